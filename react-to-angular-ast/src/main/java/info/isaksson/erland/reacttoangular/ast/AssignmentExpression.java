package info.isaksson.erland.reacttoangular.ast;

import java.util.List;

public final class AssignmentExpression extends JsNode {
    public final String operator;
    public final JsNode left;
    public final JsNode right;

    public AssignmentExpression(String operator, JsNode left, JsNode right) {
        this.operator = operator == null || operator.isEmpty() ? "=" : operator;
        this.left = left;
        this.right = right;
    }

    @Override public JsNodeKind kind() { return JsNodeKind.ASSIGNMENT_EXPRESSION; }

    @Override public List<JsNode> children() { return childrenOf(left, right); }
}
