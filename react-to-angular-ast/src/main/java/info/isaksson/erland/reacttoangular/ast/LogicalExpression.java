package info.isaksson.erland.reacttoangular.ast;

import java.util.List;

/** {@code &&}, {@code ||} and {@code ??}. */
public final class LogicalExpression extends JsNode {
    public final String operator;
    public final JsNode left;
    public final JsNode right;

    public LogicalExpression(String operator, JsNode left, JsNode right) {
        this.operator = operator == null ? "" : operator;
        this.left = left;
        this.right = right;
    }

    @Override public JsNodeKind kind() { return JsNodeKind.LOGICAL_EXPRESSION; }

    @Override public List<JsNode> children() { return childrenOf(left, right); }
}
