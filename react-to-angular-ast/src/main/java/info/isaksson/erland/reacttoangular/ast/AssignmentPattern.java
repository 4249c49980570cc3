package info.isaksson.erland.reacttoangular.ast;

import java.util.List;

/** Pattern with a default value: {@code left = right}. */
public final class AssignmentPattern extends JsNode {
    public final JsNode left;
    public final JsNode right;

    public AssignmentPattern(JsNode left, JsNode right) {
        this.left = left;
        this.right = right;
    }

    @Override public JsNodeKind kind() { return JsNodeKind.ASSIGNMENT_PATTERN; }

    @Override public List<JsNode> children() { return childrenOf(left, right); }
}
