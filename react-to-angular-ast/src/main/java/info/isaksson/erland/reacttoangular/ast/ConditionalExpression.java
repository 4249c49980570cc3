package info.isaksson.erland.reacttoangular.ast;

import java.util.List;

/** {@code test ? consequent : alternate}. */
public final class ConditionalExpression extends JsNode {
    public final JsNode test;
    public final JsNode consequent;
    public final JsNode alternate;

    public ConditionalExpression(JsNode test, JsNode consequent, JsNode alternate) {
        this.test = test;
        this.consequent = consequent;
        this.alternate = alternate;
    }

    @Override public JsNodeKind kind() { return JsNodeKind.CONDITIONAL_EXPRESSION; }

    @Override public List<JsNode> children() { return childrenOf(test, consequent, alternate); }
}
