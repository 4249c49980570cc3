package info.isaksson.erland.reacttoangular.ast;

import java.util.List;

public final class IfStatement extends JsNode {
    public final JsNode test;
    public final JsNode consequent;
    /** Else branch, may be null. */
    public final JsNode alternate;

    public IfStatement(JsNode test, JsNode consequent, JsNode alternate) {
        this.test = test;
        this.consequent = consequent;
        this.alternate = alternate;
    }

    @Override public JsNodeKind kind() { return JsNodeKind.IF_STATEMENT; }

    @Override public List<JsNode> children() { return childrenOf(test, consequent, alternate); }
}
