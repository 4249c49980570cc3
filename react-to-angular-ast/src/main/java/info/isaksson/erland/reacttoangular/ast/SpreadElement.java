package info.isaksson.erland.reacttoangular.ast;

import java.util.List;

public final class SpreadElement extends JsNode {
    public final JsNode argument;

    public SpreadElement(JsNode argument) {
        this.argument = argument;
    }

    @Override public JsNodeKind kind() { return JsNodeKind.SPREAD_ELEMENT; }

    @Override public List<JsNode> children() { return childrenOf(argument); }
}
