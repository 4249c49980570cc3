package info.isaksson.erland.reacttoangular.ast;

import java.util.List;

public final class RestElement extends JsNode {
    public final JsNode argument;

    public RestElement(JsNode argument) {
        this.argument = argument;
    }

    @Override public JsNodeKind kind() { return JsNodeKind.REST_ELEMENT; }

    @Override public List<JsNode> children() { return childrenOf(argument); }
}
