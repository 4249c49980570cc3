package info.isaksson.erland.reacttoangular.ast;

import java.util.List;

public final class Identifier extends JsNode {
    public final String name;

    public Identifier(String name) {
        this.name = name == null ? "" : name;
    }

    @Override public JsNodeKind kind() { return JsNodeKind.IDENTIFIER; }

    @Override public List<JsNode> children() { return List.of(); }

    @Override
    public String toString() {
        return "IDENTIFIER(" + name + ")";
    }
}
