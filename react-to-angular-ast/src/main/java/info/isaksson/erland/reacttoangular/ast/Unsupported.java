package info.isaksson.erland.reacttoangular.ast;

import java.util.List;

/** Sentinel for node types outside the supported set. Keeps the original {@code type} for diagnostics. */
public final class Unsupported extends JsNode {
    public final String type;

    public Unsupported(String type) {
        this.type = type == null ? "" : type;
    }

    @Override public JsNodeKind kind() { return JsNodeKind.UNSUPPORTED; }

    @Override public List<JsNode> children() { return List.of(); }

    @Override
    public String toString() {
        return "UNSUPPORTED(" + type + ")";
    }
}
