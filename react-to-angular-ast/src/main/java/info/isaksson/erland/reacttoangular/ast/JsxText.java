package info.isaksson.erland.reacttoangular.ast;

import java.util.List;

public final class JsxText extends JsNode {
    public final String value;

    public JsxText(String value) {
        this.value = value == null ? "" : value;
    }

    @Override public JsNodeKind kind() { return JsNodeKind.JSX_TEXT; }

    @Override public List<JsNode> children() { return List.of(); }
}
