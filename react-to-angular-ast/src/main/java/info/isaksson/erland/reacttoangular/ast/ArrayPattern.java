package info.isaksson.erland.reacttoangular.ast;

import java.util.List;

/** {@code [a, , b]}; holes are kept as {@code null} entries. */
public final class ArrayPattern extends JsNode {
    public final List<JsNode> elements;

    public ArrayPattern(List<JsNode> elements) {
        this.elements = copyOf(elements);
    }

    @Override public JsNodeKind kind() { return JsNodeKind.ARRAY_PATTERN; }

    @Override public List<JsNode> children() { return childrenOf(elements); }
}
