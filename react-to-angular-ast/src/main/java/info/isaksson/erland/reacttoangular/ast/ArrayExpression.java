package info.isaksson.erland.reacttoangular.ast;

import java.util.List;

/** {@code [a, ...b]}; holes are kept as {@code null} entries. */
public final class ArrayExpression extends JsNode {
    public final List<JsNode> elements;

    public ArrayExpression(List<JsNode> elements) {
        this.elements = copyOf(elements);
    }

    @Override public JsNodeKind kind() { return JsNodeKind.ARRAY_EXPRESSION; }

    @Override public List<JsNode> children() { return childrenOf(elements); }
}
