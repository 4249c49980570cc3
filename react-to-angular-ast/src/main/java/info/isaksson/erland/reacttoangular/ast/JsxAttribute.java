package info.isaksson.erland.reacttoangular.ast;

import java.util.List;

/**
 * {@code name="literal"}, {@code name={expression}} or bare {@code name}.
 *
 * <p>{@link #value} is a {@link Literal}, a {@link JsxExpressionContainer}, a nested JSX element, or
 * {@code null} for a boolean attribute.</p>
 */
public final class JsxAttribute extends JsNode {
    public final String name;
    public final JsNode value;

    public JsxAttribute(String name, JsNode value) {
        this.name = name == null ? "" : name;
        this.value = value;
    }

    @Override public JsNodeKind kind() { return JsNodeKind.JSX_ATTRIBUTE; }

    @Override public List<JsNode> children() { return childrenOf(value); }

    /** The value with an expression container unwrapped; null for boolean attributes. */
    public JsNode expression() {
        if (value instanceof JsxExpressionContainer) return ((JsxExpressionContainer) value).expression;
        return value;
    }
}
