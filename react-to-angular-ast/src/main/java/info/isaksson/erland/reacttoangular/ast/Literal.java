package info.isaksson.erland.reacttoangular.ast;

import java.util.List;

/**
 * Literal value. Covers ESTree {@code Literal} as well as the Babel specific
 * {@code StringLiteral}/{@code NumericLiteral}/{@code BooleanLiteral}/{@code NullLiteral} nodes.
 */
public final class Literal extends JsNode {
    public final LiteralKind literalKind;
    /** String, Number or Boolean value; null for NULL and when the parser omitted it. */
    public final Object value;
    /** Source text as written, may be null. */
    public final String raw;

    public Literal(LiteralKind literalKind, Object value, String raw) {
        this.literalKind = literalKind == null ? LiteralKind.NULL : literalKind;
        this.value = value;
        this.raw = raw;
    }

    public static Literal string(String value) {
        return new Literal(LiteralKind.STRING, value, null);
    }

    public static Literal number(Number value) {
        return new Literal(LiteralKind.NUMBER, value, null);
    }

    public static Literal bool(boolean value) {
        return new Literal(LiteralKind.BOOLEAN, value, null);
    }

    @Override public JsNodeKind kind() { return JsNodeKind.LITERAL; }

    @Override public List<JsNode> children() { return List.of(); }

    public boolean isString() {
        return literalKind == LiteralKind.STRING;
    }

    public String stringValue() {
        return value == null ? "" : String.valueOf(value);
    }

    @Override
    public String toString() {
        return "LITERAL(" + literalKind + ":" + value + ")";
    }
}
