package info.isaksson.erland.reacttoangular.ast;

import java.util.List;
import java.util.Objects;

/**
 * Function declaration, function expression or arrow function.
 *
 * <p>The three shapes share one class; {@link #kind()} tells them apart. Arrow functions may have an
 * expression body, every other shape has a {@link BlockStatement} body.</p>
 */
public final class FunctionNode extends JsNode {
    private final JsNodeKind kind;
    public final Identifier id;
    public final List<JsNode> params;
    public final JsNode body;
    public final boolean async;

    public FunctionNode(JsNodeKind kind, Identifier id, List<JsNode> params, JsNode body, boolean async) {
        if (kind != JsNodeKind.FUNCTION_DECLARATION
                && kind != JsNodeKind.FUNCTION_EXPRESSION
                && kind != JsNodeKind.ARROW_FUNCTION_EXPRESSION) {
            throw new IllegalArgumentException("not a function kind: " + kind);
        }
        this.kind = kind;
        this.id = id;
        this.params = copyOf(params);
        this.body = Objects.requireNonNullElseGet(body, () -> new BlockStatement(List.of()));
        this.async = async;
    }

    public static FunctionNode arrow(List<JsNode> params, JsNode body) {
        return new FunctionNode(JsNodeKind.ARROW_FUNCTION_EXPRESSION, null, params, body, false);
    }

    @Override public JsNodeKind kind() { return kind; }

    @Override public List<JsNode> children() { return childrenOf(id, params, body); }

    /** Declared name, or {@code null} for anonymous functions. */
    public String name() {
        return id == null ? null : id.name;
    }

    public boolean hasBlockBody() {
        return body instanceof BlockStatement;
    }

    /** Names of plain identifier parameters, in order. Patterns are skipped. */
    public List<String> identifierParamNames() {
        return params.stream()
                .filter(p -> p instanceof Identifier)
                .map(p -> ((Identifier) p).name)
                .collect(java.util.stream.Collectors.toUnmodifiableList());
    }

    /**
     * Statements of the body: the block's statements, or the expression body wrapped as one
     * expression statement.
     */
    public List<JsNode> bodyStatements() {
        if (body instanceof BlockStatement) return ((BlockStatement) body).body;
        return List.of(new ExpressionStatement(body));
    }
}
