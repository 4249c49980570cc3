package info.isaksson.erland.reacttoangular.ast;

import java.util.List;

/** {@code id = init}; {@code id} is an identifier or a destructuring pattern, {@code init} may be null. */
public final class VariableDeclarator extends JsNode {
    public final JsNode id;
    public final JsNode init;

    public VariableDeclarator(JsNode id, JsNode init) {
        this.id = id;
        this.init = init;
    }

    @Override public JsNodeKind kind() { return JsNodeKind.VARIABLE_DECLARATOR; }

    @Override public List<JsNode> children() { return childrenOf(id, init); }

    /** Bound name when {@link #id} is a plain identifier, otherwise {@code null}. */
    public String boundName() {
        return id instanceof Identifier ? ((Identifier) id).name : null;
    }
}
