package info.isaksson.erland.reacttoangular.ast;

import java.util.List;

/** Entry of an object literal or object pattern (ESTree {@code Property}, Babel {@code ObjectProperty}). */
public final class Property extends JsNode {
    public final JsNode key;
    public final JsNode value;
    public final boolean computed;
    public final boolean shorthand;

    public Property(JsNode key, JsNode value, boolean computed, boolean shorthand) {
        this.key = key;
        this.value = value;
        this.computed = computed;
        this.shorthand = shorthand;
    }

    @Override public JsNodeKind kind() { return JsNodeKind.PROPERTY; }

    @Override public List<JsNode> children() { return childrenOf(key, value); }

    /** Static key text ({@code a} for {@code a: 1} and {@code 'a': 1}), or {@code null} for computed keys. */
    public String keyName() {
        if (computed) return null;
        if (key instanceof Identifier) return ((Identifier) key).name;
        if (key instanceof Literal) return ((Literal) key).stringValue();
        return null;
    }
}
