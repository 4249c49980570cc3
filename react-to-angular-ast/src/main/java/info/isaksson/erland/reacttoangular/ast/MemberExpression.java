package info.isaksson.erland.reacttoangular.ast;

import java.util.List;

/** {@code object.property}, {@code object[property]} or {@code object?.property}. */
public final class MemberExpression extends JsNode {
    public final JsNode object;
    public final JsNode property;
    public final boolean computed;
    public final boolean optional;

    public MemberExpression(JsNode object, JsNode property, boolean computed) {
        this(object, property, computed, false);
    }

    public MemberExpression(JsNode object, JsNode property, boolean computed, boolean optional) {
        this.object = object;
        this.property = property;
        this.computed = computed;
        this.optional = optional;
    }

    @Override public JsNodeKind kind() { return JsNodeKind.MEMBER_EXPRESSION; }

    @Override public List<JsNode> children() { return childrenOf(object, property); }

    /** Name of a non-computed identifier property ({@code map} in {@code items.map}), otherwise {@code null}. */
    public String propertyName() {
        if (!computed && property instanceof Identifier) return ((Identifier) property).name;
        return null;
    }
}
