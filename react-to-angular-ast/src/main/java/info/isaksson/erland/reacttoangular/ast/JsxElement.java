package info.isaksson.erland.reacttoangular.ast;

import java.util.List;

/**
 * {@code <tag attr={...}>children</tag>}. The opening/closing element pair is flattened: only the tag
 * name, the attribute list and the children are kept.
 */
public final class JsxElement extends JsNode {
    /** Tag name as written; member tags ({@code Foo.Bar}) are joined with dots. */
    public final String name;
    /** {@link JsxAttribute} and {@link JsxSpreadAttribute} nodes in source order. */
    public final List<JsNode> attributes;
    public final List<JsNode> children;
    public final boolean selfClosing;

    public JsxElement(String name, List<JsNode> attributes, List<JsNode> children, boolean selfClosing) {
        this.name = name == null ? "" : name;
        this.attributes = copyOf(attributes);
        this.children = copyOf(children);
        this.selfClosing = selfClosing;
    }

    @Override public JsNodeKind kind() { return JsNodeKind.JSX_ELEMENT; }

    @Override public List<JsNode> children() { return childrenOf(attributes, children); }
}
