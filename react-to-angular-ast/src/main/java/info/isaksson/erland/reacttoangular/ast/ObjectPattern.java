package info.isaksson.erland.reacttoangular.ast;

import java.util.List;

/** {@code {a, b: c, d = 1, ...rest}}; entries are {@link Property} or {@link RestElement} nodes. */
public final class ObjectPattern extends JsNode {
    public final List<JsNode> properties;

    public ObjectPattern(List<JsNode> properties) {
        this.properties = copyOf(properties);
    }

    @Override public JsNodeKind kind() { return JsNodeKind.OBJECT_PATTERN; }

    @Override public List<JsNode> children() { return childrenOf(properties); }
}
