package info.isaksson.erland.reacttoangular.ast;

import java.util.List;

/** Object literal; entries are {@link Property} or {@link SpreadElement} nodes. */
public final class ObjectExpression extends JsNode {
    public final List<JsNode> properties;

    public ObjectExpression(List<JsNode> properties) {
        this.properties = copyOf(properties);
    }

    @Override public JsNodeKind kind() { return JsNodeKind.OBJECT_EXPRESSION; }

    @Override public List<JsNode> children() { return childrenOf(properties); }
}
