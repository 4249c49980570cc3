package info.isaksson.erland.reacttoangular.ast;

import java.util.List;

/** {@code <>...</>}. */
public final class JsxFragment extends JsNode {
    public final List<JsNode> children;

    public JsxFragment(List<JsNode> children) {
        this.children = copyOf(children);
    }

    @Override public JsNodeKind kind() { return JsNodeKind.JSX_FRAGMENT; }

    @Override public List<JsNode> children() { return childrenOf(children); }
}
