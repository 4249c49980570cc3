package info.isaksson.erland.reacttoangular.ast;

import java.util.List;

/** {@code {...props}} inside an opening tag. */
public final class JsxSpreadAttribute extends JsNode {
    public final JsNode argument;

    public JsxSpreadAttribute(JsNode argument) {
        this.argument = argument;
    }

    @Override public JsNodeKind kind() { return JsNodeKind.JSX_SPREAD_ATTRIBUTE; }

    @Override public List<JsNode> children() { return childrenOf(argument); }
}
