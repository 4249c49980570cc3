package info.isaksson.erland.reacttoangular.ast;

import java.util.List;

public final class AwaitExpression extends JsNode {
    public final JsNode argument;

    public AwaitExpression(JsNode argument) {
        this.argument = argument;
    }

    @Override public JsNodeKind kind() { return JsNodeKind.AWAIT_EXPRESSION; }

    @Override public List<JsNode> children() { return childrenOf(argument); }
}
