package info.isaksson.erland.reacttoangular.ast;

import java.util.List;

public final class ReturnStatement extends JsNode {
    /** Returned expression, {@code null} for a bare {@code return}. */
    public final JsNode argument;

    public ReturnStatement(JsNode argument) {
        this.argument = argument;
    }

    @Override public JsNodeKind kind() { return JsNodeKind.RETURN_STATEMENT; }

    @Override public List<JsNode> children() { return childrenOf(argument); }
}
