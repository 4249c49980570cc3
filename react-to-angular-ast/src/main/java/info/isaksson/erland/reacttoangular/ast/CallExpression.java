package info.isaksson.erland.reacttoangular.ast;

import java.util.List;

public final class CallExpression extends JsNode {
    public final JsNode callee;
    public final List<JsNode> arguments;
    public final boolean optional;

    public CallExpression(JsNode callee, List<JsNode> arguments) {
        this(callee, arguments, false);
    }

    public CallExpression(JsNode callee, List<JsNode> arguments, boolean optional) {
        this.callee = callee;
        this.arguments = copyOf(arguments);
        this.optional = optional;
    }

    @Override public JsNodeKind kind() { return JsNodeKind.CALL_EXPRESSION; }

    @Override public List<JsNode> children() { return childrenOf(callee, arguments); }

    /** Callee name when the callee is a plain identifier, otherwise {@code null}. */
    public String calleeName() {
        return callee instanceof Identifier ? ((Identifier) callee).name : null;
    }

    public JsNode argument(int index) {
        return index < arguments.size() ? arguments.get(index) : null;
    }
}
