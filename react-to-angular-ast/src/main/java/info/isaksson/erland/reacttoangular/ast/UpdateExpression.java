package info.isaksson.erland.reacttoangular.ast;

import java.util.List;

/** {@code i++}, {@code --i}. */
public final class UpdateExpression extends JsNode {
    public final String operator;
    public final JsNode argument;
    public final boolean prefix;

    public UpdateExpression(String operator, JsNode argument, boolean prefix) {
        this.operator = operator == null ? "" : operator;
        this.argument = argument;
        this.prefix = prefix;
    }

    @Override public JsNodeKind kind() { return JsNodeKind.UPDATE_EXPRESSION; }

    @Override public List<JsNode> children() { return childrenOf(argument); }
}
