package info.isaksson.erland.reacttoangular.ast;

import java.util.List;

public final class UnaryExpression extends JsNode {
    public final String operator;
    public final JsNode argument;

    public UnaryExpression(String operator, JsNode argument) {
        this.operator = operator == null ? "" : operator;
        this.argument = argument;
    }

    @Override public JsNodeKind kind() { return JsNodeKind.UNARY_EXPRESSION; }

    @Override public List<JsNode> children() { return childrenOf(argument); }
}
