package info.isaksson.erland.reacttoangular.ast;

import java.util.List;

public final class ExpressionStatement extends JsNode {
    public final JsNode expression;

    public ExpressionStatement(JsNode expression) {
        this.expression = expression;
    }

    @Override public JsNodeKind kind() { return JsNodeKind.EXPRESSION_STATEMENT; }

    @Override public List<JsNode> children() { return childrenOf(expression); }
}
