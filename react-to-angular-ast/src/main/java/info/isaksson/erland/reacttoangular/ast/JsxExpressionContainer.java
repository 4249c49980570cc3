package info.isaksson.erland.reacttoangular.ast;

import java.util.List;

public final class JsxExpressionContainer extends JsNode {
    public final JsNode expression;

    public JsxExpressionContainer(JsNode expression) {
        this.expression = expression == null ? new JsxEmptyExpression() : expression;
    }

    @Override public JsNodeKind kind() { return JsNodeKind.JSX_EXPRESSION_CONTAINER; }

    @Override public List<JsNode> children() { return childrenOf(expression); }
}
