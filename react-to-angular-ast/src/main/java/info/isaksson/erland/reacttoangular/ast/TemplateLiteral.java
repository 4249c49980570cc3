package info.isaksson.erland.reacttoangular.ast;

import java.util.List;

/** {@code `a${x}b`}: cooked quasis interleave with expressions ({@code quasis.size() == expressions.size() + 1}). */
public final class TemplateLiteral extends JsNode {
    public final List<String> quasis;
    public final List<JsNode> expressions;

    public TemplateLiteral(List<String> quasis, List<JsNode> expressions) {
        this.quasis = copyOf(quasis);
        this.expressions = copyOf(expressions);
    }

    @Override public JsNodeKind kind() { return JsNodeKind.TEMPLATE_LITERAL; }

    @Override public List<JsNode> children() { return childrenOf(expressions); }

    public String quasi(int index) {
        if (index >= quasis.size()) return "";
        String q = quasis.get(index);
        return q == null ? "" : q;
    }
}
