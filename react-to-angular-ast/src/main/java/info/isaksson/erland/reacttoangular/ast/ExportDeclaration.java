package info.isaksson.erland.reacttoangular.ast;

import java.util.List;

/** {@code export ...} / {@code export default ...} wrapper around a declaration or expression. */
public final class ExportDeclaration extends JsNode {
    public final JsNode declaration;
    public final boolean isDefault;

    public ExportDeclaration(JsNode declaration, boolean isDefault) {
        this.declaration = declaration;
        this.isDefault = isDefault;
    }

    @Override public JsNodeKind kind() { return JsNodeKind.EXPORT_DECLARATION; }

    @Override public List<JsNode> children() { return childrenOf(declaration); }
}
