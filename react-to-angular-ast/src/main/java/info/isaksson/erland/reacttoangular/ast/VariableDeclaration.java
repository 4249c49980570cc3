package info.isaksson.erland.reacttoangular.ast;

import java.util.List;

/** {@code const|let|var} declaration holding one or more declarators. */
public final class VariableDeclaration extends JsNode {
    public final String declarationKind;
    public final List<VariableDeclarator> declarations;

    public VariableDeclaration(String declarationKind, List<VariableDeclarator> declarations) {
        this.declarationKind = declarationKind == null || declarationKind.isBlank() ? "const" : declarationKind;
        this.declarations = copyOf(declarations);
    }

    @Override public JsNodeKind kind() { return JsNodeKind.VARIABLE_DECLARATION; }

    @Override public List<JsNode> children() { return childrenOf(declarations); }
}
