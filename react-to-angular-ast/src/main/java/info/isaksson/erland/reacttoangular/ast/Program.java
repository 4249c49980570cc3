package info.isaksson.erland.reacttoangular.ast;

import java.util.List;

/** Root of a parsed module. */
public final class Program extends JsNode {
    public final List<JsNode> body;

    public Program(List<JsNode> body) {
        this.body = copyOf(body);
    }

    @Override public JsNodeKind kind() { return JsNodeKind.PROGRAM; }

    @Override public List<JsNode> children() { return childrenOf(body); }
}
