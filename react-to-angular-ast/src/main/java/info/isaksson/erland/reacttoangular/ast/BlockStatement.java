package info.isaksson.erland.reacttoangular.ast;

import java.util.List;

public final class BlockStatement extends JsNode {
    public final List<JsNode> body;

    public BlockStatement(List<JsNode> body) {
        this.body = copyOf(body);
    }

    @Override public JsNodeKind kind() { return JsNodeKind.BLOCK_STATEMENT; }

    @Override public List<JsNode> children() { return childrenOf(body); }
}
