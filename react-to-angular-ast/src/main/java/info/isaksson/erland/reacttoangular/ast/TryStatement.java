package info.isaksson.erland.reacttoangular.ast;

import java.util.List;

/** {@code try {} catch (param) {} finally {}}; the catch clause is flattened into this node. */
public final class TryStatement extends JsNode {
    public final BlockStatement block;
    /** Catch parameter, may be null (also for {@code catch {}} without binding). */
    public final JsNode catchParam;
    /** Catch body, null when there is no catch clause. */
    public final BlockStatement catchBody;
    /** Finally block, may be null. */
    public final BlockStatement finalizer;

    public TryStatement(BlockStatement block, JsNode catchParam, BlockStatement catchBody, BlockStatement finalizer) {
        this.block = block == null ? new BlockStatement(List.of()) : block;
        this.catchParam = catchParam;
        this.catchBody = catchBody;
        this.finalizer = finalizer;
    }

    @Override public JsNodeKind kind() { return JsNodeKind.TRY_STATEMENT; }

    @Override public List<JsNode> children() { return childrenOf(block, catchParam, catchBody, finalizer); }
}
