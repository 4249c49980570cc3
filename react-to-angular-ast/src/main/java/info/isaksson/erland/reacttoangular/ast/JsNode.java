package info.isaksson.erland.reacttoangular.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Base type of the typed JavaScript/JSX syntax tree.
 *
 * <p>Every node reports its {@link JsNodeKind}; callers dispatch on the kind (or on the concrete
 * class) and treat {@link Unsupported} as "nothing recognisable here". Nodes are immutable.</p>
 */
public abstract class JsNode {

    JsNode() {}

    public abstract JsNodeKind kind();

    /** Direct child nodes in source order. Never null and never contains null entries. */
    public abstract List<JsNode> children();

    public final boolean is(JsNodeKind kind) {
        return kind() == kind;
    }

    /** Flattens nodes and node lists into one child list, skipping nulls. */
    static List<JsNode> childrenOf(Object... parts) {
        List<JsNode> out = new ArrayList<>();
        for (Object part : parts) {
            if (part instanceof JsNode) {
                out.add((JsNode) part);
            } else if (part instanceof List<?>) {
                for (Object o : (List<?>) part) {
                    if (o instanceof JsNode) out.add((JsNode) o);
                }
            }
        }
        return Collections.unmodifiableList(out);
    }

    static <T> List<T> copyOf(List<T> in) {
        if (in == null || in.isEmpty()) return List.of();
        // List.copyOf rejects null entries, array patterns may contain holes
        return Collections.unmodifiableList(new ArrayList<>(in));
    }

    @Override
    public String toString() {
        return kind().name();
    }
}
