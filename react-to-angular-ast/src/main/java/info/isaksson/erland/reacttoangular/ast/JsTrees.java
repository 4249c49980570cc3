package info.isaksson.erland.reacttoangular.ast;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/** Traversal helpers over {@link JsNode} trees. */
public final class JsTrees {

    private JsTrees() {}

    public static boolean isFunction(JsNode node) {
        return node instanceof FunctionNode;
    }

    public static boolean isJsx(JsNode node) {
        return node instanceof JsxElement || node instanceof JsxFragment;
    }

    /**
     * Pre-order (depth-first, source order) list of {@code root} and all its descendants.
     *
     * @param enterFunctions when false, nested function nodes are listed but their contents are not
     *                       (the root itself is always entered)
     */
    public static List<JsNode> preOrder(JsNode root, boolean enterFunctions) {
        List<JsNode> out = new ArrayList<>();
        if (root == null) return out;
        Deque<JsNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            JsNode n = stack.pop();
            out.add(n);
            if (n != root && !enterFunctions && isFunction(n)) continue;
            List<JsNode> children = n.children();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
        return out;
    }

    /** Strips {@code export} wrappers. */
    public static JsNode unwrapExport(JsNode node) {
        JsNode cur = node;
        while (cur instanceof ExportDeclaration) {
            cur = ((ExportDeclaration) cur).declaration;
        }
        return cur;
    }

    /** True when {@code node} is a call to {@code name(...)} or {@code React.name(...)}. */
    public static boolean isCallTo(JsNode node, String name) {
        if (!(node instanceof CallExpression)) return false;
        JsNode callee = ((CallExpression) node).callee;
        if (callee instanceof Identifier) return name.equals(((Identifier) callee).name);
        if (callee instanceof MemberExpression) {
            MemberExpression m = (MemberExpression) callee;
            return m.object instanceof Identifier
                    && "React".equals(((Identifier) m.object).name)
                    && name.equals(m.propertyName());
        }
        return false;
    }
}
