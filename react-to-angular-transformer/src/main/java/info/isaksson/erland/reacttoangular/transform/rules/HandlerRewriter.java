package info.isaksson.erland.reacttoangular.transform.rules;

import info.isaksson.erland.reacttoangular.ast.BlockStatement;
import info.isaksson.erland.reacttoangular.ast.CallExpression;
import info.isaksson.erland.reacttoangular.ast.ExpressionStatement;
import info.isaksson.erland.reacttoangular.ast.FunctionNode;
import info.isaksson.erland.reacttoangular.ast.Identifier;
import info.isaksson.erland.reacttoangular.ast.JsNode;
import info.isaksson.erland.reacttoangular.ast.JsPrinter;
import info.isaksson.erland.reacttoangular.ast.JsxEmptyExpression;
import info.isaksson.erland.reacttoangular.ast.MemberExpression;
import info.isaksson.erland.reacttoangular.ast.ReturnStatement;
import info.isaksson.erland.reacttoangular.ir.FrameworkConventions.Angular;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns a JSX event-handler expression into Angular template statement text.
 *
 * <ul>
 *   <li>{@code handleClick} or {@code props.onSave}: {@code handleClick()}</li>
 *   <li>{@code e => setName(e.target.value)}: {@code name = $event.target.value}</li>
 *   <li>{@code () => setCount(c => c + 1)}: {@code count = count + 1}</li>
 *   <li>{@code () => { a(); b() }}: {@code a(); b()}</li>
 *   <li>{@code save(id)}: printed as written</li>
 * </ul>
 *
 * <p>The handler's first parameter becomes {@code $event}. Never throws for well-formed nodes; shapes
 * it does not know are printed as they are.</p>
 */
final class HandlerRewriter {

    private final Map<String, String> setterMap;

    HandlerRewriter(Map<String, String> setterMap) {
        this.setterMap = setterMap;
    }

    String rewrite(JsNode handler) {
        if (handler == null || handler instanceof JsxEmptyExpression) return "";
        if (handler instanceof Identifier || handler instanceof MemberExpression) {
            return JsPrinter.expression(handler) + "()";
        }
        if (handler instanceof FunctionNode) {
            return rewriteFunction((FunctionNode) handler);
        }
        return JsPrinter.expression(handler);
    }

    private String rewriteFunction(FunctionNode fn) {
        Map<String, String> renames = new HashMap<>();
        if (!fn.params.isEmpty() && fn.params.get(0) instanceof Identifier) {
            renames.put(((Identifier) fn.params.get(0)).name, Angular.EVENT_ARG);
        }
        if (!fn.hasBlockBody()) {
            return rewriteExpression(fn.body, renames);
        }
        List<String> parts = new ArrayList<>();
        for (JsNode stmt : ((BlockStatement) fn.body).body) {
            String s = stmt instanceof ExpressionStatement
                    ? rewriteExpression(((ExpressionStatement) stmt).expression, renames)
                    : JsPrinter.statement(stmt, renames);
            if (!s.isBlank()) parts.add(s);
        }
        return String.join("; ", parts);
    }

    /** Setter calls become assignments; everything else is printed with the renames applied. */
    String rewriteExpression(JsNode expr, Map<String, String> renames) {
        String property = setterTarget(expr);
        if (property == null) {
            return JsPrinter.expression(expr, renames);
        }
        JsNode arg = ((CallExpression) expr).argument(0);
        if (arg == null) {
            return property + " = undefined";
        }
        JsNode updated = updaterResult(arg);
        if (updated != null) {
            Map<String, String> inner = new HashMap<>(renames);
            inner.put(((Identifier) ((FunctionNode) arg).params.get(0)).name, property);
            return property + " = " + JsPrinter.expression(updated, inner);
        }
        return property + " = " + JsPrinter.expression(arg, renames);
    }

    /** Property updated by {@code expr} when it is a call of a registered setter, otherwise null. */
    String setterTarget(JsNode expr) {
        if (!(expr instanceof CallExpression)) return null;
        String callee = ((CallExpression) expr).calleeName();
        return callee == null ? null : setterMap.get(callee);
    }

    /** Result expression of an updater function {@code prev => expr}, or null for any other argument. */
    private static JsNode updaterResult(JsNode arg) {
        if (!(arg instanceof FunctionNode)) return null;
        FunctionNode fn = (FunctionNode) arg;
        if (fn.params.size() != 1 || !(fn.params.get(0) instanceof Identifier)) return null;
        if (!fn.hasBlockBody()) return fn.body;
        List<JsNode> body = ((BlockStatement) fn.body).body;
        if (body.size() == 1 && body.get(0) instanceof ReturnStatement) {
            return ((ReturnStatement) body.get(0)).argument;
        }
        return null;
    }
}
