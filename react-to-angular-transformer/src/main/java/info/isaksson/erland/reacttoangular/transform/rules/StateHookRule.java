package info.isaksson.erland.reacttoangular.transform.rules;

import info.isaksson.erland.reacttoangular.ast.ArrayExpression;
import info.isaksson.erland.reacttoangular.ast.ArrayPattern;
import info.isaksson.erland.reacttoangular.ast.BlockStatement;
import info.isaksson.erland.reacttoangular.ast.CallExpression;
import info.isaksson.erland.reacttoangular.ast.ExpressionStatement;
import info.isaksson.erland.reacttoangular.ast.FunctionNode;
import info.isaksson.erland.reacttoangular.ast.Identifier;
import info.isaksson.erland.reacttoangular.ast.JsNode;
import info.isaksson.erland.reacttoangular.ast.JsPrinter;
import info.isaksson.erland.reacttoangular.ast.JsTrees;
import info.isaksson.erland.reacttoangular.ast.ReturnStatement;
import info.isaksson.erland.reacttoangular.ast.VariableDeclarator;
import info.isaksson.erland.reacttoangular.ir.ComponentIr;
import info.isaksson.erland.reacttoangular.ir.FrameworkConventions.React;
import info.isaksson.erland.reacttoangular.ir.IrProperty;
import info.isaksson.erland.reacttoangular.transform.ComponentSource;
import info.isaksson.erland.reacttoangular.transform.TransformWarning;
import info.isaksson.erland.reacttoangular.transform.mapping.MappingTables;

import java.util.ArrayList;
import java.util.List;

/**
 * Lowers state hooks to class properties and effect hooks to lifecycle hooks.
 *
 * <p>{@code const [value, setValue] = useState(init)} anywhere inside the component becomes a property
 * {@code value} and the setter map entry {@code setValue -> value}. Top-level
 * {@code useEffect(fn, deps)} calls append the effect body to the mount hook and the returned cleanup
 * to the unmount hook.</p>
 */
public final class StateHookRule extends AbstractTransformRule {

    public StateHookRule(MappingTables tables) {
        super(tables);
    }

    @Override
    public RuleStage stage() {
        return RuleStage.STATE_HOOKS;
    }

    @Override
    protected void doApply(ComponentSource source, ComponentIr ir) {
        for (JsNode node : JsTrees.preOrder(source.component.body, true)) {
            if (node instanceof VariableDeclarator && JsTrees.isCallTo(((VariableDeclarator) node).init, React.USE_STATE)) {
                lowerState((VariableDeclarator) node, source, ir);
            }
        }
        for (JsNode stmt : source.component.bodyStatements()) {
            if (stmt instanceof ExpressionStatement
                    && JsTrees.isCallTo(((ExpressionStatement) stmt).expression, React.USE_EFFECT)) {
                lowerEffect((CallExpression) ((ExpressionStatement) stmt).expression, source, ir);
            }
        }
    }

    private void lowerState(VariableDeclarator decl, ComponentSource source, ComponentIr ir) {
        List<String> names = patternNames(decl.id);
        if (names.size() < 2) {
            source.warnings.warn(TransformWarning.STATE_HOOK_SHAPE,
                    "State hook result is not destructured into [value, setter]; skipped",
                    "declaration", JsPrinter.expression(decl.id));
            return;
        }
        String value = names.get(0);
        String setter = names.get(1);

        JsNode init = unwrapLazyInitializer(((CallExpression) decl.init).argument(0));
        String type = TypeInference.infer(init);
        String initial = init == null ? "" : JsPrinter.expression(init);

        ir.addPropertyIfAbsent(IrProperty.field(value, type, initial));
        ir.registerSetter(setter, value);
    }

    /** First two elements of {@code [a, b]} when both are plain identifiers. */
    private static List<String> patternNames(JsNode id) {
        List<String> out = new ArrayList<>();
        if (!(id instanceof ArrayPattern)) return out;
        List<JsNode> elements = ((ArrayPattern) id).elements;
        for (int i = 0; i < Math.min(2, elements.size()); i++) {
            JsNode e = elements.get(i);
            if (!(e instanceof Identifier)) return List.of();
            out.add(((Identifier) e).name);
        }
        return out;
    }

    /** {@code useState(() => x)} initialises with {@code x}. */
    private static JsNode unwrapLazyInitializer(JsNode arg) {
        if (!(arg instanceof FunctionNode)) return arg;
        FunctionNode fn = (FunctionNode) arg;
        if (!fn.params.isEmpty()) return arg;
        if (!fn.hasBlockBody()) return fn.body;
        List<JsNode> body = ((BlockStatement) fn.body).body;
        if (body.size() == 1 && body.get(0) instanceof ReturnStatement && ((ReturnStatement) body.get(0)).argument != null) {
            return ((ReturnStatement) body.get(0)).argument;
        }
        return arg;
    }

    private void lowerEffect(CallExpression call, ComponentSource source, ComponentIr ir) {
        JsNode arg = call.argument(0);
        if (!(arg instanceof FunctionNode)) {
            source.warnings.warn(TransformWarning.EFFECT_SHAPE,
                    "Effect callback is not an inline function; skipped",
                    "effect", JsPrinter.expression(call));
            return;
        }
        JsNode deps = call.argument(1);
        if (deps instanceof ArrayExpression && !((ArrayExpression) deps).elements.isEmpty()) {
            source.warnings.warn(TransformWarning.EFFECT_DEPENDENCIES,
                    "Effect dependencies are not tracked; effect body runs once on init",
                    "dependencies", JsPrinter.expression(deps));
        }

        FunctionNode effect = (FunctionNode) arg;
        List<JsNode> statements = new ArrayList<>(effect.bodyStatements());
        String cleanup = "";
        if (effect.hasBlockBody() && !statements.isEmpty()
                && statements.get(statements.size() - 1) instanceof ReturnStatement) {
            JsNode returned = ((ReturnStatement) statements.remove(statements.size() - 1)).argument;
            cleanup = cleanupBody(returned);
        }

        String mountHook = tables.lifecycle(React.MOUNT);
        String unmountHook = tables.lifecycle(React.UNMOUNT);
        String body = JsPrinter.statements(statements);
        if (!mountHook.isEmpty() && !body.isBlank()) {
            ir.appendToLifecycleHook(mountHook, body);
        }
        if (!unmountHook.isEmpty() && !cleanup.isBlank()) {
            ir.appendToLifecycleHook(unmountHook, cleanup);
        }
    }

    private static String cleanupBody(JsNode returned) {
        if (returned == null) return "";
        if (returned instanceof FunctionNode) return JsPrinter.functionBody((FunctionNode) returned);
        // `return unsubscribe` hands back a function reference
        return JsPrinter.expression(returned) + "()";
    }
}
