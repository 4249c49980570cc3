package info.isaksson.erland.reacttoangular.transform.rules;

import info.isaksson.erland.reacttoangular.ast.AssignmentPattern;
import info.isaksson.erland.reacttoangular.ast.CallExpression;
import info.isaksson.erland.reacttoangular.ast.FunctionNode;
import info.isaksson.erland.reacttoangular.ast.Identifier;
import info.isaksson.erland.reacttoangular.ast.JsNode;
import info.isaksson.erland.reacttoangular.ast.JsPrinter;
import info.isaksson.erland.reacttoangular.ast.JsTrees;
import info.isaksson.erland.reacttoangular.ast.ObjectPattern;
import info.isaksson.erland.reacttoangular.ast.Property;
import info.isaksson.erland.reacttoangular.ast.VariableDeclaration;
import info.isaksson.erland.reacttoangular.ast.VariableDeclarator;
import info.isaksson.erland.reacttoangular.ir.ComponentIr;
import info.isaksson.erland.reacttoangular.ir.FrameworkConventions.Angular;
import info.isaksson.erland.reacttoangular.ir.FrameworkConventions.React;
import info.isaksson.erland.reacttoangular.ir.IrMethod;
import info.isaksson.erland.reacttoangular.ir.IrProperty;
import info.isaksson.erland.reacttoangular.transform.ComponentSource;
import info.isaksson.erland.reacttoangular.transform.mapping.MappingTables;

import java.util.ArrayList;
import java.util.List;

/**
 * Class skeleton: component name, props as {@code @Input()} properties and local functions as methods.
 *
 * <p>Only the immediate body of the component is searched for functions. A local bound to
 * {@code useCallback(fn, deps)} is treated like a local bound to {@code fn}.</p>
 */
public final class ComponentRule extends AbstractTransformRule {

    private static final String USE_CALLBACK = "useCallback";

    public ComponentRule(MappingTables tables) {
        super(tables);
    }

    @Override
    public RuleStage stage() {
        return RuleStage.COMPONENT;
    }

    @Override
    protected void doApply(ComponentSource source, ComponentIr ir) {
        if (ir.componentClass.name.isEmpty()) {
            ir.componentClass.name = source.componentName != null ? source.componentName : React.DEFAULT_COMPONENT_NAME;
        }

        for (JsNode param : source.component.params) {
            addInputs(param, ir);
        }

        for (JsNode stmt : source.component.bodyStatements()) {
            JsNode node = JsTrees.unwrapExport(stmt);
            if (node instanceof FunctionNode && ((FunctionNode) node).name() != null) {
                FunctionNode fn = (FunctionNode) node;
                ir.addMethodIfAbsent(toMethod(fn.name(), fn));
            } else if (node instanceof VariableDeclaration) {
                for (VariableDeclarator d : ((VariableDeclaration) node).declarations) {
                    FunctionNode fn = boundFunction(d.init);
                    String name = d.boundName();
                    if (fn != null && name != null) {
                        ir.addMethodIfAbsent(toMethod(name, fn));
                    }
                }
            }
        }
    }

    private void addInputs(JsNode param, ComponentIr ir) {
        if (param instanceof Identifier) {
            ir.addPropertyIfAbsent(IrProperty.input(((Identifier) param).name, TypeInference.ANY, ""));
        } else if (param instanceof AssignmentPattern) {
            // (props = {}) behaves like (props)
            addInputs(((AssignmentPattern) param).left, ir);
        } else if (param instanceof ObjectPattern) {
            for (JsNode entry : ((ObjectPattern) param).properties) {
                if (entry instanceof Property) addDestructuredInput((Property) entry, ir);
            }
        }
    }

    private void addDestructuredInput(Property entry, ComponentIr ir) {
        String key = entry.keyName();
        if (key == null) return;
        JsNode value = entry.value;
        String local;
        String initial = "";
        String type = TypeInference.ANY;
        if (value instanceof AssignmentPattern) {
            AssignmentPattern p = (AssignmentPattern) value;
            if (!(p.left instanceof Identifier)) return;
            local = ((Identifier) p.left).name;
            initial = JsPrinter.expression(p.right);
            type = TypeInference.infer(p.right);
        } else if (value instanceof Identifier) {
            local = ((Identifier) value).name;
        } else {
            return;
        }
        String decorator = local.equals(key)
                ? Angular.DECORATOR_INPUT
                : "@Input(" + JsPrinter.quote(key) + ")";
        ir.addPropertyIfAbsent(new IrProperty(local, type, initial, decorator));
    }

    private FunctionNode boundFunction(JsNode init) {
        if (init instanceof FunctionNode) return (FunctionNode) init;
        if (JsTrees.isCallTo(init, USE_CALLBACK) && !tables.hook(USE_CALLBACK).isEmpty()) {
            JsNode fn = ((CallExpression) init).argument(0);
            if (fn instanceof FunctionNode) return (FunctionNode) fn;
        }
        return null;
    }

    private static IrMethod toMethod(String name, FunctionNode fn) {
        List<String> params = new ArrayList<>();
        for (JsNode p : fn.params) {
            params.add(JsPrinter.expression(p));
        }
        return new IrMethod(name, params, JsPrinter.functionBody(fn), fn.async ? IrMethod.ASYNC_VOID : IrMethod.VOID);
    }
}
