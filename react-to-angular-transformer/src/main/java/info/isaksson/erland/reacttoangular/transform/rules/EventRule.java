package info.isaksson.erland.reacttoangular.transform.rules;

import info.isaksson.erland.reacttoangular.ast.FunctionNode;
import info.isaksson.erland.reacttoangular.ast.Identifier;
import info.isaksson.erland.reacttoangular.ast.JsNode;
import info.isaksson.erland.reacttoangular.ast.JsTrees;
import info.isaksson.erland.reacttoangular.ast.JsxAttribute;
import info.isaksson.erland.reacttoangular.ir.ComponentIr;
import info.isaksson.erland.reacttoangular.ir.FrameworkConventions.React;
import info.isaksson.erland.reacttoangular.ir.IrBinding;
import info.isaksson.erland.reacttoangular.ir.IrElement;
import info.isaksson.erland.reacttoangular.transform.ComponentSource;
import info.isaksson.erland.reacttoangular.transform.TransformWarning;
import info.isaksson.erland.reacttoangular.transform.mapping.MappingTables;

/**
 * Event bindings and two-way binding fusion.
 *
 * <p>An element with {@code value={p}} and a one-parameter {@code onChange} handler that calls a setter
 * of {@code p} gets a single two-way binding for {@code p}; its plain {@code value} attribute is dropped.
 * Every other {@code on*} attribute becomes an event binding targeted at its element.</p>
 */
public final class EventRule extends AbstractTransformRule {

    public EventRule(MappingTables tables) {
        super(tables);
    }

    @Override
    public RuleStage stage() {
        return RuleStage.EVENTS;
    }

    @Override
    protected void doApply(ComponentSource source, ComponentIr ir) {
        HandlerRewriter rewriter = new HandlerRewriter(ir.setterMap);
        for (IrElement el : ir.template.allElements()) {
            JsxAttribute fusedChange = fuseTwoWay(el, rewriter, ir);
            for (JsNode raw : el.rawAttributes) {
                if (!(raw instanceof JsxAttribute) || raw == fusedChange) continue;
                JsxAttribute attr = (JsxAttribute) raw;
                if (React.isEventAttribute(attr.name)) {
                    ir.template.bindings.add(IrBinding.event(tables.event(attr.name), handlerText(attr, el, rewriter, source), el.id));
                }
            }
        }
    }

    private static String handlerText(JsxAttribute attr, IrElement el, HandlerRewriter rewriter, ComponentSource source) {
        try {
            return rewriter.rewrite(attr.expression());
        } catch (RuntimeException ex) {
            source.warnings.warn(TransformWarning.EVENT_HANDLER,
                    "Event handler could not be rewritten; binding left empty",
                    "element", el.id,
                    "event", attr.name);
            return "";
        }
    }

    /** Returns the consumed change attribute when a two-way binding was created, otherwise null. */
    private static JsxAttribute fuseTwoWay(IrElement el, HandlerRewriter rewriter, ComponentIr ir) {
        JsxAttribute value = rawAttribute(el, React.VALUE_ATTRIBUTE);
        JsxAttribute change = rawAttribute(el, React.CHANGE_ATTRIBUTE);
        if (value == null || change == null || !(value.expression() instanceof Identifier)) return null;
        if (!(change.expression() instanceof FunctionNode)) return null;

        String property = ((Identifier) value.expression()).name;
        FunctionNode handler = (FunctionNode) change.expression();
        if (handler.params.size() != 1 || !(handler.params.get(0) instanceof Identifier)) return null;
        if (!callsSetterOf(handler, property, rewriter)) return null;

        el.twoWayBinding = property;
        el.removeAttribute(React.VALUE_ATTRIBUTE);
        ir.template.bindings.add(IrBinding.twoWay(property, el.id));
        return change;
    }

    private static boolean callsSetterOf(FunctionNode handler, String property, HandlerRewriter rewriter) {
        for (JsNode n : JsTrees.preOrder(handler.body, false)) {
            if (property.equals(rewriter.setterTarget(n))) return true;
        }
        return false;
    }

    private static JsxAttribute rawAttribute(IrElement el, String name) {
        for (JsNode n : el.rawAttributes) {
            if (n instanceof JsxAttribute && ((JsxAttribute) n).name.equals(name)) return (JsxAttribute) n;
        }
        return null;
    }
}
