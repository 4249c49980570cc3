package info.isaksson.erland.reacttoangular.transform.rules;

import info.isaksson.erland.reacttoangular.ast.BlockStatement;
import info.isaksson.erland.reacttoangular.ast.CallExpression;
import info.isaksson.erland.reacttoangular.ast.ConditionalExpression;
import info.isaksson.erland.reacttoangular.ast.FunctionNode;
import info.isaksson.erland.reacttoangular.ast.Identifier;
import info.isaksson.erland.reacttoangular.ast.JsNode;
import info.isaksson.erland.reacttoangular.ast.JsPrinter;
import info.isaksson.erland.reacttoangular.ast.JsTrees;
import info.isaksson.erland.reacttoangular.ast.JsxAttribute;
import info.isaksson.erland.reacttoangular.ast.JsxElement;
import info.isaksson.erland.reacttoangular.ast.JsxEmptyExpression;
import info.isaksson.erland.reacttoangular.ast.JsxExpressionContainer;
import info.isaksson.erland.reacttoangular.ast.JsxFragment;
import info.isaksson.erland.reacttoangular.ast.JsxSpreadAttribute;
import info.isaksson.erland.reacttoangular.ast.JsxText;
import info.isaksson.erland.reacttoangular.ast.Literal;
import info.isaksson.erland.reacttoangular.ast.LiteralKind;
import info.isaksson.erland.reacttoangular.ast.LogicalExpression;
import info.isaksson.erland.reacttoangular.ast.MemberExpression;
import info.isaksson.erland.reacttoangular.ast.ReturnStatement;
import info.isaksson.erland.reacttoangular.ast.TemplateLiteral;
import info.isaksson.erland.reacttoangular.ir.ComponentIr;
import info.isaksson.erland.reacttoangular.ir.FrameworkConventions.Angular;
import info.isaksson.erland.reacttoangular.ir.FrameworkConventions.React;
import info.isaksson.erland.reacttoangular.ir.IrAttribute;
import info.isaksson.erland.reacttoangular.ir.IrElement;
import info.isaksson.erland.reacttoangular.ir.IrInterpolation;
import info.isaksson.erland.reacttoangular.ir.IrNode;
import info.isaksson.erland.reacttoangular.ir.IrRepeat;
import info.isaksson.erland.reacttoangular.ir.IrText;
import info.isaksson.erland.reacttoangular.transform.ComponentSource;
import info.isaksson.erland.reacttoangular.transform.TransformWarning;
import info.isaksson.erland.reacttoangular.transform.TransformWarnings;
import info.isaksson.erland.reacttoangular.transform.mapping.MappingTables;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Lowers the returned JSX into the IR element tree.
 *
 * <p>Element ids are allocated as elements are created, so they follow document order. Event
 * attributes are left on {@link IrElement#rawAttributes} for the event stage; {@code .map(...)} calls
 * become repetition directives and {@code &&} / {@code ?:} become conditions.</p>
 */
public final class TemplateRule extends AbstractTransformRule {

    public TemplateRule(MappingTables tables) {
        super(tables);
    }

    @Override
    public RuleStage stage() {
        return RuleStage.TEMPLATE;
    }

    @Override
    protected void doApply(ComponentSource source, ComponentIr ir) {
        JsNode markup = findMarkup(source.component, source.warnings);
        if (markup == null) {
            source.warnings.warn(TransformWarning.NO_TEMPLATE, "Component returns no JSX; template left empty");
            return;
        }
        Lowering lowering = new Lowering(ir, source.warnings);
        for (IrNode node : lowering.lowerRoot(markup)) {
            if (node instanceof IrElement) {
                ir.template.elements.add((IrElement) node);
            } else {
                IrElement wrapper = ir.createElement(Angular.NG_CONTAINER);
                wrapper.children.add(node);
                ir.template.elements.add(wrapper);
            }
        }
    }

    /**
     * The markup expression: the expression body of an arrow component, else the last top-level
     * {@code return} with JSX, else the first JSX {@code return} found depth-first outside nested functions.
     */
    JsNode findMarkup(FunctionNode component, TransformWarnings warnings) {
        if (!component.hasBlockBody()) {
            return containsMarkup(component.body) ? component.body : null;
        }
        List<ReturnStatement> candidates = new ArrayList<>();
        for (JsNode n : JsTrees.preOrder(component.body, false)) {
            if (n instanceof ReturnStatement && containsMarkup(((ReturnStatement) n).argument)) {
                candidates.add((ReturnStatement) n);
            }
        }
        if (candidates.isEmpty()) return null;

        ReturnStatement chosen = null;
        for (JsNode stmt : ((BlockStatement) component.body).body) {
            if (stmt instanceof ReturnStatement && candidates.contains(stmt)) {
                chosen = (ReturnStatement) stmt;
            }
        }
        if (chosen == null) chosen = candidates.get(0);

        for (ReturnStatement other : candidates) {
            if (other == chosen) continue;
            warnings.warn(TransformWarning.EARLY_RETURN,
                    "Conditional return of markup is not converted",
                    "returns", JsPrinter.expression(other.argument));
        }
        return chosen.argument;
    }

    boolean containsMarkup(JsNode node) {
        if (node == null) return false;
        if (JsTrees.isJsx(node) || isListRendering(node)) return true;
        if (node instanceof ConditionalExpression) {
            ConditionalExpression c = (ConditionalExpression) node;
            return containsMarkup(c.consequent) || containsMarkup(c.alternate);
        }
        if (node instanceof LogicalExpression) {
            return containsMarkup(((LogicalExpression) node).right);
        }
        return false;
    }

    /** Per-call lowering state. */
    private final class Lowering {
        private final ComponentIr ir;
        private final TransformWarnings warnings;

        Lowering(ComponentIr ir, TransformWarnings warnings) {
            this.ir = ir;
            this.warnings = warnings;
        }

        List<IrNode> lowerRoot(JsNode markup) {
            if (markup instanceof JsxFragment) {
                IrElement container = ir.createElement(Angular.NG_CONTAINER);
                container.children.addAll(lowerChildren(((JsxFragment) markup).children, Angular.NG_CONTAINER));
                return List.of(container);
            }
            return lowerExpression(markup, null);
        }

        /** Lowers a value appearing as markup: JSX, conditionals, list rendering or a plain expression. */
        List<IrNode> lowerExpression(JsNode expr, String parentTag) {
            List<IrNode> out = new ArrayList<>();
            if (expr == null || expr instanceof JsxEmptyExpression) return out;
            if (expr instanceof JsxElement) {
                out.add(lowerElement((JsxElement) expr));
            } else if (expr instanceof JsxFragment) {
                out.addAll(lowerChildren(((JsxFragment) expr).children, parentTag));
            } else if (isListRendering(expr)) {
                out.add(lowerList((CallExpression) expr, parentTag));
            } else if (expr instanceof LogicalExpression && "&&".equals(((LogicalExpression) expr).operator)
                    && containsMarkup(((LogicalExpression) expr).right)) {
                LogicalExpression l = (LogicalExpression) expr;
                addBranch(out, l.right, JsPrinter.expression(l.left), parentTag);
            } else if (expr instanceof ConditionalExpression && containsMarkup(expr)) {
                ConditionalExpression c = (ConditionalExpression) expr;
                String test = JsPrinter.expression(c.test);
                addBranch(out, c.consequent, test, parentTag);
                addBranch(out, c.alternate, "!(" + test + ")", parentTag);
            } else if (expr instanceof Literal && ((Literal) expr).isString()) {
                String text = ((Literal) expr).stringValue();
                if (!text.isBlank()) out.add(new IrText(text));
            } else {
                String printed = JsPrinter.expression(expr);
                if (!printed.isEmpty()) out.add(new IrInterpolation(printed));
            }
            return out;
        }

        private void addBranch(List<IrNode> out, JsNode branch, String condition, String parentTag) {
            if (branch == null || isNullish(branch)) return;
            List<IrNode> nodes = lowerExpression(branch, parentTag);
            if (nodes.isEmpty()) return;
            if (nodes.size() == 1 && nodes.get(0) instanceof IrElement) {
                IrElement e = (IrElement) nodes.get(0);
                e.condition = e.condition == null ? condition : "(" + condition + ") && (" + e.condition + ")";
                out.add(e);
                return;
            }
            IrElement container = ir.createElement(Angular.NG_CONTAINER);
            container.condition = condition;
            container.children.addAll(nodes);
            out.add(container);
        }

        private List<IrNode> lowerChildren(List<JsNode> children, String parentTag) {
            List<IrNode> out = new ArrayList<>();
            for (JsNode child : children) {
                if (child instanceof JsxText) {
                    String text = normalizeText(((JsxText) child).value);
                    if (!text.isEmpty()) out.add(new IrText(text));
                } else if (child instanceof JsxExpressionContainer) {
                    out.addAll(lowerExpression(((JsxExpressionContainer) child).expression, parentTag));
                } else {
                    out.addAll(lowerExpression(child, parentTag));
                }
            }
            return out;
        }

        IrElement lowerElement(JsxElement jsx) {
            IrElement el = ir.createElement(jsx.name);
            el.rawAttributes.addAll(jsx.attributes);
            for (JsNode a : jsx.attributes) {
                if (a instanceof JsxSpreadAttribute) {
                    warnings.warn(TransformWarning.SPREAD_ATTRIBUTE,
                            "Spread attributes are not converted",
                            "element", el.id,
                            "spread", JsPrinter.expression(((JsxSpreadAttribute) a).argument));
                } else if (a instanceof JsxAttribute) {
                    lowerAttribute((JsxAttribute) a, el);
                }
            }
            el.children.addAll(lowerChildren(jsx.children, el.tag));
            return el;
        }

        private void lowerAttribute(JsxAttribute attr, IrElement el) {
            String jsxName = attr.name;
            if (React.KEY_ATTRIBUTE.equals(jsxName) || React.isEventAttribute(jsxName)) return;

            String name = tables.attribute(jsxName);
            if (attr.value == null) {
                el.attributes.add(IrAttribute.bare(name));
                return;
            }
            JsNode expr = attr.expression();
            if (expr == null || expr instanceof JsxEmptyExpression) return;

            if (expr instanceof Literal && ((Literal) expr).isString()) {
                el.attributes.add(IrAttribute.literal(name, ((Literal) expr).stringValue()));
            } else if (React.STYLE_ATTRIBUTE.equals(jsxName)) {
                el.propertyBindings.put(Angular.NG_STYLE, JsPrinter.expression(expr));
            } else if (expr instanceof TemplateLiteral) {
                el.attributes.add(IrAttribute.literal(name, mixedText((TemplateLiteral) expr)));
            } else if (tables.domProperty(jsxName).isPresent()) {
                el.propertyBindings.put(tables.domProperty(jsxName).get(), JsPrinter.expression(expr));
            } else if (!JsTrees.isJsx(expr)) {
                el.attributes.add(IrAttribute.interpolated(name, JsPrinter.expression(expr)));
            }
        }

        private IrElement lowerList(CallExpression call, String parentTag) {
            String array = JsPrinter.expression(((MemberExpression) call.callee).object);
            JsNode callback = call.argument(0);

            String item = null;
            String index = null;
            JsNode markup = null;
            if (callback instanceof FunctionNode) {
                FunctionNode fn = (FunctionNode) callback;
                item = paramName(fn, 0);
                index = paramName(fn, 1);
                markup = returnedMarkup(fn);
            }
            IrRepeat repeat = new IrRepeat(array, item, index);

            if (markup != null) {
                List<IrNode> nodes = lowerExpression(markup, parentTag);
                if (nodes.size() == 1 && nodes.get(0) instanceof IrElement && ((IrElement) nodes.get(0)).repeat == null) {
                    IrElement e = (IrElement) nodes.get(0);
                    e.repeat = repeat;
                    return e;
                }
                IrElement container = ir.createElement(Angular.NG_CONTAINER);
                container.repeat = repeat;
                container.children.addAll(nodes);
                return container;
            }

            warnings.warn(TransformWarning.LIST_CALLBACK,
                    "List callback does not return markup; rendering a placeholder element",
                    "array", array);
            String tag = "ul".equals(parentTag) || "ol".equals(parentTag) ? "li" : "div";
            IrElement placeholder = ir.createElement(tag);
            placeholder.repeat = repeat;
            placeholder.children.add(new IrInterpolation(repeat.item));
            return placeholder;
        }
    }

    private boolean isListRendering(JsNode expr) {
        if (!(expr instanceof CallExpression)) return false;
        JsNode callee = ((CallExpression) expr).callee;
        return callee instanceof MemberExpression && tables.isListMethod(((MemberExpression) callee).propertyName());
    }

    private static String paramName(FunctionNode fn, int index) {
        if (index >= fn.params.size()) return null;
        JsNode p = fn.params.get(index);
        return p instanceof Identifier ? ((Identifier) p).name : null;
    }

    /** Markup returned by a list callback: expression body or the last top-level return. */
    private JsNode returnedMarkup(FunctionNode fn) {
        if (!fn.hasBlockBody()) {
            return containsMarkup(fn.body) ? fn.body : null;
        }
        Optional<JsNode> last = ((BlockStatement) fn.body).body.stream()
                .filter(s -> s instanceof ReturnStatement && containsMarkup(((ReturnStatement) s).argument))
                .map(s -> ((ReturnStatement) s).argument)
                .reduce((a, b) -> b);
        return last.orElse(null);
    }

    private static boolean isNullish(JsNode node) {
        if (node instanceof Literal) {
            Literal l = (Literal) node;
            return l.literalKind == LiteralKind.NULL || (l.literalKind == LiteralKind.BOOLEAN && Boolean.FALSE.equals(l.value));
        }
        return node instanceof Identifier && "undefined".equals(((Identifier) node).name);
    }

    /**
     * JSX text whitespace: line breaks and the indentation around them collapse, whitespace inside a line
     * is kept. Lines left blank are dropped and the rest joined with single spaces.
     */
    static String normalizeText(String raw) {
        String[] lines = raw.split("\\R", -1);
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < lines.length; i++) {
            String t = lines[i];
            if (i > 0) t = t.stripLeading();
            if (i < lines.length - 1) t = t.stripTrailing();
            if (t.isEmpty()) continue;
            if (sb.length() > 0) sb.append(' ');
            sb.append(t);
        }
        return sb.toString();
    }

    /** {@code `btn ${kind}`} as {@code btn {{ kind }}}. */
    private static String mixedText(TemplateLiteral t) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < t.quasis.size() || i < t.expressions.size(); i++) {
            sb.append(t.quasi(i));
            if (i < t.expressions.size()) {
                sb.append("{{ ").append(JsPrinter.expression(t.expressions.get(i))).append(" }}");
            }
        }
        return sb.toString();
    }
}
