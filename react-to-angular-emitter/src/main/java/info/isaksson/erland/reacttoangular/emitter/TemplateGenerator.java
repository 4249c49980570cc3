package info.isaksson.erland.reacttoangular.emitter;

import info.isaksson.erland.reacttoangular.ir.BindingKind;
import info.isaksson.erland.reacttoangular.ir.ComponentIr;
import info.isaksson.erland.reacttoangular.ir.FrameworkConventions.Angular;
import info.isaksson.erland.reacttoangular.ir.FrameworkConventions.Html;
import info.isaksson.erland.reacttoangular.ir.IrAttribute;
import info.isaksson.erland.reacttoangular.ir.IrBinding;
import info.isaksson.erland.reacttoangular.ir.IrElement;
import info.isaksson.erland.reacttoangular.ir.IrInterpolation;
import info.isaksson.erland.reacttoangular.ir.IrNode;
import info.isaksson.erland.reacttoangular.ir.IrText;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Renders the HTML template ({@code <Name>.component.html}).
 *
 * <p>Attribute order per element: {@code *ngFor}, {@code *ngIf}, {@code [(ngModel)]}, {@code [property]}
 * bindings, {@code (event)} bindings, then plain attributes. Bindings are matched by element id; a
 * binding without a target applies only to elements without an id. An element carrying both a
 * repetition and a condition is wrapped in an {@code ng-container} holding the {@code *ngIf}, since
 * Angular allows one structural directive per element.</p>
 */
public final class TemplateGenerator {

    private static final Logger LOG = LoggerFactory.getLogger(TemplateGenerator.class);

    private static final String INDENT = "  ";

    public String generate(ComponentIr ir, String componentName) {
        if (ir == null) throw new IllegalArgumentException("ir must not be null");
        StringBuilder sb = new StringBuilder();
        for (IrElement el : ir.template.elements) {
            renderElement(el, 0, ir, sb);
        }
        LOG.debug("Generated template for {} with {} root elements",
                ComponentNames.resolve(componentName, ir), ir.template.elements.size());
        return sb.toString();
    }

    private void renderElement(IrElement el, int depth, ComponentIr ir, StringBuilder sb) {
        if (el.repeat != null && el.condition != null) {
            String pad = INDENT.repeat(depth);
            sb.append(pad).append('<').append(Angular.NG_CONTAINER).append(' ')
                    .append(Angular.NG_IF).append("=\"").append(escapeAttribute(el.condition)).append("\">\n");
            renderTag(el, depth + 1, ir, sb, false);
            sb.append(pad).append("</").append(Angular.NG_CONTAINER).append(">\n");
            return;
        }
        renderTag(el, depth, ir, sb, true);
    }

    private void renderTag(IrElement el, int depth, ComponentIr ir, StringBuilder sb, boolean withCondition) {
        String pad = INDENT.repeat(depth);
        List<String> attrs = attributes(el, ir, withCondition);
        String open = "<" + el.tag + (attrs.isEmpty() ? "" : " " + String.join(" ", attrs));

        if (Html.isVoid(el.tag)) {
            sb.append(pad).append(open).append(" />\n");
            return;
        }
        if (el.childElements().isEmpty()) {
            StringBuilder text = new StringBuilder();
            for (IrNode child : el.children) text.append(inline(child));
            sb.append(pad).append(open).append('>').append(text.toString().strip())
                    .append("</").append(el.tag).append(">\n");
            return;
        }
        sb.append(pad).append(open).append(">\n");
        for (IrNode child : el.children) {
            if (child instanceof IrElement) {
                renderElement((IrElement) child, depth + 1, ir, sb);
            } else {
                String text = inline(child).strip();
                if (!text.isEmpty()) sb.append(INDENT.repeat(depth + 1)).append(text).append('\n');
            }
        }
        sb.append(pad).append("</").append(el.tag).append(">\n");
    }

    private static List<String> attributes(IrElement el, ComponentIr ir, boolean withCondition) {
        List<String> out = new ArrayList<>();
        if (el.repeat != null) {
            out.add(Angular.NG_FOR + "=\"let " + el.repeat.item + " of " + escapeAttribute(el.repeat.array)
                    + "; let " + el.repeat.index + " = index\"");
        }
        if (withCondition && el.condition != null) {
            out.add(Angular.NG_IF + "=\"" + escapeAttribute(el.condition) + "\"");
        }

        Set<String> models = new LinkedHashSet<>();
        if (el.twoWayBinding != null) models.add(el.twoWayBinding);
        for (IrBinding b : ir.template.bindingsFor(el.id, BindingKind.TWO_WAY)) models.add(b.name);
        for (String model : models) {
            out.add("[(" + Angular.NG_MODEL + ")]=\"" + escapeAttribute(model) + "\"");
        }

        for (Map.Entry<String, String> e : el.propertyBindings.entrySet()) {
            out.add("[" + e.getKey() + "]=\"" + escapeAttribute(e.getValue()) + "\"");
        }
        for (IrBinding b : ir.template.bindingsFor(el.id, BindingKind.PROPERTY)) {
            if (!el.propertyBindings.containsKey(b.name)) {
                out.add("[" + b.name + "]=\"" + escapeAttribute(b.handler) + "\"");
            }
        }

        for (IrBinding b : ir.template.bindingsFor(el.id, BindingKind.EVENT)) {
            out.add("(" + b.name + ")=\"" + escapeAttribute(b.handler) + "\"");
        }

        for (IrAttribute a : el.attributes) {
            if (a.isBare()) {
                out.add(a.name);
            } else if (a.interpolated) {
                out.add(a.name + "=\"{{ " + escapeAttribute(a.value) + " }}\"");
            } else {
                out.add(a.name + "=\"" + escapeAttribute(a.value) + "\"");
            }
        }
        return out;
    }

    private static String inline(IrNode node) {
        if (node instanceof IrText) return escapeText(((IrText) node).text);
        if (node instanceof IrInterpolation) return "{{ " + ((IrInterpolation) node).expression + " }}";
        return "";
    }

    private static String escapeAttribute(String value) {
        return value.replace("\"", "&quot;");
    }

    /** Characters Angular would read as markup or interpolation inside text. */
    private static String escapeText(String text) {
        StringBuilder sb = new StringBuilder();
        for (char c : text.toCharArray()) {
            switch (c) {
                case '<': sb.append("&lt;"); break;
                case '{': sb.append("{{ '{' }}"); break;
                case '}': sb.append("{{ '}' }}"); break;
                default: sb.append(c);
            }
        }
        return sb.toString();
    }
}
