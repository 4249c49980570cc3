package info.isaksson.erland.reacttoangular.emitter;

import info.isaksson.erland.reacttoangular.ir.ComponentIr;
import info.isaksson.erland.reacttoangular.ir.IrStyleRule;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/** Renders the stylesheet ({@code <Name>.component.css}). */
public final class StyleGenerator {

    public String generate(ComponentIr ir, String componentName) {
        if (ir == null) throw new IllegalArgumentException("ir must not be null");
        List<String> blocks = new ArrayList<>();
        for (IrStyleRule rule : ir.styles) {
            if (rule.declarations.isEmpty()) continue;
            StringBuilder sb = new StringBuilder(rule.selector).append(" {\n");
            for (Map.Entry<String, String> d : rule.declarations.entrySet()) {
                sb.append("  ").append(ComponentNames.cssProperty(d.getKey())).append(": ").append(d.getValue()).append(";\n");
            }
            blocks.add(sb.append("}\n").toString());
        }
        if (blocks.isEmpty()) {
            return "/* Styles for " + ComponentNames.resolve(componentName, ir) + " component */\n";
        }
        return String.join("\n", blocks);
    }
}
