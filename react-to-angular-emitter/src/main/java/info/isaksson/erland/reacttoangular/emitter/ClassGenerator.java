package info.isaksson.erland.reacttoangular.emitter;

import info.isaksson.erland.reacttoangular.ir.BindingKind;
import info.isaksson.erland.reacttoangular.ir.ComponentIr;
import info.isaksson.erland.reacttoangular.ir.FrameworkConventions.Angular;
import info.isaksson.erland.reacttoangular.ir.IrBinding;
import info.isaksson.erland.reacttoangular.ir.IrElement;
import info.isaksson.erland.reacttoangular.ir.IrMethod;
import info.isaksson.erland.reacttoangular.ir.IrProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Renders the component class ({@code <Name>.component.ts}).
 *
 * <p>Layout: {@code @angular/core} import, optional FormsModule note, {@code @Component} decorator,
 * then properties, lifecycle hooks and methods in IR order. Method and hook bodies go through
 * {@link BodyNormalizer}.</p>
 */
public final class ClassGenerator {

    private static final Logger LOG = LoggerFactory.getLogger(ClassGenerator.class);

    private static final String INDENT = "  ";
    private static final String BODY_INDENT = "    ";
    private static final String STUB_BODY = "// handler not found in source component";

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_$][\\w$]*");
    private static final Pattern CALLED_NAME = Pattern.compile("^\\s*([A-Za-z_$][\\w$]*)\\s*\\(");
    private static final Set<String> KEYWORDS = Set.of(
            "if", "for", "while", "switch", "catch", "return", "typeof", "void", "delete", "await", "new", "function");

    private final GeneratorOptions options;

    public ClassGenerator() {
        this(GeneratorOptions.defaults());
    }

    public ClassGenerator(GeneratorOptions options) {
        this.options = options == null ? GeneratorOptions.defaults() : options;
    }

    public String generate(ComponentIr ir, String componentName) {
        if (ir == null) throw new IllegalArgumentException("ir must not be null");
        String name = ComponentNames.resolve(componentName, ir);

        List<IrProperty> properties = new ArrayList<>(ir.componentClass.properties);
        if (options.inferredProperties) {
            properties.addAll(inferredProperties(ir));
        }
        List<IrMethod> methods = new ArrayList<>(ir.componentClass.methods);
        if (options.handlerStubs) {
            methods.addAll(handlerStubs(ir, properties));
        }
        List<IrMethod> hooks = ir.componentClass.lifecycleHooks;

        Set<String> knownNames = new LinkedHashSet<>();
        properties.forEach(p -> knownNames.add(p.name));
        methods.forEach(m -> knownNames.add(m.name));

        StringBuilder sb = new StringBuilder();
        sb.append(importLine(properties, hooks)).append('\n');
        if (options.formsNote && hasTwoWayBinding(ir)) {
            sb.append('\n').append(Angular.FORMS_MODULE_NOTE).append('\n');
        }
        sb.append('\n');
        sb.append("@Component({\n");
        sb.append(INDENT).append("selector: '").append(ComponentNames.selector(options.selectorPrefix, name)).append("',\n");
        sb.append(INDENT).append("templateUrl: './").append(ComponentNames.fileBaseName(name)).append(".html',\n");
        sb.append(INDENT).append("styleUrls: ['./").append(ComponentNames.fileBaseName(name)).append(".css']\n");
        sb.append("})\n");
        sb.append("export class ").append(ComponentNames.className(name)).append(implementsClause(hooks)).append(" {\n");

        List<String> sections = new ArrayList<>();
        if (!properties.isEmpty()) {
            StringBuilder props = new StringBuilder();
            for (IrProperty p : properties) props.append(property(p));
            sections.add(props.toString());
        }
        for (IrMethod hook : hooks) {
            sections.add(method(hook, knownNames, ir));
        }
        for (IrMethod m : methods) {
            sections.add(method(m, knownNames, ir));
        }
        sb.append(String.join("\n", sections));
        sb.append("}\n");

        LOG.debug("Generated class {} with {} properties, {} hooks, {} methods",
                ComponentNames.className(name), properties.size(), hooks.size(), methods.size());
        return sb.toString();
    }

    private static String importLine(List<IrProperty> properties, List<IrMethod> hooks) {
        Set<String> imports = new TreeSet<>();
        imports.add("Component");
        for (IrProperty p : properties) {
            if (p.decorator == null) continue;
            if (p.decorator.startsWith("@Input")) imports.add("Input");
            if (p.decorator.startsWith("@Output")) {
                imports.add("Output");
                imports.add("EventEmitter");
            }
        }
        for (IrMethod hook : hooks) {
            String iface = Angular.LIFECYCLE_INTERFACES.get(hook.name);
            if (iface != null) imports.add(iface);
        }
        return "import { " + String.join(", ", imports) + " } from '" + Angular.CORE_MODULE + "';";
    }

    private static String implementsClause(List<IrMethod> hooks) {
        Set<String> interfaces = new LinkedHashSet<>();
        for (IrMethod hook : hooks) {
            String iface = Angular.LIFECYCLE_INTERFACES.get(hook.name);
            if (iface != null) interfaces.add(iface);
        }
        return interfaces.isEmpty() ? "" : " implements " + String.join(", ", interfaces);
    }

    private static String property(IrProperty p) {
        StringBuilder sb = new StringBuilder(INDENT);
        if (p.decorator != null) sb.append(p.decorator).append(' ');
        sb.append(p.name).append(": ").append(p.type);
        if (p.hasInitialValue()) sb.append(" = ").append(p.initialValue);
        return sb.append(";\n").toString();
    }

    private static String method(IrMethod m, Set<String> knownNames, ComponentIr ir) {
        List<String> params = new ArrayList<>();
        for (String p : m.parameters) {
            params.add(IDENTIFIER.matcher(p).matches() ? p + ": any" : p);
        }
        StringBuilder sb = new StringBuilder(INDENT);
        if (m.isAsync()) sb.append("async ");
        sb.append(m.name).append('(').append(String.join(", ", params)).append("): ").append(m.returnType).append(" {\n");
        String body = m.body.equals(STUB_BODY) ? STUB_BODY : BodyNormalizer.normalize(m.body, knownNames, ir.setterMap);
        for (String line : body.split("\n", -1)) {
            if (line.isBlank()) continue;
            sb.append(BODY_INDENT).append(line).append('\n');
        }
        return sb.append(INDENT).append("}\n").toString();
    }

    /** Two-way bound names and simple repeated array names that no property declares. */
    private static List<IrProperty> inferredProperties(ComponentIr ir) {
        Set<String> declared = new LinkedHashSet<>();
        ir.componentClass.properties.forEach(p -> declared.add(p.name));
        ir.componentClass.methods.forEach(m -> declared.add(m.name));

        List<IrProperty> out = new ArrayList<>();
        for (String name : twoWayNames(ir)) {
            if (declared.add(name)) out.add(IrProperty.field(name, "string", "''"));
        }
        for (IrElement el : ir.template.allElements()) {
            if (el.repeat == null || !IDENTIFIER.matcher(el.repeat.array).matches()) continue;
            if (declared.add(el.repeat.array)) out.add(IrProperty.field(el.repeat.array, "any[]", "[]"));
        }
        return out;
    }

    /** Methods for names that event handlers call but the class does not declare. */
    private static List<IrMethod> handlerStubs(ComponentIr ir, List<IrProperty> properties) {
        Set<String> declared = new LinkedHashSet<>();
        properties.forEach(p -> declared.add(p.name));
        ir.componentClass.methods.forEach(m -> declared.add(m.name));
        ir.componentClass.lifecycleHooks.forEach(m -> declared.add(m.name));

        List<IrMethod> out = new ArrayList<>();
        for (IrBinding b : ir.template.bindings) {
            if (b.kind != BindingKind.EVENT) continue;
            for (String statement : b.handler.split(";")) {
                Matcher m = CALLED_NAME.matcher(statement);
                if (m.find() && !KEYWORDS.contains(m.group(1)) && declared.add(m.group(1))) {
                    out.add(IrMethod.of(m.group(1), List.of("...args: any[]"), STUB_BODY));
                }
            }
        }
        return out;
    }

    private static Set<String> twoWayNames(ComponentIr ir) {
        Set<String> names = new LinkedHashSet<>();
        for (IrElement el : ir.template.allElements()) {
            if (el.twoWayBinding != null) names.add(el.twoWayBinding);
        }
        for (IrBinding b : ir.template.bindings) {
            if (b.kind == BindingKind.TWO_WAY && !b.name.isEmpty()) names.add(b.name);
        }
        return names;
    }

    private static boolean hasTwoWayBinding(ComponentIr ir) {
        return !twoWayNames(ir).isEmpty();
    }
}
