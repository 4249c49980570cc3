package info.isaksson.erland.reacttoangular.emitter;

import info.isaksson.erland.reacttoangular.ir.ComponentIr;
import info.isaksson.erland.reacttoangular.ir.FrameworkConventions.React;

import java.util.Locale;

/** Naming conventions for generated Angular artifacts. */
public final class ComponentNames {

    private static final String CLASS_SUFFIX = "Component";

    private ComponentNames() {}

    /**
     * The name to generate under: the explicit name when given, else the IR's component name, else
     * {@code MyComponent}.
     */
    public static String resolve(String componentName, ComponentIr ir) {
        if (componentName != null && !componentName.isBlank()) return componentName.trim();
        if (ir != null && ir.componentClass.name != null && !ir.componentClass.name.isBlank()) {
            return ir.componentClass.name;
        }
        return React.DEFAULT_COMPONENT_NAME;
    }

    /** {@code todo-box} and {@code TodoBox} both give {@code TodoBox}; inner capitals are kept. */
    public static String pascalCase(String name) {
        StringBuilder sb = new StringBuilder();
        for (String word : name.split("[^A-Za-z0-9]+")) {
            if (word.isEmpty()) continue;
            sb.append(Character.toUpperCase(word.charAt(0))).append(word.substring(1));
        }
        return sb.toString();
    }

    /** {@code TodoBox} gives {@code todo-box}; {@code HTMLView} gives {@code html-view}. */
    public static String kebabCase(String name) {
        String pascal = pascalCase(name);
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < pascal.length(); i++) {
            char c = pascal.charAt(i);
            if (Character.isUpperCase(c) && i > 0) {
                char prev = pascal.charAt(i - 1);
                boolean nextLower = i + 1 < pascal.length() && Character.isLowerCase(pascal.charAt(i + 1));
                if (!Character.isUpperCase(prev) || nextLower) sb.append('-');
            }
            sb.append(Character.toLowerCase(c));
        }
        return sb.toString();
    }

    public static String className(String name) {
        return pascalCase(name) + CLASS_SUFFIX;
    }

    public static String selector(String prefix, String name) {
        return prefix + "-" + kebabCase(name);
    }

    /** Base file name shared by the three artifacts: {@code <Name>.component}. */
    public static String fileBaseName(String name) {
        return name + ".component";
    }

    /** CSS property name: {@code backgroundColor} gives {@code background-color}. */
    public static String cssProperty(String name) {
        if (name.startsWith("--")) return name;
        StringBuilder sb = new StringBuilder();
        for (char c : name.toCharArray()) {
            if (Character.isUpperCase(c)) {
                sb.append('-').append(Character.toLowerCase(c));
            } else {
                sb.append(c);
            }
        }
        return sb.toString().toLowerCase(Locale.ROOT);
    }
}
