package info.isaksson.erland.reacttoangular.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Intermediate representation of one converted component.
 *
 * <p>An instance is created empty for each transformation call and filled additively by the rules:
 * nothing already present is overwritten or removed except where a rule fuses attributes into a
 * binding. Generators only read it.</p>
 */
@JsonPropertyOrder({"schemaVersion","class","template","styles","setterMap"})
public final class ComponentIr {

    public static final String SCHEMA_VERSION = "1.0";
    public static final String ELEMENT_ID_PREFIX = "el-";

    public final String schemaVersion;

    @JsonProperty("class")
    public final IrClass componentClass;

    public final IrTemplate template;
    public final List<IrStyleRule> styles;

    /** State setter name to property name. First registration wins. */
    public final Map<String, String> setterMap;

    @JsonIgnore
    private int elementCounter;

    public ComponentIr() {
        this(SCHEMA_VERSION, null, null, null, null);
    }

    @JsonCreator
    public ComponentIr(
            @JsonProperty("schemaVersion") String schemaVersion,
            @JsonProperty("class") IrClass componentClass,
            @JsonProperty("template") IrTemplate template,
            @JsonProperty("styles") List<IrStyleRule> styles,
            @JsonProperty("setterMap") Map<String, String> setterMap
    ) {
        this.schemaVersion = schemaVersion == null || schemaVersion.isBlank() ? SCHEMA_VERSION : schemaVersion;
        this.componentClass = componentClass == null ? new IrClass() : componentClass;
        this.template = template == null ? new IrTemplate() : template;
        this.styles = styles == null ? new ArrayList<>() : new ArrayList<>(styles);
        this.setterMap = setterMap == null ? new LinkedHashMap<>() : new LinkedHashMap<>(setterMap);
        this.elementCounter = highestElementNumber(this.template);
    }

    /** Creates an element with the next free {@code el-<n>} id. The element is not attached anywhere. */
    public IrElement createElement(String tag) {
        elementCounter++;
        return new IrElement(ELEMENT_ID_PREFIX + elementCounter, tag);
    }

    /** Adds the property unless one with the same name exists. Returns true if it was added. */
    public boolean addPropertyIfAbsent(IrProperty property) {
        if (componentClass.hasProperty(property.name)) return false;
        componentClass.properties.add(property);
        return true;
    }

    /** Adds the method unless one with the same name exists. Returns true if it was added. */
    public boolean addMethodIfAbsent(IrMethod method) {
        if (componentClass.hasMethod(method.name)) return false;
        componentClass.methods.add(method);
        return true;
    }

    /** Registers {@code setter -> property}; an existing mapping for the setter is kept. */
    public boolean registerSetter(String setter, String property) {
        return setterMap.putIfAbsent(setter, property) == null;
    }

    /**
     * Appends {@code body} to the lifecycle hook {@code hookName}, creating the hook on first use.
     * Hook order follows first creation.
     */
    public void appendToLifecycleHook(String hookName, String body) {
        List<IrMethod> hooks = componentClass.lifecycleHooks;
        for (int i = 0; i < hooks.size(); i++) {
            if (hooks.get(i).name.equals(hookName)) {
                hooks.set(i, hooks.get(i).withAppendedBody(body));
                return;
            }
        }
        hooks.add(IrMethod.of(hookName, List.of(), body));
    }

    /** Element with the given id, searched depth-first, or null. */
    public IrElement findElement(String id) {
        for (IrElement e : template.allElements()) {
            if (e.id != null && e.id.equals(id)) return e;
        }
        return null;
    }

    /** True when no component was found: nothing was recorded in class or template. */
    @JsonIgnore
    public boolean isEmpty() {
        return componentClass.isEmpty() && template.isEmpty();
    }

    private static int highestElementNumber(IrTemplate template) {
        int max = 0;
        for (IrElement e : template.allElements()) {
            if (e.id == null || !e.id.startsWith(ELEMENT_ID_PREFIX)) continue;
            try {
                max = Math.max(max, Integer.parseInt(e.id.substring(ELEMENT_ID_PREFIX.length())));
            } catch (NumberFormatException ignored) {
                // foreign id scheme, does not collide with ours
            }
        }
        return max;
    }
}
