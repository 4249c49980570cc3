package info.isaksson.erland.reacttoangular.transform.mapping;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable React to Angular lookup tables.
 *
 * <p>Every lookup has a deterministic fallback, so callers never see a missing mapping:
 * unmapped lifecycle methods and hooks give {@code ""}, unmapped events drop the {@code on}
 * prefix and are lower-cased, unmapped attributes are lower-cased.</p>
 */
public final class MappingTables {

    private static final MappingTables DEFAULTS = new MappingTables(
            orderedMap(
                    "componentDidMount", "ngOnInit",
                    "componentDidUpdate", "ngAfterViewChecked",
                    "componentWillUnmount", "ngOnDestroy"),
            orderedMap(
                    "useState", "property",
                    "useEffect", "ngOnInit/ngOnDestroy",
                    "useContext", "inject",
                    "useRef", "ViewChild/ElementRef",
                    "useMemo", "getter",
                    "useCallback", "method"),
            orderedMap(
                    "onClick", "click",
                    "onChange", "change",
                    "onSubmit", "submit",
                    "onFocus", "focus",
                    "onBlur", "blur",
                    "onKeyDown", "keydown",
                    "onKeyUp", "keyup",
                    "onKeyPress", "keypress",
                    "onMouseEnter", "mouseenter",
                    "onMouseLeave", "mouseleave",
                    "onDoubleClick", "dblclick",
                    "onInput", "input"),
            orderedMap(
                    "className", "class",
                    "htmlFor", "for"),
            orderedMap(
                    "disabled", "disabled",
                    "checked", "checked",
                    "hidden", "hidden",
                    "selected", "selected",
                    "readOnly", "readonly",
                    "required", "required",
                    "multiple", "multiple"),
            Set.of("map")
    );

    private final Map<String, String> lifecycle;
    private final Map<String, String> hooks;
    private final Map<String, String> events;
    private final Map<String, String> attributes;
    private final Map<String, String> domProperties;
    private final Set<String> listMethods;

    public MappingTables(
            Map<String, String> lifecycle,
            Map<String, String> hooks,
            Map<String, String> events,
            Map<String, String> attributes,
            Map<String, String> domProperties,
            Set<String> listMethods
    ) {
        this.lifecycle = freeze(lifecycle);
        this.hooks = freeze(hooks);
        this.events = freeze(events);
        this.attributes = freeze(attributes);
        this.domProperties = freeze(domProperties);
        this.listMethods = listMethods == null
                ? Collections.emptySet()
                : Collections.unmodifiableSet(new LinkedHashSet<>(listMethods));
    }

    public static MappingTables defaults() {
        return DEFAULTS;
    }

    /** Angular hook for a React lifecycle method, or {@code ""}. */
    public String lifecycle(String reactMethod) {
        return reactMethod == null ? "" : lifecycle.getOrDefault(reactMethod, "");
    }

    /** Angular construct a React hook is lowered to, or {@code ""}. */
    public String hook(String hookName) {
        return hookName == null ? "" : hooks.getOrDefault(hookName, "");
    }

    /** DOM event name for a React event attribute ({@code onDoubleTap} gives {@code doubletap}). */
    public String event(String reactAttribute) {
        if (reactAttribute == null) return "";
        String mapped = events.get(reactAttribute);
        if (mapped != null) return mapped;
        String bare = reactAttribute.startsWith("on") ? reactAttribute.substring(2) : reactAttribute;
        return bare.toLowerCase(Locale.ROOT);
    }

    /** HTML attribute name for a JSX attribute. */
    public String attribute(String jsxAttribute) {
        if (jsxAttribute == null) return "";
        String mapped = attributes.get(jsxAttribute);
        return mapped != null ? mapped : jsxAttribute.toLowerCase(Locale.ROOT);
    }

    /** DOM property name when the attribute is bound as {@code [property]}, otherwise empty. */
    public Optional<String> domProperty(String jsxAttribute) {
        return Optional.ofNullable(jsxAttribute == null ? null : domProperties.get(jsxAttribute));
    }

    public boolean isListMethod(String methodName) {
        return methodName != null && listMethods.contains(methodName);
    }

    private static Map<String, String> freeze(Map<String, String> in) {
        if (in == null || in.isEmpty()) return Collections.emptyMap();
        return Collections.unmodifiableMap(new LinkedHashMap<>(in));
    }

    private static Map<String, String> orderedMap(String... kv) {
        Map<String, String> m = new LinkedHashMap<>();
        for (int i = 0; i + 1 < kv.length; i += 2) {
            m.put(kv[i], kv[i + 1]);
        }
        return m;
    }
}
