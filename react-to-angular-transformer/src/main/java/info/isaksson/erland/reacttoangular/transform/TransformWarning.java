package info.isaksson.erland.reacttoangular.transform;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A non-fatal warning recorded while transforming a component.
 *
 * <p>Every warning means a documented default was applied and the IR stays usable. Codes by producer:</p>
 * <ul>
 *   <li>{@link ReactToAngularTransformer}: {@link #MISSING_COMPONENT} (empty IR returned)</li>
 *   <li>any rule, via {@code AbstractTransformRule}: {@link #RULE_FAILED} with {@code stage} and
 *   {@code error} context; the IR keeps what the rule added before failing</li>
 *   <li>{@code StateHookRule}: {@link #STATE_HOOK_SHAPE} (declaration skipped), {@link #EFFECT_SHAPE}
 *   (effect skipped), {@link #EFFECT_DEPENDENCIES} (effect still runs once in {@code ngOnInit})</li>
 *   <li>{@code TemplateRule}: {@link #NO_TEMPLATE}, {@link #EARLY_RETURN} (top-level return used),
 *   {@link #SPREAD_ATTRIBUTE} (dropped), {@link #LIST_CALLBACK} (placeholder element)</li>
 *   <li>{@code EventRule}: {@link #EVENT_HANDLER} (binding kept with empty handler text)</li>
 * </ul>
 */
public final class TransformWarning {

    public static final String MISSING_COMPONENT = "MISSING_COMPONENT";
    public static final String RULE_FAILED = "RULE_FAILED";
    public static final String STATE_HOOK_SHAPE = "STATE_HOOK_SHAPE";
    public static final String EFFECT_SHAPE = "EFFECT_SHAPE";
    public static final String EFFECT_DEPENDENCIES = "EFFECT_DEPENDENCIES";
    public static final String EARLY_RETURN = "EARLY_RETURN";
    public static final String NO_TEMPLATE = "NO_TEMPLATE";
    public static final String SPREAD_ATTRIBUTE = "SPREAD_ATTRIBUTE";
    public static final String LIST_CALLBACK = "LIST_CALLBACK";
    public static final String EVENT_HANDLER = "EVENT_HANDLER";

    /** Warning code stable across versions. */
    public final String code;

    /** Human-readable message. */
    public final String message;

    /** Optional structured context (stable keys recommended). */
    public final Map<String, String> context;

    public TransformWarning(String code, String message, Map<String, String> context) {
        this.code = Objects.requireNonNull(code, "code must not be null");
        this.message = Objects.requireNonNull(message, "message must not be null");
        if (context == null || context.isEmpty()) {
            this.context = Collections.emptyMap();
        } else {
            this.context = Collections.unmodifiableMap(new LinkedHashMap<>(context));
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TransformWarning)) return false;
        TransformWarning that = (TransformWarning) o;
        return code.equals(that.code) && message.equals(that.message) && context.equals(that.context);
    }

    @Override
    public int hashCode() {
        return Objects.hash(code, message, context);
    }

    @Override
    public String toString() {
        return code + ": " + message + (context.isEmpty() ? "" : " " + context);
    }
}
