package info.isaksson.erland.reacttoangular.transform;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-call warning sink shared by the rules of one {@link ReactToAngularTransformer#transform} run.
 *
 * <p>Rules report unrecognised shapes here instead of throwing; each warning is logged at debug level
 * as it arrives. {@link #toDeterministicList()} sorts by code, message and key-sorted context so two
 * runs over the same tree report identical lists. Not thread-safe; one instance per call.</p>
 */
public final class TransformWarnings {

    private static final Logger LOG = LoggerFactory.getLogger(TransformWarnings.class);

    private final List<TransformWarning> warnings = new ArrayList<>();

    public void warn(String code, String message) {
        warn(code, message, null);
    }

    public void warn(String code, String message, Map<String, String> context) {
        TransformWarning w = new TransformWarning(code, message, context == null ? Collections.emptyMap() : context);
        LOG.debug("{}", w);
        warnings.add(w);
    }

    public void warn(String code, String message, String k1, String v1) {
        Map<String, String> ctx = new LinkedHashMap<>();
        ctx.put(k1, v1);
        warn(code, message, ctx);
    }

    public void warn(String code, String message, String k1, String v1, String k2, String v2) {
        Map<String, String> ctx = new LinkedHashMap<>();
        ctx.put(k1, v1);
        ctx.put(k2, v2);
        warn(code, message, ctx);
    }

    public boolean isEmpty() {
        return warnings.isEmpty();
    }

    public boolean contains(String code) {
        return warnings.stream().anyMatch(w -> w.code.equals(code));
    }

    public List<TransformWarning> toDeterministicList() {
        List<TransformWarning> out = new ArrayList<>(warnings);
        out.sort(Comparator
                .comparing((TransformWarning w) -> w.code)
                .thenComparing(w -> w.message)
                .thenComparing(w -> contextString(w.context)));
        return Collections.unmodifiableList(out);
    }

    private static String contextString(Map<String, String> ctx) {
        if (ctx == null || ctx.isEmpty()) return "";
        // stable serialization: key-sorted
        List<String> keys = new ArrayList<>(ctx.keySet());
        keys.sort(String::compareTo);
        StringBuilder sb = new StringBuilder();
        for (String k : keys) {
            sb.append(k).append('=').append(ctx.get(k)).append(';');
        }
        return sb.toString();
    }
}
