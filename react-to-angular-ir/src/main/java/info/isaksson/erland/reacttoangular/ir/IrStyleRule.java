package info.isaksson.erland.reacttoangular.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** {@code selector { property: value; ... }} with declarations in insertion order. */
@JsonPropertyOrder({"selector","declarations"})
public final class IrStyleRule {
    public final String selector;
    public final Map<String, String> declarations;

    @JsonCreator
    public IrStyleRule(
            @JsonProperty("selector") String selector,
            @JsonProperty("declarations") Map<String, String> declarations
    ) {
        this.selector = Objects.requireNonNull(selector, "selector must not be null");
        this.declarations = declarations == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(declarations));
    }
}
