package info.isaksson.erland.reacttoangular.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * A plain template attribute. A {@code null} value is a bare boolean attribute; an interpolated value is
 * an expression rendered as {@code {{ value }}}; the value may also already mix text and {@code {{ }}}
 * tokens.
 */
@JsonPropertyOrder({"name","value","interpolated"})
public final class IrAttribute {
    public final String name;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final String value;

    public final boolean interpolated;

    @JsonCreator
    public IrAttribute(
            @JsonProperty("name") String name,
            @JsonProperty("value") String value,
            @JsonProperty("interpolated") boolean interpolated
    ) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.value = value;
        this.interpolated = interpolated && value != null;
    }

    public static IrAttribute literal(String name, String value) {
        return new IrAttribute(name, value, false);
    }

    public static IrAttribute bare(String name) {
        return new IrAttribute(name, null, false);
    }

    public static IrAttribute interpolated(String name, String expression) {
        return new IrAttribute(name, expression, true);
    }

    @JsonIgnore
    public boolean isBare() {
        return value == null;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IrAttribute)) return false;
        IrAttribute that = (IrAttribute) o;
        return interpolated == that.interpolated && name.equals(that.name) && Objects.equals(value, that.value);
    }

    @Override public int hashCode() {
        return Objects.hash(name, value, interpolated);
    }
}
