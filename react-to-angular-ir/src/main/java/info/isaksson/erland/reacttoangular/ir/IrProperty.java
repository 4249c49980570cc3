package info.isaksson.erland.reacttoangular.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/** A field of the generated component class. */
@JsonPropertyOrder({"name","type","initialValue","decorator"})
public final class IrProperty {
    public final String name;
    public final String type;
    /** Initial value as source text; empty for none. */
    public final String initialValue;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final String decorator;

    @JsonCreator
    public IrProperty(
            @JsonProperty("name") String name,
            @JsonProperty("type") String type,
            @JsonProperty("initialValue") String initialValue,
            @JsonProperty("decorator") String decorator
    ) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.type = type == null || type.isBlank() ? "any" : type;
        this.initialValue = initialValue == null ? "" : initialValue;
        this.decorator = decorator == null || decorator.isBlank() ? null : decorator;
    }

    public static IrProperty field(String name, String type, String initialValue) {
        return new IrProperty(name, type, initialValue, null);
    }

    public static IrProperty input(String name, String type, String initialValue) {
        return new IrProperty(name, type, initialValue, FrameworkConventions.Angular.DECORATOR_INPUT);
    }

    public boolean hasInitialValue() {
        return !initialValue.isEmpty();
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IrProperty)) return false;
        IrProperty that = (IrProperty) o;
        return name.equals(that.name) && type.equals(that.type)
                && initialValue.equals(that.initialValue) && Objects.equals(decorator, that.decorator);
    }

    @Override public int hashCode() {
        return Objects.hash(name, type, initialValue, decorator);
    }

    @Override public String toString() {
        return "IrProperty{" + name + ": " + type + (hasInitialValue() ? " = " + initialValue : "") + "}";
    }
}
