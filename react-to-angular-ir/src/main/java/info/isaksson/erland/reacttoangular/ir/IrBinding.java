package info.isaksson.erland.reacttoangular.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * Template binding. For {@link BindingKind#EVENT} the name is the DOM event and the handler is the
 * statement text; for {@link BindingKind#TWO_WAY} name and handler are both the bound property.
 * The target is the element id the binding belongs to.
 */
@JsonPropertyOrder({"kind","name","handler","target"})
public final class IrBinding {
    public final BindingKind kind;
    public final String name;
    public final String handler;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public final String target;

    @JsonCreator
    public IrBinding(
            @JsonProperty("kind") BindingKind kind,
            @JsonProperty("name") String name,
            @JsonProperty("handler") String handler,
            @JsonProperty("target") String target
    ) {
        this.kind = kind == null ? BindingKind.EVENT : kind;
        this.name = name == null ? "" : name;
        this.handler = handler == null ? "" : handler;
        this.target = target == null || target.isBlank() ? null : target;
    }

    public static IrBinding event(String event, String handler, String target) {
        return new IrBinding(BindingKind.EVENT, event, handler, target);
    }

    public static IrBinding twoWay(String property, String target) {
        return new IrBinding(BindingKind.TWO_WAY, property, property, target);
    }

    public boolean targets(String elementId) {
        return target == null ? elementId == null : target.equals(elementId);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IrBinding)) return false;
        IrBinding that = (IrBinding) o;
        return kind == that.kind && name.equals(that.name) && handler.equals(that.handler)
                && Objects.equals(target, that.target);
    }

    @Override public int hashCode() {
        return Objects.hash(kind, name, handler, target);
    }

    @Override public String toString() {
        return "IrBinding{" + kind + " " + name + "=" + handler + (target == null ? "" : " @" + target) + "}";
    }
}
