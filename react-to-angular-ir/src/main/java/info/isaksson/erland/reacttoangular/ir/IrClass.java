package info.isaksson.erland.reacttoangular.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/** Class section of the IR. Lists are mutable and keep insertion (source) order. */
@JsonPropertyOrder({"name","properties","methods","lifecycleHooks"})
public final class IrClass {
    /** Component name; empty until the component rule sets it. */
    public String name;
    public final List<IrProperty> properties;
    public final List<IrMethod> methods;
    public final List<IrMethod> lifecycleHooks;

    public IrClass() {
        this("", null, null, null);
    }

    @JsonCreator
    public IrClass(
            @JsonProperty("name") String name,
            @JsonProperty("properties") List<IrProperty> properties,
            @JsonProperty("methods") List<IrMethod> methods,
            @JsonProperty("lifecycleHooks") List<IrMethod> lifecycleHooks
    ) {
        this.name = name == null ? "" : name;
        this.properties = properties == null ? new ArrayList<>() : new ArrayList<>(properties);
        this.methods = methods == null ? new ArrayList<>() : new ArrayList<>(methods);
        this.lifecycleHooks = lifecycleHooks == null ? new ArrayList<>() : new ArrayList<>(lifecycleHooks);
    }

    public Optional<IrProperty> property(String propertyName) {
        return properties.stream().filter(p -> p.name.equals(propertyName)).findFirst();
    }

    public boolean hasProperty(String propertyName) {
        return property(propertyName).isPresent();
    }

    public boolean hasMethod(String methodName) {
        return methods.stream().anyMatch(m -> m.name.equals(methodName));
    }

    public Optional<IrMethod> lifecycleHook(String hookName) {
        return lifecycleHooks.stream().filter(m -> m.name.equals(hookName)).findFirst();
    }

    @JsonIgnore
    public boolean isEmpty() {
        return name.isEmpty() && properties.isEmpty() && methods.isEmpty() && lifecycleHooks.isEmpty();
    }
}
