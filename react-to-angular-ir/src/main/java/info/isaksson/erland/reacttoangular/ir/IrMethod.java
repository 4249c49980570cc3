package info.isaksson.erland.reacttoangular.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

/** A method or lifecycle hook of the generated component class. The body is un-normalised source text. */
@JsonPropertyOrder({"name","parameters","body","returnType"})
public final class IrMethod {
    public static final String VOID = "void";
    public static final String ASYNC_VOID = "Promise<void>";

    public final String name;
    public final List<String> parameters;
    public final String body;
    public final String returnType;

    @JsonCreator
    public IrMethod(
            @JsonProperty("name") String name,
            @JsonProperty("parameters") List<String> parameters,
            @JsonProperty("body") String body,
            @JsonProperty("returnType") String returnType
    ) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.parameters = parameters == null ? List.of() : List.copyOf(parameters);
        this.body = body == null ? "" : body;
        this.returnType = returnType == null || returnType.isBlank() ? VOID : returnType;
    }

    public static IrMethod of(String name, List<String> parameters, String body) {
        return new IrMethod(name, parameters, body, VOID);
    }

    @JsonIgnore
    public boolean isAsync() {
        return returnType.startsWith("Promise");
    }

    /** Copy with {@code more} appended to the body on a new line. */
    public IrMethod withAppendedBody(String more) {
        if (more == null || more.isBlank()) return this;
        String joined = body.isBlank() ? more : body + "\n" + more;
        return new IrMethod(name, parameters, joined, returnType);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IrMethod)) return false;
        IrMethod that = (IrMethod) o;
        return name.equals(that.name) && parameters.equals(that.parameters)
                && body.equals(that.body) && returnType.equals(that.returnType);
    }

    @Override public int hashCode() {
        return Objects.hash(name, parameters, body, returnType);
    }

    @Override public String toString() {
        return "IrMethod{" + name + "(" + String.join(", ", parameters) + ")}";
    }
}
