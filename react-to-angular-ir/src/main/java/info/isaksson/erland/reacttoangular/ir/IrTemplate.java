package info.isaksson.erland.reacttoangular.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/** Template section of the IR: root elements plus the binding list. */
@JsonPropertyOrder({"elements","bindings"})
public final class IrTemplate {
    public final List<IrElement> elements;
    public final List<IrBinding> bindings;

    public IrTemplate() {
        this(null, null);
    }

    @JsonCreator
    public IrTemplate(
            @JsonProperty("elements") List<IrElement> elements,
            @JsonProperty("bindings") List<IrBinding> bindings
    ) {
        this.elements = elements == null ? new ArrayList<>() : new ArrayList<>(elements);
        this.bindings = bindings == null ? new ArrayList<>() : new ArrayList<>(bindings);
    }

    /** Every element of the tree in depth-first pre-order. */
    public List<IrElement> allElements() {
        List<IrElement> out = new ArrayList<>();
        for (IrElement e : elements) collect(e, out);
        return out;
    }

    private static void collect(IrElement e, List<IrElement> out) {
        out.add(e);
        for (IrElement c : e.childElements()) collect(c, out);
    }

    /** Bindings of the given kind attached to {@code elementId}, in insertion order. */
    public List<IrBinding> bindingsFor(String elementId, BindingKind kind) {
        return bindings.stream()
                .filter(b -> b.kind == kind && b.targets(elementId))
                .collect(Collectors.toList());
    }

    @JsonIgnore
    public boolean isEmpty() {
        return elements.isEmpty() && bindings.isEmpty();
    }
}
