package info.isaksson.erland.reacttoangular.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import info.isaksson.erland.reacttoangular.ast.JsNode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Template element. Structure (id, tag) is fixed at creation; attributes, children and directives are
 * filled in by the transformation rules.
 */
@JsonPropertyOrder({"id","tag","attributes","children","repeat","condition","twoWayBinding","propertyBindings"})
public final class IrElement extends IrNode {
    public final String id;
    public final String tag;
    public final List<IrAttribute> attributes;
    public final List<IrNode> children;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public IrRepeat repeat;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public String condition;

    /** Name of the property bound with {@code [(ngModel)]}, or null. */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public String twoWayBinding;

    /** {@code [name]="expression"} bindings in source order. */
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public final Map<String, String> propertyBindings;

    /** Source attributes before filtering; only meaningful during one transform call. */
    @JsonIgnore
    public final List<JsNode> rawAttributes = new ArrayList<>();

    public IrElement(String id, String tag) {
        this(id, tag, null, null, null, null, null, null);
    }

    @JsonCreator
    public IrElement(
            @JsonProperty("id") String id,
            @JsonProperty("tag") String tag,
            @JsonProperty("attributes") List<IrAttribute> attributes,
            @JsonProperty("children") List<IrNode> children,
            @JsonProperty("repeat") IrRepeat repeat,
            @JsonProperty("condition") String condition,
            @JsonProperty("twoWayBinding") String twoWayBinding,
            @JsonProperty("propertyBindings") Map<String, String> propertyBindings
    ) {
        this.id = id;
        this.tag = tag == null || tag.isBlank() ? "div" : tag;
        this.attributes = attributes == null ? new ArrayList<>() : new ArrayList<>(attributes);
        this.children = children == null ? new ArrayList<>() : new ArrayList<>(children);
        this.repeat = repeat;
        this.condition = condition;
        this.twoWayBinding = twoWayBinding;
        this.propertyBindings = propertyBindings == null ? new LinkedHashMap<>() : new LinkedHashMap<>(propertyBindings);
    }

    public Optional<IrAttribute> attribute(String name) {
        return attributes.stream().filter(a -> a.name.equals(name)).findFirst();
    }

    public boolean removeAttribute(String name) {
        return attributes.removeIf(a -> a.name.equals(name));
    }

    /** Child elements only, in order. */
    @JsonIgnore
    public List<IrElement> childElements() {
        List<IrElement> out = new ArrayList<>();
        for (IrNode c : children) {
            if (c instanceof IrElement) out.add((IrElement) c);
        }
        return out;
    }

    @Override public String toString() {
        return "IrElement{" + id + " <" + tag + ">}";
    }
}
