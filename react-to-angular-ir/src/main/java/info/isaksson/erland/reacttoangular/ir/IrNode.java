package info.isaksson.erland.reacttoangular.ir;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/** Template child: static text, an interpolation, or an element. */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = IrText.class, name = "text"),
        @JsonSubTypes.Type(value = IrInterpolation.class, name = "interpolation"),
        @JsonSubTypes.Type(value = IrElement.class, name = "element")
})
public abstract class IrNode {
    IrNode() {}
}
