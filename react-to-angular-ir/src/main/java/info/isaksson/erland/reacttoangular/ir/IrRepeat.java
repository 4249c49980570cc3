package info.isaksson.erland.reacttoangular.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/** Repetition directive: one element instance per item of {@code array}. */
@JsonPropertyOrder({"array","item","index"})
public final class IrRepeat {
    public static final String DEFAULT_ITEM = "item";
    public static final String DEFAULT_INDEX = "index";

    public final String array;
    public final String item;
    public final String index;

    @JsonCreator
    public IrRepeat(
            @JsonProperty("array") String array,
            @JsonProperty("item") String item,
            @JsonProperty("index") String index
    ) {
        this.array = array == null ? "" : array;
        this.item = item == null || item.isBlank() ? DEFAULT_ITEM : item;
        this.index = index == null || index.isBlank() ? DEFAULT_INDEX : index;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IrRepeat)) return false;
        IrRepeat that = (IrRepeat) o;
        return array.equals(that.array) && item.equals(that.item) && index.equals(that.index);
    }

    @Override public int hashCode() {
        return Objects.hash(array, item, index);
    }

    @Override public String toString() {
        return "IrRepeat{" + item + ", " + index + " of " + array + "}";
    }
}
