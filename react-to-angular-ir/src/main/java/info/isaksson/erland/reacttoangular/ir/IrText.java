package info.isaksson.erland.reacttoangular.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

public final class IrText extends IrNode {
    public final String text;

    @JsonCreator
    public IrText(@JsonProperty("text") String text) {
        this.text = text == null ? "" : text;
    }

    @Override public boolean equals(Object o) {
        return o instanceof IrText && text.equals(((IrText) o).text);
    }

    @Override public int hashCode() {
        return Objects.hash(text);
    }
}
