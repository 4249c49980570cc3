package info.isaksson.erland.reacttoangular.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/** {@code {{ expression }}} in the template. */
public final class IrInterpolation extends IrNode {
    public final String expression;

    @JsonCreator
    public IrInterpolation(@JsonProperty("expression") String expression) {
        this.expression = expression == null ? "" : expression;
    }

    @Override public boolean equals(Object o) {
        return o instanceof IrInterpolation && expression.equals(((IrInterpolation) o).expression);
    }

    @Override public int hashCode() {
        return Objects.hash(expression);
    }
}
