package info.isaksson.erland.reacttoangular.transform;

import info.isaksson.erland.reacttoangular.ast.FunctionNode;
import info.isaksson.erland.reacttoangular.ast.Program;

import java.util.Objects;

/**
 * Input of one transformation: the parsed module, the located component function and the warning sink.
 * Built once per call by {@link ReactToAngularTransformer}.
 */
public final class ComponentSource {
    public final Program program;

    /** The component function, or null when none was found. */
    public final FunctionNode component;

    /** Declared name of the component, or null for anonymous components. */
    public final String componentName;

    public final TransformWarnings warnings;

    public ComponentSource(Program program, FunctionNode component, String componentName, TransformWarnings warnings) {
        this.program = Objects.requireNonNull(program, "program must not be null");
        this.component = component;
        this.componentName = componentName == null || componentName.isBlank() ? null : componentName;
        this.warnings = warnings == null ? new TransformWarnings() : warnings;
    }

    public boolean hasComponent() {
        return component != null;
    }
}
