package info.isaksson.erland.reacttoangular.transform.rules;

import info.isaksson.erland.reacttoangular.ir.ComponentIr;
import info.isaksson.erland.reacttoangular.transform.ComponentSource;
import info.isaksson.erland.reacttoangular.transform.TransformWarning;
import info.isaksson.erland.reacttoangular.transform.mapping.MappingTables;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Base for the built-in rules: holds the mapping tables, skips inputs without a component and turns an
 * unexpected failure into a {@link TransformWarning#RULE_FAILED} warning. The IR keeps whatever the rule
 * added before it failed.
 */
public abstract class AbstractTransformRule implements TransformRule {

    private static final Logger LOG = LoggerFactory.getLogger(AbstractTransformRule.class);

    protected final MappingTables tables;

    protected AbstractTransformRule(MappingTables tables) {
        this.tables = Objects.requireNonNull(tables, "tables must not be null");
    }

    @Override
    public final void apply(ComponentSource source, ComponentIr ir) {
        if (!source.hasComponent()) return;
        try {
            doApply(source, ir);
        } catch (RuntimeException ex) {
            LOG.warn("{} rule failed, continuing with partial result", stage(), ex);
            source.warnings.warn(TransformWarning.RULE_FAILED,
                    "Rule failed: " + ex.getClass().getSimpleName(),
                    "stage", stage().name(),
                    "error", String.valueOf(ex.getMessage()));
        }
    }

    protected abstract void doApply(ComponentSource source, ComponentIr ir);
}
