package info.isaksson.erland.reacttoangular.transform;

import info.isaksson.erland.reacttoangular.ast.Program;
import info.isaksson.erland.reacttoangular.ir.ComponentIr;
import info.isaksson.erland.reacttoangular.transform.mapping.MappingTables;
import info.isaksson.erland.reacttoangular.transform.rules.ComponentRule;
import info.isaksson.erland.reacttoangular.transform.rules.EventRule;
import info.isaksson.erland.reacttoangular.transform.rules.RuleStage;
import info.isaksson.erland.reacttoangular.transform.rules.StateHookRule;
import info.isaksson.erland.reacttoangular.transform.rules.TemplateRule;
import info.isaksson.erland.reacttoangular.transform.rules.TransformRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Runs the rule pipeline over one parsed module and returns a fresh IR.
 *
 * <p>The stage list is fixed at construction and must be strictly ordered by {@link RuleStage}
 * (state hooks, component, template, events). Instances hold no per-call state and can be shared.</p>
 */
public final class ReactToAngularTransformer {

    private static final Logger LOG = LoggerFactory.getLogger(ReactToAngularTransformer.class);

    private final List<TransformRule> rules;

    public ReactToAngularTransformer() {
        this(MappingTables.defaults());
    }

    public ReactToAngularTransformer(MappingTables tables) {
        this(List.of(
                new StateHookRule(tables),
                new ComponentRule(tables),
                new TemplateRule(tables),
                new EventRule(tables)
        ));
    }

    /**
     * @throws IllegalArgumentException if the rules are not in strictly increasing stage order
     */
    public ReactToAngularTransformer(List<TransformRule> rules) {
        if (rules == null || rules.isEmpty()) throw new IllegalArgumentException("rules must not be empty");
        RuleStage previous = null;
        for (TransformRule rule : rules) {
            if (rule == null) throw new IllegalArgumentException("rules must not contain null");
            if (previous != null && rule.stage().compareTo(previous) <= 0) {
                throw new IllegalArgumentException(
                        "Rule stage " + rule.stage() + " must come after " + previous);
            }
            previous = rule.stage();
        }
        this.rules = List.copyOf(rules);
    }

    public List<TransformRule> rules() {
        return rules;
    }

    public ComponentIr transform(Program program) {
        return transform(program, new TransformWarnings());
    }

    /** Transforms {@code program}, recording recoverable problems in {@code warnings}. */
    public ComponentIr transform(Program program, TransformWarnings warnings) {
        if (program == null) throw new IllegalArgumentException("program must not be null");
        TransformWarnings sink = warnings == null ? new TransformWarnings() : warnings;

        Optional<ComponentLocator.Located> located = ComponentLocator.locate(program);
        ComponentSource source = located
                .map(l -> new ComponentSource(program, l.function, l.name, sink))
                .orElseGet(() -> new ComponentSource(program, null, null, sink));

        ComponentIr ir = new ComponentIr();
        if (!source.hasComponent()) {
            sink.warn(TransformWarning.MISSING_COMPONENT, "No component function found");
            return ir;
        }
        for (TransformRule rule : rules) {
            rule.apply(source, ir);
        }
        LOG.debug("Transformed component '{}': {} properties, {} methods, {} root elements, {} bindings",
                ir.componentClass.name,
                ir.componentClass.properties.size(),
                ir.componentClass.methods.size(),
                ir.template.elements.size(),
                ir.template.bindings.size());
        return ir;
    }
}
