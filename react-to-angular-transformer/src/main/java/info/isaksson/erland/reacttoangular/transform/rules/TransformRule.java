package info.isaksson.erland.reacttoangular.transform.rules;

import info.isaksson.erland.reacttoangular.ir.ComponentIr;
import info.isaksson.erland.reacttoangular.transform.ComponentSource;

/** One stage of the transformation pipeline. Rules only add to the IR; they never reset it. */
public interface TransformRule {

    RuleStage stage();

    void apply(ComponentSource source, ComponentIr ir);
}
