package info.isaksson.erland.reacttoangular.transform;

import info.isaksson.erland.reacttoangular.ast.Program;
import info.isaksson.erland.reacttoangular.ir.ComponentIr;
import info.isaksson.erland.reacttoangular.ir.IrJson;
import info.isaksson.erland.reacttoangular.transform.mapping.MappingTables;
import info.isaksson.erland.reacttoangular.transform.rules.AbstractTransformRule;
import info.isaksson.erland.reacttoangular.transform.rules.EventRule;
import info.isaksson.erland.reacttoangular.transform.rules.RuleStage;
import info.isaksson.erland.reacttoangular.transform.rules.StateHookRule;
import info.isaksson.erland.reacttoangular.transform.rules.TemplateRule;
import org.junit.jupiter.api.Test;

import java.util.List;

import static info.isaksson.erland.reacttoangular.transform.JsBuilder.*;
import static org.junit.jupiter.api.Assertions.*;

public class ReactToAngularTransformerTest {

    private static final MappingTables TABLES = MappingTables.defaults();

    private static Program counter() {
        return component("Counter", List.of(props(prop("step", num(1)))),
                useState("count", "setCount", num(0)),
                constDecl("reset", arrow(call("setCount", num(0)))),
                ret(el("div",
                        el("p", text("Count: "), expr(id("count"))),
                        el("button", List.of(attr("onClick", arrow(call("setCount", bin("+", id("count"), id("step")))))),
                                text("Add")))));
    }

    /** Fails on every call, after adding a method. */
    private static final class ExplodingRule extends AbstractTransformRule {
        ExplodingRule() {
            super(TABLES);
        }

        @Override
        public RuleStage stage() {
            return RuleStage.COMPONENT;
        }

        @Override
        protected void doApply(ComponentSource source, ComponentIr ir) {
            ir.componentClass.name = "Partial";
            throw new IllegalStateException("boom");
        }
    }

    @Test
    void defaultPipelineRunsStagesInOrder() {
        List<RuleStage> stages = new java.util.ArrayList<>();
        new ReactToAngularTransformer().rules().forEach(r -> stages.add(r.stage()));
        assertEquals(List.of(RuleStage.STATE_HOOKS, RuleStage.COMPONENT, RuleStage.TEMPLATE, RuleStage.EVENTS), stages);
    }

    @Test
    void rejectsOutOfOrderOrRepeatedStages() {
        assertThrows(IllegalArgumentException.class,
                () -> new ReactToAngularTransformer(List.of(new EventRule(TABLES), new StateHookRule(TABLES))));
        assertThrows(IllegalArgumentException.class,
                () -> new ReactToAngularTransformer(List.of(new TemplateRule(TABLES), new TemplateRule(TABLES))));
        assertThrows(IllegalArgumentException.class,
                () -> new ReactToAngularTransformer(List.of()));
    }

    @Test
    void subsetOfStagesIsAllowed() {
        ReactToAngularTransformer t = new ReactToAngularTransformer(List.of(new StateHookRule(TABLES), new TemplateRule(TABLES)));

        ComponentIr ir = t.transform(counter());

        assertTrue(ir.componentClass.hasProperty("count"));
        assertEquals("", ir.componentClass.name);
        assertTrue(ir.template.bindings.isEmpty());
        assertFalse(ir.template.elements.isEmpty());
    }

    @Test
    void missingComponentGivesEmptyIrAndWarning() {
        TransformWarnings warnings = new TransformWarnings();
        ComponentIr ir = new ReactToAngularTransformer().transform(program(stmt(call("setup"))), warnings);

        assertTrue(ir.isEmpty());
        assertTrue(ir.setterMap.isEmpty());
        assertEquals(1, warnings.toDeterministicList().size());
        assertEquals(TransformWarning.MISSING_COMPONENT, warnings.toDeterministicList().get(0).code);
    }

    @Test
    void repeatedCallsProduceIdenticalIr() throws Exception {
        ReactToAngularTransformer t = new ReactToAngularTransformer();

        String first = IrJson.toJsonString(t.transform(counter()));
        String second = IrJson.toJsonString(t.transform(counter()));

        assertEquals(first, second);
        assertTrue(first.contains("\"el-1\""));
    }

    @Test
    void failingRuleIsDowngradedToWarning() {
        TransformWarnings warnings = new TransformWarnings();
        ReactToAngularTransformer t = new ReactToAngularTransformer(List.of(
                new StateHookRule(TABLES),
                new ExplodingRule(),
                new TemplateRule(TABLES),
                new EventRule(TABLES)));

        ComponentIr ir = t.transform(counter(), warnings);

        assertTrue(warnings.contains(TransformWarning.RULE_FAILED));
        TransformWarning w = warnings.toDeterministicList().get(0);
        assertEquals("COMPONENT", w.context.get("stage"));
        assertEquals("boom", w.context.get("error"));
        assertEquals("Partial", ir.componentClass.name);
        assertTrue(ir.componentClass.hasProperty("count"));
        assertEquals(1, ir.template.bindings.size());
        assertEquals("count = count + step", ir.template.bindings.get(0).handler);
    }
}
