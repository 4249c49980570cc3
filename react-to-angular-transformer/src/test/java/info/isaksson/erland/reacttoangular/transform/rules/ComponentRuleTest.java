package info.isaksson.erland.reacttoangular.transform.rules;

import info.isaksson.erland.reacttoangular.ast.AssignmentPattern;
import info.isaksson.erland.reacttoangular.ast.FunctionNode;
import info.isaksson.erland.reacttoangular.ast.JsNode;
import info.isaksson.erland.reacttoangular.ast.JsNodeKind;
import info.isaksson.erland.reacttoangular.ast.ObjectExpression;
import info.isaksson.erland.reacttoangular.ast.Program;
import info.isaksson.erland.reacttoangular.ir.ComponentIr;
import info.isaksson.erland.reacttoangular.ir.IrMethod;
import info.isaksson.erland.reacttoangular.ir.IrProperty;
import info.isaksson.erland.reacttoangular.transform.ReactToAngularTransformer;
import org.junit.jupiter.api.Test;

import java.util.List;

import static info.isaksson.erland.reacttoangular.transform.JsBuilder.*;
import static org.junit.jupiter.api.Assertions.*;

public class ComponentRuleTest {

    private final ReactToAngularTransformer transformer = new ReactToAngularTransformer();

    private static IrMethod method(ComponentIr ir, String name) {
        return ir.componentClass.methods.stream()
                .filter(m -> m.name.equals(name))
                .findFirst()
                .orElseThrow(() -> new AssertionError("missing method " + name));
    }

    @Test
    void usesDeclaredComponentName() {
        ComponentIr ir = transformer.transform(component("TodoList", List.of(), ret(el("ul"))));
        assertEquals("TodoList", ir.componentClass.name);
    }

    @Test
    void capitalisedConstantComponentIsFound() {
        Program p = program(
                constDecl("helper", arrow(num(1))),
                constDecl("TodoApp", arrow(el("div"))));

        ComponentIr ir = transformer.transform(p);

        assertEquals("TodoApp", ir.componentClass.name);
    }

    @Test
    void anonymousDefaultExportFallsBackToDefaultName() {
        ComponentIr ir = transformer.transform(program(exportDefault(arrow(el("div")))));
        assertEquals("MyComponent", ir.componentClass.name);
    }

    @Test
    void identifierParameterBecomesSingleInput() {
        ComponentIr ir = transformer.transform(component("Card", List.of(id("props")), ret(el("div"))));

        assertEquals(1, ir.componentClass.properties.size());
        IrProperty props = ir.componentClass.properties.get(0);
        assertEquals("props", props.name);
        assertEquals("any", props.type);
        assertEquals("@Input()", props.decorator);
        assertEquals("", props.initialValue);
    }

    @Test
    void parameterWithDefaultObjectBehavesLikeIdentifier() {
        JsNode param = new AssignmentPattern(id("props"), new ObjectExpression(List.of()));
        ComponentIr ir = transformer.transform(component("Card", List.of(param), ret(el("div"))));

        assertTrue(ir.componentClass.hasProperty("props"));
    }

    @Test
    void destructuredPropsBecomeInputs() {
        Program p = component("Greeting",
                List.of(props(prop("title"), prop("count", num(1)), alias("label", "text"))),
                ret(el("h1")));

        ComponentIr ir = transformer.transform(p);

        List<IrProperty> props = ir.componentClass.properties;
        assertEquals(3, props.size());

        assertEquals("title", props.get(0).name);
        assertEquals("any", props.get(0).type);
        assertEquals("@Input()", props.get(0).decorator);

        assertEquals("count", props.get(1).name);
        assertEquals("number", props.get(1).type);
        assertEquals("1", props.get(1).initialValue);

        assertEquals("text", props.get(2).name);
        assertEquals("@Input('label')", props.get(2).decorator);
    }

    @Test
    void stateWinsOverInputWithSameName() {
        Program p = component("Field",
                List.of(props(prop("value"))),
                useState("value", "setValue", num(3)),
                ret(el("div")));

        ComponentIr ir = transformer.transform(p);

        assertEquals(1, ir.componentClass.properties.size());
        IrProperty value = ir.componentClass.properties.get(0);
        assertEquals("number", value.type);
        assertNull(value.decorator);
    }

    @Test
    void localFunctionsBecomeMethods() {
        FunctionNode asyncLoad = new FunctionNode(JsNodeKind.FUNCTION_DECLARATION, id("load"), List.of(),
                block(stmt(call("fetchAll"))), true);
        Program p = component("Counter", List.of(),
                useState("count", "setCount", num(0)),
                constDecl("increment", arrow(call("setCount", bin("+", id("count"), num(1))))),
                function("reset", List.of(), stmt(call("setCount", num(0)))),
                constDecl("save", call("useCallback", arrow(call("persist", id("x")), "x"), array())),
                constDecl("limit", num(3)),
                asyncLoad,
                ret(el("div")));

        ComponentIr ir = transformer.transform(p);

        assertEquals(List.of("increment", "reset", "save", "load"),
                ir.componentClass.methods.stream().map(m -> m.name).collect(java.util.stream.Collectors.toList()));

        IrMethod increment = method(ir, "increment");
        assertTrue(increment.parameters.isEmpty());
        assertEquals("setCount(count + 1)", increment.body);
        assertEquals(IrMethod.VOID, increment.returnType);

        assertEquals("setCount(0)", method(ir, "reset").body);

        IrMethod save = method(ir, "save");
        assertEquals(List.of("x"), save.parameters);
        assertEquals("persist(x)", save.body);

        IrMethod load = method(ir, "load");
        assertTrue(load.isAsync());
        assertEquals("fetchAll()", load.body);
    }

    @Test
    void nestedFunctionsAreNotMethods() {
        Program p = component("Outer", List.of(),
                function("helper", List.of(), constDecl("inner", arrow(num(1))), ret(num(2))),
                ret(el("div")));

        ComponentIr ir = transformer.transform(p);

        assertEquals(1, ir.componentClass.methods.size());
        assertEquals("helper", ir.componentClass.methods.get(0).name);
        assertEquals("const inner = () => 1\nreturn 2", ir.componentClass.methods.get(0).body);
    }
}
