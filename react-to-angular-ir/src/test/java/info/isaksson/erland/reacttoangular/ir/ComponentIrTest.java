package info.isaksson.erland.reacttoangular.ir;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ComponentIrTest {

    @Test
    void elementIdsAreSequentialPerDocument() {
        ComponentIr first = new ComponentIr();
        assertEquals("el-1", first.createElement("div").id);
        assertEquals("el-2", first.createElement("span").id);

        ComponentIr second = new ComponentIr();
        assertEquals("el-1", second.createElement("p").id);
    }

    @Test
    void firstWriterWinsForPropertiesMethodsAndSetters() {
        ComponentIr ir = new ComponentIr();
        assertTrue(ir.addPropertyIfAbsent(IrProperty.field("count", "number", "0")));
        assertFalse(ir.addPropertyIfAbsent(IrProperty.input("count", "any", "")));
        assertEquals("number", ir.componentClass.property("count").orElseThrow().type);

        assertTrue(ir.addMethodIfAbsent(IrMethod.of("save", List.of(), "a()")));
        assertFalse(ir.addMethodIfAbsent(IrMethod.of("save", List.of(), "b()")));
        assertEquals("a()", ir.componentClass.methods.get(0).body);

        assertTrue(ir.registerSetter("setCount", "count"));
        assertFalse(ir.registerSetter("setCount", "other"));
        assertEquals("count", ir.setterMap.get("setCount"));
    }

    @Test
    void lifecycleBodiesAccumulateInOrder() {
        ComponentIr ir = new ComponentIr();
        ir.appendToLifecycleHook("ngOnInit", "load()");
        ir.appendToLifecycleHook("ngOnDestroy", "stop()");
        ir.appendToLifecycleHook("ngOnInit", "track()");

        assertEquals(2, ir.componentClass.lifecycleHooks.size());
        assertEquals("ngOnInit", ir.componentClass.lifecycleHooks.get(0).name);
        assertEquals("load()\ntrack()", ir.componentClass.lifecycleHooks.get(0).body);
    }

    @Test
    void findsNestedElementsById() {
        ComponentIr ir = new ComponentIr();
        IrElement root = ir.createElement("ul");
        IrElement item = ir.createElement("li");
        root.children.add(item);
        ir.template.elements.add(root);

        assertSame(item, ir.findElement("el-2"));
        assertNull(ir.findElement("el-9"));
        assertEquals(List.of(root, item), ir.template.allElements());
        assertFalse(ir.isEmpty());
        assertTrue(new ComponentIr().isEmpty());
    }
}
