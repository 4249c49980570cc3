package info.isaksson.erland.reacttoangular.emitter;

import info.isaksson.erland.reacttoangular.ir.ComponentIr;
import info.isaksson.erland.reacttoangular.ir.IrBinding;
import info.isaksson.erland.reacttoangular.ir.IrElement;
import info.isaksson.erland.reacttoangular.ir.IrMethod;
import info.isaksson.erland.reacttoangular.ir.IrProperty;
import info.isaksson.erland.reacttoangular.ir.IrRepeat;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ClassGeneratorTest {

    private static ComponentIr counter() {
        ComponentIr ir = new ComponentIr();
        ir.componentClass.name = "Counter";
        ir.addPropertyIfAbsent(IrProperty.field("count", "number", "0"));
        ir.registerSetter("setCount", "count");
        ir.addMethodIfAbsent(IrMethod.of("increment", List.of(), "setCount(count + 1)"));
        ir.appendToLifecycleHook("ngOnInit", "console.log('ready')");
        return ir;
    }

    @Test
    void rendersCompleteCounterClass() {
        String expected = ""
                + "import { Component, OnInit } from '@angular/core';\n"
                + "\n"
                + "@Component({\n"
                + "  selector: 'app-counter',\n"
                + "  templateUrl: './Counter.component.html',\n"
                + "  styleUrls: ['./Counter.component.css']\n"
                + "})\n"
                + "export class CounterComponent implements OnInit {\n"
                + "  count: number = 0;\n"
                + "\n"
                + "  ngOnInit(): void {\n"
                + "    console.log('ready');\n"
                + "  }\n"
                + "\n"
                + "  increment(): void {\n"
                + "    this.count = this.count + 1;\n"
                + "  }\n"
                + "}\n";

        assertEquals(expected, new ClassGenerator().generate(counter(), "Counter"));
    }

    @Test
    void generationIsIdempotent() {
        ComponentIr ir = counter();
        ClassGenerator generator = new ClassGenerator();
        assertEquals(generator.generate(ir, "Counter"), generator.generate(ir, "Counter"));
    }

    @Test
    void importsFollowDecoratorsAndHooks() {
        ComponentIr ir = new ComponentIr();
        ir.addPropertyIfAbsent(IrProperty.input("title", "any", ""));
        ir.addPropertyIfAbsent(new IrProperty("saved", "EventEmitter<string>", "new EventEmitter<string>()", "@Output()"));
        ir.appendToLifecycleHook("ngOnInit", "load()");
        ir.appendToLifecycleHook("ngOnDestroy", "unsubscribe()");

        String ts = new ClassGenerator().generate(ir, "Panel");

        assertTrue(ts.startsWith("import { Component, EventEmitter, Input, OnDestroy, OnInit, Output } from '@angular/core';\n"));
        assertTrue(ts.contains("export class PanelComponent implements OnInit, OnDestroy {\n"));
        assertTrue(ts.contains("  @Input() title: any;\n"));
        assertTrue(ts.contains("  @Output() saved: EventEmitter<string> = new EventEmitter<string>();\n"));
    }

    @Test
    void selectorPrefixAndNamingUseOptions() {
        ComponentIr ir = new ComponentIr();
        String ts = new ClassGenerator(GeneratorOptions.defaults().withSelectorPrefix("my")).generate(ir, "TodoBox");

        assertTrue(ts.contains("  selector: 'my-todo-box',\n"));
        assertTrue(ts.contains("  templateUrl: './TodoBox.component.html',\n"));
        assertTrue(ts.contains("export class TodoBoxComponent {\n}\n"));
    }

    @Test
    void twoWayBindingAddsNoteAndInferredProperty() {
        ComponentIr ir = new ComponentIr();
        IrElement input = ir.createElement("input");
        input.twoWayBinding = "query";
        ir.template.elements.add(input);
        ir.template.bindings.add(IrBinding.twoWay("query", input.id));

        String ts = new ClassGenerator().generate(ir, "Search");

        assertTrue(ts.contains("\n// NOTE: Add FormsModule to your module imports for [(ngModel)]\n"));
        assertTrue(ts.contains("  query: string = '';\n"));

        String bare = new ClassGenerator(GeneratorOptions.defaults().withFormsNote(false).withInferredProperties(false))
                .generate(ir, "Search");
        assertFalse(bare.contains("FormsModule"));
        assertFalse(bare.contains("query"));
    }

    @Test
    void declaredTwoWayPropertyIsNotDuplicated() {
        ComponentIr ir = new ComponentIr();
        ir.addPropertyIfAbsent(IrProperty.field("name", "string", "'Ada'"));
        IrElement input = ir.createElement("input");
        input.twoWayBinding = "name";
        ir.template.elements.add(input);

        String ts = new ClassGenerator().generate(ir, "Form");

        assertTrue(ts.contains("  name: string = 'Ada';\n"));
        assertEquals(ts.indexOf("name: string"), ts.lastIndexOf("name: string"));
    }

    @Test
    void repeatedArraysAreInferred() {
        ComponentIr ir = new ComponentIr();
        IrElement ul = ir.createElement("ul");
        IrElement li = ir.createElement("li");
        li.repeat = new IrRepeat("items", "x", "i");
        ul.children.add(li);
        IrElement row = ir.createElement("div");
        row.repeat = new IrRepeat("props.rows", null, null);
        ul.children.add(row);
        ir.template.elements.add(ul);

        String ts = new ClassGenerator().generate(ir, "List");

        assertTrue(ts.contains("  items: any[] = [];\n"));
        assertFalse(ts.contains("props.rows:"));
    }

    @Test
    void undeclaredHandlersGetStubs() {
        ComponentIr ir = new ComponentIr();
        ir.registerSetter("setCount", "count");
        ir.addPropertyIfAbsent(IrProperty.field("count", "number", "0"));
        ir.addMethodIfAbsent(IrMethod.of("reset", List.of(), "setCount(0)"));
        IrElement button = ir.createElement("button");
        ir.template.elements.add(button);
        ir.template.bindings.add(IrBinding.event("click", "handleClick()", button.id));
        ir.template.bindings.add(IrBinding.event("dblclick", "reset(); track($event)", button.id));
        ir.template.bindings.add(IrBinding.event("focus", "count = count + 1", button.id));

        String ts = new ClassGenerator().generate(ir, "Clicker");

        assertTrue(ts.contains("  handleClick(...args: any[]): void {\n    // handler not found in source component\n  }\n"));
        assertTrue(ts.contains("  track(...args: any[]): void {\n"));
        assertFalse(ts.contains("  reset(...args"));
        assertTrue(ts.contains("  reset(): void {\n    this.count = 0;\n  }\n"));

        String withoutStubs = new ClassGenerator(GeneratorOptions.defaults().withHandlerStubs(false)).generate(ir, "Clicker");
        assertFalse(withoutStubs.contains("handleClick"));
    }

    @Test
    void asyncMethodsAndParameters() {
        ComponentIr ir = new ComponentIr();
        ir.addMethodIfAbsent(new IrMethod("load", List.of(), "await fetchData()", IrMethod.ASYNC_VOID));
        ir.addMethodIfAbsent(IrMethod.of("save", List.of("item", "{ id }"), "persist(item, id)"));

        String ts = new ClassGenerator().generate(ir, "Loader");

        assertTrue(ts.contains("  async load(): Promise<void> {\n    await fetchData();\n  }\n"));
        assertTrue(ts.contains("  save(item: any, { id }): void {\n    persist(item, id);\n  }\n"));
    }
}
