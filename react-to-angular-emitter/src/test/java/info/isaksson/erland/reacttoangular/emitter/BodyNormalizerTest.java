package info.isaksson.erland.reacttoangular.emitter;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class BodyNormalizerTest {

    private static final Map<String, String> SETTERS = Map.of(
            "setCount", "count",
            "setItems", "items",
            "setName", "name",
            "setOpen", "open");

    private static String normalize(String body, String... known) {
        return BodyNormalizer.normalize(body, List.of(known), SETTERS);
    }

    @Test
    void setterCallBecomesQualifiedAssignment() {
        assertEquals("this.count = this.count + 1;", normalize("setCount(count + 1)", "count"));
    }

    @Test
    void appendingSpreadBecomesPush() {
        assertEquals("this.items.push(this.text);", normalize("setItems([...items, text])", "items", "text"));
        assertEquals("this.items.push('new');", normalize("setItems([...items, 'new'])", "items"));
    }

    @Test
    void appendingComplexValueKeepsSpreadAssignment() {
        assertEquals("this.items = [...this.items, { id: 1 }];", normalize("setItems([...items, { id: 1 }])", "items"));
    }

    @Test
    void spreadOperandsAreQualified() {
        assertEquals("const all = [...this.items, extra];", normalize("const all = [...items, extra]", "items"));
        assertEquals("this.items = [newItem, ...this.items];", normalize("setItems([newItem, ...items])", "items"));
        assertEquals("this.items = [...this.items, 'x'];", normalize("setItems(prev => [...prev, 'x'])", "items"));
        assertEquals("const copy = [...form.items];", normalize("const copy = [...form.items]", "items"));
    }

    @Test
    void objectLiteralKeysAreNotQualified() {
        assertEquals("this.save({ text: this.input, count: this.count });",
                normalize("save({ text: input, count })", "text", "input", "count", "save"));
        assertEquals("return { count: this.count }", normalize("return { count }", "count"));
        assertEquals("const v = ok ? this.count : 0;", normalize("const v = ok ? count : 0", "count"));
    }

    @Test
    void updaterFunctionIsInlined() {
        assertEquals("this.count = this.count + 1;", normalize("setCount(c => c + 1)", "count"));
        assertEquals("this.count = this.count * 2;", normalize("setCount((prev) => prev * 2)", "count"));
    }

    @Test
    void setterWithoutArgumentAssignsUndefined() {
        assertEquals("this.open = undefined;", normalize("setOpen()", "open"));
    }

    @Test
    void nestedSetterCallsAreRewritten() {
        assertEquals("this.name = this.name.trim();", normalize("setName(name.trim())", "name"));
    }

    @Test
    void stringLiteralsAreNotQualified() {
        assertEquals("this.name = 'count';", normalize("setName('count')", "count", "name"));
        assertEquals("console.log(\"count is\", this.count);", normalize("console.log(\"count is\", count)", "count"));
    }

    @Test
    void memberPositionsAndLongerNamesAreRespected() {
        assertEquals("this.items.map(x => x.item);", normalize("items.map(x => x.item)", "item", "items"));
        assertEquals("api.setCount(1);", normalize("api.setCount(1)", "count"));
    }

    @Test
    void methodNamesAreQualifiedToo() {
        assertEquals("this.reset();\nthis.count = 0;", normalize("reset()\nsetCount(0)", "count", "reset"));
    }

    @Test
    void blocksAndCommentsDoNotGetTerminators() {
        String body = "if (ok) {\n  save()\n} else {\n  // nothing\n}";
        assertEquals("if (ok) {\n  this.save();\n} else {\n  // nothing\n}", normalize(body, "save"));
    }

    @Test
    void doubledQualifierCollapses() {
        assertEquals("this.count = 1;", normalize("this.this.count = 1", "count"));
    }

    @Test
    void localsShadowingPropertiesAreQualified() {
        assertEquals("const this.count = 5;", normalize("const count = 5", "count"));
    }

    @Test
    void emptyBodyStaysEmpty() {
        assertEquals("", BodyNormalizer.normalize(null, List.of("a"), SETTERS));
        assertEquals("", BodyNormalizer.normalize("  ", List.of("a"), SETTERS));
        assertEquals("run();", BodyNormalizer.normalize("run()", null, null));
    }
}
