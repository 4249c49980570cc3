package info.isaksson.erland.reacttoangular.emitter;

import info.isaksson.erland.reacttoangular.ir.ComponentIr;
import info.isaksson.erland.reacttoangular.ir.IrStyleRule;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class StyleGeneratorTest {

    private final StyleGenerator generator = new StyleGenerator();

    @Test
    void emptyStylesGivePlaceholderComment() {
        assertEquals("/* Styles for Counter component */\n", generator.generate(new ComponentIr(), "Counter"));
    }

    @Test
    void rulesRenderInOrderWithKebabCaseProperties() {
        Map<String, String> box = new LinkedHashMap<>();
        box.put("backgroundColor", "red");
        box.put("font-size", "12px");
        ComponentIr ir = new ComponentIr();
        ir.styles.add(new IrStyleRule(".box", box));
        ir.styles.add(new IrStyleRule(".empty", Map.of()));
        ir.styles.add(new IrStyleRule("h1", Map.of("marginTop", "0")));

        String expected = ""
                + ".box {\n"
                + "  background-color: red;\n"
                + "  font-size: 12px;\n"
                + "}\n"
                + "\n"
                + "h1 {\n"
                + "  margin-top: 0;\n"
                + "}\n";

        assertEquals(expected, generator.generate(ir, "Box"));
    }
}
