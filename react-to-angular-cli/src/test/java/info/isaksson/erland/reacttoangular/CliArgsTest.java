package info.isaksson.erland.reacttoangular;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class CliArgsTest {

    @Test
    void defaults() {
        Main.CliArgs a = Main.CliArgs.parse(new String[] {"in.json"});
        assertEquals("in.json", a.source);
        assertEquals("./output", a.output);
        assertEquals("app", a.selectorPrefix);
        assertTrue(a.formsNote);
        assertTrue(a.handlerStubs);
        assertFalse(a.writeIr);
        assertFalse(a.failOnMissingComponent);
        assertTrue(a.excludes.isEmpty());
    }

    @Test
    void parsesAllFlags() {
        Main.CliArgs a = Main.CliArgs.parse(new String[] {
                "--source", "trees",
                "--output", "out",
                "--exclude", "a/**",
                "--exclude=b",
                "--write-ir",
                "--selector-prefix", "acme",
                "--forms-note", "no",
                "--handler-stubs", "0",
                "--fail-on-missing-component", "yes"
        });
        assertEquals("trees", a.source);
        assertEquals("out", a.output);
        assertEquals(List.of("a/**", "b"), a.excludes);
        assertTrue(a.writeIr);
        assertEquals("acme", a.selectorPrefix);
        assertFalse(a.formsNote);
        assertFalse(a.handlerStubs);
        assertTrue(a.failOnMissingComponent);
    }

    @Test
    void rejectsBadInput() {
        assertThrows(IllegalArgumentException.class, () -> Main.CliArgs.parse(new String[] {"--name"}));
        assertThrows(IllegalArgumentException.class, () -> Main.CliArgs.parse(new String[] {"--name", "--output"}));
        assertThrows(IllegalArgumentException.class, () -> Main.CliArgs.parse(new String[] {"a.json", "b.json"}));
        assertThrows(IllegalArgumentException.class, () -> Main.CliArgs.parse(new String[] {"--source", "a", "--ir", "b"}));
        assertThrows(IllegalArgumentException.class, () -> Main.CliArgs.parse(new String[] {"--handler-stubs", "perhaps"}));
    }
}
