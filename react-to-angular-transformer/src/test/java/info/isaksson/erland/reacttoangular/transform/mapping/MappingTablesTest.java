package info.isaksson.erland.reacttoangular.transform.mapping;

import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class MappingTablesTest {

    private final MappingTables tables = MappingTables.defaults();

    @Test
    void eventsMapOrFallBackToLowerCasedSuffix() {
        assertEquals("click", tables.event("onClick"));
        assertEquals("dblclick", tables.event("onDoubleClick"));
        assertEquals("mouseenter", tables.event("onMouseEnter"));
        assertEquals("doubletap", tables.event("onDoubleTap"));
        assertEquals("scroll", tables.event("onScroll"));
    }

    @Test
    void attributesMapOrFallBackToLowerCase() {
        assertEquals("class", tables.attribute("className"));
        assertEquals("for", tables.attribute("htmlFor"));
        assertEquals("tabindex", tables.attribute("tabIndex"));
        assertEquals("aria-label", tables.attribute("aria-label"));
    }

    @Test
    void lifecycleAndHooksFallBackToEmpty() {
        assertEquals("ngOnInit", tables.lifecycle("componentDidMount"));
        assertEquals("ngAfterViewChecked", tables.lifecycle("componentDidUpdate"));
        assertEquals("ngOnDestroy", tables.lifecycle("componentWillUnmount"));
        assertEquals("", tables.lifecycle("shouldComponentUpdate"));

        assertEquals("property", tables.hook("useState"));
        assertEquals("method", tables.hook("useCallback"));
        assertEquals("", tables.hook("useReducer"));
    }

    @Test
    void domPropertiesAndListMethods() {
        assertEquals(Optional.of("readonly"), tables.domProperty("readOnly"));
        assertEquals(Optional.of("disabled"), tables.domProperty("disabled"));
        assertTrue(tables.domProperty("title").isEmpty());
        assertTrue(tables.isListMethod("map"));
        assertFalse(tables.isListMethod("forEach"));
    }

    @Test
    void customTablesAreCopied() {
        Map<String, String> events = new java.util.HashMap<>(Map.of("onTap", "tap"));
        MappingTables custom = new MappingTables(Map.of(), Map.of(), events, Map.of(), Map.of(), Set.of("map", "flatMap"));
        events.clear();

        assertEquals("tap", custom.event("onTap"));
        assertTrue(custom.isListMethod("flatMap"));
        assertEquals("", custom.lifecycle("componentDidMount"));
    }
}
