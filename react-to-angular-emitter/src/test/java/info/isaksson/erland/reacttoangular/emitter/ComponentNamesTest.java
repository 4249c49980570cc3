package info.isaksson.erland.reacttoangular.emitter;

import info.isaksson.erland.reacttoangular.ir.ComponentIr;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ComponentNamesTest {

    @Test
    void pascalAndKebabCase() {
        assertEquals("TodoBox", ComponentNames.pascalCase("TodoBox"));
        assertEquals("TodoBox", ComponentNames.pascalCase("todo-box"));
        assertEquals("UserProfileCard", ComponentNames.pascalCase("user_profile card"));

        assertEquals("todo-box", ComponentNames.kebabCase("TodoBox"));
        assertEquals("counter", ComponentNames.kebabCase("Counter"));
        assertEquals("html-view", ComponentNames.kebabCase("HTMLView"));
        assertEquals("todo-box", ComponentNames.kebabCase("todo-box"));
    }

    @Test
    void classSelectorAndFileNames() {
        assertEquals("TodoBoxComponent", ComponentNames.className("TodoBox"));
        assertEquals("app-todo-box", ComponentNames.selector("app", "TodoBox"));
        assertEquals("TodoBox.component", ComponentNames.fileBaseName("TodoBox"));
    }

    @Test
    void cssPropertiesBecomeKebabCase() {
        assertEquals("background-color", ComponentNames.cssProperty("backgroundColor"));
        assertEquals("font-size", ComponentNames.cssProperty("font-size"));
        assertEquals("-webkit-transition", ComponentNames.cssProperty("WebkitTransition"));
        assertEquals("--mainColor", ComponentNames.cssProperty("--mainColor"));
    }

    @Test
    void resolvePrefersExplicitThenIrThenDefault() {
        ComponentIr ir = new ComponentIr();
        assertEquals("MyComponent", ComponentNames.resolve(null, ir));

        ir.componentClass.name = "Counter";
        assertEquals("Counter", ComponentNames.resolve("  ", ir));
        assertEquals("Clicker", ComponentNames.resolve("Clicker", ir));
    }
}
