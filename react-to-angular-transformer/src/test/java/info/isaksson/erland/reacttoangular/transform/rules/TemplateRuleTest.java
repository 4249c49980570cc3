package info.isaksson.erland.reacttoangular.transform.rules;

import info.isaksson.erland.reacttoangular.ast.ConditionalExpression;
import info.isaksson.erland.reacttoangular.ast.IfStatement;
import info.isaksson.erland.reacttoangular.ast.JsxSpreadAttribute;
import info.isaksson.erland.reacttoangular.ast.Literal;
import info.isaksson.erland.reacttoangular.ast.LiteralKind;
import info.isaksson.erland.reacttoangular.ast.LogicalExpression;
import info.isaksson.erland.reacttoangular.ast.ObjectExpression;
import info.isaksson.erland.reacttoangular.ast.Program;
import info.isaksson.erland.reacttoangular.ast.Property;
import info.isaksson.erland.reacttoangular.ast.TemplateLiteral;
import info.isaksson.erland.reacttoangular.ir.ComponentIr;
import info.isaksson.erland.reacttoangular.ir.IrAttribute;
import info.isaksson.erland.reacttoangular.ir.IrElement;
import info.isaksson.erland.reacttoangular.ir.IrInterpolation;
import info.isaksson.erland.reacttoangular.ir.IrRepeat;
import info.isaksson.erland.reacttoangular.ir.IrText;
import info.isaksson.erland.reacttoangular.transform.ReactToAngularTransformer;
import info.isaksson.erland.reacttoangular.transform.TransformWarning;
import info.isaksson.erland.reacttoangular.transform.TransformWarnings;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static info.isaksson.erland.reacttoangular.transform.JsBuilder.*;
import static org.junit.jupiter.api.Assertions.*;

public class TemplateRuleTest {

    private final ReactToAngularTransformer transformer = new ReactToAngularTransformer();

    private ComponentIr render(TransformWarnings warnings, info.isaksson.erland.reacttoangular.ast.JsNode markup) {
        Program p = component("View", List.of(), ret(markup));
        return transformer.transform(p, warnings);
    }

    private ComponentIr render(info.isaksson.erland.reacttoangular.ast.JsNode markup) {
        return render(new TransformWarnings(), markup);
    }

    private static IrElement root(ComponentIr ir) {
        assertEquals(1, ir.template.elements.size());
        return ir.template.elements.get(0);
    }

    @Test
    void attributesAreMappedAndClassified() {
        TransformWarnings warnings = new TransformWarnings();
        ObjectExpression style = new ObjectExpression(List.of(new Property(id("color"), str("red"), false, false)));
        TemplateLiteral title = new TemplateLiteral(List.of("Hi ", ""), List.of(id("name")));

        ComponentIr ir = render(warnings, el("div", List.of(
                attr("key", id("k")),
                attr("className", str("box")),
                attr("onClick", id("go")),
                bareAttr("hidden"),
                attr("id", id("itemId")),
                attr("title", title),
                attr("style", style),
                attr("disabled", id("busy")),
                attr("readOnly", id("locked")),
                new JsxSpreadAttribute(id("rest")))));

        IrElement div = root(ir);
        assertEquals(List.of(
                IrAttribute.literal("class", "box"),
                IrAttribute.bare("hidden"),
                IrAttribute.interpolated("id", "itemId"),
                IrAttribute.literal("title", "Hi {{ name }}")), div.attributes);
        assertEquals(Map.of("ngStyle", "{ color: 'red' }", "disabled", "busy", "readonly", "locked"), div.propertyBindings);
        assertEquals(List.of("ngStyle", "disabled", "readonly"), List.copyOf(div.propertyBindings.keySet()));
        assertTrue(warnings.contains(TransformWarning.SPREAD_ATTRIBUTE));
    }

    @Test
    void elementIdsFollowDocumentOrder() {
        ComponentIr ir = render(el("div",
                el("header", el("h1", text("Title"))),
                el("main")));

        List<String> ids = ir.template.allElements().stream().map(e -> e.id).collect(Collectors.toList());
        List<String> tags = ir.template.allElements().stream().map(e -> e.tag).collect(Collectors.toList());
        assertEquals(List.of("el-1", "el-2", "el-3", "el-4"), ids);
        assertEquals(List.of("div", "header", "h1", "main"), tags);
    }

    @Test
    void listRenderingPutsRepeatOnReturnedElement() {
        ComponentIr ir = render(el("ul",
                expr(call(member("items", "map"), arrow(el("li", expr(id("x"))), "x", "i")))));

        IrElement ul = root(ir);
        assertEquals(1, ul.children.size());
        IrElement li = ul.childElements().get(0);
        assertEquals("li", li.tag);
        assertEquals(new IrRepeat("items", "x", "i"), li.repeat);
        assertEquals(1, li.children.size());
        assertEquals("x", ((IrInterpolation) li.children.get(0)).expression);
    }

    @Test
    void listCallbackWithoutMarkupGetsPlaceholder() {
        TransformWarnings warnings = new TransformWarnings();
        ComponentIr ir = render(warnings, el("div",
                el("ul", expr(call(member("items", "map"), id("renderItem")))),
                expr(call(member("rows", "map"), id("renderRow")))));

        IrElement div = root(ir);
        IrElement ul = div.childElements().get(0);
        IrElement li = ul.childElements().get(0);
        assertEquals("li", li.tag);
        assertEquals(new IrRepeat("items", "item", "index"), li.repeat);
        assertEquals("item", ((IrInterpolation) li.children.get(0)).expression);

        IrElement row = div.childElements().get(1);
        assertEquals("div", row.tag);
        assertEquals("rows", row.repeat.array);
        assertTrue(warnings.contains(TransformWarning.LIST_CALLBACK));
    }

    @Test
    void logicalAndBecomesCondition() {
        ComponentIr ir = render(el("div",
                expr(new LogicalExpression("&&", id("open"), el("p", text("Hi"))))));

        IrElement p = root(ir).childElements().get(0);
        assertEquals("p", p.tag);
        assertEquals("open", p.condition);
        assertEquals("Hi", ((IrText) p.children.get(0)).text);
    }

    @Test
    void ternaryBecomesComplementaryConditions() {
        ComponentIr ir = render(el("div",
                expr(new ConditionalExpression(id("ok"), el("span"), el("em"))),
                expr(new ConditionalExpression(id("busy"), el("i"), new Literal(LiteralKind.NULL, null, "null")))));

        List<IrElement> kids = root(ir).childElements();
        assertEquals(3, kids.size());
        assertEquals("ok", kids.get(0).condition);
        assertEquals("!(ok)", kids.get(1).condition);
        assertEquals("busy", kids.get(2).condition);
    }

    @Test
    void ternaryWithTextBranchesUsesContainers() {
        ComponentIr ir = render(el("p",
                expr(new ConditionalExpression(id("done"), str("Done"), el("b", text("Pending"))))));

        List<IrElement> kids = root(ir).childElements();
        assertEquals("ng-container", kids.get(0).tag);
        assertEquals("done", kids.get(0).condition);
        assertEquals("Done", ((IrText) kids.get(0).children.get(0)).text);
        assertEquals("b", kids.get(1).tag);
        assertEquals("!(done)", kids.get(1).condition);
    }

    @Test
    void rootFragmentBecomesContainerAndNestedFragmentsFlatten() {
        ComponentIr ir = render(fragment(
                el("h1"),
                fragment(el("p"), el("p"))));

        IrElement container = root(ir);
        assertEquals("ng-container", container.tag);
        assertEquals(List.of("h1", "p", "p"),
                container.childElements().stream().map(e -> e.tag).collect(Collectors.toList()));
    }

    @Test
    void textIsNormalisedAndExpressionsInterpolated() {
        ComponentIr ir = render(el("p",
                text("\n    Hello\n    world   \n"),
                expr(member("user", "name"))));

        IrElement p = root(ir);
        assertEquals(2, p.children.size());
        assertEquals("Hello world", ((IrText) p.children.get(0)).text);
        assertEquals("user.name", ((IrInterpolation) p.children.get(1)).expression);
    }

    @Test
    void whitespaceInsideALineIsKept() {
        ComponentIr ir = render(el("p", text("Count: "), expr(id("count"))));

        IrElement p = root(ir);
        assertEquals("Count: ", ((IrText) p.children.get(0)).text);
        assertEquals("count", ((IrInterpolation) p.children.get(1)).expression);
    }

    @Test
    void earlyReturnIsReportedAndLastReturnWins() {
        TransformWarnings warnings = new TransformWarnings();
        Program p = component("Loader", List.of(),
                new IfStatement(id("loading"), block(ret(el("p", text("Loading")))), null),
                ret(el("div")));

        ComponentIr ir = transformer.transform(p, warnings);

        assertEquals("div", root(ir).tag);
        assertTrue(warnings.contains(TransformWarning.EARLY_RETURN));
    }

    @Test
    void componentWithoutMarkupHasEmptyTemplate() {
        TransformWarnings warnings = new TransformWarnings();
        ComponentIr ir = transformer.transform(component("Logic", List.of(), ret(num(1))), warnings);

        assertTrue(ir.template.elements.isEmpty());
        assertTrue(warnings.contains(TransformWarning.NO_TEMPLATE));
        assertEquals("Logic", ir.componentClass.name);
    }

    @Test
    void nonElementRootIsWrapped() {
        ComponentIr ir = render(new LogicalExpression("&&", id("show"), fragment(text("a"), el("b"))));

        IrElement wrapper = root(ir);
        assertEquals("ng-container", wrapper.tag);
        assertEquals("show", wrapper.condition);
        assertEquals(2, wrapper.children.size());
    }
}
