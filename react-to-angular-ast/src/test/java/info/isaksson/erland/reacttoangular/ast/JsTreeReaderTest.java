package info.isaksson.erland.reacttoangular.ast;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class JsTreeReaderTest {

    @Test
    void readsEstreeUseStateDeclaration() throws Exception {
        Program program = JsTreeReader.readFromString("""
                {"type":"Program","body":[
                  {"type":"VariableDeclaration","kind":"const","declarations":[
                    {"type":"VariableDeclarator",
                     "id":{"type":"ArrayPattern","elements":[
                        {"type":"Identifier","name":"count"},
                        {"type":"Identifier","name":"setCount"}]},
                     "init":{"type":"CallExpression",
                        "callee":{"type":"Identifier","name":"useState"},
                        "arguments":[{"type":"Literal","value":0,"raw":"0"}]}}]}]}
                """);

        assertEquals(1, program.body.size());
        VariableDeclaration decl = (VariableDeclaration) program.body.get(0);
        assertEquals("const", decl.declarationKind);
        VariableDeclarator d = decl.declarations.get(0);
        ArrayPattern pattern = (ArrayPattern) d.id;
        assertEquals("count", ((Identifier) pattern.elements.get(0)).name);
        assertTrue(JsTrees.isCallTo(d.init, "useState"));
        Literal zero = (Literal) ((CallExpression) d.init).arguments.get(0);
        assertEquals(LiteralKind.NUMBER, zero.literalKind);
        assertEquals("0", JsPrinter.expression(zero));
    }

    @Test
    void unwrapsBabelFileRootAndAcceptsBabelLiterals() throws Exception {
        Program program = JsTreeReader.readFromString("""
                {"type":"File","program":{"type":"Program","body":[
                  {"type":"ExpressionStatement","expression":
                    {"type":"ParenthesizedExpression","expression":
                      {"type":"StringLiteral","value":"hi","extra":{"raw":"\\"hi\\""}}}},
                  {"type":"ExpressionStatement","expression":{"type":"BooleanLiteral","value":true}},
                  {"type":"ExpressionStatement","expression":{"type":"NullLiteral"}}
                ]}}
                """);

        assertEquals(3, program.body.size());
        Literal s = (Literal) ((ExpressionStatement) program.body.get(0)).expression;
        assertTrue(s.isString());
        assertEquals("hi", s.stringValue());
        assertEquals("true", JsPrinter.statement(program.body.get(1)));
        assertEquals("null", JsPrinter.statement(program.body.get(2)));
    }

    @Test
    void unknownNodeTypesBecomeUnsupported() throws Exception {
        Program program = JsTreeReader.readFromString("""
                {"type":"Program","body":[{"type":"ClassDeclaration","id":{"type":"Identifier","name":"A"}}]}
                """);

        JsNode node = program.body.get(0);
        assertEquals(JsNodeKind.UNSUPPORTED, node.kind());
        assertEquals("ClassDeclaration", ((Unsupported) node).type);
        assertEquals("", JsPrinter.statement(node));
    }

    @Test
    void readsJsxElementWithAttributesAndChildren() throws Exception {
        Program program = JsTreeReader.readFromString("""
                {"type":"Program","body":[{"type":"ExpressionStatement","expression":
                  {"type":"JSXElement",
                   "openingElement":{"type":"JSXOpeningElement","selfClosing":false,
                     "name":{"type":"JSXIdentifier","name":"button"},
                     "attributes":[
                       {"type":"JSXAttribute","name":{"type":"JSXIdentifier","name":"className"},
                        "value":{"type":"StringLiteral","value":"btn"}},
                       {"type":"JSXAttribute","name":{"type":"JSXIdentifier","name":"disabled"},"value":null},
                       {"type":"JSXSpreadAttribute","argument":{"type":"Identifier","name":"rest"}}]},
                   "children":[
                     {"type":"JSXText","value":"  Go  "},
                     {"type":"JSXExpressionContainer","expression":{"type":"Identifier","name":"label"}}]}}]}
                """);

        JsxElement button = (JsxElement) ((ExpressionStatement) program.body.get(0)).expression;
        assertEquals("button", button.name);
        assertEquals(3, button.attributes.size());
        JsxAttribute cls = (JsxAttribute) button.attributes.get(0);
        assertEquals("className", cls.name);
        assertEquals("btn", ((Literal) cls.value).stringValue());
        assertNull(((JsxAttribute) button.attributes.get(1)).value);
        assertTrue(button.attributes.get(2) instanceof JsxSpreadAttribute);
        assertEquals(2, button.children.size());
        assertEquals("  Go  ", ((JsxText) button.children.get(0)).value);
    }

    @Test
    void invalidJsonIsUnparsable() {
        assertThrows(UnparsableInputException.class, () -> JsTreeReader.readFromString("{\"type\": "));
    }

    @Test
    void rootWithoutTypeIsUnparsable() {
        assertThrows(UnparsableInputException.class, () -> JsTreeReader.readFromString("{\"body\": []}"));
        assertThrows(UnparsableInputException.class, () -> JsTreeReader.readFromString("[1, 2]"));
    }

    @Test
    void bareStatementRootIsWrappedInProgram() throws Exception {
        Program program = JsTreeReader.readFromString("""
                {"type":"ReturnStatement","argument":{"type":"Identifier","name":"x"}}
                """);
        assertEquals(1, program.body.size());
        assertEquals("return x", JsPrinter.statement(program.body.get(0)));
    }
}
