package info.isaksson.erland.reacttoangular.ast;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads a JSON syntax tree (ESTree or Babel flavour) into typed {@link JsNode} objects.
 *
 * <p>The reader is lenient about the shape of individual nodes: missing fields become null/empty and
 * unknown node types become {@link Unsupported}. Only malformed JSON or a root without a {@code type}
 * is rejected.</p>
 */
public final class JsTreeReader {

    private static final Logger LOG = LoggerFactory.getLogger(JsTreeReader.class);

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private JsTreeReader() {}

    public static Program read(Path path) throws IOException {
        if (path == null) throw new IllegalArgumentException("path is null");
        try (InputStream in = Files.newInputStream(path)) {
            return read(in, path.toString());
        }
    }

    public static Program read(InputStream in, String origin) throws IOException {
        if (in == null) throw new IllegalArgumentException("input stream is null");
        final JsonNode root;
        try {
            root = MAPPER.readTree(in);
        } catch (JsonProcessingException e) {
            throw new UnparsableInputException("Invalid JSON in " + origin + ": " + e.getOriginalMessage(), e);
        }
        return toProgram(root, origin);
    }

    public static Program readFromString(String json) throws UnparsableInputException {
        if (json == null) throw new IllegalArgumentException("json is null");
        final JsonNode root;
        try {
            root = MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new UnparsableInputException("Invalid JSON: " + e.getOriginalMessage(), e);
        }
        return toProgram(root, "<string>");
    }

    private static Program toProgram(JsonNode root, String origin) throws UnparsableInputException {
        if (root == null || !root.isObject() || !root.hasNonNull("type")) {
            throw new UnparsableInputException("Syntax tree root has no 'type' discriminator: " + origin);
        }
        JsonNode cur = root;
        if ("File".equals(cur.path("type").asText())) {
            cur = cur.path("program");
            if (!cur.isObject() || !cur.hasNonNull("type")) {
                throw new UnparsableInputException("File node without a program: " + origin);
            }
        }
        JsNode node = convert(cur);
        if (node instanceof Program) return (Program) node;
        // A bare statement or expression is treated as a one-statement module.
        return new Program(List.of(node));
    }

    /** Converts one JSON node. Returns {@code null} for JSON null or missing nodes. */
    static JsNode convert(JsonNode n) {
        if (n == null || n.isNull() || n.isMissingNode()) return null;
        if (!n.isObject()) return new Unsupported(n.getNodeType().name());
        String type = n.path("type").asText("");
        switch (type) {
            case "Program":
                return new Program(list(n.path("body")));
            case "ExportNamedDeclaration":
                return new ExportDeclaration(convert(n.get("declaration")), false);
            case "ExportDefaultDeclaration":
                return new ExportDeclaration(convert(n.get("declaration")), true);
            case "FunctionDeclaration":
                return function(JsNodeKind.FUNCTION_DECLARATION, n);
            case "FunctionExpression":
                return function(JsNodeKind.FUNCTION_EXPRESSION, n);
            case "ArrowFunctionExpression":
                return function(JsNodeKind.ARROW_FUNCTION_EXPRESSION, n);
            case "VariableDeclaration": {
                List<VariableDeclarator> decls = new ArrayList<>();
                for (JsonNode d : n.path("declarations")) {
                    JsNode c = convert(d);
                    if (c instanceof VariableDeclarator) decls.add((VariableDeclarator) c);
                }
                return new VariableDeclaration(n.path("kind").asText("const"), decls);
            }
            case "VariableDeclarator":
                return new VariableDeclarator(convert(n.get("id")), convert(n.get("init")));
            case "ArrayPattern":
                return new ArrayPattern(listWithHoles(n.path("elements")));
            case "ObjectPattern":
                return new ObjectPattern(list(n.path("properties")));
            case "AssignmentPattern":
                return new AssignmentPattern(convert(n.get("left")), convert(n.get("right")));
            case "RestElement":
                return new RestElement(convert(n.get("argument")));
            case "BlockStatement":
                return new BlockStatement(list(n.path("body")));
            case "ExpressionStatement":
                return new ExpressionStatement(convert(n.get("expression")));
            case "ReturnStatement":
                return new ReturnStatement(convert(n.get("argument")));
            case "IfStatement":
                return new IfStatement(convert(n.get("test")), convert(n.get("consequent")), convert(n.get("alternate")));
            case "TryStatement": {
                JsonNode handler = n.path("handler");
                BlockStatement catchBody = handler.isObject() ? block(handler.get("body")) : null;
                return new TryStatement(block(n.get("block")),
                        handler.isObject() ? convert(handler.get("param")) : null,
                        catchBody,
                        block(n.get("finalizer")));
            }
            case "CallExpression":
            case "OptionalCallExpression":
                return new CallExpression(convert(n.get("callee")), list(n.path("arguments")), n.path("optional").asBoolean(false));
            case "MemberExpression":
            case "OptionalMemberExpression":
                return new MemberExpression(convert(n.get("object")), convert(n.get("property")),
                        n.path("computed").asBoolean(false), n.path("optional").asBoolean(false));
            case "Identifier":
                return new Identifier(n.path("name").asText(""));
            case "Literal":
                return estreeLiteral(n);
            case "StringLiteral":
                return new Literal(LiteralKind.STRING, n.path("value").asText(""), raw(n));
            case "NumericLiteral":
                return new Literal(LiteralKind.NUMBER, n.path("value").numberValue(), raw(n));
            case "BooleanLiteral":
                return new Literal(LiteralKind.BOOLEAN, n.path("value").asBoolean(false), raw(n));
            case "NullLiteral":
                return new Literal(LiteralKind.NULL, null, "null");
            case "RegExpLiteral":
                return new Literal(LiteralKind.REGEX, null, "/" + n.path("pattern").asText("") + "/" + n.path("flags").asText(""));
            case "BigIntLiteral":
                return new Literal(LiteralKind.BIGINT, n.path("value").asText(""), raw(n));
            case "TemplateLiteral": {
                List<String> quasis = new ArrayList<>();
                for (JsonNode q : n.path("quasis")) {
                    JsonNode value = q.path("value");
                    JsonNode cooked = value.get("cooked");
                    quasis.add(cooked != null && !cooked.isNull() ? cooked.asText() : value.path("raw").asText(""));
                }
                return new TemplateLiteral(quasis, list(n.path("expressions")));
            }
            case "BinaryExpression":
                return new BinaryExpression(n.path("operator").asText(""), convert(n.get("left")), convert(n.get("right")));
            case "LogicalExpression":
                return new LogicalExpression(n.path("operator").asText(""), convert(n.get("left")), convert(n.get("right")));
            case "UnaryExpression":
                return new UnaryExpression(n.path("operator").asText(""), convert(n.get("argument")));
            case "UpdateExpression":
                return new UpdateExpression(n.path("operator").asText(""), convert(n.get("argument")), n.path("prefix").asBoolean(false));
            case "AssignmentExpression":
                return new AssignmentExpression(n.path("operator").asText("="), convert(n.get("left")), convert(n.get("right")));
            case "ConditionalExpression":
                return new ConditionalExpression(convert(n.get("test")), convert(n.get("consequent")), convert(n.get("alternate")));
            case "AwaitExpression":
                return new AwaitExpression(convert(n.get("argument")));
            case "ArrayExpression":
                return new ArrayExpression(listWithHoles(n.path("elements")));
            case "ObjectExpression":
                return new ObjectExpression(list(n.path("properties")));
            case "Property":
            case "ObjectProperty":
                return new Property(convert(n.get("key")), convert(n.get("value")),
                        n.path("computed").asBoolean(false), n.path("shorthand").asBoolean(false));
            case "SpreadElement":
                return new SpreadElement(convert(n.get("argument")));
            case "JSXElement": {
                JsonNode opening = n.path("openingElement");
                return new JsxElement(jsxName(opening.get("name")), list(opening.path("attributes")),
                        list(n.path("children")), opening.path("selfClosing").asBoolean(false));
            }
            case "JSXFragment":
                return new JsxFragment(list(n.path("children")));
            case "JSXAttribute":
                return new JsxAttribute(jsxName(n.get("name")), convert(n.get("value")));
            case "JSXSpreadAttribute":
                return new JsxSpreadAttribute(convert(n.get("argument")));
            case "JSXExpressionContainer":
                return new JsxExpressionContainer(convert(n.get("expression")));
            case "JSXEmptyExpression":
                return new JsxEmptyExpression();
            case "JSXText":
                return new JsxText(n.path("value").asText(""));
            case "ParenthesizedExpression":
            case "ChainExpression":
            case "TSAsExpression":
            case "TSNonNullExpression":
            case "TSSatisfiesExpression":
            case "TypeCastExpression":
                return convert(n.get("expression"));
            default:
                LOG.debug("Unsupported syntax node type '{}'", type);
                return new Unsupported(type);
        }
    }

    private static FunctionNode function(JsNodeKind kind, JsonNode n) {
        JsNode id = convert(n.get("id"));
        return new FunctionNode(kind,
                id instanceof Identifier ? (Identifier) id : null,
                list(n.path("params")),
                convert(n.get("body")),
                n.path("async").asBoolean(false));
    }

    private static BlockStatement block(JsonNode n) {
        JsNode b = convert(n);
        return b instanceof BlockStatement ? (BlockStatement) b : null;
    }

    private static Literal estreeLiteral(JsonNode n) {
        String raw = n.hasNonNull("raw") ? n.get("raw").asText() : null;
        if (n.has("regex")) return new Literal(LiteralKind.REGEX, null, raw);
        if (n.hasNonNull("bigint")) return new Literal(LiteralKind.BIGINT, n.get("bigint").asText(), raw);
        JsonNode v = n.get("value");
        if (v == null || v.isNull()) return new Literal(LiteralKind.NULL, null, raw == null ? "null" : raw);
        if (v.isTextual()) return new Literal(LiteralKind.STRING, v.asText(), raw);
        if (v.isNumber()) return new Literal(LiteralKind.NUMBER, v.numberValue(), raw);
        if (v.isBoolean()) return new Literal(LiteralKind.BOOLEAN, v.asBoolean(), raw);
        return new Literal(LiteralKind.STRING, v.asText(), raw);
    }

    private static String raw(JsonNode n) {
        JsonNode r = n.path("extra").get("raw");
        return r == null || r.isNull() ? null : r.asText();
    }

    private static String jsxName(JsonNode n) {
        if (n == null || n.isNull()) return "";
        String type = n.path("type").asText("");
        switch (type) {
            case "JSXIdentifier":
            case "Identifier":
                return n.path("name").asText("");
            case "JSXNamespacedName":
                return jsxName(n.get("namespace")) + ":" + jsxName(n.get("name"));
            case "JSXMemberExpression":
                return jsxName(n.get("object")) + "." + jsxName(n.get("property"));
            default:
                return n.path("name").asText("");
        }
    }

    private static List<JsNode> list(JsonNode array) {
        List<JsNode> out = new ArrayList<>();
        if (array == null || !array.isArray()) return out;
        for (JsonNode e : array) {
            JsNode c = convert(e);
            if (c != null) out.add(c);
        }
        return out;
    }

    private static List<JsNode> listWithHoles(JsonNode array) {
        List<JsNode> out = new ArrayList<>();
        if (array == null || !array.isArray()) return out;
        for (JsonNode e : array) {
            out.add(convert(e));
        }
        return out;
    }
}
