package info.isaksson.erland.reacttoangular.ast;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Conservative source printer for expressions and statements.
 *
 * <p>Output is canonical rather than faithful: strings use single quotes, parentheses are inserted from
 * operator precedence, statements carry no terminators and nested blocks are indented by two spaces.
 * Unsupported nodes print as the empty string.</p>
 */
public final class JsPrinter {

    private static final String INDENT = "  ";

    private static final int PREC_ASSIGN = 2;
    private static final int PREC_CONDITIONAL = 3;
    private static final int PREC_UNARY = 15;
    private static final int PREC_POSTFIX = 16;
    private static final int PREC_MEMBER = 17;
    private static final int PREC_PRIMARY = 18;

    private static final JsPrinter PLAIN = new JsPrinter(Map.of());

    /** Identifier renames applied to value positions; member names and object keys are left alone. */
    private final Map<String, String> renames;

    private JsPrinter(Map<String, String> renames) {
        this.renames = renames;
    }

    /** Prints an expression (or pattern) without surrounding parentheses. */
    public static String expression(JsNode node) {
        return PLAIN.expr(node, 0, 0);
    }

    /** Prints an expression with identifiers renamed, e.g. a handler parameter to {@code $event}. */
    public static String expression(JsNode node, Map<String, String> renames) {
        return printer(renames).expr(node, 0, 0);
    }

    /** Prints a statement; multi-line statements use {@code \n} and two-space nesting. */
    public static String statement(JsNode node) {
        return PLAIN.stmt(node, 0);
    }

    public static String statement(JsNode node, Map<String, String> renames) {
        return printer(renames).stmt(node, 0);
    }

    /**
     * Body text of a function: the block's statements joined by newlines, or the printed expression of an
     * expression-bodied arrow function.
     */
    public static String functionBody(FunctionNode fn) {
        if (fn == null) return "";
        if (fn.body instanceof BlockStatement) {
            return PLAIN.statements(((BlockStatement) fn.body).body, 0);
        }
        return expression(fn.body);
    }

    /** Prints a list of statements at top level, one per line. */
    public static String statements(List<JsNode> statements) {
        return PLAIN.statements(statements, 0);
    }

    private static JsPrinter printer(Map<String, String> renames) {
        return renames == null || renames.isEmpty() ? PLAIN : new JsPrinter(Map.copyOf(renames));
    }

    /** Single-quoted string literal with escapes. */
    public static String quote(String s) {
        StringBuilder sb = new StringBuilder("'");
        for (char c : (s == null ? "" : s).toCharArray()) {
            switch (c) {
                case '\'': sb.append("\\'"); break;
                case '\\': sb.append("\\\\"); break;
                case '\n': sb.append("\\n"); break;
                case '\r': sb.append("\\r"); break;
                case '\t': sb.append("\\t"); break;
                default: sb.append(c);
            }
        }
        return sb.append('\'').toString();
    }

    // ---------------------------------------------------------------------------------------------
    // statements

    private String statements(List<JsNode> list, int depth) {
        List<String> lines = new ArrayList<>();
        for (JsNode s : list) {
            String printed = stmt(s, depth);
            if (!printed.isEmpty()) lines.add(printed);
        }
        String pad = INDENT.repeat(depth);
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < lines.size(); i++) {
            if (i > 0) sb.append('\n');
            sb.append(pad).append(lines.get(i));
        }
        return sb.toString();
    }

    /** Prints one statement; the first line is not indented, continuation lines are. */
    private String stmt(JsNode node, int depth) {
        if (node == null) return "";
        switch (node.kind()) {
            case EXPRESSION_STATEMENT: {
                JsNode e = ((ExpressionStatement) node).expression;
                String s = expr(e, 0, depth);
                if (e instanceof ObjectExpression || (e instanceof FunctionNode && !e.is(JsNodeKind.ARROW_FUNCTION_EXPRESSION))) {
                    return "(" + s + ")";
                }
                return s;
            }
            case VARIABLE_DECLARATION: {
                VariableDeclaration v = (VariableDeclaration) node;
                List<String> parts = new ArrayList<>();
                for (VariableDeclarator d : v.declarations) {
                    parts.add(declarator(d, depth));
                }
                return v.declarationKind + " " + String.join(", ", parts);
            }
            case VARIABLE_DECLARATOR:
                return declarator((VariableDeclarator) node, depth);
            case RETURN_STATEMENT: {
                JsNode arg = ((ReturnStatement) node).argument;
                return arg == null ? "return" : "return " + expr(arg, 0, depth);
            }
            case IF_STATEMENT: {
                IfStatement s = (IfStatement) node;
                StringBuilder sb = new StringBuilder();
                sb.append("if (").append(expr(s.test, 0, depth)).append(") ").append(blockOrStatement(s.consequent, depth));
                if (s.alternate != null) {
                    sb.append(" else ");
                    if (s.alternate instanceof IfStatement) {
                        sb.append(stmt(s.alternate, depth));
                    } else {
                        sb.append(blockOrStatement(s.alternate, depth));
                    }
                }
                return sb.toString();
            }
            case BLOCK_STATEMENT:
                return block((BlockStatement) node, depth);
            case TRY_STATEMENT: {
                TryStatement t = (TryStatement) node;
                StringBuilder sb = new StringBuilder("try ").append(block(t.block, depth));
                if (t.catchBody != null) {
                    sb.append(" catch ");
                    if (t.catchParam != null) sb.append('(').append(expr(t.catchParam, 0, depth)).append(") ");
                    sb.append(block(t.catchBody, depth));
                }
                if (t.finalizer != null) sb.append(" finally ").append(block(t.finalizer, depth));
                return sb.toString();
            }
            case FUNCTION_DECLARATION:
                return function((FunctionNode) node, depth);
            case EXPORT_DECLARATION: {
                ExportDeclaration e = (ExportDeclaration) node;
                String inner = e.declaration == null ? "" : stmt(e.declaration, depth);
                if (inner.isEmpty()) return "";
                return (e.isDefault ? "export default " : "export ") + inner;
            }
            default:
                return expr(node, 0, depth);
        }
    }

    private String declarator(VariableDeclarator d, int depth) {
        String id = expr(d.id, 0, depth);
        return d.init == null ? id : id + " = " + expr(d.init, PREC_ASSIGN, depth);
    }

    private String blockOrStatement(JsNode node, int depth) {
        if (node instanceof BlockStatement) return block((BlockStatement) node, depth);
        return block(new BlockStatement(List.of(node)), depth);
    }

    private String block(BlockStatement b, int depth) {
        if (b == null || b.body.isEmpty()) return "{}";
        return "{\n" + statements(b.body, depth + 1) + "\n" + INDENT.repeat(depth) + "}";
    }

    // ---------------------------------------------------------------------------------------------
    // expressions

    private String expr(JsNode node, int minPrec, int depth) {
        if (node == null) return "";
        String s = exprNoParens(node, depth);
        if (s.isEmpty()) return s;
        return precedence(node) < minPrec ? "(" + s + ")" : s;
    }

    private String exprNoParens(JsNode node, int depth) {
        switch (node.kind()) {
            case IDENTIFIER: {
                String name = ((Identifier) node).name;
                return renames.getOrDefault(name, name);
            }
            case LITERAL:
                return literal((Literal) node);
            case TEMPLATE_LITERAL:
                return templateLiteral((TemplateLiteral) node, depth);
            case ARRAY_EXPRESSION:
            case ARRAY_PATTERN: {
                List<JsNode> elements = node instanceof ArrayExpression
                        ? ((ArrayExpression) node).elements
                        : ((ArrayPattern) node).elements;
                List<String> parts = new ArrayList<>();
                for (JsNode e : elements) parts.add(e == null ? "" : expr(e, PREC_ASSIGN, depth));
                return "[" + String.join(", ", parts) + "]";
            }
            case OBJECT_EXPRESSION:
            case OBJECT_PATTERN: {
                List<JsNode> props = node instanceof ObjectExpression
                        ? ((ObjectExpression) node).properties
                        : ((ObjectPattern) node).properties;
                if (props.isEmpty()) return "{}";
                List<String> parts = new ArrayList<>();
                for (JsNode p : props) parts.add(expr(p, PREC_ASSIGN, depth));
                return "{ " + String.join(", ", parts) + " }";
            }
            case PROPERTY:
                return property((Property) node, depth);
            case SPREAD_ELEMENT:
                return "..." + expr(((SpreadElement) node).argument, PREC_ASSIGN, depth);
            case REST_ELEMENT:
                return "..." + expr(((RestElement) node).argument, PREC_ASSIGN, depth);
            case ASSIGNMENT_PATTERN: {
                AssignmentPattern p = (AssignmentPattern) node;
                return expr(p.left, 0, depth) + " = " + expr(p.right, PREC_ASSIGN, depth);
            }
            case MEMBER_EXPRESSION: {
                MemberExpression m = (MemberExpression) node;
                String obj = expr(m.object, PREC_MEMBER, depth);
                if (m.object instanceof Literal && ((Literal) m.object).literalKind == LiteralKind.NUMBER) {
                    obj = "(" + obj + ")";
                }
                if (m.computed) {
                    return obj + (m.optional ? "?.[" : "[") + expr(m.property, 0, depth) + "]";
                }
                String name = m.property instanceof Identifier
                        ? ((Identifier) m.property).name
                        : expr(m.property, PREC_PRIMARY, depth);
                return obj + (m.optional ? "?." : ".") + name;
            }
            case CALL_EXPRESSION: {
                CallExpression c = (CallExpression) node;
                List<String> args = new ArrayList<>();
                for (JsNode a : c.arguments) args.add(expr(a, PREC_ASSIGN, depth));
                return expr(c.callee, PREC_MEMBER, depth) + (c.optional ? "?.(" : "(") + String.join(", ", args) + ")";
            }
            case BINARY_EXPRESSION: {
                BinaryExpression b = (BinaryExpression) node;
                return binary(b.operator, b.left, b.right, precedence(node), depth);
            }
            case LOGICAL_EXPRESSION: {
                LogicalExpression l = (LogicalExpression) node;
                return binary(l.operator, l.left, l.right, precedence(node), depth);
            }
            case UNARY_EXPRESSION: {
                UnaryExpression u = (UnaryExpression) node;
                String arg = expr(u.argument, PREC_UNARY, depth);
                boolean word = Character.isLetter(u.operator.isEmpty() ? ' ' : u.operator.charAt(0));
                boolean clash = (u.operator.equals("-") && arg.startsWith("-")) || (u.operator.equals("+") && arg.startsWith("+"));
                return u.operator + (word || clash ? " " : "") + arg;
            }
            case UPDATE_EXPRESSION: {
                UpdateExpression u = (UpdateExpression) node;
                String arg = expr(u.argument, PREC_POSTFIX, depth);
                return u.prefix ? u.operator + arg : arg + u.operator;
            }
            case ASSIGNMENT_EXPRESSION: {
                AssignmentExpression a = (AssignmentExpression) node;
                return expr(a.left, PREC_MEMBER, depth) + " " + a.operator + " " + expr(a.right, PREC_ASSIGN, depth);
            }
            case CONDITIONAL_EXPRESSION: {
                ConditionalExpression c = (ConditionalExpression) node;
                return expr(c.test, PREC_CONDITIONAL + 1, depth)
                        + " ? " + expr(c.consequent, PREC_ASSIGN, depth)
                        + " : " + expr(c.alternate, PREC_ASSIGN, depth);
            }
            case AWAIT_EXPRESSION:
                return "await " + expr(((AwaitExpression) node).argument, PREC_UNARY, depth);
            case FUNCTION_DECLARATION:
            case FUNCTION_EXPRESSION:
            case ARROW_FUNCTION_EXPRESSION:
                return function((FunctionNode) node, depth);
            case JSX_ELEMENT:
            case JSX_FRAGMENT:
            case JSX_TEXT:
            case JSX_EXPRESSION_CONTAINER:
                return jsx(node, depth);
            case JSX_EMPTY_EXPRESSION:
            case UNSUPPORTED:
                return "";
            default:
                return stmt(node, depth);
        }
    }

    private String binary(String op, JsNode left, JsNode right, int prec, int depth) {
        boolean rightAssoc = "**".equals(op);
        String l = expr(left, rightAssoc ? prec + 1 : prec, depth);
        String r = expr(right, rightAssoc ? prec : prec + 1, depth);
        return l + " " + op + " " + r;
    }

    private String property(Property p, int depth) {
        String value = expr(p.value, PREC_ASSIGN, depth);
        String key;
        if (p.computed) {
            key = "[" + expr(p.key, PREC_ASSIGN, depth) + "]";
        } else if (p.key instanceof Identifier) {
            key = ((Identifier) p.key).name;
        } else {
            key = expr(p.key, PREC_PRIMARY, depth);
        }
        if (!p.computed && key.equals(value)) {
            return value;
        }
        if (p.shorthand && p.value instanceof AssignmentPattern) {
            return value;
        }
        return key + ": " + value;
    }

    private String function(FunctionNode fn, int depth) {
        List<String> params = new ArrayList<>();
        for (JsNode p : fn.params) params.add(expr(p, PREC_ASSIGN, depth));
        String prefix = fn.async ? "async " : "";
        String body;
        if (fn.body instanceof BlockStatement) {
            body = block((BlockStatement) fn.body, depth);
        } else {
            body = expr(fn.body, PREC_ASSIGN, depth);
            if (fn.body instanceof ObjectExpression) body = "(" + body + ")";
        }
        if (fn.is(JsNodeKind.ARROW_FUNCTION_EXPRESSION)) {
            String head = fn.params.size() == 1 && fn.params.get(0) instanceof Identifier
                    ? params.get(0)
                    : "(" + String.join(", ", params) + ")";
            return prefix + head + " => " + body;
        }
        String name = fn.name() == null ? "" : " " + fn.name();
        return prefix + "function" + name + "(" + String.join(", ", params) + ") " + body;
    }

    private static String literal(Literal l) {
        switch (l.literalKind) {
            case STRING:
                return quote(l.stringValue());
            case NUMBER:
                if (l.raw != null && !l.raw.isBlank()) return l.raw;
                return number(l.value);
            case BOOLEAN:
                return String.valueOf(Boolean.TRUE.equals(l.value));
            case NULL:
                return "null";
            case REGEX:
                return l.raw == null ? "" : l.raw;
            case BIGINT:
                if (l.raw != null) return l.raw;
                return l.stringValue() + "n";
            default:
                return "";
        }
    }

    private static String number(Object value) {
        if (value == null) return "0";
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (Double.isFinite(d) && d == Math.rint(d) && Math.abs(d) < 1e15) {
                return Long.toString((long) d);
            }
            return new BigDecimal(Double.toString(d)).stripTrailingZeros().toPlainString();
        }
        if (value instanceof BigDecimal) return ((BigDecimal) value).stripTrailingZeros().toPlainString();
        return value.toString();
    }

    private String templateLiteral(TemplateLiteral t, int depth) {
        StringBuilder sb = new StringBuilder("`");
        for (int i = 0; i < t.quasis.size() || i < t.expressions.size(); i++) {
            sb.append(t.quasi(i).replace("\\", "\\\\").replace("`", "\\`").replace("${", "\\${"));
            if (i < t.expressions.size()) {
                sb.append("${").append(expr(t.expressions.get(i), 0, depth)).append('}');
            }
        }
        return sb.append('`').toString();
    }

    private String jsx(JsNode node, int depth) {
        if (node instanceof JsxText) {
            return ((JsxText) node).value.strip();
        }
        if (node instanceof JsxExpressionContainer) {
            String inner = expr(((JsxExpressionContainer) node).expression, 0, depth);
            return inner.isEmpty() ? "" : "{" + inner + "}";
        }
        if (node instanceof JsxFragment) {
            return "<>" + jsxChildren(((JsxFragment) node).children, depth) + "</>";
        }
        JsxElement e = (JsxElement) node;
        StringBuilder sb = new StringBuilder("<").append(e.name);
        for (JsNode a : e.attributes) {
            if (a instanceof JsxAttribute) {
                JsxAttribute attr = (JsxAttribute) a;
                sb.append(' ').append(attr.name);
                if (attr.value instanceof Literal) {
                    sb.append("=\"").append(((Literal) attr.value).stringValue()).append('"');
                } else if (attr.value != null) {
                    sb.append('=').append(jsx(attr.value, depth));
                }
            } else if (a instanceof JsxSpreadAttribute) {
                sb.append(" {...").append(expr(((JsxSpreadAttribute) a).argument, PREC_ASSIGN, depth)).append('}');
            }
        }
        if (e.children.isEmpty()) return sb.append(" />").toString();
        return sb.append('>').append(jsxChildren(e.children, depth)).append("</").append(e.name).append('>').toString();
    }

    private String jsxChildren(List<JsNode> children, int depth) {
        StringBuilder sb = new StringBuilder();
        for (JsNode c : children) sb.append(jsx(c, depth));
        return sb.toString();
    }

    private static int precedence(JsNode node) {
        switch (node.kind()) {
            case ASSIGNMENT_EXPRESSION:
            case ARROW_FUNCTION_EXPRESSION:
            case SPREAD_ELEMENT:
                return PREC_ASSIGN;
            case CONDITIONAL_EXPRESSION:
                return PREC_CONDITIONAL;
            case LOGICAL_EXPRESSION:
                return binaryPrecedence(((LogicalExpression) node).operator);
            case BINARY_EXPRESSION:
                return binaryPrecedence(((BinaryExpression) node).operator);
            case UNARY_EXPRESSION:
            case AWAIT_EXPRESSION:
                return PREC_UNARY;
            case UPDATE_EXPRESSION:
                return ((UpdateExpression) node).prefix ? PREC_UNARY : PREC_POSTFIX;
            case CALL_EXPRESSION:
            case MEMBER_EXPRESSION:
                return PREC_MEMBER;
            case FUNCTION_EXPRESSION:
            case FUNCTION_DECLARATION:
                return PREC_MEMBER - 1;
            default:
                return PREC_PRIMARY;
        }
    }

    private static int binaryPrecedence(String op) {
        switch (op) {
            case "??":
            case "||": return 4;
            case "&&": return 5;
            case "|": return 6;
            case "^": return 7;
            case "&": return 8;
            case "==":
            case "!=":
            case "===":
            case "!==": return 9;
            case "<":
            case ">":
            case "<=":
            case ">=":
            case "instanceof":
            case "in": return 10;
            case "<<":
            case ">>":
            case ">>>": return 11;
            case "+":
            case "-": return 12;
            case "*":
            case "/":
            case "%": return 13;
            case "**": return 14;
            default: return 10;
        }
    }
}
