package info.isaksson.erland.reacttoangular.transform.rules;

import info.isaksson.erland.reacttoangular.ast.ArrayExpression;
import info.isaksson.erland.reacttoangular.ast.JsNode;
import info.isaksson.erland.reacttoangular.ast.Literal;
import info.isaksson.erland.reacttoangular.ast.TemplateLiteral;
import info.isaksson.erland.reacttoangular.ast.UnaryExpression;

/** TypeScript type of an initial value, judged from its syntactic shape only. */
final class TypeInference {

    static final String ANY = "any";

    private TypeInference() {}

    static String infer(JsNode value) {
        if (value instanceof ArrayExpression) {
            ArrayExpression arr = (ArrayExpression) value;
            JsNode first = arr.elements.isEmpty() ? null : arr.elements.get(0);
            String elem = first instanceof Literal || first instanceof TemplateLiteral ? infer(first) : ANY;
            return elem + "[]";
        }
        if (value instanceof TemplateLiteral) return "string";
        if (value instanceof Literal) {
            switch (((Literal) value).literalKind) {
                case STRING: return "string";
                case NUMBER: return "number";
                case BOOLEAN: return "boolean";
                default: return ANY;
            }
        }
        if (value instanceof UnaryExpression) {
            UnaryExpression u = (UnaryExpression) value;
            if (("-".equals(u.operator) || "+".equals(u.operator)) && "number".equals(infer(u.argument))) {
                return "number";
            }
            if ("!".equals(u.operator)) return "boolean";
        }
        return ANY;
    }
}
