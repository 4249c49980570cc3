package info.isaksson.erland.reacttoangular.ast;

/**
 * Closed set of syntax-tree node kinds understood by the converter.
 *
 * <p>{@link #UNSUPPORTED} is the sentinel for anything else the parser produced.</p>
 */
public enum JsNodeKind {
    PROGRAM,
    EXPORT_DECLARATION,
    FUNCTION_DECLARATION,
    FUNCTION_EXPRESSION,
    ARROW_FUNCTION_EXPRESSION,
    VARIABLE_DECLARATION,
    VARIABLE_DECLARATOR,
    ARRAY_PATTERN,
    OBJECT_PATTERN,
    ASSIGNMENT_PATTERN,
    REST_ELEMENT,
    BLOCK_STATEMENT,
    EXPRESSION_STATEMENT,
    RETURN_STATEMENT,
    IF_STATEMENT,
    TRY_STATEMENT,
    CALL_EXPRESSION,
    MEMBER_EXPRESSION,
    IDENTIFIER,
    LITERAL,
    TEMPLATE_LITERAL,
    BINARY_EXPRESSION,
    LOGICAL_EXPRESSION,
    UNARY_EXPRESSION,
    UPDATE_EXPRESSION,
    ASSIGNMENT_EXPRESSION,
    CONDITIONAL_EXPRESSION,
    AWAIT_EXPRESSION,
    ARRAY_EXPRESSION,
    OBJECT_EXPRESSION,
    PROPERTY,
    SPREAD_ELEMENT,
    JSX_ELEMENT,
    JSX_FRAGMENT,
    JSX_ATTRIBUTE,
    JSX_SPREAD_ATTRIBUTE,
    JSX_EXPRESSION_CONTAINER,
    JSX_EMPTY_EXPRESSION,
    JSX_TEXT,
    UNSUPPORTED
}
