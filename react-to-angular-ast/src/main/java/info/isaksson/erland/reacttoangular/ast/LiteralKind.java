package info.isaksson.erland.reacttoangular.ast;

public enum LiteralKind {
    STRING,
    NUMBER,
    BOOLEAN,
    NULL,
    REGEX,
    BIGINT
}
