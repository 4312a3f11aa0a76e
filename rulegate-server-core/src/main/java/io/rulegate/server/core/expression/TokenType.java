package io.rulegate.server.core.expression;

enum TokenType {
    NUMBER,
    STRING,
    TRUE,
    FALSE,
    NULL,
    IDENTIFIER,
    FUNCTION,
    DOT,
    COMMA,
    LPAREN,
    RPAREN,
    EQ,
    NEQ,
    GT,
    GTE,
    LT,
    LTE,
    AND,
    OR,
    NOT,
    EOF;

    boolean isComparison() {
        return this == EQ || this == NEQ || this == GT || this == GTE || this == LT || this == LTE;
    }

    boolean isLiteral() {
        return this == NUMBER || this == STRING || this == TRUE || this == FALSE || this == NULL;
    }
}
