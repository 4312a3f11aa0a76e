package io.rulegate.server.core.expression;

/**
 * @param value literal value for literal tokens, otherwise {@code null}
 */
record Token(TokenType type, String text, Object value, int position) {
}
