package io.rulegate.server.core.expression;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Splits rule source text into tokens.
 */
final class ExpressionTokenizer {

    private final String source;
    private final ExpressionLimits limits;
    private int pos;

    ExpressionTokenizer(String source, ExpressionLimits limits) {
        this.source = source;
        this.limits = limits;
    }

    List<Token> tokenize() throws ExpressionException {
        if (source.length() > limits.maxLength()) {
            throw ExpressionException.parse("expression longer than " + limits.maxLength() + " characters", -1);
        }
        List<Token> tokens = new ArrayList<>();
        while (true) {
            skipWhitespace();
            if (pos >= source.length()) {
                tokens.add(new Token(TokenType.EOF, "", null, pos));
                return tokens;
            }
            if (tokens.size() >= limits.maxTokens()) {
                throw ExpressionException.parse("expression has more than " + limits.maxTokens() + " tokens", pos);
            }
            boolean afterDot = !tokens.isEmpty() && tokens.get(tokens.size() - 1).type() == TokenType.DOT;
            tokens.add(next(afterDot));
        }
    }

    private Token next(boolean afterDot) throws ExpressionException {
        int start = pos;
        char c = source.charAt(pos);

        // list index inside a path, e.g. items.0.name
        if (afterDot && isDigit(c)) {
            return new Token(TokenType.IDENTIFIER, identifier(), null, start);
        }
        if (isDigit(c) || (c == '-' && pos + 1 < source.length() && isDigit(source.charAt(pos + 1)))) {
            return number(start);
        }
        if (c == '\'' || c == '"') {
            return string(start, c);
        }
        if (isIdentifierStart(c)) {
            String word = identifier();
            return switch (word) {
                case "true" -> new Token(TokenType.TRUE, word, Boolean.TRUE, start);
                case "false" -> new Token(TokenType.FALSE, word, Boolean.FALSE, start);
                case "null" -> new Token(TokenType.NULL, word, null, start);
                default -> new Token(TokenType.IDENTIFIER, word, null, start);
            };
        }
        if (c == '$') {
            pos++;
            if (pos >= source.length() || !isIdentifierStart(source.charAt(pos))) {
                throw ExpressionException.parse("function name expected after '$'", start);
            }
            return new Token(TokenType.FUNCTION, "$" + identifier(), null, start);
        }

        pos++;
        switch (c) {
            case '.':
                return new Token(TokenType.DOT, ".", null, start);
            case ',':
                return new Token(TokenType.COMMA, ",", null, start);
            case '(':
                return new Token(TokenType.LPAREN, "(", null, start);
            case ')':
                return new Token(TokenType.RPAREN, ")", null, start);
            case '=':
                if (peek('=')) {
                    pos++;
                    return new Token(TokenType.EQ, "==", null, start);
                }
                return new Token(TokenType.EQ, "=", null, start);
            case '!':
                if (peek('=')) {
                    pos++;
                    return new Token(TokenType.NEQ, "!=", null, start);
                }
                return new Token(TokenType.NOT, "!", null, start);
            case '>':
                if (peek('=')) {
                    pos++;
                    return new Token(TokenType.GTE, ">=", null, start);
                }
                return new Token(TokenType.GT, ">", null, start);
            case '<':
                if (peek('=')) {
                    pos++;
                    return new Token(TokenType.LTE, "<=", null, start);
                }
                return new Token(TokenType.LT, "<", null, start);
            case '&':
                if (peek('&')) {
                    pos++;
                    return new Token(TokenType.AND, "&&", null, start);
                }
                throw ExpressionException.parse("expected '&&'", start);
            case '|':
                if (peek('|')) {
                    pos++;
                    return new Token(TokenType.OR, "||", null, start);
                }
                throw ExpressionException.parse("expected '||'", start);
            default:
                throw ExpressionException.parse("unexpected character '" + c + "'", start);
        }
    }

    private Token number(int start) throws ExpressionException {
        if (source.charAt(pos) == '-') pos++;
        while (pos < source.length() && isDigit(source.charAt(pos))) pos++;
        if (pos < source.length() && source.charAt(pos) == '.') {
            pos++;
            if (pos >= source.length() || !isDigit(source.charAt(pos))) {
                throw ExpressionException.parse("digit expected after decimal point", pos);
            }
            while (pos < source.length() && isDigit(source.charAt(pos))) pos++;
        }
        String text = source.substring(start, pos);
        return new Token(TokenType.NUMBER, text, new BigDecimal(text), start);
    }

    private Token string(int start, char quote) throws ExpressionException {
        pos++;
        StringBuilder sb = new StringBuilder();
        while (pos < source.length()) {
            char c = source.charAt(pos++);
            if (c == quote) {
                return new Token(TokenType.STRING, source.substring(start, pos), sb.toString(), start);
            }
            if (c == '\\') {
                if (pos >= source.length()) break;
                char e = source.charAt(pos++);
                switch (e) {
                    case 'n' -> sb.append('\n');
                    case 't' -> sb.append('\t');
                    case 'r' -> sb.append('\r');
                    case '\\', '\'', '"' -> sb.append(e);
                    default -> throw ExpressionException.parse("invalid escape '\\" + e + "'", pos - 2);
                }
            } else {
                sb.append(c);
            }
        }
        throw ExpressionException.parse("unterminated string literal", start);
    }

    private String identifier() {
        int start = pos;
        while (pos < source.length() && isIdentifierPart(source.charAt(pos))) pos++;
        return source.substring(start, pos);
    }

    private boolean peek(char expected) {
        return pos < source.length() && source.charAt(pos) == expected;
    }

    private void skipWhitespace() {
        while (pos < source.length() && Character.isWhitespace(source.charAt(pos))) pos++;
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isIdentifierStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || isDigit(c);
    }
}
