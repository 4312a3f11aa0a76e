package io.rulegate.server.core.expression;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive-descent parser.
 *
 * <pre>
 * or         := and ( '||' and )*
 * and        := comparison ( '&amp;&amp;' comparison )*
 * comparison := unary ( ( '=' | '!=' | '&gt;' | '&gt;=' | '&lt;' | '&lt;=' ) unary )?
 * unary      := '!' unary | primary
 * primary    := literal | path | function '(' args? ')' | '(' or ')'
 * path       := identifier ( '.' ( identifier | index ) )*
 * </pre>
 */
final class ExpressionParser {

    private final List<Token> tokens;
    private final ExpressionLimits limits;
    private int index;
    private int depth;

    ExpressionParser(List<Token> tokens, ExpressionLimits limits) {
        this.tokens = tokens;
        this.limits = limits;
    }

    Node parse() throws ExpressionException {
        if (peek().type() == TokenType.EOF) {
            throw ExpressionException.parse("empty expression", 0);
        }
        Node node = parseOr();
        Token trailing = peek();
        if (trailing.type() != TokenType.EOF) {
            throw ExpressionException.parse("unexpected '" + trailing.text() + "'", trailing.position());
        }
        return node;
    }

    // each '&&' or '||' nests the chain built so far one level deeper
    private Node parseOr() throws ExpressionException {
        Node left = parseAnd();
        int nested = 0;
        try {
            while (peek().type() == TokenType.OR) {
                enter(next());
                nested++;
                left = new Node.BinaryOp(Node.Operator.OR, left, parseAnd());
            }
            return left;
        } finally {
            depth -= nested;
        }
    }

    private Node parseAnd() throws ExpressionException {
        Node left = parseComparison();
        int nested = 0;
        try {
            while (peek().type() == TokenType.AND) {
                enter(next());
                nested++;
                left = new Node.BinaryOp(Node.Operator.AND, left, parseComparison());
            }
            return left;
        } finally {
            depth -= nested;
        }
    }

    private Node parseComparison() throws ExpressionException {
        Node left = parseUnary();
        Token op = peek();
        if (!op.type().isComparison()) {
            return left;
        }
        index++;
        Node right = parseUnary();
        if (peek().type().isComparison()) {
            throw ExpressionException.parse("chained comparison, use '&&'", peek().position());
        }
        return new Node.BinaryOp(operatorOf(op.type()), left, right);
    }

    private Node parseUnary() throws ExpressionException {
        Token t = peek();
        if (t.type() == TokenType.NOT) {
            index++;
            enter(t);
            try {
                return new Node.UnaryOp(parseUnary());
            } finally {
                depth--;
            }
        }
        return parsePrimary();
    }

    private Node parsePrimary() throws ExpressionException {
        Token t = next();
        if (t.type().isLiteral()) {
            return new Node.Literal(t.value());
        }
        switch (t.type()) {
            case IDENTIFIER:
                return parsePath(t);
            case FUNCTION:
                return parseCall(t);
            case LPAREN: {
                enter(t);
                try {
                    Node inner = parseOr();
                    expect(TokenType.RPAREN, "')'");
                    return inner;
                } finally {
                    depth--;
                }
            }
            case EOF:
                throw ExpressionException.parse("unexpected end of expression", t.position());
            default:
                throw ExpressionException.parse("unexpected '" + t.text() + "'", t.position());
        }
    }

    private Node parsePath(Token first) throws ExpressionException {
        List<String> path = new ArrayList<>();
        path.add(first.text());
        while (match(TokenType.DOT)) {
            Token segment = next();
            if (segment.type() != TokenType.IDENTIFIER) {
                throw ExpressionException.parse("field name expected after '.'", segment.position());
            }
            path.add(segment.text());
        }
        return new Node.FieldAccess(path);
    }

    private Node parseCall(Token name) throws ExpressionException {
        Node.Function function = Node.Function.byName(name.text());
        if (function == null) {
            throw ExpressionException.parse("unknown function " + name.text(), name.position());
        }
        expect(TokenType.LPAREN, "'('");
        enter(name);
        List<Node> args = new ArrayList<>();
        try {
            if (!match(TokenType.RPAREN)) {
                do {
                    args.add(parseOr());
                } while (match(TokenType.COMMA));
                expect(TokenType.RPAREN, "')'");
            }
        } finally {
            depth--;
        }
        if (args.size() != function.arity()) {
            throw ExpressionException.parse(function.functionName() + " expects " + function.arity()
                    + " argument(s), got " + args.size(), name.position());
        }
        return new Node.Call(function, args);
    }

    private void enter(Token at) throws ExpressionException {
        if (++depth > limits.maxDepth()) {
            throw ExpressionException.parse("expression nested deeper than " + limits.maxDepth(), at.position());
        }
    }

    private static Node.Operator operatorOf(TokenType type) {
        return switch (type) {
            case EQ -> Node.Operator.EQ;
            case NEQ -> Node.Operator.NEQ;
            case GT -> Node.Operator.GT;
            case GTE -> Node.Operator.GTE;
            case LT -> Node.Operator.LT;
            case LTE -> Node.Operator.LTE;
            default -> throw new IllegalArgumentException("not a comparison: " + type);
        };
    }

    private void expect(TokenType type, String description) throws ExpressionException {
        Token t = next();
        if (t.type() != type) {
            throw ExpressionException.parse(description + " expected", t.position());
        }
    }

    private boolean match(TokenType type) {
        if (peek().type() == type) {
            index++;
            return true;
        }
        return false;
    }

    private Token peek() {
        return tokens.get(index);
    }

    private Token next() {
        Token t = tokens.get(index);
        if (t.type() != TokenType.EOF) index++;
        return t;
    }
}
