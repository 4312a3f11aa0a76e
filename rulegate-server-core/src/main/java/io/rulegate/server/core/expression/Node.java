package io.rulegate.server.core.expression;

import java.util.List;
import java.util.Objects;

/**
 * Parsed expression tree.
 */
public sealed interface Node permits Node.Literal, Node.FieldAccess, Node.BinaryOp, Node.UnaryOp, Node.Call {

    /**
     * @param value a {@link java.math.BigDecimal}, {@link String}, {@link Boolean} or {@code null}
     */
    record Literal(Object value) implements Node {}

    /**
     * Dotted path; the first segment is the root ({@code auth}, {@code record}, {@code data}).
     */
    record FieldAccess(List<String> path) implements Node {
        public FieldAccess {
            path = List.copyOf(path);
            if (path.isEmpty()) throw new IllegalArgumentException("path must not be empty");
        }

        public String root() {
            return path.get(0);
        }

        /** Path below the root, joined with dots; empty for the root itself. */
        public String subPath() {
            return String.join(".", path.subList(1, path.size()));
        }
    }

    record BinaryOp(Operator operator, Node left, Node right) implements Node {
        public BinaryOp {
            Objects.requireNonNull(operator, "operator");
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
        }
    }

    /** Logical negation, the only unary operator. */
    record UnaryOp(Node operand) implements Node {
        public UnaryOp {
            Objects.requireNonNull(operand, "operand");
        }
    }

    record Call(Function function, List<Node> arguments) implements Node {
        public Call {
            Objects.requireNonNull(function, "function");
            arguments = List.copyOf(arguments);
        }
    }

    enum Operator {
        EQ("="),
        NEQ("!="),
        GT(">"),
        GTE(">="),
        LT("<"),
        LTE("<="),
        AND("&&"),
        OR("||");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }

        public boolean isComparison() {
            return this != AND && this != OR;
        }
    }

    /**
     * The closed helper-function set.
     */
    enum Function {
        NOW("$now", 0),
        CONTAINS("$contains", 2),
        SIZE("$size", 1),
        IS_EMPTY("$isEmpty", 1),
        IS_NOT_EMPTY("$isNotEmpty", 1);

        private final String functionName;
        private final int arity;

        Function(String functionName, int arity) {
            this.functionName = functionName;
            this.arity = arity;
        }

        public String functionName() {
            return functionName;
        }

        public int arity() {
            return arity;
        }

        static Function byName(String name) {
            for (Function f : values()) {
                if (f.functionName.equals(name)) return f;
            }
            return null;
        }
    }
}
