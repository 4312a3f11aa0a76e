package io.rulegate.server.core.filter;

import io.rulegate.server.core.expression.CompiledExpression;
import io.rulegate.server.core.expression.ExpressionException;
import io.rulegate.server.core.expression.Node;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Fast-path filter: {@code field op literal} terms joined by {@code &&}.
 *
 * <p>A leading {@code record.} on a field path is optional. A field value is coerced toward its
 * literal's type (numeric strings to numbers, {@code "true"}/{@code "false"} to booleans, anything
 * to text for string literals); a value that cannot be coerced never matches an ordering term.
 */
final class RestrictedRecordFilter implements RecordFilter {

    private final String source;
    private final List<Term> terms;

    private RestrictedRecordFilter(String source, List<Term> terms) {
        this.source = source;
        this.terms = List.copyOf(terms);
    }

    /**
     * @throws ExpressionException if the expression is not an {@code &&} chain of field/literal
     *                             comparisons
     */
    static RestrictedRecordFilter from(CompiledExpression expression) throws ExpressionException {
        List<Term> terms = new ArrayList<>();
        collect(expression.root(), terms);
        return new RestrictedRecordFilter(expression.source(), terms);
    }

    private static void collect(Node node, List<Term> out) throws ExpressionException {
        if (node instanceof Node.BinaryOp op && op.operator() == Node.Operator.AND) {
            collect(op.left(), out);
            collect(op.right(), out);
            return;
        }
        if (node instanceof Node.BinaryOp op && op.operator().isComparison()) {
            if (op.left() instanceof Node.FieldAccess field && op.right() instanceof Node.Literal literal) {
                out.add(term(field, op.operator(), literal.value()));
                return;
            }
            if (op.left() instanceof Node.Literal literal && op.right() instanceof Node.FieldAccess field) {
                out.add(term(field, flip(op.operator()), literal.value()));
                return;
            }
        }
        throw unsupported("filters must be field comparisons against literals joined by &&");
    }

    private static Term term(Node.FieldAccess field, Node.Operator operator, Object literal) throws ExpressionException {
        List<String> path = field.path();
        if (path.size() > 1 && "record".equals(path.get(0))) {
            path = path.subList(1, path.size());
        }
        boolean ordering = operator != Node.Operator.EQ && operator != Node.Operator.NEQ;
        if (ordering && !(literal instanceof BigDecimal) && !(literal instanceof String)) {
            throw unsupported("operator " + operator.symbol() + " needs a number or string literal");
        }
        return new Term(List.copyOf(path), operator, literal);
    }

    private static Node.Operator flip(Node.Operator operator) {
        return switch (operator) {
            case GT -> Node.Operator.LT;
            case GTE -> Node.Operator.LTE;
            case LT -> Node.Operator.GT;
            case LTE -> Node.Operator.GTE;
            default -> operator;
        };
    }

    private static ExpressionException unsupported(String message) {
        return new ExpressionException(ExpressionException.Phase.PARSE, message, -1);
    }

    @Override
    public String source() {
        return source;
    }

    @Override
    public boolean matches(Map<String, Object> record) {
        for (Term term : terms) {
            if (!term.matches(record)) return false;
        }
        return true;
    }

    @Override
    public String toString() {
        return "RestrictedRecordFilter{" + source + "}";
    }

    private record Term(List<String> path, Node.Operator operator, Object literal) {

        boolean matches(Map<String, Object> record) {
            Object value = read(record);
            if (literal == null) {
                return switch (operator) {
                    case EQ -> value == null;
                    case NEQ -> value != null;
                    default -> false;
                };
            }
            Object coerced = coerce(value);
            if (operator == Node.Operator.EQ) return coerced != null && compareTo(coerced) == 0;
            if (operator == Node.Operator.NEQ) return coerced == null || compareTo(coerced) != 0;
            if (coerced == null) return false;
            int c = compareTo(coerced);
            return switch (operator) {
                case GT -> c > 0;
                case GTE -> c >= 0;
                case LT -> c < 0;
                case LTE -> c <= 0;
                default -> false;
            };
        }

        private Object read(Map<String, Object> record) {
            Object current = record;
            for (String segment : path) {
                if (current instanceof Map<?, ?> map) {
                    current = map.get(segment);
                } else if (current instanceof List<?> list) {
                    current = index(list, segment);
                } else {
                    return null;
                }
            }
            return current;
        }

        private static Object index(List<?> list, String segment) {
            try {
                int i = Integer.parseInt(segment);
                return i >= 0 && i < list.size() ? list.get(i) : null;
            } catch (NumberFormatException e) {
                return null;
            }
        }

        /** The value in the literal's type, or {@code null} if it has no such form. */
        private Object coerce(Object value) {
            if (value == null) return null;
            if (literal instanceof BigDecimal) {
                if (value instanceof Number n) return decimal(n.toString());
                if (value instanceof String s) return decimal(s.trim());
                return null;
            }
            if (literal instanceof Boolean) {
                if (value instanceof Boolean) return value;
                if (value instanceof String s) {
                    if ("true".equalsIgnoreCase(s)) return Boolean.TRUE;
                    if ("false".equalsIgnoreCase(s)) return Boolean.FALSE;
                }
                return null;
            }
            if (value instanceof Map || value instanceof List) return null;
            return value.toString();
        }

        private int compareTo(Object coerced) {
            if (literal instanceof BigDecimal d) return ((BigDecimal) coerced).compareTo(d);
            if (literal instanceof Boolean b) return coerced.equals(b) ? 0 : 1;
            return ((String) coerced).compareTo((String) literal);
        }

        private static BigDecimal decimal(String text) {
            try {
                return new BigDecimal(text);
            } catch (NumberFormatException e) {
                return null;
            }
        }
    }
}
