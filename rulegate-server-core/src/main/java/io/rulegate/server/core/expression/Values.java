package io.rulegate.server.core.expression;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Coercion and comparison rules shared by rule evaluation and subscription filters.
 */
public final class Values {

    private Values() {}

    /**
     * Boolean coercion: {@code null}, {@code false}, zero and empty strings, collections and maps are
     * false; everything else is true.
     */
    public static boolean truthy(Object value) {
        if (value == null) return false;
        if (value instanceof Boolean b) return b;
        if (value instanceof Number n) {
            BigDecimal d = toDecimal(n);
            return d == null ? n.doubleValue() != 0 : d.signum() != 0;
        }
        if (value instanceof CharSequence s) return s.length() > 0;
        if (value instanceof Collection<?> c) return !c.isEmpty();
        if (value instanceof Map<?, ?> m) return !m.isEmpty();
        return true;
    }

    /**
     * Null-safe equality. Numbers compare numerically; values of different kinds are unequal.
     */
    public static boolean equal(Object a, Object b) {
        if (a == null || b == null) return a == b;
        if (a instanceof Number x && b instanceof Number y) {
            BigDecimal dx = toDecimal(x);
            BigDecimal dy = toDecimal(y);
            if (dx == null || dy == null) return Double.compare(x.doubleValue(), y.doubleValue()) == 0;
            return dx.compareTo(dy) == 0;
        }
        if (a instanceof CharSequence x && b instanceof CharSequence y) {
            return x.toString().equals(y.toString());
        }
        if (a instanceof List<?> x && b instanceof List<?> y) {
            if (x.size() != y.size()) return false;
            for (int i = 0; i < x.size(); i++) {
                if (!equal(x.get(i), y.get(i))) return false;
            }
            return true;
        }
        return Objects.equals(a, b);
    }

    /**
     * Ordering of two numbers or two strings.
     *
     * @throws ExpressionException for any other combination
     */
    public static int compare(Object a, Object b) throws ExpressionException {
        if (a instanceof Number x && b instanceof Number y) {
            BigDecimal dx = toDecimal(x);
            BigDecimal dy = toDecimal(y);
            if (dx == null || dy == null) return Double.compare(x.doubleValue(), y.doubleValue());
            return dx.compareTo(dy);
        }
        if (a instanceof CharSequence x && b instanceof CharSequence y) {
            return x.toString().compareTo(y.toString());
        }
        throw ExpressionException.evaluate("cannot order " + typeName(a) + " and " + typeName(b));
    }

    /** Exact decimal form of a number, or {@code null} for NaN and infinities. */
    static BigDecimal toDecimal(Number n) {
        if (n instanceof BigDecimal d) return d;
        if (n instanceof BigInteger i) return new BigDecimal(i);
        if (n instanceof Long || n instanceof Integer || n instanceof Short || n instanceof Byte) {
            return BigDecimal.valueOf(n.longValue());
        }
        double d = n.doubleValue();
        if (Double.isNaN(d) || Double.isInfinite(d)) return null;
        return new BigDecimal(n.toString());
    }

    static String typeName(Object value) {
        if (value == null) return "null";
        if (value instanceof Number) return "number";
        if (value instanceof CharSequence) return "string";
        if (value instanceof Boolean) return "boolean";
        if (value instanceof Collection) return "list";
        if (value instanceof Map) return "object";
        return value.getClass().getSimpleName();
    }
}
