package io.rulegate.server.spi;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Storage-level predicate compiled from an access rule.
 *
 * <p>Query layers translate fragments into their native filter language so listings can push
 * filtering down instead of evaluating a rule per row. {@link #test(Map)} applies the same
 * predicate in memory.
 *
 * <p>{@link FieldEquals} resolves and compares the way rule evaluation does: numeric path
 * segments index into lists, numbers compare numerically (NaN and infinities by their double
 * value), lists element-wise, and a {@code null} value matches a missing or null field.
 */
public sealed interface FilterFragment
        permits FilterFragment.AlwaysTrue, FilterFragment.AlwaysFalse, FilterFragment.FieldEquals,
        FilterFragment.And, FilterFragment.Or {

    boolean test(Map<String, Object> record);

    record AlwaysTrue() implements FilterFragment {
        @Override
        public boolean test(Map<String, Object> record) {
            return true;
        }
    }

    record AlwaysFalse() implements FilterFragment {
        @Override
        public boolean test(Map<String, Object> record) {
            return false;
        }
    }

    /**
     * @param field dotted record field path
     * @param value expected value, may be {@code null}
     */
    record FieldEquals(String field, Object value) implements FilterFragment {
        public FieldEquals {
            Objects.requireNonNull(field, "field");
        }

        @Override
        public boolean test(Map<String, Object> record) {
            Object actual = record;
            for (String segment : field.split("\\.")) {
                if (actual == null) break;
                actual = member(actual, segment);
            }
            return equal(actual, value);
        }
    }

    record And(List<FilterFragment> parts) implements FilterFragment {
        public And {
            parts = List.copyOf(parts);
        }

        @Override
        public boolean test(Map<String, Object> record) {
            for (FilterFragment part : parts) {
                if (!part.test(record)) return false;
            }
            return true;
        }
    }

    record Or(List<FilterFragment> parts) implements FilterFragment {
        public Or {
            parts = List.copyOf(parts);
        }

        @Override
        public boolean test(Map<String, Object> record) {
            for (FilterFragment part : parts) {
                if (part.test(record)) return true;
            }
            return false;
        }
    }

    static FilterFragment alwaysTrue() {
        return new AlwaysTrue();
    }

    static FilterFragment alwaysFalse() {
        return new AlwaysFalse();
    }

    private static Object member(Object container, String name) {
        if (container instanceof Map<?, ?> map) {
            return map.get(name);
        }
        if (container instanceof List<?> list) {
            try {
                int i = Integer.parseInt(name);
                return i >= 0 && i < list.size() ? list.get(i) : null;
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static boolean equal(Object a, Object b) {
        if (a == null || b == null) return a == b;
        if (a instanceof Number x && b instanceof Number y) {
            BigDecimal dx = decimal(x);
            BigDecimal dy = decimal(y);
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

    /** {@code null} for NaN and infinities. */
    private static BigDecimal decimal(Number n) {
        if (n instanceof BigDecimal d) return d;
        if (n instanceof BigInteger i) return new BigDecimal(i);
        if (n instanceof Long || n instanceof Integer || n instanceof Short || n instanceof Byte) {
            return BigDecimal.valueOf(n.longValue());
        }
        double d = n.doubleValue();
        if (Double.isNaN(d) || Double.isInfinite(d)) return null;
        return new BigDecimal(n.toString());
    }
}
