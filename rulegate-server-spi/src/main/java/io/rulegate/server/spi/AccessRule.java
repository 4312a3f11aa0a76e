package io.rulegate.server.spi;

import java.util.Objects;

/**
 * Per-collection, per-operation access policy.
 *
 * <p>Rules are stored as nullable strings by most hosts; {@link #of(String)} maps them:
 * <ul>
 *   <li>{@code null} → {@link DenyAll} (only admins pass)</li>
 *   <li>blank → {@link AllowAll}</li>
 *   <li>anything else → {@link Expression}, evaluated per request</li>
 * </ul>
 */
public sealed interface AccessRule permits AccessRule.DenyAll, AccessRule.AllowAll, AccessRule.Expression {

    record DenyAll() implements AccessRule {}

    record AllowAll() implements AccessRule {}

    /**
     * Conditional rule.
     *
     * @param source rule expression text, e.g. {@code auth.id = record.userId}
     */
    record Expression(String source) implements AccessRule {
        public Expression {
            Objects.requireNonNull(source, "source");
            if (source.isBlank()) throw new IllegalArgumentException("expression source must not be blank");
        }
    }

    static AccessRule denyAll() {
        return new DenyAll();
    }

    static AccessRule allowAll() {
        return new AllowAll();
    }

    static AccessRule of(String source) {
        if (source == null) return new DenyAll();
        if (source.isBlank()) return new AllowAll();
        return new Expression(source.trim());
    }
}
