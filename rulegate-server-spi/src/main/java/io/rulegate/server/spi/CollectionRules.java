package io.rulegate.server.spi;

import io.rulegate.core.RuleType;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * The access rules of one collection, one per {@link RuleType}.
 *
 * <p>An operation without a rule is deny-all.
 *
 * <pre>{@code
 * CollectionRules rules = CollectionRules.builder()
 *     .list("auth.id = record.userId")
 *     .view("auth.id = record.userId")
 *     .create("")          // allow-all
 *     .build();            // update/delete stay deny-all
 * }</pre>
 */
public final class CollectionRules {

    private final Map<RuleType, AccessRule> rules;

    private CollectionRules(Map<RuleType, AccessRule> rules) {
        this.rules = rules;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Rules denying every operation to non-admins. */
    public static CollectionRules denyAll() {
        return builder().build();
    }

    public AccessRule rule(RuleType type) {
        Objects.requireNonNull(type, "type");
        return rules.getOrDefault(type, AccessRule.denyAll());
    }

    /**
     * Builder for {@link CollectionRules}. String setters follow {@link AccessRule#of(String)}.
     */
    public static final class Builder {
        private final EnumMap<RuleType, AccessRule> rules = new EnumMap<>(RuleType.class);

        private Builder() {}

        public Builder rule(RuleType type, AccessRule rule) {
            rules.put(Objects.requireNonNull(type, "type"), Objects.requireNonNull(rule, "rule"));
            return this;
        }

        public Builder list(String source) {
            return rule(RuleType.LIST, AccessRule.of(source));
        }

        public Builder view(String source) {
            return rule(RuleType.VIEW, AccessRule.of(source));
        }

        public Builder create(String source) {
            return rule(RuleType.CREATE, AccessRule.of(source));
        }

        public Builder update(String source) {
            return rule(RuleType.UPDATE, AccessRule.of(source));
        }

        public Builder delete(String source) {
            return rule(RuleType.DELETE, AccessRule.of(source));
        }

        public CollectionRules build() {
            return new CollectionRules(Map.copyOf(rules));
        }
    }
}
