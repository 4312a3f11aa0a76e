package io.rulegate.server.core;

import io.rulegate.server.spi.CollectionRules;
import io.rulegate.server.spi.RulesProvider;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Mutable in-process rule table. Changes apply to the next rule check.
 */
public final class InMemoryRulesProvider implements RulesProvider {

    private final Map<String, CollectionRules> rules = new ConcurrentHashMap<>();

    @Override
    public Optional<CollectionRules> find(String collection) {
        return Optional.ofNullable(rules.get(collection));
    }

    public InMemoryRulesProvider put(String collection, CollectionRules collectionRules) {
        rules.put(Objects.requireNonNull(collection, "collection"),
                Objects.requireNonNull(collectionRules, "collectionRules"));
        return this;
    }

    public boolean remove(String collection) {
        return rules.remove(collection) != null;
    }
}
