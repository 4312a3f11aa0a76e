package io.rulegate.server.spi;

import java.util.Optional;

/**
 * Source of collection access rules.
 *
 * <p>Consulted on every check, so implementations must be thread-safe and cheap; rule changes
 * become visible on the next call. An unknown collection is treated as deny-all.
 */
@FunctionalInterface
public interface RulesProvider {

    /**
     * Find the rules of a collection.
     *
     * @param collection collection name
     * @return the rules if the collection is known
     */
    Optional<CollectionRules> find(String collection);
}
