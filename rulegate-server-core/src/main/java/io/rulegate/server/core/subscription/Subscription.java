package io.rulegate.server.core.subscription;

import io.rulegate.server.core.filter.RecordFilter;
import io.rulegate.server.spi.AuthContext;

import java.time.Instant;
import java.util.Objects;

/**
 * One client's interest in a collection, optionally narrowed to a record id and a filter.
 * Immutable; re-subscribe to change it.
 *
 * @param recordId   record the subscription is pinned to, or {@code null} for the whole collection
 * @param filterExpr filter source, or {@code null}
 * @param filter     compiled {@code filterExpr}, or {@code null}
 */
public record Subscription(
        String id,
        String clientId,
        String collection,
        String recordId,
        String filterExpr,
        RecordFilter filter,
        AuthContext authContext,
        Instant createdAt
) {
    public Subscription {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(clientId, "clientId");
        Objects.requireNonNull(collection, "collection");
        Objects.requireNonNull(authContext, "authContext");
        Objects.requireNonNull(createdAt, "createdAt");
    }

    /** Whether this subscription is interested in a record with the given id. */
    public boolean coversRecord(Object recordIdValue) {
        return recordId == null || (recordIdValue != null && recordId.equals(recordIdValue.toString()));
    }
}
