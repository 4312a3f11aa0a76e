package io.rulegate.server.core.subscription;

import io.rulegate.core.RuleGateException;
import io.rulegate.server.core.expression.ExpressionEvaluator;
import io.rulegate.server.core.expression.ExpressionException;
import io.rulegate.server.core.filter.FilterMode;
import io.rulegate.server.core.filter.RecordFilter;
import io.rulegate.server.core.filter.RecordFilters;
import io.rulegate.server.spi.AuthContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.UnaryOperator;

/**
 * The store of active subscriptions, indexed by id, by client and by collection.
 *
 * <p>Mutations serialize through one lock. The per-collection index is an immutable snapshot
 * replaced on every change and published through a volatile field, so
 * {@link #listByCollection(String)} never takes the lock and always sees a consistent list.
 */
public final class SubscriptionRegistry {

    public static final String REASON_INVALID_FILTER = "invalid_filter";
    public static final String REASON_INVALID_REQUEST = "invalid_request";
    public static final String REASON_SUBSCRIPTION_LIMIT = "subscription_limit";

    public static final int DEFAULT_MAX_SUBSCRIPTIONS_PER_CLIENT = 1000;

    private static final Logger log = LoggerFactory.getLogger(SubscriptionRegistry.class);

    private final ExpressionEvaluator evaluator;
    private final FilterMode filterMode;
    private final Clock clock;
    private final int maxSubscriptionsPerClient;

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, Subscription> byId = new HashMap<>();
    private final Map<String, Set<String>> byClient = new HashMap<>();
    private volatile Map<String, List<Subscription>> byCollection = Map.of();
    private final Map<String, Instant> clientActivity = new ConcurrentHashMap<>();

    public SubscriptionRegistry(ExpressionEvaluator evaluator) {
        this(evaluator, FilterMode.RESTRICTED, Clock.systemUTC(), DEFAULT_MAX_SUBSCRIPTIONS_PER_CLIENT);
    }

    public SubscriptionRegistry(ExpressionEvaluator evaluator, FilterMode filterMode, Clock clock,
                                int maxSubscriptionsPerClient) {
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator");
        this.filterMode = Objects.requireNonNull(filterMode, "filterMode");
        this.clock = Objects.requireNonNull(clock, "clock");
        if (maxSubscriptionsPerClient <= 0) {
            throw new IllegalArgumentException("maxSubscriptionsPerClient must be > 0");
        }
        this.maxSubscriptionsPerClient = maxSubscriptionsPerClient;
    }

    /**
     * Create a subscription. The filter is validated before anything is registered.
     *
     * @throws RuleGateException.SubscriptionRejected if the request is invalid, the filter does
     *                                                not compile or the client is at its limit
     */
    public Subscription subscribe(String clientId, String collection, String recordId, String filterExpr,
                                  AuthContext authContext) {
        if (clientId == null || clientId.isBlank()) {
            throw new RuleGateException.SubscriptionRejected(REASON_INVALID_REQUEST, "clientId is required");
        }
        if (collection == null || collection.isBlank()) {
            throw new RuleGateException.SubscriptionRejected(REASON_INVALID_REQUEST, "collection is required");
        }
        String normalizedRecordId = recordId == null || recordId.isBlank() ? null : recordId;
        String normalizedFilter = filterExpr == null || filterExpr.isBlank() ? null : filterExpr.trim();

        RecordFilter filter = null;
        if (normalizedFilter != null) {
            try {
                filter = RecordFilters.compile(normalizedFilter, filterMode, evaluator);
            } catch (ExpressionException e) {
                throw new RuleGateException.SubscriptionRejected(REASON_INVALID_FILTER,
                        "invalid filter: " + e.getMessage(), e);
            }
        }

        Subscription subscription = new Subscription(
                UUID.randomUUID().toString(), clientId, collection, normalizedRecordId, normalizedFilter, filter,
                authContext == null ? AuthContext.anonymous() : authContext, clock.instant());

        lock.lock();
        try {
            Set<String> owned = byClient.computeIfAbsent(clientId, k -> new LinkedHashSet<>());
            if (owned.size() >= maxSubscriptionsPerClient) {
                throw new RuleGateException.SubscriptionRejected(REASON_SUBSCRIPTION_LIMIT,
                        "client " + clientId + " already has " + owned.size() + " subscriptions");
            }
            owned.add(subscription.id());
            byId.put(subscription.id(), subscription);
            publish(collection, current -> {
                List<Subscription> next = new ArrayList<>(current);
                next.add(subscription);
                return next;
            });
        } finally {
            lock.unlock();
        }
        log.debug("Subscribed {} to '{}' as {}", clientId, collection, subscription.id());
        return subscription;
    }

    /**
     * @return whether a subscription was removed
     */
    public boolean unsubscribe(String subscriptionId) {
        if (subscriptionId == null) return false;
        lock.lock();
        try {
            Subscription removed = byId.remove(subscriptionId);
            if (removed == null) return false;
            Set<String> owned = byClient.get(removed.clientId());
            if (owned != null) {
                owned.remove(subscriptionId);
                if (owned.isEmpty()) {
                    byClient.remove(removed.clientId());
                    clientActivity.remove(removed.clientId());
                }
            }
            removeFromCollections(List.of(removed));
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Remove every subscription of a client.
     *
     * @return how many were removed
     */
    public int unsubscribeClient(String clientId) {
        if (clientId == null) return 0;
        int removedCount;
        lock.lock();
        try {
            Set<String> owned = byClient.remove(clientId);
            clientActivity.remove(clientId);
            if (owned == null || owned.isEmpty()) return 0;
            List<Subscription> removed = new ArrayList<>(owned.size());
            for (String id : owned) {
                Subscription s = byId.remove(id);
                if (s != null) removed.add(s);
            }
            removeFromCollections(removed);
            removedCount = removed.size();
        } finally {
            lock.unlock();
        }
        log.debug("Removed {} subscriptions of client {}", removedCount, clientId);
        return removedCount;
    }

    public Optional<Subscription> find(String subscriptionId) {
        lock.lock();
        try {
            return Optional.ofNullable(byId.get(subscriptionId));
        } finally {
            lock.unlock();
        }
    }

    public List<Subscription> listByClient(String clientId) {
        lock.lock();
        try {
            Set<String> owned = byClient.get(clientId);
            if (owned == null) return List.of();
            List<Subscription> out = new ArrayList<>(owned.size());
            for (String id : owned) {
                out.add(byId.get(id));
            }
            return Collections.unmodifiableList(out);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Snapshot of a collection's subscriptions. Lock-free.
     */
    public List<Subscription> listByCollection(String collection) {
        List<Subscription> list = byCollection.get(collection);
        return list == null ? List.of() : list;
    }

    /**
     * Record delivery activity for a client; defers its subscriptions' expiry. Ignored for
     * clients that own no subscriptions.
     */
    public void touchClient(String clientId) {
        if (clientId == null) return;
        lock.lock();
        try {
            if (byClient.containsKey(clientId)) {
                clientActivity.put(clientId, clock.instant());
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Last recorded delivery to a client that still owns subscriptions.
     */
    public Optional<Instant> lastActivity(String clientId) {
        return clientId == null ? Optional.empty() : Optional.ofNullable(clientActivity.get(clientId));
    }

    /**
     * Remove subscriptions whose last activity is older than {@code maxAge}. Activity is the later
     * of creation and the last delivery to the owning client.
     *
     * @return how many were removed
     */
    public int cleanup(Duration maxAge) {
        Objects.requireNonNull(maxAge, "maxAge");
        Instant cutoff = clock.instant().minus(maxAge);
        List<Subscription> stale = new ArrayList<>();
        lock.lock();
        try {
            for (Subscription s : byId.values()) {
                Instant activity = clientActivity.get(s.clientId());
                Instant last = activity != null && activity.isAfter(s.createdAt()) ? activity : s.createdAt();
                if (last.isBefore(cutoff)) stale.add(s);
            }
            if (stale.isEmpty()) return 0;
            for (Subscription s : stale) {
                byId.remove(s.id());
                Set<String> owned = byClient.get(s.clientId());
                if (owned != null) {
                    owned.remove(s.id());
                    if (owned.isEmpty()) {
                        byClient.remove(s.clientId());
                        clientActivity.remove(s.clientId());
                    }
                }
            }
            removeFromCollections(stale);
        } finally {
            lock.unlock();
        }
        log.info("Cleanup removed {} stale subscriptions", stale.size());
        return stale.size();
    }

    public int size() {
        lock.lock();
        try {
            return byId.size();
        } finally {
            lock.unlock();
        }
    }

    private void removeFromCollections(List<Subscription> removed) {
        Map<String, Set<String>> idsByCollection = new HashMap<>();
        for (Subscription s : removed) {
            idsByCollection.computeIfAbsent(s.collection(), k -> new HashSet<>()).add(s.id());
        }
        for (Map.Entry<String, Set<String>> e : idsByCollection.entrySet()) {
            Set<String> ids = e.getValue();
            publish(e.getKey(), current -> {
                List<Subscription> next = new ArrayList<>(current.size());
                for (Subscription s : current) {
                    if (!ids.contains(s.id())) next.add(s);
                }
                return next;
            });
        }
    }

    /** Replace one collection's snapshot. Caller holds the lock. */
    private void publish(String collection, UnaryOperator<List<Subscription>> change) {
        Map<String, List<Subscription>> next = new HashMap<>(byCollection);
        List<Subscription> updated = change.apply(next.getOrDefault(collection, List.of()));
        if (updated.isEmpty()) {
            next.remove(collection);
        } else {
            next.put(collection, List.copyOf(updated));
        }
        byCollection = Map.copyOf(next);
    }
}
