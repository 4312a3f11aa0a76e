package io.rulegate.server.core.dispatch;

import io.rulegate.core.Protocol;
import io.rulegate.core.RecordAction;
import io.rulegate.core.RuleType;
import io.rulegate.json.spi.JsonCodec;
import io.rulegate.json.spi.JsonException;
import io.rulegate.server.core.expression.ExpressionException;
import io.rulegate.server.core.rules.RulesEngine;
import io.rulegate.server.core.subscription.Subscription;
import io.rulegate.server.core.subscription.SubscriptionRegistry;
import io.rulegate.server.spi.AuthContext;
import io.rulegate.server.spi.AuthResolver;
import io.rulegate.server.spi.RuleContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.format.DateTimeFormatter;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Fans committed record changes out to authorized, filter-matching subscribers.
 *
 * <p>The view rule is evaluated for every candidate at delivery time with the candidate's auth.
 * One candidate failing never stops fan-out to the others. Events for the same record are
 * fanned out one at a time, in call order.
 */
public final class EventDispatcher {

    private static final Logger log = LoggerFactory.getLogger(EventDispatcher.class);
    private static final int STRIPES = 64;

    private final SubscriptionRegistry registry;
    private final RulesEngine rules;
    private final MessageSink sink;
    private final JsonCodec codec;
    private final Clock clock;
    private final AuthRefreshPolicy authRefreshPolicy;
    private final AuthResolver authResolver;
    private final ReentrantLock[] stripes = new ReentrantLock[STRIPES];

    public EventDispatcher(SubscriptionRegistry registry, RulesEngine rules, MessageSink sink, JsonCodec codec,
                           Clock clock, AuthRefreshPolicy authRefreshPolicy, AuthResolver authResolver) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.rules = Objects.requireNonNull(rules, "rules");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.authRefreshPolicy = Objects.requireNonNull(authRefreshPolicy, "authRefreshPolicy");
        this.authResolver = Objects.requireNonNull(authResolver, "authResolver");
        for (int i = 0; i < STRIPES; i++) {
            stripes[i] = new ReentrantLock();
        }
    }

    /**
     * Deliver one committed change. Call strictly after the write commits.
     *
     * @return the number of clients the event was handed to
     */
    public int emitRecordEvent(String collection, RecordAction action, Map<String, Object> record) {
        Objects.requireNonNull(collection, "collection");
        Objects.requireNonNull(action, "action");
        Objects.requireNonNull(record, "record");

        List<Subscription> candidates = registry.listByCollection(collection);
        if (candidates.isEmpty()) return 0;

        Object recordId = record.get(Protocol.F_RECORD_ID);
        String data;
        try {
            data = codec.writeString(message(collection, action, record));
        } catch (JsonException e) {
            log.error("Cannot serialize {} event for collection '{}'", action.wireValue(), collection, e);
            return 0;
        }

        ReentrantLock stripe = stripes[Math.floorMod(Objects.hash(collection, recordId == null ? null : recordId.toString()), STRIPES)];
        stripe.lock();
        try {
            Set<String> delivered = new HashSet<>();
            for (Subscription candidate : candidates) {
                if (delivered.contains(candidate.clientId())) continue;
                if (!candidate.coversRecord(recordId)) continue;
                if (!accepts(candidate, record)) continue;
                if (sink.send(candidate.clientId(), collection, data)) {
                    delivered.add(candidate.clientId());
                }
            }
            if (log.isDebugEnabled()) {
                log.debug("{} on '{}' id={} delivered to {}/{} candidates",
                        action.wireValue(), collection, recordId, delivered.size(), candidates.size());
            }
            return delivered.size();
        } finally {
            stripe.unlock();
        }
    }

    private boolean accepts(Subscription candidate, Map<String, Object> record) {
        try {
            Optional<AuthContext> auth = authFor(candidate);
            if (auth.isEmpty()) return false;
            if (!rules.checkRule(candidate.collection(), RuleType.VIEW, RuleContext.of(auth.get(), record))) {
                return false;
            }
            return candidate.filter() == null || candidate.filter().matches(record);
        } catch (ExpressionException e) {
            log.warn("Filter of subscription {} failed, skipping: {}", candidate.id(), e.getMessage());
            return false;
        } catch (RuntimeException e) {
            log.warn("Delivery check for subscription {} failed, skipping", candidate.id(), e);
            return false;
        }
    }

    private Optional<AuthContext> authFor(Subscription candidate) {
        if (authRefreshPolicy == AuthRefreshPolicy.SNAPSHOT) {
            return Optional.of(candidate.authContext());
        }
        Optional<AuthContext> resolved = authResolver.resolve(candidate.authContext());
        return resolved == null ? Optional.empty() : resolved;
    }

    private Map<String, Object> message(String collection, RecordAction action, Map<String, Object> record) {
        Map<String, Object> message = new LinkedHashMap<>();
        message.put(Protocol.F_ACTION, action.wireValue());
        message.put(Protocol.F_RECORD, record);
        message.put(Protocol.F_COLLECTION, collection);
        message.put(Protocol.F_TIMESTAMP, DateTimeFormatter.ISO_INSTANT.format(clock.instant()));
        return message;
    }
}
