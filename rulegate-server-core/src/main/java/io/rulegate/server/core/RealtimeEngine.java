package io.rulegate.server.core;

import io.rulegate.core.RecordAction;
import io.rulegate.core.RuleGateException;
import io.rulegate.core.RuleType;
import io.rulegate.json.spi.JsonCodec;
import io.rulegate.server.core.dispatch.AuthRefreshPolicy;
import io.rulegate.server.core.dispatch.EventDispatcher;
import io.rulegate.server.core.expression.ExpressionEvaluator;
import io.rulegate.server.core.expression.ExpressionLimits;
import io.rulegate.server.core.filter.FilterMode;
import io.rulegate.server.core.rules.RulesEngine;
import io.rulegate.server.core.subscription.Subscription;
import io.rulegate.server.core.subscription.SubscriptionRegistry;
import io.rulegate.server.core.transport.ClientConnection;
import io.rulegate.server.core.transport.OverflowPolicy;
import io.rulegate.server.core.transport.TransportManager;
import io.rulegate.server.spi.AuthContext;
import io.rulegate.server.spi.AuthResolver;
import io.rulegate.server.spi.ClientStream;
import io.rulegate.server.spi.FilterFragment;
import io.rulegate.server.spi.RuleContext;
import io.rulegate.server.spi.RulesProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Rule-gated realtime subscription engine.
 *
 * <p>Wires the rules engine, subscription registry, event dispatcher and transport manager, and
 * runs the periodic sweep that drops subscriptions whose disconnect was never observed.
 *
 * <pre>{@code
 * RealtimeEngine engine = RealtimeEngine.builder(rulesProvider)
 *     .heartbeatInterval(Duration.ofSeconds(15))
 *     .overflowPolicy(OverflowPolicy.DROP_OLDEST)
 *     .build();
 *
 * // after a write commits
 * engine.emitRecordEvent("posts", RecordAction.CREATE, record);
 * }</pre>
 */
public final class RealtimeEngine implements AutoCloseable {

    public static final Duration DEFAULT_SUBSCRIPTION_MAX_AGE = Duration.ofHours(1);
    public static final Duration DEFAULT_CLEANUP_INTERVAL = Duration.ofMinutes(5);

    private static final Logger log = LoggerFactory.getLogger(RealtimeEngine.class);

    private final Clock clock;
    private final Duration subscriptionMaxAge;
    private final RulesEngine rules;
    private final SubscriptionRegistry registry;
    private final TransportManager transport;
    private final EventDispatcher dispatcher;
    private final JsonCodec codec;
    private final ScheduledExecutorService cleanupScheduler;

    /**
     * Creates a new builder.
     *
     * @param rulesProvider source of collection rules (required)
     */
    public static Builder builder(RulesProvider rulesProvider) {
        return new Builder(rulesProvider);
    }

    private RealtimeEngine(Builder b) {
        this.clock = b.clock != null ? b.clock : Clock.systemUTC();
        this.subscriptionMaxAge = b.subscriptionMaxAge != null ? b.subscriptionMaxAge : DEFAULT_SUBSCRIPTION_MAX_AGE;
        this.codec = b.codec != null ? b.codec : ServiceLoaderJsonCodecs.defaultCodec();

        ExpressionEvaluator evaluator = new ExpressionEvaluator(clock,
                b.limits != null ? b.limits : ExpressionLimits.defaults());
        this.rules = new RulesEngine(b.rulesProvider, evaluator);
        this.registry = new SubscriptionRegistry(evaluator,
                b.filterMode != null ? b.filterMode : FilterMode.RESTRICTED,
                clock,
                b.maxSubscriptionsPerClient > 0 ? b.maxSubscriptionsPerClient
                        : SubscriptionRegistry.DEFAULT_MAX_SUBSCRIPTIONS_PER_CLIENT);
        this.transport = new TransportManager(registry, codec, clock,
                b.heartbeatInterval != null ? b.heartbeatInterval : TransportManager.DEFAULT_HEARTBEAT_INTERVAL,
                b.sendBufferCapacity > 0 ? b.sendBufferCapacity : TransportManager.DEFAULT_SEND_BUFFER_CAPACITY,
                b.overflowPolicy != null ? b.overflowPolicy : OverflowPolicy.DISCONNECT);
        this.dispatcher = new EventDispatcher(registry, rules, transport, codec, clock,
                b.authRefreshPolicy != null ? b.authRefreshPolicy : AuthRefreshPolicy.SNAPSHOT,
                b.authResolver != null ? b.authResolver : AuthResolver.snapshot());

        Duration cleanupInterval = b.cleanupInterval != null ? b.cleanupInterval : DEFAULT_CLEANUP_INTERVAL;
        if (cleanupInterval.isZero() || cleanupInterval.isNegative()) {
            this.cleanupScheduler = null;
        } else {
            this.cleanupScheduler = VirtualThreads.newScheduler("rulegate-cleanup");
            long millis = cleanupInterval.toMillis();
            cleanupScheduler.scheduleWithFixedDelay(this::sweep, millis, millis, TimeUnit.MILLISECONDS);
        }
    }

    /**
     * Builder for {@link RealtimeEngine}.
     */
    public static final class Builder {
        private final RulesProvider rulesProvider;
        private Clock clock;
        private Duration heartbeatInterval;
        private int sendBufferCapacity;
        private OverflowPolicy overflowPolicy;
        private Duration subscriptionMaxAge;
        private Duration cleanupInterval;
        private int maxSubscriptionsPerClient;
        private FilterMode filterMode;
        private AuthRefreshPolicy authRefreshPolicy;
        private AuthResolver authResolver;
        private JsonCodec codec;
        private ExpressionLimits limits;

        private Builder(RulesProvider rulesProvider) {
            this.rulesProvider = Objects.requireNonNull(rulesProvider, "rulesProvider");
        }

        /** Clock for timestamps, {@code $now()} and subscription ageing. Default: system UTC. */
        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /** Default: 30 seconds. */
        public Builder heartbeatInterval(Duration heartbeatInterval) {
            this.heartbeatInterval = heartbeatInterval;
            return this;
        }

        /** Messages buffered per connection. Default: 256. */
        public Builder sendBufferCapacity(int sendBufferCapacity) {
            this.sendBufferCapacity = sendBufferCapacity;
            return this;
        }

        /** Default: {@link OverflowPolicy#DISCONNECT}. */
        public Builder overflowPolicy(OverflowPolicy overflowPolicy) {
            this.overflowPolicy = overflowPolicy;
            return this;
        }

        /** Inactivity after which the sweep drops a subscription. Default: 1 hour. */
        public Builder subscriptionMaxAge(Duration subscriptionMaxAge) {
            this.subscriptionMaxAge = subscriptionMaxAge;
            return this;
        }

        /** Sweep period; zero disables the sweep. Default: 5 minutes. */
        public Builder cleanupInterval(Duration cleanupInterval) {
            this.cleanupInterval = cleanupInterval;
            return this;
        }

        /** Default: 1000. */
        public Builder maxSubscriptionsPerClient(int maxSubscriptionsPerClient) {
            this.maxSubscriptionsPerClient = maxSubscriptionsPerClient;
            return this;
        }

        /** Default: {@link FilterMode#RESTRICTED}. */
        public Builder filterMode(FilterMode filterMode) {
            this.filterMode = filterMode;
            return this;
        }

        /** Default: {@link AuthRefreshPolicy#SNAPSHOT}. */
        public Builder authRefreshPolicy(AuthRefreshPolicy authRefreshPolicy) {
            this.authRefreshPolicy = authRefreshPolicy;
            return this;
        }

        /** Required with {@link AuthRefreshPolicy#LIVE}; ignored otherwise. */
        public Builder authResolver(AuthResolver authResolver) {
            this.authResolver = authResolver;
            return this;
        }

        /** Default: the codec discovered through {@link java.util.ServiceLoader}. */
        public Builder codec(JsonCodec codec) {
            this.codec = codec;
            return this;
        }

        public Builder expressionLimits(ExpressionLimits limits) {
            this.limits = limits;
            return this;
        }

        /**
         * @throws IllegalStateException if {@link AuthRefreshPolicy#LIVE} is set without an {@link AuthResolver}
         */
        public RealtimeEngine build() {
            if (authRefreshPolicy == AuthRefreshPolicy.LIVE && authResolver == null) {
                throw new IllegalStateException("AuthRefreshPolicy.LIVE requires an AuthResolver");
            }
            return new RealtimeEngine(this);
        }
    }

    /**
     * Open a connection under a generated client id. The first event on the stream is
     * {@code connected}, carrying the id.
     */
    public ClientConnection connect(ClientStream stream, AuthContext auth) {
        return transport.createConnection(stream, auth);
    }

    public ClientConnection connect(String clientId, ClientStream stream, AuthContext auth) {
        return transport.createConnection(clientId, stream, auth);
    }

    /**
     * Subscribe a connected client.
     *
     * @param auth principal of the subscribe request
     * @throws RuleGateException.ClientNotConnected    if the client has no open connection
     * @throws RuleGateException.ClientAuthMismatch    if {@code auth} is not the connection's principal
     * @throws RuleGateException.SubscriptionRejected  if the request or filter is invalid
     */
    public Subscription subscribe(String clientId, String collection, String recordId, String filter, AuthContext auth) {
        ClientConnection connection = openConnection(clientId);
        AuthContext owner = connection.authContext();
        if (!sameOwner(owner, auth)) {
            throw new RuleGateException.ClientAuthMismatch(clientId);
        }

        Subscription subscription = registry.subscribe(clientId, collection, recordId, filter, owner);
        if (!transport.isOpen(clientId) || transport.connection(clientId).orElse(null) != connection) {
            // the connection went away while registering
            registry.unsubscribe(subscription.id());
            throw new RuleGateException.ClientNotConnected(clientId);
        }
        return subscription;
    }

    /**
     * Subscribe with the connection's own principal.
     */
    public Subscription subscribe(String clientId, String collection, String recordId, String filter) {
        AuthContext owner = openConnection(clientId).authContext();
        return subscribe(clientId, collection, recordId, filter, owner);
    }

    public boolean unsubscribe(String subscriptionId) {
        return registry.unsubscribe(subscriptionId);
    }

    public int unsubscribeClient(String clientId) {
        return registry.unsubscribeClient(clientId);
    }

    /**
     * Remove one of a client's subscriptions on behalf of a request principal.
     *
     * @return {@code false} if the client has no such subscription
     * @throws RuleGateException.ClientAuthMismatch if {@code auth} does not own the connected client
     */
    public boolean unsubscribe(String clientId, String subscriptionId, AuthContext auth) {
        checkOwner(clientId, auth);
        Optional<Subscription> subscription = registry.find(subscriptionId);
        if (subscription.isEmpty() || !subscription.get().clientId().equals(clientId)) return false;
        return registry.unsubscribe(subscriptionId);
    }

    /**
     * Remove all of a client's subscriptions on behalf of a request principal.
     *
     * @throws RuleGateException.ClientAuthMismatch if {@code auth} does not own the connected client
     */
    public int unsubscribeClient(String clientId, AuthContext auth) {
        checkOwner(clientId, auth);
        return registry.unsubscribeClient(clientId);
    }

    public boolean closeConnection(String clientId) {
        return transport.closeConnection(clientId);
    }

    public boolean isConnected(String clientId) {
        return transport.isOpen(clientId);
    }

    public Optional<ClientConnection> connection(String clientId) {
        return transport.connection(clientId);
    }

    public List<Subscription> subscriptions(String clientId) {
        return registry.listByClient(clientId);
    }

    public Optional<Subscription> findSubscription(String subscriptionId) {
        return registry.find(subscriptionId);
    }

    /**
     * Deliver a committed record change to authorized, matching subscribers.
     *
     * @return the number of clients the event was handed to
     */
    public int emitRecordEvent(String collection, RecordAction action, Map<String, Object> record) {
        return dispatcher.emitRecordEvent(collection, action, record);
    }

    public boolean checkRule(String collection, RuleType type, RuleContext context) {
        return rules.checkRule(collection, type, context);
    }

    /**
     * @return the push-down predicate, or {@code null} if the list rule must be checked per record
     */
    public FilterFragment generateFilter(String collection, RuleContext context) {
        return rules.generateFilter(collection, context);
    }

    /**
     * Drop subscriptions inactive for longer than the configured maximum age.
     */
    public int cleanup() {
        return registry.cleanup(subscriptionMaxAge);
    }

    public int connectionCount() {
        return transport.connectionCount();
    }

    public int subscriptionCount() {
        return registry.size();
    }

    public JsonCodec codec() {
        return codec;
    }

    public Clock clock() {
        return clock;
    }

    @Override
    public void close() {
        if (cleanupScheduler != null) {
            cleanupScheduler.shutdownNow();
        }
        transport.close();
    }

    private ClientConnection openConnection(String clientId) {
        if (clientId == null || clientId.isBlank()) {
            throw new RuleGateException.SubscriptionRejected(SubscriptionRegistry.REASON_INVALID_REQUEST,
                    "clientId is required");
        }
        return transport.connection(clientId)
                .filter(ClientConnection::isOpen)
                .orElseThrow(() -> new RuleGateException.ClientNotConnected(clientId));
    }

    private void checkOwner(String clientId, AuthContext auth) {
        Optional<ClientConnection> connection = transport.connection(clientId);
        if (connection.isPresent() && !sameOwner(connection.get().authContext(), auth)) {
            throw new RuleGateException.ClientAuthMismatch(clientId);
        }
    }

    private static boolean sameOwner(AuthContext owner, AuthContext requester) {
        AuthContext r = requester == null ? AuthContext.anonymous() : requester;
        return owner.principalId().equals(r.principalId()) && owner.isAdmin() == r.isAdmin();
    }

    private void sweep() {
        try {
            cleanup();
        } catch (RuntimeException e) {
            log.error("Subscription cleanup failed", e);
        }
    }
}
