package io.rulegate.server.core.transport;

import io.rulegate.core.Protocol;
import io.rulegate.json.spi.JsonCodec;
import io.rulegate.json.spi.JsonException;
import io.rulegate.server.core.VirtualThreads;
import io.rulegate.server.core.dispatch.MessageSink;
import io.rulegate.server.core.subscription.SubscriptionRegistry;
import io.rulegate.server.spi.AuthContext;
import io.rulegate.server.spi.ClientStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Owns one long-lived delivery stream per client.
 *
 * <p>Every way a connection ends (client disconnect, write failure, buffer overflow, explicit
 * close, replacement, shutdown) goes through {@link ClientConnection#close(CloseReason)}, which
 * removes the connection and cascades into {@link SubscriptionRegistry#unsubscribeClient(String)}
 * exactly once.
 */
public final class TransportManager implements MessageSink, AutoCloseable {

    public static final Duration DEFAULT_HEARTBEAT_INTERVAL = Duration.ofSeconds(30);
    public static final int DEFAULT_SEND_BUFFER_CAPACITY = 256;

    private static final Logger log = LoggerFactory.getLogger(TransportManager.class);

    private final SubscriptionRegistry registry;
    private final JsonCodec codec;
    private final Clock clock;
    private final Duration heartbeatInterval;
    private final int sendBufferCapacity;
    private final OverflowPolicy overflowPolicy;

    private final Map<String, ClientConnection> connections = new ConcurrentHashMap<>();
    private final ExecutorService writer;
    private final ScheduledExecutorService heartbeats;
    private final AtomicBoolean closed = new AtomicBoolean();

    public TransportManager(SubscriptionRegistry registry, JsonCodec codec) {
        this(registry, codec, Clock.systemUTC(), DEFAULT_HEARTBEAT_INTERVAL, DEFAULT_SEND_BUFFER_CAPACITY,
                OverflowPolicy.DISCONNECT);
    }

    public TransportManager(SubscriptionRegistry registry, JsonCodec codec, Clock clock, Duration heartbeatInterval,
                            int sendBufferCapacity, OverflowPolicy overflowPolicy) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.heartbeatInterval = Objects.requireNonNull(heartbeatInterval, "heartbeatInterval");
        if (heartbeatInterval.isNegative() || heartbeatInterval.isZero()) {
            throw new IllegalArgumentException("heartbeatInterval must be > 0");
        }
        if (sendBufferCapacity <= 0) {
            throw new IllegalArgumentException("sendBufferCapacity must be > 0");
        }
        this.sendBufferCapacity = sendBufferCapacity;
        this.overflowPolicy = Objects.requireNonNull(overflowPolicy, "overflowPolicy");
        this.writer = VirtualThreads.newExecutor("rulegate-writer");
        this.heartbeats = VirtualThreads.newScheduler("rulegate-heartbeat");
    }

    /**
     * Open a connection under a generated client id.
     */
    public ClientConnection createConnection(ClientStream stream, AuthContext authContext) {
        return createConnection(UUID.randomUUID().toString(), stream, authContext);
    }

    /**
     * Open a connection. An existing connection with the same id is closed and replaced.
     */
    public ClientConnection createConnection(String clientId, ClientStream stream, AuthContext authContext) {
        Objects.requireNonNull(clientId, "clientId");
        Objects.requireNonNull(stream, "stream");
        if (closed.get()) {
            stream.close();
            throw new IllegalStateException("transport manager is closed");
        }
        ClientConnection connection = new ClientConnection(
                clientId, stream, authContext == null ? AuthContext.anonymous() : authContext,
                sendBufferCapacity, overflowPolicy, writer, clock,
                () -> registry.touchClient(clientId),
                this::onClosed);

        ClientConnection existing;
        while ((existing = connections.putIfAbsent(clientId, connection)) != null) {
            log.debug("Replacing connection of client {}", clientId);
            existing.close(CloseReason.REPLACED);
            Thread.onSpinWait();
        }

        stream.onClose(() -> connection.close(CloseReason.CLIENT_CLOSED));
        connection.enqueue(Protocol.EVENT_CONNECTED, handshake(clientId));
        if (connection.markOpen()) {
            connection.startHeartbeat(heartbeats.scheduleAtFixedRate(
                    () -> heartbeat(connection),
                    heartbeatInterval.toMillis(), heartbeatInterval.toMillis(), TimeUnit.MILLISECONDS));
            log.debug("Client {} connected", clientId);
        }
        return connection;
    }

    @Override
    public boolean send(String clientId, String event, String data) {
        ClientConnection connection = connections.get(clientId);
        return connection != null && connection.enqueue(event, data);
    }

    /**
     * Terminate a client's connection and its subscriptions.
     *
     * @return whether a connection was closed
     */
    public boolean closeConnection(String clientId) {
        ClientConnection connection = connections.get(clientId);
        return connection != null && connection.close(CloseReason.EXPLICIT);
    }

    public Optional<ClientConnection> connection(String clientId) {
        return Optional.ofNullable(connections.get(clientId));
    }

    public boolean isOpen(String clientId) {
        ClientConnection connection = connections.get(clientId);
        return connection != null && connection.isOpen();
    }

    public int connectionCount() {
        return connections.size();
    }

    /**
     * Close every connection and stop the writer and heartbeat threads.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) return;
        for (ClientConnection connection : new ArrayList<>(connections.values())) {
            connection.close(CloseReason.SHUTDOWN);
        }
        heartbeats.shutdownNow();
        writer.shutdown();
    }

    private void onClosed(ClientConnection connection, CloseReason reason) {
        if (connections.remove(connection.clientId(), connection)) {
            int removed = registry.unsubscribeClient(connection.clientId());
            log.debug("Client {} disconnected ({}), {} subscriptions removed", connection.clientId(), reason, removed);
        }
    }

    private void heartbeat(ClientConnection connection) {
        try {
            connection.heartbeat(message(Protocol.EVENT_HEARTBEAT, null));
        } catch (RuntimeException e) {
            log.error("Heartbeat for client {} failed", connection.clientId(), e);
        }
    }

    private String handshake(String clientId) {
        return message(Protocol.EVENT_CONNECTED, clientId);
    }

    private String message(String type, String clientId) {
        Map<String, Object> message = new LinkedHashMap<>();
        message.put(Protocol.F_TYPE, type);
        if (clientId != null) message.put(Protocol.F_CLIENT_ID, clientId);
        message.put(Protocol.F_TIMESTAMP, DateTimeFormatter.ISO_INSTANT.format(clock.instant()));
        try {
            return codec.writeString(message);
        } catch (JsonException e) {
            throw new IllegalStateException("cannot serialize " + type + " message", e);
        }
    }
}
