package io.rulegate.server.core.transport;

import io.rulegate.core.Protocol;
import io.rulegate.server.spi.AuthContext;
import io.rulegate.server.spi.ClientStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BiConsumer;

/**
 * One client's delivery stream with its bounded send buffer.
 *
 * <p>Senders enqueue without blocking; at most one drain task writes to the stream at a time,
 * so writes keep enqueue order. {@link #close(CloseReason)} runs its cleanup exactly once no
 * matter how many paths race to close.
 */
public final class ClientConnection {

    private static final Logger log = LoggerFactory.getLogger(ClientConnection.class);

    private final String clientId;
    private final ClientStream stream;
    private final AuthContext authContext;
    private final int capacity;
    private final OverflowPolicy overflowPolicy;
    private final Executor writer;
    private final Clock clock;
    private final Runnable onWrite;
    private final BiConsumer<ClientConnection, CloseReason> onClosed;

    private final AtomicReference<ConnectionState> state = new AtomicReference<>(ConnectionState.CONNECTING);
    private final ArrayDeque<Frame> queue = new ArrayDeque<>();
    private boolean draining;
    private final AtomicLong dropped = new AtomicLong();
    private volatile Future<?> heartbeat;
    private volatile Instant lastHeartbeat;
    private volatile CloseReason closeReason;

    ClientConnection(String clientId, ClientStream stream, AuthContext authContext, int capacity,
                     OverflowPolicy overflowPolicy, Executor writer, Clock clock, Runnable onWrite,
                     BiConsumer<ClientConnection, CloseReason> onClosed) {
        this.clientId = Objects.requireNonNull(clientId, "clientId");
        this.stream = Objects.requireNonNull(stream, "stream");
        this.authContext = Objects.requireNonNull(authContext, "authContext");
        this.capacity = capacity;
        this.overflowPolicy = Objects.requireNonNull(overflowPolicy, "overflowPolicy");
        this.writer = Objects.requireNonNull(writer, "writer");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.onWrite = Objects.requireNonNull(onWrite, "onWrite");
        this.onClosed = Objects.requireNonNull(onClosed, "onClosed");
        this.lastHeartbeat = clock.instant();
    }

    public String clientId() {
        return clientId;
    }

    public AuthContext authContext() {
        return authContext;
    }

    public ConnectionState state() {
        return state.get();
    }

    public boolean isOpen() {
        return state.get() == ConnectionState.OPEN;
    }

    public Instant lastHeartbeat() {
        return lastHeartbeat;
    }

    /** Reason of the close, or {@code null} while not closed. */
    public CloseReason closeReason() {
        return closeReason;
    }

    /** Messages discarded under {@link OverflowPolicy#DROP_OLDEST}. */
    public long droppedCount() {
        return dropped.get();
    }

    public int queuedCount() {
        synchronized (queue) {
            return queue.size();
        }
    }

    boolean markOpen() {
        return state.compareAndSet(ConnectionState.CONNECTING, ConnectionState.OPEN);
    }

    void startHeartbeat(Future<?> task) {
        heartbeat = task;
        if (state.get().isTerminal()) {
            task.cancel(false);
        }
    }

    void heartbeat(String data) {
        if (state.get() != ConnectionState.OPEN) return;
        lastHeartbeat = clock.instant();
        enqueue(Protocol.EVENT_HEARTBEAT, data);
    }

    /**
     * Queue a message for writing.
     *
     * @return {@code false} if the connection is closing or the message overflowed the buffer
     */
    boolean enqueue(String event, String data) {
        boolean overflow = false;
        boolean startDrain = false;
        synchronized (queue) {
            if (state.get().isTerminal()) return false;
            if (queue.size() >= capacity) {
                if (overflowPolicy == OverflowPolicy.DROP_OLDEST) {
                    queue.pollFirst();
                    dropped.incrementAndGet();
                } else {
                    overflow = true;
                }
            }
            if (!overflow) {
                queue.addLast(new Frame(event, data));
                if (!draining) {
                    draining = true;
                    startDrain = true;
                }
            }
        }
        if (overflow) {
            log.warn("Send buffer of client {} is full ({} messages), disconnecting", clientId, capacity);
            close(CloseReason.BUFFER_OVERFLOW);
            return false;
        }
        if (startDrain) {
            try {
                writer.execute(this::drain);
            } catch (RejectedExecutionException e) {
                close(CloseReason.SHUTDOWN);
                return false;
            }
        }
        return true;
    }

    private void drain() {
        while (true) {
            Frame frame;
            synchronized (queue) {
                frame = queue.pollFirst();
                if (frame == null || state.get().isTerminal()) {
                    draining = false;
                    return;
                }
            }
            try {
                stream.write(frame.event(), frame.data());
                if (!state.get().isTerminal()) onWrite.run();
            } catch (IOException | RuntimeException e) {
                log.warn("Write to client {} failed, disconnecting: {}", clientId, e.toString());
                close(CloseReason.WRITE_FAILED);
                return;
            }
        }
    }

    /**
     * Close the connection. Only the first call has an effect.
     *
     * @return whether this call performed the close
     */
    public boolean close(CloseReason reason) {
        ConnectionState previous = state.getAndUpdate(s -> s.isTerminal() ? s : ConnectionState.CLOSING);
        if (previous.isTerminal()) return false;
        closeReason = reason;

        Future<?> task = heartbeat;
        if (task != null) task.cancel(false);
        synchronized (queue) {
            queue.clear();
        }
        try {
            onClosed.accept(this, reason);
        } finally {
            try {
                stream.close();
            } catch (RuntimeException e) {
                log.debug("Closing stream of client {} failed", clientId, e);
            }
            state.set(ConnectionState.CLOSED);
        }
        log.debug("Connection {} closed: {}", clientId, reason);
        return true;
    }

    @Override
    public String toString() {
        return "ClientConnection{clientId=" + clientId + ", state=" + state.get() + "}";
    }

    private record Frame(String event, String data) {}
}
