package io.rulegate.server.core;

import io.rulegate.server.spi.ClientStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Flow;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Bridges a transport connection to an SSE response body.
 *
 * <p>The adapter subscribes once; the subscription starts the connection. Writes wait for
 * subscriber demand up to a timeout and fail with {@link IOException} once the subscriber has
 * cancelled or the wait runs out.
 */
final class SseClientStream implements ClientStream, Flow.Publisher<SseFrame> {

    private static final Logger log = LoggerFactory.getLogger(SseClientStream.class);

    private final Consumer<SseClientStream> onStart;
    private final long demandTimeoutNanos;

    private final Object lock = new Object();
    private final List<Runnable> closeCallbacks = new ArrayList<>();
    private Flow.Subscriber<? super SseFrame> subscriber;
    private long demand;
    private boolean closed;

    SseClientStream(Consumer<SseClientStream> onStart, Duration demandTimeout) {
        this.onStart = Objects.requireNonNull(onStart, "onStart");
        this.demandTimeoutNanos = demandTimeout.toNanos();
    }

    @Override
    public void subscribe(Flow.Subscriber<? super SseFrame> s) {
        Objects.requireNonNull(s, "subscriber");
        synchronized (lock) {
            if (subscriber != null || closed) {
                s.onSubscribe(new Flow.Subscription() {
                    @Override
                    public void request(long n) {
                    }

                    @Override
                    public void cancel() {
                    }
                });
                s.onError(new IllegalStateException("SSE stream supports a single subscriber"));
                return;
            }
            subscriber = s;
        }
        s.onSubscribe(new Sub());
        onStart.accept(this);
    }

    @Override
    public void write(String event, String data) throws IOException {
        Flow.Subscriber<? super SseFrame> target;
        synchronized (lock) {
            long deadline = System.nanoTime() + demandTimeoutNanos;
            while (!closed && demand == 0) {
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) throw new IOException("SSE subscriber stalled");
                try {
                    TimeUnit.NANOSECONDS.timedWait(lock, remaining);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IOException("interrupted waiting for SSE demand", e);
                }
            }
            if (closed) throw new IOException("SSE stream closed");
            if (demand != Long.MAX_VALUE) demand--;
            target = subscriber;
        }
        target.onNext(new SseFrame(event, data));
    }

    @Override
    public void onClose(Runnable callback) {
        Objects.requireNonNull(callback, "callback");
        synchronized (lock) {
            if (!closed) {
                closeCallbacks.add(callback);
                return;
            }
        }
        callback.run();
    }

    @Override
    public void close() {
        Flow.Subscriber<? super SseFrame> target = terminate();
        if (target != null) target.onComplete();
    }

    /** Marks the stream closed and fires callbacks once; returns the subscriber to notify. */
    private Flow.Subscriber<? super SseFrame> terminate() {
        List<Runnable> callbacks;
        Flow.Subscriber<? super SseFrame> target;
        synchronized (lock) {
            if (closed) return null;
            closed = true;
            lock.notifyAll();
            callbacks = new ArrayList<>(closeCallbacks);
            closeCallbacks.clear();
            target = subscriber;
        }
        for (Runnable callback : callbacks) {
            try {
                callback.run();
            } catch (RuntimeException e) {
                log.warn("SSE close callback failed", e);
            }
        }
        return target;
    }

    private final class Sub implements Flow.Subscription {
        @Override
        public void request(long n) {
            if (n <= 0) {
                Flow.Subscriber<? super SseFrame> target = terminate();
                if (target != null) target.onError(new IllegalArgumentException("non-positive request: " + n));
                return;
            }
            synchronized (lock) {
                long next = demand + n;
                demand = next < 0 ? Long.MAX_VALUE : next;
                lock.notifyAll();
            }
        }

        @Override
        public void cancel() {
            terminate();
        }
    }
}
