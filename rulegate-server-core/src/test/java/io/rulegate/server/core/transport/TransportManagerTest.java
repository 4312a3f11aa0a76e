package io.rulegate.server.core.transport;

import io.rulegate.core.Protocol;
import io.rulegate.json.jackson.JacksonJsonCodec;
import io.rulegate.server.core.expression.ExpressionEvaluator;
import io.rulegate.server.core.filter.FilterMode;
import io.rulegate.server.core.subscription.SubscriptionRegistry;
import io.rulegate.server.core.testing.Await;
import io.rulegate.server.core.testing.RecordingStream;
import io.rulegate.server.spi.AuthContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class TransportManagerTest {

    private final JacksonJsonCodec codec = new JacksonJsonCodec();
    private final SubscriptionRegistry registry =
            new SubscriptionRegistry(new ExpressionEvaluator(), FilterMode.RESTRICTED, Clock.systemUTC(), 100);
    private final List<TransportManager> managers = new ArrayList<>();

    private TransportManager manager(Duration heartbeat, int capacity, OverflowPolicy policy) {
        TransportManager m = new TransportManager(registry, codec, Clock.systemUTC(), heartbeat, capacity, policy);
        managers.add(m);
        return m;
    }

    private TransportManager manager() {
        return manager(Duration.ofMinutes(5), 16, OverflowPolicy.DISCONNECT);
    }

    @AfterEach
    void closeManagers() {
        managers.forEach(TransportManager::close);
    }

    @Test
    void firstEventIsTheHandshake() throws Exception {
        TransportManager transport = manager();
        RecordingStream stream = new RecordingStream();

        ClientConnection connection = transport.createConnection("c1", stream, AuthContext.of(Map.of("id", "u1")));

        assertThat(connection.state()).isEqualTo(ConnectionState.OPEN);
        assertThat(transport.isOpen("c1")).isTrue();
        Await.until(() -> !stream.events().isEmpty());
        RecordingStream.Event first = stream.events().get(0);
        assertThat(first.event()).isEqualTo(Protocol.EVENT_CONNECTED);
        Map<?, ?> body = codec.readValue(first.data(), Map.class);
        assertThat(body.get("type")).isEqualTo("connected");
        assertThat(body.get("clientId")).isEqualTo("c1");
        assertThat(body.get("timestamp")).isNotNull();
    }

    @Test
    void generatedClientIds() {
        TransportManager transport = manager();

        ClientConnection a = transport.createConnection(new RecordingStream(), null);
        ClientConnection b = transport.createConnection(new RecordingStream(), null);

        assertThat(a.clientId()).isNotBlank().isNotEqualTo(b.clientId());
        assertThat(a.authContext()).isEqualTo(AuthContext.anonymous());
        assertThat(transport.connectionCount()).isEqualTo(2);
    }

    @Test
    void messagesArriveInSendOrder() {
        TransportManager transport = manager();
        RecordingStream stream = new RecordingStream();
        transport.createConnection("c1", stream, null);

        for (int i = 0; i < 10; i++) {
            assertThat(transport.send("c1", "posts", "m" + i)).isTrue();
        }

        Await.until(() -> stream.events("posts").size() == 10);
        assertThat(stream.events("posts")).extracting(RecordingStream.Event::data)
                .containsExactly("m0", "m1", "m2", "m3", "m4", "m5", "m6", "m7", "m8", "m9");
    }

    @Test
    void heartbeatsWhileOpen() {
        TransportManager transport = manager(Duration.ofMillis(30), 16, OverflowPolicy.DISCONNECT);
        RecordingStream stream = new RecordingStream();
        ClientConnection connection = transport.createConnection("c1", stream, null);

        Await.until(() -> stream.events(Protocol.EVENT_HEARTBEAT).size() >= 2);
        assertThat(stream.events(Protocol.EVENT_HEARTBEAT).get(0).data()).contains("\"type\":\"heartbeat\"");
        assertThat(connection.lastHeartbeat()).isNotNull();

        transport.closeConnection("c1");
        sleep(30);
        int afterClose = stream.events(Protocol.EVENT_HEARTBEAT).size();
        sleep(120);
        assertThat(stream.events(Protocol.EVENT_HEARTBEAT)).hasSize(afterClose);
    }

    @Test
    void slowConsumerOverflowDisconnectsOnlyThatClient() {
        TransportManager transport = manager(Duration.ofMinutes(5), 4, OverflowPolicy.DISCONNECT);
        RecordingStream slow = new RecordingStream();
        RecordingStream fast = new RecordingStream();
        slow.block();
        try {
            ClientConnection slowConnection = transport.createConnection("slow", slow, null);
            transport.createConnection("fast", fast, null);
            registry.subscribe("slow", "posts", null, null, null);
            registry.subscribe("fast", "posts", null, null, null);

            boolean rejected = false;
            for (int i = 0; i < 10; i++) {
                rejected |= !transport.send("slow", "posts", "m" + i);
                assertThat(transport.send("fast", "posts", "m" + i)).isTrue();
                int expected = i + 1;
                Await.until(() -> fast.events("posts").size() == expected);
            }

            assertThat(rejected).isTrue();
            assertThat(slowConnection.closeReason()).isEqualTo(CloseReason.BUFFER_OVERFLOW);
            assertThat(transport.isOpen("slow")).isFalse();
            assertThat(registry.listByClient("slow")).isEmpty();
            assertThat(slow.isClosed()).isTrue();

            assertThat(transport.isOpen("fast")).isTrue();
            assertThat(registry.listByClient("fast")).hasSize(1);
        } finally {
            slow.release();
        }
    }

    @Test
    void dropOldestKeepsTheConnection() {
        TransportManager transport = manager(Duration.ofMinutes(5), 2, OverflowPolicy.DROP_OLDEST);
        RecordingStream stream = new RecordingStream();
        stream.block();
        ClientConnection connection = transport.createConnection("c1", stream, null);

        for (int i = 0; i < 6; i++) {
            assertThat(transport.send("c1", "posts", "m" + i)).isTrue();
        }
        assertThat(connection.droppedCount()).isPositive();
        stream.release();

        Await.until(() -> stream.events("posts").stream().anyMatch(e -> e.data().equals("m5")));
        assertThat(connection.isOpen()).isTrue();
        assertThat(stream.events("posts")).extracting(RecordingStream.Event::data).endsWith("m4", "m5");
    }

    @Test
    void writeFailureIsAnImplicitDisconnect() {
        TransportManager transport = manager();
        RecordingStream stream = new RecordingStream();
        ClientConnection connection = transport.createConnection("c1", stream, null);
        registry.subscribe("c1", "posts", null, null, null);
        Await.until(() -> !stream.events().isEmpty());

        stream.failWrites();
        transport.send("c1", "posts", "boom");

        Await.until(() -> connection.state() == ConnectionState.CLOSED);
        assertThat(connection.closeReason()).isEqualTo(CloseReason.WRITE_FAILED);
        assertThat(transport.connection("c1")).isEmpty();
        assertThat(registry.listByClient("c1")).isEmpty();
        assertThat(transport.send("c1", "posts", "again")).isFalse();
    }

    @Test
    void clientDisconnectCascades() {
        TransportManager transport = manager();
        RecordingStream stream = new RecordingStream();
        ClientConnection connection = transport.createConnection("c1", stream, null);
        registry.subscribe("c1", "posts", null, null, null);

        stream.disconnect();

        assertThat(connection.state()).isEqualTo(ConnectionState.CLOSED);
        assertThat(connection.closeReason()).isEqualTo(CloseReason.CLIENT_CLOSED);
        assertThat(registry.size()).isZero();
        assertThat(transport.connectionCount()).isZero();
    }

    @Test
    void racingClosesRunCleanupOnce() throws Exception {
        TransportManager transport = manager();
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            for (int round = 0; round < 50; round++) {
                RecordingStream stream = new RecordingStream();
                ClientConnection connection = transport.createConnection("c" + round, stream, null);
                CountDownLatch start = new CountDownLatch(1);
                List<Future<Boolean>> results = new ArrayList<>();
                results.add(pool.submit(() -> {
                    start.await();
                    return connection.close(CloseReason.WRITE_FAILED);
                }));
                results.add(pool.submit(() -> {
                    start.await();
                    return connection.close(CloseReason.EXPLICIT);
                }));
                results.add(pool.submit(() -> {
                    start.await();
                    stream.disconnect();
                    return false;
                }));
                start.countDown();

                int performed = 0;
                for (Future<Boolean> f : results) {
                    if (f.get(5, TimeUnit.SECONDS)) performed++;
                }
                assertThat(performed).isLessThanOrEqualTo(1);
                assertThat(connection.state()).isEqualTo(ConnectionState.CLOSED);
                assertThat(connection.closeReason()).isNotNull();
            }
        } finally {
            pool.shutdownNow();
        }
        assertThat(transport.connectionCount()).isZero();
    }

    @Test
    void secondConnectionReplacesTheFirst() {
        TransportManager transport = manager();
        RecordingStream old = new RecordingStream();
        RecordingStream replacement = new RecordingStream();

        ClientConnection first = transport.createConnection("c1", old, null);
        ClientConnection second = transport.createConnection("c1", replacement, null);

        assertThat(first.closeReason()).isEqualTo(CloseReason.REPLACED);
        assertThat(old.isClosed()).isTrue();
        assertThat(second.isOpen()).isTrue();
        assertThat(transport.connection("c1")).containsSame(second);
    }

    @Test
    void closeShutsEveryConnection() {
        TransportManager transport = manager();
        RecordingStream a = new RecordingStream();
        RecordingStream b = new RecordingStream();
        transport.createConnection("a", a, null);
        transport.createConnection("b", b, null);

        transport.close();

        assertThat(a.isClosed()).isTrue();
        assertThat(b.isClosed()).isTrue();
        assertThat(transport.connectionCount()).isZero();
        assertThat(transport.send("a", "posts", "x")).isFalse();
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
