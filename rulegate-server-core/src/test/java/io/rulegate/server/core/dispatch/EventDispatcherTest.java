package io.rulegate.server.core.dispatch;

import io.rulegate.core.RecordAction;
import io.rulegate.json.jackson.JacksonJsonCodec;
import io.rulegate.server.core.InMemoryRulesProvider;
import io.rulegate.server.core.expression.ExpressionEvaluator;
import io.rulegate.server.core.filter.FilterMode;
import io.rulegate.server.core.rules.RulesEngine;
import io.rulegate.server.core.subscription.SubscriptionRegistry;
import io.rulegate.server.core.testing.MutableClock;
import io.rulegate.server.spi.AuthContext;
import io.rulegate.server.spi.AuthResolver;
import io.rulegate.server.spi.CollectionRules;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;

class EventDispatcherTest {

    private static final AuthContext U1 = AuthContext.of(Map.of("id", "u1"));
    private static final AuthContext U2 = AuthContext.of(Map.of("id", "u2"));

    private final MutableClock clock = new MutableClock(Instant.parse("2024-03-01T12:00:00Z"));
    private final InMemoryRulesProvider provider = new InMemoryRulesProvider();
    private final ExpressionEvaluator evaluator = new ExpressionEvaluator();
    private final SubscriptionRegistry registry = new SubscriptionRegistry(evaluator, FilterMode.RESTRICTED, clock, 100);
    private final RecordingSink sink = new RecordingSink();
    private final JacksonJsonCodec codec = new JacksonJsonCodec();

    private EventDispatcher dispatcher(AuthRefreshPolicy policy, AuthResolver resolver) {
        return new EventDispatcher(registry, new RulesEngine(provider, evaluator), sink, codec, clock, policy, resolver);
    }

    private EventDispatcher dispatcher() {
        return dispatcher(AuthRefreshPolicy.SNAPSHOT, AuthResolver.snapshot());
    }

    @Test
    void denyAllViewRuleDeliversNothing() {
        provider.put("posts", CollectionRules.builder().list("").build());
        registry.subscribe("c1", "posts", null, null, U1);

        int delivered = dispatcher().emitRecordEvent("posts", RecordAction.CREATE, Map.of("id", "p1", "userId", "u1"));

        assertThat(delivered).isZero();
        assertThat(sink.messages).isEmpty();
    }

    @Test
    void allowAllViewRuleDeliversEveryEventSubjectToFilter() throws Exception {
        provider.put("posts", CollectionRules.builder().view("").build());
        registry.subscribe("c1", "posts", null, null, U1);
        registry.subscribe("c2", "posts", null, "views > 100", U2);

        EventDispatcher dispatcher = dispatcher();
        assertThat(dispatcher.emitRecordEvent("posts", RecordAction.CREATE, Map.of("id", "p1", "views", 1))).isEqualTo(1);
        assertThat(dispatcher.emitRecordEvent("posts", RecordAction.UPDATE, Map.of("id", "p1", "views", 500))).isEqualTo(2);
        assertThat(dispatcher.emitRecordEvent("comments", RecordAction.CREATE, Map.of("id", "x"))).isZero();

        Message first = sink.messages.get(0);
        assertThat(first.clientId()).isEqualTo("c1");
        assertThat(first.event()).isEqualTo("posts");
        Map<?, ?> body = codec.readValue(first.data(), Map.class);
        assertThat(body.get("action")).isEqualTo("create");
        assertThat(body.get("collection")).isEqualTo("posts");
        assertThat(body.get("timestamp")).isEqualTo("2024-03-01T12:00:00Z");
        assertThat((Map<Object, Object>) body.get("record")).containsEntry("id", "p1");
    }

    @Test
    void ownershipRuleIsCheckedPerRecord() {
        provider.put("posts", CollectionRules.builder().view("auth.id = record.userId").build());
        registry.subscribe("c1", "posts", null, null, U1);

        EventDispatcher dispatcher = dispatcher();
        dispatcher.emitRecordEvent("posts", RecordAction.CREATE, Map.of("id", "p1", "userId", "u1"));
        dispatcher.emitRecordEvent("posts", RecordAction.CREATE, Map.of("id", "p2", "userId", "u2"));

        assertThat(sink.messages).hasSize(1);
        assertThat(sink.messages.get(0).data()).contains("\"p1\"").doesNotContain("\"p2\"");
    }

    @Test
    void publishedWithViewsFilter() {
        provider.put("posts", CollectionRules.builder().view("").build());
        registry.subscribe("c1", "posts", null, "status='published' && views>10", U1);

        EventDispatcher dispatcher = dispatcher();
        assertThat(dispatcher.emitRecordEvent("posts", RecordAction.UPDATE,
                Map.of("id", "p1", "status", "published", "views", 5))).isZero();
        assertThat(dispatcher.emitRecordEvent("posts", RecordAction.UPDATE,
                Map.of("id", "p1", "status", "published", "views", 20))).isEqualTo(1);
    }

    @Test
    void reevaluatesAtDeliveryTime() {
        provider.put("posts", CollectionRules.builder().view("record.public = true").build());
        registry.subscribe("c1", "posts", null, null, U1);
        EventDispatcher dispatcher = dispatcher();

        assertThat(dispatcher.emitRecordEvent("posts", RecordAction.UPDATE, Map.of("id", "p1", "public", true))).isEqualTo(1);
        assertThat(dispatcher.emitRecordEvent("posts", RecordAction.UPDATE, Map.of("id", "p1", "public", false))).isZero();

        provider.put("posts", CollectionRules.builder().view("record.public = false").build());
        assertThat(dispatcher.emitRecordEvent("posts", RecordAction.UPDATE, Map.of("id", "p1", "public", false))).isEqualTo(1);
    }

    @Test
    void recordSubscriptionsOnlyReceiveTheirRecord() {
        provider.put("posts", CollectionRules.builder().view("").build());
        registry.subscribe("c1", "posts", "42", null, U1);
        EventDispatcher dispatcher = dispatcher();

        assertThat(dispatcher.emitRecordEvent("posts", RecordAction.UPDATE, Map.of("id", 42))).isEqualTo(1);
        assertThat(dispatcher.emitRecordEvent("posts", RecordAction.UPDATE, Map.of("id", 43))).isZero();
        assertThat(dispatcher.emitRecordEvent("posts", RecordAction.UPDATE, Map.of("title", "no id"))).isZero();
    }

    @Test
    void clientReceivesAnEventOnceEvenWithSeveralMatchingSubscriptions() {
        provider.put("posts", CollectionRules.builder().view("").build());
        registry.subscribe("c1", "posts", null, null, U1);
        registry.subscribe("c1", "posts", "p1", null, U1);

        assertThat(dispatcher().emitRecordEvent("posts", RecordAction.DELETE, Map.of("id", "p1"))).isEqualTo(1);
        assertThat(sink.messages).hasSize(1);
    }

    @Test
    void oneFailingCandidateDoesNotStopFanOut() {
        provider.put("posts", CollectionRules.builder().view("record.views > auth.limit").build());
        registry.subscribe("bad", "posts", null, null, AuthContext.of(Map.of("id", "x", "limit", "not-a-number")));
        registry.subscribe("good", "posts", null, null, AuthContext.of(Map.of("id", "y", "limit", 1)));

        int delivered = dispatcher().emitRecordEvent("posts", RecordAction.CREATE, Map.of("id", "p1", "views", 5));

        assertThat(delivered).isEqualTo(1);
        assertThat(sink.messages).extracting(Message::clientId).containsExactly("good");
    }

    @Test
    void liveAuthRefreshUsesTheResolver() {
        provider.put("posts", CollectionRules.builder().view("auth.id = record.userId").build());
        registry.subscribe("c1", "posts", null, null, U1);
        Set<String> revoked = ConcurrentHashMap.newKeySet();
        AuthResolver resolver = captured -> revoked.contains(captured.principalId().orElse(""))
                ? Optional.empty()
                : Optional.of(captured);
        EventDispatcher dispatcher = dispatcher(AuthRefreshPolicy.LIVE, resolver);

        assertThat(dispatcher.emitRecordEvent("posts", RecordAction.CREATE, Map.of("id", "p1", "userId", "u1"))).isEqualTo(1);
        revoked.add("u1");
        assertThat(dispatcher.emitRecordEvent("posts", RecordAction.CREATE, Map.of("id", "p2", "userId", "u1"))).isZero();
    }

    @Test
    void rejectedSendsAreNotCounted() {
        provider.put("posts", CollectionRules.builder().view("").build());
        registry.subscribe("c1", "posts", null, null, U1);
        EventDispatcher dispatcher = new EventDispatcher(registry, new RulesEngine(provider, evaluator),
                (clientId, event, data) -> false, codec, clock, AuthRefreshPolicy.SNAPSHOT, AuthResolver.snapshot());

        assertThat(dispatcher.emitRecordEvent("posts", RecordAction.CREATE, Map.of("id", "p1"))).isZero();
    }

    record Message(String clientId, String event, String data) {}

    static final class RecordingSink implements MessageSink {
        final List<Message> messages = new CopyOnWriteArrayList<>();

        @Override
        public boolean send(String clientId, String event, String data) {
            messages.add(new Message(clientId, event, data));
            return true;
        }
    }
}
