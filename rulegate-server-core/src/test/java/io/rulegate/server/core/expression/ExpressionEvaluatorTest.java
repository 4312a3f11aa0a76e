package io.rulegate.server.core.expression;

import io.rulegate.server.core.testing.MutableClock;
import io.rulegate.server.spi.AuthContext;
import io.rulegate.server.spi.RuleContext;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExpressionEvaluatorTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
    private final ExpressionEvaluator evaluator = new ExpressionEvaluator(clock, ExpressionLimits.defaults());

    @Test
    void comparesAuthAgainstRecord() throws Exception {
        RuleContext ctx = RuleContext.of(AuthContext.of(Map.of("id", "u1")), Map.of("userId", "u1"));
        RuleContext other = RuleContext.of(AuthContext.of(Map.of("id", "u1")), Map.of("userId", "u2"));

        assertThat(evaluator.test(evaluator.compile("auth.id = record.userId"), ctx)).isTrue();
        assertThat(evaluator.test(evaluator.compile("auth.id = record.userId"), other)).isFalse();
    }

    @Test
    void numbersCompareNumerically() throws Exception {
        RuleContext ctx = RuleContext.recordOnly(Map.of("views", 20, "score", 1.5, "count", 1L));

        assertThat(evaluator.evaluate("record.views > 10", ctx)).isEqualTo(true);
        assertThat(evaluator.evaluate("record.views <= 20.0", ctx)).isEqualTo(true);
        assertThat(evaluator.evaluate("record.score = 1.50", ctx)).isEqualTo(true);
        assertThat(evaluator.evaluate("record.count = 1", ctx)).isEqualTo(true);
        assertThat(evaluator.evaluate("record.count != '1'", ctx)).isEqualTo(true);
    }

    @Test
    void missingFieldsAreNull() throws Exception {
        Map<String, Object> record = new HashMap<>();
        record.put("owner", "plain-string");
        record.put("archived", null);
        RuleContext ctx = RuleContext.recordOnly(record);

        assertThat(evaluator.evaluate("record.nope", ctx)).isNull();
        assertThat(evaluator.evaluate("record.owner.id", ctx)).isNull();
        assertThat(evaluator.evaluate("record.archived = null", ctx)).isEqualTo(true);
        assertThat(evaluator.evaluate("auth.id = null", ctx)).isEqualTo(true);
    }

    @Test
    void walksNestedMapsAndListIndexes() throws Exception {
        RuleContext ctx = RuleContext.recordOnly(Map.of(
                "owner", Map.of("id", "u7"),
                "tags", List.of("a", "b")));

        assertThat(evaluator.evaluate("record.owner.id", ctx)).isEqualTo("u7");
        assertThat(evaluator.evaluate("record.tags.1", ctx)).isEqualTo("b");
        assertThat(evaluator.evaluate("record.tags.9", ctx)).isNull();
    }

    @Test
    void listIndexesMayAppearMidPath() throws Exception {
        RuleContext ctx = RuleContext.recordOnly(Map.of(
                "items", List.of(Map.of("name", "first"), Map.of("name", "second"))));

        assertThat(evaluator.evaluate("record.items.1.name", ctx)).isEqualTo("second");
        assertThat(evaluator.evaluate("record.items.0.name = 'first'", ctx)).isEqualTo(true);
        assertThat(evaluator.evaluate("record.items.2.name", ctx)).isNull();
    }

    @Test
    void booleanConnectivesShortCircuit() throws Exception {
        RuleContext ctx = RuleContext.recordOnly(Map.of("status", "draft"));

        // the right-hand side would fail: strings and numbers cannot be ordered
        assertThat(evaluator.evaluate("record.status = 'published' && record.status > 1", ctx)).isEqualTo(false);
        assertThat(evaluator.evaluate("record.status = 'draft' || record.status > 1", ctx)).isEqualTo(true);
        assertThat(evaluator.evaluate("!(record.status = 'draft')", ctx)).isEqualTo(false);
    }

    @Test
    void helperFunctions() throws Exception {
        RuleContext ctx = RuleContext.of(
                AuthContext.of(Map.of("id", "u1", "roles", List.of("editor"))),
                Map.of("tags", List.of("x", "y"), "title", "Hello world", "meta", Map.of("k", 1), "empty", ""));

        assertThat(evaluator.evaluate("$contains(auth.roles, 'editor')", ctx)).isEqualTo(true);
        assertThat(evaluator.evaluate("$contains(record.title, 'world')", ctx)).isEqualTo(true);
        assertThat(evaluator.evaluate("$contains(record.meta, 'k')", ctx)).isEqualTo(true);
        assertThat(evaluator.evaluate("$contains(record.missing, 'k')", ctx)).isEqualTo(false);
        assertThat(evaluator.evaluate("$size(record.tags)", ctx)).isEqualTo(2L);
        assertThat(evaluator.evaluate("$size(record.missing) = 0", ctx)).isEqualTo(true);
        assertThat(evaluator.evaluate("$isEmpty(record.empty)", ctx)).isEqualTo(true);
        assertThat(evaluator.evaluate("$isNotEmpty(record.tags)", ctx)).isEqualTo(true);
        assertThat(evaluator.evaluate("$now()", ctx)).isEqualTo("2024-05-01T10:00:00Z");
    }

    @Test
    void nowFollowsTheClock() throws Exception {
        CompiledExpression notExpired = evaluator.compile("record.expiresAt > $now()");
        RuleContext ctx = RuleContext.recordOnly(Map.of("expiresAt", "2024-05-01T12:00:00Z"));

        assertThat(evaluator.test(notExpired, ctx)).isTrue();
        clock.advance(Duration.ofHours(3));
        assertThat(evaluator.test(notExpired, ctx)).isFalse();
    }

    @Test
    void runtimeProblemsAreEvaluationFailures() {
        RuleContext ctx = RuleContext.recordOnly(Map.of("n", 1, "s", "x"));

        assertThatThrownBy(() -> evaluator.evaluate("record.n > 'x'", ctx))
                .isInstanceOf(ExpressionException.class)
                .extracting(e -> ((ExpressionException) e).phase())
                .isEqualTo(ExpressionException.Phase.EVALUATE);
        assertThatThrownBy(() -> evaluator.evaluate("$size(record.n)", ctx))
                .isInstanceOf(ExpressionException.class);
        assertThatThrownBy(() -> evaluator.evaluate("user.id = 1", ctx))
                .isInstanceOf(ExpressionException.class)
                .hasMessageContaining("unknown identifier");
    }

    @Test
    void recordFiltersResolveBareIdentifiers() throws Exception {
        CompiledExpression filter = evaluator.compile("status = 'published' && record.views > 10");

        assertThat(evaluator.testRecord(filter, Map.of("status", "published", "views", 20))).isTrue();
        assertThat(evaluator.testRecord(filter, Map.of("status", "published", "views", 5))).isFalse();
    }

    @Test
    void truthiness() {
        assertThat(Values.truthy(null)).isFalse();
        assertThat(Values.truthy(0)).isFalse();
        assertThat(Values.truthy(0.0)).isFalse();
        assertThat(Values.truthy("")).isFalse();
        assertThat(Values.truthy(List.of())).isFalse();
        assertThat(Values.truthy(Map.of())).isFalse();
        assertThat(Values.truthy("false")).isTrue();
        assertThat(Values.truthy(-1)).isTrue();
    }
}
