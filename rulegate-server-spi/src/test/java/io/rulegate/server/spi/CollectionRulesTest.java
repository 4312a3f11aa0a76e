package io.rulegate.server.spi;

import io.rulegate.core.RuleType;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CollectionRulesTest {

    @Test
    void mapsNullBlankAndExpressionSources() {
        assertThat(AccessRule.of(null)).isInstanceOf(AccessRule.DenyAll.class);
        assertThat(AccessRule.of("  ")).isInstanceOf(AccessRule.AllowAll.class);
        assertThat(AccessRule.of(" auth.id = record.userId "))
                .isEqualTo(new AccessRule.Expression("auth.id = record.userId"));
        assertThatThrownBy(() -> new AccessRule.Expression(" "))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void missingOperationsAreDenyAll() {
        CollectionRules rules = CollectionRules.builder()
                .view("")
                .list("auth.id != null")
                .build();

        assertThat(rules.rule(RuleType.VIEW)).isInstanceOf(AccessRule.AllowAll.class);
        assertThat(rules.rule(RuleType.LIST)).isInstanceOf(AccessRule.Expression.class);
        assertThat(rules.rule(RuleType.DELETE)).isInstanceOf(AccessRule.DenyAll.class);
        assertThat(CollectionRules.denyAll().rule(RuleType.VIEW)).isInstanceOf(AccessRule.DenyAll.class);
    }

    @Test
    void ruleContextCarriesAdminFlagFromAuth() {
        RuleContext admin = RuleContext.of(AuthContext.admin(null), Map.of("id", "r1"));
        RuleContext anon = RuleContext.of(null, Map.of("id", "r1"));

        assertThat(admin.admin()).isTrue();
        assertThat(anon.admin()).isFalse();
        assertThat(anon.auth()).isNull();
        assertThat(AuthContext.of(Map.of("id", 7)).principalId()).contains("7");
    }

    @Test
    void fieldEqualsComparesNumbersNumericallyAndFollowsPaths() {
        Map<String, Object> record = new HashMap<>();
        record.put("views", 10);
        record.put("owner", Map.of("id", "u1"));
        record.put("deleted", null);

        assertThat(new FilterFragment.FieldEquals("views", 10.0).test(record)).isTrue();
        assertThat(new FilterFragment.FieldEquals("owner.id", "u1").test(record)).isTrue();
        assertThat(new FilterFragment.FieldEquals("owner.id", "u2").test(record)).isFalse();
        assertThat(new FilterFragment.FieldEquals("deleted", null).test(record)).isTrue();
        assertThat(new FilterFragment.FieldEquals("missing", null).test(record)).isTrue();
    }

    @Test
    void compositeFragmentsCombineParts() {
        Map<String, Object> record = Map.of("a", 1, "b", 2);
        FilterFragment a = new FilterFragment.FieldEquals("a", 1);
        FilterFragment notB = new FilterFragment.FieldEquals("b", 3);

        assertThat(new FilterFragment.And(List.of(a, notB)).test(record)).isFalse();
        assertThat(new FilterFragment.Or(List.of(a, notB)).test(record)).isTrue();
        assertThat(FilterFragment.alwaysFalse().test(record)).isFalse();
        assertThat(FilterFragment.alwaysTrue().test(record)).isTrue();
    }
}
