package io.rulegate.server.core;

import io.rulegate.core.RuleType;
import io.rulegate.server.spi.AccessRule;
import io.rulegate.server.spi.CollectionRules;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryRulesProviderTest {

    @Test
    void storesAndReplacesRules() {
        InMemoryRulesProvider provider = new InMemoryRulesProvider()
                .put("posts", CollectionRules.builder().view("").build());

        assertThat(provider.find("posts")).isPresent();
        assertThat(provider.find("posts").get().rule(RuleType.VIEW)).isInstanceOf(AccessRule.AllowAll.class);

        provider.put("posts", CollectionRules.denyAll());
        assertThat(provider.find("posts").get().rule(RuleType.VIEW)).isInstanceOf(AccessRule.DenyAll.class);

        provider.remove("posts");
        assertThat(provider.find("posts")).isEmpty();
    }

    @Test
    void discoversJacksonCodecThroughServiceLoader() {
        assertThat(ServiceLoaderJsonCodecs.defaultCodec()).isNotNull();
    }
}
