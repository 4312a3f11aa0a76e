package io.rulegate.spring.boot;

import io.rulegate.json.jackson.JacksonJsonCodec;
import io.rulegate.json.spi.JsonCodec;
import io.rulegate.server.core.InMemoryRulesProvider;
import io.rulegate.server.core.RealtimeEngine;
import io.rulegate.server.core.RealtimeHandler;
import io.rulegate.server.spi.AuthResolver;
import io.rulegate.server.spi.RequestAuthenticator;
import io.rulegate.server.spi.RulesProvider;
import io.rulegate.servlet.RealtimeServlet;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Auto-configuration for the RuleGate realtime engine.
 *
 * <p>Provides default beans for {@link RulesProvider}, {@link JsonCodec}, {@link RealtimeEngine}
 * and {@link RealtimeHandler}, plus a {@link RealtimeServlet} when the Servlet API is present.
 * Each can be overridden by defining your own bean. Optional {@link AuthResolver} and
 * {@link RequestAuthenticator} beans are picked up when present.
 *
 * <p><strong>Note:</strong> no route is registered. Mount the servlet at the path your
 * application uses for realtime traffic, with async support enabled:
 * <pre>{@code
 * @Bean
 * public ServletRegistrationBean<RealtimeServlet> realtime(RealtimeServlet servlet) {
 *     ServletRegistrationBean<RealtimeServlet> reg = new ServletRegistrationBean<>(servlet, "/api/realtime");
 *     reg.setAsyncSupported(true);
 *     return reg;
 * }
 * }</pre>
 */
@AutoConfiguration
@ConditionalOnClass(RealtimeEngine.class)
@EnableConfigurationProperties(RuleGateProperties.class)
public class RuleGateAutoConfiguration {

    /**
     * Empty in-memory rules; every collection is denied until rules are registered.
     */
    @Bean
    @ConditionalOnMissingBean
    public RulesProvider ruleGateRulesProvider() {
        return new InMemoryRulesProvider();
    }

    @Bean
    @ConditionalOnMissingBean
    public JsonCodec ruleGateJsonCodec() {
        return new JacksonJsonCodec();
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public RealtimeEngine ruleGateRealtimeEngine(RulesProvider rulesProvider,
                                                 JsonCodec codec,
                                                 RuleGateProperties properties,
                                                 ObjectProvider<AuthResolver> authResolver) {
        return RealtimeEngine.builder(rulesProvider)
                .codec(codec)
                .heartbeatInterval(properties.getHeartbeatInterval())
                .sendBufferCapacity(properties.getSendBufferCapacity())
                .overflowPolicy(properties.getOverflowPolicy())
                .subscriptionMaxAge(properties.getSubscriptionMaxAge())
                .cleanupInterval(properties.getCleanupInterval())
                .maxSubscriptionsPerClient(properties.getMaxSubscriptionsPerClient())
                .filterMode(properties.getFilterMode())
                .authRefreshPolicy(properties.getAuthRefreshPolicy())
                .authResolver(authResolver.getIfAvailable())
                .build();
    }

    @Bean
    @ConditionalOnMissingBean
    public RealtimeHandler ruleGateRealtimeHandler(RealtimeEngine engine,
                                                   RuleGateProperties properties,
                                                   ObjectProvider<RequestAuthenticator> authenticator) {
        return RealtimeHandler.builder(engine)
                .authenticator(authenticator.getIfAvailable())
                .sseDemandTimeout(properties.getSseDemandTimeout())
                .build();
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(name = "jakarta.servlet.http.HttpServlet")
    static class ServletConfiguration {

        @Bean
        @ConditionalOnMissingBean
        public RealtimeServlet ruleGateRealtimeServlet(RealtimeHandler handler) {
            return new RealtimeServlet(handler);
        }
    }
}
