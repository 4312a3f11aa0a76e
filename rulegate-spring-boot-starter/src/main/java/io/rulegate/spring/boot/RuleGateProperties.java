package io.rulegate.spring.boot;

import io.rulegate.server.core.RealtimeEngine;
import io.rulegate.server.core.RealtimeHandler;
import io.rulegate.server.core.dispatch.AuthRefreshPolicy;
import io.rulegate.server.core.filter.FilterMode;
import io.rulegate.server.core.subscription.SubscriptionRegistry;
import io.rulegate.server.core.transport.OverflowPolicy;
import io.rulegate.server.core.transport.TransportManager;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Settings bound from {@code rulegate.*}. Unset values fall back to the engine defaults.
 */
@ConfigurationProperties("rulegate")
public class RuleGateProperties {

    /** Interval between heartbeat events on each open stream. */
    private Duration heartbeatInterval = TransportManager.DEFAULT_HEARTBEAT_INTERVAL;

    /** Outbound messages buffered per client before the overflow policy applies. */
    private int sendBufferCapacity = TransportManager.DEFAULT_SEND_BUFFER_CAPACITY;

    private OverflowPolicy overflowPolicy = OverflowPolicy.DISCONNECT;

    /** Idle age after which a subscription is swept. */
    private Duration subscriptionMaxAge = RealtimeEngine.DEFAULT_SUBSCRIPTION_MAX_AGE;

    /** Sweep interval; zero disables the background sweep. */
    private Duration cleanupInterval = RealtimeEngine.DEFAULT_CLEANUP_INTERVAL;

    private int maxSubscriptionsPerClient = SubscriptionRegistry.DEFAULT_MAX_SUBSCRIPTIONS_PER_CLIENT;

    private FilterMode filterMode = FilterMode.RESTRICTED;

    private AuthRefreshPolicy authRefreshPolicy = AuthRefreshPolicy.SNAPSHOT;

    /** How long an SSE write waits for subscriber demand. */
    private Duration sseDemandTimeout = RealtimeHandler.DEFAULT_SSE_DEMAND_TIMEOUT;

    public Duration getHeartbeatInterval() {
        return heartbeatInterval;
    }

    public void setHeartbeatInterval(Duration heartbeatInterval) {
        this.heartbeatInterval = heartbeatInterval;
    }

    public int getSendBufferCapacity() {
        return sendBufferCapacity;
    }

    public void setSendBufferCapacity(int sendBufferCapacity) {
        this.sendBufferCapacity = sendBufferCapacity;
    }

    public OverflowPolicy getOverflowPolicy() {
        return overflowPolicy;
    }

    public void setOverflowPolicy(OverflowPolicy overflowPolicy) {
        this.overflowPolicy = overflowPolicy;
    }

    public Duration getSubscriptionMaxAge() {
        return subscriptionMaxAge;
    }

    public void setSubscriptionMaxAge(Duration subscriptionMaxAge) {
        this.subscriptionMaxAge = subscriptionMaxAge;
    }

    public Duration getCleanupInterval() {
        return cleanupInterval;
    }

    public void setCleanupInterval(Duration cleanupInterval) {
        this.cleanupInterval = cleanupInterval;
    }

    public int getMaxSubscriptionsPerClient() {
        return maxSubscriptionsPerClient;
    }

    public void setMaxSubscriptionsPerClient(int maxSubscriptionsPerClient) {
        this.maxSubscriptionsPerClient = maxSubscriptionsPerClient;
    }

    public FilterMode getFilterMode() {
        return filterMode;
    }

    public void setFilterMode(FilterMode filterMode) {
        this.filterMode = filterMode;
    }

    public AuthRefreshPolicy getAuthRefreshPolicy() {
        return authRefreshPolicy;
    }

    public void setAuthRefreshPolicy(AuthRefreshPolicy authRefreshPolicy) {
        this.authRefreshPolicy = authRefreshPolicy;
    }

    public Duration getSseDemandTimeout() {
        return sseDemandTimeout;
    }

    public void setSseDemandTimeout(Duration sseDemandTimeout) {
        this.sseDemandTimeout = sseDemandTimeout;
    }
}
