package io.rulegate.server.core.dispatch;

/**
 * Which authentication state a delivery-time rule check sees.
 */
public enum AuthRefreshPolicy {
    /** The auth captured when the subscription was created. */
    SNAPSHOT,
    /** The auth re-fetched through {@link io.rulegate.server.spi.AuthResolver} at every delivery. */
    LIVE
}
