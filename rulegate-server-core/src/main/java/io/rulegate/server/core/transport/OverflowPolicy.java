package io.rulegate.server.core.transport;

/**
 * What happens when a connection's send buffer is full.
 */
public enum OverflowPolicy {
    /** Treat the slow consumer as disconnected. */
    DISCONNECT,
    /** Discard the oldest queued message. */
    DROP_OLDEST
}
