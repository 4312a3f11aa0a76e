package io.rulegate.core;

import java.util.Objects;

/**
 * Base class for RuleGate related exceptions.
 *
 * <p>Provides a common hierarchy for protocol-level and runtime errors.
 * Subclasses should be specific to the error condition while preserving
 * the original cause when applicable.
 */
public abstract class RuleGateException extends RuntimeException {

    protected RuleGateException(String message) {
        super(message);
    }

    protected RuleGateException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Raised synchronously from subscribe when a subscription cannot be created.
     * No subscription exists after this is thrown.
     */
    public static class SubscriptionRejected extends RuleGateException {
        private final String reason;

        public SubscriptionRejected(String reason, String message) {
            super(message);
            this.reason = Objects.requireNonNull(reason, "reason");
        }

        public SubscriptionRejected(String reason, String message, Throwable cause) {
            super(message, cause);
            this.reason = Objects.requireNonNull(reason, "reason");
        }

        /** Machine-readable rejection reason, e.g. {@code invalid_filter}. */
        public String reason() {
            return reason;
        }
    }

    /**
     * Raised when an operation targets a client that has no open connection.
     */
    public static class ClientNotConnected extends RuleGateException {
        public ClientNotConnected(String clientId) {
            super("client not connected: " + clientId);
        }
    }

    /**
     * Raised when a request principal does not match the principal that opened the connection.
     */
    public static class ClientAuthMismatch extends RuleGateException {
        public ClientAuthMismatch(String clientId) {
            super("request principal does not own client " + clientId);
        }
    }
}
