package io.rulegate.server.core.transport;

/**
 * Connection lifecycle: {@code CONNECTING -> OPEN -> CLOSING -> CLOSED}. Heartbeats run only
 * while {@code OPEN}.
 */
public enum ConnectionState {
    CONNECTING,
    OPEN,
    CLOSING,
    CLOSED;

    public boolean isTerminal() {
        return this == CLOSING || this == CLOSED;
    }
}
