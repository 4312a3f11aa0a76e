package io.rulegate.server.core.transport;

public enum CloseReason {
    CLIENT_CLOSED,
    WRITE_FAILED,
    BUFFER_OVERFLOW,
    EXPLICIT,
    REPLACED,
    SHUTDOWN
}
