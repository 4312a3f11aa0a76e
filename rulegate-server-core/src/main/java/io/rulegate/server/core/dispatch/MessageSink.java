package io.rulegate.server.core.dispatch;

/**
 * Hands serialized messages to client connections.
 */
@FunctionalInterface
public interface MessageSink {

    /**
     * Best-effort, non-blocking send.
     *
     * @return whether the message was accepted for delivery
     */
    boolean send(String clientId, String event, String data);
}
