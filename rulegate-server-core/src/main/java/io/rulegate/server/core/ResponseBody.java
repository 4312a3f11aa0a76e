package io.rulegate.server.core;

import java.util.concurrent.Flow;

/**
 * Framework-neutral response body abstraction.
 */
public sealed interface ResponseBody permits ResponseBody.Empty, ResponseBody.Bytes, ResponseBody.Sse {

    record Empty() implements ResponseBody {}

    record Bytes(byte[] bytes) implements ResponseBody {}

    /**
     * Event stream. Adapters subscribe once, write each frame as it arrives and cancel the
     * subscription when the peer goes away.
     */
    record Sse(Flow.Publisher<SseFrame> publisher) implements ResponseBody {}
}
