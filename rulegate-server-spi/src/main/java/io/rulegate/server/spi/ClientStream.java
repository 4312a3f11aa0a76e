package io.rulegate.server.spi;

import java.io.IOException;

/**
 * Long-lived outbound stream to one client, supplied by the hosting framework.
 *
 * <p>Writes are issued by a single thread at a time. An {@link IOException} from
 * {@link #write(String, String)} is treated as a disconnect.
 */
public interface ClientStream {

    /**
     * Write one event and flush it.
     *
     * @param event event name (SSE {@code event:} field)
     * @param data  event payload
     * @throws IOException if the peer is gone or the write failed
     */
    void write(String event, String data) throws IOException;

    /**
     * Register a callback fired once when the peer disconnects or the stream errors.
     * Registering after the stream closed fires the callback immediately.
     */
    void onClose(Runnable callback);

    /**
     * Release the stream. Idempotent.
     */
    void close();
}
