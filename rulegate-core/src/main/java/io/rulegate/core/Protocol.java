package io.rulegate.core;

/**
 * RuleGate realtime protocol constants (query keys, SSE event names, message fields).
 *
 * <p>This module intentionally contains no HTTP server bindings. It only models protocol-level
 * concerns that are shared across servers and adapters.
 */
public final class Protocol {
    private Protocol() {}

    // Query parameter keys
    public static final String Q_CLIENT_ID = "clientId";
    public static final String Q_SUBSCRIPTION = "subscription";

    // SSE event names (record events use the collection name as event name)
    public static final String EVENT_CONNECTED = "connected";
    public static final String EVENT_HEARTBEAT = "heartbeat";

    // Message fields
    public static final String F_TYPE = "type";
    public static final String F_CLIENT_ID = "clientId";
    public static final String F_TIMESTAMP = "timestamp";
    public static final String F_ACTION = "action";
    public static final String F_RECORD = "record";
    public static final String F_COLLECTION = "collection";

    /** Record field holding the record identifier, matched against a subscription's record id. */
    public static final String F_RECORD_ID = "id";

    // HTTP headers
    public static final String H_CONTENT_TYPE = "Content-Type";
    public static final String H_CACHE_CONTROL = "Cache-Control";
    public static final String H_ERROR = "X-Error";
    public static final String H_ACCEL_BUFFERING = "X-Accel-Buffering";

    // Content types
    public static final String CT_EVENT_STREAM = "text/event-stream";
    public static final String CT_JSON = "application/json";
}
