package io.rulegate.server.core;

import io.rulegate.core.Protocol;
import io.rulegate.core.RuleGateException;
import io.rulegate.json.spi.JsonCodec;
import io.rulegate.json.spi.JsonException;
import io.rulegate.server.core.subscription.Subscription;
import io.rulegate.server.spi.AuthContext;
import io.rulegate.server.spi.RequestAuthenticator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Framework-neutral HTTP handler for the realtime endpoint.
 *
 * <ul>
 *   <li>{@code GET} opens an SSE stream; its first event is {@code connected} with the client id</li>
 *   <li>{@code POST {clientId, collection, recordId?, filter?}} subscribes</li>
 *   <li>{@code DELETE ?clientId=..[&subscription=..]} unsubscribes one or all</li>
 * </ul>
 *
 * <p>The handler is path-agnostic; mount it wherever the host routes realtime traffic.
 *
 * <pre>{@code
 * RealtimeHandler handler = RealtimeHandler.builder(engine)
 *     .authenticator(headers -> sessions.lookup(headers))
 *     .build();
 * }</pre>
 */
public final class RealtimeHandler {

    public static final Duration DEFAULT_SSE_DEMAND_TIMEOUT = Duration.ofSeconds(30);

    private static final Logger log = LoggerFactory.getLogger(RealtimeHandler.class);

    private final RealtimeEngine engine;
    private final RequestAuthenticator authenticator;
    private final JsonCodec codec;
    private final Duration sseDemandTimeout;

    public static Builder builder(RealtimeEngine engine) {
        return new Builder(engine);
    }

    public RealtimeHandler(RealtimeEngine engine) {
        this(builder(engine));
    }

    private RealtimeHandler(Builder builder) {
        this.engine = Objects.requireNonNull(builder.engine, "engine");
        this.authenticator = builder.authenticator != null ? builder.authenticator : RequestAuthenticator.anonymous();
        this.codec = builder.codec != null ? builder.codec : engine.codec();
        this.sseDemandTimeout = builder.sseDemandTimeout != null ? builder.sseDemandTimeout : DEFAULT_SSE_DEMAND_TIMEOUT;
    }

    /**
     * Builder for {@link RealtimeHandler}.
     */
    public static final class Builder {
        private final RealtimeEngine engine;
        private RequestAuthenticator authenticator;
        private JsonCodec codec;
        private Duration sseDemandTimeout;

        private Builder(RealtimeEngine engine) {
            this.engine = Objects.requireNonNull(engine, "engine");
        }

        /** Maps request headers to a principal. Default: every request is anonymous. */
        public Builder authenticator(RequestAuthenticator authenticator) {
            this.authenticator = authenticator;
            return this;
        }

        /** Codec for request and response bodies. Default: the engine's codec. */
        public Builder codec(JsonCodec codec) {
            this.codec = codec;
            return this;
        }

        /** How long an SSE write waits for subscriber demand before the client is dropped. Default: 30 seconds. */
        public Builder sseDemandTimeout(Duration sseDemandTimeout) {
            this.sseDemandTimeout = sseDemandTimeout;
            return this;
        }

        public RealtimeHandler build() {
            return new RealtimeHandler(this);
        }
    }

    public ServerResponse handle(ServerRequest req) {
        try {
            return switch (req.method()) {
                case GET -> handleConnect(req);
                case POST -> handleSubscribe(req);
                case DELETE -> handleUnsubscribe(req);
                case PUT, HEAD -> new ServerResponse(405, new ResponseBody.Empty())
                        .header("Allow", "GET, POST, DELETE")
                        .header(Protocol.H_CACHE_CONTROL, "no-store");
            };
        } catch (BadRequest br) {
            return error(400, br.getMessage());
        } catch (RuleGateException.SubscriptionRejected rejected) {
            return error(400, rejected.reason());
        } catch (RuleGateException.ClientNotConnected e) {
            return error(404, "client_not_connected");
        } catch (RuleGateException.ClientAuthMismatch e) {
            return error(403, "forbidden");
        } catch (Exception e) {
            log.error("Realtime request {} {} failed", req.method(), req.uri(), e);
            return error(500, "internal_error");
        }
    }

    private ServerResponse handleConnect(ServerRequest req) {
        AuthContext auth = authenticate(req);
        SseClientStream stream = new SseClientStream(s -> engine.connect(s, auth), sseDemandTimeout);
        return new ServerResponse(200, new ResponseBody.Sse(stream))
                .header(Protocol.H_CONTENT_TYPE, Protocol.CT_EVENT_STREAM)
                .header(Protocol.H_CACHE_CONTROL, "no-store")
                .header(Protocol.H_ACCEL_BUFFERING, "no");
    }

    private ServerResponse handleSubscribe(ServerRequest req) throws JsonException {
        if (req.body() == null) throw new BadRequest("empty body");
        SubscribeRequest body;
        try {
            body = codec.readValue(req.body(), SubscribeRequest.class);
        } catch (JsonException e) {
            throw new BadRequest("invalid_json");
        }
        if (body == null) throw new BadRequest("empty body");

        AuthContext auth = authenticate(req);
        Subscription s = engine.subscribe(body.getClientId(), body.getCollection(), body.getRecordId(),
                body.getFilter(), auth);

        Map<String, Object> out = new LinkedHashMap<>();
        out.put("id", s.id());
        out.put(Protocol.F_CLIENT_ID, s.clientId());
        out.put(Protocol.F_COLLECTION, s.collection());
        out.put("recordId", s.recordId());
        out.put("filter", s.filterExpr());
        return new ServerResponse(200, new ResponseBody.Bytes(codec.writeBytes(out)))
                .header(Protocol.H_CONTENT_TYPE, Protocol.CT_JSON)
                .header(Protocol.H_CACHE_CONTROL, "no-store");
    }

    private ServerResponse handleUnsubscribe(ServerRequest req) {
        Map<String, String> q = QueryString.parse(req.uri());
        String clientId = q.get(Protocol.Q_CLIENT_ID);
        if (clientId == null || clientId.isBlank()) throw new BadRequest("missing clientId");
        AuthContext auth = authenticate(req);

        String subscriptionId = q.get(Protocol.Q_SUBSCRIPTION);
        if (subscriptionId == null || subscriptionId.isBlank()) {
            engine.unsubscribeClient(clientId, auth);
            return empty(204);
        }
        return engine.unsubscribe(clientId, subscriptionId, auth) ? empty(204) : error(404, "subscription_not_found");
    }

    private AuthContext authenticate(ServerRequest req) {
        AuthContext auth = authenticator.authenticate(req.headers());
        return auth == null ? AuthContext.anonymous() : auth;
    }

    private static ServerResponse empty(int status) {
        return new ServerResponse(status, new ResponseBody.Empty())
                .header(Protocol.H_CACHE_CONTROL, "no-store");
    }

    private static ServerResponse error(int status, String code) {
        return empty(status).header(Protocol.H_ERROR, code);
    }

    private static final class BadRequest extends RuntimeException {
        BadRequest(String msg) {
            super(msg);
        }
    }
}
