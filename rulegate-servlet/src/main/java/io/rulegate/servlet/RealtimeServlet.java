package io.rulegate.servlet;

import io.rulegate.core.Protocol;
import io.rulegate.server.core.HttpMethod;
import io.rulegate.server.core.RealtimeHandler;
import io.rulegate.server.core.ResponseBody;
import io.rulegate.server.core.ServerRequest;
import io.rulegate.server.core.ServerResponse;
import io.rulegate.server.core.SseFrame;
import jakarta.servlet.AsyncContext;
import jakarta.servlet.AsyncEvent;
import jakarta.servlet.AsyncListener;
import jakarta.servlet.ServletOutputStream;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.Enumeration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Flow;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Jakarta Servlet adapter for {@link RealtimeHandler}.
 *
 * <p>SSE responses switch the request to async mode and stream frames until either side closes.
 * Requires async support on the servlet registration.
 */
public final class RealtimeServlet extends HttpServlet {

    private static final Logger log = LoggerFactory.getLogger(RealtimeServlet.class);

    private final RealtimeHandler handler;

    public RealtimeServlet(RealtimeHandler handler) {
        this.handler = Objects.requireNonNull(handler, "handler");
    }

    @Override
    protected void service(HttpServletRequest req, HttpServletResponse resp) throws IOException {
        HttpMethod method;
        try {
            method = HttpMethod.valueOf(req.getMethod().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            resp.setStatus(405);
            resp.setHeader("Allow", "GET, POST, DELETE");
            return;
        }

        ServerResponse engineResp;
        try {
            engineResp = handler.handle(toEngineRequest(req, method));
        } catch (URISyntaxException e) {
            resp.setStatus(400);
            resp.setHeader(Protocol.H_ERROR, "invalid_uri");
            return;
        }

        resp.setStatus(engineResp.status());
        engineResp.headers().forEach((k, vals) -> vals.forEach(v -> resp.addHeader(k, v)));

        ResponseBody body = engineResp.body();
        if (body instanceof ResponseBody.Bytes bytes) {
            resp.getOutputStream().write(bytes.bytes());
        } else if (body instanceof ResponseBody.Sse sse) {
            stream(req, resp, sse);
        }
    }

    private static void stream(HttpServletRequest req, HttpServletResponse resp, ResponseBody.Sse sse) throws IOException {
        ServletOutputStream out = resp.getOutputStream();
        // commit headers before the first event
        out.flush();

        AsyncContext async = req.startAsync();
        async.setTimeout(0);
        FrameWriter writer = new FrameWriter(async, out);
        async.addListener(writer);
        sse.publisher().subscribe(writer);
    }

    private static ServerRequest toEngineRequest(HttpServletRequest req, HttpMethod method) throws IOException, URISyntaxException {
        URI uri = new URI(req.getRequestURL().toString() + (req.getQueryString() == null ? "" : "?" + req.getQueryString()));

        Map<String, List<String>> headers = new LinkedHashMap<>();
        Enumeration<String> names = req.getHeaderNames();
        while (names != null && names.hasMoreElements()) {
            String name = names.nextElement();
            headers.put(name, Collections.list(req.getHeaders(name)));
        }

        byte[] bodyBytes = readBody(req);
        InputStream body = bodyBytes.length == 0 ? null : new ByteArrayInputStream(bodyBytes);
        return new ServerRequest(method, uri, headers, body);
    }

    private static byte[] readBody(HttpServletRequest req) throws IOException {
        if (req.getContentLengthLong() == 0) {
            return new byte[0];
        }
        try (InputStream in = req.getInputStream()) {
            return in == null ? new byte[0] : in.readAllBytes();
        }
    }

    /**
     * Writes frames to the async response; cancels the publisher when the container reports the
     * peer gone.
     */
    private static final class FrameWriter implements Flow.Subscriber<SseFrame>, AsyncListener {
        private final AsyncContext async;
        private final ServletOutputStream out;
        private final AtomicBoolean completed = new AtomicBoolean();
        private volatile Flow.Subscription subscription;

        FrameWriter(AsyncContext async, ServletOutputStream out) {
            this.async = async;
            this.out = out;
        }

        @Override
        public void onSubscribe(Flow.Subscription subscription) {
            this.subscription = subscription;
            subscription.request(Long.MAX_VALUE);
        }

        @Override
        public void onNext(SseFrame item) {
            try {
                synchronized (out) {
                    out.write(item.render().getBytes(StandardCharsets.UTF_8));
                    out.flush();
                }
            } catch (IOException e) {
                log.debug("SSE write failed, closing stream", e);
                cancel();
                complete();
            }
        }

        @Override
        public void onError(Throwable throwable) {
            log.debug("SSE publisher failed", throwable);
            complete();
        }

        @Override
        public void onComplete() {
            complete();
        }

        @Override
        public void onComplete(AsyncEvent event) {
            cancel();
        }

        @Override
        public void onTimeout(AsyncEvent event) {
            cancel();
            complete();
        }

        @Override
        public void onError(AsyncEvent event) {
            cancel();
            complete();
        }

        @Override
        public void onStartAsync(AsyncEvent event) {
            // no-op
        }

        private void cancel() {
            Flow.Subscription s = subscription;
            if (s != null) s.cancel();
        }

        private void complete() {
            if (completed.compareAndSet(false, true)) {
                async.complete();
            }
        }
    }
}
