package io.rulegate.servlet;

import io.rulegate.json.jackson.JacksonJsonCodec;
import io.rulegate.server.core.InMemoryRulesProvider;
import io.rulegate.server.core.RealtimeEngine;
import io.rulegate.server.core.RealtimeHandler;
import io.rulegate.server.spi.CollectionRules;
import jakarta.servlet.AsyncContext;
import jakarta.servlet.AsyncEvent;
import jakarta.servlet.AsyncListener;
import jakarta.servlet.ReadListener;
import jakarta.servlet.ServletInputStream;
import jakarta.servlet.ServletOutputStream;
import jakarta.servlet.WriteListener;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Collections;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RealtimeServletTest {

    private static final Pattern CLIENT_ID = Pattern.compile("\"clientId\":\"([^\"]+)\"");

    private RealtimeEngine engine;
    private RealtimeServlet servlet;

    @BeforeEach
    void setUp() {
        InMemoryRulesProvider rules = new InMemoryRulesProvider()
                .put("news", CollectionRules.builder().list("").view("").build());
        engine = RealtimeEngine.builder(rules)
                .codec(new JacksonJsonCodec())
                .cleanupInterval(Duration.ZERO)
                .build();
        servlet = new RealtimeServlet(new RealtimeHandler(engine));
    }

    @AfterEach
    void tearDown() {
        engine.close();
    }

    @Test
    void streamsConnectedEventAndCancelsOnDisconnect() throws Exception {
        HttpServletRequest req = request("GET", null, null);
        AsyncContext async = mock(AsyncContext.class);
        when(req.startAsync()).thenReturn(async);
        HttpServletResponse resp = mock(HttpServletResponse.class);
        CapturingOutput out = new CapturingOutput();
        when(resp.getOutputStream()).thenReturn(out);

        servlet.service(req, resp);

        verify(resp).setStatus(200);
        verify(resp).addHeader("Content-Type", "text/event-stream");
        waitFor(() -> out.text().contains("event: connected"));
        Matcher m = CLIENT_ID.matcher(out.text());
        assertThat(m.find()).isTrue();
        String clientId = m.group(1);
        assertThat(engine.isConnected(clientId)).isTrue();

        ArgumentCaptor<AsyncListener> listener = ArgumentCaptor.forClass(AsyncListener.class);
        verify(async).addListener(listener.capture());
        listener.getValue().onError(new AsyncEvent(async));

        assertThat(engine.isConnected(clientId)).isFalse();
        verify(async, timeout(1000)).complete();
    }

    @Test
    void postForUnknownClientMapsErrorHeaders() throws Exception {
        HttpServletRequest req = request("POST", null, "{\"clientId\":\"nobody\",\"collection\":\"news\"}");
        HttpServletResponse resp = mock(HttpServletResponse.class);

        servlet.service(req, resp);

        verify(resp).setStatus(404);
        verify(resp).addHeader("X-Error", "client_not_connected");
    }

    @Test
    void unknownMethodIsNotAllowed() throws Exception {
        HttpServletRequest req = request("PATCH", null, null);
        HttpServletResponse resp = mock(HttpServletResponse.class);

        servlet.service(req, resp);

        verify(resp).setStatus(405);
        verify(resp).setHeader("Allow", "GET, POST, DELETE");
    }

    private static HttpServletRequest request(String method, String query, String body) throws IOException {
        HttpServletRequest req = mock(HttpServletRequest.class);
        when(req.getMethod()).thenReturn(method);
        when(req.getRequestURL()).thenReturn(new StringBuffer("http://localhost/realtime"));
        when(req.getQueryString()).thenReturn(query);
        when(req.getHeaderNames()).thenReturn(Collections.emptyEnumeration());
        byte[] bytes = body == null ? new byte[0] : body.getBytes(StandardCharsets.UTF_8);
        when(req.getContentLengthLong()).thenReturn((long) bytes.length);
        when(req.getInputStream()).thenReturn(new BytesInput(bytes));
        return req;
    }

    private static void waitFor(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) throw new AssertionError("condition not met in time");
            Thread.sleep(5);
        }
    }

    private static final class CapturingOutput extends ServletOutputStream {
        private final ByteArrayOutputStream bytes = new ByteArrayOutputStream();

        @Override
        public synchronized void write(int b) {
            bytes.write(b);
        }

        @Override
        public synchronized void write(byte[] b, int off, int len) {
            bytes.write(b, off, len);
        }

        synchronized String text() {
            return bytes.toString(StandardCharsets.UTF_8);
        }

        @Override
        public boolean isReady() {
            return true;
        }

        @Override
        public void setWriteListener(WriteListener writeListener) {
        }
    }

    private static final class BytesInput extends ServletInputStream {
        private final ByteArrayInputStream in;

        BytesInput(byte[] bytes) {
            this.in = new ByteArrayInputStream(bytes);
        }

        @Override
        public int read() {
            return in.read();
        }

        @Override
        public boolean isFinished() {
            return in.available() == 0;
        }

        @Override
        public boolean isReady() {
            return true;
        }

        @Override
        public void setReadListener(ReadListener readListener) {
        }
    }
}
