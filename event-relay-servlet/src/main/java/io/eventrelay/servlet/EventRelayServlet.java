package io.eventrelay.servlet;

import io.eventrelay.server.core.EventRelayServer;
import io.eventrelay.server.core.EventSink;
import io.eventrelay.server.core.HttpMethod;
import io.eventrelay.server.core.ServerRequest;
import io.eventrelay.server.core.ServerResponse;
import io.eventrelay.server.core.StreamExchange;
import jakarta.servlet.AsyncContext;
import jakarta.servlet.AsyncEvent;
import jakarta.servlet.AsyncListener;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Collections;
import java.util.Enumeration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Serves the relay's connect endpoint from a Jakarta Servlet container.
 *
 * <p>Register it with async support enabled; GET streams then run on an {@link AsyncContext} and
 * observe the container's completion, error and timeout callbacks as request cancellation. Without
 * async support the stream holds the container thread and disconnects are found by the keepalive.
 */
public final class EventRelayServlet extends HttpServlet {
    private static final Logger log = LoggerFactory.getLogger(EventRelayServlet.class);

    private final transient EventRelayServer relay;

    public EventRelayServlet(EventRelayServer relay) {
        this.relay = Objects.requireNonNull(relay, "relay");
    }

    @Override
    protected void service(HttpServletRequest req, HttpServletResponse resp) throws IOException {
        ServerRequest engineReq;
        try {
            engineReq = toEngineRequest(req);
        } catch (URISyntaxException e) {
            resp.sendError(400, "Malformed request URI");
            return;
        }

        if (engineReq.method() != HttpMethod.GET || !req.isAsyncSupported()) {
            relay.handle(engineReq, new ServletExchange(resp));
            return;
        }

        AsyncContext async = req.startAsync();
        async.setTimeout(0);
        ServletExchange exchange = new ServletExchange(resp);
        async.addListener(new CancelOnEnd(exchange.cancelled));
        async.start(() -> {
            try {
                relay.handle(engineReq, exchange);
            } catch (IOException e) {
                log.debug("Stream request ended with I/O error: {}", e.getMessage());
            } finally {
                exchange.cancelled.complete(null);
                try {
                    async.complete();
                } catch (IllegalStateException alreadyCompleted) {
                    log.trace("Async context already completed");
                }
            }
        });
    }

    private static ServerRequest toEngineRequest(HttpServletRequest req) throws URISyntaxException {
        HttpMethod method = HttpMethod.parse(req.getMethod());
        URI uri = new URI(req.getRequestURL().toString() + (req.getQueryString() == null ? "" : "?" + req.getQueryString()));

        Map<String, List<String>> headers = new LinkedHashMap<>();
        Enumeration<String> names = req.getHeaderNames();
        while (names.hasMoreElements()) {
            String name = names.nextElement();
            headers.put(name, Collections.list(req.getHeaders(name)));
        }
        return new ServerRequest(method, uri, headers);
    }

    private static final class ServletExchange implements StreamExchange {
        private final HttpServletResponse resp;
        private final CompletableFuture<Void> cancelled = new CompletableFuture<>();

        private ServletExchange(HttpServletResponse resp) {
            this.resp = resp;
        }

        @Override
        public void respond(ServerResponse response) throws IOException {
            resp.setStatus(response.status());
            response.headers().forEach((k, vals) -> vals.forEach(v -> resp.addHeader(k, v)));
            if (response.body().length > 0) {
                resp.getOutputStream().write(response.body());
            }
        }

        @Override
        public EventSink sink() {
            return new ServletSink(resp);
        }

        @Override
        public void beginStream(Map<String, List<String>> headers) throws IOException {
            resp.setStatus(HttpServletResponse.SC_OK);
            headers.forEach((k, vals) -> vals.forEach(v -> resp.addHeader(k, v)));
            resp.flushBuffer();
        }

        @Override
        public CompletableFuture<Void> cancelled() {
            return cancelled;
        }
    }

    /**
     * Containers report writes after completion as {@link IllegalStateException}; the relay treats every
     * write failure as an I/O failure.
     */
    private static final class ServletSink implements EventSink {
        private final HttpServletResponse resp;

        private ServletSink(HttpServletResponse resp) {
            this.resp = resp;
        }

        @Override
        public void write(byte[] bytes) throws IOException {
            try {
                resp.getOutputStream().write(bytes);
            } catch (IllegalStateException e) {
                throw new IOException("response no longer writable", e);
            }
        }

        @Override
        public void flush() throws IOException {
            try {
                resp.flushBuffer();
            } catch (IllegalStateException e) {
                throw new IOException("response no longer writable", e);
            }
        }
    }

    private static final class CancelOnEnd implements AsyncListener {
        private final CompletableFuture<Void> cancelled;

        private CancelOnEnd(CompletableFuture<Void> cancelled) {
            this.cancelled = cancelled;
        }

        @Override
        public void onComplete(AsyncEvent event) {
            cancelled.complete(null);
        }

        @Override
        public void onTimeout(AsyncEvent event) {
            cancelled.complete(null);
        }

        @Override
        public void onError(AsyncEvent event) {
            cancelled.complete(null);
        }

        @Override
        public void onStartAsync(AsyncEvent event) {
            // streams are never re-dispatched
        }
    }
}
