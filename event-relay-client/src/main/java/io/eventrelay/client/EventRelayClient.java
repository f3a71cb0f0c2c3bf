package io.eventrelay.client;

import io.eventrelay.core.EventFramer;
import io.eventrelay.core.EventRelayException;
import io.eventrelay.core.Protocol;
import io.eventrelay.core.Urls;
import io.eventrelay.json.jackson.JacksonJsonCodec;
import io.eventrelay.json.spi.JsonCodec;
import io.eventrelay.json.spi.JsonException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Long-lived SSE subscriber that reconnects with exponential backoff and routes events to handlers.
 *
 * <p>Events are parsed on a reader thread and handed to a single dispatch thread through a bounded
 * queue, so handlers run one at a time in arrival order. The identifier assigned by the server in the
 * {@code connected} event is remembered and sent back on every later attempt.
 *
 * <pre>{@code
 * EventRelayClient client = EventRelayClient.builder(URI.create("http://localhost:8080")).build();
 * client.addEventHandler("task", data -> process(data));
 * client.start();
 * }</pre>
 */
public final class EventRelayClient implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(EventRelayClient.class);

    public static final int DEFAULT_MAX_RETRIES = 10;
    public static final Duration DEFAULT_INITIAL_BACKOFF = Duration.ofSeconds(1);
    public static final Duration DEFAULT_MAX_BACKOFF = Duration.ofSeconds(60);
    public static final int DEFAULT_DISPATCH_QUEUE_CAPACITY = 1024;
    public static final Duration DEFAULT_ENQUEUE_TIMEOUT = Duration.ofSeconds(5);

    private final URI connectUrl;
    private final int maxRetries;
    private final Backoff backoff;
    private final boolean resetBackoffOnConnect;
    private final EventRelayTransport transport;
    private final JsonCodec codec;
    private final HandlerRegistry handlers = new HandlerRegistry();
    private final DispatchQueue dispatchQueue;
    private final List<ConnectionListener> listeners = new CopyOnWriteArrayList<>();

    private final ReentrantLock connectLock = new ReentrantLock();
    private final Object stateLock = new Object();
    private final CountDownLatch closedLatch = new CountDownLatch(1);

    private ConnectionState state = ConnectionState.IDLE;
    private Session session;
    private Thread supervisor;
    private Thread connecting;
    private boolean connectInterrupted;
    private volatile String clientId;
    private volatile boolean closed;

    public static Builder builder(URI serverUrl) {
        return new Builder(serverUrl);
    }

    private EventRelayClient(Builder builder) {
        String path = builder.path != null ? builder.path : Protocol.DEFAULT_CONNECT_PATH;
        this.connectUrl = Urls.resolvePath(builder.serverUrl, path);
        this.clientId = builder.clientId;
        this.maxRetries = builder.maxRetries > 0 ? builder.maxRetries : DEFAULT_MAX_RETRIES;
        Duration maxBackoff = positiveOr(builder.maxBackoff, DEFAULT_MAX_BACKOFF);
        Duration initialBackoff = positiveOr(builder.initialBackoff, DEFAULT_INITIAL_BACKOFF);
        this.backoff = new Backoff(
                initialBackoff.compareTo(maxBackoff) > 0 ? maxBackoff : initialBackoff,
                maxBackoff);
        this.resetBackoffOnConnect = builder.resetBackoffOnConnect;
        this.transport = builder.transport != null ? builder.transport : new JdkHttpTransport();
        this.codec = builder.jsonCodec != null ? builder.jsonCodec : new JacksonJsonCodec();
        int capacity = builder.dispatchQueueCapacity > 0 ? builder.dispatchQueueCapacity : DEFAULT_DISPATCH_QUEUE_CAPACITY;
        BackpressurePolicy policy = builder.backpressurePolicy != null ? builder.backpressurePolicy : BackpressurePolicy.DROP_OLDEST;
        this.dispatchQueue = new DispatchQueue(capacity, policy,
                positiveOr(builder.enqueueTimeout, DEFAULT_ENQUEUE_TIMEOUT), handlers);
    }

    private static Duration positiveOr(Duration value, Duration fallback) {
        return value == null || value.isZero() || value.isNegative() ? fallback : value;
    }

    /**
     * Builder for {@link EventRelayClient}.
     */
    public static final class Builder {
        private final URI serverUrl;
        private String path;
        private String clientId;
        private int maxRetries;
        private Duration initialBackoff;
        private Duration maxBackoff;
        private boolean resetBackoffOnConnect;
        private int dispatchQueueCapacity;
        private BackpressurePolicy backpressurePolicy;
        private Duration enqueueTimeout;
        private EventRelayTransport transport;
        private JsonCodec jsonCodec;

        private Builder(URI serverUrl) {
            this.serverUrl = Objects.requireNonNull(serverUrl, "serverUrl");
        }

        public Builder path(String path) {
            this.path = Objects.requireNonNull(path, "path");
            return this;
        }

        /**
         * Identifier to present on the first attempt. Later attempts use whatever the server assigned.
         */
        public Builder clientId(String clientId) {
            this.clientId = clientId;
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder initialBackoff(Duration initialBackoff) {
            this.initialBackoff = initialBackoff;
            return this;
        }

        public Builder maxBackoff(Duration maxBackoff) {
            this.maxBackoff = maxBackoff;
            return this;
        }

        /**
         * Restart the backoff sequence at the initial delay after every successful connection.
         */
        public Builder resetBackoffOnConnect(boolean resetBackoffOnConnect) {
            this.resetBackoffOnConnect = resetBackoffOnConnect;
            return this;
        }

        public Builder dispatchQueueCapacity(int dispatchQueueCapacity) {
            this.dispatchQueueCapacity = dispatchQueueCapacity;
            return this;
        }

        public Builder backpressurePolicy(BackpressurePolicy backpressurePolicy) {
            this.backpressurePolicy = Objects.requireNonNull(backpressurePolicy, "backpressurePolicy");
            return this;
        }

        /**
         * How long the reader may block on a full queue under {@link BackpressurePolicy#BLOCK_WITH_TIMEOUT}.
         */
        public Builder enqueueTimeout(Duration enqueueTimeout) {
            this.enqueueTimeout = enqueueTimeout;
            return this;
        }

        public Builder transport(EventRelayTransport transport) {
            this.transport = Objects.requireNonNull(transport, "transport");
            return this;
        }

        public Builder jsonCodec(JsonCodec jsonCodec) {
            this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
            return this;
        }

        public EventRelayClient build() {
            return new EventRelayClient(this);
        }
    }

    public void addEventHandler(String eventType, EventHandler handler) {
        handlers.add(eventType, handler);
    }

    public void addConnectionListener(ConnectionListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public ConnectionState state() {
        synchronized (stateLock) {
            return state;
        }
    }

    public boolean isConnected() {
        return state() == ConnectionState.CONNECTED;
    }

    /**
     * The identifier presented to the server, or {@code null} before the first handshake when none was
     * configured.
     */
    public String clientId() {
        return clientId;
    }

    /**
     * Opens the stream, retrying with backoff. Returns once the server has accepted the stream; events are
     * read in the background. Does nothing if already connected.
     *
     * @throws EventRelayException.ConnectionExhausted if every attempt failed
     * @throws CancellationException if the client was closed while connecting, including while waiting for
     *         the server to answer
     * @throws IllegalStateException if the client is already closed
     */
    public void connect() {
        connectLock.lock();
        try {
            synchronized (stateLock) {
                if (closed) {
                    throw new IllegalStateException("client is closed");
                }
                if (state == ConnectionState.CONNECTED) {
                    return;
                }
                state = ConnectionState.CONNECTING;
                connecting = Thread.currentThread();
            }
            Exception lastError = null;
            for (int attempt = 1; attempt <= maxRetries; attempt++) {
                try {
                    log.info("Connecting to {} (attempt {}/{})", connectUrl, attempt, maxRetries);
                    establish();
                    return;
                } catch (CancellationException e) {
                    throw e;
                } catch (Exception e) {
                    if (closed) {
                        throw cancelled();
                    }
                    lastError = e;
                }
                if (attempt == maxRetries) {
                    break;
                }
                Duration delay = backoff.next();
                log.warn("Connection attempt {}/{} failed: {}. Retrying in {} ms",
                        attempt, maxRetries, lastError.getMessage(), delay.toMillis());
                if (awaitClosed(delay)) {
                    throw cancelled();
                }
            }
            setState(ConnectionState.DISCONNECTED);
            throw new EventRelayException.ConnectionExhausted(maxRetries, lastError);
        } finally {
            synchronized (stateLock) {
                if (connecting == Thread.currentThread()) {
                    connecting = null;
                    if (connectInterrupted) {
                        // the interrupt came from close(), not from the caller
                        Thread.interrupted();
                        connectInterrupted = false;
                    }
                }
            }
            connectLock.unlock();
        }
    }

    /**
     * Runs a background supervisor that connects, waits for the stream to end and reconnects, until the
     * client is closed or a connect exhausts its retries. Every reconnect after a dropped stream first waits
     * out the next backoff delay.
     *
     * @return completes normally when the client is closed, exceptionally with
     *         {@link EventRelayException.ConnectionExhausted} when the supervisor gave up
     */
    public CompletableFuture<Void> start() {
        CompletableFuture<Void> done = new CompletableFuture<>();
        synchronized (stateLock) {
            if (closed) {
                throw new IllegalStateException("client is closed");
            }
            if (supervisor != null) {
                throw new IllegalStateException("supervisor already started");
            }
            supervisor = new Thread(() -> supervise(done), "event-relay-supervisor");
            supervisor.setDaemon(true);
            supervisor.start();
        }
        return done;
    }

    private void supervise(CompletableFuture<Void> done) {
        try {
            while (!closed) {
                connect();
                awaitDisconnect();
                if (closed) {
                    break;
                }
                Duration delay = backoff.next();
                log.info("Stream to {} ended, reconnecting in {} ms", connectUrl, delay.toMillis());
                if (awaitClosed(delay)) {
                    break;
                }
            }
            done.complete(null);
        } catch (IllegalStateException e) {
            // CancellationException included: the client was closed mid-connect
            done.complete(null);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            done.complete(null);
        } catch (EventRelayException.ConnectionExhausted e) {
            log.error("Giving up on {}: {}", connectUrl, e.getMessage());
            done.completeExceptionally(e);
        }
    }

    /**
     * Blocks until the current stream ends. Returns immediately when not connected.
     */
    public void awaitDisconnect() throws InterruptedException {
        Session s = currentSession();
        if (s != null) {
            s.disconnected.await();
        }
    }

    /**
     * @return {@code true} if the stream ended (or none was open) before the timeout
     */
    public boolean awaitDisconnect(Duration timeout) throws InterruptedException {
        Session s = currentSession();
        return s == null || s.disconnected.await(timeout.toNanos(), TimeUnit.NANOSECONDS);
    }

    private Session currentSession() {
        synchronized (stateLock) {
            return state == ConnectionState.CONNECTED ? session : null;
        }
    }

    private void establish() throws Exception {
        URI url = clientId == null
                ? connectUrl
                : Urls.withQueryParam(connectUrl, Protocol.Q_CLIENT_ID, clientId);
        Map<String, Iterable<String>> headers = Map.of(
                Protocol.H_ACCEPT, List.of(Protocol.CT_EVENT_STREAM),
                Protocol.H_CACHE_CONTROL, List.of(Protocol.NO_CACHE));
        TransportResponse<InputStream> resp = transport.openStream(new TransportRequest("GET", url, headers, null));
        if (resp.status() != 200) {
            closeBody(resp.body());
            throw new IOException("server returned status " + resp.status());
        }
        if (resp.body() == null) {
            throw new IOException("server returned no body");
        }

        Session s = new Session(resp.body());
        synchronized (stateLock) {
            if (closed) {
                closeBody(s.body);
                throw cancelled();
            }
            session = s;
            state = ConnectionState.CONNECTED;
        }
        if (resetBackoffOnConnect) {
            backoff.reset();
        }
        dispatchQueue.start();
        log.info("Connected to {}", connectUrl);
        for (ConnectionListener l : listeners) {
            l.onConnected();
        }

        Thread reader = new Thread(() -> read(s), "event-relay-reader");
        reader.setDaemon(true);
        reader.start();
    }

    private void read(Session s) {
        Throwable cause = null;
        try (EventFramer framer = new EventFramer(s.body)) {
            EventFramer.Event event;
            while (!closed && (event = framer.next()) != null) {
                if (Protocol.EVENT_CONNECTED.equals(event.eventType())) {
                    rememberClientId(event.data());
                }
                dispatchQueue.offer(event);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (IOException e) {
            if (!closed) {
                log.warn("Error reading events: {}", e.getMessage());
                cause = e;
            }
        } finally {
            disconnected(s, cause);
        }
    }

    private void rememberClientId(String data) {
        try {
            Map<?, ?> handshake = codec.readValue(data.getBytes(StandardCharsets.UTF_8), Map.class);
            Object id = handshake == null ? null : handshake.get(Protocol.FIELD_CLIENT_ID);
            if (id instanceof String && !((String) id).isEmpty()) {
                clientId = (String) id;
                log.info("Assigned client id {}", clientId);
            }
        } catch (JsonException e) {
            log.warn("Malformed {} event: {}", Protocol.EVENT_CONNECTED, e.getMessage());
        }
    }

    private void disconnected(Session s, Throwable cause) {
        if (!s.notified.compareAndSet(false, true)) {
            return;
        }
        synchronized (stateLock) {
            if (session == s) {
                state = ConnectionState.DISCONNECTED;
            }
        }
        closeBody(s.body);
        log.info("Disconnected from {}", connectUrl);
        s.disconnected.countDown();
        for (ConnectionListener l : listeners) {
            l.onDisconnected(cause);
        }
    }

    private boolean awaitClosed(Duration delay) {
        try {
            return closedLatch.await(delay.toNanos(), TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return true;
        }
    }

    private void setState(ConnectionState next) {
        synchronized (stateLock) {
            state = next;
        }
    }

    private static CancellationException cancelled() {
        return new CancellationException("client closed");
    }

    private static void closeBody(InputStream body) {
        if (body == null) {
            return;
        }
        try {
            body.close();
        } catch (IOException e) {
            log.debug("Failed to close response body", e);
        }
    }

    /**
     * Stops reading, dispatching and reconnecting. Any thread blocked in {@link #connect()} or
     * {@link #awaitDisconnect()} is released. Idempotent.
     */
    @Override
    public void close() {
        Session s;
        Thread sup;
        synchronized (stateLock) {
            if (closed) {
                return;
            }
            closed = true;
            s = session;
            sup = supervisor;
            state = ConnectionState.DISCONNECTED;
            if (connecting != null && connecting != sup) {
                // unblocks a request still waiting for response headers
                connectInterrupted = true;
                connecting.interrupt();
            }
        }
        closedLatch.countDown();
        if (s != null) {
            closeBody(s.body);
            disconnected(s, null);
        }
        if (sup != null) {
            sup.interrupt();
        }
        dispatchQueue.close();
    }

    Backoff backoff() {
        return backoff;
    }

    private static final class Session {
        final InputStream body;
        final CountDownLatch disconnected = new CountDownLatch(1);
        final AtomicBoolean notified = new AtomicBoolean();

        Session(InputStream body) {
            this.body = body;
        }
    }
}
