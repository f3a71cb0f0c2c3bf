package io.eventrelay.client;

import io.eventrelay.core.EventRelayException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EventRelayClientTest {

    private static final URI SERVER = URI.create("http://relay.test:8080");

    private final ScriptedTransport transport = new ScriptedTransport();
    private EventRelayClient client;

    @AfterEach
    void tearDown() {
        if (client != null) {
            client.close();
        }
    }

    private EventRelayClient.Builder builder() {
        return EventRelayClient.builder(SERVER)
                .transport(transport)
                .initialBackoff(Duration.ofMillis(10))
                .maxBackoff(Duration.ofMillis(40));
    }

    @Test
    void connectStoresAssignedIdAndDispatchesEvents() throws Exception {
        ScriptedStream body = new ScriptedStream();
        transport.stream(body);
        client = builder().build();

        List<String> received = new CopyOnWriteArrayList<>();
        CountDownLatch taskSeen = new CountDownLatch(1);
        client.addEventHandler("task", data -> {
            received.add(new String(data, StandardCharsets.UTF_8));
            taskSeen.countDown();
        });

        client.connect();
        assertThat(client.isConnected()).isTrue();
        assertThat(client.state()).isEqualTo(ConnectionState.CONNECTED);

        body.event("connected", "{\"client_id\":\"abc\"}").event("task", "{\"n\":1}");
        assertThat(taskSeen.await(5, TimeUnit.SECONDS)).isTrue();

        assertThat(received).containsExactly("{\"n\":1}");
        assertThat(client.clientId()).isEqualTo("abc");

        TransportRequest request = transport.requests.get(0);
        assertThat(request.method()).isEqualTo("GET");
        assertThat(request.url()).isEqualTo(URI.create("http://relay.test:8080/api/sse/connect"));
        assertThat(request.headers().get("Accept")).containsExactly("text/event-stream");
        assertThat(request.timeout()).isNull();
    }

    @Test
    void connectIsNoOpWhileConnected() {
        transport.stream(new ScriptedStream());
        client = builder().build();

        client.connect();
        client.connect();

        assertThat(transport.requests).hasSize(1);
    }

    @Test
    void configuredIdAndPathAreUsedOnFirstAttempt() {
        transport.stream(new ScriptedStream());
        client = builder().path("/events").clientId("worker 7").build();

        client.connect();

        assertThat(transport.requests.get(0).url().toString())
                .isEqualTo("http://relay.test:8080/events?client_id=worker+7");
    }

    @Test
    void reconnectPresentsServerAssignedId() throws Exception {
        ScriptedStream first = new ScriptedStream();
        transport.stream(first).stream(new ScriptedStream());
        client = builder().build();

        client.connect();
        first.event("connected", "{\"client_id\":\"client-42\"}");
        first.end();

        assertThat(client.awaitDisconnect(Duration.ofSeconds(5))).isTrue();
        assertThat(client.state()).isEqualTo(ConnectionState.DISCONNECTED);

        client.connect();
        assertThat(transport.requests).hasSize(2);
        assertThat(transport.requests.get(1).url().getQuery()).isEqualTo("client_id=client-42");
    }

    @Test
    void retriesUntilServerAcceptsStream() {
        transport.status(503).fail(new IOException("reset")).stream(new ScriptedStream());
        client = builder().build();

        client.connect();

        assertThat(client.isConnected()).isTrue();
        assertThat(transport.requests).hasSize(3);
    }

    @Test
    void exhaustingRetriesReportsLastError() {
        client = builder().maxRetries(3).build();

        assertThatThrownBy(() -> client.connect())
                .isInstanceOfSatisfying(EventRelayException.ConnectionExhausted.class,
                        e -> assertThat(e.attempts()).isEqualTo(3))
                .hasCauseInstanceOf(IOException.class);

        assertThat(transport.requests).hasSize(3);
        assertThat(client.state()).isEqualTo(ConnectionState.DISCONNECTED);
    }

    @Test
    void closeCancelsBackoffWait() throws Exception {
        client = builder().initialBackoff(Duration.ofSeconds(30)).maxBackoff(Duration.ofSeconds(30)).build();
        AtomicReference<Throwable> failure = new AtomicReference<>();
        Thread connecting = new Thread(() -> {
            try {
                client.connect();
            } catch (Throwable t) {
                failure.set(t);
            }
        });
        connecting.start();

        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (transport.requests.isEmpty() && System.nanoTime() < deadline) {
            Thread.sleep(10);
        }
        client.close();
        connecting.join(5_000);

        assertThat(connecting.isAlive()).isFalse();
        assertThat(failure.get()).isInstanceOf(CancellationException.class);
    }

    @Test
    void disconnectIsReportedOncePerConnection() throws Exception {
        ScriptedStream body = new ScriptedStream();
        transport.stream(body);
        client = builder().build();
        AtomicInteger disconnects = new AtomicInteger();
        client.addConnectionListener(new ConnectionListener() {
            @Override
            public void onDisconnected(Throwable cause) {
                disconnects.incrementAndGet();
            }
        });

        client.connect();
        body.end();
        assertThat(client.awaitDisconnect(Duration.ofSeconds(5))).isTrue();
        client.close();

        assertThat(disconnects.get()).isEqualTo(1);
    }

    @Test
    void closeReleasesDisconnectWaitersAndClosesBody() throws Exception {
        ScriptedStream body = new ScriptedStream();
        transport.stream(body);
        client = builder().build();
        client.connect();

        CompletableFuture<Boolean> waiter = CompletableFuture.supplyAsync(() -> {
            try {
                return client.awaitDisconnect(Duration.ofSeconds(10));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        });
        Thread.sleep(50);
        client.close();

        assertThat(waiter.get(5, TimeUnit.SECONDS)).isTrue();
        assertThat(body.isClosed()).isTrue();
        assertThat(client.state()).isEqualTo(ConnectionState.DISCONNECTED);
        assertThatThrownBy(() -> client.connect()).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void malformedHandshakeKeepsStreamAlive() throws Exception {
        ScriptedStream body = new ScriptedStream();
        transport.stream(body);
        client = builder().build();
        CountDownLatch taskSeen = new CountDownLatch(1);
        client.addEventHandler("task", data -> taskSeen.countDown());

        client.connect();
        body.event("connected", "not-json").event("task", "{}");

        assertThat(taskSeen.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(client.clientId()).isNull();
        assertThat(client.isConnected()).isTrue();
    }

    @Test
    void supervisorReconnectsAfterStreamEnds() throws Exception {
        ScriptedStream first = new ScriptedStream();
        ScriptedStream second = new ScriptedStream();
        transport.stream(first).stream(second);
        client = builder().build();
        CountDownLatch connectedTwice = new CountDownLatch(2);
        client.addConnectionListener(new ConnectionListener() {
            @Override
            public void onConnected() {
                connectedTwice.countDown();
            }
        });

        CompletableFuture<Void> supervisor = client.start();
        first.event("connected", "{\"client_id\":\"client-1\"}");
        first.end();

        assertThat(connectedTwice.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(transport.requests.get(1).url().getQuery()).isEqualTo("client_id=client-1");

        client.close();
        assertThat(supervisor).succeedsWithin(Duration.ofSeconds(5));
    }

    @Test
    void supervisorWaitsBackoffBeforeReconnectingAfterDroppedStream() throws Exception {
        for (int i = 0; i < 5; i++) {
            ScriptedStream empty = new ScriptedStream();
            empty.end();
            transport.stream(empty);
        }
        client = builder().initialBackoff(Duration.ofMillis(300)).maxBackoff(Duration.ofMillis(300)).build();

        client.start();
        Thread.sleep(500);

        assertThat(transport.requests.size()).isBetween(1, 2);
    }

    @Test
    void backoffCarriesOverSuccessfulConnectionByDefault() throws Exception {
        ScriptedStream first = new ScriptedStream();
        transport.fail(new IOException("refused")).stream(first);
        client = builder().initialBackoff(Duration.ofMillis(100)).maxBackoff(Duration.ofSeconds(10)).build();

        client.connect();
        assertThat(client.backoff().current()).isEqualTo(Duration.ofMillis(200));
        first.end();
        assertThat(client.awaitDisconnect(Duration.ofSeconds(5))).isTrue();

        transport.fail(new IOException("refused")).stream(new ScriptedStream());
        long start = System.nanoTime();
        client.connect();

        assertThat(Duration.ofNanos(System.nanoTime() - start)).isGreaterThanOrEqualTo(Duration.ofMillis(200));
        assertThat(client.backoff().current()).isEqualTo(Duration.ofMillis(400));
    }

    @Test
    void backoffRestartsAfterSuccessfulConnectionWhenConfigured() throws Exception {
        ScriptedStream first = new ScriptedStream();
        transport.fail(new IOException("refused")).stream(first);
        client = builder()
                .initialBackoff(Duration.ofMillis(100))
                .maxBackoff(Duration.ofSeconds(10))
                .resetBackoffOnConnect(true)
                .build();

        client.connect();
        assertThat(client.backoff().current()).isEqualTo(Duration.ofMillis(100));
        first.end();
        assertThat(client.awaitDisconnect(Duration.ofSeconds(5))).isTrue();

        transport.fail(new IOException("refused")).stream(new ScriptedStream());
        long start = System.nanoTime();
        client.connect();

        assertThat(Duration.ofNanos(System.nanoTime() - start)).isGreaterThanOrEqualTo(Duration.ofMillis(100));
        assertThat(client.backoff().current()).isEqualTo(Duration.ofMillis(100));
    }

    @Test
    void initialBackoffAboveMaximumIsCapped() {
        client = EventRelayClient.builder(SERVER)
                .transport(transport)
                .initialBackoff(Duration.ofSeconds(90))
                .build();

        assertThat(client.backoff().current()).isEqualTo(EventRelayClient.DEFAULT_MAX_BACKOFF);
    }

    @Test
    void closeUnblocksAttemptWaitingForResponse() throws Exception {
        CountDownLatch requested = new CountDownLatch(1);
        client = EventRelayClient.builder(SERVER)
                .transport(request -> {
                    requested.countDown();
                    new CountDownLatch(1).await();
                    throw new IllegalStateException("unreachable");
                })
                .build();
        AtomicReference<Throwable> failure = new AtomicReference<>();
        Thread connecting = new Thread(() -> {
            try {
                client.connect();
            } catch (Throwable t) {
                failure.set(t);
            }
        });
        connecting.start();
        assertThat(requested.await(5, TimeUnit.SECONDS)).isTrue();

        client.close();
        connecting.join(3_000);

        assertThat(connecting.isAlive()).isFalse();
        assertThat(failure.get()).isInstanceOf(CancellationException.class);
    }

    @Test
    void supervisorGivesUpWhenRetriesAreExhausted() {
        client = builder().maxRetries(2).build();

        CompletableFuture<Void> supervisor = client.start();

        assertThat(supervisor).failsWithin(Duration.ofSeconds(5))
                .withThrowableOfType(ExecutionException.class)
                .withCauseInstanceOf(EventRelayException.ConnectionExhausted.class);
        assertThat(transport.requests).hasSize(2);
    }
}
