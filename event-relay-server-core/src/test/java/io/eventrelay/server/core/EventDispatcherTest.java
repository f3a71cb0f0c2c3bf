package io.eventrelay.server.core;

import io.eventrelay.core.EventRelayException;
import io.eventrelay.core.RelayMessage;
import io.eventrelay.json.jackson.JacksonJsonCodec;
import io.eventrelay.json.spi.JsonCodec;
import io.eventrelay.json.spi.JsonException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EventDispatcherTest {

    private ExecutorService executor;
    private ConnectionRegistry registry;
    private EventDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        executor = Executors.newCachedThreadPool();
        registry = new ConnectionRegistry(10);
        dispatcher = new EventDispatcher(registry, new JacksonJsonCodec(), executor, Duration.ofSeconds(5));
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void broadcastToNoConnectionsSucceeds() {
        assertThatCode(() -> dispatcher.send(RelayMessage.of("tick", Map.of("n", 1))))
                .doesNotThrowAnyException();
        assertThat(registry.count()).isZero();
    }

    @Test
    void targetedSendWithNoRegisteredIdsFails() {
        register("a");

        assertThatThrownBy(() -> dispatcher.send(RelayMessage.of("tick", Map.of()), "x", "y"))
                .isInstanceOf(EventRelayException.NoMatchingClients.class);
    }

    @Test
    void invalidMessageIsRejectedBeforeAnyWrite() {
        RecordingSink a = register("a");

        assertThatThrownBy(() -> dispatcher.send(RelayMessage.of("", Map.of())))
                .isInstanceOf(EventRelayException.InvalidMessage.class);
        assertThatThrownBy(() -> dispatcher.publish("tick", null))
                .isInstanceOf(EventRelayException.InvalidMessage.class);
        assertThatThrownBy(() -> dispatcher.send(RelayMessage.of("multi\nline", Map.of())))
                .isInstanceOf(EventRelayException.InvalidMessage.class);
        assertThat(a.text()).isEmpty();
    }

    @Test
    void unserializablePayloadIsInvalidMessage() {
        register("a");

        assertThatThrownBy(() -> dispatcher.publish("tick", new Object()))
                .isInstanceOf(EventRelayException.InvalidMessage.class)
                .hasCauseInstanceOf(JsonException.class);
    }

    @Test
    void broadcastThenPartialFailureEvictsFailedRecipient() {
        RecordingSink a = register("a");
        RecordingSink b = register("b");
        RecordingSink c = register("c");

        dispatcher.send(RelayMessage.of("tick", Map.of("n", 1)));

        for (RecordingSink sink : List.of(a, b, c)) {
            assertThat(sink.text()).isEqualTo("event: tick\ndata: {\"n\":1}\n\n");
        }
        assertThat(registry.count()).isEqualTo(3);

        b.fail();
        assertThatThrownBy(() -> dispatcher.send(RelayMessage.of("tick", Map.of("n", 2))))
                .isInstanceOfSatisfying(EventRelayException.PartialDeliveryFailure.class, e -> {
                    assertThat(e.failed()).isEqualTo(1);
                    assertThat(e.total()).isEqualTo(3);
                    assertThat(e.getCause()).hasMessage("broken pipe");
                });

        assertThat(registry.count()).isEqualTo(2);
        assertThat(registry.ids()).containsExactly("a", "c");
        assertThat(a.count("event: tick")).isEqualTo(2);
        assertThat(c.count("event: tick")).isEqualTo(2);
    }

    @Test
    void targetedSendReachesOnlyResolvedIds() {
        RecordingSink a = register("a");
        RecordingSink b = register("b");
        RecordingSink c = register("c");

        dispatcher.publish("job", Map.of("id", 7), "a", "c", "ghost");

        assertThat(a.count("event: job")).isEqualTo(1);
        assertThat(b.text()).isEmpty();
        assertThat(c.count("event: job")).isEqualTo(1);
    }

    @Test
    void singleRecipientFailureIsReportedAndEvicted() {
        RecordingSink a = register("a");
        register("b");
        a.fail();

        assertThatThrownBy(() -> dispatcher.publish("job", Map.of(), "a"))
                .isInstanceOfSatisfying(EventRelayException.PartialDeliveryFailure.class, e -> {
                    assertThat(e.failed()).isEqualTo(1);
                    assertThat(e.total()).isEqualTo(1);
                });
        assertThat(registry.ids()).containsExactly("b");
    }

    @Test
    void recipientMissingDeadlineIsEvictedWhileOthersKeepTheirFrame() {
        RecordingSink fast = register("fast");
        RecordingSink slow = register("slow");
        slow.block();

        try {
            assertThatThrownBy(() -> dispatcher.send(RelayMessage.of("tick", Map.of()), Duration.ofMillis(200), List.of()))
                    .isInstanceOfSatisfying(EventRelayException.PartialDeliveryFailure.class, e -> {
                        assertThat(e.failed()).isEqualTo(1);
                        assertThat(e.total()).isEqualTo(2);
                    });
        } finally {
            slow.release();
        }

        assertThat(fast.count("event: tick")).isEqualTo(1);
        assertThat(registry.ids()).containsExactly("fast");
    }

    @Test
    void interruptedCallerCancelsSendWithoutEvicting() {
        RecordingSink a = register("a");

        Thread.currentThread().interrupt();
        try {
            assertThatThrownBy(() -> dispatcher.publish("tick", Map.of("n", 1), "a"))
                    .isInstanceOf(CancellationException.class);
        } finally {
            assertThat(Thread.interrupted()).isTrue();
        }

        assertThat(registry.contains("a")).isTrue();
        assertThat(a.text()).isEmpty();
    }

    @Test
    void interruptedCallerCancelsBroadcastWithoutEvicting() {
        register("a");
        register("b");

        Thread.currentThread().interrupt();
        try {
            assertThatThrownBy(() -> dispatcher.publish("tick", Map.of("n", 1)))
                    .isInstanceOf(CancellationException.class);
        } finally {
            assertThat(Thread.interrupted()).isTrue();
        }

        assertThat(registry.ids()).containsExactlyInAnyOrder("a", "b");
    }

    @Test
    void zeroTimeoutUsesBroadcastTimeout() {
        RecordingSink a = register("a");

        dispatcher.send(RelayMessage.of("tick", Map.of()), Duration.ZERO, List.of("a"));

        assertThat(a.count("event: tick")).isEqualTo(1);
        assertThat(registry.contains("a")).isTrue();
    }

    @Test
    void singleRecipientStuckBehindStalledWriterIsEvictedAtDeadline() throws Exception {
        RecordingSink sink = new RecordingSink();
        Connection stalled = new Connection("a", sink);
        registry.register(stalled);
        sink.block();
        Thread holder = new Thread(() -> {
            try {
                stalled.write(": keepalive\n\n".getBytes(StandardCharsets.UTF_8));
            } catch (IOException ignored) {
                // released at the end of the test
            }
        });
        holder.start();
        Thread.sleep(100);

        long start = System.nanoTime();
        try {
            assertThatThrownBy(() -> dispatcher.send(RelayMessage.of("tick", Map.of()), Duration.ofMillis(200), List.of("a")))
                    .isInstanceOfSatisfying(EventRelayException.PartialDeliveryFailure.class,
                            e -> assertThat(e.total()).isEqualTo(1));
        } finally {
            sink.release();
            holder.join(5_000);
        }

        assertThat(Duration.ofNanos(System.nanoTime() - start)).isLessThan(Duration.ofSeconds(3));
        assertThat(registry.contains("a")).isFalse();
    }

    @Test
    void payloadIsSerializedOncePerSend() {
        AtomicInteger writes = new AtomicInteger();
        JacksonJsonCodec jackson = new JacksonJsonCodec();
        JsonCodec counting = new JsonCodec() {
            @Override
            public byte[] writeBytes(Object value) throws JsonException {
                writes.incrementAndGet();
                return jackson.writeBytes(value);
            }

            @Override
            public String writeString(Object value) throws JsonException {
                writes.incrementAndGet();
                return jackson.writeString(value);
            }

            @Override
            public <T> T readValue(byte[] data, Class<T> type) throws JsonException {
                return jackson.readValue(data, type);
            }

            @Override
            public <T> T readValue(String json, Class<T> type) throws JsonException {
                return jackson.readValue(json, type);
            }
        };
        dispatcher = new EventDispatcher(registry, counting, executor, Duration.ofSeconds(5));
        register("a");
        register("b");
        register("c");

        dispatcher.publish("tick", Map.of("n", 1));

        assertThat(writes.get()).isEqualTo(1);
    }

    private RecordingSink register(String id) {
        RecordingSink sink = new RecordingSink();
        registry.register(new Connection(id, sink));
        return sink;
    }
}
