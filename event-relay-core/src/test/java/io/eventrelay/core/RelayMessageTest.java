package io.eventrelay.core;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RelayMessageTest {

    @Test
    void rejectsEmptyEventType() {
        assertThatThrownBy(() -> RelayMessage.of("", Map.of()).validate())
                .isInstanceOf(EventRelayException.InvalidMessage.class)
                .hasMessageContaining("eventType");
    }

    @Test
    void rejectsNullPayload() {
        assertThatThrownBy(() -> RelayMessage.of("tick", null).validate())
                .isInstanceOf(EventRelayException.InvalidMessage.class)
                .hasMessageContaining("payload");
    }

    @Test
    void acceptsEventWithPayload() {
        assertThatCode(() -> RelayMessage.of("tick", Map.of("n", 1)).validate()).doesNotThrowAnyException();
    }

    @Test
    void frameRejectsMultiLineData() {
        assertThatThrownBy(() -> new EventFrame("tick", "a\nb"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
