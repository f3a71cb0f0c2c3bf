package io.eventrelay.core;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * A single Server-Sent Events frame.
 *
 * <p>Only single-line data is carried; JSON payloads produced by the relay never contain raw newlines.
 */
public final class EventFrame {
    private final String event;
    private final String data;

    public EventFrame(String event, String data) {
        this.event = Objects.requireNonNull(event, "event");
        this.data = Objects.requireNonNull(data, "data");
        if (!isSingleLine(event) || event.isEmpty()) {
            throw new IllegalArgumentException("event must be a non-empty single line");
        }
        if (!isSingleLine(data)) {
            throw new IllegalArgumentException("data must be a single line");
        }
    }

    public String event() {
        return event;
    }

    public String data() {
        return data;
    }

    /**
     * Render as an SSE event block (without HTTP headers).
     */
    public String render() {
        return "event: " + event + "\n" + "data: " + data + "\n\n";
    }

    public byte[] toBytes() {
        return render().getBytes(StandardCharsets.UTF_8);
    }

    private static boolean isSingleLine(String s) {
        return s.indexOf('\n') < 0 && s.indexOf('\r') < 0;
    }
}
