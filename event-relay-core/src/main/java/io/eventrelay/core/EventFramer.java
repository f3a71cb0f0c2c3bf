package io.eventrelay.core;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;

/**
 * Incremental SSE parser for the relay's single-line event protocol.
 *
 * <p>Comment lines (starting with {@code :}) are skipped, {@code event:} and {@code data:} set the
 * pending fields, and a blank line completes an event only when both fields are set. Any other line
 * shape is ignored.
 */
public final class EventFramer implements AutoCloseable {

    public record Event(String eventType, String data) {}

    private final BufferedReader in;
    private String pendingType;
    private String pendingData;

    /**
     * Creates a new framer reading from the given input stream.
     *
     * @param is the input stream to read from
     */
    public EventFramer(InputStream is) {
        this.in = new BufferedReader(new InputStreamReader(is, StandardCharsets.UTF_8));
    }

    /**
     * Reads until the next complete event.
     *
     * @return the next event, or {@code null} if EOF is reached
     * @throws IOException if an I/O error occurs
     */
    public Event next() throws IOException {
        String line;
        while ((line = in.readLine()) != null) {
            Event ev = accept(line);
            if (ev != null) return ev;
        }
        return null;
    }

    /**
     * Feeds one line (without its terminator) into the framer.
     *
     * @return the completed event, or {@code null} if the line did not complete one
     */
    Event accept(String line) {
        if (line.startsWith(Protocol.COMMENT_PREFIX)) {
            return null;
        }
        if (line.startsWith(Protocol.FIELD_EVENT)) {
            pendingType = fieldValue(line, Protocol.FIELD_EVENT);
        } else if (line.startsWith(Protocol.FIELD_DATA)) {
            pendingData = fieldValue(line, Protocol.FIELD_DATA);
        } else if (line.isEmpty()) {
            if (isSet(pendingType) && isSet(pendingData)) {
                Event ev = new Event(pendingType, pendingData);
                pendingType = null;
                pendingData = null;
                return ev;
            }
        }
        return null;
    }

    private static String fieldValue(String line, String field) {
        String v = line.substring(field.length());
        return v.startsWith(" ") ? v.substring(1) : v;
    }

    private static boolean isSet(String s) {
        return s != null && !s.isEmpty();
    }

    @Override
    public void close() throws IOException {
        in.close();
    }
}
