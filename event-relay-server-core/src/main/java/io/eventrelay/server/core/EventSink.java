package io.eventrelay.server.core;

import java.io.IOException;

/**
 * Output side of one streaming response.
 *
 * <p>Implementations are not required to be thread-safe; {@link Connection} serializes access.
 */
public interface EventSink {

    void write(byte[] bytes) throws IOException;

    void flush() throws IOException;
}
