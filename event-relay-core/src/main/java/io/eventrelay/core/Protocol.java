package io.eventrelay.core;

/**
 * Event relay wire constants (query keys, header names, well-known events).
 *
 * <p>This module intentionally contains no HTTP client/server bindings. It only models protocol-level
 * concerns that are shared across clients and servers.
 */
public final class Protocol {
    private Protocol() {}

    // Query parameter keys
    public static final String Q_CLIENT_ID = "client_id";

    // Default connect path
    public static final String DEFAULT_CONNECT_PATH = "/api/sse/connect";

    // Well-known events
    public static final String EVENT_CONNECTED = "connected";
    public static final String FIELD_CLIENT_ID = "client_id";

    // Line prefixes
    public static final String FIELD_EVENT = "event:";
    public static final String FIELD_DATA = "data:";
    public static final String COMMENT_PREFIX = ":";

    /** Keepalive comment block, a comment line followed by a blank line. */
    public static final String KEEPALIVE_FRAME = ": keepalive\n\n";

    // HTTP headers
    public static final String H_CONTENT_TYPE = "Content-Type";
    public static final String H_CACHE_CONTROL = "Cache-Control";
    public static final String H_CONNECTION = "Connection";
    public static final String H_ACCEPT = "Accept";
    public static final String H_ORIGIN = "Origin";
    public static final String H_ALLOW_ORIGIN = "Access-Control-Allow-Origin";
    public static final String H_ALLOW_METHODS = "Access-Control-Allow-Methods";
    public static final String H_ALLOW_HEADERS = "Access-Control-Allow-Headers";

    // Header values
    public static final String CT_EVENT_STREAM = "text/event-stream";
    public static final String NO_CACHE = "no-cache";
    public static final String KEEP_ALIVE = "keep-alive";
    public static final String ALLOWED_METHODS = "GET, OPTIONS";
    public static final String ALLOWED_HEADERS = "Content-Type";
    public static final String ANY_ORIGIN = "*";
}
