package io.eventrelay.server.core;

import java.util.Locale;

public enum HttpMethod {
    GET, HEAD, POST, PUT, PATCH, DELETE, OPTIONS, TRACE, CONNECT;

    /**
     * @return the matching method, or {@code null} for an unknown token
     */
    public static HttpMethod parse(String method) {
        if (method == null) return null;
        try {
            return valueOf(method.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
