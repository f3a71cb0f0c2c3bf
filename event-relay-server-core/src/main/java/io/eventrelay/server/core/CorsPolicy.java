package io.eventrelay.server.core;

import io.eventrelay.core.Protocol;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Cross-origin headers for the stream endpoint.
 *
 * <p>An empty allow-list allows any origin. Otherwise a matching origin (or a {@code *} entry) is echoed
 * back, and an unmatched origin is answered with the first configured entry, which browsers will reject.
 */
public final class CorsPolicy {
    private final List<String> allowedOrigins;

    public CorsPolicy(List<String> allowedOrigins) {
        this.allowedOrigins = allowedOrigins == null ? List.of() : List.copyOf(allowedOrigins);
    }

    public static CorsPolicy allowAll() {
        return new CorsPolicy(List.of());
    }

    public List<String> allowedOrigins() {
        return allowedOrigins;
    }

    public Map<String, String> headersFor(String requestOrigin) {
        Map<String, String> out = new LinkedHashMap<>();
        out.put(Protocol.H_ALLOW_ORIGIN, allowOrigin(requestOrigin));
        out.put(Protocol.H_ALLOW_METHODS, Protocol.ALLOWED_METHODS);
        out.put(Protocol.H_ALLOW_HEADERS, Protocol.ALLOWED_HEADERS);
        return out;
    }

    private String allowOrigin(String requestOrigin) {
        if (allowedOrigins.isEmpty()) {
            return Protocol.ANY_ORIGIN;
        }
        for (String allowed : allowedOrigins) {
            if (allowed.equals(requestOrigin)) {
                return requestOrigin;
            }
            if (Protocol.ANY_ORIGIN.equals(allowed)) {
                return requestOrigin == null ? Protocol.ANY_ORIGIN : requestOrigin;
            }
        }
        return allowedOrigins.get(0);
    }
}
