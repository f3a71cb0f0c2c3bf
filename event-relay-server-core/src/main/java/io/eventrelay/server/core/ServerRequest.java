package io.eventrelay.server.core;

import java.net.URI;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Framework-neutral request abstraction.
 */
public final class ServerRequest {
    private final HttpMethod method; // null for an unrecognised method
    private final URI uri;
    private final Map<String, List<String>> headers;

    public ServerRequest(HttpMethod method, URI uri, Map<String, List<String>> headers) {
        this.method = method;
        this.uri = Objects.requireNonNull(uri, "uri");
        this.headers = Objects.requireNonNull(headers, "headers");
    }

    public HttpMethod method() {
        return method;
    }

    public URI uri() {
        return uri;
    }

    public Map<String, List<String>> headers() {
        return headers;
    }

    /**
     * First value of a header, matching the name case-insensitively.
     */
    public Optional<String> header(String name) {
        return headers.entrySet().stream()
                .filter(e -> e.getKey() != null && e.getKey().equalsIgnoreCase(name))
                .flatMap(e -> e.getValue().stream())
                .filter(Objects::nonNull)
                .findFirst();
    }
}
