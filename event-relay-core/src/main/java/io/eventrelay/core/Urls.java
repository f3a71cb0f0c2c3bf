package io.eventrelay.core;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Builds the connect URL from a server base URL.
 */
public final class Urls {
    private Urls() {}

    /**
     * Appends {@code path} to {@code base}, collapsing a duplicated slash at the join.
     */
    public static URI resolvePath(URI base, String path) {
        Objects.requireNonNull(base, "base");
        if (path == null || path.isEmpty()) return base;
        String b = base.toString();
        if (b.endsWith("/") && path.startsWith("/")) {
            b = b.substring(0, b.length() - 1);
        } else if (!b.endsWith("/") && !path.startsWith("/")) {
            b = b + "/";
        }
        return URI.create(b + path);
    }

    /**
     * Adds one form-encoded query parameter, keeping any query already on {@code base}.
     */
    public static URI withQueryParam(URI base, String name, String value) {
        Objects.requireNonNull(base, "base");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(value, "value");
        String separator = base.getRawQuery() == null ? "?" : "&";
        return URI.create(base + separator
                + URLEncoder.encode(name, StandardCharsets.UTF_8) + "="
                + URLEncoder.encode(value, StandardCharsets.UTF_8));
    }
}
