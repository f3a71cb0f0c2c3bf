package io.eventrelay.server.core;

import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;

/**
 * Minimal query string parser (framework-neutral). The first occurrence of a key wins.
 */
final class QueryString {

    private QueryString() {}

    static Map<String, String> parse(URI uri) {
        String q = uri.getRawQuery();
        if (q == null || q.isEmpty()) return Map.of();
        Map<String, String> out = new HashMap<>();
        for (String part : q.split("&")) {
            if (part.isEmpty()) continue;
            int eq = part.indexOf('=');
            if (eq < 0) {
                out.putIfAbsent(decode(part), "");
            } else {
                String k = decode(part.substring(0, eq));
                String v = decode(part.substring(eq + 1));
                out.putIfAbsent(k, v);
            }
        }
        return out;
    }

    private static String decode(String s) {
        return URLDecoder.decode(s, StandardCharsets.UTF_8);
    }
}
