package io.eventrelay.client;

import java.io.InputStream;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Transport implementation using {@link java.net.http.HttpClient}.
 */
public final class JdkHttpTransport implements EventRelayTransport {
    private final HttpClient http;

    /**
     * Creates a transport over a default client with a 10 second connect timeout.
     */
    public JdkHttpTransport() {
        this(HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build());
    }

    /**
     * Creates a new transport.
     *
     * @param http the JDK HttpClient to use
     */
    public JdkHttpTransport(HttpClient http) {
        this.http = Objects.requireNonNull(http, "http");
    }

    @Override
    public TransportResponse<InputStream> openStream(TransportRequest request) throws Exception {
        HttpResponse<InputStream> resp = http.send(buildRequest(request), HttpResponse.BodyHandlers.ofInputStream());
        return new TransportResponse<>(resp.statusCode(), resp.body());
    }

    private static HttpRequest buildRequest(TransportRequest request) {
        HttpRequest.Builder builder = HttpRequest.newBuilder(request.url())
                .method(request.method(), HttpRequest.BodyPublishers.noBody());

        if (request.timeout() != null) {
            builder.timeout(request.timeout());
        }

        for (Map.Entry<String, ? extends Iterable<String>> entry : request.headers().entrySet()) {
            String name = entry.getKey();
            if (name == null) {
                continue;
            }
            Iterable<String> values = entry.getValue();
            if (values == null) {
                continue;
            }
            for (String value : values) {
                if (value != null) {
                    builder.header(name, value);
                }
            }
        }

        return builder.build();
    }
}
