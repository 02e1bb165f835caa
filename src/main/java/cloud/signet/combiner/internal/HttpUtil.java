package cloud.signet.combiner.internal;

import com.sun.net.httpserver.HttpExchange;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.URI;
import java.net.http.HttpRequest;
import java.time.Duration;
import java.util.Map;

/**
 * Helper methods for building outbound JSON requests and writing JSON responses.
 */
public final class HttpUtil {

    public static final String CONTENT_TYPE = "Content-Type";
    public static final String APPLICATION_JSON = "application/json";

    private HttpUtil() {
    }

    /**
     * Builds a JSON POST. Headers with {@code null} or blank values are skipped.
     */
    public static HttpRequest jsonPost(String url, byte[] body, Map<String, String> headers, Duration timeout) {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
            .uri(URI.create(url))
            .POST(HttpRequest.BodyPublishers.ofByteArray(body))
            .header(CONTENT_TYPE, APPLICATION_JSON)
            .header("Accept", APPLICATION_JSON);

        if (headers != null) {
            headers.forEach((name, value) -> {
                if (value != null && !value.isBlank()) {
                    builder.header(name, value);
                }
            });
        }
        if (timeout != null && !timeout.isZero() && !timeout.isNegative()) {
            builder.timeout(timeout);
        }
        return builder.build();
    }

    public static byte[] readBody(HttpExchange exchange) throws IOException {
        try (InputStream stream = exchange.getRequestBody()) {
            return stream.readAllBytes();
        }
    }

    public static void writeJson(HttpExchange exchange, int status, Object payload) throws IOException {
        byte[] bytes = Json.mapper().writeValueAsBytes(payload);
        exchange.getResponseHeaders().set(CONTENT_TYPE, APPLICATION_JSON);
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }
}
