package cloud.signet.combiner.internal;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Extracts a readable reason from a signer's error payload. Used for log lines only; signer error bodies are never
 * relayed to clients.
 */
public final class SignerErrorDecoder {

    private static final ObjectMapper MAPPER = Json.mapper();
    private static final int MAX_FALLBACK_LENGTH = 200;

    private SignerErrorDecoder() {
    }

    public static String describe(int statusCode, String body) {
        if (body == null || body.isBlank()) {
            return "status " + statusCode;
        }

        try {
            JsonNode node = MAPPER.readTree(body.getBytes(StandardCharsets.UTF_8));
            String error = node.hasNonNull("error") ? node.get("error").asText() : null;
            String message = node.hasNonNull("message") ? node.get("message").asText() : null;
            if (error == null && message == null) {
                return "status " + statusCode;
            }
            StringBuilder sb = new StringBuilder("status ").append(statusCode);
            if (error != null) {
                sb.append(" (").append(error).append(')');
            }
            if (message != null) {
                sb.append(": ").append(message);
            }
            return sb.toString();
        } catch (IOException ex) {
            String fallback = body.length() > MAX_FALLBACK_LENGTH ? body.substring(0, MAX_FALLBACK_LENGTH) : body;
            return "status " + statusCode + ": " + fallback;
        }
    }
}
