package cloud.signet.combiner.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import cloud.signet.combiner.CombinerApiException;
import cloud.signet.combiner.ErrorCode;

import java.util.Base64;
import java.util.Optional;

final class Inputs {

    private Inputs() {
    }

    static Optional<String> text(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (!value.isTextual() || value.asText().isBlank()) {
            return Optional.empty();
        }
        return Optional.of(value.asText());
    }

    static void requireBase64(JsonNode body, String field) throws CombinerApiException {
        String value = text(body, field)
            .orElseThrow(() -> new CombinerApiException(400, ErrorCode.INVALID_INPUT, field + " is required"));
        try {
            Base64.getDecoder().decode(value.trim());
        } catch (IllegalArgumentException ex) {
            throw new CombinerApiException(400, ErrorCode.INVALID_INPUT, field + " must be base64");
        }
    }
}
