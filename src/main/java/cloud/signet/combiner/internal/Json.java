package cloud.signet.combiner.internal;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.StreamReadFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;

/**
 * Shared ObjectMapper for client bodies, signer bodies and server responses. Duplicate keys are rejected so a body
 * cannot carry two different signatures.
 */
public final class Json {

    private static final ObjectMapper MAPPER = JsonMapper.builder()
        .addModule(new JavaTimeModule())
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .enable(StreamReadFeature.STRICT_DUPLICATE_DETECTION)
        .build()
        .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    private Json() {
    }

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    /**
     * @throws IOException when {@code text} is not JSON or its root is not an object.
     */
    public static ObjectNode readObject(String text) throws IOException {
        return requireObject(MAPPER.readTree(text == null ? "" : text));
    }

    /**
     * @throws IOException when {@code bytes} are not JSON or their root is not an object.
     */
    public static ObjectNode readObject(byte[] bytes) throws IOException {
        return requireObject(MAPPER.readTree(bytes == null ? new byte[0] : bytes));
    }

    private static ObjectNode requireObject(JsonNode node) throws IOException {
        if (node == null || !node.isObject()) {
            throw new IOException("expected a JSON object but found " + (node == null ? "nothing" : node.getNodeType()));
        }
        return (ObjectNode) node;
    }
}
