package cloud.signet.combiner;

import com.fasterxml.jackson.databind.JsonNode;
import cloud.signet.combiner.internal.Json;

import java.io.IOException;

/**
 * Client request as received by the combiner. The body is kept both raw, so it can be forwarded to signers
 * byte for byte, and parsed for input checks.
 */
public final class SigningRequest {

    private final byte[] rawBody;
    private final JsonNode body;
    private final String declaredKeyVersion;
    private final String authorization;

    private SigningRequest(byte[] rawBody, JsonNode body, String declaredKeyVersion, String authorization) {
        this.rawBody = rawBody;
        this.body = body;
        this.declaredKeyVersion = declaredKeyVersion;
        this.authorization = authorization;
    }

    /**
     * Parses a request body.
     *
     * @param rawBody            JSON request body.
     * @param declaredKeyVersion value of the client's key version header, or {@code null} when absent.
     * @param authorization      value of the client's {@code Authorization} header, or {@code null}.
     * @throws CombinerApiException when the body is not a JSON object.
     */
    public static SigningRequest of(byte[] rawBody, String declaredKeyVersion, String authorization)
        throws CombinerApiException {
        if (rawBody == null || rawBody.length == 0) {
            throw new CombinerApiException(400, ErrorCode.INVALID_INPUT, "empty body");
        }
        JsonNode parsed;
        try {
            parsed = Json.readObject(rawBody);
        } catch (IOException ex) {
            throw new CombinerApiException(400, ErrorCode.INVALID_INPUT, "body must be a JSON object");
        }
        return new SigningRequest(rawBody.clone(), parsed, emptyToNull(declaredKeyVersion), emptyToNull(authorization));
    }

    /**
     * Convenience factory serialising {@code body} with the shared mapper.
     */
    public static SigningRequest of(Object body, String declaredKeyVersion, String authorization)
        throws CombinerApiException {
        try {
            return of(Json.mapper().writeValueAsBytes(body), declaredKeyVersion, authorization);
        } catch (IOException ex) {
            throw new CombinerApiException(400, ErrorCode.INVALID_INPUT, ex.getMessage());
        }
    }

    public byte[] rawBody() {
        return rawBody.clone();
    }

    /**
     * @return a copy of the parsed body; mutating it does not affect the request.
     */
    public JsonNode body() {
        return body.deepCopy();
    }

    public String declaredKeyVersion() {
        return declaredKeyVersion;
    }

    public String authorization() {
        return authorization;
    }

    @Override
    public String toString() {
        return "SigningRequest{bytes=" + rawBody.length + ", keyVersion=" + declaredKeyVersion + "}";
    }

    private static String emptyToNull(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim();
    }
}
