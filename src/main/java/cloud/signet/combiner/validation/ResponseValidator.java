package cloud.signet.combiner.validation;

import com.fasterxml.jackson.databind.JsonNode;
import cloud.signet.combiner.crypto.PartialSignatureShare;
import cloud.signet.combiner.fanout.SignerResponse;
import cloud.signet.combiner.internal.Json;
import cloud.signet.combiner.internal.SignerErrorDecoder;
import cloud.signet.combiner.protocol.SigningProtocol;

import java.io.IOException;
import java.util.Base64;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Acceptance gate for signer responses.
 *
 * <p>
 * Every response is appended to the caller's record log before any check runs, so rejected signers still take part
 * in error aggregation. A response is accepted only when it has a 2xx status, declares the combiner's key version,
 * and carries a base64 signature in the field the {@link SigningProtocol} designates.
 * </p>
 */
public final class ResponseValidator {

    private final int keyVersion;
    private final SigningProtocol protocol;

    public ResponseValidator(int keyVersion, SigningProtocol protocol) {
        this.keyVersion = keyVersion;
        this.protocol = Objects.requireNonNull(protocol, "protocol");
    }

    /**
     * Records {@code response} in {@code log} and extracts its partial signature.
     *
     * @throws SignerResponseException when the response cannot contribute a share.
     */
    public PartialSignatureShare accept(SignerResponse response, List<ResponseRecord> log) throws SignerResponseException {
        log.add(new ResponseRecord(response.signer(), response.statusCode(), response.body()));

        String url = response.signer().url();
        if (!response.isSuccess()) {
            throw new SignerResponseException(response.signer(), SignerResponseException.Reason.ERROR_STATUS,
                "Signer " + url + " failed with " + SignerErrorDecoder.describe(response.statusCode(), response.body()));
        }

        if (!matchesKeyVersion(response.keyVersion())) {
            throw new SignerResponseException(response.signer(), SignerResponseException.Reason.INCORRECT_KEY_VERSION,
                "Incorrect key version received from signer " + url);
        }

        JsonNode body;
        try {
            body = Json.readObject(response.body());
        } catch (IOException ex) {
            throw new SignerResponseException(response.signer(), SignerResponseException.Reason.MALFORMED_RESPONSE,
                "Unusable response from signer " + url + ": " + ex.getMessage());
        }

        Optional<String> signature = protocol.signature(body);
        if (signature.isEmpty() || signature.get().isBlank()) {
            throw new SignerResponseException(response.signer(), SignerResponseException.Reason.SIGNATURE_MISSING,
                "Signature is missing from signer " + url);
        }

        byte[] bytes;
        try {
            bytes = Base64.getDecoder().decode(signature.get().trim());
        } catch (IllegalArgumentException ex) {
            throw new SignerResponseException(response.signer(), SignerResponseException.Reason.MALFORMED_RESPONSE,
                "Signature from signer " + url + " is not base64");
        }
        return new PartialSignatureShare(response.signer(), bytes);
    }

    private boolean matchesKeyVersion(String declared) {
        if (declared == null || declared.isBlank()) {
            return false;
        }
        try {
            return Integer.parseInt(declared.trim()) == keyVersion;
        } catch (NumberFormatException ex) {
            return false;
        }
    }
}
