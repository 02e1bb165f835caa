package cloud.signet.combiner.fanout;

import cloud.signet.combiner.SignerEndpoint;

import java.util.Objects;

/**
 * Raw HTTP response from a signer.
 *
 * @param signer     signer that answered.
 * @param statusCode HTTP status code.
 * @param keyVersion value of the signer's key version header, {@code null} when absent.
 * @param body       response body as text, possibly empty.
 */
public record SignerResponse(SignerEndpoint signer, int statusCode, String keyVersion, String body) {

    public SignerResponse {
        Objects.requireNonNull(signer, "signer");
        body = body == null ? "" : body;
    }

    public boolean isSuccess() {
        return statusCode >= 200 && statusCode < 300;
    }
}
