package cloud.signet.combiner.validation;

import cloud.signet.combiner.SignerEndpoint;

/**
 * A signer response as seen by the combiner, kept for error aggregation and discrepancy logging.
 *
 * @param signer     signer that answered.
 * @param statusCode HTTP status code of the answer.
 * @param rawBody    unparsed response body.
 */
public record ResponseRecord(SignerEndpoint signer, int statusCode, String rawBody) {

    public boolean isSuccess() {
        return statusCode >= 200 && statusCode < 300;
    }
}
