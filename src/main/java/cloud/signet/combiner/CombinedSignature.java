package cloud.signet.combiner;

/**
 * Successful outcome of a signing request.
 *
 * @param combinedSignature base64 encoded signature reconstructed from the signers' partial signatures.
 * @param version           combiner service version.
 */
public record CombinedSignature(String combinedSignature, String version) {
}
