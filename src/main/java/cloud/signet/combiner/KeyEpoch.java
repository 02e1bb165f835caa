package cloud.signet.combiner;

import java.util.Objects;

/**
 * The distributed key currently served by the combiner. Signers must declare the same {@code keyVersion};
 * responses produced under another version are rejected.
 *
 * @param publicKey              hex encoded compressed public key point.
 * @param keyVersion             version identifier of the key.
 * @param verificationPolynomial hex encoded commitments to the sharing polynomial coefficients.
 */
public record KeyEpoch(String publicKey, int keyVersion, String verificationPolynomial) {

    public KeyEpoch {
        Objects.requireNonNull(publicKey, "publicKey");
        Objects.requireNonNull(verificationPolynomial, "verificationPolynomial");
        if (keyVersion < 0) {
            throw new IllegalArgumentException("keyVersion cannot be negative");
        }
    }
}
