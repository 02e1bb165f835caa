package cloud.signet.combiner.crypto;

import cloud.signet.combiner.SignerEndpoint;

import java.util.Objects;

/**
 * A partial signature returned by one signer.
 *
 * @param signer         signer that produced the share.
 * @param signatureBytes encoded partial signature, copied on construction and on access.
 */
public record PartialSignatureShare(SignerEndpoint signer, byte[] signatureBytes) {

    public PartialSignatureShare {
        Objects.requireNonNull(signer, "signer");
        Objects.requireNonNull(signatureBytes, "signatureBytes");
        signatureBytes = signatureBytes.clone();
    }

    @Override
    public byte[] signatureBytes() {
        return signatureBytes.clone();
    }

    @Override
    public String toString() {
        return "PartialSignatureShare{signer=" + signer + ", bytes=" + signatureBytes.length + "}";
    }
}
