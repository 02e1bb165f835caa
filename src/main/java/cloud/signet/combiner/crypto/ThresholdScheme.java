package cloud.signet.combiner.crypto;

import java.util.SortedMap;

/**
 * Stateless threshold signature primitives for one key epoch.
 */
public interface ThresholdScheme {

    /**
     * @return number of partial signatures needed to reconstruct a signature.
     */
    int threshold();

    /**
     * Checks that {@code blindedMessage} is a well-formed message for this scheme.
     *
     * @throws IllegalArgumentException when the message cannot be decoded.
     */
    void validateMessage(byte[] blindedMessage);

    /**
     * Verifies a signer's partial signature against its public key share.
     */
    boolean verifyShare(int signerIndex, byte[] blindedMessage, byte[] partialSignature);

    /**
     * Reconstructs the full signature from exactly {@link #threshold()} verified partial signatures keyed by signer index.
     */
    byte[] reconstruct(SortedMap<Integer, byte[]> partialSignatures) throws CombinationUnavailableException;
}
