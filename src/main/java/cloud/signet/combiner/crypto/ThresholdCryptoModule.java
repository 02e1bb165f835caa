package cloud.signet.combiner.crypto;

/**
 * Per-request accumulator of partial signatures. Implementations are not required to be thread-safe; the owning
 * signing session serialises every call.
 */
public interface ThresholdCryptoModule {

    /**
     * Verifies and accumulates a partial signature. Invalid shares and repeated shares from the same signer are
     * dropped without error.
     *
     * @return {@code true} when the share was accepted.
     */
    boolean addShare(PartialSignatureShare share);

    boolean hasQuorum();

    int acceptedCount();

    int threshold();

    /**
     * Combines the accepted shares. The first successful result is cached and returned by later calls.
     *
     * @throws CombinationUnavailableException when fewer than {@link #threshold()} usable shares remain or
     *                                         reconstruction fails.
     */
    byte[] combine() throws CombinationUnavailableException;

    /**
     * Opens a module bound to one blinded message.
     */
    @FunctionalInterface
    interface Factory {

        /**
         * @throws IllegalArgumentException when the blinded message is malformed.
         */
        ThresholdCryptoModule open(byte[] blindedMessage);
    }
}
