package cloud.signet.combiner.crypto;

import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.logging.Logger;

/**
 * {@link ThresholdCryptoModule} backed by a {@link ThresholdScheme}. Shares are verified on arrival and kept ordered by
 * signer index, so combination always uses the {@code t} lowest indices and is deterministic for a given accepted set.
 */
public final class ThresholdSignatureAccumulator implements ThresholdCryptoModule {

    private static final Logger LOGGER = Logger.getLogger(ThresholdSignatureAccumulator.class.getName());

    private final ThresholdScheme scheme;
    private final byte[] blindedMessage;
    private final SortedMap<Integer, byte[]> accepted = new TreeMap<>();
    private byte[] combined;

    public ThresholdSignatureAccumulator(ThresholdScheme scheme, byte[] blindedMessage) {
        this.scheme = Objects.requireNonNull(scheme, "scheme");
        Objects.requireNonNull(blindedMessage, "blindedMessage");
        scheme.validateMessage(blindedMessage);
        this.blindedMessage = blindedMessage.clone();
    }

    public static ThresholdCryptoModule.Factory factory(ThresholdScheme scheme) {
        Objects.requireNonNull(scheme, "scheme");
        return blindedMessage -> new ThresholdSignatureAccumulator(scheme, blindedMessage);
    }

    @Override
    public boolean addShare(PartialSignatureShare share) {
        int index = share.signer().index();
        if (accepted.containsKey(index)) {
            LOGGER.fine(() -> "[combiner] ignoring repeated share from " + share.signer());
            return false;
        }
        byte[] signature = share.signatureBytes();
        if (!scheme.verifyShare(index, blindedMessage, signature)) {
            LOGGER.fine(() -> "[combiner] dropping invalid share from " + share.signer());
            return false;
        }
        accepted.put(index, signature);
        return true;
    }

    @Override
    public boolean hasQuorum() {
        return accepted.size() >= scheme.threshold();
    }

    @Override
    public int acceptedCount() {
        return accepted.size();
    }

    @Override
    public int threshold() {
        return scheme.threshold();
    }

    @Override
    public byte[] combine() throws CombinationUnavailableException {
        if (combined != null) {
            return combined.clone();
        }
        int threshold = scheme.threshold();
        if (accepted.size() < threshold) {
            throw new CombinationUnavailableException(
                "only " + accepted.size() + " of " + threshold + " required partial signatures available");
        }

        SortedMap<Integer, byte[]> selected = new TreeMap<>();
        for (Map.Entry<Integer, byte[]> entry : accepted.entrySet()) {
            if (selected.size() == threshold) {
                break;
            }
            selected.put(entry.getKey(), entry.getValue());
        }

        byte[] result;
        try {
            result = scheme.reconstruct(selected);
        } catch (IllegalArgumentException | ArithmeticException ex) {
            throw new CombinationUnavailableException("reconstruction failed: " + ex.getMessage(), ex);
        }
        combined = result.clone();
        return result;
    }
}
