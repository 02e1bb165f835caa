package cloud.signet.combiner;

import cloud.signet.combiner.validation.ResponseRecord;

import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.TreeMap;

/**
 * Derives the client-visible error of a request that could not produce a signature.
 *
 * <p>
 * Only non-2xx signer responses are tallied. Among codes with the same count the numerically lowest wins, which keeps
 * the verdict independent of the order in which signers happened to answer. A majority outside 4xx/5xx (an
 * unfollowed redirect, say) is reported as a 500.
 * </p>
 */
public final class ErrorAggregator {

    static final int DEFAULT_ERROR_STATUS = 500;
    static final int QUOTA_EXCEEDED_STATUS = 403;

    private ErrorAggregator() {
    }

    public static OptionalInt majorityErrorCode(List<ResponseRecord> records) {
        Map<Integer, Integer> counts = new TreeMap<>();
        for (ResponseRecord record : records) {
            if (!record.isSuccess()) {
                counts.merge(record.statusCode(), 1, Integer::sum);
            }
        }

        int best = -1;
        int bestCount = 0;
        for (Map.Entry<Integer, Integer> entry : counts.entrySet()) {
            if (entry.getValue() > bestCount) {
                best = entry.getKey();
                bestCount = entry.getValue();
            }
        }
        return bestCount == 0 ? OptionalInt.empty() : OptionalInt.of(best);
    }

    public static CombinerApiException clientError(OptionalInt majorityErrorCode) {
        if (majorityErrorCode.isPresent() && majorityErrorCode.getAsInt() == QUOTA_EXCEEDED_STATUS) {
            return new CombinerApiException(QUOTA_EXCEEDED_STATUS, ErrorCode.EXCEEDED_QUOTA);
        }
        int status = majorityErrorCode.orElse(DEFAULT_ERROR_STATUS);
        if (status < 400 || status > 599) {
            status = DEFAULT_ERROR_STATUS;
        }
        return new CombinerApiException(status, ErrorCode.NOT_ENOUGH_PARTIAL_SIGNATURES);
    }

    public static CombinerApiException clientError(List<ResponseRecord> records) {
        return clientError(majorityErrorCode(records));
    }
}
