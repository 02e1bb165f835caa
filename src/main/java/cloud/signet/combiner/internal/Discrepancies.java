package cloud.signet.combiner.internal;

import com.fasterxml.jackson.databind.JsonNode;
import cloud.signet.combiner.validation.ResponseRecord;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Compares one field across successful signer responses and logs when signers disagree.
 */
public final class Discrepancies {

    private Discrepancies() {
    }

    /**
     * Logs a WARNING when signers report different values at {@code pointer}, escalating to SEVERE when numeric values
     * spread further than {@code maxSpread}.
     *
     * @return {@code true} when a discrepancy was found.
     */
    public static boolean warnIfDivergent(Logger logger, String protocol, List<ResponseRecord> records, String pointer,
                                          long maxSpread) {
        Map<String, JsonNode> values = valuesBySigner(records, pointer);
        if (values.size() < 2) {
            return false;
        }

        Set<String> distinct = new LinkedHashSet<>();
        boolean numeric = true;
        long min = Long.MAX_VALUE;
        long max = Long.MIN_VALUE;
        for (JsonNode value : values.values()) {
            distinct.add(value.toString());
            if (value.isIntegralNumber()) {
                min = Math.min(min, value.asLong());
                max = Math.max(max, value.asLong());
            } else {
                numeric = false;
            }
        }
        if (distinct.size() == 1) {
            return false;
        }

        Level level = numeric && spread(min, max) > maxSpread ? Level.SEVERE : Level.WARNING;
        logger.log(level, () -> String.format(Locale.ROOT,
            "[combiner] %s signers disagree on %s: %s", protocol, pointer, values));
        return true;
    }

    static long spread(long min, long max) {
        try {
            return Math.subtractExact(max, min);
        } catch (ArithmeticException ex) {
            return Long.MAX_VALUE;
        }
    }

    static Map<String, JsonNode> valuesBySigner(List<ResponseRecord> records, String pointer) {
        Map<String, JsonNode> values = new LinkedHashMap<>();
        for (ResponseRecord record : records) {
            if (!record.isSuccess()) {
                continue;
            }
            JsonNode body;
            try {
                body = Json.readObject(record.rawBody());
            } catch (IOException ex) {
                // already reported by the response validator
                continue;
            }
            JsonNode value = body.at(pointer);
            if (value != null && !value.isMissingNode() && !value.isNull()) {
                values.put(record.signer().url(), value);
            }
        }
        return values;
    }
}
