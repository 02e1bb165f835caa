package cloud.signet.combiner.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import cloud.signet.combiner.CombinerApiException;
import cloud.signet.combiner.ErrorCode;
import cloud.signet.combiner.internal.Discrepancies;
import cloud.signet.combiner.validation.ResponseRecord;

import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * Blinded-message signatures for account-scoped queries. Clients send {@code account} and
 * {@code blindedQueryPhoneNumber}; signers report their quota view alongside the partial signature.
 */
public final class BlindedMessageProtocol implements SigningProtocol {

    public static final String COMBINER_PATH = "/getBlindedMessageSig";
    public static final String SIGNER_PATH = "/getBlindedMessagePartialSig";

    static final long MAX_BLOCK_DISCREPANCY = 3;
    static final long MAX_QUOTA_DISCREPANCY = 5;

    private static final Logger LOGGER = Logger.getLogger(BlindedMessageProtocol.class.getName());
    private static final Pattern ACCOUNT = Pattern.compile("^(0x)?[0-9a-fA-F]{40}$");

    @Override
    public String name() {
        return "blinded-message";
    }

    @Override
    public String combinerPath() {
        return COMBINER_PATH;
    }

    @Override
    public String signerPath() {
        return SIGNER_PATH;
    }

    @Override
    public void checkInput(JsonNode body) throws CombinerApiException {
        String account = body.path("account").asText("");
        if (!ACCOUNT.matcher(account).matches()) {
            throw new CombinerApiException(400, ErrorCode.INVALID_INPUT, "account must be a 20-byte hex address");
        }
        Inputs.requireBase64(body, "blindedQueryPhoneNumber");
    }

    @Override
    public String blindedMessage(JsonNode body) {
        return body.path("blindedQueryPhoneNumber").asText();
    }

    @Override
    public Optional<String> signature(JsonNode signerBody) {
        return Inputs.text(signerBody, "signature");
    }

    @Override
    public void logDiscrepancies(List<ResponseRecord> records) {
        Discrepancies.warnIfDivergent(LOGGER, name(), records, "/performedQueryCount", MAX_QUOTA_DISCREPANCY);
        Discrepancies.warnIfDivergent(LOGGER, name(), records, "/totalQuota", MAX_QUOTA_DISCREPANCY);
        Discrepancies.warnIfDivergent(LOGGER, name(), records, "/blockNumber", MAX_BLOCK_DISCREPANCY);
    }
}
