package cloud.signet.combiner.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import cloud.signet.combiner.CombinerApiException;
import cloud.signet.combiner.ErrorCode;
import cloud.signet.combiner.internal.Discrepancies;
import cloud.signet.combiner.validation.ResponseRecord;

import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Domain-restricted signatures. The client names a {@code domain} whose rate-limiting state each signer tracks and
 * reports back under {@code status}.
 */
public final class DomainSignatureProtocol implements SigningProtocol {

    public static final String PATH = "/domain/sign";

    private static final Logger LOGGER = Logger.getLogger(DomainSignatureProtocol.class.getName());

    @Override
    public String name() {
        return "domain-signature";
    }

    @Override
    public String combinerPath() {
        return PATH;
    }

    @Override
    public String signerPath() {
        return PATH;
    }

    @Override
    public void checkInput(JsonNode body) throws CombinerApiException {
        JsonNode domain = body.path("domain");
        if (!domain.isObject() || domain.path("name").asText("").isBlank()) {
            throw new CombinerApiException(400, ErrorCode.INVALID_INPUT, "domain with a name is required");
        }
        Inputs.requireBase64(body, "blindedMessage");
    }

    @Override
    public String blindedMessage(JsonNode body) {
        return body.path("blindedMessage").asText();
    }

    @Override
    public Optional<String> signature(JsonNode signerBody) {
        return Inputs.text(signerBody, "signature");
    }

    @Override
    public void logDiscrepancies(List<ResponseRecord> records) {
        Discrepancies.warnIfDivergent(LOGGER, name(), records, "/status/disabled", 0);
        Discrepancies.warnIfDivergent(LOGGER, name(), records, "/status/counter", 0);
        Discrepancies.warnIfDivergent(LOGGER, name(), records, "/status/timer", 0);
    }
}
