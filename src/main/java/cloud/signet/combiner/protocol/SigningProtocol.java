package cloud.signet.combiner.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import cloud.signet.combiner.CombinerApiException;
import cloud.signet.combiner.validation.ResponseRecord;

import java.util.List;
import java.util.Optional;

/**
 * Per-domain behaviour plugged into the quorum combiner. Implementations are stateless and shared across requests.
 */
public interface SigningProtocol {

    String name();

    /**
     * @return path clients post signing requests to.
     */
    String combinerPath();

    /**
     * @return path appended to each signer URL when fanning the request out.
     */
    String signerPath();

    /**
     * Validates the client body before any signer is contacted.
     *
     * @throws CombinerApiException with status 400 when the body is unusable.
     */
    void checkInput(JsonNode body) throws CombinerApiException;

    /**
     * @return base64 blinded message carried by a body that passed {@link #checkInput(JsonNode)}.
     */
    String blindedMessage(JsonNode body);

    /**
     * @return base64 partial signature from a signer body, empty when absent.
     */
    Optional<String> signature(JsonNode signerBody);

    /**
     * Logs disagreement between signers' successful responses. Observability only.
     */
    void logDiscrepancies(List<ResponseRecord> records);
}
