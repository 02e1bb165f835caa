package cloud.signet.combiner.validation;

import cloud.signet.combiner.CombinerException;
import cloud.signet.combiner.SignerEndpoint;

/**
 * A signer response that cannot contribute a partial signature.
 */
public final class SignerResponseException extends CombinerException {

    private static final long serialVersionUID = 1L;

    /**
     * Why a response was rejected.
     */
    public enum Reason {
        ERROR_STATUS,
        INCORRECT_KEY_VERSION,
        MALFORMED_RESPONSE,
        SIGNATURE_MISSING
    }

    private final transient SignerEndpoint signer;
    private final Reason reason;

    public SignerResponseException(SignerEndpoint signer, Reason reason, String message) {
        super(message);
        this.signer = signer;
        this.reason = reason;
    }

    public SignerEndpoint getSigner() {
        return signer;
    }

    public Reason getReason() {
        return reason;
    }
}
