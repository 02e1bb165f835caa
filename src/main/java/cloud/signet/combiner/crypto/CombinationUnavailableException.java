package cloud.signet.combiner.crypto;

import cloud.signet.combiner.CombinerException;

/**
 * Raised when accumulated partial signatures cannot be combined into a full signature.
 */
public final class CombinationUnavailableException extends CombinerException {

    private static final long serialVersionUID = 1L;

    public CombinationUnavailableException(String message) {
        super(message);
    }

    public CombinationUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
