package cloud.signet.combiner;

/**
 * Base exception thrown by the signature combiner.
 */
public class CombinerException extends Exception {

    private static final long serialVersionUID = 1L;

    public CombinerException(String message) {
        super(message);
    }

    public CombinerException(String message, Throwable cause) {
        super(message, cause);
    }
}
