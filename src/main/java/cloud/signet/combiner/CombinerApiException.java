package cloud.signet.combiner;

/**
 * Client-visible failure of a signing request. Carries the HTTP status the combiner answers with and the
 * {@link ErrorCode} written into the error body; signer error bodies never reach this type.
 */
public final class CombinerApiException extends CombinerException {

    private static final long serialVersionUID = 1L;

    private final int statusCode;
    private final ErrorCode code;

    public CombinerApiException(int statusCode, ErrorCode code) {
        this(statusCode, code, null);
    }

    public CombinerApiException(int statusCode, ErrorCode code, String detail) {
        super(detail == null || detail.isBlank() ? code.message() : code.message() + ": " + detail);
        this.statusCode = statusCode;
        this.code = code;
    }

    /**
     * @return HTTP status returned to the client.
     */
    public int getStatusCode() {
        return statusCode;
    }

    /**
     * @return combiner error code describing the failure.
     */
    public ErrorCode getCode() {
        return code;
    }
}
