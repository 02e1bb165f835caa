package cloud.signet.combiner;

/**
 * Error codes surfaced to combiner clients.
 */
public enum ErrorCode {

    INVALID_KEY_HEADER("Invalid key version header"),
    INVALID_INPUT("Invalid request input"),
    EXCEEDED_QUOTA("Requester exceeded service query quota"),
    NOT_ENOUGH_PARTIAL_SIGNATURES("Not enough partial signatures"),
    METHOD_NOT_ALLOWED("Method not allowed"),
    UNKNOWN_ERROR("Something went wrong");

    private final String message;

    ErrorCode(String message) {
        this.message = message;
    }

    public String message() {
        return message;
    }
}
