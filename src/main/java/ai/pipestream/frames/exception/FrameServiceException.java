package ai.pipestream.frames.exception;

/**
 * Base exception for all frame composer operations.
 * Carries a stable error code and the operation that failed so callers can
 * surface structured errors over HTTP and in run status.
 */
public class FrameServiceException extends RuntimeException {

    private final String errorCode;
    private final String operation;
    private final String detail;

    public FrameServiceException(String errorCode, String operation, String message) {
        super(String.format("[%s] %s: %s", errorCode, operation, message));
        this.errorCode = errorCode;
        this.operation = operation;
        this.detail = message;
    }

    public FrameServiceException(String errorCode, String operation, String message, Throwable cause) {
        super(String.format("[%s] %s: %s", errorCode, operation, message), cause);
        this.errorCode = errorCode;
        this.operation = operation;
        this.detail = message;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public String getOperation() {
        return operation;
    }

    /**
     * The message without the code/operation prefix.
     */
    public String getDetail() {
        return detail;
    }
}
