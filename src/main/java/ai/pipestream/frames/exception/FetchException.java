package ai.pipestream.frames.exception;

/**
 * Thrown when a validated fetch fails at the transport level: unreachable
 * host, timeout, or a non-2xx response.
 */
public class FetchException extends FrameServiceException {

    public static final String CODE = "FETCH_ERROR";

    private final String url;
    private final int statusCode;

    public FetchException(String url, String message, Throwable cause) {
        super(CODE, "fetch", message, cause);
        this.url = url;
        this.statusCode = -1;
    }

    public FetchException(String url, int statusCode) {
        super(CODE, "fetch", String.format("HTTP %d from %s", statusCode, url));
        this.url = url;
        this.statusCode = statusCode;
    }

    public String getUrl() {
        return url;
    }

    /**
     * @return the HTTP status, or -1 when no response was received
     */
    public int getStatusCode() {
        return statusCode;
    }
}
