package ai.pipestream.frames.exception;

/**
 * Thrown when a fetch target or its response is rejected by the URL safety
 * rules: disallowed scheme, port or address range, unexpected content type,
 * or a response over the byte ceiling.
 */
public class UrlValidationException extends FrameServiceException {

    public static final String CODE = "VALIDATION_ERROR";

    private final String url;

    public UrlValidationException(String url, String reason) {
        super(CODE, "fetch", reason);
        this.url = url;
    }

    public String getUrl() {
        return url;
    }
}
