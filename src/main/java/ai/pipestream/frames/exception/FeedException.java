package ai.pipestream.frames.exception;

/**
 * Thrown when a feed cannot be used as a whole: unreachable endpoint,
 * non-2xx response, or a document that does not parse as XML.
 */
public class FeedException extends FrameServiceException {

    public static final String CODE = "FEED_ERROR";

    public FeedException(String message) {
        super(CODE, "feed", message);
    }

    public FeedException(String message, Throwable cause) {
        super(CODE, "feed", message, cause);
    }
}
