package ai.pipestream.frames.exception;

/**
 * Thrown when a frame project (or one of its outputs) cannot be found.
 */
public class FrameProjectNotFoundException extends FrameServiceException {

    public static final String CODE = "NOT_FOUND";

    public FrameProjectNotFoundException(long projectId) {
        super(CODE, "lookup", "frame project not found: " + projectId);
    }

    public FrameProjectNotFoundException(long projectId, String productId) {
        super(CODE, "lookup", String.format("no output for product %s in frame project %d", productId, projectId));
    }
}
