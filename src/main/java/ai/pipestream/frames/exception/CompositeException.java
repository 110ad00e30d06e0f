package ai.pipestream.frames.exception;

/**
 * Thrown when a single product image cannot be composited. Always per-item:
 * the bulk orchestrator records it on the failed output and keeps going.
 */
public class CompositeException extends FrameServiceException {

    public static final String CODE = "COMPOSITE_ERROR";

    public enum Kind {
        DECODE_FAILED,
        UNSUPPORTED_DIMENSIONS,
        ENCODE_FAILED
    }

    private final Kind kind;

    public CompositeException(Kind kind, String message) {
        super(CODE, "composite", kind + ": " + message);
        this.kind = kind;
    }

    public CompositeException(Kind kind, String message, Throwable cause) {
        super(CODE, "composite", kind + ": " + message, cause);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }

    public static CompositeException decodeFailed(String message) {
        return new CompositeException(Kind.DECODE_FAILED, message);
    }

    public static CompositeException decodeFailed(String message, Throwable cause) {
        return new CompositeException(Kind.DECODE_FAILED, message, cause);
    }

    public static CompositeException encodeFailed(String message, Throwable cause) {
        return new CompositeException(Kind.ENCODE_FAILED, message, cause);
    }
}
