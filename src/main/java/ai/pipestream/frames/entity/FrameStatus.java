package ai.pipestream.frames.entity;

/**
 * Lifecycle of a frame project.
 * <pre>
 * DRAFT -> COORDINATES_SET -> PROCESSING -> COMPLETED | FAILED
 * </pre>
 * A finished project can be run again, which moves it back to PROCESSING.
 */
public enum FrameStatus {
    DRAFT,
    COORDINATES_SET,
    PROCESSING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
