package ai.pipestream.frames.exception;

/**
 * Thrown synchronously when a bulk run is requested for a frame project that
 * already has one in progress.
 */
public class AlreadyRunningException extends FrameServiceException {

    public static final String CODE = "ALREADY_RUNNING";

    private final long projectId;
    private final String activeRunId;

    public AlreadyRunningException(long projectId, String activeRunId) {
        super(CODE, "trigger-run",
                String.format("frame project %d already has an active run (%s)", projectId, activeRunId));
        this.projectId = projectId;
        this.activeRunId = activeRunId;
    }

    public long getProjectId() {
        return projectId;
    }

    public String getActiveRunId() {
        return activeRunId;
    }
}
