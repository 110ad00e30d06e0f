package ai.pipestream.frames.bulk;

public enum RunState {
    RUNNING,
    SUCCEEDED,
    FAILED,
    CANCELLED
}
