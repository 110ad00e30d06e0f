package ai.pipestream.frames.output;

public enum OutputStatus {
    SUCCEEDED,
    FAILED
}
