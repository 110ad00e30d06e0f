package ai.pipestream.frames.bulk;

import java.time.Instant;

/**
 * Point-in-time view of a project's current or most recent run.
 *
 * @param total  distinct products in the feed, {@code -1} until the feed is parsed
 * @param result the final result, {@code null} while running
 */
public record RunStatus(String runId,
                        long projectId,
                        RunState state,
                        int total,
                        int processed,
                        int succeeded,
                        int failed,
                        Instant startedAt,
                        Instant finishedAt,
                        BulkRunResult result) {

    public static RunState stateOf(BulkRunResult result) {
        if (result.cancelled()) {
            return RunState.CANCELLED;
        }
        if (result.aborted() || result.succeeded() == 0) {
            return RunState.FAILED;
        }
        return RunState.SUCCEEDED;
    }
}
