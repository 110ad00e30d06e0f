package ai.pipestream.frames.http;

import ai.pipestream.frames.bulk.BulkRunResult;
import ai.pipestream.frames.bulk.RunStatus;

import java.time.Instant;
import java.util.List;

public record RunStatusView(
        String runId,
        long projectId,
        String state,
        int total,
        int processed,
        int succeeded,
        int failed,
        Instant startedAt,
        Instant finishedAt,
        Result result
) {

    /**
     * Final counts, present once the run has finished.
     */
    public record Result(int attempted, int succeeded, int failed, int abandoned, List<String> failures,
                         List<String> feedWarnings, String abortCode, String abortReason, long durationMillis) {}

    public static RunStatusView from(RunStatus status) {
        BulkRunResult r = status.result();
        Result result = r == null ? null : new Result(r.attempted(), r.succeeded(), r.failed(), r.abandoned(),
                r.failures(), r.feedWarnings(), r.abortCode(), r.abortReason(), r.duration().toMillis());
        return new RunStatusView(status.runId(), status.projectId(), status.state().name(), status.total(),
                status.processed(), status.succeeded(), status.failed(), status.startedAt(), status.finishedAt(),
                result);
    }
}
