package ai.pipestream.frames.bulk;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Summary of a finished bulk run.
 * <p>
 * {@code attempted} counts distinct products taken from the feed, so
 * {@code attempted == succeeded + failed + abandoned}. A run that aborted
 * before any item started (unreachable feed, invalid overlay) has
 * {@code attempted == 0} and a non-null {@link #abortReason()}.
 *
 * @param failures one {@code "productId: reason"} line per failed item
 * @param feedWarnings feed entries that were skipped while parsing
 */
public record BulkRunResult(long projectId,
                            String runId,
                            int attempted,
                            int succeeded,
                            int failed,
                            int abandoned,
                            List<String> failures,
                            List<String> feedWarnings,
                            String abortCode,
                            String abortReason,
                            boolean cancelled,
                            Instant startedAt,
                            Instant finishedAt) {

    public BulkRunResult {
        failures = List.copyOf(failures);
        feedWarnings = List.copyOf(feedWarnings);
    }

    public static BulkRunResult aborted(RunToken token, String code, String reason, Instant startedAt) {
        return new BulkRunResult(token.projectId(), token.runId(), 0, 0, 0, 0, List.of(), List.of(),
                code, reason, !token.isActive(), startedAt, Instant.now());
    }

    public boolean aborted() {
        return abortReason != null;
    }

    public Duration duration() {
        return Duration.between(startedAt, finishedAt);
    }
}
