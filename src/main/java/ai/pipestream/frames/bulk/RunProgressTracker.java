package ai.pipestream.frames.bulk;

import ai.pipestream.frames.entity.FrameProject;
import ai.pipestream.frames.entity.FrameStatus;
import io.quarkus.panache.common.Parameters;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.transaction.Transactional;
import org.jboss.logging.Logger;

import java.time.Instant;

/**
 * Writes run progress onto the frame project row. Every update is scoped to
 * the run id that started it, so a late write from an old run cannot clobber
 * a newer one, and processed counts only move forward.
 */
@ApplicationScoped
public class RunProgressTracker {

    private static final Logger LOG = Logger.getLogger(RunProgressTracker.class);

    @Transactional
    public void markStarted(long projectId, String runId, Instant startedAt) {
        FrameProject.update("status = :status, lastRunId = :runId, totalProducts = 0, processedProducts = 0, "
                        + "succeededProducts = 0, failedProducts = 0, lastRunError = null, "
                        + "runStartedAt = :startedAt, runCompletedAt = null, updatedAt = :now where id = :id",
                Parameters.with("status", FrameStatus.PROCESSING)
                        .and("runId", runId)
                        .and("startedAt", startedAt)
                        .and("now", Instant.now())
                        .and("id", projectId));
    }

    @Transactional
    public void recordTotal(long projectId, String runId, int total) {
        FrameProject.update("totalProducts = :total, updatedAt = :now where id = :id and lastRunId = :runId",
                Parameters.with("total", total)
                        .and("now", Instant.now())
                        .and("id", projectId)
                        .and("runId", runId));
    }

    @Transactional
    public void recordProgress(long projectId, String runId, int processed, int succeeded, int failed) {
        FrameProject.update("processedProducts = :processed, succeededProducts = :succeeded, "
                        + "failedProducts = :failed, updatedAt = :now "
                        + "where id = :id and lastRunId = :runId and processedProducts < :processed",
                Parameters.with("processed", processed)
                        .and("succeeded", succeeded)
                        .and("failed", failed)
                        .and("now", Instant.now())
                        .and("id", projectId)
                        .and("runId", runId));
    }

    /**
     * COMPLETED when at least one item succeeded, FAILED otherwise.
     */
    @Transactional
    public FrameStatus markFinished(BulkRunResult result) {
        FrameStatus status = result.succeeded() > 0 ? FrameStatus.COMPLETED : FrameStatus.FAILED;
        String error = runError(result);
        int updated = FrameProject.update("status = :status, totalProducts = :total, "
                        + "processedProducts = :processed, succeededProducts = :succeeded, "
                        + "failedProducts = :failed, lastRunError = :error, runCompletedAt = :completedAt, "
                        + "updatedAt = :now where id = :id and lastRunId = :runId",
                Parameters.with("status", status)
                        .and("total", result.attempted())
                        .and("processed", result.succeeded() + result.failed())
                        .and("succeeded", result.succeeded())
                        .and("failed", result.failed())
                        .and("error", error)
                        .and("completedAt", result.finishedAt())
                        .and("now", Instant.now())
                        .and("id", result.projectId())
                        .and("runId", result.runId()));
        if (updated == 0) {
            LOG.debugf("Project %d is gone or has a newer run; result of run %s not recorded",
                    result.projectId(), result.runId());
        }
        return status;
    }

    static String runError(BulkRunResult result) {
        if (result.aborted()) {
            return result.abortReason();
        }
        if (result.cancelled()) {
            return "run cancelled";
        }
        if (result.attempted() == 0) {
            return "feed contained no usable products";
        }
        if (result.succeeded() == 0) {
            return "no product image could be composited";
        }
        return null;
    }

    /**
     * Projects left PROCESSING by a previous process cannot finish; marks them FAILED.
     */
    @Transactional
    public int failInterruptedRuns() {
        int updated = FrameProject.update("status = :failed, lastRunError = :error, runCompletedAt = :now, "
                        + "updatedAt = :now where status = :processing",
                Parameters.with("failed", FrameStatus.FAILED)
                        .and("error", "run interrupted by service restart")
                        .and("now", Instant.now())
                        .and("processing", FrameStatus.PROCESSING));
        if (updated > 0) {
            LOG.warnf("Marked %d interrupted run(s) as FAILED", updated);
        }
        return updated;
    }
}
