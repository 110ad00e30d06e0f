package ai.pipestream.frames.bulk;

import ai.pipestream.frames.exception.AlreadyRunningException;
import org.jboss.logging.Logger;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Tracks which projects have an active bulk run, and the last finished run of
 * each project. At most one run per project is active at a time; a second
 * trigger is rejected, never queued.
 */
public class BulkRunRegistry {

    private static final Logger LOG = Logger.getLogger(BulkRunRegistry.class);

    private final Map<Long, ActiveRun> active = new ConcurrentHashMap<>();
    private final Map<Long, RunStatus> finished = new ConcurrentHashMap<>();

    /**
     * Registers a new run for the project.
     *
     * @throws AlreadyRunningException when the project already has an active run
     */
    public RunToken begin(long projectId) {
        RunToken token = RunToken.start(projectId);
        ActiveRun run = new ActiveRun(token);
        ActiveRun existing = active.putIfAbsent(projectId, run);
        if (existing != null) {
            throw new AlreadyRunningException(projectId, existing.token.runId());
        }
        LOG.debugf("Registered run %s for project %d", token.runId(), projectId);
        return token;
    }

    public void recordTotal(RunToken token, int total) {
        ActiveRun run = active.get(token.projectId());
        if (run != null && run.token == token) {
            run.total = total;
        }
    }

    public void recordProgress(RunToken token, int processed, int succeeded, int failed) {
        ActiveRun run = active.get(token.projectId());
        if (run != null && run.token == token) {
            run.processed.accumulateAndGet(processed, Math::max);
            run.succeeded.accumulateAndGet(succeeded, Math::max);
            run.failed.accumulateAndGet(failed, Math::max);
        }
    }

    /**
     * Releases the project's run slot and keeps the result as its last run.
     */
    public RunStatus finish(RunToken token, BulkRunResult result) {
        RunStatus status = new RunStatus(token.runId(), token.projectId(), RunStatus.stateOf(result),
                result.attempted(), result.succeeded() + result.failed() + result.abandoned(),
                result.succeeded(), result.failed(), token.startedAt(), result.finishedAt(), result);
        finished.put(token.projectId(), status);
        active.computeIfPresent(token.projectId(), (id, run) -> run.token == token ? null : run);
        return status;
    }

    /**
     * Releases the run slot after a failure that produced no result.
     */
    public RunStatus fail(RunToken token, String reason) {
        return finish(token, BulkRunResult.aborted(token, "INTERNAL_ERROR", reason, token.startedAt()));
    }

    /**
     * Flags the project's active run as cancelled. Workers stop writing at
     * their next check; the run still finishes through {@link #finish}.
     *
     * @return the cancelled token, if a run was active
     */
    public Optional<RunToken> cancel(long projectId) {
        ActiveRun run = active.get(projectId);
        if (run == null) {
            return Optional.empty();
        }
        if (run.token.cancel()) {
            LOG.infof("Cancelled run %s for project %d", run.token.runId(), projectId);
        }
        return Optional.of(run.token);
    }

    public boolean isActive(long projectId) {
        return active.containsKey(projectId);
    }

    public int activeCount() {
        return active.size();
    }

    public Optional<RunStatus> status(long projectId) {
        ActiveRun run = active.get(projectId);
        if (run != null) {
            return Optional.of(run.snapshot());
        }
        return Optional.ofNullable(finished.get(projectId));
    }

    /**
     * Drops the remembered last run of a deleted project.
     */
    public void forget(long projectId) {
        finished.remove(projectId);
    }

    private static final class ActiveRun {

        final RunToken token;
        volatile int total = -1;
        final AtomicInteger processed = new AtomicInteger();
        final AtomicInteger succeeded = new AtomicInteger();
        final AtomicInteger failed = new AtomicInteger();

        ActiveRun(RunToken token) {
            this.token = token;
        }

        RunStatus snapshot() {
            RunState state = token.isActive() ? RunState.RUNNING : RunState.CANCELLED;
            return new RunStatus(token.runId(), token.projectId(), state, total, processed.get(),
                    succeeded.get(), failed.get(), token.startedAt(), null, null);
        }
    }
}
