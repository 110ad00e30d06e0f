package ai.pipestream.frames.bulk;

import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Identity and cancellation flag of one bulk run. Workers check
 * {@link #isActive()} before every write.
 */
public final class RunToken {

    private final String runId;
    private final long projectId;
    private final Instant startedAt;
    private final AtomicBoolean cancelled = new AtomicBoolean();

    public RunToken(String runId, long projectId, Instant startedAt) {
        this.runId = runId;
        this.projectId = projectId;
        this.startedAt = startedAt;
    }

    public static RunToken start(long projectId) {
        return new RunToken(UUID.randomUUID().toString(), projectId, Instant.now());
    }

    public String runId() {
        return runId;
    }

    public long projectId() {
        return projectId;
    }

    public Instant startedAt() {
        return startedAt;
    }

    /**
     * @return {@code true} if this call cancelled the run
     */
    public boolean cancel() {
        return cancelled.compareAndSet(false, true);
    }

    public boolean isActive() {
        return !cancelled.get();
    }

    @Override
    public String toString() {
        return "RunToken{runId=" + runId + ", projectId=" + projectId + ", cancelled=" + cancelled.get() + '}';
    }
}
