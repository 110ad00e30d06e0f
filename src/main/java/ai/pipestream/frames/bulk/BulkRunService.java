package ai.pipestream.frames.bulk;

import ai.pipestream.frames.config.BulkConfiguration;
import ai.pipestream.frames.entity.FrameProject;
import ai.pipestream.frames.exception.AlreadyRunningException;
import ai.pipestream.frames.exception.FrameConfigurationException;
import ai.pipestream.frames.exception.UrlValidationException;
import ai.pipestream.frames.metrics.FrameMetrics;
import ai.pipestream.frames.project.FrameProjectService;
import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.util.List;
import java.util.Optional;

/**
 * Starts bulk runs in the background and reports their status.
 * <p>
 * Triggering validates synchronously (project exists, overlay set and in
 * bounds, no run already active) and returns as soon as the run is registered.
 */
@ApplicationScoped
public class BulkRunService {

    private static final Logger LOG = Logger.getLogger(BulkRunService.class);

    @Inject
    FrameProjectService projects;

    @Inject
    BulkJobOrchestrator orchestrator;

    @Inject
    BulkRunRegistry registry;

    @Inject
    RunProgressTracker tracker;

    @Inject
    BulkConfiguration bulkConfig;

    @Inject
    FrameMetrics metrics;

    void onStart(@Observes StartupEvent event) {
        metrics.bindActiveRuns(registry::activeCount);
        tracker.failInterruptedRuns();
    }

    /**
     * @throws ai.pipestream.frames.exception.FrameProjectNotFoundException when the project does not exist
     * @throws FrameConfigurationException when the overlay was never set or no longer fits the template
     * @throws AlreadyRunningException when the project already has an active run
     */
    public RunStatus trigger(long projectId) {
        FrameProject project = projects.get(projectId);
        if (!project.coordinatesSet) {
            throw new FrameConfigurationException("trigger-run", "overlay coordinates have not been set");
        }
        FrameProjectSnapshot snapshot = projects.snapshot(projectId);
        snapshot.rect().requireWithin(snapshot.template().width(), snapshot.template().height());

        RunToken token;
        try {
            token = registry.begin(projectId);
        } catch (AlreadyRunningException e) {
            metrics.recordRunRejected();
            LOG.infof("Rejected run for project %d: run %s still active", projectId, e.getActiveRunId());
            throw e;
        }

        try {
            tracker.markStarted(projectId, token.runId(), token.startedAt());
        } catch (RuntimeException e) {
            registry.fail(token, "could not record run start: " + e.getMessage());
            throw e;
        }
        metrics.recordRunStarted();

        orchestrator.run(snapshot, token, new ProgressListener(token))
                .subscribe().with(
                        result -> complete(token, result),
                        failure -> {
                            LOG.errorf(failure, "Run %s for project %d failed unexpectedly", token.runId(), projectId);
                            complete(token, BulkRunResult.aborted(token, "INTERNAL_ERROR",
                                    String.valueOf(failure.getMessage()), token.startedAt()));
                        });

        return registry.status(projectId).orElseThrow();
    }

    public Optional<RunStatus> status(long projectId) {
        return registry.status(projectId);
    }

    public Optional<RunToken> cancel(long projectId) {
        return registry.cancel(projectId);
    }

    public int activeRuns() {
        return registry.activeCount();
    }

    private void complete(RunToken token, BulkRunResult result) {
        try {
            tracker.markFinished(result);
        } catch (RuntimeException e) {
            LOG.errorf(e, "Could not record result of run %s for project %d", token.runId(), token.projectId());
        } finally {
            RunStatus status = registry.finish(token, result);
            metrics.recordRunFinished(status.state() == RunState.SUCCEEDED, result.duration());
        }
    }

    /**
     * Mirrors progress into the registry on every item and onto the project row
     * every {@code progress-interval} items.
     */
    private final class ProgressListener implements BulkRunListener {

        private final RunToken token;
        private final int interval;

        ProgressListener(RunToken token) {
            this.token = token;
            this.interval = Math.max(1, bulkConfig.progressInterval());
        }

        @Override
        public void onFeedParsed(int distinctProducts, List<String> warnings) {
            registry.recordTotal(token, distinctProducts);
            tracker.recordTotal(token.projectId(), token.runId(), distinctProducts);
            if (!warnings.isEmpty()) {
                LOG.infof("Run %s: %d feed entries skipped", token.runId(), warnings.size());
            }
        }

        @Override
        public void onItemResolved(ItemOutcome outcome, int resolved, int succeeded, int failed) {
            registry.recordProgress(token, resolved, succeeded, failed);
            if (outcome.status() == ItemOutcome.Status.SUCCEEDED) {
                metrics.recordItemSucceeded(outcome.durationMillis());
            } else if (outcome.status() == ItemOutcome.Status.FAILED) {
                metrics.recordItemFailed(outcome.durationMillis());
                if (UrlValidationException.CODE.equals(outcome.errorCode())) {
                    metrics.recordUrlRejected();
                }
            }
            if (resolved % interval == 0 && token.isActive()) {
                try {
                    tracker.recordProgress(token.projectId(), token.runId(), resolved, succeeded, failed);
                } catch (RuntimeException e) {
                    LOG.warnf("Could not flush progress of run %s: %s", token.runId(), e.getMessage());
                }
            }
        }
    }
}
