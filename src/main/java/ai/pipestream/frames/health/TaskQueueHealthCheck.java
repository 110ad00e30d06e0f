package ai.pipestream.frames.health;

import ai.pipestream.frames.bulk.BulkRunService;
import io.smallrye.mutiny.infrastructure.Infrastructure;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Checks that the worker pool running bulk items still accepts and runs work.
 */
@Readiness
@ApplicationScoped
public class TaskQueueHealthCheck implements HealthCheck {

    private static final long PROBE_TIMEOUT_MS = 2000;

    @Inject
    BulkRunService runs;

    @Override
    public HealthCheckResponse call() {
        try {
            CompletableFuture.runAsync(() -> { }, Infrastructure.getDefaultWorkerPool())
                    .get(PROBE_TIMEOUT_MS, TimeUnit.MILLISECONDS);
            return HealthCheckResponse.named("task-queue")
                    .withData("activeRuns", runs.activeRuns())
                    .up()
                    .build();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return down("interrupted");
        } catch (Exception e) {
            return down(String.valueOf(e.getMessage()));
        }
    }

    private HealthCheckResponse down(String error) {
        return HealthCheckResponse.named("task-queue")
                .withData("activeRuns", runs.activeRuns())
                .withData("error", error)
                .down()
                .build();
    }
}
