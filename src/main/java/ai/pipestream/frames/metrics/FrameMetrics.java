package ai.pipestream.frames.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Metrics for previews and bulk runs.
 * Exposes counters, timers and a gauge via Micrometer.
 */
@ApplicationScoped
public class FrameMetrics {

    @Inject
    MeterRegistry registry;

    private Counter runsStartedTotal;
    private Counter runsCompletedTotal;
    private Counter runsFailedTotal;
    private Counter runsRejectedTotal;
    private Counter itemsSucceededTotal;
    private Counter itemsFailedTotal;
    private Counter urlRejectedTotal;
    private Counter previewsTotal;

    private Timer compositeLatency;
    private Timer runDuration;

    @PostConstruct
    void init() {
        runsStartedTotal = Counter.builder("frame_runs_started_total")
                .description("Bulk runs started")
                .register(registry);

        runsCompletedTotal = Counter.builder("frame_runs_completed_total")
                .description("Bulk runs that finished with at least one output")
                .register(registry);

        runsFailedTotal = Counter.builder("frame_runs_failed_total")
                .description("Bulk runs that aborted or produced no output")
                .register(registry);

        runsRejectedTotal = Counter.builder("frame_runs_rejected_total")
                .description("Run requests rejected because a run was already active")
                .register(registry);

        itemsSucceededTotal = Counter.builder("frame_items_succeeded_total")
                .description("Products composited and stored")
                .register(registry);

        itemsFailedTotal = Counter.builder("frame_items_failed_total")
                .description("Products that failed during a bulk run")
                .register(registry);

        urlRejectedTotal = Counter.builder("frame_url_rejected_total")
                .description("Remote URLs refused by the safety validator")
                .register(registry);

        previewsTotal = Counter.builder("frame_previews_total")
                .description("Previews rendered")
                .register(registry);

        compositeLatency = Timer.builder("frame_item_latency_ms")
                .description("Fetch, composite and store latency of one bulk item")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);

        runDuration = Timer.builder("frame_run_duration")
                .description("Wall-clock duration of bulk runs")
                .register(registry);
    }

    /**
     * Registers the active-runs gauge against a live counter.
     */
    public void bindActiveRuns(Supplier<Number> activeRuns) {
        registry.gauge("frame_runs_active", activeRuns, s -> s.get().doubleValue());
    }

    public void recordRunStarted() {
        runsStartedTotal.increment();
    }

    public void recordRunFinished(boolean completed, Duration duration) {
        if (completed) {
            runsCompletedTotal.increment();
        } else {
            runsFailedTotal.increment();
        }
        runDuration.record(duration);
    }

    public void recordRunRejected() {
        runsRejectedTotal.increment();
    }

    public void recordItemSucceeded(long latencyMs) {
        itemsSucceededTotal.increment();
        compositeLatency.record(Duration.ofMillis(latencyMs));
    }

    public void recordItemFailed(long latencyMs) {
        itemsFailedTotal.increment();
        compositeLatency.record(Duration.ofMillis(latencyMs));
    }

    public void recordUrlRejected() {
        urlRejectedTotal.increment();
    }

    public void recordPreview() {
        previewsTotal.increment();
    }
}
