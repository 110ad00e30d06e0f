package ai.pipestream.frames.http;

import ai.pipestream.frames.entity.FrameProject;

import java.time.Duration;
import java.time.Instant;

/**
 * Frame project as returned over HTTP, with derived progress figures.
 */
public record FrameProjectView(
        long id,
        String name,
        String ownerId,
        String status,
        String feedUrl,
        Template template,
        Overlay overlay,
        boolean coordinatesSet,
        Progress progress,
        Instant createdAt,
        Instant updatedAt
) {

    public record Template(String format, int width, int height, long sizeBytes) {}

    public record Overlay(int x, int y, int width, int height) {}

    public record Progress(
            String runId,
            int totalProducts,
            int processedProducts,
            int succeededProducts,
            int failedProducts,
            double progressPercent,
            double successRate,
            Long durationMillis,
            String lastRunError,
            Instant startedAt,
            Instant completedAt
    ) {}

    public static FrameProjectView from(FrameProject p) {
        return new FrameProjectView(
                p.id,
                p.name,
                p.ownerId,
                p.status.name(),
                p.feedUrl,
                new Template(p.templateFormat.name(), p.templateWidth, p.templateHeight, p.templateSizeBytes),
                new Overlay(p.overlayX, p.overlayY, p.overlayWidth, p.overlayHeight),
                p.coordinatesSet,
                new Progress(
                        p.lastRunId,
                        p.totalProducts,
                        p.processedProducts,
                        p.succeededProducts,
                        p.failedProducts,
                        percent(p.processedProducts, p.totalProducts),
                        percent(p.succeededProducts, p.processedProducts),
                        durationMillis(p.runStartedAt, p.runCompletedAt),
                        p.lastRunError,
                        p.runStartedAt,
                        p.runCompletedAt),
                p.createdAt,
                p.updatedAt);
    }

    static double percent(int part, int whole) {
        if (whole <= 0) {
            return 0.0;
        }
        return Math.round(part * 1000.0 / whole) / 10.0;
    }

    static Long durationMillis(Instant startedAt, Instant completedAt) {
        if (startedAt == null) {
            return null;
        }
        Instant end = completedAt != null ? completedAt : Instant.now();
        return Duration.between(startedAt, end).toMillis();
    }
}
