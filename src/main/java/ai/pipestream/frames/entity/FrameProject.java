package ai.pipestream.frames.entity;

import ai.pipestream.frames.composite.ImageFormat;
import ai.pipestream.frames.composite.OverlayRect;
import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.*;

import java.time.Instant;

/**
 * A frame project: the template, where product images go on it, which feed
 * supplies them, and the progress of the latest bulk run.
 * <p>
 * The template bytes live in blob storage under {@link #templateKey}.
 */
@Entity
@Table(name = "frame_projects")
public class FrameProject extends PanacheEntityBase {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    public Long id;

    @Column(nullable = false, length = 200)
    public String name;

    @Column(name = "owner_id")
    public String ownerId;

    @Column(name = "template_key", nullable = false, length = 1024)
    public String templateKey;

    @Enumerated(EnumType.STRING)
    @Column(name = "template_format", nullable = false, length = 16)
    public ImageFormat templateFormat;

    @Column(name = "template_width", nullable = false)
    public int templateWidth;

    @Column(name = "template_height", nullable = false)
    public int templateHeight;

    @Column(name = "template_size_bytes", nullable = false)
    public long templateSizeBytes;

    @Column(name = "overlay_x", nullable = false)
    public int overlayX;

    @Column(name = "overlay_y", nullable = false)
    public int overlayY;

    @Column(name = "overlay_width", nullable = false)
    public int overlayWidth;

    @Column(name = "overlay_height", nullable = false)
    public int overlayHeight;

    /**
     * Whether the overlay was explicitly set, as opposed to the initial default.
     */
    @Column(name = "coordinates_set", nullable = false)
    public boolean coordinatesSet;

    @Column(name = "feed_url", nullable = false, length = 2048)
    public String feedUrl;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    public FrameStatus status;

    @Column(name = "last_run_id", length = 64)
    public String lastRunId;

    @Column(name = "total_products", nullable = false)
    public int totalProducts;

    @Column(name = "processed_products", nullable = false)
    public int processedProducts;

    @Column(name = "succeeded_products", nullable = false)
    public int succeededProducts;

    @Column(name = "failed_products", nullable = false)
    public int failedProducts;

    @Column(name = "last_run_error", columnDefinition = "TEXT")
    public String lastRunError;

    @Column(name = "run_started_at")
    public Instant runStartedAt;

    @Column(name = "run_completed_at")
    public Instant runCompletedAt;

    @Column(name = "created_at", nullable = false)
    public Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    public Instant updatedAt;

    public OverlayRect overlay() {
        return new OverlayRect(overlayX, overlayY, overlayWidth, overlayHeight);
    }

    public void applyOverlay(OverlayRect rect) {
        overlayX = rect.x();
        overlayY = rect.y();
        overlayWidth = rect.width();
        overlayHeight = rect.height();
    }
}
