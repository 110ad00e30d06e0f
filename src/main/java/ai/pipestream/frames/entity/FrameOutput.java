package ai.pipestream.frames.entity;

import ai.pipestream.frames.output.OutputStatus;
import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.*;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;

import java.time.Instant;

/**
 * One generated (or failed) output per product of a frame project.
 * Re-runs update the row in place.
 */
@Entity
@Table(name = "frame_outputs",
        uniqueConstraints = @UniqueConstraint(name = "uk_frame_outputs_project_product",
                columnNames = {"project_id", "product_id"}),
        indexes = @Index(name = "idx_frame_outputs_project_generated", columnList = "project_id, generated_at"))
public class FrameOutput extends PanacheEntityBase {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    public Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "project_id", nullable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    public FrameProject project;

    @Column(name = "product_id", nullable = false, length = 512)
    public String productId;

    @Column(name = "product_image_url", length = 2048)
    public String productImageUrl;

    /**
     * Blob key of the generated image; {@code null} when the item failed.
     */
    @Column(name = "output_key", length = 1024)
    public String outputKey;

    @Column(name = "content_type", length = 64)
    public String contentType;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    public OutputStatus status;

    @Column(name = "failure_reason", columnDefinition = "TEXT")
    public String failureReason;

    @Column(name = "created_at", nullable = false)
    public Instant createdAt;

    @Column(name = "generated_at", nullable = false)
    public Instant generatedAt;
}
