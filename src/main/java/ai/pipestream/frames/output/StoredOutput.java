package ai.pipestream.frames.output;

import java.time.Instant;

/**
 * One persisted output row as seen by readers.
 *
 * @param outputKey blob key of the generated image, {@code null} for failed outputs
 */
public record StoredOutput(long projectId,
                           String productId,
                           String productImageUrl,
                           OutputStatus status,
                           String failureReason,
                           String outputKey,
                           String contentType,
                           Instant createdAt,
                           Instant generatedAt) {
}
