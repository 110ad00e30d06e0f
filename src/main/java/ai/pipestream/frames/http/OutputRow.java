package ai.pipestream.frames.http;

import ai.pipestream.frames.output.OutputStatus;
import ai.pipestream.frames.output.StoredOutput;
import jakarta.ws.rs.core.UriBuilder;

import java.time.Instant;

public record OutputRow(
        String productId,
        String productImageUrl,
        String status,
        String failureReason,
        String imagePath,
        Instant createdAt,
        Instant generatedAt
) {

    public static OutputRow from(StoredOutput o) {
        String imagePath = o.status() == OutputStatus.SUCCEEDED
                ? UriBuilder.fromPath("/api/frames/{id}/outputs/{productId}/image")
                        .build(o.projectId(), o.productId())
                        .toString()
                : null;
        return new OutputRow(o.productId(), o.productImageUrl(), o.status().name(), o.failureReason(),
                imagePath, o.createdAt(), o.generatedAt());
    }
}
