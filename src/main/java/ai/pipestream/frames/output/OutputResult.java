package ai.pipestream.frames.output;

import ai.pipestream.frames.composite.ImageFormat;

/**
 * What one bulk item produced: an encoded image, or the reason it failed.
 */
public record OutputResult(OutputStatus status, String productImageUrl, byte[] image, ImageFormat format,
                           String failureReason) {

    public static OutputResult succeeded(String productImageUrl, byte[] image, ImageFormat format) {
        if (image == null || image.length == 0) {
            throw new IllegalArgumentException("image cannot be null or empty");
        }
        return new OutputResult(OutputStatus.SUCCEEDED, productImageUrl, image, format, null);
    }

    public static OutputResult failed(String productImageUrl, String reason) {
        return new OutputResult(OutputStatus.FAILED, productImageUrl, null, null,
                reason == null || reason.isBlank() ? "unknown failure" : reason);
    }

    public boolean isSucceeded() {
        return status == OutputStatus.SUCCEEDED;
    }
}
