package ai.pipestream.frames.preview;

/**
 * What to preview: raw image bytes supplied by the operator, or a URL to
 * fetch through the safety-checked fetcher.
 */
public record ProductImageRef(byte[] bytes, String url) {

    public ProductImageRef {
        boolean hasBytes = bytes != null && bytes.length > 0;
        boolean hasUrl = url != null && !url.isBlank();
        if (hasBytes == hasUrl) {
            throw new IllegalArgumentException("exactly one of bytes or url must be provided");
        }
    }

    public static ProductImageRef ofBytes(byte[] bytes) {
        return new ProductImageRef(bytes, null);
    }

    public static ProductImageRef ofUrl(String url) {
        return new ProductImageRef(null, url);
    }

    public boolean isUrl() {
        return url != null;
    }
}
