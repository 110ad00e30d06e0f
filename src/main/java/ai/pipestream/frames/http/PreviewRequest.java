package ai.pipestream.frames.http;

import ai.pipestream.frames.exception.FrameConfigurationException;
import ai.pipestream.frames.preview.ProductImageRef;

import java.util.Base64;

/**
 * Preview parameters. At most one of {@code imageUrl} and {@code imageBase64}
 * may be given; with neither, the first product of the project's feed is used.
 */
public record PreviewRequest(Integer x, Integer y, Integer width, Integer height,
                             String imageUrl, String imageBase64) {

    public OverlayRequest overlay() {
        return new OverlayRequest(x, y, width, height);
    }

    /**
     * @return the image reference, or {@code null} to use the feed
     */
    public ProductImageRef imageRef() {
        boolean hasUrl = imageUrl != null && !imageUrl.isBlank();
        boolean hasBytes = imageBase64 != null && !imageBase64.isBlank();
        if (hasUrl && hasBytes) {
            throw new FrameConfigurationException("preview", "give either imageUrl or imageBase64, not both");
        }
        if (hasUrl) {
            return ProductImageRef.ofUrl(imageUrl.trim());
        }
        if (hasBytes) {
            try {
                return ProductImageRef.ofBytes(Base64.getMimeDecoder().decode(stripDataUri(imageBase64)));
            } catch (IllegalArgumentException e) {
                throw new FrameConfigurationException("preview", "imageBase64 is not valid base64", e);
            }
        }
        return null;
    }

    private static String stripDataUri(String value) {
        int comma = value.indexOf(',');
        return value.startsWith("data:") && comma > 0 ? value.substring(comma + 1) : value;
    }
}
