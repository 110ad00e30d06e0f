package ai.pipestream.frames.preview;

import ai.pipestream.frames.composite.FrameTemplate;
import ai.pipestream.frames.composite.ImageCompositor;
import ai.pipestream.frames.composite.ImageFormat;
import ai.pipestream.frames.composite.OverlayRect;
import ai.pipestream.frames.fetch.FetchPolicy;
import ai.pipestream.frames.fetch.RemoteFetcher;
import org.jboss.logging.Logger;

import java.awt.image.BufferedImage;

/**
 * Synchronous single-item composite for interactive coordinate tuning.
 * Nothing is persisted. Identical inputs give byte-identical output.
 */
public class PreviewEngine {

    private static final Logger LOG = Logger.getLogger(PreviewEngine.class);

    private final ImageCompositor compositor;
    private final RemoteFetcher fetcher;
    private final FetchPolicy imagePolicy;
    private final int maxWidth;
    private final int maxHeight;
    private final float quality;

    public PreviewEngine(ImageCompositor compositor, RemoteFetcher fetcher, FetchPolicy imagePolicy,
                         int maxWidth, int maxHeight, float quality) {
        this.compositor = compositor;
        this.fetcher = fetcher;
        this.imagePolicy = imagePolicy;
        this.maxWidth = maxWidth;
        this.maxHeight = maxHeight;
        this.quality = quality;
    }

    /**
     * @throws ai.pipestream.frames.exception.FrameConfigurationException when the rectangle leaves the template
     * @throws ai.pipestream.frames.exception.UrlValidationException when a URL ref is rejected
     * @throws ai.pipestream.frames.exception.FetchException when a URL ref cannot be fetched
     * @throws ai.pipestream.frames.exception.CompositeException when the image cannot be decoded
     */
    public PreviewImage preview(FrameTemplate template, OverlayRect rect, ProductImageRef ref) {
        rect.requireWithin(template.width(), template.height());

        byte[] productBytes = ref.isUrl()
                ? fetcher.fetch(ref.url(), imagePolicy).body()
                : ref.bytes();

        BufferedImage composed = compositor.render(template, rect, productBytes);
        BufferedImage scaled = ImageCompositor.fitWithin(composed, maxWidth, maxHeight);
        byte[] encoded = ImageCompositor.encode(scaled, ImageFormat.JPEG, quality);

        LOG.debugf("Preview rendered for rect (%d, %d, %d, %d): %dx%d, %d bytes",
                rect.x(), rect.y(), rect.width(), rect.height(), scaled.getWidth(), scaled.getHeight(), encoded.length);
        return new PreviewImage(encoded, ImageFormat.JPEG.mediaType(), scaled.getWidth(), scaled.getHeight());
    }
}
