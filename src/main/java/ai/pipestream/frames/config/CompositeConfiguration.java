package ai.pipestream.frames.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Image decoding, encoding and preview limits.
 */
@ConfigMapping(prefix = "frames.composite")
public interface CompositeConfiguration {

    /**
     * JPEG quality used for every encoded output, 0.0 to 1.0.
     */
    @WithDefault("0.85")
    float jpegQuality();

    /**
     * JPEG quality used for previews.
     */
    @WithDefault("0.75")
    float previewJpegQuality();

    @WithDefault("10")
    int minImageDimension();

    @WithDefault("4000")
    int maxImageDimension();

    /**
     * Largest accepted template upload.
     * Default: 10 MB.
     */
    @WithDefault("10485760")
    long templateMaxBytes();

    /**
     * Largest accepted template width or height, checked before decoding pixels.
     */
    @WithDefault("8000")
    int templateMaxDimension();

    @WithDefault("800")
    int previewMaxWidth();

    @WithDefault("600")
    int previewMaxHeight();
}
