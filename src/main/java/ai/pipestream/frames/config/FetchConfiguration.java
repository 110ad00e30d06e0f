package ai.pipestream.frames.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.time.Duration;
import java.util.Set;

/**
 * Limits applied to every remote fetch (feed documents and product images).
 * All keys are namespaced under {@code frames.fetch.*}.
 */
@ConfigMapping(prefix = "frames.fetch")
public interface FetchConfiguration {

    /**
     * Connect and read timeout for a single request.
     * Default: 10 seconds.
     */
    @WithDefault("PT10S")
    Duration timeout();

    /**
     * Destination ports a fetch may target.
     * Default: 80 and 443.
     */
    @WithDefault("80,443")
    Set<Integer> allowedPorts();

    /**
     * Redirect hops followed. Every hop is validated again.
     * Default: 3.
     */
    @WithDefault("3")
    int maxRedirects();

    /**
     * Byte ceiling for a feed document.
     * Default: 50 MB.
     */
    @WithDefault("52428800")
    long feedMaxBytes();

    /**
     * Byte ceiling for a product image.
     * Default: 10 MB.
     */
    @WithDefault("10485760")
    long imageMaxBytes();

    @WithDefault("FrameComposer/1.0")
    String userAgent();
}
