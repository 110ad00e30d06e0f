package ai.pipestream.frames.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.time.Duration;

/**
 * Feed defaults and the preview feed cache.
 */
@ConfigMapping(prefix = "frames.feed")
public interface FeedConfiguration {

    /**
     * Feed used when a frame project is created without one.
     */
    @WithDefault("https://cdn.goanalytix.io/assets/casestudy/CaseStudyFeed.xml")
    String defaultUrl();

    /**
     * How long a parsed feed is reused for previews.
     * Default: 30 minutes.
     */
    @WithDefault("PT30M")
    Duration cacheTtl();

    @WithDefault("256")
    int cacheMaxEntries();
}
