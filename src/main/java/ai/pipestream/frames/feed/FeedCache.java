package ai.pipestream.frames.feed;

import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.google.common.util.concurrent.UncheckedExecutionException;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.cache.GuavaCacheMetrics;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Short-lived cache of parsed feeds, used by the preview path so repeated
 * coordinate tweaks do not refetch the feed. Bulk runs always fetch fresh.
 */
public class FeedCache {

    private static final Logger LOG = Logger.getLogger(FeedCache.class);

    private final FeedFetcher feedFetcher;
    private final Cache<String, FeedParseResult> cache;

    public FeedCache(FeedFetcher feedFetcher, Duration ttl, int maxEntries) {
        this.feedFetcher = feedFetcher;
        this.cache = CacheBuilder.newBuilder()
                .maximumSize(maxEntries)
                .expireAfterWrite(ttl.toMillis(), TimeUnit.MILLISECONDS)
                .recordStats()
                .build();
    }

    public FeedParseResult get(String feedUrl) {
        try {
            return cache.get(feedUrl, () -> {
                LOG.debugf("Feed cache miss for %s", feedUrl);
                return feedFetcher.fetchAndParse(feedUrl);
            });
        } catch (UncheckedExecutionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw e;
        } catch (ExecutionException e) {
            throw new IllegalStateException("feed load failed for " + feedUrl, e.getCause());
        }
    }

    /**
     * First product of the feed, used as the default preview subject.
     */
    public Optional<ProductRecord> firstProduct(String feedUrl) {
        return get(feedUrl).products().stream().findFirst();
    }

    /**
     * Publishes hit, miss and eviction counts under {@code frames_feed_cache}.
     */
    public FeedCache monitor(MeterRegistry registry) {
        GuavaCacheMetrics.monitor(registry, cache, "frames_feed_cache");
        return this;
    }

    public void invalidate(String feedUrl) {
        cache.invalidate(feedUrl);
    }

    Cache<String, FeedParseResult> delegate() {
        return cache;
    }
}
