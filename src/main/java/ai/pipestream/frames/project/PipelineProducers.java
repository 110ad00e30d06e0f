package ai.pipestream.frames.project;

import ai.pipestream.frames.bulk.BulkJobOrchestrator;
import ai.pipestream.frames.bulk.BulkRunRegistry;
import ai.pipestream.frames.config.BulkConfiguration;
import ai.pipestream.frames.config.CompositeConfiguration;
import ai.pipestream.frames.config.FeedConfiguration;
import ai.pipestream.frames.config.FetchConfiguration;
import ai.pipestream.frames.composite.ImageCompositor;
import ai.pipestream.frames.feed.FeedCache;
import ai.pipestream.frames.feed.FeedFetcher;
import ai.pipestream.frames.feed.FeedParser;
import ai.pipestream.frames.fetch.FetchPolicy;
import ai.pipestream.frames.fetch.HostResolver;
import ai.pipestream.frames.fetch.RemoteFetcher;
import ai.pipestream.frames.fetch.SafeHttpFetcher;
import ai.pipestream.frames.fetch.UrlSafetyValidator;
import ai.pipestream.frames.output.OutputStore;
import ai.pipestream.frames.preview.PreviewEngine;
import io.micrometer.core.instrument.MeterRegistry;
import io.smallrye.mutiny.infrastructure.Infrastructure;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Named;
import jakarta.inject.Singleton;

import java.util.concurrent.Executor;

/**
 * Wires the pipeline classes from configuration. The pipeline itself is plain
 * Java so it can be exercised without a container.
 */
@ApplicationScoped
public class PipelineProducers {

    public static final String FEED_POLICY = "feed-policy";
    public static final String IMAGE_POLICY = "image-policy";

    @Produces
    @Singleton
    public UrlSafetyValidator urlSafetyValidator(FetchConfiguration fetch) {
        return new UrlSafetyValidator(HostResolver.SYSTEM, fetch.allowedPorts());
    }

    @Produces
    @ApplicationScoped
    public RemoteFetcher remoteFetcher(UrlSafetyValidator validator, FetchConfiguration fetch) {
        return new SafeHttpFetcher(validator, fetch.timeout(), fetch.maxRedirects(), fetch.userAgent());
    }

    @Produces
    @Singleton
    @Named(FEED_POLICY)
    public FetchPolicy feedPolicy(FetchConfiguration fetch) {
        return FetchPolicy.feed(fetch.feedMaxBytes(), fetch.timeout());
    }

    @Produces
    @Singleton
    @Named(IMAGE_POLICY)
    public FetchPolicy imagePolicy(FetchConfiguration fetch) {
        return FetchPolicy.image(fetch.imageMaxBytes(), fetch.timeout());
    }

    @Produces
    @Singleton
    public FeedFetcher feedFetcher(RemoteFetcher fetcher, @Named(FEED_POLICY) FetchPolicy policy) {
        return new FeedFetcher(fetcher, new FeedParser(), policy);
    }

    @Produces
    @Singleton
    public FeedCache feedCache(FeedFetcher feedFetcher, FeedConfiguration feed, MeterRegistry meterRegistry) {
        return new FeedCache(feedFetcher, feed.cacheTtl(), feed.cacheMaxEntries()).monitor(meterRegistry);
    }

    @Produces
    @Singleton
    public ImageCompositor imageCompositor(CompositeConfiguration composite) {
        return new ImageCompositor(composite.jpegQuality(), composite.minImageDimension(),
                composite.maxImageDimension());
    }

    @Produces
    @Singleton
    public PreviewEngine previewEngine(ImageCompositor compositor, RemoteFetcher fetcher,
                                       @Named(IMAGE_POLICY) FetchPolicy imagePolicy,
                                       CompositeConfiguration composite) {
        return new PreviewEngine(compositor, fetcher, imagePolicy, composite.previewMaxWidth(),
                composite.previewMaxHeight(), composite.previewJpegQuality());
    }

    /**
     * Bulk items run on the Quarkus worker pool; the per-run bound is applied
     * by the orchestrator, not by the pool.
     */
    @Produces
    @Singleton
    public BulkJobOrchestrator bulkJobOrchestrator(FeedFetcher feedFetcher,
                                                   RemoteFetcher fetcher,
                                                   @Named(IMAGE_POLICY) FetchPolicy imagePolicy,
                                                   ImageCompositor compositor,
                                                   OutputStore outputStore,
                                                   BulkConfiguration bulk) {
        Executor executor = Infrastructure.getDefaultWorkerPool();
        return new BulkJobOrchestrator(feedFetcher, fetcher, imagePolicy, compositor, outputStore,
                executor, bulk.maxInFlight());
    }

    @Produces
    @Singleton
    public BulkRunRegistry bulkRunRegistry() {
        return new BulkRunRegistry();
    }
}
