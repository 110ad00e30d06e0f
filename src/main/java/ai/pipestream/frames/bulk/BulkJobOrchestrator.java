package ai.pipestream.frames.bulk;

import ai.pipestream.frames.composite.FrameTemplate;
import ai.pipestream.frames.composite.ImageCompositor;
import ai.pipestream.frames.exception.FeedException;
import ai.pipestream.frames.exception.FrameConfigurationException;
import ai.pipestream.frames.exception.FrameServiceException;
import ai.pipestream.frames.exception.UrlValidationException;
import ai.pipestream.frames.feed.FeedFetcher;
import ai.pipestream.frames.feed.FeedParseResult;
import ai.pipestream.frames.feed.ProductRecord;
import ai.pipestream.frames.fetch.FetchPolicy;
import ai.pipestream.frames.fetch.FetchedResource;
import ai.pipestream.frames.fetch.RemoteFetcher;
import ai.pipestream.frames.output.OutputResult;
import ai.pipestream.frames.output.OutputStore;
import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs the full pipeline for every product in a feed: fetch the image,
 * composite it onto the template, upsert the output.
 * <p>
 * Items run on the given executor with at most {@code maxInFlight} in flight.
 * One item's failure never touches another: every item resolves to an
 * {@link ItemOutcome} and the run always completes with a {@link BulkRunResult}.
 * Only an unusable feed or overlay aborts the run as a whole, before any item starts.
 */
public class BulkJobOrchestrator {

    private static final Logger LOG = Logger.getLogger(BulkJobOrchestrator.class);

    private final FeedFetcher feedFetcher;
    private final RemoteFetcher imageFetcher;
    private final FetchPolicy imagePolicy;
    private final ImageCompositor compositor;
    private final OutputStore outputStore;
    private final Executor executor;
    private final int maxInFlight;

    public BulkJobOrchestrator(FeedFetcher feedFetcher,
                               RemoteFetcher imageFetcher,
                               FetchPolicy imagePolicy,
                               ImageCompositor compositor,
                               OutputStore outputStore,
                               Executor executor,
                               int maxInFlight) {
        if (maxInFlight < 1) {
            throw new IllegalArgumentException("maxInFlight must be at least 1: " + maxInFlight);
        }
        this.feedFetcher = feedFetcher;
        this.imageFetcher = imageFetcher;
        this.imagePolicy = imagePolicy;
        this.compositor = compositor;
        this.outputStore = outputStore;
        this.executor = executor;
        this.maxInFlight = maxInFlight;
    }

    public int maxInFlight() {
        return maxInFlight;
    }

    /**
     * Starts the run lazily: nothing happens until the returned Uni is subscribed.
     * The Uni never fails; aborts are reported on the result.
     */
    public Uni<BulkRunResult> run(FrameProjectSnapshot snapshot, RunToken token, BulkRunListener listener) {
        Instant startedAt = token.startedAt();
        FrameTemplate template = snapshot.template();
        try {
            snapshot.rect().requireWithin(template.width(), template.height());
        } catch (FrameConfigurationException e) {
            LOG.warnf("Run %s for project %d aborted: %s", token.runId(), snapshot.projectId(), e.getDetail());
            return Uni.createFrom().item(BulkRunResult.aborted(token, e.getErrorCode(), e.getDetail(), startedAt));
        }

        LOG.infof("Run %s for project %d started: feed=%s, maxInFlight=%d",
                token.runId(), snapshot.projectId(), snapshot.feedUrl(), maxInFlight);

        return Uni.createFrom().item(() -> feedFetcher.fetchAndParse(snapshot.feedUrl()))
                .runSubscriptionOn(executor)
                .onItem().transformToUni(feed -> processFeed(snapshot, token, listener, feed))
                .onFailure(BulkJobOrchestrator::isFeedFailure).recoverWithItem(failure -> {
                    FrameServiceException e = (FrameServiceException) failure;
                    LOG.warnf("Run %s for project %d aborted: %s", token.runId(), snapshot.projectId(), e.getDetail());
                    return BulkRunResult.aborted(token, e.getErrorCode(), e.getDetail(), startedAt);
                });
    }

    private Uni<BulkRunResult> processFeed(FrameProjectSnapshot snapshot, RunToken token,
                                           BulkRunListener listener, FeedParseResult feed) {
        List<ProductRecord> products = distinctByProductId(feed.products());
        listener.onFeedParsed(products.size(), feed.warnings());
        if (products.isEmpty()) {
            LOG.warnf("Run %s for project %d: feed has no usable products (%d skipped)",
                    token.runId(), snapshot.projectId(), feed.skipped().size());
        }

        AtomicInteger resolved = new AtomicInteger();
        AtomicInteger succeeded = new AtomicInteger();
        AtomicInteger failed = new AtomicInteger();

        return Multi.createFrom().iterable(products)
                .onItem().transformToUni(product -> Uni.createFrom()
                        .item(() -> processItem(snapshot, token, product))
                        .runSubscriptionOn(executor)
                        .invoke(outcome -> {
                            int s = outcome.status() == ItemOutcome.Status.SUCCEEDED
                                    ? succeeded.incrementAndGet() : succeeded.get();
                            int f = outcome.status() == ItemOutcome.Status.FAILED
                                    ? failed.incrementAndGet() : failed.get();
                            listener.onItemResolved(outcome, resolved.incrementAndGet(), s, f);
                        }))
                .merge(maxInFlight)
                .collect().asList()
                .map(outcomes -> summarize(snapshot, token, feed, outcomes));
    }

    /**
     * Never throws: every failure becomes a FAILED outcome for this item only.
     */
    ItemOutcome processItem(FrameProjectSnapshot snapshot, RunToken token, ProductRecord product) {
        String productId = product.productId();
        String imageUrl = product.imageUrl();
        if (!token.isActive()) {
            return ItemOutcome.abandoned(productId, imageUrl, "run cancelled");
        }

        long start = System.nanoTime();
        OutputResult result;
        String errorCode = null;
        try {
            FetchedResource image = imageFetcher.fetch(imageUrl, imagePolicy);
            byte[] composed = compositor.compose(snapshot.template(), snapshot.rect(), image.body());
            result = OutputResult.succeeded(imageUrl, composed, snapshot.template().format());
        } catch (FrameServiceException e) {
            errorCode = e.getErrorCode();
            result = OutputResult.failed(imageUrl, e.getDetail());
        } catch (RuntimeException e) {
            LOG.errorf(e, "Unexpected failure processing product %s", productId);
            errorCode = "INTERNAL_ERROR";
            result = OutputResult.failed(imageUrl, "unexpected error: " + e.getMessage());
        }

        if (!token.isActive()) {
            return ItemOutcome.abandoned(productId, imageUrl, "run cancelled before write");
        }
        try {
            if (!outputStore.upsert(snapshot.projectId(), productId, result)) {
                return ItemOutcome.abandoned(productId, imageUrl, "project no longer exists");
            }
        } catch (RuntimeException e) {
            if (!token.isActive()) {
                return ItemOutcome.abandoned(productId, imageUrl, "run cancelled during write");
            }
            LOG.warnf("Could not store output for product %s: %s", productId, e.getMessage());
            return ItemOutcome.failed(productId, imageUrl, storageCode(e), "could not store output: " + e.getMessage(),
                    elapsedMillis(start));
        }

        long millis = elapsedMillis(start);
        if (result.isSucceeded()) {
            LOG.debugf("Product %s composited in %d ms", productId, millis);
            return ItemOutcome.succeeded(productId, imageUrl, millis);
        }
        LOG.warnf("Product %s failed: %s", productId, result.failureReason());
        return ItemOutcome.failed(productId, imageUrl, errorCode, result.failureReason(), millis);
    }

    private BulkRunResult summarize(FrameProjectSnapshot snapshot, RunToken token, FeedParseResult feed,
                                    List<ItemOutcome> outcomes) {
        int succeeded = 0;
        int failed = 0;
        int abandoned = 0;
        List<String> failures = new ArrayList<>();
        for (ItemOutcome outcome : outcomes) {
            switch (outcome.status()) {
                case SUCCEEDED:
                    succeeded++;
                    break;
                case FAILED:
                    failed++;
                    failures.add(outcome.describeFailure());
                    break;
                default:
                    abandoned++;
            }
        }
        BulkRunResult result = new BulkRunResult(snapshot.projectId(), token.runId(), outcomes.size(),
                succeeded, failed, abandoned, failures, feed.warnings(), null, null, !token.isActive(),
                token.startedAt(), Instant.now());
        LOG.infof("Run %s for project %d finished: attempted=%d, succeeded=%d, failed=%d, abandoned=%d, took=%dms",
                token.runId(), snapshot.projectId(), result.attempted(), succeeded, failed, abandoned,
                result.duration().toMillis());
        return result;
    }

    /**
     * Keeps one record per product id, the last one in document order, in
     * the position of its first occurrence.
     */
    static List<ProductRecord> distinctByProductId(List<ProductRecord> products) {
        Map<String, ProductRecord> byId = new LinkedHashMap<>();
        for (ProductRecord product : products) {
            if (byId.containsKey(product.productId())) {
                LOG.debugf("Duplicate product id %s at entry %d replaces an earlier entry",
                        product.productId(), product.position());
            }
            byId.put(product.productId(), product);
        }
        return new ArrayList<>(byId.values());
    }

    private static boolean isFeedFailure(Throwable failure) {
        return failure instanceof FeedException || failure instanceof UrlValidationException;
    }

    private static String storageCode(RuntimeException e) {
        return e instanceof FrameServiceException ? ((FrameServiceException) e).getErrorCode() : "INTERNAL_ERROR";
    }

    private static long elapsedMillis(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }
}
