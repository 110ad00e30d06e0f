package ai.pipestream.frames.bulk;

import ai.pipestream.frames.composite.FrameTemplate;
import ai.pipestream.frames.composite.ImageCompositor;
import ai.pipestream.frames.composite.OverlayRect;
import ai.pipestream.frames.exception.FeedException;
import ai.pipestream.frames.exception.FrameConfigurationException;
import ai.pipestream.frames.exception.UrlValidationException;
import ai.pipestream.frames.feed.FeedFetcher;
import ai.pipestream.frames.feed.FeedParser;
import ai.pipestream.frames.fetch.FetchPolicy;
import ai.pipestream.frames.output.OutputStatus;
import ai.pipestream.frames.output.StoredOutput;
import ai.pipestream.frames.support.InMemoryOutputStore;
import ai.pipestream.frames.support.StubRemoteFetcher;
import ai.pipestream.frames.support.TestImages;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.awt.Color;
import java.awt.image.BufferedImage;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class BulkJobOrchestratorTest {

    private static final long PROJECT_ID = 7L;
    private static final String FEED_URL = "https://feeds.example/products.xml";
    private static final Duration TIMEOUT = Duration.ofSeconds(30);
    private static final FetchPolicy IMAGE_POLICY = FetchPolicy.image(1024 * 1024, Duration.ofSeconds(5));

    private final ExecutorService executor = Executors.newCachedThreadPool();
    private final StubRemoteFetcher remote = new StubRemoteFetcher();
    private final InMemoryOutputStore store = new InMemoryOutputStore();
    private final FeedFetcher feedFetcher = new FeedFetcher(remote, new FeedParser(),
            FetchPolicy.feed(1024 * 1024, Duration.ofSeconds(5)));

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private BulkJobOrchestrator orchestrator(ImageCompositor compositor, int maxInFlight) {
        return new BulkJobOrchestrator(feedFetcher, remote, IMAGE_POLICY, compositor, store, executor, maxInFlight);
    }

    private BulkJobOrchestrator orchestrator() {
        return orchestrator(new ImageCompositor(0.85f, 10, 4000), 4);
    }

    private static FrameProjectSnapshot snapshot(OverlayRect rect) {
        FrameTemplate template = FrameTemplate.decode(TestImages.png(800, 600, Color.WHITE), 10_000_000);
        return new FrameProjectSnapshot(PROJECT_ID, template, rect, FEED_URL);
    }

    private static FrameProjectSnapshot snapshot() {
        return snapshot(new OverlayRect(50, 50, 200, 150));
    }

    private static String feed(String... idAndImage) {
        StringBuilder xml = new StringBuilder(
                "<feed xmlns=\"http://www.w3.org/2005/Atom\" xmlns:g=\"http://base.google.com/ns/1.0\">");
        for (int i = 0; i < idAndImage.length; i += 2) {
            xml.append("<entry><g:id>").append(idAndImage[i]).append("</g:id><g:image_link>")
                    .append(idAndImage[i + 1]).append("</g:image_link></entry>");
        }
        return xml.append("</feed>").toString();
    }

    private static String img(String name) {
        return "https://cdn.example/" + name + ".png";
    }

    private BulkRunResult run(BulkJobOrchestrator orchestrator, FrameProjectSnapshot snapshot, RunToken token,
                              BulkRunListener listener) {
        return orchestrator.run(snapshot, token, listener).await().atMost(TIMEOUT);
    }

    private BulkRunResult run(BulkJobOrchestrator orchestrator) {
        return run(orchestrator, snapshot(), RunToken.start(PROJECT_ID), BulkRunListener.NONE);
    }

    @Test
    void compositesReachableProductsAndRecordsUnreachableOnes() {
        remote.feed(FEED_URL, feed("P1", img("p1"), "P2", img("p2")))
                .image(img("p1"), TestImages.png(400, 300, Color.RED));

        BulkRunResult result = run(orchestrator());

        assertEquals(2, result.attempted());
        assertEquals(1, result.succeeded());
        assertEquals(1, result.failed());
        assertFalse(result.aborted());
        assertEquals(1, result.failures().size());
        assertTrue(result.failures().get(0).startsWith("P2: "), result.failures().get(0));

        StoredOutput p1 = store.find(PROJECT_ID, "P1").orElseThrow();
        assertEquals(OutputStatus.SUCCEEDED, p1.status());
        BufferedImage output = TestImages.decode(store.readImage(PROJECT_ID, "P1").orElseThrow());
        assertEquals(800, output.getWidth());
        assertEquals(600, output.getHeight());
        assertEquals(Color.RED.getRGB(), output.getRGB(150, 125));
        assertEquals(Color.WHITE.getRGB(), output.getRGB(10, 10));

        StoredOutput p2 = store.find(PROJECT_ID, "P2").orElseThrow();
        assertEquals(OutputStatus.FAILED, p2.status());
        assertNotNull(p2.failureReason());
    }

    @Test
    void oneBadItemNeverAffectsTheOthers() {
        remote.feed(FEED_URL, feed(
                        "GOOD-1", img("good1"),
                        "CORRUPT", img("corrupt"),
                        "TINY", img("tiny"),
                        "PRIVATE", img("private"),
                        "GOOD-2", img("good2")))
                .image(img("good1"), TestImages.png(300, 300, Color.RED))
                .image(img("corrupt"), "definitely not a png".getBytes())
                .image(img("tiny"), TestImages.png(4, 4, Color.RED))
                .failing(img("private"), new UrlValidationException(img("private"), "resolves to private address"))
                .image(img("good2"), TestImages.jpeg(500, 200, Color.BLUE));

        BulkRunResult result = run(orchestrator());

        assertEquals(5, result.attempted());
        assertEquals(2, result.succeeded());
        assertEquals(3, result.failed());
        assertEquals(result.attempted(), result.succeeded() + result.failed() + result.abandoned());
        assertEquals(2, store.count(OutputStatus.SUCCEEDED));
        assertEquals(3, store.count(OutputStatus.FAILED));
        assertTrue(store.find(PROJECT_ID, "CORRUPT").orElseThrow().failureReason().contains("DECODE_FAILED"));
        assertTrue(store.find(PROJECT_ID, "TINY").orElseThrow().failureReason().contains("UNSUPPORTED_DIMENSIONS"));
    }

    @Test
    void rerunningUpdatesOutputsInPlace() {
        remote.feed(FEED_URL, feed("A", img("a"), "B", img("b")))
                .image(img("a"), TestImages.png(100, 100, Color.RED))
                .image(img("b"), TestImages.png(100, 100, Color.GREEN));
        BulkJobOrchestrator orchestrator = orchestrator();

        run(orchestrator);
        byte[] firstA = store.readImage(PROJECT_ID, "A").orElseThrow();
        BulkRunResult second = run(orchestrator);

        assertEquals(2, second.succeeded());
        assertEquals(2, store.size());
        assertEquals(4, store.writes());
        assertArrayEquals(firstA, store.readImage(PROJECT_ID, "A").orElseThrow());
    }

    @Test
    void failedRerunReplacesEarlierSuccess() {
        remote.feed(FEED_URL, feed("A", img("a")))
                .image(img("a"), TestImages.png(100, 100, Color.RED));
        BulkJobOrchestrator orchestrator = orchestrator();
        run(orchestrator);

        remote.failing(img("a"), new ai.pipestream.frames.exception.FetchException(img("a"), 503));
        run(orchestrator);

        assertEquals(1, store.size());
        assertEquals(OutputStatus.FAILED, store.find(PROJECT_ID, "A").orElseThrow().status());
        assertTrue(store.readImage(PROJECT_ID, "A").isEmpty());
    }

    @Test
    void neverExceedsTheInFlightBound() {
        String[] entries = new String[24];
        for (int i = 0; i < 12; i++) {
            entries[2 * i] = "P" + i;
            entries[2 * i + 1] = img("p" + i);
            remote.image(img("p" + i), TestImages.png(50, 50, Color.RED));
        }
        remote.feed(FEED_URL, feed(entries));

        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        // the first three items only proceed once all three are composing together
        CountDownLatch allThreeStarted = new CountDownLatch(3);
        ImageCompositor slow = new ImageCompositor(0.85f, 10, 4000) {
            @Override
            public byte[] compose(FrameTemplate template, OverlayRect rect, byte[] productImage) {
                int now = inFlight.incrementAndGet();
                peak.accumulateAndGet(now, Math::max);
                try {
                    allThreeStarted.countDown();
                    allThreeStarted.await(10, TimeUnit.SECONDS);
                    Thread.sleep(20);
                    return super.compose(template, rect, productImage);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException(e);
                } finally {
                    inFlight.decrementAndGet();
                }
            }
        };

        BulkRunResult result = run(orchestrator(slow, 3));

        assertEquals(12, result.succeeded());
        assertEquals(3, peak.get(), "peak concurrency");
    }

    @Test
    void cancelledRunWritesNothingFurther() {
        remote.feed(FEED_URL, feed("A", img("a"), "B", img("b"), "C", img("c")))
                .image(img("a"), TestImages.png(100, 100, Color.RED))
                .image(img("b"), TestImages.png(100, 100, Color.RED))
                .image(img("c"), TestImages.png(100, 100, Color.RED));
        RunToken token = RunToken.start(PROJECT_ID);
        ImageCompositor cancelling = new ImageCompositor(0.85f, 10, 4000) {
            @Override
            public byte[] compose(FrameTemplate template, OverlayRect rect, byte[] productImage) {
                byte[] out = super.compose(template, rect, productImage);
                token.cancel();
                return out;
            }
        };

        BulkRunResult result = run(orchestrator(cancelling, 1), snapshot(), token, BulkRunListener.NONE);

        assertTrue(result.cancelled());
        assertEquals(3, result.attempted());
        assertEquals(0, result.succeeded());
        assertEquals(3, result.abandoned());
        assertEquals(0, store.writes());
    }

    @Test
    void unreachableFeedAbortsBeforeAnyItem() {
        BulkRunResult result = run(orchestrator());

        assertTrue(result.aborted());
        assertEquals(FeedException.CODE, result.abortCode());
        assertEquals(0, result.attempted());
        assertEquals(0, store.writes());
    }

    @Test
    void rejectedFeedUrlAbortsTheRun() {
        remote.failing(FEED_URL, new UrlValidationException(FEED_URL, "host resolves to loopback address 127.0.0.1"));

        BulkRunResult result = run(orchestrator());

        assertTrue(result.aborted());
        assertEquals(UrlValidationException.CODE, result.abortCode());
        assertTrue(result.abortReason().contains("loopback"));
    }

    @Test
    void malformedFeedAbortsTheRun() {
        remote.feed(FEED_URL, "<feed><entry>");

        BulkRunResult result = run(orchestrator());

        assertTrue(result.aborted());
        assertEquals(FeedException.CODE, result.abortCode());
    }

    @Test
    void overlayOutsideTemplateAbortsWithoutFetching() {
        BulkRunResult result = run(orchestrator(), snapshot(new OverlayRect(700, 500, 200, 150)),
                RunToken.start(PROJECT_ID), BulkRunListener.NONE);

        assertTrue(result.aborted());
        assertEquals(FrameConfigurationException.BOUNDS_CODE, result.abortCode());
        assertTrue(remote.requested().isEmpty());
    }

    @Test
    void emptyFeedFinishesWithNothingAttempted() {
        remote.feed(FEED_URL, feed());

        BulkRunResult result = run(orchestrator());

        assertFalse(result.aborted());
        assertEquals(0, result.attempted());
        assertEquals(0, result.succeeded());
    }

    @Test
    void duplicateProductIdsKeepTheLastEntry() {
        remote.feed(FEED_URL, feed("DUP", img("first"), "DUP", img("second")))
                .image(img("first"), TestImages.png(100, 100, Color.RED))
                .image(img("second"), TestImages.png(100, 100, Color.BLUE));

        BulkRunResult result = run(orchestrator());

        assertEquals(1, result.attempted());
        assertEquals(0, remote.requestCount(img("first")));
        assertEquals(img("second"), store.find(PROJECT_ID, "DUP").orElseThrow().productImageUrl());
    }

    @Test
    void storageFailureFailsOnlyThatItem() {
        remote.feed(FEED_URL, feed("A", img("a"), "B", img("b")))
                .image(img("a"), TestImages.png(100, 100, Color.RED))
                .image(img("b"), TestImages.png(100, 100, Color.RED));
        store.failWritesFor("B"::equals);

        BulkRunResult result = run(orchestrator());

        assertEquals(1, result.succeeded());
        assertEquals(1, result.failed());
        assertTrue(result.failures().get(0).contains("could not store output"));
    }

    @Test
    void deletedProjectAbandonsRemainingItems() {
        remote.feed(FEED_URL, feed("A", img("a")))
                .image(img("a"), TestImages.png(100, 100, Color.RED));
        store.projectDeleted();

        BulkRunResult result = run(orchestrator());

        assertEquals(1, result.abandoned());
        assertEquals(0, result.failed());
    }

    @Test
    void reportsProgressToTheListener() {
        remote.feed(FEED_URL, feed("A", img("a"), "B", img("b"), "C", img("c")))
                .image(img("a"), TestImages.png(100, 100, Color.RED))
                .image(img("c"), TestImages.png(100, 100, Color.RED));
        AtomicReference<Integer> total = new AtomicReference<>();
        List<Integer> resolved = new CopyOnWriteArrayList<>();
        AtomicInteger lastFailed = new AtomicInteger();

        BulkRunListener listener = new BulkRunListener() {
            @Override
            public void onFeedParsed(int distinctProducts, List<String> warnings) {
                total.set(distinctProducts);
            }

            @Override
            public void onItemResolved(ItemOutcome outcome, int resolvedSoFar, int succeeded, int failed) {
                resolved.add(resolvedSoFar);
                lastFailed.accumulateAndGet(failed, Math::max);
            }
        };

        run(orchestrator(), snapshot(), RunToken.start(PROJECT_ID), listener);

        assertEquals(3, total.get());
        assertEquals(3, resolved.size());
        assertTrue(resolved.contains(3));
        assertEquals(1, lastFailed.get());
    }

    @Test
    void keepsLastOccurrenceInFirstPosition() {
        var records = BulkJobOrchestrator.distinctByProductId(List.of(
                new ai.pipestream.frames.feed.ProductRecord(0, "X", img("x1"), java.util.Map.of()),
                new ai.pipestream.frames.feed.ProductRecord(1, "Y", img("y"), java.util.Map.of()),
                new ai.pipestream.frames.feed.ProductRecord(2, "X", img("x2"), java.util.Map.of())));

        assertEquals(2, records.size());
        assertEquals("X", records.get(0).productId());
        assertEquals(img("x2"), records.get(0).imageUrl());
    }
}
