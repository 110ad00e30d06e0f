package ai.pipestream.frames.bulk;

import ai.pipestream.frames.exception.AlreadyRunningException;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class BulkRunRegistryTest {

    private final BulkRunRegistry registry = new BulkRunRegistry();

    private static BulkRunResult result(RunToken token, int succeeded, int failed) {
        return new BulkRunResult(token.projectId(), token.runId(), succeeded + failed, succeeded, failed, 0,
                List.of(), List.of(), null, null, !token.isActive(), token.startedAt(), Instant.now());
    }

    @Test
    void secondTriggerIsRejectedWhileARunIsActive() {
        RunToken first = registry.begin(1L);

        AlreadyRunningException e = assertThrows(AlreadyRunningException.class, () -> registry.begin(1L));
        assertEquals(first.runId(), e.getActiveRunId());
        assertTrue(registry.isActive(1L));
    }

    @Test
    void differentProjectsRunIndependently() {
        registry.begin(1L);
        registry.begin(2L);

        assertEquals(2, registry.activeCount());
    }

    @Test
    void finishingReleasesTheSlotAndKeepsTheResult() {
        RunToken token = registry.begin(1L);
        RunStatus status = registry.finish(token, result(token, 3, 1));

        assertFalse(registry.isActive(1L));
        assertEquals(RunState.SUCCEEDED, status.state());
        assertEquals(4, status.processed());
        assertEquals(status, registry.status(1L).orElseThrow());
        assertNotEquals(token.runId(), registry.begin(1L).runId());
    }

    @Test
    void staleFinishDoesNotReleaseANewerRun() {
        RunToken old = registry.begin(1L);
        registry.finish(old, result(old, 1, 0));
        RunToken current = registry.begin(1L);

        registry.finish(old, result(old, 1, 0));

        assertTrue(registry.isActive(1L));
        assertEquals(current.runId(), registry.status(1L).orElseThrow().runId());
    }

    @Test
    void progressIsMonotonic() {
        RunToken token = registry.begin(1L);
        registry.recordTotal(token, 10);
        registry.recordProgress(token, 5, 4, 1);
        registry.recordProgress(token, 3, 3, 0);

        RunStatus status = registry.status(1L).orElseThrow();
        assertEquals(RunState.RUNNING, status.state());
        assertEquals(10, status.total());
        assertEquals(5, status.processed());
        assertEquals(4, status.succeeded());
        assertEquals(1, status.failed());
        assertNull(status.result());
    }

    @Test
    void cancelFlagsTheActiveToken() {
        RunToken token = registry.begin(1L);

        assertSame(token, registry.cancel(1L).orElseThrow());
        assertFalse(token.isActive());
        assertEquals(RunState.CANCELLED, registry.status(1L).orElseThrow().state());

        RunStatus finished = registry.finish(token, result(token, 0, 0));
        assertEquals(RunState.CANCELLED, finished.state());
    }

    @Test
    void cancelWithoutActiveRunIsEmpty() {
        assertTrue(registry.cancel(42L).isEmpty());
    }

    @Test
    void runWithNoSuccessesIsFailed() {
        RunToken token = registry.begin(1L);
        assertEquals(RunState.FAILED, registry.finish(token, result(token, 0, 3)).state());

        RunToken aborted = registry.begin(1L);
        RunStatus status = registry.fail(aborted, "boom");
        assertEquals(RunState.FAILED, status.state());
        assertEquals("boom", status.result().abortReason());
    }

    @Test
    void forgetDropsTheLastRun() {
        RunToken token = registry.begin(1L);
        registry.finish(token, result(token, 1, 0));

        registry.forget(1L);

        assertTrue(registry.status(1L).isEmpty());
    }

    @Test
    void concurrentTriggersAdmitExactlyOne() throws Exception {
        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger admitted = new AtomicInteger();
        AtomicInteger rejected = new AtomicInteger();
        try {
            for (int i = 0; i < threads; i++) {
                pool.submit(() -> {
                    start.await();
                    try {
                        registry.begin(9L);
                        admitted.incrementAndGet();
                    } catch (AlreadyRunningException e) {
                        rejected.incrementAndGet();
                    }
                    return null;
                });
            }
            start.countDown();
            pool.shutdown();
            assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));
        } finally {
            pool.shutdownNow();
        }

        assertEquals(1, admitted.get());
        assertEquals(threads - 1, rejected.get());
    }
}
