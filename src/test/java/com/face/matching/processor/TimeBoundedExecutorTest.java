package com.face.matching.processor;

import com.face.matching.exception.BatchExecutionException;
import com.face.matching.exception.BatchSetupException;
import com.face.matching.model.Summary;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class TimeBoundedExecutorTest {

    private final TimeBoundedExecutor executor = new TimeBoundedExecutor();
    private final CountDownLatch release = new CountDownLatch(1);

    @AfterEach
    void tearDown() {
        release.countDown();
    }

    @Test
    void returnsWorkerSummaryUnchanged() {
        Summary expected = Summary.builder().totalImages(2).processedImages(2).build();
        Summary actual = executor.runWithDeadline(() -> expected, Duration.ofSeconds(5), () -> 99);
        assertSame(expected, actual);
    }

    @Test
    void runsOnDedicatedWorkerThread() {
        AtomicReference<Thread> worker = new AtomicReference<>();
        executor.runWithDeadline(() -> {
            worker.set(Thread.currentThread());
            return Summary.builder().build();
        }, Duration.ofSeconds(5), () -> 0);

        assertNotSame(Thread.currentThread(), worker.get());
        assertTrue(worker.get().getName().startsWith("batch-worker-"));
        assertTrue(worker.get().isDaemon());
    }

    @Test @Timeout(5)
    void deadlineReturnsTimeoutSummaryImmediately() {
        long start = System.nanoTime();
        Summary summary = executor.runWithDeadline(() -> {
            release.await(10, TimeUnit.SECONDS);
            return Summary.builder().totalImages(7).processedImages(7).build();
        }, Duration.ofMillis(100), () -> 7);
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertTrue(summary.isTimedOut());
        assertEquals(Summary.TIMEOUT_MESSAGE, summary.getError());
        assertEquals(7, summary.getTotalImages());
        assertEquals(0, summary.getProcessedImages());
        assertEquals(0, summary.getSkippedImages());
        assertTrue(summary.getResults().isEmpty());
        assertTrue(elapsedMs < 2000, "took " + elapsedMs + " ms");
    }

    @Test @Timeout(5)
    void failingCountFallsBackToZero() {
        Summary summary = executor.runWithDeadline(() -> {
            release.await(10, TimeUnit.SECONDS);
            return Summary.builder().build();
        }, Duration.ofMillis(50), () -> {
            throw new BatchSetupException("gone");
        });
        assertTrue(summary.isTimedOut());
        assertEquals(0, summary.getTotalImages());
    }

    @Test
    void withoutDeadlineWaitsForCompletion() {
        Summary summary = executor.runWithDeadline(() -> {
            Thread.sleep(150);
            return Summary.builder().totalImages(1).build();
        }, null, () -> 1);
        assertFalse(summary.isTimedOut());
        assertEquals(1, summary.getTotalImages());
    }

    @Test
    void runtimeFailurePropagatesUnwrapped() {
        BatchSetupException e = assertThrows(BatchSetupException.class,
                () -> executor.runWithDeadline(() -> {
                    throw new BatchSetupException("Image directory does not exist: /nope");
                }, Duration.ofSeconds(5), () -> 0));
        assertTrue(e.getMessage().contains("/nope"));
    }

    @Test
    void checkedFailureIsWrapped() {
        BatchExecutionException e = assertThrows(BatchExecutionException.class,
                () -> executor.runWithDeadline(() -> {
                    throw new IOException("disk");
                }, Duration.ofSeconds(5), () -> 0));
        assertInstanceOf(IOException.class, e.getCause());
    }
}
