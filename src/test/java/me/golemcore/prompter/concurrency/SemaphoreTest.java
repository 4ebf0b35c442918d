package me.golemcore.prompter.concurrency;

import me.golemcore.prompter.domain.model.SemaphoreStats;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class SemaphoreTest {

    @Test
    void rejectsNonPositivePermits() {
        assertThrows(IllegalArgumentException.class, () -> new Semaphore(0));
        assertThrows(IllegalArgumentException.class, () -> new Semaphore(-3));
    }

    @Test
    void neverRunsMoreThanMaxPermitsAtOnce() throws Exception {
        Semaphore semaphore = new Semaphore(3);
        AtomicInteger active = new AtomicInteger();
        AtomicInteger maxActive = new AtomicInteger();

        List<CompletableFuture<Integer>> results = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            int n = i;
            results.add(semaphore.execute(() -> CompletableFuture.supplyAsync(() -> {
                int now = active.incrementAndGet();
                maxActive.accumulateAndGet(now, Math::max);
                sleep(20);
                active.decrementAndGet();
                return n;
            }), 0));
        }

        CompletableFuture.allOf(results.toArray(new CompletableFuture[0])).get(10, TimeUnit.SECONDS);

        assertTrue(maxActive.get() <= 3, "max active was " + maxActive.get());
        assertEquals(3, semaphore.getAvailablePermits());
        assertEquals(0, semaphore.getQueueLength());
        SemaphoreStats stats = semaphore.getStats();
        assertEquals(20, stats.getCompleted());
        assertEquals(3, stats.getPeakPermitsInUse());
    }

    @Test
    void admitsWaitersInFifoOrder() {
        Semaphore semaphore = new Semaphore(2);
        List<Integer> started = new ArrayList<>();
        Map<Integer, CompletableFuture<String>> running = new ConcurrentHashMap<>();

        for (int i = 0; i < 6; i++) {
            int n = i;
            semaphore.execute(() -> {
                started.add(n);
                CompletableFuture<String> future = new CompletableFuture<>();
                running.put(n, future);
                return future;
            }, 0);
        }

        assertEquals(List.of(0, 1), started);
        assertEquals(4, semaphore.getQueueLength());
        assertTrue(semaphore.isFullyUtilized());

        running.get(1).complete("one");
        assertEquals(List.of(0, 1, 2), started);
        running.get(0).complete("zero");
        assertEquals(List.of(0, 1, 2, 3), started);
        running.get(3).complete("three");
        running.get(2).complete("two");
        assertEquals(List.of(0, 1, 2, 3, 4, 5), started);

        running.get(4).complete("four");
        running.get(5).complete("five");
        assertEquals(2, semaphore.getAvailablePermits());
        assertEquals(6, semaphore.getStats().getCompleted());
    }

    @Test
    void drainsLongQueueOfImmediatelyCompletingOperations() {
        Semaphore semaphore = new Semaphore(1);
        CompletableFuture<String> blocker = new CompletableFuture<>();
        semaphore.execute(() -> blocker, 0);

        int queuedCount = 50_000;
        List<CompletableFuture<Integer>> queued = new ArrayList<>(queuedCount);
        for (int i = 0; i < queuedCount; i++) {
            int n = i;
            queued.add(semaphore.execute(() -> CompletableFuture.completedFuture(n), 0));
        }
        assertEquals(queuedCount, semaphore.getQueueLength());

        blocker.complete("go");

        assertTrue(queued.stream().allMatch(f -> f.isDone() && !f.isCompletedExceptionally()));
        assertEquals(queuedCount - 1, queued.get(queuedCount - 1).join());
        assertEquals(1, semaphore.getAvailablePermits());
        assertEquals(0, semaphore.getQueueLength());
        assertEquals(queuedCount + 1, semaphore.getStats().getCompleted());
    }

    @Test
    void releasesPermitWhenSupplierThrows() {
        Semaphore semaphore = new Semaphore(1);

        CompletableFuture<String> result = semaphore.execute(() -> {
            throw new IllegalStateException("boom");
        }, 0);

        CompletionException error = assertThrows(CompletionException.class, result::join);
        assertInstanceOf(IllegalStateException.class, error.getCause());
        assertEquals(1, semaphore.getAvailablePermits());
        assertEquals(1, semaphore.getStats().getFailed());
    }

    @Test
    void releasesPermitWhenOperationFails() {
        Semaphore semaphore = new Semaphore(1);

        CompletableFuture<String> result = semaphore.execute(
                () -> CompletableFuture.failedFuture(new IOException("disk gone")), 0);

        CompletionException error = assertThrows(CompletionException.class, result::join);
        assertInstanceOf(IOException.class, error.getCause());
        assertEquals(1, semaphore.getAvailablePermits());

        String next = semaphore.execute(() -> CompletableFuture.completedFuture("ok"), 0).join();
        assertEquals("ok", next);
    }

    @Test
    void timesOutSlowOperationAndFreesPermit() {
        Semaphore semaphore = new Semaphore(1);
        CompletableFuture<String> neverDone = new CompletableFuture<>();

        CompletableFuture<String> result = semaphore.execute(() -> neverDone, 50);

        ExecutionException error = assertThrows(ExecutionException.class, () -> result.get(5, TimeUnit.SECONDS));
        assertInstanceOf(TimeoutException.class, error.getCause());
        assertEquals(1, semaphore.getAvailablePermits());
        assertEquals(1, semaphore.getStats().getTimedOut());
        assertEquals(0, semaphore.getStats().getFailed());
        assertFalse(neverDone.isDone());
    }

    @Test
    void clearCancelsQueuedCallersAndIgnoresStaleRelease() {
        Semaphore semaphore = new Semaphore(1);
        CompletableFuture<String> holder = new CompletableFuture<>();
        semaphore.execute(() -> holder, 0);
        CompletableFuture<String> queued = semaphore.execute(() -> CompletableFuture.completedFuture("late"), 0);
        assertEquals(1, semaphore.getQueueLength());

        semaphore.clear();

        CompletionException error = assertThrows(CompletionException.class, queued::join);
        assertInstanceOf(CancellationException.class, error.getCause());
        assertEquals(0, semaphore.getQueueLength());
        assertEquals(1, semaphore.getAvailablePermits());

        holder.complete("done");
        assertEquals(1, semaphore.getAvailablePermits());
        assertEquals(0, semaphore.getStats().getCompleted());
    }

    @Test
    void statsReflectPermitsInUse() {
        Semaphore semaphore = new Semaphore(4);
        CompletableFuture<String> first = new CompletableFuture<>();
        CompletableFuture<String> second = new CompletableFuture<>();
        semaphore.execute(() -> first, 0);
        semaphore.execute(() -> second, 0);

        SemaphoreStats stats = semaphore.getStats();
        assertEquals(4, stats.getMaxPermits());
        assertEquals(2, stats.getAvailablePermits());
        assertEquals(2, stats.getPermitsInUse());
        assertEquals(50.0, stats.getUtilizationRate(), 0.001);

        first.complete("a");
        second.complete("b");
        semaphore.resetPeakUsage();
        assertEquals(0, semaphore.getStats().getPeakPermitsInUse());
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
