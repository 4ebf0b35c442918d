package me.golemcore.prompter.concurrency;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.prompter.domain.model.SemaphoreStats;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Counting admission gate for asynchronous operations.
 *
 * <p>
 * At most {@code maxPermits} operations started through
 * {@link #execute(Supplier, long)} hold a permit at the same time. Callers that
 * find no free permit are queued and admitted in FIFO order. A permit is always
 * returned when the operation settles: on success, on failure, when the
 * supplier throws, and when the timeout fires.
 *
 * <p>
 * A released permit passes straight to the next queued caller on the releasing
 * thread. When that caller's operation settles synchronously, its own release
 * is deferred to the handoff loop already running on the thread, so a long
 * queue of immediately completing operations is drained iteratively.
 *
 * <p>
 * A timed out operation is not cancelled. Its future keeps running and its
 * result is discarded, so side effects may still happen after the caller has
 * seen the {@link TimeoutException}.
 *
 * @since 1.0
 */
public class Semaphore {

    private final int maxPermits;
    private final Object lock = new Object();
    private final Deque<CompletableFuture<Long>> waitQueue = new ArrayDeque<>();
    private final ThreadLocal<Deque<Runnable>> pendingHandoffs = new ThreadLocal<>();

    private int availablePermits;
    private int peakPermitsInUse;
    private long generation;
    private long completed;
    private long failed;
    private long timedOut;

    public Semaphore(int maxPermits) {
        if (maxPermits <= 0) {
            throw new IllegalArgumentException("Semaphore max permits must be greater than 0");
        }
        this.maxPermits = maxPermits;
        this.availablePermits = maxPermits;
    }

    /**
     * Runs an operation while holding one permit.
     *
     * @param operation
     *            supplier of the operation future, invoked once the permit is
     *            granted
     * @param timeoutMs
     *            time the operation may take once admitted; {@code <= 0}
     *            disables the timeout
     * @return future of the operation result, failed with
     *         {@link TimeoutException} on timeout or
     *         {@link CancellationException} if the semaphore is cleared while
     *         the caller is still queued
     */
    public <T> CompletableFuture<T> execute(Supplier<CompletableFuture<T>> operation, long timeoutMs) {
        return acquirePermit().thenCompose(permitGeneration -> {
            CompletableFuture<T> bounded;
            try {
                CompletableFuture<T> running = operation.get();
                bounded = running != null
                        ? running.copy()
                        : CompletableFuture.failedFuture(new IllegalStateException("Operation returned no future"));
            } catch (RuntimeException e) {
                bounded = CompletableFuture.failedFuture(e);
            }
            if (timeoutMs > 0) {
                bounded.orTimeout(timeoutMs, TimeUnit.MILLISECONDS);
            }
            return bounded.whenComplete((result, error) -> release(permitGeneration, error));
        });
    }

    public int getAvailablePermits() {
        synchronized (lock) {
            return availablePermits;
        }
    }

    public int getMaxPermits() {
        return maxPermits;
    }

    public int getQueueLength() {
        synchronized (lock) {
            return waitQueue.size();
        }
    }

    public boolean isFullyUtilized() {
        synchronized (lock) {
            return availablePermits == 0;
        }
    }

    public SemaphoreStats getStats() {
        synchronized (lock) {
            int inUse = maxPermits - availablePermits;
            return SemaphoreStats.builder()
                    .maxPermits(maxPermits)
                    .availablePermits(availablePermits)
                    .permitsInUse(inUse)
                    .peakPermitsInUse(peakPermitsInUse)
                    .queueLength(waitQueue.size())
                    .completed(completed)
                    .failed(failed)
                    .timedOut(timedOut)
                    .utilizationRate(inUse * 100.0 / maxPermits)
                    .build();
        }
    }

    /**
     * Restarts peak tracking from the current number of permits in use.
     */
    public void resetPeakUsage() {
        synchronized (lock) {
            peakPermitsInUse = maxPermits - availablePermits;
        }
    }

    /**
     * Drops all bookkeeping: queued callers fail with
     * {@link CancellationException}, permits and counters are reset. Operations
     * that already hold a permit keep running; their later release is ignored.
     */
    public void clear() {
        List<CompletableFuture<Long>> pending;
        synchronized (lock) {
            pending = new ArrayList<>(waitQueue);
            waitQueue.clear();
            generation++;
            availablePermits = maxPermits;
            peakPermitsInUse = 0;
            completed = 0;
            failed = 0;
            timedOut = 0;
        }
        for (CompletableFuture<Long> waiter : pending) {
            waiter.completeExceptionally(new CancellationException("Semaphore cleared"));
        }
    }

    private CompletableFuture<Long> acquirePermit() {
        synchronized (lock) {
            if (availablePermits > 0) {
                availablePermits--;
                trackPeak();
                return CompletableFuture.completedFuture(generation);
            }
            CompletableFuture<Long> waiter = new CompletableFuture<>();
            waitQueue.addLast(waiter);
            return waiter;
        }
    }

    private void release(long permitGeneration, Throwable error) {
        CompletableFuture<Long> next;
        synchronized (lock) {
            if (permitGeneration != generation) {
                return;
            }
            recordOutcome(error);
            next = waitQueue.pollFirst();
            if (next == null) {
                availablePermits = Math.min(maxPermits, availablePermits + 1);
                return;
            }
        }
        handOff(() -> next.complete(permitGeneration));
    }

    private void handOff(Runnable admission) {
        Deque<Runnable> pending = pendingHandoffs.get();
        if (pending != null) {
            pending.addLast(admission);
            return;
        }
        pending = new ArrayDeque<>();
        pendingHandoffs.set(pending);
        try {
            Runnable current = admission;
            while (current != null) {
                current.run();
                current = pending.pollFirst();
            }
        } finally {
            pendingHandoffs.remove();
        }
    }

    private void recordOutcome(Throwable error) {
        if (error == null) {
            completed++;
            return;
        }
        Throwable cause = error instanceof CompletionException && error.getCause() != null
                ? error.getCause()
                : error;
        if (cause instanceof TimeoutException) {
            timedOut++;
        } else {
            failed++;
        }
    }

    private void trackPeak() {
        int inUse = maxPermits - availablePermits;
        if (inUse > peakPermitsInUse) {
            peakPermitsInUse = inUse;
        }
    }
}
