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

import me.golemcore.prompter.domain.model.BatchProcessingResult;
import me.golemcore.prompter.domain.model.FileContent;
import me.golemcore.prompter.domain.model.FileFailure;
import me.golemcore.prompter.domain.model.FileWrite;
import me.golemcore.prompter.domain.model.FileWriteResult;
import me.golemcore.prompter.domain.model.ProcessingStats;
import me.golemcore.prompter.domain.model.SemaphoreStats;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Bounded-concurrency batch processing of files.
 *
 * <p>
 * Paths are split into batches of {@code batchSize}; batches run one after
 * another, and every file of a batch is submitted at once. Each file then waits
 * for a permit of the read {@link Semaphore} (writes use a separate, smaller
 * one), so at most {@code maxConcurrentReads} files are read at any moment. A
 * file that fails or exceeds {@code operationTimeoutMs} is reported in
 * {@link BatchProcessingResult#getFailed()} and never aborts the batch.
 *
 * <p>
 * Blocking I/O runs on a private pool of daemon threads named
 * {@code file-processor-N}; call {@link #close()} to release it.
 *
 * @since 1.0
 */
@Slf4j
public class ConcurrentFileProcessor implements AutoCloseable {

    private static final long EXECUTOR_TERMINATION_TIMEOUT_SECONDS = 5;
    private static final double NANOS_PER_MILLI = 1_000_000.0;

    private final AtomicInteger threadCounter = new AtomicInteger();
    private final ExecutorService ioExecutor = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "file-processor-" + threadCounter.incrementAndGet());
        t.setDaemon(true);
        return t;
    });

    private volatile ProcessingSettings settings;
    private volatile Semaphore readSemaphore;
    private volatile Semaphore writeSemaphore;
    private volatile ProcessingStats lastStats = ProcessingStats.empty();

    public ConcurrentFileProcessor() {
        this(ProcessingSettings.defaults());
    }

    public ConcurrentFileProcessor(ProcessingSettings settings) {
        validate(settings);
        this.settings = settings;
        this.readSemaphore = new Semaphore(settings.getMaxConcurrentReads());
        this.writeSemaphore = new Semaphore(settings.getMaxConcurrentWrites());
    }

    /**
     * Reads every file and applies {@code processor} to its text.
     *
     * @return successes, per-file failures, completion order and run statistics
     */
    public <T> BatchProcessingResult<T> processFilesInBatches(List<Path> filePaths, FileContentProcessor<T> processor) {
        return runInBatches(filePaths, Function.identity(), readSemaphore, path -> readAndProcess(path, processor));
    }

    /**
     * Reads every file as UTF-8 text.
     */
    public BatchProcessingResult<FileContent> readFilesInBatches(List<Path> filePaths) {
        return processFilesInBatches(filePaths,
                (path, content) -> new FileContent(path.toString(), content,
                        content.getBytes(StandardCharsets.UTF_8).length));
    }

    /**
     * Writes every file through the write semaphore, creating parent directories
     * as needed.
     */
    public BatchProcessingResult<FileWriteResult> writeFilesInBatches(List<FileWrite> writes) {
        return runInBatches(writes, FileWrite::filePath, writeSemaphore,
                pending -> () -> write(pending.filePath(), pending.content()));
    }

    /**
     * Statistics of the most recent run.
     */
    public ProcessingStats getStats() {
        return lastStats;
    }

    public SemaphoreStats getReadSemaphoreStats() {
        return readSemaphore.getStats();
    }

    public SemaphoreStats getWriteSemaphoreStats() {
        return writeSemaphore.getStats();
    }

    public ProcessingSettings getSettings() {
        return settings;
    }

    /**
     * Installs new limits. Operations queued from now on use fresh semaphores;
     * operations already waiting drain through the previous ones.
     */
    public void reconfigure(ProcessingSettings newSettings) {
        validate(newSettings);
        this.settings = newSettings;
        this.readSemaphore = new Semaphore(newSettings.getMaxConcurrentReads());
        this.writeSemaphore = new Semaphore(newSettings.getMaxConcurrentWrites());
        log.info("[FileProcessor] Reconfigured: reads={}, writes={}, timeout={}ms, batchSize={}",
                newSettings.getMaxConcurrentReads(), newSettings.getMaxConcurrentWrites(),
                newSettings.getOperationTimeoutMs(), newSettings.getBatchSize());
    }

    /**
     * Drops semaphore bookkeeping. Queued operations fail; running ones finish.
     */
    public void cleanup() {
        readSemaphore.clear();
        writeSemaphore.clear();
    }

    @Override
    public void close() {
        cleanup();
        ioExecutor.shutdownNow();
        try {
            ioExecutor.awaitTermination(EXECUTOR_TERMINATION_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private <I, T> BatchProcessingResult<T> runInBatches(List<I> items, Function<I, Path> pathOf,
            Semaphore semaphore, Function<I, IoTask<T>> taskFactory) {
        ProcessingSettings current = settings;
        RunAccumulator<T> run = new RunAccumulator<>(current.isEnablePerformanceTracking());
        semaphore.resetPeakUsage();
        long runStarted = System.nanoTime();

        int batchSize = current.getBatchSize();
        int batchCount = (items.size() + batchSize - 1) / batchSize;
        for (int start = 0; start < items.size(); start += batchSize) {
            List<I> batch = items.subList(start, Math.min(start + batchSize, items.size()));
            List<CompletableFuture<Void>> settled = new ArrayList<>(batch.size());
            for (I item : batch) {
                settled.add(submit(pathOf.apply(item), semaphore, current.getOperationTimeoutMs(),
                        taskFactory.apply(item), run));
            }
            CompletableFuture.allOf(settled.toArray(new CompletableFuture[0])).join();

            if (current.isEnablePerformanceTracking()) {
                log.debug("[FileProcessor] Batch {}/{} done: {} ok, {} failed",
                        start / batchSize + 1, batchCount, run.successCount(), run.failureCount());
            }
        }

        long totalMs = toMillis(System.nanoTime() - runStarted);
        ProcessingStats stats = run.toStats(totalMs, semaphore.getStats());
        lastStats = stats;
        if (stats.getFailedFiles() > 0) {
            log.warn("[FileProcessor] {} of {} files failed", stats.getFailedFiles(), stats.getTotalFiles());
        }
        return run.toResult(stats);
    }

    private <T> CompletableFuture<Void> submit(Path path, Semaphore semaphore, long timeoutMs, IoTask<T> task,
            RunAccumulator<T> run) {
        long enqueuedAt = System.nanoTime();
        long[] startedAt = { enqueuedAt };
        CompletableFuture<T> result = semaphore.execute(() -> {
            startedAt[0] = System.nanoTime();
            run.recordQueueWait(toMillis(startedAt[0] - enqueuedAt));
            return CompletableFuture.supplyAsync(() -> {
                try {
                    return task.run();
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
            }, ioExecutor);
        }, timeoutMs);

        return result.handle((value, error) -> {
            long elapsedMs = toMillis(System.nanoTime() - startedAt[0]);
            String filePath = path.toString();
            if (error == null) {
                run.recordSuccess(filePath, value, elapsedMs);
            } else {
                run.recordFailure(new FileFailure(filePath, describe(error, timeoutMs), elapsedMs));
            }
            return null;
        });
    }

    private <T> IoTask<T> readAndProcess(Path path, FileContentProcessor<T> processor) {
        return () -> {
            String content = Files.readString(path, StandardCharsets.UTF_8);
            return processor.process(path, content);
        };
    }

    private FileWriteResult write(Path path, String content) throws IOException {
        Path parent = path.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        byte[] bytes = content.getBytes(StandardCharsets.UTF_8);
        Files.write(path, bytes);
        return new FileWriteResult(path.toString(), bytes.length);
    }

    static String describe(Throwable error, long timeoutMs) {
        Throwable cause = error;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException
                || cause instanceof UncheckedIOException) && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof TimeoutException) {
            return "Operation timed out after " + timeoutMs + "ms";
        }
        String message = cause.getMessage();
        return message != null ? message : cause.getClass().getSimpleName();
    }

    private static void validate(ProcessingSettings settings) {
        if (settings.getBatchSize() <= 0) {
            throw new IllegalArgumentException("Batch size must be greater than 0");
        }
        if (settings.getMaxConcurrentReads() <= 0 || settings.getMaxConcurrentWrites() <= 0) {
            throw new IllegalArgumentException("Concurrency limits must be greater than 0");
        }
    }

    private static long toMillis(long nanos) {
        return Math.round(nanos / NANOS_PER_MILLI);
    }

    @FunctionalInterface
    private interface IoTask<T> {
        T run() throws IOException;
    }

    /**
     * Per-run results, filled concurrently by completion callbacks.
     */
    private static final class RunAccumulator<T> {

        private final boolean trackTiming;
        private final List<T> successful = new ArrayList<>();
        private final List<FileFailure> failed = new ArrayList<>();
        private final List<String> processingOrder = new ArrayList<>();
        private final List<Long> processingTimes = new ArrayList<>();
        private long totalQueueWaitMs;
        private int queueWaitSamples;

        private RunAccumulator(boolean trackTiming) {
            this.trackTiming = trackTiming;
        }

        private synchronized void recordQueueWait(long waitMs) {
            totalQueueWaitMs += waitMs;
            queueWaitSamples++;
        }

        private synchronized void recordSuccess(String filePath, T value, long elapsedMs) {
            successful.add(value);
            processingOrder.add(filePath);
            if (trackTiming) {
                processingTimes.add(elapsedMs);
            }
        }

        private synchronized void recordFailure(FileFailure failure) {
            failed.add(failure);
            processingOrder.add(failure.filePath());
            if (trackTiming) {
                processingTimes.add(failure.processingTimeMs());
            }
        }

        private synchronized int successCount() {
            return successful.size();
        }

        private synchronized int failureCount() {
            return failed.size();
        }

        private synchronized ProcessingStats toStats(long totalMs, SemaphoreStats semaphoreStats) {
            ProcessingStats.ProcessingStatsBuilder stats = ProcessingStats.builder()
                    .totalFiles(successful.size() + failed.size())
                    .successfulFiles(successful.size())
                    .failedFiles(failed.size())
                    .concurrencyUtilization(
                            semaphoreStats.getPeakPermitsInUse() * 100.0 / semaphoreStats.getMaxPermits());
            if (!trackTiming) {
                return stats.build();
            }
            long min = processingTimes.stream().mapToLong(Long::longValue).min().orElse(0);
            long max = processingTimes.stream().mapToLong(Long::longValue).max().orElse(0);
            double avg = processingTimes.stream().mapToLong(Long::longValue).average().orElse(0);
            return stats
                    .minProcessingTimeMs(min)
                    .maxProcessingTimeMs(max)
                    .averageProcessingTimeMs(avg)
                    .averageQueueWaitMs(queueWaitSamples == 0 ? 0 : (double) totalQueueWaitMs / queueWaitSamples)
                    .totalProcessingTimeMs(totalMs)
                    .build();
        }

        private synchronized BatchProcessingResult<T> toResult(ProcessingStats stats) {
            return BatchProcessingResult.<T>builder()
                    .successful(Collections.unmodifiableList(new ArrayList<>(successful)))
                    .failed(Collections.unmodifiableList(new ArrayList<>(failed)))
                    .processingOrder(Collections.unmodifiableList(new ArrayList<>(processingOrder)))
                    .stats(stats)
                    .build();
        }
    }
}
