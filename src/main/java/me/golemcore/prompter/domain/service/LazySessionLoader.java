package me.golemcore.prompter.domain.service;

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

import me.golemcore.prompter.cache.LRUCache;
import me.golemcore.prompter.concurrency.Semaphore;
import me.golemcore.prompter.domain.model.BatchOperationResult;
import me.golemcore.prompter.domain.model.ContentSearchResult;
import me.golemcore.prompter.domain.model.ContentSearchResult.ContentMatch;
import me.golemcore.prompter.domain.model.ContentSearchResult.MatchType;
import me.golemcore.prompter.domain.model.ConversationEntry;
import me.golemcore.prompter.domain.model.FileStat;
import me.golemcore.prompter.domain.model.LazyLoadOptions;
import me.golemcore.prompter.domain.model.LazySessionData;
import me.golemcore.prompter.domain.model.LoaderCacheStats;
import me.golemcore.prompter.domain.model.LruCacheStats;
import me.golemcore.prompter.domain.model.Session;
import me.golemcore.prompter.domain.model.SessionContext;
import me.golemcore.prompter.domain.model.SessionMetadata;
import me.golemcore.prompter.domain.model.SessionMetadataCache;
import me.golemcore.prompter.domain.service.SessionMetadataExtractor.MalformedSessionException;
import me.golemcore.prompter.infrastructure.config.PrompterProperties;
import me.golemcore.prompter.port.outbound.StoragePort;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * On-demand loading of session bodies on top of {@link SessionCacheManager}.
 *
 * <p>
 * Metadata always comes from the index; history and context are read from the
 * session file only when asked for. Whatever was materialized is kept in a
 * bounded {@link LRUCache}. A cached entry answers a request only when it
 * already holds every requested part; otherwise the missing parts are loaded
 * and merged into it, as long as the file has not changed since the cached
 * parts were read.
 *
 * <p>
 * Cached data is provisional: use {@link #validateCachedSession(String)} before
 * relying on it for anything correctness-sensitive.
 *
 * @since 1.0
 */
@Service
@Slf4j
public class LazySessionLoader {

    private static final String SESSION_EXTENSION = ".json";
    private static final int LOAD_TIME_SAMPLES = 100;
    private static final long EXECUTOR_TERMINATION_TIMEOUT_SECONDS = 5;
    private static final double NANOS_PER_MILLI = 1_000_000.0;

    private final SessionCacheManager cacheManager;
    private final StoragePort storagePort;
    private final SessionMetadataExtractor extractor;
    private final PrompterProperties properties;
    private final Clock clock;
    private final LRUCache<LazySessionData> sessionDataCache;
    private final Deque<Double> loadTimes = new ArrayDeque<>();

    private final AtomicInteger threadCounter = new AtomicInteger();
    private final ExecutorService loaderExecutor = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "session-loader-" + threadCounter.incrementAndGet());
        t.setDaemon(true);
        return t;
    });

    public LazySessionLoader(SessionCacheManager cacheManager, StoragePort storagePort,
            SessionMetadataExtractor extractor, ObjectMapper objectMapper, PrompterProperties properties,
            Clock clock) {
        this.cacheManager = cacheManager;
        this.storagePort = storagePort;
        this.extractor = extractor;
        this.properties = properties;
        this.clock = clock;
        this.sessionDataCache = new LRUCache<>(properties.getCache().getMaxSessionDataCacheSize(), clock,
                objectMapper);
    }

    /**
     * Loads the requested parts of a session, reusing cached parts where
     * possible.
     *
     * @return empty when the session has no metadata (missing or malformed file)
     * @throws IllegalArgumentException
     *             for a negative page or a non-positive limit
     */
    public Optional<LazySessionData> loadSessionLazy(String sessionId, LazyLoadOptions options) {
        validateWindow(options.getHistoryPage(), options.getHistoryLimit());
        long started = System.nanoTime();

        if (!options.isForceRefresh()) {
            Optional<LazySessionData> cached = sessionDataCache.get(sessionId);
            if (cached.isPresent() && satisfies(cached.get(), options)) {
                return cached;
            }
        }

        Optional<SessionMetadataCache> metadata = cacheManager.getSessionMetadata(sessionId);
        if (metadata.isEmpty()) {
            sessionDataCache.delete(sessionId);
            return Optional.empty();
        }

        LazySessionData previous = options.isForceRefresh() ? null : reusable(sessionId);
        boolean carried = false;

        LazySessionData.LazySessionDataBuilder data = LazySessionData.builder().metadata(metadata.get());
        List<ConversationEntry> history = null;
        SessionContext context = null;
        boolean readFile = options.isIncludeHistory() || options.isIncludeContext();
        Instant readAt = clock.instant();
        Optional<String> content = readFile ? readSessionFile(sessionId) : Optional.empty();

        if (options.isIncludeHistory()) {
            history = paginate(historyOf(sessionId, content), options.getHistoryPage(), options.getHistoryLimit());
            data.historyPage(options.getHistoryPage()).historyLimit(options.getHistoryLimit());
        } else if (previous != null && previous.hasHistory()) {
            history = previous.getHistory();
            data.historyPage(previous.getHistoryPage()).historyLimit(previous.getHistoryLimit());
            carried = true;
        }

        if (options.isIncludeContext()) {
            context = contextOf(sessionId, content);
        } else if (previous != null && previous.hasContext()) {
            context = previous.getContext();
            carried = true;
        }

        LazySessionData loaded = data
                .history(history)
                .context(context)
                .fullyLoaded(history != null && context != null)
                .loadedAt(carried ? previous.getLoadedAt() : readAt)
                .build();
        sessionDataCache.set(sessionId, loaded);
        recordLoadTime((System.nanoTime() - started) / NANOS_PER_MILLI);
        return Optional.of(loaded);
    }

    /**
     * Loads metadata, full history and context and converts them back into a
     * {@link Session}.
     */
    public Optional<Session> loadFullSession(String sessionId) {
        return loadSessionLazy(sessionId, LazyLoadOptions.full())
                .filter(data -> data.getHistory() != null && data.getContext() != null)
                .map(data -> {
                    SessionMetadataCache metadata = data.getMetadata();
                    return Session.builder()
                            .metadata(SessionMetadata.builder()
                                    .sessionId(metadata.getSessionId())
                                    .projectName(metadata.getProjectName())
                                    .createdDate(metadata.getCreatedDate())
                                    .lastAccessed(metadata.getLastAccessed())
                                    .status(metadata.getStatus())
                                    .description(metadata.getDescription())
                                    .tags(new ArrayList<>(metadata.getTags()))
                                    .build())
                            .history(new ArrayList<>(data.getHistory()))
                            .context(data.getContext())
                            .build();
                });
    }

    /**
     * History of a session. With page and limit the window
     * {@code [page * limit, page * limit + limit)} is returned; with only a
     * limit, the most recent {@code limit} entries; otherwise everything.
     *
     * @return empty list when the file is missing, unreadable or malformed
     */
    public List<ConversationEntry> loadSessionHistory(String sessionId, Integer page, Integer limit) {
        validateWindow(page, limit);
        return paginate(historyOf(sessionId, readSessionFile(sessionId)), page, limit);
    }

    public List<ConversationEntry> getHistoryPage(String sessionId, int page, int limit) {
        return loadSessionHistory(sessionId, page, limit);
    }

    /**
     * Context of a session, or an empty context when the file cannot be read.
     */
    public SessionContext loadSessionContext(String sessionId) {
        return contextOf(sessionId, readSessionFile(sessionId));
    }

    /**
     * History in chunks of {@code chunkSize}. Each iteration starts again from
     * the first page, and each chunk re-reads the file, so entries appended
     * between chunks are observed. Iteration ends after a short or empty chunk.
     */
    public Iterable<List<ConversationEntry>> streamSessionHistory(String sessionId, int chunkSize) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("Chunk size must be greater than 0");
        }
        return () -> new HistoryChunkIterator(sessionId, chunkSize);
    }

    /**
     * Warms the cache for several sessions with at most
     * {@code prompter.loader.preload-concurrency} loads in flight. One failing
     * load never stops the others.
     */
    public BatchOperationResult preloadSessions(List<String> sessionIds, LazyLoadOptions options) {
        Instant started = clock.instant();
        Semaphore gate = new Semaphore(properties.getLoader().getPreloadConcurrency());
        List<CompletableFuture<Optional<LazySessionData>>> loads = new ArrayList<>(sessionIds.size());
        for (String sessionId : sessionIds) {
            loads.add(gate.execute(() -> CompletableFuture.supplyAsync(
                    () -> loadSessionLazy(sessionId, options), loaderExecutor), 0));
        }

        int successful = 0;
        List<BatchOperationResult.SessionError> errors = new ArrayList<>();
        for (int i = 0; i < loads.size(); i++) {
            String sessionId = sessionIds.get(i);
            try {
                if (loads.get(i).join().isPresent()) {
                    successful++;
                } else {
                    errors.add(new BatchOperationResult.SessionError(sessionId, "Session not found"));
                }
            } catch (CompletionException e) {
                String message = e.getCause() != null ? e.getCause().getMessage() : e.getMessage();
                log.warn("[LazyLoader] Preload of {} failed: {}", sessionId, message);
                errors.add(new BatchOperationResult.SessionError(sessionId, message));
            }
        }
        return BatchOperationResult.builder()
                .successful(successful)
                .failed(errors.size())
                .errors(errors)
                .totalTimeMs(clock.millis() - started.toEpochMilli())
                .build();
    }

    /**
     * Cached data without touching the disk.
     */
    public Optional<LazySessionData> getFromCache(String sessionId) {
        return sessionDataCache.get(sessionId);
    }

    public boolean evictFromCache(String sessionId) {
        return sessionDataCache.delete(sessionId);
    }

    public void clearCache() {
        sessionDataCache.clear();
        synchronized (loadTimes) {
            loadTimes.clear();
        }
    }

    /**
     * Checks a cached session against its file and evicts it when the file was
     * modified after the data was loaded or no longer exists.
     *
     * @return true if a cached entry exists and is still current
     */
    public boolean validateCachedSession(String sessionId) {
        Optional<LazySessionData> cached = sessionDataCache.peek(sessionId);
        if (cached.isEmpty()) {
            return false;
        }
        if (unchangedSince(sessionId, cached.get().getLoadedAt())) {
            return true;
        }
        sessionDataCache.delete(sessionId);
        return false;
    }

    /**
     * Evicts entries untouched for {@code prompter.loader.optimize-max-age-ms}.
     *
     * @return number of evicted entries
     */
    public int optimizeCache() {
        int evicted = sessionDataCache.evictOlderThan(properties.getLoader().getOptimizeMaxAgeMs());
        if (evicted > 0) {
            log.debug("[LazyLoader] Evicted {} idle sessions from cache", evicted);
        }
        return evicted;
    }

    /**
     * Metadata of many sessions, fetched in groups of
     * {@code prompter.loader.bulk-metadata-batch-size}. Sessions that cannot be
     * loaded are left out; the rest keep their input order.
     */
    public List<SessionMetadataCache> bulkLoadMetadata(List<String> sessionIds) {
        int batchSize = properties.getLoader().getBulkMetadataBatchSize();
        List<SessionMetadataCache> results = new ArrayList<>();
        for (int start = 0; start < sessionIds.size(); start += batchSize) {
            List<String> batch = sessionIds.subList(start, Math.min(start + batchSize, sessionIds.size()));
            List<CompletableFuture<Optional<SessionMetadataCache>>> lookups = new ArrayList<>(batch.size());
            for (String sessionId : batch) {
                lookups.add(CompletableFuture.supplyAsync(() -> cacheManager.getSessionMetadata(sessionId),
                        loaderExecutor));
            }
            for (int i = 0; i < lookups.size(); i++) {
                try {
                    lookups.get(i).join().ifPresent(results::add);
                } catch (CompletionException e) {
                    log.debug("[LazyLoader] Skipping metadata of {}: {}", batch.get(i), e.getMessage());
                }
            }
        }
        return results;
    }

    /**
     * Case-insensitive search through the prompts and responses of the given
     * sessions. Sessions that cannot be read are skipped.
     */
    public List<ContentSearchResult> searchSessionContent(List<String> sessionIds, String query) {
        String needle = query.toLowerCase(Locale.ROOT);
        List<ContentSearchResult> results = new ArrayList<>();
        for (String sessionId : sessionIds) {
            try {
                Optional<SessionMetadataCache> metadata = cacheManager.getSessionMetadata(sessionId);
                if (metadata.isEmpty()) {
                    continue;
                }
                List<ConversationEntry> history = loadSessionHistory(sessionId, null, null);
                List<ContentMatch> matches = new ArrayList<>();
                for (int i = 0; i < history.size(); i++) {
                    ConversationEntry entry = history.get(i);
                    if (contains(entry.getPrompt(), needle)) {
                        matches.add(new ContentMatch(MatchType.PROMPT, entry.getPrompt(), i));
                    }
                    if (contains(entry.getResponse(), needle)) {
                        matches.add(new ContentMatch(MatchType.RESPONSE, entry.getResponse(), i));
                    }
                }
                if (!matches.isEmpty()) {
                    results.add(ContentSearchResult.builder()
                            .sessionId(sessionId)
                            .metadata(metadata.get())
                            .matches(matches)
                            .build());
                }
            } catch (RuntimeException e) { // NOSONAR
                log.warn("[LazyLoader] Failed to search session {}: {}", sessionId, e.getMessage());
            }
        }
        return results;
    }

    public LoaderCacheStats getCacheStats() {
        LruCacheStats stats = sessionDataCache.getStats();
        double averageLoadTime;
        synchronized (loadTimes) {
            averageLoadTime = loadTimes.stream().mapToDouble(Double::doubleValue).average().orElse(0);
        }
        return LoaderCacheStats.builder()
                .size(stats.getSize())
                .maxSize(stats.getMaxSize())
                .hitRate(stats.getHitRate())
                .averageLoadTimeMs(averageLoadTime)
                .estimatedMemoryUsage(sessionDataCache.estimateMemoryUsage())
                .build();
    }

    @PreDestroy
    public void shutdown() {
        loaderExecutor.shutdownNow();
        try {
            loaderExecutor.awaitTermination(EXECUTOR_TERMINATION_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        sessionDataCache.clear();
    }

    private boolean satisfies(LazySessionData cached, LazyLoadOptions options) {
        if (options.isIncludeHistory() && (!cached.hasHistory()
                || !Objects.equals(cached.getHistoryPage(), options.getHistoryPage())
                || !Objects.equals(cached.getHistoryLimit(), options.getHistoryLimit()))) {
            return false;
        }
        return !options.isIncludeContext() || cached.hasContext();
    }

    private LazySessionData reusable(String sessionId) {
        Optional<LazySessionData> cached = sessionDataCache.peek(sessionId);
        if (cached.isEmpty() || !unchangedSince(sessionId, cached.get().getLoadedAt())) {
            return null;
        }
        return cached.get();
    }

    private boolean unchangedSince(String sessionId, Instant loadedAt) {
        Optional<FileStat> stat;
        try {
            stat = storagePort.stat(sessionsDir(), sessionId + SESSION_EXTENSION).join();
        } catch (CompletionException e) {
            log.debug("[LazyLoader] Cannot stat session {}: {}", sessionId, e.getMessage());
            return false;
        }
        return stat.isPresent() && loadedAt != null && !stat.get().lastModified().isAfter(loadedAt);
    }

    private Optional<String> readSessionFile(String sessionId) {
        try {
            String content = storagePort.getText(sessionsDir(), sessionId + SESSION_EXTENSION).join();
            if (content == null) {
                log.warn("[LazyLoader] Session file not found: {}", sessionId);
            }
            return Optional.ofNullable(content);
        } catch (CompletionException e) {
            log.warn("[LazyLoader] Failed to read session {}: {}", sessionId, e.getMessage());
            return Optional.empty();
        }
    }

    private List<ConversationEntry> historyOf(String sessionId, Optional<String> content) {
        if (content.isEmpty()) {
            return Collections.emptyList();
        }
        try {
            return extractor.extractHistory(content.get());
        } catch (MalformedSessionException e) {
            log.warn("[LazyLoader] Failed to load history for session {}: {}", sessionId, e.getMessage());
            return Collections.emptyList();
        }
    }

    private SessionContext contextOf(String sessionId, Optional<String> content) {
        if (content.isEmpty()) {
            return SessionContext.empty();
        }
        try {
            return extractor.extractContext(content.get());
        } catch (MalformedSessionException e) {
            log.warn("[LazyLoader] Failed to load context for session {}: {}", sessionId, e.getMessage());
            return SessionContext.empty();
        }
    }

    private static List<ConversationEntry> paginate(List<ConversationEntry> history, Integer page, Integer limit) {
        if (limit == null) {
            return new ArrayList<>(history);
        }
        if (page == null) {
            return new ArrayList<>(history.subList(Math.max(0, history.size() - limit), history.size()));
        }
        long from = (long) page * limit;
        if (from >= history.size()) {
            return new ArrayList<>();
        }
        int to = (int) Math.min(from + limit, history.size());
        return new ArrayList<>(history.subList((int) from, to));
    }

    private static void validateWindow(Integer page, Integer limit) {
        if (page != null && page < 0) {
            throw new IllegalArgumentException("History page must not be negative: " + page);
        }
        if (limit != null && limit <= 0) {
            throw new IllegalArgumentException("History limit must be greater than 0: " + limit);
        }
    }

    private static boolean contains(String text, String lowerNeedle) {
        return text != null && text.toLowerCase(Locale.ROOT).contains(lowerNeedle);
    }

    private void recordLoadTime(double millis) {
        synchronized (loadTimes) {
            loadTimes.addLast(millis);
            if (loadTimes.size() > LOAD_TIME_SAMPLES) {
                loadTimes.removeFirst();
            }
        }
    }

    private String sessionsDir() {
        return properties.getStorage().getDirectories().getSessions();
    }

    private final class HistoryChunkIterator implements Iterator<List<ConversationEntry>> {

        private final String sessionId;
        private final int chunkSize;
        private int page;
        private List<ConversationEntry> next;
        private boolean finished;

        private HistoryChunkIterator(String sessionId, int chunkSize) {
            this.sessionId = sessionId;
            this.chunkSize = chunkSize;
        }

        @Override
        public boolean hasNext() {
            if (next != null) {
                return true;
            }
            if (finished) {
                return false;
            }
            List<ConversationEntry> chunk = loadSessionHistory(sessionId, page++, chunkSize);
            if (chunk.size() < chunkSize) {
                finished = true;
            }
            if (chunk.isEmpty()) {
                return false;
            }
            next = chunk;
            return true;
        }

        @Override
        public List<ConversationEntry> next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            List<ConversationEntry> chunk = next;
            next = null;
            return chunk;
        }
    }
}
