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

import me.golemcore.prompter.concurrency.ConcurrentFileProcessor;
import me.golemcore.prompter.concurrency.ProcessingSettings;
import me.golemcore.prompter.domain.model.BatchProcessingResult;
import me.golemcore.prompter.domain.model.CacheValidationResult;
import me.golemcore.prompter.domain.model.FileFailure;
import me.golemcore.prompter.domain.model.FileStat;
import me.golemcore.prompter.domain.model.IndexRebuildResult;
import me.golemcore.prompter.domain.model.IndexState;
import me.golemcore.prompter.domain.model.ProcessingStats;
import me.golemcore.prompter.domain.model.SessionIndexStats;
import me.golemcore.prompter.domain.model.SessionMetadataCache;
import me.golemcore.prompter.domain.model.SessionMetadataUpdate;
import me.golemcore.prompter.domain.service.SessionMetadataExtractor.MalformedSessionException;
import me.golemcore.prompter.infrastructure.config.PrompterProperties;
import me.golemcore.prompter.port.outbound.StoragePort;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Owner of the persisted session metadata index: one
 * {@link SessionMetadataCache} per session file, kept in memory and mirrored to
 * {@code <sessions>/.metadata-cache.json}.
 *
 * <p>
 * The index moves from {@link IndexState#UNINITIALIZED} to
 * {@link IndexState#LOADED}, either directly from the index file or through a
 * full {@link IndexState#REBUILDING rebuild}. A rebuild may be triggered again
 * at any time; it writes into the live map, so concurrent reads keep being
 * served while it runs.
 *
 * <p>
 * Per-file problems are logged and turn into missing entries. Failing to
 * persist the index raises {@link SessionIndexPersistenceException} to the
 * caller of the operation that triggered the write.
 *
 * <p>
 * Concurrent updates of the same session id are last-writer-wins.
 *
 * @since 1.0
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SessionCacheManager {

    private static final String SESSION_EXTENSION = ".json";

    private static final TypeReference<LinkedHashMap<String, SessionMetadataCache>> INDEX_TYPE = new TypeReference<>() {
    };

    private final StoragePort storagePort;
    private final ConcurrentFileProcessor fileProcessor;
    private final SessionMetadataExtractor extractor;
    private final ObjectMapper objectMapper;
    private final PrompterProperties properties;
    private final Clock clock;

    private final Map<String, SessionMetadataCache> index = new ConcurrentHashMap<>();
    private final Object lifecycleLock = new Object();
    private final Object persistLock = new Object();

    private volatile IndexState state = IndexState.UNINITIALIZED;
    private volatile Instant lastCacheUpdate;
    private volatile Instant lastCacheRebuild;
    private volatile long lastRebuildDurationMs;

    /**
     * Loads the index file, or rebuilds the index when the file is missing,
     * unreadable, or written by another cache version. Does nothing once the
     * index is loaded.
     */
    public void initialize() {
        synchronized (lifecycleLock) {
            if (state == IndexState.LOADED) {
                return;
            }
            storagePort.ensureDirectory(sessionsDir()).join();

            Optional<Map<String, SessionMetadataCache>> persisted = loadIndexFile();
            if (persisted.isPresent()) {
                index.clear();
                index.putAll(persisted.get());
                lastCacheUpdate = clock.instant();
                state = IndexState.LOADED;
                log.info("[SessionCache] Loaded index with {} sessions", index.size());
                return;
            }
            rebuildCache();
        }
    }

    /**
     * Re-extracts every session file and persists the result. Files that fail
     * are left out of the index.
     */
    public IndexRebuildResult rebuildCache() {
        synchronized (lifecycleLock) {
            IndexState previous = state;
            state = IndexState.REBUILDING;
            Instant started = clock.instant();
            BatchProcessingResult<SessionMetadataCache> result;
            try {
                List<Path> files = listSessionFiles().stream()
                        .map(name -> storagePort.resolve(sessionsDir(), name))
                        .toList();
                log.info("[SessionCache] Rebuilding index from {} session files", files.size());
                result = fileProcessor.processFilesInBatches(files, (path, content) -> {
                    SessionMetadataCache entry = extractor.extract(sessionIdOf(path), path, content);
                    index.put(entry.getSessionId(), entry);
                    return entry;
                });
            } catch (RuntimeException e) {
                state = previous;
                throw e;
            }

            Set<String> seen = new HashSet<>();
            for (SessionMetadataCache entry : result.getSuccessful()) {
                seen.add(entry.getSessionId());
            }
            index.keySet().retainAll(seen);
            for (FileFailure failure : result.getFailed()) {
                log.warn("[SessionCache] Skipping session file {}: {}", failure.filePath(), failure.error());
            }

            Instant finished = clock.instant();
            lastCacheRebuild = finished;
            lastRebuildDurationMs = Duration.between(started, finished).toMillis();
            state = IndexState.LOADED;
            saveIndex();

            log.info("[SessionCache] Index rebuilt: {} indexed, {} failed in {}ms",
                    seen.size(), result.getFailed().size(), lastRebuildDurationMs);
            return IndexRebuildResult.builder()
                    .indexed(seen.size())
                    .failed(result.getFailed().size())
                    .failures(result.getFailed())
                    .durationMs(lastRebuildDurationMs)
                    .build();
        }
    }

    /**
     * Index entry for a session, re-extracted from its file when the cached
     * entry is missing, expired or older than the file. The caller gets a copy;
     * changing it does not touch the index.
     *
     * @return empty when the session file is gone or malformed
     */
    public Optional<SessionMetadataCache> getSessionMetadata(String sessionId) {
        requireInitialized();
        SessionMetadataCache cached = index.get(sessionId);
        if (cached != null && validateCacheEntry(cached).isValid()) {
            return Optional.of(copyOf(cached));
        }
        return refreshSessionMetadata(sessionId);
    }

    /**
     * Re-extracts one session file regardless of the cached entry and persists
     * the index.
     */
    public Optional<SessionMetadataCache> refreshSessionMetadata(String sessionId) {
        requireInitialized();
        String fileName = fileNameOf(sessionId);
        String content;
        try {
            content = storagePort.getText(sessionsDir(), fileName).join();
        } catch (CompletionException e) {
            log.warn("[SessionCache] Failed to read session {}: {}", sessionId, rootMessage(e));
            return Optional.empty();
        }
        if (content == null) {
            removeAndPersist(sessionId);
            return Optional.empty();
        }

        SessionMetadataCache fresh;
        try {
            fresh = extractor.extract(sessionId, storagePort.resolve(sessionsDir(), fileName), content);
        } catch (MalformedSessionException e) {
            log.warn("[SessionCache] Malformed session file {}: {}", fileName, e.getMessage());
            removeAndPersist(sessionId);
            return Optional.empty();
        }
        index.put(sessionId, fresh);
        saveIndex();
        return Optional.of(copyOf(fresh));
    }

    /**
     * Copies of every indexed entry, most recently accessed first. Entries are
     * returned as cached; staleness is only resolved by
     * {@link #getSessionMetadata(String)}.
     */
    public List<SessionMetadataCache> getAllSessionMetadata() {
        requireInitialized();
        return sortByLastAccessed(index.values().stream().map(SessionCacheManager::copyOf).toList());
    }

    /**
     * Case-insensitive substring search over project name, description, tags,
     * languages and patterns of indexed entries.
     */
    public List<SessionMetadataCache> searchMetadata(String query) {
        requireInitialized();
        String needle = query == null ? "" : query.toLowerCase(Locale.ROOT);
        List<SessionMetadataCache> matches = new ArrayList<>();
        for (SessionMetadataCache entry : index.values()) {
            if (searchableText(entry).contains(needle)) {
                matches.add(copyOf(entry));
            }
        }
        return sortByLastAccessed(matches);
    }

    /**
     * Applies the non-null fields of {@code update} to an indexed entry.
     *
     * @return false if the session is not indexed
     */
    public boolean updateSessionMetadata(String sessionId, SessionMetadataUpdate update) {
        requireInitialized();
        SessionMetadataCache existing = index.get(sessionId);
        if (existing == null) {
            return false;
        }
        SessionMetadataCache.SessionMetadataCacheBuilder updated = existing.toBuilder()
                .lastCacheUpdate(clock.instant());
        if (update.getProjectName() != null) {
            updated.projectName(update.getProjectName());
        }
        if (update.getDescription() != null) {
            updated.description(update.getDescription());
        }
        if (update.getStatus() != null) {
            updated.status(update.getStatus());
        }
        if (update.getTags() != null) {
            updated.tags(new ArrayList<>(update.getTags()));
        }
        if (update.getLastAccessed() != null) {
            updated.lastAccessed(update.getLastAccessed());
        }
        index.put(sessionId, updated.build());
        saveIndex();
        return true;
    }

    public void invalidateSessionCache(String sessionId) {
        requireInitialized();
        index.remove(sessionId);
        saveIndex();
    }

    /**
     * Removes every entry that fails {@link #validateCacheEntry}: missing
     * files, files changed since extraction, and entries past the maximum age.
     *
     * @return number of removed entries
     */
    public int cleanupStaleEntries() {
        requireInitialized();
        int removed = 0;
        for (SessionMetadataCache entry : new ArrayList<>(index.values())) {
            CacheValidationResult validation = validateCacheEntry(entry);
            if (!validation.isValid() && index.remove(entry.getSessionId(), entry)) {
                log.debug("[SessionCache] Removing stale entry {}: {}", entry.getSessionId(),
                        validation.getReason());
                removed++;
            }
        }
        saveIndex();
        if (removed > 0) {
            log.info("[SessionCache] Removed {} stale entries", removed);
        }
        return removed;
    }

    /**
     * An entry is valid while it is younger than the maximum cache age and its
     * file has not been modified since the entry was computed.
     */
    public CacheValidationResult validateCacheEntry(SessionMetadataCache entry) {
        Optional<FileStat> stat;
        try {
            stat = storagePort.stat(sessionsDir(), fileNameOf(entry.getSessionId())).join();
        } catch (CompletionException e) {
            return CacheValidationResult.builder()
                    .valid(false)
                    .reason("File not accessible: " + rootMessage(e))
                    .fileExists(false)
                    .build();
        }
        if (stat.isEmpty()) {
            return CacheValidationResult.builder()
                    .valid(false)
                    .reason("File not found")
                    .fileExists(false)
                    .build();
        }

        Instant lastModified = stat.get().lastModified();
        CacheValidationResult.CacheValidationResultBuilder result = CacheValidationResult.builder()
                .lastModified(lastModified)
                .fileExists(true);
        Instant computedAt = entry.getLastCacheUpdate();
        if (computedAt == null) {
            return result.valid(false).reason("Entry has no update time").build();
        }
        long ageMs = Duration.between(computedAt, clock.instant()).toMillis();
        if (ageMs >= properties.getCache().getMaxMetadataCacheAgeMs()) {
            return result.valid(false).reason("Entry expired").build();
        }
        if (lastModified.isAfter(computedAt)) {
            return result.valid(false).reason("File modified after entry was computed").build();
        }
        return result.valid(true).build();
    }

    public SessionIndexStats getCacheStats() {
        long memory = 0;
        for (SessionMetadataCache entry : index.values()) {
            try {
                memory += objectMapper.writeValueAsString(entry).length() * 2L;
            } catch (JsonProcessingException e) {
                log.debug("[SessionCache] Could not size entry {}", entry.getSessionId());
            }
        }
        return SessionIndexStats.builder()
                .size(index.size())
                .state(state)
                .lastCacheUpdate(lastCacheUpdate)
                .lastCacheRebuild(lastCacheRebuild)
                .lastRebuildDurationMs(lastRebuildDurationMs)
                .estimatedMemoryUsage(memory)
                .build();
    }

    public IndexState getState() {
        return state;
    }

    public ProcessingStats getProcessingStats() {
        return fileProcessor.getStats();
    }

    public void reconfigureProcessing(ProcessingSettings settings) {
        fileProcessor.reconfigure(settings);
    }

    /**
     * Releases file processor bookkeeping. The in-memory index stays readable.
     */
    public void cleanup() {
        fileProcessor.cleanup();
    }

    private Optional<Map<String, SessionMetadataCache>> loadIndexFile() {
        String indexFile = properties.getCache().getIndexFileName();
        String json;
        try {
            json = storagePort.getText(sessionsDir(), indexFile).join();
        } catch (CompletionException e) {
            log.warn("[SessionCache] Failed to read index file, rebuilding: {}", rootMessage(e));
            return Optional.empty();
        }
        if (json == null) {
            log.info("[SessionCache] No index file found, rebuilding");
            return Optional.empty();
        }

        Map<String, SessionMetadataCache> entries;
        try {
            entries = objectMapper.readValue(json, INDEX_TYPE);
        } catch (JsonProcessingException e) {
            log.warn("[SessionCache] Corrupt index file, rebuilding: {}", e.getOriginalMessage());
            return Optional.empty();
        }
        if (entries == null) {
            log.warn("[SessionCache] Empty index document, rebuilding");
            return Optional.empty();
        }
        for (Map.Entry<String, SessionMetadataCache> entry : entries.entrySet()) {
            SessionMetadataCache value = entry.getValue();
            if (value == null || !entry.getKey().equals(value.getSessionId())) {
                log.warn("[SessionCache] Index entry {} does not match its key, rebuilding", entry.getKey());
                return Optional.empty();
            }
            if (!SessionMetadataExtractor.CACHE_VERSION.equals(value.getCacheVersion())) {
                log.info("[SessionCache] Index version {} is outdated, rebuilding", value.getCacheVersion());
                return Optional.empty();
            }
        }
        return Optional.of(entries);
    }

    private void saveIndex() {
        synchronized (persistLock) {
            try {
                String json = objectMapper.writerWithDefaultPrettyPrinter()
                        .writeValueAsString(new TreeMap<>(index));
                storagePort.putTextAtomic(sessionsDir(), properties.getCache().getIndexFileName(), json, false)
                        .join();
                lastCacheUpdate = clock.instant();
            } catch (JsonProcessingException | RuntimeException e) {
                throw new SessionIndexPersistenceException("Failed to persist session index", e);
            }
        }
    }

    private void removeAndPersist(String sessionId) {
        if (index.remove(sessionId) != null) {
            saveIndex();
        }
    }

    private List<String> listSessionFiles() {
        return storagePort.listObjects(sessionsDir()).join().stream()
                .filter(name -> name.endsWith(SESSION_EXTENSION) && !name.startsWith("."))
                .toList();
    }

    private void requireInitialized() {
        if (state == IndexState.UNINITIALIZED) {
            throw new IllegalStateException("Session index is not initialized");
        }
    }

    private String sessionsDir() {
        return properties.getStorage().getDirectories().getSessions();
    }

    private static String fileNameOf(String sessionId) {
        return sessionId + SESSION_EXTENSION;
    }

    private static String sessionIdOf(Path path) {
        String fileName = path.getFileName().toString();
        return fileName.substring(0, fileName.length() - SESSION_EXTENSION.length());
    }

    private static String searchableText(SessionMetadataCache entry) {
        List<String> parts = new ArrayList<>();
        parts.add(entry.getProjectName());
        parts.add(entry.getDescription());
        addAll(parts, entry.getTags());
        addAll(parts, entry.getLanguages());
        addAll(parts, entry.getPatterns());
        StringBuilder text = new StringBuilder();
        for (String part : parts) {
            if (part != null) {
                text.append(part).append(' ');
            }
        }
        return text.toString().toLowerCase(Locale.ROOT);
    }

    private static void addAll(List<String> target, List<String> values) {
        if (values != null) {
            target.addAll(values);
        }
    }

    private static SessionMetadataCache copyOf(SessionMetadataCache entry) {
        return entry.toBuilder()
                .tags(copyList(entry.getTags()))
                .languages(copyList(entry.getLanguages()))
                .patterns(copyList(entry.getPatterns()))
                .build();
    }

    private static List<String> copyList(List<String> values) {
        return values != null ? new ArrayList<>(values) : new ArrayList<>();
    }

    private static List<SessionMetadataCache> sortByLastAccessed(Collection<SessionMetadataCache> entries) {
        List<SessionMetadataCache> sorted = new ArrayList<>(entries);
        sorted.sort(Comparator.comparing(SessionMetadataCache::getLastAccessed,
                Comparator.nullsLast(Comparator.<Instant>reverseOrder())));
        return sorted;
    }

    private static String rootMessage(Throwable error) {
        Throwable cause = error;
        while (cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }

    /**
     * The in-memory index could not be written to disk. Memory and disk now
     * disagree; retrying the operation is safe.
     */
    public static class SessionIndexPersistenceException extends RuntimeException {
        private static final long serialVersionUID = 1L;

        public SessionIndexPersistenceException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
