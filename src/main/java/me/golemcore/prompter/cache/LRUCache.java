package me.golemcore.prompter.cache;

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

import me.golemcore.prompter.domain.model.LruCacheStats;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Bounded least-recently-used cache keyed by string.
 *
 * <p>
 * Backed by an insertion-ordered {@link LinkedHashMap} whose head is the least
 * recently used entry: every {@link #get} and {@link #set} re-inserts the entry
 * at the tail, and inserting beyond {@code maxSize} evicts the head. Entries can
 * also be evicted by age through {@link #evictOlderThan(long)}, independent of
 * capacity pressure.
 *
 * <p>
 * All methods are synchronized on the cache instance.
 *
 * @param <V>
 *            cached value type
 * @since 1.0
 */
public class LRUCache<V> {

    private static final int DEFAULT_MAX_SIZE = 20;
    private static final long UNSERIALIZABLE_ENTRY_BYTES = 1024;

    private final int maxSize;
    private final Clock clock;
    private final ObjectMapper objectMapper;
    private final LinkedHashMap<String, Entry<V>> entries;

    private long hits;
    private long misses;

    public LRUCache() {
        this(DEFAULT_MAX_SIZE);
    }

    public LRUCache(int maxSize) {
        this(maxSize, Clock.systemUTC(), defaultObjectMapper());
    }

    public LRUCache(int maxSize, Clock clock, ObjectMapper objectMapper) {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("LRU cache size must be greater than 0");
        }
        this.maxSize = maxSize;
        this.clock = clock;
        this.objectMapper = objectMapper;
        this.entries = new LinkedHashMap<>();
    }

    /**
     * Returns the value and marks it most recently used.
     */
    public synchronized Optional<V> get(String key) {
        Entry<V> entry = entries.get(key);
        if (entry == null) {
            misses++;
            return Optional.empty();
        }
        touch(key, entry, clock.instant());
        hits++;
        return Optional.of(entry.value);
    }

    /**
     * Returns the value without touching recency or hit statistics.
     */
    public synchronized Optional<V> peek(String key) {
        Entry<V> entry = entries.get(key);
        return entry == null ? Optional.empty() : Optional.of(entry.value);
    }

    /**
     * Inserts or replaces a value and marks it most recently used, evicting the
     * least recently used entry when the cache is full.
     */
    public synchronized void set(String key, V value) {
        Instant now = clock.instant();
        Entry<V> existing = entries.get(key);
        if (existing != null) {
            existing.value = value;
            touch(key, existing, now);
            return;
        }

        if (entries.size() >= maxSize) {
            Iterator<String> eldest = entries.keySet().iterator();
            eldest.next();
            eldest.remove();
        }
        entries.put(key, new Entry<>(value, now));
    }

    public synchronized boolean delete(String key) {
        return entries.remove(key) != null;
    }

    public synchronized boolean containsKey(String key) {
        return entries.containsKey(key);
    }

    /**
     * Removes every entry and resets hit statistics.
     */
    public synchronized void clear() {
        entries.clear();
        hits = 0;
        misses = 0;
    }

    /**
     * Keys from least to most recently used.
     */
    public synchronized List<String> keys() {
        return new ArrayList<>(entries.keySet());
    }

    public synchronized List<V> values() {
        List<V> values = new ArrayList<>(entries.size());
        for (Entry<V> entry : entries.values()) {
            values.add(entry.value);
        }
        return values;
    }

    public synchronized int size() {
        return entries.size();
    }

    public int getMaxSize() {
        return maxSize;
    }

    /**
     * Hit rate as a percentage (0-100).
     */
    public synchronized double getHitRate() {
        long total = hits + misses;
        return total == 0 ? 0 : hits * 100.0 / total;
    }

    public synchronized LruCacheStats getStats() {
        Instant oldest = null;
        Instant newest = null;
        for (Entry<V> entry : entries.values()) {
            if (oldest == null || entry.createdAt.isBefore(oldest)) {
                oldest = entry.createdAt;
            }
            if (newest == null || entry.createdAt.isAfter(newest)) {
                newest = entry.createdAt;
            }
        }
        return LruCacheStats.builder()
                .size(entries.size())
                .maxSize(maxSize)
                .hits(hits)
                .misses(misses)
                .hitRate(getHitRate())
                .oldestEntry(oldest)
                .newestEntry(newest)
                .build();
    }

    /**
     * Evicts entries whose last access is older than {@code maxAgeMs}.
     *
     * @return number of evicted entries
     */
    public synchronized int evictOlderThan(long maxAgeMs) {
        Instant cutoff = clock.instant().minus(Duration.ofMillis(maxAgeMs));
        int evicted = 0;
        Iterator<Entry<V>> iterator = entries.values().iterator();
        while (iterator.hasNext()) {
            if (iterator.next().lastAccessed.isBefore(cutoff)) {
                iterator.remove();
                evicted++;
            }
        }
        return evicted;
    }

    /**
     * The {@code count} least recently used keys, oldest first.
     */
    public synchronized List<String> getLeastRecentlyUsed(int count) {
        return entries.entrySet().stream()
                .sorted(Comparator.comparing(e -> e.getValue().lastAccessed))
                .limit(Math.max(0, count))
                .map(Map.Entry::getKey)
                .toList();
    }

    /**
     * Rough memory footprint based on the JSON length of every value, two bytes
     * per character.
     */
    public synchronized long estimateMemoryUsage() {
        long total = 0;
        for (Entry<V> entry : entries.values()) {
            try {
                total += objectMapper.writeValueAsString(entry.value).length() * 2L;
            } catch (JsonProcessingException e) {
                total += UNSERIALIZABLE_ENTRY_BYTES;
            }
        }
        return total;
    }

    private void touch(String key, Entry<V> entry, Instant now) {
        entry.lastAccessed = now;
        entries.remove(key);
        entries.put(key, entry);
    }

    private static ObjectMapper defaultObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        return mapper;
    }

    private static final class Entry<V> {
        private V value;
        private final Instant createdAt;
        private Instant lastAccessed;

        private Entry(V value, Instant now) {
            this.value = value;
            this.createdAt = now;
            this.lastAccessed = now;
        }
    }
}
