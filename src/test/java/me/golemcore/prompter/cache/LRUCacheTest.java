package me.golemcore.prompter.cache;

import me.golemcore.prompter.domain.model.LruCacheStats;
import me.golemcore.prompter.testsupport.MutableClock;
import me.golemcore.prompter.testsupport.SessionFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class LRUCacheTest {

    private MutableClock clock;
    private LRUCache<String> cache;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-01T12:00:00Z"));
        cache = new LRUCache<>(3, clock, SessionFixtures.objectMapper());
    }

    @Test
    void rejectsNonPositiveSize() {
        assertThrows(IllegalArgumentException.class, () -> new LRUCache<String>(0));
    }

    @Test
    void defaultSizeIsTwenty() {
        assertEquals(20, new LRUCache<String>().getMaxSize());
    }

    @Test
    void evictsLeastRecentlyUsedWhenFull() {
        cache.set("a", "A");
        cache.set("b", "B");
        cache.set("c", "C");

        cache.get("a");
        cache.set("d", "D");

        assertFalse(cache.containsKey("b"));
        assertEquals(List.of("c", "a", "d"), cache.keys());
        assertEquals(3, cache.size());
    }

    @Test
    void setOnExistingKeyReplacesAndTouches() {
        cache.set("a", "A");
        cache.set("b", "B");
        cache.set("a", "A2");

        assertEquals(List.of("b", "a"), cache.keys());
        assertEquals(Optional.of("A2"), cache.peek("a"));
        assertEquals(2, cache.size());
    }

    @Test
    void peekDoesNotAffectRecencyOrStats() {
        cache.set("a", "A");
        cache.set("b", "B");

        assertEquals(Optional.of("A"), cache.peek("a"));
        assertEquals(Optional.empty(), cache.peek("zzz"));

        assertEquals(List.of("a", "b"), cache.keys());
        LruCacheStats stats = cache.getStats();
        assertEquals(0, stats.getHits());
        assertEquals(0, stats.getMisses());
    }

    @Test
    void tracksHitRate() {
        cache.set("a", "A");
        cache.get("a");
        cache.get("a");
        cache.get("a");
        cache.get("missing");

        assertEquals(75.0, cache.getHitRate(), 0.001);
        LruCacheStats stats = cache.getStats();
        assertEquals(3, stats.getHits());
        assertEquals(1, stats.getMisses());
        assertEquals(3, stats.getMaxSize());
    }

    @Test
    void hitRateIsZeroWithoutLookups() {
        assertEquals(0.0, cache.getHitRate());
    }

    @Test
    void clearResetsEntriesAndStatistics() {
        cache.set("a", "A");
        cache.get("a");

        cache.clear();

        assertEquals(0, cache.size());
        assertEquals(0.0, cache.getHitRate());
        assertTrue(cache.keys().isEmpty());
    }

    @Test
    void deleteReportsWhetherKeyExisted() {
        cache.set("a", "A");

        assertTrue(cache.delete("a"));
        assertFalse(cache.delete("a"));
    }

    @Test
    void evictsEntriesIdleLongerThanMaxAge() {
        cache.set("old", "O");
        clock.advance(Duration.ofMinutes(10));
        cache.set("fresh", "F");

        int evicted = cache.evictOlderThan(Duration.ofMinutes(5).toMillis());

        assertEquals(1, evicted);
        assertEquals(List.of("fresh"), cache.keys());
    }

    @Test
    void accessRenewsAge() {
        cache.set("a", "A");
        clock.advance(Duration.ofMinutes(10));
        cache.get("a");

        assertEquals(0, cache.evictOlderThan(Duration.ofMinutes(5).toMillis()));
        assertTrue(cache.containsKey("a"));
    }

    @Test
    void leastRecentlyUsedOrderedByLastAccess() {
        cache.set("a", "A");
        clock.advance(Duration.ofSeconds(1));
        cache.set("b", "B");
        clock.advance(Duration.ofSeconds(1));
        cache.set("c", "C");
        clock.advance(Duration.ofSeconds(1));
        cache.get("a");

        assertEquals(List.of("b", "c"), cache.getLeastRecentlyUsed(2));
        assertTrue(cache.getLeastRecentlyUsed(-1).isEmpty());
    }

    @Test
    void statsReportOldestAndNewestEntries() {
        Instant first = clock.instant();
        cache.set("a", "A");
        clock.advance(Duration.ofSeconds(30));
        cache.set("b", "B");

        LruCacheStats stats = cache.getStats();
        assertEquals(first, stats.getOldestEntry());
        assertEquals(first.plusSeconds(30), stats.getNewestEntry());
    }

    @Test
    void estimatesMemoryFromJsonLength() {
        LRUCache<Map<String, String>> maps = new LRUCache<>(2, clock, SessionFixtures.objectMapper());
        maps.set("k", Map.of("x", "y"));

        // {"x":"y"} is 9 characters
        assertEquals(18, maps.estimateMemoryUsage());
    }

    @Test
    void valuesFollowRecencyOrder() {
        cache.set("a", "A");
        cache.set("b", "B");
        cache.get("a");

        assertEquals(List.of("B", "A"), cache.values());
    }
}
