package me.golemcore.prompter.domain.service;

import me.golemcore.prompter.adapter.outbound.storage.LocalStorageAdapter;
import me.golemcore.prompter.concurrency.ConcurrentFileProcessor;
import me.golemcore.prompter.domain.model.BatchOperationResult;
import me.golemcore.prompter.domain.model.ContentSearchResult;
import me.golemcore.prompter.domain.model.ContentSearchResult.MatchType;
import me.golemcore.prompter.domain.model.ConversationEntry;
import me.golemcore.prompter.domain.model.LazyLoadOptions;
import me.golemcore.prompter.domain.model.LazySessionData;
import me.golemcore.prompter.domain.model.LoaderCacheStats;
import me.golemcore.prompter.domain.model.Session;
import me.golemcore.prompter.domain.model.SessionContext;
import me.golemcore.prompter.domain.model.SessionMetadataCache;
import me.golemcore.prompter.infrastructure.config.PrompterProperties;
import me.golemcore.prompter.testsupport.MutableClock;
import me.golemcore.prompter.testsupport.SessionFixtures;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class LazySessionLoaderTest {

    @TempDir
    Path tempDir;

    private Path sessionsDir;
    private MutableClock clock;
    private ObjectMapper objectMapper;
    private PrompterProperties properties;
    private LocalStorageAdapter storage;
    private ConcurrentFileProcessor fileProcessor;
    private SessionMetadataExtractor extractor;
    private SessionCacheManager cacheManager;
    private LazySessionLoader loader;

    @BeforeEach
    void setUp() {
        sessionsDir = tempDir.resolve("sessions");
        clock = new MutableClock(Instant.now().plusSeconds(5));
        objectMapper = SessionFixtures.objectMapper();
        properties = SessionFixtures.properties(tempDir);
        storage = new LocalStorageAdapter(properties);
        storage.init();
        fileProcessor = new ConcurrentFileProcessor();
        extractor = new SessionMetadataExtractor(objectMapper, new TopicClassifier(), clock);
        cacheManager = new SessionCacheManager(storage, fileProcessor, extractor, objectMapper, properties, clock);
        cacheManager.initialize();
        loader = newLoader();
    }

    @AfterEach
    void tearDown() {
        loader.shutdown();
        fileProcessor.close();
    }

    // ==================== history windows ====================

    @Test
    void limitAloneReturnsMostRecentEntries() throws Exception {
        writeSession("long", 25);

        List<ConversationEntry> recent = loader.loadSessionHistory("long", null, 10);

        assertEquals(10, recent.size());
        assertEquals("Prompt 16", recent.get(0).getPrompt());
        assertEquals("Prompt 25", recent.get(9).getPrompt());
    }

    @Test
    void pageAndLimitReturnWindowFromStart() throws Exception {
        writeSession("long", 25);

        assertEquals(prompts(1, 10), promptsOf(loader.loadSessionHistory("long", 0, 10)));
        assertEquals(prompts(21, 25), promptsOf(loader.getHistoryPage("long", 2, 10)));
        assertTrue(loader.loadSessionHistory("long", 3, 10).isEmpty());
        assertEquals(25, loader.loadSessionHistory("long", null, null).size());
    }

    @Test
    void invalidWindowsAreRejected() throws Exception {
        writeSession("s", 3);

        assertThrows(IllegalArgumentException.class, () -> loader.loadSessionHistory("s", -1, 10));
        assertThrows(IllegalArgumentException.class, () -> loader.loadSessionHistory("s", 0, 0));
        assertThrows(IllegalArgumentException.class, () -> loader.loadSessionLazy("s",
                LazyLoadOptions.builder().includeHistory(true).historyLimit(-5).build()));
        assertThrows(IllegalArgumentException.class, () -> loader.streamSessionHistory("s", 0));
    }

    @Test
    void historyOfMissingSessionIsEmpty() {
        assertTrue(loader.loadSessionHistory("nobody", null, null).isEmpty());
    }

    // ==================== loadSessionLazy ====================

    @Test
    void metadataOnlyLoadLeavesBodyUnloaded() throws Exception {
        writeSession("s", 3);

        LazySessionData data = loader.loadSessionLazy("s", LazyLoadOptions.metadataOnly()).orElseThrow();

        assertEquals("s", data.getMetadata().getSessionId());
        assertFalse(data.hasHistory());
        assertFalse(data.hasContext());
        assertFalse(data.isFullyLoaded());
        assertEquals(clock.instant(), data.getLoadedAt());
    }

    @Test
    void lazyHistoryHonoursWindow() throws Exception {
        writeSession("long", 25);

        LazySessionData data = loader.loadSessionLazy("long",
                LazyLoadOptions.builder().includeHistory(true).historyLimit(10).build()).orElseThrow();

        assertEquals(prompts(16, 25), promptsOf(data.getHistory()));
        assertNull(data.getHistoryPage());
        assertEquals(10, data.getHistoryLimit());
    }

    @Test
    void secondLoadOfOtherPartEnrichesCachedEntry() throws Exception {
        writeSession("s", 4);

        LazySessionData first = loader.loadSessionLazy("s",
                LazyLoadOptions.builder().includeHistory(true).build()).orElseThrow();
        LazySessionData second = loader.loadSessionLazy("s",
                LazyLoadOptions.builder().includeContext(true).build()).orElseThrow();

        assertTrue(first.hasHistory());
        assertFalse(first.hasContext());
        assertTrue(second.hasHistory());
        assertTrue(second.hasContext());
        assertTrue(second.isFullyLoaded());
        assertEquals(4, second.getHistory().size());
        assertSame(second, loader.getFromCache("s").orElseThrow());
    }

    @Test
    void cachedEntryAnswersCoveredRequest() throws Exception {
        writeSession("s", 2);

        LazySessionData first = loader.loadSessionLazy("s", LazyLoadOptions.full()).orElseThrow();
        LazySessionData again = loader.loadSessionLazy("s", LazyLoadOptions.full()).orElseThrow();
        LazySessionData metadataOnly = loader.loadSessionLazy("s", LazyLoadOptions.metadataOnly()).orElseThrow();

        assertSame(first, again);
        assertSame(first, metadataOnly);
    }

    @Test
    void changingLoadedMetadataLeavesIndexUntouched() throws Exception {
        writeSession("m", 1);

        LazySessionData data = loader.loadSessionLazy("m", LazyLoadOptions.metadataOnly()).orElseThrow();
        data.getMetadata().setProjectName("HACKED");

        assertNotEquals("HACKED", cacheManager.getSessionMetadata("m").orElseThrow().getProjectName());
        assertTrue(cacheManager.searchMetadata("hacked").isEmpty());
    }

    @Test
    void differentHistoryWindowIsNotACacheHit() throws Exception {
        writeSession("long", 25);
        LazyLoadOptions firstPage = LazyLoadOptions.builder().includeHistory(true).historyPage(0).historyLimit(10)
                .build();

        loader.loadSessionLazy("long", firstPage);
        LazySessionData secondPage = loader.loadSessionLazy("long",
                firstPage.toBuilder().historyPage(1).build()).orElseThrow();

        assertEquals(prompts(11, 20), promptsOf(secondPage.getHistory()));
        assertEquals(1, secondPage.getHistoryPage());
    }

    @Test
    void changedFileDiscardsCachedParts() throws Exception {
        Session session = writeSession("s", 2);
        loader.loadSessionLazy("s", LazyLoadOptions.builder().includeHistory(true).build());

        session.addEntry(ConversationEntry.builder().prompt("Prompt 3").response("Response 3").build());
        Path file = SessionFixtures.write(sessionsDir, session);
        SessionFixtures.touch(file, clock.instant().plusSeconds(60));
        clock.advance(Duration.ofMinutes(2));

        LazySessionData data = loader.loadSessionLazy("s",
                LazyLoadOptions.builder().includeContext(true).build()).orElseThrow();

        assertFalse(data.hasHistory());
        assertTrue(data.hasContext());
        assertEquals(3, data.getMetadata().getConversationCount());
        assertEquals(clock.instant(), data.getLoadedAt());
    }

    @Test
    void forceRefreshRereadsFile() throws Exception {
        Session session = writeSession("s", 2);
        loader.loadSessionLazy("s", LazyLoadOptions.full());

        session.addEntry(ConversationEntry.builder().prompt("Prompt 3").response("Response 3").build());
        SessionFixtures.write(sessionsDir, session);

        LazySessionData cached = loader.loadSessionLazy("s", LazyLoadOptions.full()).orElseThrow();
        LazySessionData refreshed = loader.loadSessionLazy("s",
                LazyLoadOptions.full().toBuilder().forceRefresh(true).build()).orElseThrow();

        assertEquals(2, cached.getHistory().size());
        assertEquals(3, refreshed.getHistory().size());
    }

    @Test
    void missingSessionYieldsEmptyAndEvicts() throws Exception {
        writeSession("s", 1);
        loader.loadSessionLazy("s", LazyLoadOptions.full());
        Files.delete(sessionsDir.resolve("s.json"));

        assertTrue(loader.loadSessionLazy("s", LazyLoadOptions.metadataOnly()
                .toBuilder().forceRefresh(true).build()).isEmpty());
        assertTrue(loader.getFromCache("s").isEmpty());
        assertTrue(loader.loadSessionLazy("unknown", LazyLoadOptions.full()).isEmpty());
    }

    @Test
    void loadFullSessionRebuildsSession() throws Exception {
        writeSession("full", 3);

        Session session = loader.loadFullSession("full").orElseThrow();

        assertEquals("full", session.getMetadata().getSessionId());
        assertEquals("project-full", session.getMetadata().getProjectName());
        assertEquals(List.of("backend"), session.getMetadata().getTags());
        assertEquals(3, session.getHistory().size());
        assertNotNull(session.getContext());
        assertTrue(loader.loadFullSession("absent").isEmpty());
    }

    // ==================== context / streaming ====================

    @Test
    void loadsContextOrEmptyContext() throws Exception {
        Session session = SessionFixtures.session("ctx", "p", 1);
        session.getContext().setCurrentTopic("indexing");
        session.getContext().setVariables(Map.of("branch", "main"));
        SessionFixtures.write(sessionsDir, session);

        SessionContext context = loader.loadSessionContext("ctx");

        assertEquals("indexing", context.getCurrentTopic());
        assertEquals("main", context.getVariables().get("branch"));
        SessionContext missing = loader.loadSessionContext("missing");
        assertNull(missing.getCurrentTopic());
        assertTrue(missing.getDecisions().isEmpty());
    }

    @Test
    void streamsHistoryInChunks() throws Exception {
        writeSession("long", 25);

        List<Integer> sizes = new ArrayList<>();
        List<String> all = new ArrayList<>();
        for (List<ConversationEntry> chunk : loader.streamSessionHistory("long", 10)) {
            sizes.add(chunk.size());
            all.addAll(promptsOf(chunk));
        }

        assertEquals(List.of(10, 10, 5), sizes);
        assertEquals(prompts(1, 25), all);
    }

    @Test
    void streamStopsAfterExactMultiple() throws Exception {
        writeSession("even", 20);

        List<Integer> sizes = new ArrayList<>();
        for (List<ConversationEntry> chunk : loader.streamSessionHistory("even", 10)) {
            sizes.add(chunk.size());
        }

        assertEquals(List.of(10, 10), sizes);
        assertFalse(loader.streamSessionHistory("missing", 5).iterator().hasNext());
    }

    // ==================== batch operations ====================

    @Test
    void preloadCountsMissingSessionsAsFailures() throws Exception {
        writeSession("a", 1);
        writeSession("b", 2);

        BatchOperationResult result = loader.preloadSessions(List.of("a", "missing", "b"), LazyLoadOptions.full());

        assertEquals(2, result.getSuccessful());
        assertEquals(1, result.getFailed());
        assertEquals("missing", result.getErrors().get(0).getSessionId());
        assertEquals("Session not found", result.getErrors().get(0).getError());
        assertTrue(loader.getFromCache("a").isPresent());
        assertTrue(loader.getFromCache("b").orElseThrow().isFullyLoaded());
    }

    @Test
    void bulkMetadataKeepsInputOrderAndSkipsMissing() throws Exception {
        properties.getLoader().setBulkMetadataBatchSize(2);
        writeSession("a", 1);
        writeSession("b", 1);
        writeSession("c", 1);

        List<SessionMetadataCache> metadata = loader.bulkLoadMetadata(List.of("c", "missing", "a", "b"));

        assertEquals(List.of("c", "a", "b"), metadata.stream().map(SessionMetadataCache::getSessionId).toList());
    }

    @Test
    void searchFindsPromptsAndResponses() throws Exception {
        writeSession("twelve", 12);
        writeSession("three", 3);

        List<ContentSearchResult> byResponse = loader.searchSessionContent(List.of("twelve"), "response 1");
        List<ContentSearchResult> byPrompt = loader.searchSessionContent(List.of("missing", "three", "twelve"),
                "PROMPT 2");

        assertEquals(1, byResponse.size());
        List<Integer> indexes = byResponse.get(0).getMatches().stream()
                .map(ContentSearchResult.ContentMatch::getIndex)
                .toList();
        assertEquals(List.of(0, 9, 10, 11), indexes);
        assertTrue(byResponse.get(0).getMatches().stream().allMatch(m -> m.getType() == MatchType.RESPONSE));

        assertEquals(List.of("three", "twelve"), byPrompt.stream().map(ContentSearchResult::getSessionId).toList());
        ContentSearchResult.ContentMatch match = byPrompt.get(0).getMatches().get(0);
        assertEquals(MatchType.PROMPT, match.getType());
        assertEquals("Prompt 2", match.getContent());
        assertEquals(1, match.getIndex());
    }

    // ==================== cache hygiene ====================

    @Test
    void validationEvictsSessionsChangedOnDisk() throws Exception {
        writeSession("v", 1);
        loader.loadSessionLazy("v", LazyLoadOptions.full());

        assertTrue(loader.validateCachedSession("v"));

        SessionFixtures.touch(sessionsDir.resolve("v.json"), clock.instant().plusSeconds(60));
        assertFalse(loader.validateCachedSession("v"));
        assertTrue(loader.getFromCache("v").isEmpty());
        assertFalse(loader.validateCachedSession("never-loaded"));
    }

    @Test
    void optimizeEvictsIdleEntries() throws Exception {
        writeSession("idle", 1);
        writeSession("busy", 1);
        loader.loadSessionLazy("idle", LazyLoadOptions.metadataOnly());
        loader.loadSessionLazy("busy", LazyLoadOptions.metadataOnly());

        clock.advance(Duration.ofMinutes(20));
        loader.getFromCache("busy");
        clock.advance(Duration.ofMinutes(15));

        assertEquals(1, loader.optimizeCache());
        assertTrue(loader.getFromCache("idle").isEmpty());
        assertTrue(loader.getFromCache("busy").isPresent());
    }

    @Test
    void cacheIsBoundedBySessionDataCacheSize() throws Exception {
        properties.getCache().setMaxSessionDataCacheSize(2);
        LazySessionLoader small = newLoader();
        try {
            writeSession("a", 1);
            writeSession("b", 1);
            writeSession("c", 1);

            small.loadSessionLazy("a", LazyLoadOptions.metadataOnly());
            small.loadSessionLazy("b", LazyLoadOptions.metadataOnly());
            small.loadSessionLazy("c", LazyLoadOptions.metadataOnly());

            assertTrue(small.getFromCache("a").isEmpty());
            assertEquals(2, small.getCacheStats().getSize());
            assertEquals(2, small.getCacheStats().getMaxSize());
        } finally {
            small.shutdown();
        }
    }

    @Test
    void statsReflectLoadsAndHits() throws Exception {
        writeSession("s", 2);
        loader.loadSessionLazy("s", LazyLoadOptions.full());
        loader.loadSessionLazy("s", LazyLoadOptions.full());

        LoaderCacheStats stats = loader.getCacheStats();

        assertEquals(1, stats.getSize());
        assertEquals(20, stats.getMaxSize());
        assertEquals(50.0, stats.getHitRate(), 0.001);
        assertTrue(stats.getAverageLoadTimeMs() >= 0);
        assertTrue(stats.getEstimatedMemoryUsage() > 0);
    }

    @Test
    void evictAndClear() throws Exception {
        writeSession("a", 1);
        writeSession("b", 1);
        loader.loadSessionLazy("a", LazyLoadOptions.metadataOnly());
        loader.loadSessionLazy("b", LazyLoadOptions.metadataOnly());

        assertTrue(loader.evictFromCache("a"));
        assertFalse(loader.evictFromCache("a"));
        loader.clearCache();

        assertEquals(0, loader.getCacheStats().getSize());
    }

    private LazySessionLoader newLoader() {
        return new LazySessionLoader(cacheManager, storage, extractor, objectMapper, properties, clock);
    }

    private Session writeSession(String id, int entries) throws Exception {
        Session session = SessionFixtures.session(id, "project-" + id, entries);
        SessionFixtures.write(sessionsDir, session);
        return session;
    }

    private static List<String> promptsOf(List<ConversationEntry> entries) {
        return entries.stream().map(ConversationEntry::getPrompt).toList();
    }

    private static List<String> prompts(int from, int to) {
        List<String> prompts = new ArrayList<>();
        for (int i = from; i <= to; i++) {
            prompts.add("Prompt " + i);
        }
        return prompts;
    }
}
