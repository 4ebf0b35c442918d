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

import me.golemcore.prompter.domain.model.ConversationEntry;
import me.golemcore.prompter.domain.model.Decision;
import me.golemcore.prompter.domain.model.EntrySource;
import me.golemcore.prompter.domain.model.ExportFormat;
import me.golemcore.prompter.domain.model.Session;
import me.golemcore.prompter.domain.model.SessionContext;
import me.golemcore.prompter.domain.model.SessionContextUpdate;
import me.golemcore.prompter.domain.model.SessionMetadata;
import me.golemcore.prompter.domain.model.SessionMetadataCache;
import me.golemcore.prompter.domain.model.SessionStatus;
import me.golemcore.prompter.domain.model.TrackedIssue;
import me.golemcore.prompter.domain.service.SessionMetadataExtractor.MalformedSessionException;
import me.golemcore.prompter.infrastructure.config.PrompterProperties;
import me.golemcore.prompter.port.outbound.StoragePort;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Consumer;

/**
 * Session store: creates, reads and mutates session files.
 *
 * <p>
 * Every write replaces the whole file atomically, then evicts the session from
 * the {@link LazySessionLoader} cache and refreshes its entry in the
 * {@link SessionCacheManager} index. Mutations of one session are serialized;
 * mutations of an unknown session raise {@link IllegalArgumentException}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SessionService {

    private static final String SESSION_EXTENSION = ".json";
    private static final String ID_ALPHABET = "0123456789abcdefghijklmnopqrstuvwxyz";
    private static final int ID_RANDOM_LENGTH = 5;
    private static final int LOCK_STRIPES = 64;

    private final StoragePort storagePort;
    private final SessionMetadataExtractor extractor;
    private final SessionCacheManager cacheManager;
    private final LazySessionLoader sessionLoader;
    private final ObjectMapper objectMapper;
    private final PrompterProperties properties;
    private final Clock clock;

    private final Object[] sessionLocks = newLockStripes();

    public Session createSession(String projectName, String description) {
        Instant now = clock.instant();
        Session session = Session.builder()
                .metadata(SessionMetadata.builder()
                        .sessionId(generateSessionId())
                        .createdDate(now)
                        .lastAccessed(now)
                        .projectName(projectName)
                        .description(description)
                        .status(SessionStatus.ACTIVE)
                        .build())
                .history(new ArrayList<>())
                .context(SessionContext.empty())
                .build();
        save(session);
        log.info("Created new session: {}", session.getMetadata().getSessionId());
        return session;
    }

    /**
     * Reads a session without touching it.
     *
     * @return empty when the file is missing, unreadable or malformed
     */
    public Optional<Session> getSession(String sessionId) {
        String content;
        try {
            content = storagePort.getText(sessionsDir(), sessionId + SESSION_EXTENSION).join();
        } catch (CompletionException e) {
            log.warn("Failed to read session {}: {}", sessionId, e.getMessage());
            return Optional.empty();
        }
        if (content == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(extractor.parseSession(content));
        } catch (MalformedSessionException e) {
            log.warn("Malformed session {}: {}", sessionId, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Reads a session and records the access.
     */
    public Optional<Session> resumeSession(String sessionId) {
        synchronized (lockFor(sessionId)) {
            Optional<Session> session = getSession(sessionId);
            session.ifPresent(s -> {
                s.getMetadata().setLastAccessed(clock.instant());
                save(s);
            });
            return session;
        }
    }

    public void save(Session session) {
        String sessionId = session.getMetadata().getSessionId();
        String json;
        try {
            json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(session);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize session " + sessionId, e);
        }
        storagePort.putTextAtomic(sessionsDir(), sessionId + SESSION_EXTENSION, json, false).join();
        sessionLoader.evictFromCache(sessionId);
        cacheManager.refreshSessionMetadata(sessionId);
        log.debug("Saved session: {}", sessionId);
    }

    public ConversationEntry addConversationEntry(String sessionId, String prompt, String response,
            EntrySource source, Map<String, Object> metadata) {
        ConversationEntry entry = ConversationEntry.builder()
                .prompt(prompt)
                .response(response)
                .timestamp(clock.instant())
                .source(source != null ? source : EntrySource.USER)
                .metadata(metadata)
                .build();
        mutate(sessionId, session -> {
            session.addEntry(entry);
            session.getMetadata().setLastAccessed(entry.getTimestamp());
        });
        return entry;
    }

    public void updateContext(String sessionId, SessionContextUpdate update) {
        mutate(sessionId, session -> {
            SessionContext context = session.getContext();
            if (update.getCurrentTopic() != null) {
                context.setCurrentTopic(update.getCurrentTopic());
            }
            if (update.getVariables() != null) {
                context.setVariables(new HashMap<>(update.getVariables()));
            }
            if (update.getDecisions() != null) {
                context.setDecisions(new ArrayList<>(update.getDecisions()));
            }
            if (update.getTrackedIssues() != null) {
                context.setTrackedIssues(new ArrayList<>(update.getTrackedIssues()));
            }
        });
    }

    public Decision addDecision(String sessionId, String decision, String rationale, List<String> relatedFiles) {
        Instant now = clock.instant();
        Decision recorded = Decision.builder()
                .id("decision-" + now.toEpochMilli())
                .decision(decision)
                .rationale(rationale)
                .timestamp(now)
                .relatedFiles(relatedFiles != null ? new ArrayList<>(relatedFiles) : new ArrayList<>())
                .build();
        mutate(sessionId, session -> session.getContext().getDecisions().add(recorded));
        return recorded;
    }

    public TrackedIssue trackIssue(String sessionId, String title, TrackedIssue.IssueStatus status,
            TrackedIssue.IssuePriority priority) {
        Instant now = clock.instant();
        TrackedIssue issue = TrackedIssue.builder()
                .id("issue-" + now.toEpochMilli())
                .title(title)
                .status(status != null ? status : TrackedIssue.IssueStatus.PLANNING)
                .priority(priority != null ? priority : TrackedIssue.IssuePriority.MEDIUM)
                .createdAt(now)
                .updatedAt(now)
                .build();
        mutate(sessionId, session -> session.getContext().getTrackedIssues().add(issue));
        return issue;
    }

    /**
     * Deletes the session file and drops it from both caches.
     *
     * @return false if there was no such session
     */
    public boolean deleteSession(String sessionId) {
        synchronized (lockFor(sessionId)) {
            String fileName = sessionId + SESSION_EXTENSION;
            boolean existed = Boolean.TRUE.equals(storagePort.exists(sessionsDir(), fileName).join());
            storagePort.deleteObject(sessionsDir(), fileName).join();
            sessionLoader.evictFromCache(sessionId);
            cacheManager.invalidateSessionCache(sessionId);
            if (existed) {
                log.info("Deleted session: {}", sessionId);
            }
            return existed;
        }
    }

    /**
     * Index entries of all sessions, most recently accessed first.
     */
    public List<SessionMetadataCache> listSessions() {
        return cacheManager.getAllSessionMetadata();
    }

    public String exportSession(String sessionId, ExportFormat format) {
        Session session = getSession(sessionId)
                .orElseThrow(() -> new IllegalArgumentException("Session " + sessionId + " not found"));
        if (format == ExportFormat.JSON) {
            try {
                return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(session);
            } catch (JsonProcessingException e) {
                throw new IllegalStateException("Failed to export session " + sessionId, e);
            }
        }
        return toMarkdown(session);
    }

    private void mutate(String sessionId, Consumer<Session> change) {
        synchronized (lockFor(sessionId)) {
            Session session = getSession(sessionId)
                    .orElseThrow(() -> new IllegalArgumentException("Session " + sessionId + " not found"));
            if (session.getContext() == null) {
                session.setContext(SessionContext.empty());
            }
            change.accept(session);
            save(session);
        }
    }

    private String toMarkdown(Session session) {
        SessionMetadata metadata = session.getMetadata();
        StringBuilder markdown = new StringBuilder();
        markdown.append("# ").append(metadata.getProjectName()).append("\n\n");
        markdown.append("**Session ID**: ").append(metadata.getSessionId()).append('\n');
        markdown.append("**Created**: ").append(metadata.getCreatedDate()).append('\n');
        markdown.append("**Last Accessed**: ").append(metadata.getLastAccessed()).append("\n\n");

        if (metadata.getDescription() != null && !metadata.getDescription().isBlank()) {
            markdown.append("## Description\n").append(metadata.getDescription()).append("\n\n");
        }

        markdown.append("## Conversation History\n\n");
        for (ConversationEntry entry : session.getHistory()) {
            String source = entry.getSource() != null ? entry.getSource().getCode() : EntrySource.OTHER.getCode();
            markdown.append("### ").append(entry.getTimestamp()).append(" (").append(source).append(")\n");
            markdown.append("**Prompt**: ").append(entry.getPrompt()).append("\n\n");
            markdown.append("**Response**: ").append(entry.getResponse()).append("\n\n");
            markdown.append("---\n\n");
        }

        List<Decision> decisions = session.getContext() != null ? session.getContext().getDecisions() : null;
        if (decisions != null && !decisions.isEmpty()) {
            markdown.append("## Decisions\n\n");
            for (Decision decision : decisions) {
                markdown.append("- **").append(decision.getDecision()).append("**: ")
                        .append(decision.getRationale()).append('\n');
            }
        }
        return markdown.toString();
    }

    private String generateSessionId() {
        ThreadLocalRandom random = ThreadLocalRandom.current();
        StringBuilder suffix = new StringBuilder(ID_RANDOM_LENGTH);
        for (int i = 0; i < ID_RANDOM_LENGTH; i++) {
            suffix.append(ID_ALPHABET.charAt(random.nextInt(ID_ALPHABET.length())));
        }
        return "session-" + Long.toString(clock.millis(), 36) + "-" + suffix;
    }

    // Ids sharing a stripe serialize against each other.
    Object lockFor(String sessionId) {
        return sessionLocks[Math.floorMod(sessionId.hashCode(), LOCK_STRIPES)];
    }

    private static Object[] newLockStripes() {
        Object[] stripes = new Object[LOCK_STRIPES];
        for (int i = 0; i < LOCK_STRIPES; i++) {
            stripes[i] = new Object();
        }
        return stripes;
    }

    private String sessionsDir() {
        return properties.getStorage().getDirectories().getSessions();
    }
}
