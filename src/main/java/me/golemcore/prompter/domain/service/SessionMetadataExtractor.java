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
import me.golemcore.prompter.domain.model.Session;
import me.golemcore.prompter.domain.model.SessionContext;
import me.golemcore.prompter.domain.model.SessionMetadata;
import me.golemcore.prompter.domain.model.SessionMetadataCache;
import me.golemcore.prompter.domain.model.SessionStatus;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Derives index records and session parts from raw session file text.
 *
 * <p>
 * Each field group has two tiers. The fast tier for the header pulls a small
 * JSON fragment out of the raw text with a regex and binds only that fragment,
 * after a streaming pass has confirmed the document is well-formed. The fast
 * tier for the context streams over the root object and binds its
 * {@code context} member alone. The slow tier parses the whole document and
 * validates its structure. It runs only when the fast tier finds nothing or
 * its fragment does not parse.
 *
 * <p>
 * Counts, the last entry timestamp and topics are always taken from markers in
 * the raw text, whichever tier produced the header.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SessionMetadataExtractor {

    public static final String CACHE_VERSION = "1.0.0";

    private static final String UNKNOWN_PROJECT = "unknown";

    private static final Pattern METADATA_FRAGMENT = Pattern.compile("\"metadata\"\\s*:\\s*(\\{[^{}]*\\})");
    private static final Pattern HISTORY_MARKER = Pattern.compile("\"history\"\\s*:\\s*\\[");
    private static final Pattern PROMPT_MARKER = Pattern.compile("\"prompt\"\\s*:");
    private static final Pattern TIMESTAMP_MARKER = Pattern.compile("\"timestamp\"\\s*:\\s*\"([^\"]+)\"");

    private static final TypeReference<List<ConversationEntry>> HISTORY_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;
    private final TopicClassifier topicClassifier;
    private final Clock clock;

    /**
     * Builds the index record of one session file.
     *
     * @param sessionId
     *            id taken from the file name; it wins over the id inside the file
     * @throws MalformedSessionException
     *             if neither tier can produce a header
     */
    public SessionMetadataCache extract(String sessionId, Path filePath, String content)
            throws MalformedSessionException {
        SessionMetadata header = extractHeader(content);
        return SessionMetadataCache.builder()
                .sessionId(sessionId)
                .projectName(header.getProjectName() != null ? header.getProjectName() : UNKNOWN_PROJECT)
                .createdDate(header.getCreatedDate())
                .lastAccessed(header.getLastAccessed())
                .status(header.getStatus() != null ? header.getStatus() : SessionStatus.ACTIVE)
                .tags(header.getTags() != null ? new ArrayList<>(header.getTags()) : new ArrayList<>())
                .description(header.getDescription())
                .conversationCount(countConversations(content))
                .lastEntryTimestamp(findLastEntryTimestamp(content).orElse(null))
                .languages(new ArrayList<>(topicClassifier.detectLanguages(content)))
                .patterns(new ArrayList<>(topicClassifier.detectPatterns(content)))
                .fileSize(content.getBytes(StandardCharsets.UTF_8).length)
                .lastCacheUpdate(clock.instant())
                .cacheVersion(CACHE_VERSION)
                .filePath(filePath.toAbsolutePath().toString())
                .build();
    }

    public SessionMetadata extractHeader(String content) throws MalformedSessionException {
        Optional<SessionMetadata> fast = extractHeaderFast(content);
        if (fast.isPresent()) {
            return fast.get();
        }
        return parseSession(content).getMetadata();
    }

    /**
     * Regex tier of {@link #extractHeader(String)}. Empty when the document does
     * not look like a session or is not well-formed JSON, when no flat metadata
     * object is found, or when the fragment does not parse.
     */
    Optional<SessionMetadata> extractHeaderFast(String content) {
        if (!looksLikeSession(content) || !isWellFormed(content)) {
            return Optional.empty();
        }
        Matcher matcher = METADATA_FRAGMENT.matcher(content);
        if (!matcher.find()) {
            return Optional.empty();
        }
        try {
            SessionMetadata header = objectMapper.readValue(matcher.group(1), SessionMetadata.class);
            // The first flat "metadata" object may belong to a history entry.
            if (header.getSessionId() == null && header.getProjectName() == null) {
                return Optional.empty();
            }
            return Optional.of(header);
        } catch (JsonProcessingException e) {
            log.debug("[Extractor] Metadata fragment did not parse, falling back to full parse: {}",
                    e.getOriginalMessage());
            return Optional.empty();
        }
    }

    /**
     * Context of a session, streaming tier first. Only the root-level
     * {@code context} member counts; a {@code context} key nested in entry
     * metadata is skipped. A document without a context yields
     * {@link SessionContext#empty()}.
     */
    public SessionContext extractContext(String content) throws MalformedSessionException {
        try (JsonParser parser = objectMapper.createParser(content)) {
            if (parser.nextToken() == JsonToken.START_OBJECT) {
                while (parser.nextToken() == JsonToken.FIELD_NAME) {
                    String field = parser.currentName();
                    JsonToken value = parser.nextToken();
                    if ("context".equals(field) && value == JsonToken.START_OBJECT) {
                        return normalize(objectMapper.readValue(parser, SessionContext.class));
                    }
                    parser.skipChildren();
                }
            }
        } catch (IOException e) {
            log.debug("[Extractor] Context stream failed, falling back to full parse: {}", e.getMessage());
        }
        return parseSession(content).getContext();
    }

    /**
     * Full history of a session in file order.
     */
    public List<ConversationEntry> extractHistory(String content) throws MalformedSessionException {
        return parseSession(content).getHistory();
    }

    /**
     * Full parse with structural validation: the root must be an object with a
     * {@code metadata} object; {@code history} must be an array and
     * {@code context} an object when present.
     */
    public Session parseSession(String content) throws MalformedSessionException {
        JsonNode root;
        try {
            root = objectMapper.readTree(content);
        } catch (JsonProcessingException e) {
            throw new MalformedSessionException("Session is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new MalformedSessionException("Session document must be a JSON object");
        }
        JsonNode metadata = root.get("metadata");
        if (metadata == null || !metadata.isObject()) {
            throw new MalformedSessionException("Session has no metadata object");
        }
        JsonNode history = root.get("history");
        if (history != null && !history.isNull() && !history.isArray()) {
            throw new MalformedSessionException("Session history must be an array");
        }
        JsonNode context = root.get("context");
        if (context != null && !context.isNull() && !context.isObject()) {
            throw new MalformedSessionException("Session context must be an object");
        }

        try {
            List<ConversationEntry> entries = history == null || history.isNull()
                    ? new ArrayList<>()
                    : objectMapper.convertValue(history, HISTORY_TYPE);
            SessionContext sessionContext = context == null || context.isNull()
                    ? SessionContext.empty()
                    : objectMapper.treeToValue(context, SessionContext.class);
            return Session.builder()
                    .metadata(objectMapper.treeToValue(metadata, SessionMetadata.class))
                    .history(entries)
                    .context(normalize(sessionContext))
                    .build();
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new MalformedSessionException("Session has an unexpected shape: " + e.getMessage(), e);
        }
    }

    public int countConversations(String content) {
        Matcher matcher = PROMPT_MARKER.matcher(content);
        int count = 0;
        while (matcher.find()) {
            count++;
        }
        return count;
    }

    public Optional<Instant> findLastEntryTimestamp(String content) {
        Matcher matcher = TIMESTAMP_MARKER.matcher(content);
        String last = null;
        while (matcher.find()) {
            last = matcher.group(1);
        }
        if (last == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(Instant.parse(last));
        } catch (DateTimeParseException e) {
            log.debug("[Extractor] Ignoring unparseable timestamp: {}", last);
            return Optional.empty();
        }
    }

    private static boolean looksLikeSession(String content) {
        String trimmed = content.strip();
        return trimmed.startsWith("{") && trimmed.endsWith("}") && HISTORY_MARKER.matcher(trimmed).find();
    }

    /**
     * Tokenizes the whole document without binding it. True for exactly one
     * syntactically valid JSON value.
     */
    private boolean isWellFormed(String content) {
        try (JsonParser parser = objectMapper.createParser(content)) {
            if (parser.nextToken() == null) {
                return false;
            }
            parser.skipChildren();
            return parser.nextToken() == null;
        } catch (IOException e) {
            log.debug("[Extractor] Document is not well-formed JSON: {}", e.getMessage());
            return false;
        }
    }

    private static SessionContext normalize(SessionContext context) {
        if (context.getVariables() == null) {
            context.setVariables(new HashMap<>());
        }
        if (context.getDecisions() == null) {
            context.setDecisions(new ArrayList<>());
        }
        if (context.getTrackedIssues() == null) {
            context.setTrackedIssues(new ArrayList<>());
        }
        return context;
    }

    /**
     * Session text that cannot be turned into a well-formed session.
     */
    public static class MalformedSessionException extends IOException {
        private static final long serialVersionUID = 1L;

        public MalformedSessionException(String message) {
            super(message);
        }

        public MalformedSessionException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
