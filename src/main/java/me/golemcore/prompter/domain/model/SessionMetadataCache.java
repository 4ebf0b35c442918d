package me.golemcore.prompter.domain.model;

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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Derived index record of one session: everything needed to list, search and
 * sort sessions without reading the session body.
 *
 * <p>
 * {@code conversationCount} and {@code lastEntryTimestamp} reflect the file as
 * it was at {@code lastCacheUpdate}; staleness is detected by comparing the
 * file modification time against that instant.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class SessionMetadataCache {

    private String sessionId;
    private String projectName;
    private Instant createdDate;
    private Instant lastAccessed;
    private SessionStatus status;

    @Builder.Default
    private List<String> tags = new ArrayList<>();

    private String description;

    private int conversationCount;
    private Instant lastEntryTimestamp;

    @Builder.Default
    private List<String> languages = new ArrayList<>();

    @Builder.Default
    private List<String> patterns = new ArrayList<>();

    /** UTF-8 size of the session file in bytes. */
    private long fileSize;

    private Instant lastCacheUpdate;
    private String cacheVersion;
    private String filePath;
}
