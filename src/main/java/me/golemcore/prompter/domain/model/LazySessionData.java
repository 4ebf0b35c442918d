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

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;

/**
 * Partially materialized session held by the lazy loader cache. Never
 * persisted.
 *
 * <p>
 * {@code history} and {@code context} are {@code null} when not loaded.
 * {@code historyPage} and {@code historyLimit} describe the window the history
 * was read with ({@code null} meaning unpaged and unlimited).
 */
@Data
@Builder(toBuilder = true)
public class LazySessionData {

    private SessionMetadataCache metadata;
    private List<ConversationEntry> history;
    private SessionContext context;
    private Integer historyPage;
    private Integer historyLimit;
    private boolean fullyLoaded;
    private Instant loadedAt;

    @JsonIgnore
    public boolean hasHistory() {
        return history != null;
    }

    @JsonIgnore
    public boolean hasContext() {
        return context != null;
    }
}
