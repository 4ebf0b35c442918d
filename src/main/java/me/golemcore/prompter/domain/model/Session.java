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

import java.util.ArrayList;
import java.util.List;

/**
 * On-disk unit of the session store: one JSON file per session, named by
 * {@code metadata.sessionId}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Session {

    private SessionMetadata metadata;

    @Builder.Default
    private List<ConversationEntry> history = new ArrayList<>();

    @Builder.Default
    private SessionContext context = SessionContext.empty();

    /**
     * Appends an entry to the history.
     */
    public void addEntry(ConversationEntry entry) {
        if (history == null) {
            history = new ArrayList<>();
        }
        history.add(entry);
    }
}
