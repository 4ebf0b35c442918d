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

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * One prompt/response exchange. Entries of a session are append-only and kept
 * in chronological order.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ConversationEntry {

    private String prompt;
    private String response;
    private Instant timestamp;
    private EntrySource source;

    /** Optional extras such as model, tokens or duration. */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private Map<String, Object> metadata;
}
