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

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Session whose conversation text matched a content search.
 */
@Value
@Builder
public class ContentSearchResult {

    String sessionId;
    SessionMetadataCache metadata;
    List<ContentMatch> matches;

    /**
     * A matching prompt or response and the position of its entry in the
     * history.
     */
    @Value
    public static class ContentMatch {
        MatchType type;
        String content;
        int index;
    }

    public enum MatchType {
        PROMPT, RESPONSE
    }
}
