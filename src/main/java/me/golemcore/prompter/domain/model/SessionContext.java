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

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Free-form state carried across the conversations of a session.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class SessionContext {

    @JsonInclude(JsonInclude.Include.NON_NULL)
    private String currentTopic;

    @Builder.Default
    private Map<String, Object> variables = new HashMap<>();

    @Builder.Default
    private List<Decision> decisions = new ArrayList<>();

    @Builder.Default
    private List<TrackedIssue> trackedIssues = new ArrayList<>();

    /**
     * Well-formed context with no topic, variables, decisions or issues.
     */
    public static SessionContext empty() {
        return SessionContext.builder().build();
    }
}
