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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Work item tracked across the conversations of a session.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class TrackedIssue {

    private String id;
    private String title;

    @Builder.Default
    private IssueStatus status = IssueStatus.PLANNING;

    @Builder.Default
    private IssuePriority priority = IssuePriority.MEDIUM;

    private Instant createdAt;
    private Instant updatedAt;

    @Builder.Default
    private List<String> dependencies = new ArrayList<>();

    public enum IssueStatus {
        PLANNING("planning"), IN_PROGRESS("in-progress"), COMPLETED("completed"), BLOCKED("blocked");

        private final String code;

        IssueStatus(String code) {
            this.code = code;
        }

        @JsonValue
        public String getCode() {
            return code;
        }

        @JsonCreator
        public static IssueStatus fromCode(String code) {
            for (IssueStatus status : values()) {
                if (status.code.equalsIgnoreCase(code)) {
                    return status;
                }
            }
            throw new IllegalArgumentException("Unknown issue status: " + code);
        }
    }

    public enum IssuePriority {
        LOW("low"), MEDIUM("medium"), HIGH("high");

        private final String code;

        IssuePriority(String code) {
            this.code = code;
        }

        @JsonValue
        public String getCode() {
            return code;
        }

        @JsonCreator
        public static IssuePriority fromCode(String code) {
            for (IssuePriority priority : values()) {
                if (priority.code.equalsIgnoreCase(code)) {
                    return priority;
                }
            }
            throw new IllegalArgumentException("Unknown issue priority: " + code);
        }
    }
}
