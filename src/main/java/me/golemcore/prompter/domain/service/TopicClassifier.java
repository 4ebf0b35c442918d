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

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Lightweight topic detection over raw session text. Every table entry is
 * tested independently, so a session may match any number of topics.
 */
@Component
public class TopicClassifier {

    private static final Map<String, Pattern> LANGUAGES = table(
            "javascript", "\\b(javascript|js|nodejs|npm|yarn)\\b",
            "typescript", "\\b(typescript|ts)\\b",
            "python", "\\b(python|py|pip|django|flask)\\b",
            "react", "\\b(react|jsx|tsx)\\b",
            "css", "\\b(css|scss|sass|styled)\\b",
            "sql", "\\b(sql|mysql|postgres|sqlite)\\b",
            "go", "\\b(golang|go)\\b",
            "rust", "\\b(rust|cargo)\\b",
            "java", "\\b(java|spring|maven)\\b",
            "php", "\\b(php|laravel|composer)\\b");

    private static final Map<String, Pattern> PATTERNS = table(
            "async-await", "async|await|promise",
            "error-handling", "try|catch|error|exception|throw",
            "testing", "test|jest|mocha|vitest|describe|it\\(",
            "api-integration", "api|endpoint|http|axios|fetch",
            "authentication", "auth|jwt|token|login|session",
            "state-management", "state|redux|zustand|context",
            "component-patterns", "component|react|vue|angular",
            "database", "database|sql|mongo|postgres|query");

    public List<String> detectLanguages(String content) {
        return matching(LANGUAGES, content);
    }

    public List<String> detectPatterns(String content) {
        return matching(PATTERNS, content);
    }

    private static List<String> matching(Map<String, Pattern> table, String content) {
        if (content == null || content.isEmpty()) {
            return Collections.emptyList();
        }
        List<String> topics = new ArrayList<>();
        for (Map.Entry<String, Pattern> entry : table.entrySet()) {
            if (entry.getValue().matcher(content).find()) {
                topics.add(entry.getKey());
            }
        }
        return topics;
    }

    private static Map<String, Pattern> table(String... namesAndRegexes) {
        Map<String, Pattern> table = new LinkedHashMap<>();
        for (int i = 0; i < namesAndRegexes.length; i += 2) {
            table.put(namesAndRegexes[i], Pattern.compile(namesAndRegexes[i + 1], Pattern.CASE_INSENSITIVE));
        }
        return Collections.unmodifiableMap(table);
    }
}
