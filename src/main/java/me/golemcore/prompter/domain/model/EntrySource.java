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

/**
 * Who produced a conversation entry. Codes written by other tools that are not
 * listed here are read as {@link #OTHER}.
 */
public enum EntrySource {
    USER("user"), CLAUDE("claude"), GPT_4O("gpt-4o"), OTHER("other");

    private final String code;

    EntrySource(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static EntrySource fromCode(String code) {
        if (code == null) {
            return OTHER;
        }
        for (EntrySource source : values()) {
            if (source.code.equalsIgnoreCase(code)) {
                return source;
            }
        }
        return OTHER;
    }
}
