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
import lombok.Data;

import java.time.Instant;

/**
 * Snapshot of an {@code LRUCache}: occupancy and hit rate since creation or
 * the last clear.
 */
@Data
@Builder
public class LruCacheStats {

    private int size;
    private int maxSize;
    private long hits;
    private long misses;

    /** Percentage 0-100. */
    private double hitRate;

    private Instant oldestEntry;
    private Instant newestEntry;
}
