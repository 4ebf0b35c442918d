package me.golemcore.prompter.concurrency;

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

/**
 * Limits applied by {@link ConcurrentFileProcessor}.
 */
@Value
@Builder(toBuilder = true)
public class ProcessingSettings {

    @Builder.Default
    int maxConcurrentReads = 10;

    @Builder.Default
    int maxConcurrentWrites = 5;

    /** Per-file timeout covering read and processing; {@code <= 0} disables it. */
    @Builder.Default
    long operationTimeoutMs = 30000;

    @Builder.Default
    int batchSize = 20;

    @Builder.Default
    boolean enablePerformanceTracking = true;

    public static ProcessingSettings defaults() {
        return ProcessingSettings.builder().build();
    }
}
