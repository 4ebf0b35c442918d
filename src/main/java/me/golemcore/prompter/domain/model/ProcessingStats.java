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

/**
 * Aggregate timing of a batch file processing run. Times are in milliseconds.
 */
@Value
@Builder(toBuilder = true)
public class ProcessingStats {

    int totalFiles;
    int successfulFiles;
    int failedFiles;
    double averageProcessingTimeMs;
    long minProcessingTimeMs;
    long maxProcessingTimeMs;
    long totalProcessingTimeMs;
    double averageQueueWaitMs;

    /** Peak permits in use during the run as a percentage of the permit limit. */
    double concurrencyUtilization;

    public static ProcessingStats empty() {
        return ProcessingStats.builder().build();
    }
}
