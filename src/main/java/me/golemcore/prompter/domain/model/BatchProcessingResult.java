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
 * Result of processing a list of files: per-file results, per-file failures and
 * the order in which files completed.
 *
 * @param <T>
 *            per-file result type
 */
@Value
@Builder
public class BatchProcessingResult<T> {

    List<T> successful;
    List<FileFailure> failed;
    List<String> processingOrder;
    ProcessingStats stats;
}
