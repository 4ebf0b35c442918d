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

/**
 * Point-in-time snapshot of a {@code Semaphore}.
 *
 * <p>
 * Counters ({@code completed}, {@code failed}, {@code timedOut},
 * {@code peakPermitsInUse}) are cumulative since creation or the last clear.
 */
@Data
@Builder
public class SemaphoreStats {

    private int maxPermits;
    private int availablePermits;
    private int permitsInUse;
    private int peakPermitsInUse;
    private int queueLength;
    private long completed;
    private long failed;
    private long timedOut;
    private double utilizationRate;
}
