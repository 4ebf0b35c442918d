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

import java.io.IOException;
import java.nio.file.Path;

/**
 * Turns the text of one file into a result. Throwing marks that file as failed
 * without affecting the rest of the batch.
 *
 * @param <T>
 *            result type
 */
@FunctionalInterface
public interface FileContentProcessor<T> {

    T process(Path filePath, String content) throws IOException;
}
