package me.golemcore.prompter;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for the prompter session store.
 *
 * <p>
 * Hosts the session storage core of the prompter CLI: a persisted metadata
 * index over per-session JSON files and a lazy loader that materializes only
 * the parts of a session a caller asks for.
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal layout (Ports &amp; Adapters):
 *
 * <pre>
 * Domain Layer       → SessionCacheManager, LazySessionLoader, SessionService
 * Concurrency        → Semaphore, ConcurrentFileProcessor, LRUCache
 * Infrastructure     → LocalStorageAdapter, configuration
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under the
 * {@code prompter.*} prefix.
 *
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class PrompterApplication {

    public static void main(String[] args) {
        SpringApplication.run(PrompterApplication.class, args);
    }

}
