package me.golemcore.prompter.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Centralized configuration properties, bound from application.properties.
 *
 * <p>
 * All configuration is organized under the {@code prompter.*} prefix:
 * <ul>
 * <li>{@link StorageProperties} - where session files live</li>
 * <li>{@link CacheProperties} - metadata index and session data cache</li>
 * <li>{@link FileProcessingProperties} - batch file I/O limits</li>
 * <li>{@link LoaderProperties} - lazy loader concurrency and hygiene</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "prompter")
@Data
public class PrompterProperties {

    private StorageProperties storage = new StorageProperties();
    private CacheProperties cache = new CacheProperties();
    private FileProcessingProperties fileProcessing = new FileProcessingProperties();
    private LoaderProperties loader = new LoaderProperties();

    @Data
    public static class StorageProperties {
        private LocalStorageProperties local = new LocalStorageProperties();
        private DirectoriesProperties directories = new DirectoriesProperties();
    }

    @Data
    public static class LocalStorageProperties {
        private String basePath = "${user.home}/.claude-prompter";
    }

    @Data
    public static class DirectoriesProperties {
        private String sessions = "sessions";
    }

    @Data
    public static class CacheProperties {
        private String indexFileName = ".metadata-cache.json";
        private long maxMetadataCacheAgeMs = 5 * 60 * 1000L;
        private int maxSessionDataCacheSize = 20;
    }

    @Data
    public static class FileProcessingProperties {
        private int maxConcurrentReads = 10;
        private int maxConcurrentWrites = 5;
        private long operationTimeoutMs = 30000;
        private int batchSize = 20;
        private boolean enablePerformanceTracking = true;
    }

    @Data
    public static class LoaderProperties {
        private int preloadConcurrency = 3;
        private int bulkMetadataBatchSize = 10;
        private long optimizeMaxAgeMs = 30 * 60 * 1000L;
        private boolean maintenanceEnabled = true;
        private long maintenanceIntervalMs = 10 * 60 * 1000L;
    }
}
