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

import me.golemcore.prompter.concurrency.ConcurrentFileProcessor;
import me.golemcore.prompter.concurrency.ProcessingSettings;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.time.Clock;

/**
 * Spring configuration for the shared infrastructure beans.
 *
 * <p>
 * This configuration:
 * <ul>
 * <li>Provides the {@link Clock} and the ISO-8601 {@link ObjectMapper} used by
 * every component that reads or writes session files</li>
 * <li>Builds the {@link ConcurrentFileProcessor} from
 * {@code prompter.file-processing.*}</li>
 * <li>Logs the effective storage and cache settings at startup</li>
 * </ul>
 *
 * @since 1.0
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AutoConfiguration {

    private final PrompterProperties properties;

    @Bean
    public static Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @Bean
    public ConcurrentFileProcessor concurrentFileProcessor() {
        return new ConcurrentFileProcessor(processingSettings(properties.getFileProcessing()));
    }

    static ProcessingSettings processingSettings(PrompterProperties.FileProcessingProperties fileProcessing) {
        return ProcessingSettings.builder()
                .maxConcurrentReads(fileProcessing.getMaxConcurrentReads())
                .maxConcurrentWrites(fileProcessing.getMaxConcurrentWrites())
                .operationTimeoutMs(fileProcessing.getOperationTimeoutMs())
                .batchSize(fileProcessing.getBatchSize())
                .enablePerformanceTracking(fileProcessing.isEnablePerformanceTracking())
                .build();
    }

    @PostConstruct
    public void init() {
        log.info("Prompter session store starting...");
        log.info("Storage Path: {}", properties.getStorage().getLocal().getBasePath());
        log.info("Sessions Directory: {}", properties.getStorage().getDirectories().getSessions());
        log.info("Session data cache size: {}, metadata max age: {}ms",
                properties.getCache().getMaxSessionDataCacheSize(),
                properties.getCache().getMaxMetadataCacheAgeMs());
    }
}
