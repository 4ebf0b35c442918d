package me.golemcore.prompter.auto;

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

import me.golemcore.prompter.domain.service.LazySessionLoader;
import me.golemcore.prompter.domain.service.SessionCacheManager;
import me.golemcore.prompter.infrastructure.config.PrompterProperties;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Lifecycle owner of the session caches.
 *
 * <p>
 * This component:
 * <ul>
 * <li>Initializes the metadata index at startup (loading or rebuilding it)</li>
 * <li>Periodically evicts idle sessions from the lazy loader cache</li>
 * <li>Releases processor bookkeeping on shutdown</li>
 * </ul>
 *
 * <p>
 * Ticks never overlap: a tick that finds the previous one still running is
 * skipped.
 *
 * @since 1.0
 * @see SessionCacheManager
 * @see LazySessionLoader
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CacheMaintenanceScheduler {

    private final SessionCacheManager cacheManager;
    private final LazySessionLoader sessionLoader;
    private final PrompterProperties properties;
    private final AtomicBoolean executing = new AtomicBoolean(false);

    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> tickTask;

    @PostConstruct
    public void init() {
        cacheManager.initialize();

        PrompterProperties.LoaderProperties loader = properties.getLoader();
        if (!loader.isMaintenanceEnabled()) {
            log.info("[CacheMaintenance] Periodic maintenance disabled");
            return;
        }

        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "cache-maintenance");
            t.setDaemon(true);
            return t;
        });
        long intervalMs = loader.getMaintenanceIntervalMs();
        tickTask = scheduler.scheduleAtFixedRate(this::tick, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        log.info("[CacheMaintenance] Started with interval: {}ms", intervalMs);
    }

    /**
     * One maintenance pass. Exposed for tests and manual triggering.
     */
    public void tick() {
        if (!executing.compareAndSet(false, true)) {
            log.debug("[CacheMaintenance] Previous tick still running, skipping");
            return;
        }
        try {
            int evicted = sessionLoader.optimizeCache();
            log.debug("[CacheMaintenance] Tick done, evicted {} idle sessions", evicted);
        } catch (RuntimeException e) { // NOSONAR
            log.warn("[CacheMaintenance] Tick failed: {}", e.getMessage(), e);
        } finally {
            executing.set(false);
        }
    }

    @PreDestroy
    public void shutdown() {
        if (tickTask != null) {
            tickTask.cancel(false);
        }
        if (scheduler != null) {
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        cacheManager.cleanup();
        log.info("[CacheMaintenance] Shut down");
    }
}
