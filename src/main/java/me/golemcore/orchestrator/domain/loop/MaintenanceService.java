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

package me.golemcore.orchestrator.domain.loop;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.orchestrator.domain.service.AnalyticsService;
import me.golemcore.orchestrator.domain.service.RequestCacheService;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import org.springframework.stereotype.Service;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Periodic housekeeping: drops expired cache entries and analytics patterns
 * past their retention window.
 */
@Service
@Slf4j
public class MaintenanceService {

    private final RequestCacheService cache;
    private final AnalyticsService analytics;
    private final OrchestratorProperties properties;
    private ScheduledExecutorService scheduler;

    public MaintenanceService(RequestCacheService cache, AnalyticsService analytics,
            OrchestratorProperties properties) {
        this.cache = cache;
        this.analytics = analytics;
        this.properties = properties;
    }

    @PostConstruct
    public void init() {
        long intervalMs = properties.getCache().getCleanupInterval().toMillis();
        if (intervalMs <= 0) {
            log.info("[Maintenance] Disabled");
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "maintenance");
            t.setDaemon(true);
            return t;
        });
        scheduler.scheduleWithFixedDelay(this::runMaintenance, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        log.info("[Maintenance] Started with interval: {}ms", intervalMs);
    }

    @PreDestroy
    public void shutdown() {
        if (scheduler == null) {
            return;
        }
        scheduler.shutdownNow();
        try {
            scheduler.awaitTermination(2, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    void runMaintenance() {
        try {
            int purged = cache.purgeExpired();
            int pruned = analytics.pruneExpired();
            if (purged > 0 || pruned > 0) {
                log.info("[Maintenance] Purged {} cache entries, pruned {} analytics patterns", purged, pruned);
            }
        } catch (Exception e) { // NOSONAR - keep the schedule alive
            log.error("[Maintenance] Optimization failed", e);
        }
    }
}
