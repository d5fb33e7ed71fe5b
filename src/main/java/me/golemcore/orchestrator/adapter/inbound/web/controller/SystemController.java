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

package me.golemcore.orchestrator.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.orchestrator.adapter.inbound.web.dto.SystemHealthResponse;
import me.golemcore.orchestrator.domain.model.CacheStats;
import me.golemcore.orchestrator.domain.model.StreamSnapshot;
import me.golemcore.orchestrator.domain.model.StreamStatus;
import me.golemcore.orchestrator.domain.service.RequestCacheService;
import me.golemcore.orchestrator.domain.service.ToolCatalog;
import me.golemcore.orchestrator.domain.stream.DataStreamRegistry;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.lang.management.ManagementFactory;

/**
 * Read-only introspection: health summary and data stream snapshots.
 */
@RestController
@RequestMapping("/api/system")
@RequiredArgsConstructor
@Slf4j
public class SystemController {

    private final DataStreamRegistry streams;
    private final RequestCacheService cache;
    private final ToolCatalog toolCatalog;

    @GetMapping("/health")
    public Mono<ResponseEntity<SystemHealthResponse>> health() {
        try {
            CacheStats stats = cache.getStats();
            SystemHealthResponse response = SystemHealthResponse.builder()
                    .status("healthy")
                    .activeDataStreams(streams.activeStreamCount())
                    .streamsInitialized(streams.isDefaultStreamsInitialized())
                    .cachePerformance(SystemHealthResponse.CachePerformance.builder()
                            .hitRate(stats.hitRate())
                            .totalEntries(stats.totalEntries())
                            .totalRequests(stats.totalRequests())
                            .build())
                    .discoveredTools(toolCatalog.size())
                    .uptimeMs(ManagementFactory.getRuntimeMXBean().getUptime())
                    .build();
            return Mono.just(ResponseEntity.ok(response));
        } catch (Exception e) { // NOSONAR
            log.error("[System] Health check failed", e);
            return Mono.just(ResponseEntity.internalServerError()
                    .body(SystemHealthResponse.builder().status("error").message(e.getMessage()).build()));
        }
    }

    @GetMapping("/streams/{streamId}")
    public Mono<ResponseEntity<StreamSnapshot>> stream(@PathVariable String streamId) {
        StreamSnapshot snapshot = streams.getLatestData(streamId);
        if (snapshot.getStatus() == StreamStatus.NOT_FOUND) {
            return Mono.just(ResponseEntity.notFound().build());
        }
        return Mono.just(ResponseEntity.ok(snapshot));
    }
}
