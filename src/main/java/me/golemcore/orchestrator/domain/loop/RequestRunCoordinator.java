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

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.orchestrator.domain.model.Query;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import me.golemcore.orchestrator.port.inbound.ProgressChannelPort;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Runs each inbound query as an independent unit of work on the bounded
 * pipeline pool. Queries from different users proceed concurrently with no
 * ordering guarantee between them.
 *
 * <p>
 * When the pool and its queue are full the query is refused, but its sender
 * still receives exactly one {@code final_response}.
 */
@Service
@Slf4j
public class RequestRunCoordinator {

    private final PipelineDriver pipelineDriver;
    private final ExecutorService pipelineExecutor;
    private final ProgressChannelPort channel;
    private final OrchestratorProperties properties;

    public RequestRunCoordinator(PipelineDriver pipelineDriver,
            @Qualifier("pipelineExecutor") ExecutorService pipelineExecutor, ProgressChannelPort channel,
            OrchestratorProperties properties) {
        this.pipelineDriver = pipelineDriver;
        this.pipelineExecutor = pipelineExecutor;
        this.channel = channel;
        this.properties = properties;
    }

    public void enqueue(Query query) {
        try {
            pipelineExecutor.submit(() -> {
                try {
                    pipelineDriver.process(query);
                } catch (Exception e) { // NOSONAR - must not kill executor thread
                    log.error("[Pipeline] Run failed for user {}", query.userId(), e);
                }
            });
        } catch (RejectedExecutionException e) {
            log.warn("[Pipeline] Worker pool saturated, refusing query from {}", query.userId());
            channel.sendFinalResponse(query.userId(), PipelineDriver.unavailablePayload(0.0))
                    .exceptionally(error -> {
                        log.warn("[Pipeline] Failed to notify {} of refusal: {}", query.userId(),
                                error.getMessage());
                        return null;
                    });
        }
    }

    @PreDestroy
    public void shutdown() {
        pipelineExecutor.shutdown();
        try {
            if (!pipelineExecutor.awaitTermination(properties.getPipeline().getShutdownTimeoutSeconds(),
                    TimeUnit.SECONDS)) {
                pipelineExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            pipelineExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("[Pipeline] Worker pool shut down");
    }
}
