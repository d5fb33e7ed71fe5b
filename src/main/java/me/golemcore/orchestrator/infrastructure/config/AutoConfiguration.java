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

package me.golemcore.orchestrator.infrastructure.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.orchestrator.domain.service.ToolExecutionService;
import me.golemcore.orchestrator.port.outbound.LlmPort;
import me.golemcore.orchestrator.port.outbound.MemoryStorePort;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Shared beans and the startup summary.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AutoConfiguration {

    private final OrchestratorProperties properties;
    private final LlmPort llmPort;
    private final MemoryStorePort memoryStore;
    private final ToolExecutionService toolExecutionService;

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

    /**
     * Bounded pool running one pipeline per inbound query. Submissions beyond
     * the queue capacity are rejected.
     */
    @Bean(name = "pipelineExecutor", destroyMethod = "")
    public static ExecutorService pipelineExecutor(OrchestratorProperties properties) {
        OrchestratorProperties.PipelineProperties pipeline = properties.getPipeline();
        int threads = Math.max(1, pipeline.getWorkerThreads());
        AtomicInteger threadCounter = new AtomicInteger();
        return new ThreadPoolExecutor(threads, threads, 60, TimeUnit.SECONDS,
                new ArrayBlockingQueue<>(Math.max(1, pipeline.getQueueCapacity())),
                r -> {
                    Thread t = new Thread(r, "pipeline-worker-" + threadCounter.incrementAndGet());
                    t.setDaemon(true);
                    return t;
                },
                new ThreadPoolExecutor.AbortPolicy());
    }

    @PostConstruct
    public void init() {
        log.info("Query orchestrator starting...");
        log.info("LLM Provider: {} (available: {})", properties.getLlm().getProvider(), llmPort.isAvailable());
        log.info("Models: fast={}, smart={}", properties.getLlm().getFastModel(), properties.getLlm().getSmartModel());
        log.info("Tools: {}", toolExecutionService.getToolNames());
        log.info("Durable memory: {}", memoryStore.isAvailable() ? "enabled" : "disabled");
        log.info("Worker pool: {} threads, queue {}", properties.getPipeline().getWorkerThreads(),
                properties.getPipeline().getQueueCapacity());
    }
}
