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

package me.golemcore.orchestrator.adapter.outbound.embedding;

import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import me.golemcore.orchestrator.port.outbound.EmbeddingPort;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * OpenAI-compatible embeddings through langchain4j, configured from
 * {@code orchestrator.embedding} ({@code api-key}, optional {@code base-url},
 * {@code model}). The model is built on first use; without an API key every
 * call fails and the durable memory store degrades.
 */
@Component
@Slf4j
public class Langchain4jEmbeddingAdapter implements EmbeddingPort {

    private static final String DEFAULT_MODEL = "text-embedding-3-small";

    private static final ExecutorService EMBEDDING_EXECUTOR = Executors.newFixedThreadPool(4,
            r -> {
                Thread t = new Thread(r, "embedding-call");
                t.setDaemon(true);
                return t;
            });

    private final OrchestratorProperties properties;
    private Optional<EmbeddingModel> model;

    public Langchain4jEmbeddingAdapter(OrchestratorProperties properties) {
        this.properties = properties;
    }

    @Override
    public CompletableFuture<float[]> embed(String text) {
        return CompletableFuture.supplyAsync(() -> resolveModel()
                .orElseThrow(() -> new IllegalStateException("Embedding model not configured"))
                .embed(text)
                .content()
                .vector(), EMBEDDING_EXECUTOR);
    }

    @Override
    public String getModel() {
        String configured = properties.getEmbedding().getModel();
        return configured == null || configured.isBlank() ? DEFAULT_MODEL : configured;
    }

    @Override
    public boolean isAvailable() {
        return resolveModel().isPresent();
    }

    private synchronized Optional<EmbeddingModel> resolveModel() {
        if (model == null) {
            model = buildModel();
        }
        return model;
    }

    private Optional<EmbeddingModel> buildModel() {
        OrchestratorProperties.EmbeddingProperties config = properties.getEmbedding();
        if (config.getApiKey() == null || config.getApiKey().isBlank()) {
            log.warn("[Embedding] No API key, durable memory vectors unavailable");
            return Optional.empty();
        }
        try {
            var builder = OpenAiEmbeddingModel.builder()
                    .apiKey(config.getApiKey())
                    .modelName(getModel());
            if (config.getBaseUrl() != null && !config.getBaseUrl().isBlank()) {
                builder.baseUrl(config.getBaseUrl());
            }
            log.info("[Embedding] Using model {}", getModel());
            return Optional.of(builder.build());
        } catch (RuntimeException e) {
            log.error("[Embedding] Model setup failed", e);
            return Optional.empty();
        }
    }
}
