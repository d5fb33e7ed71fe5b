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

package me.golemcore.orchestrator.adapter.outbound.llm;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.orchestrator.domain.exception.ExternalServiceException;
import me.golemcore.orchestrator.domain.model.LlmRequest;
import me.golemcore.orchestrator.domain.model.LlmResponse;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Used when no generation backend is configured. Every call fails, so each
 * caller's documented degradation path runs.
 */
@Component
@Slf4j
public class NoOpLlmAdapter implements LlmProviderAdapter {

    static final String PROVIDER_NONE = "none";

    @Override
    public String getProviderId() {
        return PROVIDER_NONE;
    }

    @Override
    public Set<String> getSupportedProviders() {
        return Set.of(PROVIDER_NONE);
    }

    @Override
    public CompletableFuture<LlmResponse> chat(LlmRequest request) {
        log.debug("[LLM] chat() called with no backend configured");
        return CompletableFuture.failedFuture(new ExternalServiceException("No LLM configured"));
    }

    @Override
    public boolean isAvailable() {
        return false;
    }
}
