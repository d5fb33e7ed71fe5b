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

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.orchestrator.domain.model.LlmRequest;
import me.golemcore.orchestrator.domain.model.LlmResponse;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import me.golemcore.orchestrator.port.outbound.LlmPort;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;

/**
 * Selects the active generation backend from {@code orchestrator.llm.provider}
 * and delegates to it. Falls back to {@link NoOpLlmAdapter} when the configured
 * provider is unknown or has no credentials.
 */
@Component
@Primary
@RequiredArgsConstructor
@Slf4j
public class LlmAdapterFactory implements LlmPort {

    private final OrchestratorProperties properties;
    private final List<LlmProviderAdapter> adapters;

    private LlmProviderAdapter activeAdapter;

    @PostConstruct
    public void init() {
        String provider = properties.getLlm().getProvider() != null
                ? properties.getLlm().getProvider().trim().toLowerCase(Locale.ROOT)
                : NoOpLlmAdapter.PROVIDER_NONE;

        activeAdapter = adapters.stream()
                .filter(adapter -> adapter.getSupportedProviders().contains(provider))
                .filter(LlmPort::isAvailable)
                .findFirst()
                .orElseGet(this::noOpAdapter);

        if (activeAdapter.isAvailable()) {
            log.info("[LLM] Active provider: {} ({})", provider, activeAdapter.getProviderId());
        } else {
            log.warn("[LLM] Provider '{}' is not configured, generation calls will degrade", provider);
        }
    }

    private LlmProviderAdapter noOpAdapter() {
        return adapters.stream()
                .filter(adapter -> adapter.getSupportedProviders().contains(NoOpLlmAdapter.PROVIDER_NONE))
                .findFirst()
                .orElseGet(NoOpLlmAdapter::new);
    }

    // ==================== LlmPort delegation ====================

    @Override
    public String getProviderId() {
        return activeAdapter != null ? activeAdapter.getProviderId() : NoOpLlmAdapter.PROVIDER_NONE;
    }

    @Override
    public CompletableFuture<LlmResponse> chat(LlmRequest request) {
        return activeAdapter.chat(request);
    }

    @Override
    public boolean isAvailable() {
        return activeAdapter != null && activeAdapter.isAvailable();
    }
}
