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

package me.golemcore.orchestrator.domain.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.orchestrator.domain.exception.ExternalServiceException;
import me.golemcore.orchestrator.domain.model.LlmRequest;
import me.golemcore.orchestrator.domain.model.LlmResponse;
import me.golemcore.orchestrator.domain.model.Message;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import me.golemcore.orchestrator.port.outbound.LlmPort;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Timeout-bounded completions against the generation backend, addressed by
 * model tier. Failures surface as {@link ExternalServiceException}; callers
 * decide how to degrade.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LlmCompletionService {

    private final LlmPort llmPort;
    private final OrchestratorProperties properties;

    /**
     * Completion on the fast tier (classification, extraction, scoring).
     */
    public String completeFast(List<Message> messages, double temperature, int maxTokens) {
        return complete(properties.getLlm().getFastModel(), messages, temperature, maxTokens);
    }

    /**
     * Completion on the smart tier (synthesis, content, personalization).
     */
    public String completeSmart(List<Message> messages, double temperature, int maxTokens) {
        return complete(properties.getLlm().getSmartModel(), messages, temperature, maxTokens);
    }

    public String complete(String model, List<Message> messages, double temperature, int maxTokens) {
        LlmRequest request = LlmRequest.builder()
                .model(model)
                .messages(List.copyOf(messages))
                .temperature(temperature)
                .maxTokens(maxTokens)
                .build();
        long startMs = System.currentTimeMillis();
        LlmResponse response = ExternalCalls.await(llmPort.chat(request),
                properties.getLlm().getTimeoutMs(), "LLM call (" + model + ")");
        log.debug("[LLM] {} responded in {}ms", model, System.currentTimeMillis() - startMs);
        if (response == null) {
            throw new ExternalServiceException("LLM returned no response");
        }
        return response.contentOrEmpty().trim();
    }
}
