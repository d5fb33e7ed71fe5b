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

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.exception.RateLimitException;
import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.openai.OpenAiChatModel;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.orchestrator.domain.exception.ExternalServiceException;
import me.golemcore.orchestrator.domain.model.LlmRequest;
import me.golemcore.orchestrator.domain.model.LlmResponse;
import me.golemcore.orchestrator.domain.model.Message;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Generation backend over langchain4j.
 *
 * <p>
 * Supports any OpenAI-compatible endpoint (Groq by default) and Anthropic. One
 * chat model is built lazily per model name; temperature and output limit are
 * passed per request. Rate-limit failures are retried with exponential
 * backoff, everything else fails the returned future.
 */
@Component
@Slf4j
public class Langchain4jAdapter implements LlmProviderAdapter {

    private static final String PROVIDER_OPENAI = "openai";
    private static final String PROVIDER_ANTHROPIC = "anthropic";
    private static final double BACKOFF_MULTIPLIER = 2.0;
    private static final int ANTHROPIC_DEFAULT_MAX_TOKENS = 1024;

    private static final ExecutorService LLM_EXECUTOR = Executors.newFixedThreadPool(8,
            r -> {
                Thread t = new Thread(r, "llm-call");
                t.setDaemon(true);
                return t;
            });

    private final OrchestratorProperties properties;
    private final Map<String, ChatModel> models = new ConcurrentHashMap<>();

    public Langchain4jAdapter(OrchestratorProperties properties) {
        this.properties = properties;
    }

    @Override
    public String getProviderId() {
        return "langchain4j";
    }

    @Override
    public Set<String> getSupportedProviders() {
        return Set.of(PROVIDER_OPENAI, PROVIDER_ANTHROPIC);
    }

    @Override
    public boolean isAvailable() {
        String apiKey = properties.getLlm().getApiKey();
        return apiKey != null && !apiKey.isBlank();
    }

    @Override
    public CompletableFuture<LlmResponse> chat(LlmRequest request) {
        return CompletableFuture.supplyAsync(() -> {
            if (!isAvailable()) {
                throw new ExternalServiceException("Langchain4j adapter not available");
            }
            String modelName = request.getModel() != null ? request.getModel()
                    : properties.getLlm().getSmartModel();
            ChatModel model = models.computeIfAbsent(modelName, this::createModel);
            ChatRequest.Builder chatRequest = ChatRequest.builder()
                    .messages(convertMessages(request.getMessages()))
                    .temperature(request.getTemperature());
            if (request.getMaxTokens() != null) {
                chatRequest.maxOutputTokens(request.getMaxTokens());
            }
            ChatResponse response = chatWithRetry(model, chatRequest.build());
            return LlmResponse.builder()
                    .content(response.aiMessage() != null ? response.aiMessage().text() : null)
                    .model(modelName)
                    .finishReason(response.finishReason() != null
                            ? response.finishReason().name().toLowerCase(Locale.ROOT)
                            : null)
                    .build();
        }, LLM_EXECUTOR);
    }

    private ChatResponse chatWithRetry(ChatModel model, ChatRequest chatRequest) {
        int maxRetries = properties.getLlm().getMaxRetries();
        long initialBackoffMs = properties.getLlm().getInitialBackoffMs();
        for (int attempt = 0;; attempt++) {
            try {
                return model.chat(chatRequest);
            } catch (RuntimeException e) {
                if (!isRateLimitError(e) || attempt >= maxRetries) {
                    log.error("[LLM] Chat failed: {}", e.getMessage());
                    throw new ExternalServiceException("LLM chat failed: " + e.getMessage(), e);
                }
                long backoffMs = (long) (initialBackoffMs * Math.pow(BACKOFF_MULTIPLIER, attempt));
                log.warn("[LLM] Rate limit hit (attempt {}/{}), retrying in {}ms...", attempt + 1, maxRetries,
                        backoffMs);
                try {
                    Thread.sleep(backoffMs);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new ExternalServiceException("LLM chat interrupted during retry backoff", ie);
                }
            }
        }
    }

    static boolean isRateLimitError(Throwable e) {
        Throwable current = e;
        while (current != null) {
            if (current instanceof RateLimitException) {
                return true;
            }
            String msg = current.getMessage();
            if (msg != null && (msg.contains("rate_limit") || msg.contains("Too Many Requests")
                    || msg.contains("429"))) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }

    private ChatModel createModel(String modelName) {
        OrchestratorProperties.LlmProperties llm = properties.getLlm();
        Duration timeout = Duration.ofMillis(llm.getTimeoutMs());
        if (PROVIDER_ANTHROPIC.equalsIgnoreCase(llm.getProvider())) {
            var builder = AnthropicChatModel.builder()
                    .apiKey(llm.getApiKey())
                    .modelName(modelName)
                    .maxRetries(0) // retry handled by our backoff logic
                    .maxTokens(ANTHROPIC_DEFAULT_MAX_TOKENS)
                    .timeout(timeout);
            if (llm.getBaseUrl() != null && !llm.getBaseUrl().isBlank()) {
                builder.baseUrl(llm.getBaseUrl());
            }
            log.info("[LLM] Created Anthropic model: {}", modelName);
            return builder.build();
        }
        var builder = OpenAiChatModel.builder()
                .apiKey(llm.getApiKey())
                .modelName(modelName)
                .maxRetries(0) // retry handled by our backoff logic
                .timeout(timeout);
        if (llm.getBaseUrl() != null && !llm.getBaseUrl().isBlank()) {
            builder.baseUrl(llm.getBaseUrl());
        }
        log.info("[LLM] Created OpenAI-compatible model: {}", modelName);
        return builder.build();
    }

    static List<ChatMessage> convertMessages(List<Message> messages) {
        return messages.stream()
                .map(Langchain4jAdapter::convertMessage)
                .toList();
    }

    private static ChatMessage convertMessage(Message message) {
        String content = message.getContent() != null ? message.getContent() : "";
        String role = message.getRole() != null ? message.getRole() : Message.ROLE_USER;
        return switch (role) {
            case Message.ROLE_SYSTEM -> SystemMessage.from(content);
            case Message.ROLE_ASSISTANT -> AiMessage.from(content);
            default -> UserMessage.from(content);
        };
    }
}
