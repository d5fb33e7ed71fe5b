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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.orchestrator.domain.model.Message;
import me.golemcore.orchestrator.domain.model.Source;
import me.golemcore.orchestrator.domain.model.ToolResult;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns tool outputs into the final answer of the fallback path.
 *
 * <p>
 * Casual queries, and queries without tool outputs, get a short conversational
 * reply informed by recent history. Everything else gets a synthesis
 * completion over URL-free tool data, followed by a separate confidence-scoring
 * completion.
 */
@Service
@Slf4j
public class ResponseSynthesisService {

    static final String CASUAL_FALLBACK = "Hello! How can I assist you today?";
    public static final String FAILURE_MESSAGE = "I apologize, but I encountered an error while processing "
            + "your request. Please try rephrasing your question or ask something else.";
    static final int CASUAL_CONFIDENCE = 95;
    static final int CASUAL_FALLBACK_CONFIDENCE = 90;
    public static final int FAILURE_CONFIDENCE = 20;
    static final int BASELINE_WITH_ERRORS = 60;
    static final int BASELINE_WITHOUT_ERRORS = 85;

    private static final Set<String> URL_BEARING_KEYS = Set.of("url", "query_used", "search_query");
    private static final Pattern DIGITS = Pattern.compile("\\d+");

    private static final String CASUAL_SYSTEM_PROMPT = """
            You are a friendly, helpful assistant. Reply briefly and conversationally.
            Use the earlier messages of this conversation when the user asks about them.
            """;

    private static final String SUCCESS_SYSTEM_PROMPT = """
            You are a helpful assistant. Combine the information from the tools into a clear,
            well-structured answer to the user's query. Use markdown formatting.
            Do not include URLs or links: sources are listed separately.
            """;

    private static final String ERROR_AWARE_SYSTEM_PROMPT = """
            You are a helpful assistant. Some tools failed or returned limited results.
            Answer with the information that is available, say plainly what could not be retrieved,
            and suggest how the user might rephrase. Use markdown formatting.
            Do not include URLs or links: sources are listed separately.
            """;

    private final LlmCompletionService completionService;
    private final SourceExtractor sourceExtractor;
    private final OrchestratorProperties properties;
    private final ObjectMapper objectMapper;

    public ResponseSynthesisService(LlmCompletionService completionService, SourceExtractor sourceExtractor,
            OrchestratorProperties properties, ObjectMapper objectMapper) {
        this.completionService = completionService;
        this.sourceExtractor = sourceExtractor;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    public record SynthesisResult(String response, int confidence, List<Source> sources) {
    }

    public SynthesisResult synthesize(String query, Map<String, ToolResult> toolOutputs, boolean casual,
            List<Message> history) {
        if (casual || toolOutputs == null || toolOutputs.isEmpty()) {
            return casualReply(query, history);
        }
        try {
            boolean hasErrors = toolOutputs.values().stream().anyMatch(ToolResult::hasErrorMarker);
            String toolJson = objectMapper.writeValueAsString(stripUrls(toolOutputs));

            List<Message> messages = List.of(
                    Message.system(hasErrors ? ERROR_AWARE_SYSTEM_PROMPT : SUCCESS_SYSTEM_PROMPT),
                    Message.user("User Query: " + query + "\nInformation from Tools: " + toolJson));
            String response = completionService.completeSmart(messages, 0.7, 1000);
            if (response.isBlank()) {
                throw new IllegalStateException("empty synthesis");
            }

            int confidence = scoreConfidence(response, hasErrors);
            List<Source> sources = sourceExtractor.fromToolOutputs(toolOutputs);
            log.info("[Synthesis] Synthesized answer (errors={}, confidence={}, sources={})", hasErrors, confidence,
                    sources.size());
            return new SynthesisResult(response, confidence, sources);
        } catch (JsonProcessingException e) {
            log.error("[Synthesis] Failed to serialize tool outputs", e);
            return new SynthesisResult(FAILURE_MESSAGE, FAILURE_CONFIDENCE, List.of());
        } catch (Exception e) { // NOSONAR - never leave a request unanswered
            log.error("[Synthesis] Synthesis failed: {}", e.getMessage());
            return new SynthesisResult(FAILURE_MESSAGE, FAILURE_CONFIDENCE, List.of());
        }
    }

    private SynthesisResult casualReply(String query, List<Message> history) {
        try {
            List<Message> messages = new ArrayList<>();
            messages.add(Message.system(CASUAL_SYSTEM_PROMPT));
            if (history != null && !history.isEmpty()) {
                int turns = properties.getPipeline().getCasualHistoryTurns();
                messages.addAll(history.subList(Math.max(0, history.size() - turns), history.size()));
            }
            messages.add(Message.user(query));
            String reply = completionService.completeSmart(messages, 0.7, 150);
            if (reply.isBlank()) {
                return new SynthesisResult(CASUAL_FALLBACK, CASUAL_FALLBACK_CONFIDENCE, List.of());
            }
            return new SynthesisResult(reply, CASUAL_CONFIDENCE, List.of());
        } catch (Exception e) { // NOSONAR
            log.warn("[Synthesis] Casual reply failed: {}", e.getMessage());
            return new SynthesisResult(CASUAL_FALLBACK, CASUAL_FALLBACK_CONFIDENCE, List.of());
        }
    }

    int scoreConfidence(String response, boolean hasErrors) {
        int baseline = hasErrors ? BASELINE_WITH_ERRORS : BASELINE_WITHOUT_ERRORS;
        String prompt = "Based on the following response to a user query (errors present: " + hasErrors
                + "), what is your confidence score (0-100) that it fully and accurately answers the query? "
                + "Respond with only the number.\n\nResponse:\n" + response;
        try {
            String raw = completionService.completeFast(List.of(Message.user(prompt)), 0.0, 10);
            return parseConfidence(raw, baseline);
        } catch (Exception e) { // NOSONAR
            log.debug("[Synthesis] Confidence scoring failed, using baseline {}: {}", baseline, e.getMessage());
            return baseline;
        }
    }

    static int parseConfidence(String raw, int baseline) {
        if (raw == null) {
            return baseline;
        }
        Matcher matcher = DIGITS.matcher(raw);
        if (!matcher.find()) {
            return baseline;
        }
        try {
            return Math.max(0, Math.min(100, Integer.parseInt(matcher.group())));
        } catch (NumberFormatException e) {
            return 100;
        }
    }

    /**
     * Copies tool outputs without URL-bearing fields so the prose never echoes
     * raw links.
     */
    static Map<String, Object> stripUrls(Map<String, ToolResult> toolOutputs) {
        Map<String, Object> cleaned = new LinkedHashMap<>();
        toolOutputs.forEach((name, result) -> {
            if (result.isSuccess()) {
                cleaned.put(name, strip(result.getData()));
            } else {
                cleaned.put(name, Map.of(ToolResult.ERROR_KEY, String.valueOf(result.getError())));
            }
        });
        return cleaned;
    }

    private static Object strip(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            map.forEach((key, nested) -> {
                String name = String.valueOf(key);
                if (!URL_BEARING_KEYS.contains(name)) {
                    copy.put(name, strip(nested));
                }
            });
            return copy;
        }
        if (value instanceof List<?> list) {
            return list.stream().map(ResponseSynthesisService::strip).toList();
        }
        return value;
    }
}
