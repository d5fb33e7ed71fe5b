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

package me.golemcore.orchestrator.domain.agent;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.orchestrator.domain.model.Message;
import me.golemcore.orchestrator.domain.model.UserContext;
import me.golemcore.orchestrator.domain.service.ExternalCalls;
import me.golemcore.orchestrator.domain.service.LlmCompletionService;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import me.golemcore.orchestrator.port.outbound.FinancePort;
import me.golemcore.orchestrator.routing.TickerExtractor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Analysis specialist: pulls a stock quote when the query is about a listed
 * company, then asks for analytical commentary over whatever data it has.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AnalysisAgent implements SpecialistAgent {

    static final String NAME = "AnalysisAgent";
    static final String INSIGHTS_UNAVAILABLE = "Analysis temporarily unavailable.";

    private static final KeywordPredicate CAPABILITY = KeywordPredicate.of(List.of(
            "analyze", "compare", "statistics", "data", "trends", "insights", "stock", "price", "financial",
            "market"));
    private static final KeywordPredicate FINANCIAL = KeywordPredicate.of(List.of(
            "stock", "price", "financial", "market", "dividend", "earnings"));

    private final TickerExtractor tickerExtractor;
    private final FinancePort financePort;
    private final LlmCompletionService completionService;
    private final OrchestratorProperties properties;
    private final ObjectMapper objectMapper;

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public boolean canHandle(String query) {
        return CAPABILITY.matches(query);
    }

    @Override
    public Map<String, Object> process(String query, UserContext context) {
        Map<String, Object> analysisResults = new LinkedHashMap<>();
        String analysisType = "general";

        if (FINANCIAL.matches(query)) {
            Optional<String> ticker = tickerExtractor.extract(query);
            if (ticker.isPresent()) {
                Map<String, Object> quote = ExternalCalls.await(financePort.getQuote(ticker.get()),
                        properties.getTools().getTimeoutMs(), "Stock quote");
                analysisResults.put("financial_analysis", quote);
                analysisType = "financial";
            }
        }
        analysisResults.put("insights", insights(query, analysisResults));

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("agent", NAME);
        payload.put("analysis_type", analysisType);
        payload.put("analysis_results", analysisResults);
        return payload;
    }

    private String insights(String query, Map<String, Object> data) {
        try {
            String prompt = "Provide concise analytical insights for this query: " + query
                    + "\nAvailable data: " + objectMapper.writeValueAsString(data)
                    + "\nFocus on key trends, comparisons and implications.";
            String insights = completionService.completeSmart(List.of(Message.user(prompt)), 0.3, 300);
            return insights.isBlank() ? INSIGHTS_UNAVAILABLE : insights;
        } catch (Exception e) { // NOSONAR
            log.warn("[Specialist] Analytical insights failed: {}", e.getMessage());
            return INSIGHTS_UNAVAILABLE;
        }
    }
}
