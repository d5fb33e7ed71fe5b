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

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.orchestrator.domain.model.Message;
import me.golemcore.orchestrator.domain.model.ToolNeedAnalysis;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.Collection;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Asks the generation backend whether the registered tools cover a query.
 * Actionable gaps (high or medium priority) are recorded in the
 * {@link ToolCatalog}. Any failure means "no new tool needed".
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ToolNeedAnalyzer {

    private static final Pattern JSON_OBJECT = Pattern.compile("\\{.*}", Pattern.DOTALL);

    private static final String SYSTEM_PROMPT = """
            You review whether an assistant's tools can answer a query. Respond with JSON only:
            {"needs_new_tool": true|false, "suggested_tool_name": "snake_case_name",
             "tool_description": "...", "tool_capabilities": ["..."],
             "priority": "high|medium|low", "reasoning": "..."}
            """;

    private final LlmCompletionService completionService;
    private final ToolCatalog toolCatalog;
    private final OrchestratorProperties properties;
    private final ObjectMapper objectMapper;

    public boolean isEnabled() {
        return properties.getDiscovery().isEnabled();
    }

    public ToolNeedAnalysis analyze(String query, Collection<String> availableTools) {
        try {
            String prompt = "Query: " + query + "\nAvailable tools: " + String.join(", ", availableTools);
            String raw = completionService.completeFast(
                    List.of(Message.system(SYSTEM_PROMPT), Message.user(prompt)), 0.0, 300);
            ToolNeedAnalysis analysis = parse(raw);
            if (analysis.isActionable()) {
                toolCatalog.recordSuggestion(analysis, query);
            }
            return analysis;
        } catch (Exception e) { // NOSONAR
            log.debug("[Discovery] Tool-need analysis failed: {}", e.getMessage());
            return ToolNeedAnalysis.none();
        }
    }

    ToolNeedAnalysis parse(String raw) throws IOException {
        Matcher matcher = JSON_OBJECT.matcher(raw == null ? "" : raw);
        if (!matcher.find()) {
            return ToolNeedAnalysis.none();
        }
        return objectMapper.readValue(matcher.group(), ToolNeedAnalysis.class);
    }
}
