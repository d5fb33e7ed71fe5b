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

package me.golemcore.orchestrator.tools;

import lombok.RequiredArgsConstructor;
import me.golemcore.orchestrator.domain.component.ToolComponent;
import me.golemcore.orchestrator.domain.model.ToolDefinition;
import me.golemcore.orchestrator.domain.model.ToolNames;
import me.golemcore.orchestrator.domain.model.ToolResult;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import me.golemcore.orchestrator.port.outbound.SearchPort;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * General web search. Returns a list of {@code {title, snippet, url}} items.
 *
 * <p>
 * Configuration:
 * <ul>
 * <li>{@code orchestrator.tools.web-search.enabled} - Enable/disable
 * <li>{@code orchestrator.tools.web-search.max-results} - Results per call
 * (default 8)
 * </ul>
 */
@Component
@RequiredArgsConstructor
public class WebSearchTool implements ToolComponent {

    private static final String PARAM_QUERY = "query";

    private final SearchPort searchPort;
    private final OrchestratorProperties properties;

    @Override
    public boolean isEnabled() {
        return properties.getTools().getWebSearch().isEnabled();
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.withStringParams(ToolNames.WEB_SEARCH,
                "Search the web for general information. Returns titles, snippets and URLs.",
                Map.of(PARAM_QUERY, "The search query"));
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        String query = ToolParameters.requireString(parameters, PARAM_QUERY);
        if (query == null) {
            return CompletableFuture.completedFuture(ToolResult.failure("Search query is required"));
        }
        int maxResults = properties.getTools().getWebSearch().getMaxResults();
        return searchPort.webSearch(query, maxResults).thenApply(ToolResult::success);
    }
}
