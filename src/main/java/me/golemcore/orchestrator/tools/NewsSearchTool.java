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
 * Recent news search. Returns a list of
 * {@code {title, source, date, url, snippet}} items.
 */
@Component
@RequiredArgsConstructor
public class NewsSearchTool implements ToolComponent {

    private static final String PARAM_QUERY = "query";

    private final SearchPort searchPort;
    private final OrchestratorProperties properties;

    @Override
    public boolean isEnabled() {
        return properties.getTools().getNewsSearch().isEnabled();
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.withStringParams(ToolNames.NEWS_SEARCH,
                "Search recent news articles. Returns headlines, sources, dates and URLs.",
                Map.of(PARAM_QUERY, "The news topic to search for"));
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        String query = ToolParameters.requireString(parameters, PARAM_QUERY);
        if (query == null) {
            return CompletableFuture.completedFuture(ToolResult.failure("News query is required"));
        }
        int maxResults = properties.getTools().getNewsSearch().getMaxResults();
        return searchPort.newsSearch(query, maxResults).thenApply(ToolResult::success);
    }
}
