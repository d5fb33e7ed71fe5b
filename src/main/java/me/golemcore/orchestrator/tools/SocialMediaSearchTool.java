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

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Search restricted to one social platform (instagram, twitter, tiktok,
 * facebook, youtube) or to all of them.
 */
@Component
@RequiredArgsConstructor
public class SocialMediaSearchTool implements ToolComponent {

    private static final String PARAM_QUERY = "query";
    private static final String PARAM_PLATFORM = "platform";
    private static final String DEFAULT_PLATFORM = "all";

    private final SearchPort searchPort;
    private final OrchestratorProperties properties;

    @Override
    public boolean isEnabled() {
        return properties.getTools().getSocialMediaSearch().isEnabled();
    }

    @Override
    public ToolDefinition getDefinition() {
        Map<String, String> params = new LinkedHashMap<>();
        params.put(PARAM_QUERY, "What to look for");
        params.put(PARAM_PLATFORM, "instagram, twitter, tiktok, facebook, youtube or all");
        return ToolDefinition.withStringParams(ToolNames.SOCIAL_MEDIA_SEARCH,
                "Search public social media content on a given platform.", params);
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        String query = ToolParameters.requireString(parameters, PARAM_QUERY);
        if (query == null) {
            return CompletableFuture.completedFuture(ToolResult.failure("Search query is required"));
        }
        String platform = ToolParameters.requireString(parameters, PARAM_PLATFORM);
        int maxResults = properties.getTools().getSocialMediaSearch().getMaxResults();
        return searchPort.socialMediaSearch(query, platform != null ? platform : DEFAULT_PLATFORM, maxResults)
                .thenApply(ToolResult::success);
    }
}
