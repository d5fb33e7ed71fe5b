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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.orchestrator.domain.model.UserContext;
import me.golemcore.orchestrator.domain.service.ExternalCalls;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import me.golemcore.orchestrator.port.outbound.SearchPort;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Research specialist: news-focused lookups for queries about recent events,
 * broad web lookups otherwise.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ResearchAgent implements SpecialistAgent {

    static final String NAME = "ResearchAgent";
    private static final int NEWS_PRIMARY_RESULTS = 5;
    private static final int NEWS_SECONDARY_RESULTS = 3;
    private static final int WEB_RESULTS = 8;

    private static final KeywordPredicate CAPABILITY = KeywordPredicate.of(List.of(
            "research", "find information", "tell me about", "what is", "explain", "how does",
            "latest news", "recent developments"));
    private static final KeywordPredicate NEWS_SEARCH = KeywordPredicate.of(List.of("news", "recent"));
    private static final KeywordPredicate NEWS_LABEL = KeywordPredicate.of(List.of("news"));

    private final SearchPort searchPort;
    private final OrchestratorProperties properties;

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
        long timeoutMs = properties.getTools().getTimeoutMs();
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("agent", NAME);

        List<Map<String, Object>> primary;
        List<Map<String, Object>> secondary;
        payload.put("research_strategy", NEWS_LABEL.matches(query) ? "news_focused" : "web_focused");
        if (NEWS_SEARCH.matches(query)) {
            primary = ExternalCalls.await(searchPort.newsSearch(query, NEWS_PRIMARY_RESULTS), timeoutMs,
                    "News search");
            secondary = ExternalCalls.await(searchPort.webSearch(query, NEWS_SECONDARY_RESULTS), timeoutMs,
                    "Web search");
        } else {
            primary = ExternalCalls.await(searchPort.webSearch(query, WEB_RESULTS), timeoutMs, "Web search");
            secondary = List.of();
        }
        payload.put("primary_results", primary);
        payload.put("secondary_results", secondary);
        payload.put("total_sources", primary.size() + secondary.size());
        log.debug("[Specialist] Research gathered {} primary and {} secondary results", primary.size(),
                secondary.size());
        return payload;
    }
}
