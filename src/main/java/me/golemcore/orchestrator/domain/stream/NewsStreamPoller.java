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

package me.golemcore.orchestrator.domain.stream;

import lombok.RequiredArgsConstructor;
import me.golemcore.orchestrator.domain.model.StreamType;
import me.golemcore.orchestrator.domain.model.ToolResult;
import me.golemcore.orchestrator.domain.service.ExternalCalls;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import me.golemcore.orchestrator.port.outbound.SearchPort;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Runs a news search per configured keyword and keeps the deduplicated union.
 */
@Component
@RequiredArgsConstructor
public class NewsStreamPoller implements StreamPoller {

    static final List<String> DEFAULT_KEYWORDS = List.of("AI", "technology");
    private static final int RESULTS_PER_KEYWORD = 3;

    private final SearchPort searchPort;
    private final OrchestratorProperties properties;
    private final Clock clock;

    @Override
    public StreamType getType() {
        return StreamType.NEWS;
    }

    @Override
    public Duration getInterval() {
        return Duration.ofMinutes(5);
    }

    @Override
    public Duration getErrorInterval() {
        return Duration.ofMinutes(10);
    }

    @Override
    public Task open(Map<String, Object> config) {
        List<String> keywords = StreamConfig.stringList(config, "keywords", DEFAULT_KEYWORDS);
        return () -> {
            List<Map<String, Object>> latest = new ArrayList<>();
            for (String keyword : keywords) {
                latest.addAll(ExternalCalls.await(searchPort.newsSearch(keyword, RESULTS_PER_KEYWORD),
                        properties.getTools().getTimeoutMs(), "News search"));
            }
            return Optional.of(deduplicate(latest));
        };
    }

    private List<Map<String, Object>> deduplicate(List<Map<String, Object>> items) {
        String streamTimestamp = clock.instant().toString();
        Set<Object> seenUrls = new HashSet<>();
        List<Map<String, Object>> unique = new ArrayList<>();
        for (Map<String, Object> item : items) {
            if (item == null || item.containsKey(ToolResult.ERROR_KEY) || !seenUrls.add(item.get("url"))) {
                continue;
            }
            Map<String, Object> stamped = new LinkedHashMap<>(item);
            stamped.put("stream_timestamp", streamTimestamp);
            unique.add(stamped);
        }
        return unique;
    }
}
