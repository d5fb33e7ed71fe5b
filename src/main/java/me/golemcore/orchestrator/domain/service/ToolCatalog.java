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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.orchestrator.domain.model.DiscoveredTool;
import me.golemcore.orchestrator.domain.model.ToolNeedAnalysis;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of capability gaps reported by tool-need analysis. Entries are
 * descriptors for operators to review; no code is generated or executed.
 */
@Service
@Slf4j
public class ToolCatalog {

    private final Clock clock;
    private final Map<String, DiscoveredTool> discovered = new ConcurrentHashMap<>();

    public ToolCatalog(Clock clock) {
        this.clock = clock;
    }

    /**
     * Records a suggested capability, or bumps its counter when already known.
     *
     * @return true when the suggestion was new
     */
    public boolean recordSuggestion(ToolNeedAnalysis analysis, String query) {
        String name = normalizeName(analysis.getSuggestedToolName());
        if (name.isEmpty()) {
            return false;
        }
        Instant now = Instant.now(clock);
        boolean[] created = new boolean[1];
        discovered.compute(name, (key, existing) -> {
            if (existing != null) {
                existing.setOccurrences(existing.getOccurrences() + 1);
                return existing;
            }
            created[0] = true;
            return DiscoveredTool.builder()
                    .name(key)
                    .description(analysis.getToolDescription())
                    .capabilities(analysis.getToolCapabilities() != null
                            ? List.copyOf(analysis.getToolCapabilities())
                            : List.of())
                    .priority(analysis.getPriority())
                    .reasoning(analysis.getReasoning())
                    .sampleQuery(query)
                    .discoveredAt(now)
                    .occurrences(1)
                    .build();
        });
        if (created[0]) {
            log.info("[Discovery] New capability gap recorded: {} ({})", name, analysis.getPriority());
        }
        return created[0];
    }

    public List<DiscoveredTool> getDiscoveredTools() {
        List<DiscoveredTool> tools = new ArrayList<>(discovered.values());
        tools.sort(Comparator.comparing(DiscoveredTool::getDiscoveredAt));
        return tools;
    }

    public int size() {
        return discovered.size();
    }

    private static String normalizeName(String name) {
        if (name == null) {
            return "";
        }
        return name.trim().toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9_]+", "_");
    }
}
