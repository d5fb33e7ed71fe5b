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

package me.golemcore.orchestrator.domain.model;

import lombok.Data;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;

/**
 * Per-user interaction statistics. The pattern window keeps only the most
 * recent entries; callers must hold the owning lock while mutating.
 */
@Data
public class AnalyticsRecord {

    private int totalInteractions;
    private final Map<String, Integer> preferredAgents = new HashMap<>();
    private final Deque<InteractionPattern> queryPatterns = new ArrayDeque<>();

    public void addPattern(InteractionPattern pattern, int maxPatterns) {
        queryPatterns.addLast(pattern);
        while (queryPatterns.size() > maxPatterns) {
            queryPatterns.removeFirst();
        }
    }
}
