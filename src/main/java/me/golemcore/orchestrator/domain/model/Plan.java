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

import java.util.List;
import java.util.Objects;

/**
 * Planner decision for a query: category plus the ordered tool calls to run.
 * Tool calls are empty exactly when the category needs no tools.
 */
public record Plan(QueryCategory category, List<ToolCall> toolCalls, String log) {

    public Plan {
        Objects.requireNonNull(category, "category");
        toolCalls = toolCalls != null ? List.copyOf(toolCalls) : List.of();
        if (category.requiresTools() == toolCalls.isEmpty()) {
            throw new IllegalArgumentException("Category " + category
                    + (toolCalls.isEmpty() ? " requires at least one tool call" : " must not carry tool calls"));
        }
    }

    public static Plan withoutTools(QueryCategory category, String log) {
        return new Plan(category, List.of(), log);
    }

    public boolean isCasual() {
        return category == QueryCategory.CASUAL;
    }

    public List<String> toolNames() {
        return toolCalls.stream().map(ToolCall::toolName).toList();
    }
}
