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

import java.util.Map;
import java.util.Objects;

/**
 * A single planned tool invocation.
 */
public record ToolCall(String toolName, Map<String, Object> parameters) {

    public ToolCall {
        Objects.requireNonNull(toolName, "toolName");
        parameters = parameters != null ? Map.copyOf(parameters) : Map.of();
    }

    public static ToolCall of(String toolName, Map<String, Object> parameters) {
        return new ToolCall(toolName, parameters);
    }
}
