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

import lombok.Builder;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Describes a tool: its name, what it does, and the JSON Schema of its
 * parameters.
 */
@Data
@Builder
public class ToolDefinition {

    private String name;
    private String description;
    private Map<String, Object> inputSchema; // JSON Schema

    /**
     * Creates a definition whose parameters are all required strings.
     */
    public static ToolDefinition withStringParams(String name, String description, Map<String, String> params) {
        Map<String, Object> properties = new LinkedHashMap<>();
        params.forEach((param, paramDescription) -> properties.put(param,
                Map.of("type", "string", "description", paramDescription)));
        return ToolDefinition.builder()
                .name(name)
                .description(description)
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", properties,
                        "required", List.copyOf(params.keySet())))
                .build();
    }
}
