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
import me.golemcore.orchestrator.domain.component.ToolComponent;
import me.golemcore.orchestrator.domain.model.Plan;
import me.golemcore.orchestrator.domain.model.ToolCall;
import me.golemcore.orchestrator.domain.model.ToolResult;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * Runs a plan's tool calls sequentially, in plan order, against the registry of
 * enabled tools.
 *
 * <p>
 * Unknown tools are skipped with a warning. A failing or timed-out tool is
 * recorded as {@link ToolResult#failure(String)} under its name and the next
 * call still runs.
 */
@Service
@Slf4j
public class ToolExecutionService {

    private final Map<String, ToolComponent> toolRegistry = new ConcurrentHashMap<>();
    private final OrchestratorProperties properties;

    public ToolExecutionService(List<ToolComponent> tools, OrchestratorProperties properties) {
        this.properties = properties;
        for (ToolComponent tool : tools) {
            if (tool.isEnabled()) {
                registerTool(tool);
            } else {
                log.info("[Tools] Tool disabled by configuration: {}", tool.getToolName());
            }
        }
        log.info("[Tools] Registered tools: {}", toolRegistry.keySet());
    }

    public void registerTool(ToolComponent tool) {
        toolRegistry.put(tool.getToolName(), tool);
    }

    public Set<String> getToolNames() {
        return Set.copyOf(toolRegistry.keySet());
    }

    public Map<String, ToolResult> execute(Plan plan) {
        return execute(plan, message -> {
        });
    }

    /**
     * Executes every tool call of the plan and reports human-readable progress.
     *
     * @return results keyed by tool name, in execution order
     */
    public Map<String, ToolResult> execute(Plan plan, Consumer<String> progress) {
        Map<String, ToolResult> outputs = new LinkedHashMap<>();
        List<ToolCall> calls = plan.toolCalls();
        if (calls.isEmpty()) {
            return outputs;
        }
        progress.accept("Executing " + calls.size() + " tool(s)...");

        for (int i = 0; i < calls.size(); i++) {
            ToolCall call = calls.get(i);
            ToolComponent tool = toolRegistry.get(call.toolName());
            if (tool == null) {
                log.warn("[Tools] Unknown tool '{}' skipped. Available tools: {}", call.toolName(),
                        String.join(", ", toolRegistry.keySet()));
                continue;
            }
            progress.accept("Running " + call.toolName() + " (" + (i + 1) + "/" + calls.size() + ")...");
            ToolResult result = executeToolCall(tool, call);
            outputs.put(call.toolName(), result);
            progress.accept(call.toolName() + " " + describe(result));
        }
        return outputs;
    }

    private ToolResult executeToolCall(ToolComponent tool, ToolCall call) {
        try {
            ToolResult result = ExternalCalls.await(tool.execute(call.parameters()),
                    properties.getTools().getTimeoutMs(), "Tool " + call.toolName());
            return result != null ? result : ToolResult.failure("Tool returned no result");
        } catch (Exception e) { // NOSONAR - one tool must not stop the rest
            log.error("[Tools] Tool execution failed: {}", call.toolName(), e);
            return ToolResult.failure("Tool execution failed: " + ExternalCalls.safeMessage(e));
        }
    }

    private static String describe(ToolResult result) {
        if (!result.isSuccess()) {
            return "encountered an error";
        }
        if (result.hasErrorMarker()) {
            return "had limited results";
        }
        if (result.getData() instanceof List<?> list) {
            return "found " + list.size() + " results";
        }
        return "completed successfully";
    }
}
