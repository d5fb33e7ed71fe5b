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

import java.util.List;
import java.util.Map;

/**
 * Outcome of a tool invocation: either structured data or an error message.
 * Successful list data may still carry per-item {@code error} markers when the
 * backend only partially succeeded.
 */
@Data
@Builder
public class ToolResult {

    public static final String ERROR_KEY = "error";

    @SuppressWarnings("PMD.AvoidFieldNameMatchingMethodName") // Lombok generates isSuccess()
    private boolean success;
    private Object data;
    private String error;

    /**
     * Creates a successful tool result with structured data.
     */
    public static ToolResult success(Object data) {
        return ToolResult.builder()
                .success(true)
                .data(data)
                .build();
    }

    /**
     * Creates a failed tool result with an error message.
     */
    public static ToolResult failure(String error) {
        return ToolResult.builder()
                .success(false)
                .error(error)
                .build();
    }

    /**
     * True when the result failed outright, when its data is a map carrying an
     * error key, or when its data is a list whose first item carries one.
     */
    public boolean hasErrorMarker() {
        if (!success) {
            return true;
        }
        if (data instanceof Map<?, ?> map) {
            return map.containsKey(ERROR_KEY);
        }
        if (data instanceof List<?> list && !list.isEmpty() && list.get(0) instanceof Map<?, ?> first) {
            return first.containsKey(ERROR_KEY);
        }
        return false;
    }
}
