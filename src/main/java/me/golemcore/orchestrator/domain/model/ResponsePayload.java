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

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Final answer for a query. This is the unit that is cached, emitted on the
 * progress channel and written to memory.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ResponsePayload {

    private String response;

    /** 0..100 */
    private int confidence;

    @Builder.Default
    private List<Source> sources = new ArrayList<>();

    private double processingTime;
    private String method;
    private boolean personalizationApplied;

    @Builder.Default
    private List<ProactiveSuggestion> proactiveSuggestions = new ArrayList<>();

    @Builder.Default
    private Map<String, Object> realTimeData = new LinkedHashMap<>();

    @Builder.Default
    private List<String> toolsUsed = new ArrayList<>();

    private int sourcesFound;

    @Builder.Default
    private Map<String, Object> metadata = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, Object> analytics = new LinkedHashMap<>();
}
