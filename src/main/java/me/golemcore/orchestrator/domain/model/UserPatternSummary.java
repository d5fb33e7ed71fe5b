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

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * Derived view over a user's analytics record.
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class UserPatternSummary {

    public static final String STATUS_OK = "ok";
    public static final String STATUS_INSUFFICIENT_DATA = "insufficient_data";
    public static final String STATUS_INSUFFICIENT_RECENT_DATA = "insufficient_recent_data";

    private String status;
    private Integer totalInteractions;
    private Double avgComplexity;
    private Double avgResponseTime;
    private String mostUsedAgent;
    private Map<String, String> trendAnalysis;
    private List<String> recommendations;

    public static UserPatternSummary insufficient(String status) {
        return UserPatternSummary.builder().status(status).build();
    }
}
