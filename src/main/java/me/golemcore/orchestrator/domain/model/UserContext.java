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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * What the pipeline knows about a user when answering their current query.
 */
@Data
@Builder
public class UserContext {

    public static final String APPROACH_PERSONALIZED = "personalized";
    public static final String APPROACH_STANDARD = "standard";

    private boolean newUser;

    @Builder.Default
    private List<String> recentTopics = new ArrayList<>();

    private UserProfile userPreferences;

    @Builder.Default
    private List<ConversationTurn> conversationFlow = new ArrayList<>();

    private String suggestedApproach;

    @Builder.Default
    private List<String> relevantMemories = new ArrayList<>();

    public static UserContext forNewUser() {
        return UserContext.builder()
                .newUser(true)
                .suggestedApproach(APPROACH_STANDARD)
                .build();
    }

    /**
     * Flattens the context into a JSON-friendly map for prompts.
     */
    public Map<String, Object> toPromptMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        if (newUser) {
            map.put("context", "new_user");
        } else {
            map.put("recent_topics", recentTopics);
            if (userPreferences != null) {
                Map<String, Object> preferences = new LinkedHashMap<>();
                Map<String, Integer> topics = new LinkedHashMap<>();
                userPreferences.getPreferredTopics().forEach((topic, count) -> topics.put(topic.label(), count));
                preferences.put("preferred_topics", topics);
                preferences.put("avg_complexity", userPreferences.getAvgComplexity());
                preferences.put("communication_style", userPreferences.getCommunicationStyle());
                preferences.put("response_length_preference", userPreferences.getResponseLengthPreference());
                map.put("user_preferences", preferences);
            }
            map.put("conversation_flow", conversationFlow.stream()
                    .map(turn -> Map.of("query", turn.getQueryText(), "complexity", turn.getComplexity()))
                    .toList());
            map.put("suggested_approach", suggestedApproach);
        }
        if (!relevantMemories.isEmpty()) {
            map.put("relevant_memories", relevantMemories);
        }
        return map;
    }
}
