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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.EnumMap;
import java.util.Map;

/**
 * Preference profile derived incrementally from a user's conversation turns.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserProfile {

    @Builder.Default
    private Map<Topic, Integer> preferredTopics = new EnumMap<>(Topic.class);

    private double avgComplexity;

    @Builder.Default
    private String communicationStyle = "formal";

    @Builder.Default
    private String responseLengthPreference = "medium";

    private int turnCount;

    /**
     * Folds a new turn into topic counts and the running complexity average.
     */
    public void record(ConversationTurn turn) {
        for (Topic topic : turn.getTopics()) {
            preferredTopics.merge(topic, 1, Integer::sum);
        }
        turnCount++;
        avgComplexity += (turn.getComplexity() - avgComplexity) / turnCount;
    }

    public UserProfile copy() {
        return UserProfile.builder()
                .preferredTopics(preferredTopics.isEmpty()
                        ? new EnumMap<>(Topic.class)
                        : new EnumMap<>(preferredTopics))
                .avgComplexity(avgComplexity)
                .communicationStyle(communicationStyle)
                .responseLengthPreference(responseLengthPreference)
                .turnCount(turnCount)
                .build();
    }
}
