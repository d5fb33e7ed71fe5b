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
import lombok.Value;

import java.time.Instant;
import java.util.Map;
import java.util.Set;

/**
 * One answered query in a user's short-term history, annotated with topics,
 * sentiment and a complexity score in {@code [1, 10]}. Turns are appended and
 * never mutated.
 */
@Value
@Builder
public class ConversationTurn {

    Instant timestamp;
    String queryText;
    String responseText;
    Set<Topic> topics;
    Sentiment sentiment;
    int complexity;
    Map<String, Object> metadata;
}
