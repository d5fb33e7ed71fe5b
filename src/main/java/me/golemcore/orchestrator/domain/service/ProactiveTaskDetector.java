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

import me.golemcore.orchestrator.domain.model.ConversationTurn;
import me.golemcore.orchestrator.domain.model.ProactiveSuggestion;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Looks at the last three queries of a user and offers follow-ups: automating
 * repeated questions, compiling research, or monitoring time-sensitive topics.
 * Needs at least two turns of history.
 */
@Component
public class ProactiveTaskDetector {

    private static final int WINDOW = 3;
    private static final int MIN_TURNS = 2;
    private static final double REPETITION_THRESHOLD = 0.5;
    private static final int MIN_RESEARCH_QUERIES = 2;

    private static final List<String> RESEARCH_KEYWORDS = List.of("research", "find", "tell me about", "what is");
    private static final Set<String> TIME_SENSITIVE_WORDS = Set.of("today", "latest", "recent", "current");

    static final ProactiveSuggestion AUTOMATION = ProactiveSuggestion.builder()
            .type("automation")
            .title("Create Automated Workflow")
            .description("I notice you're asking similar questions. Would you like me to create an automated workflow?")
            .priority("medium")
            .build();

    static final ProactiveSuggestion KNOWLEDGE_BASE = ProactiveSuggestion.builder()
            .type("knowledge_base")
            .title("Personal Knowledge Base")
            .description("Would you like me to compile your research into a personal knowledge base?")
            .priority("low")
            .build();

    static final ProactiveSuggestion MONITORING = ProactiveSuggestion.builder()
            .type("monitoring")
            .title("Set Up Monitoring")
            .description("I can monitor these topics and notify you of updates automatically.")
            .priority("high")
            .build();

    public List<ProactiveSuggestion> detect(List<ConversationTurn> turns) {
        if (turns == null || turns.size() < MIN_TURNS) {
            return List.of();
        }
        List<String> queries = turns.subList(Math.max(0, turns.size() - WINDOW), turns.size()).stream()
                .map(turn -> QueryAnnotator.normalize(turn.getQueryText()))
                .toList();

        List<ProactiveSuggestion> suggestions = new ArrayList<>();
        if (hasRepeatedPattern(queries)) {
            suggestions.add(AUTOMATION);
        }
        if (isResearchHeavy(queries)) {
            suggestions.add(KNOWLEDGE_BASE);
        }
        if (isTimeSensitive(queries)) {
            suggestions.add(MONITORING);
        }
        return suggestions;
    }

    private boolean hasRepeatedPattern(List<String> queries) {
        for (int i = 1; i < queries.size(); i++) {
            if (jaccard(QueryAnnotator.words(queries.get(i - 1)),
                    QueryAnnotator.words(queries.get(i))) > REPETITION_THRESHOLD) {
                return true;
            }
        }
        return false;
    }

    private boolean isResearchHeavy(List<String> queries) {
        long researchQueries = queries.stream()
                .filter(query -> RESEARCH_KEYWORDS.stream().anyMatch(query::contains))
                .count();
        return researchQueries >= MIN_RESEARCH_QUERIES;
    }

    private boolean isTimeSensitive(List<String> queries) {
        return queries.stream()
                .anyMatch(query -> QueryAnnotator.words(query).stream().anyMatch(TIME_SENSITIVE_WORDS::contains));
    }

    static double jaccard(Set<String> left, Set<String> right) {
        if (left.isEmpty() && right.isEmpty()) {
            return 0.0;
        }
        Set<String> intersection = new HashSet<>(left);
        intersection.retainAll(right);
        Set<String> union = new HashSet<>(left);
        union.addAll(right);
        return (double) intersection.size() / union.size();
    }
}
