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
import me.golemcore.orchestrator.domain.model.AnalyticsRecord;
import me.golemcore.orchestrator.domain.model.InteractionPattern;
import me.golemcore.orchestrator.domain.model.UserPatternSummary;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-user interaction analytics: a rolling window of interaction patterns plus
 * agent usage counts, summarized into trends and recommendations on demand.
 */
@Service
@Slf4j
public class AnalyticsService {

    private static final int RECENT_WINDOW = 10;
    private static final int MIN_RECENT_PATTERNS = 5;
    private static final int TREND_SAMPLE = 3;
    private static final int REGULAR_USE_PATTERNS = 5;
    private static final double AGENT_DOMINANCE_RATIO = 0.7;
    private static final double LOW_COMPLEXITY = 3.0;

    private final OrchestratorProperties properties;
    private final Clock clock;

    private final Map<String, AnalyticsRecord> records = new ConcurrentHashMap<>();

    public AnalyticsService(OrchestratorProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    public void trackInteraction(String userId, String agentUsed, double responseTime, int complexity,
            Double satisfaction) {
        InteractionPattern pattern = InteractionPattern.builder()
                .timestamp(Instant.now(clock))
                .complexity(complexity)
                .responseTime(responseTime)
                .satisfaction(satisfaction)
                .build();
        int maxPatterns = properties.getAnalytics().getMaxPatterns();
        records.compute(userId, (id, existing) -> {
            AnalyticsRecord record = existing != null ? existing : new AnalyticsRecord();
            synchronized (record) {
                record.setTotalInteractions(record.getTotalInteractions() + 1);
                if (agentUsed != null) {
                    record.getPreferredAgents().merge(agentUsed, 1, Integer::sum);
                }
                record.addPattern(pattern, maxPatterns);
            }
            return record;
        });
    }

    /**
     * Attaches a satisfaction score to the user's most recent interaction.
     *
     * @return false when the user has no recorded interactions
     */
    public boolean recordFeedback(String userId, double satisfaction) {
        AnalyticsRecord record = records.get(userId);
        if (record == null) {
            return false;
        }
        synchronized (record) {
            InteractionPattern latest = record.getQueryPatterns().peekLast();
            if (latest == null) {
                return false;
            }
            latest.setSatisfaction(satisfaction);
            return true;
        }
    }

    public UserPatternSummary analyzeUserPatterns(String userId) {
        AnalyticsRecord record = records.get(userId);
        if (record == null) {
            return UserPatternSummary.insufficient(UserPatternSummary.STATUS_INSUFFICIENT_DATA);
        }

        List<InteractionPattern> patterns;
        int totalInteractions;
        Map<String, Integer> agents;
        synchronized (record) {
            patterns = new ArrayList<>(record.getQueryPatterns());
            totalInteractions = record.getTotalInteractions();
            agents = new LinkedHashMap<>(record.getPreferredAgents());
        }

        List<InteractionPattern> recent = patterns.subList(Math.max(0, patterns.size() - RECENT_WINDOW),
                patterns.size());
        if (recent.size() < MIN_RECENT_PATTERNS) {
            return UserPatternSummary.insufficient(UserPatternSummary.STATUS_INSUFFICIENT_RECENT_DATA);
        }

        String mostUsedAgent = agents.entrySet().stream()
                .max(Map.Entry.comparingByValue())
                .map(Map.Entry::getKey)
                .orElse(null);

        return UserPatternSummary.builder()
                .status(UserPatternSummary.STATUS_OK)
                .totalInteractions(totalInteractions)
                .avgComplexity(recent.stream().mapToInt(InteractionPattern::getComplexity).average().orElse(0))
                .avgResponseTime(recent.stream().mapToDouble(InteractionPattern::getResponseTime).average().orElse(0))
                .mostUsedAgent(mostUsedAgent)
                .trendAnalysis(trends(recent, patterns.size()))
                .recommendations(recommendations(recent, agents, totalInteractions, mostUsedAgent))
                .build();
    }

    /**
     * Drops patterns older than the retention window and forgets users left
     * without any.
     *
     * @return number of patterns removed
     */
    public int pruneExpired() {
        Instant cutoff = Instant.now(clock).minus(properties.getAnalytics().getRetention());
        int removed = 0;
        for (Map.Entry<String, AnalyticsRecord> entry : records.entrySet()) {
            AnalyticsRecord record = entry.getValue();
            synchronized (record) {
                int before = record.getQueryPatterns().size();
                record.getQueryPatterns().removeIf(pattern -> pattern.getTimestamp().isBefore(cutoff));
                removed += before - record.getQueryPatterns().size();
            }
        }
        // compute holds the map lock for the key, so a concurrent trackInteraction cannot slip in
        for (String userId : records.keySet()) {
            records.computeIfPresent(userId, (id, record) -> {
                synchronized (record) {
                    return record.getQueryPatterns().isEmpty() ? null : record;
                }
            });
        }
        if (removed > 0) {
            log.info("[Analytics] Pruned {} expired interaction patterns", removed);
        }
        return removed;
    }

    private Map<String, String> trends(List<InteractionPattern> recent, int totalPatterns) {
        Map<String, String> trends = new LinkedHashMap<>();

        int first = recent.get(0).getComplexity();
        int last = recent.get(recent.size() - 1).getComplexity();
        trends.put("complexity_trend", last > first ? "increasing" : last < first ? "decreasing" : "stable");

        double early = recent.subList(0, TREND_SAMPLE).stream()
                .mapToDouble(InteractionPattern::getResponseTime).average().orElse(0);
        double late = recent.subList(recent.size() - TREND_SAMPLE, recent.size()).stream()
                .mapToDouble(InteractionPattern::getResponseTime).average().orElse(0);
        String performance = "stable";
        if (late > early * 1.2) {
            performance = "declining";
        } else if (late < early * 0.8) {
            performance = "improving";
        }
        trends.put("performance_trend", performance);
        trends.put("usage_frequency", totalPatterns >= REGULAR_USE_PATTERNS ? "regular" : "occasional");
        return trends;
    }

    private List<String> recommendations(List<InteractionPattern> recent, Map<String, Integer> agents,
            int totalInteractions, String mostUsedAgent) {
        List<String> recommendations = new ArrayList<>();
        if (mostUsedAgent != null && totalInteractions > 0
                && (double) agents.get(mostUsedAgent) / totalInteractions > AGENT_DOMINANCE_RATIO) {
            recommendations.add("Consider exploring other agents beyond " + mostUsedAgent + " for variety");
        }
        double recentComplexity = recent.subList(Math.max(0, recent.size() - MIN_RECENT_PATTERNS), recent.size())
                .stream().mapToInt(InteractionPattern::getComplexity).average().orElse(0);
        if (recentComplexity < LOW_COMPLEXITY) {
            recommendations.add("Try more complex queries to unlock advanced features");
        }
        return recommendations;
    }
}
