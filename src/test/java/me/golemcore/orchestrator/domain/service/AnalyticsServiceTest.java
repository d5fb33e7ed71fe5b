package me.golemcore.orchestrator.domain.service;

import me.golemcore.orchestrator.domain.model.UserPatternSummary;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import me.golemcore.orchestrator.testsupport.ConcurrentRunner;
import me.golemcore.orchestrator.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AnalyticsServiceTest {

    private static final String USER_ID = "u1";

    private MutableClock clock;
    private OrchestratorProperties properties;
    private AnalyticsService analytics;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-03-01T10:00:00Z");
        properties = new OrchestratorProperties();
        analytics = new AnalyticsService(properties, clock);
    }

    @Test
    void shouldReportInsufficientDataForUnknownUser() {
        assertEquals(UserPatternSummary.STATUS_INSUFFICIENT_DATA, analytics.analyzeUserPatterns(USER_ID).getStatus());
    }

    @Test
    void shouldReportInsufficientRecentDataBelowFiveInteractions() {
        for (int i = 0; i < 4; i++) {
            analytics.trackInteraction(USER_ID, "ResearchAgent", 1.0, 3, null);
        }

        assertEquals(UserPatternSummary.STATUS_INSUFFICIENT_RECENT_DATA,
                analytics.analyzeUserPatterns(USER_ID).getStatus());
    }

    @Test
    void shouldSummarizeTrendsAndRecommendations() {
        int[] complexities = {1, 1, 2, 2, 2};
        double[] responseTimes = {1.0, 1.0, 1.0, 3.0, 3.0};
        for (int i = 0; i < complexities.length; i++) {
            analytics.trackInteraction(USER_ID, "ResearchAgent", responseTimes[i], complexities[i], null);
        }

        UserPatternSummary summary = analytics.analyzeUserPatterns(USER_ID);

        assertEquals(UserPatternSummary.STATUS_OK, summary.getStatus());
        assertEquals(5, summary.getTotalInteractions());
        assertEquals("ResearchAgent", summary.getMostUsedAgent());
        assertEquals(1.6, summary.getAvgComplexity(), 1e-9);
        assertEquals("increasing", summary.getTrendAnalysis().get("complexity_trend"));
        assertEquals("declining", summary.getTrendAnalysis().get("performance_trend"));
        assertEquals("regular", summary.getTrendAnalysis().get("usage_frequency"));
        assertTrue(summary.getRecommendations().contains(
                "Consider exploring other agents beyond ResearchAgent for variety"));
        assertTrue(summary.getRecommendations().contains("Try more complex queries to unlock advanced features"));
    }

    @Test
    void shouldBoundStoredPatterns() {
        properties.getAnalytics().setMaxPatterns(5);
        for (int i = 0; i < 12; i++) {
            analytics.trackInteraction(USER_ID, "CreativeAgent", 1.0, 5, null);
        }

        UserPatternSummary summary = analytics.analyzeUserPatterns(USER_ID);

        assertEquals(12, summary.getTotalInteractions());
        assertEquals("regular", summary.getTrendAnalysis().get("usage_frequency"));
    }

    @Test
    void shouldAttachFeedbackToLatestInteraction() {
        assertFalse(analytics.recordFeedback(USER_ID, 4.5));

        analytics.trackInteraction(USER_ID, "fallback_processing", 0.5, 2, null);

        assertTrue(analytics.recordFeedback(USER_ID, 4.5));
    }

    @Test
    void shouldPruneInteractionsOlderThanRetention() {
        analytics.trackInteraction(USER_ID, "ResearchAgent", 1.0, 3, null);
        clock.advance(Duration.ofHours(25));
        analytics.trackInteraction("u2", "ResearchAgent", 1.0, 3, null);

        assertEquals(1, analytics.pruneExpired());
        assertEquals(UserPatternSummary.STATUS_INSUFFICIENT_DATA, analytics.analyzeUserPatterns(USER_ID).getStatus());
        assertEquals(UserPatternSummary.STATUS_INSUFFICIENT_RECENT_DATA,
                analytics.analyzeUserPatterns("u2").getStatus());
    }

    @Test
    void shouldCountEveryInteractionUnderConcurrentWriters() throws Exception {
        int threads = 8;
        int interactionsPerThread = 50;

        ConcurrentRunner.run(threads, worker -> {
            for (int i = 0; i < interactionsPerThread; i++) {
                analytics.trackInteraction(USER_ID, "Agent" + (worker % 3), 1.0, 2, null);
            }
        });

        UserPatternSummary summary = analytics.analyzeUserPatterns(USER_ID);
        assertEquals(threads * interactionsPerThread, summary.getTotalInteractions());
    }

    @Test
    void shouldNotLoseFreshInteractionsWhilePruning() throws Exception {
        int users = 50;
        for (int u = 0; u < users; u++) {
            analytics.trackInteraction("user-" + u, "ResearchAgent", 1.0, 2, null);
        }
        clock.advance(properties.getAnalytics().getRetention().plusMinutes(1));
        AtomicBoolean tracking = new AtomicBoolean(true);

        ConcurrentRunner.run(2, worker -> {
            if (worker == 0) {
                while (tracking.get()) {
                    analytics.pruneExpired();
                }
                return;
            }
            try {
                for (int i = 0; i < 5; i++) {
                    for (int u = 0; u < users; u++) {
                        analytics.trackInteraction("user-" + u, "ResearchAgent", 1.0, 2, null);
                    }
                }
            } finally {
                tracking.set(false);
            }
        });

        for (int u = 0; u < users; u++) {
            assertEquals(UserPatternSummary.STATUS_OK, analytics.analyzeUserPatterns("user-" + u).getStatus());
        }
    }
}
