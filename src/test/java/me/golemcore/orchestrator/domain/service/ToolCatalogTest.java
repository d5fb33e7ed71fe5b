package me.golemcore.orchestrator.domain.service;

import me.golemcore.orchestrator.domain.model.DiscoveredTool;
import me.golemcore.orchestrator.domain.model.ToolNeedAnalysis;
import me.golemcore.orchestrator.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ToolCatalogTest {

    private MutableClock clock;
    private ToolCatalog catalog;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-03-01T10:00:00Z");
        catalog = new ToolCatalog(clock);
    }

    private static ToolNeedAnalysis analysis(String name) {
        return ToolNeedAnalysis.builder()
                .needsNewTool(true)
                .suggestedToolName(name)
                .toolDescription("Looks up weather")
                .toolCapabilities(List.of("forecast"))
                .priority("high")
                .reasoning("no weather tool")
                .build();
    }

    @Test
    void shouldRecordNewSuggestionWithNormalizedName() {
        assertTrue(catalog.recordSuggestion(analysis(" Weather Lookup "), "weather in Oslo?"));

        DiscoveredTool tool = catalog.getDiscoveredTools().get(0);
        assertEquals("weather_lookup", tool.getName());
        assertEquals("weather in Oslo?", tool.getSampleQuery());
        assertEquals(List.of("forecast"), tool.getCapabilities());
        assertEquals(1, tool.getOccurrences());
    }

    @Test
    void shouldCountRepeatedSuggestion() {
        catalog.recordSuggestion(analysis("weather_lookup"), "first");

        assertFalse(catalog.recordSuggestion(analysis("Weather-Lookup"), "second"));

        assertEquals(1, catalog.size());
        DiscoveredTool tool = catalog.getDiscoveredTools().get(0);
        assertEquals(2, tool.getOccurrences());
        assertEquals("first", tool.getSampleQuery());
    }

    @Test
    void shouldIgnoreMissingName() {
        assertFalse(catalog.recordSuggestion(analysis(null), "q"));
        assertFalse(catalog.recordSuggestion(analysis("   "), "q"));

        assertEquals(0, catalog.size());
    }

    @Test
    void shouldListInDiscoveryOrder() {
        catalog.recordSuggestion(analysis("translator"), "q1");
        clock.advance(Duration.ofMinutes(1));
        catalog.recordSuggestion(analysis("calendar"), "q2");

        List<DiscoveredTool> tools = catalog.getDiscoveredTools();
        assertEquals("translator", tools.get(0).getName());
        assertEquals("calendar", tools.get(1).getName());
    }
}
