package me.golemcore.orchestrator.domain.stream;

import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import me.golemcore.orchestrator.port.outbound.SearchPort;
import me.golemcore.orchestrator.testsupport.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class StreamPollersTest {

    @Test
    @SuppressWarnings("unchecked")
    void webMonitorShouldReportChangeOnlyWhenFingerprintDiffers() throws Exception {
        MutableClock clock = MutableClock.startingAt("2026-03-01T10:00:10Z");
        StreamPoller.Task task = new WebMonitorStreamPoller(clock)
                .open(Map.of("urls", List.of("https://example.com")));

        assertTrue(task.poll().isEmpty());
        clock.advance(Duration.ofSeconds(20));
        assertTrue(task.poll().isEmpty());

        clock.advance(Duration.ofMinutes(1));
        Optional<Object> changed = task.poll();

        assertTrue(changed.isPresent());
        List<Map<String, Object>> changes = (List<Map<String, Object>>) changed.get();
        assertEquals(1, changes.size());
        assertEquals("https://example.com", changes.get(0).get("url"));
        assertEquals("content_update", changes.get(0).get("change_type"));
    }

    @Test
    void webMonitorFingerprintShouldDependOnUrlAndMinute() throws Exception {
        Instant now = Instant.parse("2026-03-01T10:05:00Z");

        assertEquals(WebMonitorStreamPoller.fingerprint("https://a.example", now),
                WebMonitorStreamPoller.fingerprint("https://a.example", now.plusSeconds(30)));
        assertNotEquals(WebMonitorStreamPoller.fingerprint("https://a.example", now),
                WebMonitorStreamPoller.fingerprint("https://b.example", now));
        assertEquals(64, WebMonitorStreamPoller.fingerprint("https://a.example", now).length());
    }

    @Test
    @SuppressWarnings("unchecked")
    void financialPollerShouldQuoteEveryConfiguredSymbol() throws Exception {
        MutableClock clock = MutableClock.startingAt("2026-03-01T10:00:00Z");
        StreamPoller.Task task = new FinancialStreamPoller(clock).open(Map.of("symbols", List.of("AAPL", "NVDA")));

        Map<String, Object> quotes = (Map<String, Object>) task.poll().orElseThrow();

        assertEquals(List.of("AAPL", "NVDA"), List.copyOf(quotes.keySet()));
        Map<String, Object> quote = (Map<String, Object>) quotes.get("AAPL");
        assertTrue(quote.containsKey("price"));
        assertTrue(quote.containsKey("change_percent"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void newsPollerShouldDeduplicateByUrlAndSkipErrors() throws Exception {
        SearchPort searchPort = mock(SearchPort.class);
        when(searchPort.newsSearch(eq("AI"), anyInt())).thenReturn(CompletableFuture.completedFuture(List.of(
                Map.of("title", "A", "url", "https://n.example/1"),
                Map.of("title", "B", "url", "https://n.example/2"))));
        when(searchPort.newsSearch(eq("startup"), anyInt())).thenReturn(CompletableFuture.completedFuture(List.of(
                Map.of("title", "A again", "url", "https://n.example/1"),
                Map.of("error", "No results found for 'startup'"))));
        NewsStreamPoller poller = new NewsStreamPoller(searchPort, new OrchestratorProperties(),
                MutableClock.startingAt("2026-03-01T10:00:00Z"));

        List<Map<String, Object>> items = (List<Map<String, Object>>) poller
                .open(Map.of("keywords", List.of("AI", "startup"))).poll().orElseThrow();

        assertEquals(2, items.size());
        assertEquals("A", items.get(0).get("title"));
        assertTrue(items.get(0).containsKey("stream_timestamp"));
    }
}
