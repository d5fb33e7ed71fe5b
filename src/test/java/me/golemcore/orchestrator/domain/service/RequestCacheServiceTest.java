package me.golemcore.orchestrator.domain.service;

import me.golemcore.orchestrator.domain.model.CacheStats;
import me.golemcore.orchestrator.domain.model.ResponsePayload;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import me.golemcore.orchestrator.testsupport.ConcurrentRunner;
import me.golemcore.orchestrator.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RequestCacheServiceTest {

    private static final Duration TTL = Duration.ofMinutes(15);

    private MutableClock clock;
    private OrchestratorProperties properties;
    private RequestCacheService cache;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-03-01T10:00:00Z");
        properties = new OrchestratorProperties();
        properties.getCache().setMaxSize(3);
        cache = new RequestCacheService(properties, clock);
    }

    private static ResponsePayload payload(String text) {
        return ResponsePayload.builder().response(text).confidence(80).build();
    }

    @Test
    void shouldReturnStoredPayloadWithinTtl() {
        cache.set("k1", payload("answer"), TTL);
        clock.advance(Duration.ofMinutes(14));

        Optional<ResponsePayload> cached = cache.get("k1");

        assertTrue(cached.isPresent());
        assertEquals("answer", cached.get().getResponse());
    }

    @Test
    void shouldTreatEntryAsAbsentOnceTtlElapsed() {
        cache.set("k1", payload("answer"), TTL);
        clock.advance(TTL);

        assertTrue(cache.get("k1").isEmpty());
        assertEquals(0, cache.size());
    }

    @Test
    void shouldCountStaleReadAsMiss() {
        cache.set("k1", payload("answer"), TTL);
        cache.get("k1");
        clock.advance(Duration.ofMinutes(20));
        cache.get("k1");
        cache.get("unknown");

        CacheStats stats = cache.getStats();
        assertEquals(1, stats.hits());
        assertEquals(2, stats.misses());
        assertEquals(3, stats.totalRequests());
        assertEquals(1.0 / 3, stats.hitRate(), 1e-9);
    }

    @Test
    void shouldReportZeroHitRateBeforeAnyRead() {
        assertEquals(0.0, cache.getStats().hitRate());
    }

    @Test
    void shouldNeverGrowBeyondMaxSize() {
        for (int i = 0; i < 10; i++) {
            cache.set("k" + i, payload("answer " + i), TTL);
            assertTrue(cache.size() <= 3);
        }
        assertEquals(3, cache.size());
    }

    @Test
    void shouldEvictLeastReadEntryFirst() {
        cache.set("a", payload("a"), TTL);
        cache.set("b", payload("b"), TTL);
        cache.set("c", payload("c"), TTL);
        cache.get("a");
        cache.get("c");

        cache.set("d", payload("d"), TTL);

        assertTrue(cache.get("b").isEmpty());
        assertTrue(cache.get("a").isPresent());
        assertTrue(cache.get("c").isPresent());
        assertTrue(cache.get("d").isPresent());
    }

    @Test
    void shouldBreakEvictionTiesByLeastRecentRead() {
        cache.set("a", payload("a"), TTL);
        clock.advance(Duration.ofSeconds(1));
        cache.set("b", payload("b"), TTL);
        clock.advance(Duration.ofSeconds(1));
        cache.set("c", payload("c"), TTL);
        clock.advance(Duration.ofSeconds(1));

        cache.set("d", payload("d"), TTL);

        assertTrue(cache.get("a").isEmpty());
        assertTrue(cache.get("b").isPresent());
    }

    @Test
    void shouldOverwriteExistingKeyWithoutEvicting() {
        cache.set("a", payload("a"), TTL);
        cache.set("b", payload("b"), TTL);
        cache.set("c", payload("c"), TTL);

        cache.set("b", payload("b2"), TTL);

        assertEquals(3, cache.size());
        assertEquals("b2", cache.get("b").orElseThrow().getResponse());
        assertTrue(cache.get("a").isPresent());
    }

    @Test
    void shouldPurgeOnlyExpiredEntries() {
        cache.set("short", payload("s"), Duration.ofMinutes(1));
        cache.set("long", payload("l"), Duration.ofMinutes(30));
        clock.advance(Duration.ofMinutes(2));

        assertEquals(1, cache.purgeExpired());
        assertEquals(1, cache.size());
        assertTrue(cache.get("long").isPresent());
    }

    @Test
    void shouldNormalizeQueryInFingerprint() {
        String base = RequestCacheService.fingerprint("u1", "What is  AI?");

        assertEquals(base, RequestCacheService.fingerprint("u1", "  what is ai?  "));
        assertNotEquals(base, RequestCacheService.fingerprint("u2", "What is AI?"));
        assertFalse(base.isBlank());
    }

    @Test
    void shouldStayBoundedUnderConcurrentWriters() throws Exception {
        int threads = 8;
        int operations = 200;

        ConcurrentRunner.run(threads, worker -> {
            for (int i = 0; i < operations; i++) {
                String key = "k" + worker + "-" + (i % 10);
                cache.set(key, payload("answer " + i), TTL);
                cache.get(key);
                assertTrue(cache.size() <= 3);
            }
        });

        CacheStats stats = cache.getStats();
        assertEquals(3, cache.size());
        assertEquals(threads * operations, stats.hits() + stats.misses());
    }
}
