package me.golemcore.orchestrator.domain.loop;

import me.golemcore.orchestrator.domain.service.AnalyticsService;
import me.golemcore.orchestrator.domain.service.RequestCacheService;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class MaintenanceServiceTest {

    private RequestCacheService cache;
    private AnalyticsService analytics;
    private OrchestratorProperties properties;
    private MaintenanceService service;

    @BeforeEach
    void setUp() {
        cache = mock(RequestCacheService.class);
        analytics = mock(AnalyticsService.class);
        properties = new OrchestratorProperties();
        service = new MaintenanceService(cache, analytics, properties);
    }

    @AfterEach
    void tearDown() {
        service.shutdown();
    }

    @Test
    void shouldPurgeCacheAndPruneAnalytics() {
        when(cache.purgeExpired()).thenReturn(2);

        service.runMaintenance();

        verify(cache).purgeExpired();
        verify(analytics).pruneExpired();
    }

    @Test
    void shouldSurviveCacheFailure() {
        when(cache.purgeExpired()).thenThrow(new IllegalStateException("boom"));

        service.runMaintenance();
        service.runMaintenance();

        verify(cache, atLeastOnce()).purgeExpired();
        verify(analytics, never()).pruneExpired();
    }

    @Test
    void shouldScheduleAtConfiguredInterval() {
        properties.getCache().setCleanupInterval(Duration.ofMillis(20));

        service.init();

        verify(cache, timeout(2000).atLeastOnce()).purgeExpired();
    }

    @Test
    void shouldStayIdleWhenIntervalIsZero() {
        properties.getCache().setCleanupInterval(Duration.ZERO);

        service.init();

        verify(cache, never()).purgeExpired();
    }
}
