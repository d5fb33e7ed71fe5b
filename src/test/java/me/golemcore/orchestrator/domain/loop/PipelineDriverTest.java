package me.golemcore.orchestrator.domain.loop;

import me.golemcore.orchestrator.domain.agent.SpecialistOrchestrator;
import me.golemcore.orchestrator.domain.exception.SpecialistPathException;
import me.golemcore.orchestrator.domain.model.Plan;
import me.golemcore.orchestrator.domain.model.QueryCategory;
import me.golemcore.orchestrator.domain.model.Query;
import me.golemcore.orchestrator.domain.model.ResponsePayload;
import me.golemcore.orchestrator.domain.model.SpecialistResult;
import me.golemcore.orchestrator.domain.model.StreamSnapshot;
import me.golemcore.orchestrator.domain.model.StreamStatus;
import me.golemcore.orchestrator.domain.model.ToolCall;
import me.golemcore.orchestrator.domain.model.ToolNames;
import me.golemcore.orchestrator.domain.model.ToolResult;
import me.golemcore.orchestrator.domain.model.UserContext;
import me.golemcore.orchestrator.domain.service.AnalyticsService;
import me.golemcore.orchestrator.domain.service.ConversationMemoryService;
import me.golemcore.orchestrator.domain.service.PersonalizationService;
import me.golemcore.orchestrator.domain.service.ProactiveTaskDetector;
import me.golemcore.orchestrator.domain.service.QueryAnnotator;
import me.golemcore.orchestrator.domain.service.RequestCacheService;
import me.golemcore.orchestrator.domain.service.ResponseSynthesisService;
import me.golemcore.orchestrator.domain.service.SourceExtractor;
import me.golemcore.orchestrator.domain.service.ToolExecutionService;
import me.golemcore.orchestrator.domain.service.ToolNeedAnalyzer;
import me.golemcore.orchestrator.domain.stream.DataStreamRegistry;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import me.golemcore.orchestrator.port.inbound.ProgressChannelPort;
import me.golemcore.orchestrator.routing.QueryClassifier;
import me.golemcore.orchestrator.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PipelineDriverTest {

    private static final String USER_ID = "user-1";

    private MutableClock clock;
    private OrchestratorProperties properties;
    private RequestCacheService cache;
    private DataStreamRegistry streams;
    private ConversationMemoryService memory;
    private SpecialistOrchestrator specialists;
    private PersonalizationService personalization;
    private QueryClassifier classifier;
    private ToolExecutionService toolExecution;
    private ResponseSynthesisService synthesis;
    private ProgressChannelPort channel;
    private PipelineDriver driver;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-03-01T10:00:00Z");
        properties = new OrchestratorProperties();
        cache = new RequestCacheService(properties, clock);
        streams = mock(DataStreamRegistry.class);
        memory = mock(ConversationMemoryService.class);
        specialists = mock(SpecialistOrchestrator.class);
        personalization = mock(PersonalizationService.class);
        classifier = mock(QueryClassifier.class);
        toolExecution = mock(ToolExecutionService.class);
        synthesis = mock(ResponseSynthesisService.class);
        channel = mock(ProgressChannelPort.class);

        when(streams.getLatestData(anyString())).thenAnswer(invocation -> StreamSnapshot.notFound(
                invocation.getArgument(0)));
        when(memory.getContextForQuery(anyString(), anyString())).thenReturn(UserContext.forNewUser());
        when(channel.sendStatus(anyString(), anyString())).thenReturn(CompletableFuture.completedFuture(null));
        when(channel.sendFinalResponse(anyString(), any())).thenReturn(CompletableFuture.completedFuture(null));

        driver = new PipelineDriver(cache, streams, mock(ToolNeedAnalyzer.class), memory,
                mock(ProactiveTaskDetector.class), specialists, personalization, classifier, toolExecution,
                synthesis, new SourceExtractor(), new AnalyticsService(properties, clock), new QueryAnnotator(),
                channel, properties, clock);
    }

    private Query query(String text) {
        return new Query(USER_ID, text, Instant.now(clock));
    }

    private void webSearchFallback(String text) {
        Plan plan = new Plan(QueryCategory.GENERAL_WEB,
                List.of(ToolCall.of(ToolNames.WEB_SEARCH, Map.of("query", text))), "Classified as GENERAL_WEB");
        when(classifier.classify(eq(text), anyList())).thenReturn(plan);
        when(toolExecution.execute(eq(plan), any())).thenReturn(Map.of(ToolNames.WEB_SEARCH,
                ToolResult.success(List.of(Map.of("title", "Result", "url", "https://example.com")))));
        when(synthesis.synthesize(eq(text), anyMap(), eq(false), anyList()))
                .thenReturn(new ResponseSynthesisService.SynthesisResult("Synthesized answer", 80, List.of()));
    }

    private void specialistAnswers(String text, String agentName) {
        SpecialistResult result = SpecialistResult.builder()
                .agentName(agentName)
                .content("Specialist answer")
                .structuredPayload(Map.of("agent", agentName))
                .build();
        when(specialists.process(eq(text), any())).thenReturn(Optional.of(result));
        when(personalization.personalize(eq("Specialist answer"), eq(text), any(), anyList()))
                .thenReturn(new PersonalizationService.PersonalizedResponse("Personalized answer", true));
    }

    @Test
    void shouldFallBackWhenSpecialistFails() {
        String text = "research the history of chess";
        when(specialists.process(eq(text), any())).thenThrow(new SpecialistPathException("synthesis failed"));
        webSearchFallback(text);

        ResponsePayload payload = driver.process(query(text));

        assertEquals("Tool Search: web_search", payload.getMethod());
        assertEquals("Synthesized answer", payload.getResponse());
        assertFalse(payload.isPersonalizationApplied());
        assertEquals(List.of(ToolNames.WEB_SEARCH), payload.getToolsUsed());
        verify(channel).sendStatus(USER_ID, "Switching to standard processing...");
        verify(channel, times(1)).sendFinalResponse(USER_ID, payload);
        verify(personalization, never()).personalize(anyString(), anyString(), any(), anyList());
    }

    @Test
    void shouldUseSpecialistAnswerWhenAvailable() {
        String text = "research quantum computing";
        specialistAnswers(text, "ResearchAgent");

        ResponsePayload payload = driver.process(query(text));

        assertEquals("Multi-Agent: ResearchAgent", payload.getMethod());
        assertEquals("Personalized answer", payload.getResponse());
        assertEquals(PipelineDriver.SPECIALIST_CONFIDENCE, payload.getConfidence());
        assertTrue(payload.isPersonalizationApplied());
        assertEquals(List.of("ResearchAgent"), payload.getToolsUsed());
        assertEquals("ResearchAgent", payload.getMetadata().get("agent_used"));
        verify(classifier, never()).classify(anyString(), anyList());
        verify(channel, times(1)).sendFinalResponse(eq(USER_ID), any());
    }

    @Test
    void shouldServeRepeatedQueryFromCache() {
        String text = "research quantum computing";
        specialistAnswers(text, "ResearchAgent");

        ResponsePayload first = driver.process(query(text));
        ResponsePayload second = driver.process(query("  Research   QUANTUM computing "));

        assertSame(first, second);
        verify(specialists, times(1)).process(anyString(), any());
        verify(channel).sendStatus(USER_ID, "Found cached response");
        verify(channel, times(2)).sendFinalResponse(eq(USER_ID), any());
        assertEquals(1, cache.getStats().hits());
    }

    @Test
    void shouldAnswerCasualChatWithoutTools() {
        String text = "hello there";
        when(classifier.classify(eq(text), anyList()))
                .thenReturn(Plan.withoutTools(QueryCategory.CASUAL, "Detected casual conversation"));
        when(synthesis.synthesize(eq(text), anyMap(), eq(true), anyList()))
                .thenReturn(new ResponseSynthesisService.SynthesisResult("Hi! How can I help?", 90, List.of()));

        ResponsePayload payload = driver.process(query(text));

        assertEquals(PipelineDriver.METHOD_CASUAL, payload.getMethod());
        assertTrue(payload.getToolsUsed().isEmpty());
        verify(toolExecution, never()).execute(any(), any());
        verify(channel, never()).sendStatus(USER_ID, "Switching to standard processing...");
        verify(channel).sendStatus(USER_ID, "Generating your response...");
    }

    @Test
    void shouldRecordMetadataAndAnalytics() {
        String text = "what is the capital of Peru";
        webSearchFallback(text);

        ResponsePayload payload = driver.process(query(text));

        Map<String, Object> metadata = payload.getMetadata();
        assertEquals(PipelineDriver.FALLBACK_AGENT, metadata.get("agent_used"));
        assertEquals(Boolean.TRUE, metadata.get("cache_miss"));
        assertEquals(Boolean.FALSE, metadata.get("real_time_data_used"));
        assertEquals(0, metadata.get("proactive_suggestions_count"));
        assertTrue(payload.getAnalytics().containsKey("cache_performance"));
        assertTrue(payload.getAnalytics().containsKey("user_patterns"));
        verify(memory).addConversationTurn(eq(USER_ID), eq(text), eq("Synthesized answer"), anyMap());
        verify(memory).addToMemory(USER_ID, text, "Synthesized answer");
        assertEquals(1, cache.size());
    }

    @Test
    void shouldPassStreamSnapshotsToSynthesis() {
        String text = "latest stock market moves";
        StreamSnapshot snapshot = StreamSnapshot.builder()
                .streamId(DataStreamRegistry.DEFAULT_FINANCIAL_STREAM)
                .data(Map.of("AAPL", Map.of("price", 190.0)))
                .lastUpdate(Instant.now(clock))
                .status(StreamStatus.ACTIVE)
                .build();
        when(streams.getLatestData(DataStreamRegistry.DEFAULT_FINANCIAL_STREAM)).thenReturn(snapshot);
        webSearchFallback(text);

        ResponsePayload payload = driver.process(query(text));

        assertTrue(payload.getRealTimeData().containsKey("financial"));
        assertEquals(Boolean.TRUE, payload.getMetadata().get("real_time_data_used"));
        verify(synthesis).synthesize(eq(text), argThat(
                outputs -> outputs.containsKey(ToolNames.REAL_TIME_STREAMS)), eq(false), anyList());
    }

    @Test
    void shouldEmitApologyExactlyOnceWhenFallbackFails() {
        String text = "what is the capital of Peru";
        when(classifier.classify(eq(text), anyList())).thenThrow(new IllegalStateException("boom"));

        ResponsePayload payload = driver.process(query(text));

        assertEquals(PipelineDriver.METHOD_UNAVAILABLE, payload.getMethod());
        assertEquals(ResponseSynthesisService.FAILURE_MESSAGE, payload.getResponse());
        verify(channel, times(1)).sendFinalResponse(eq(USER_ID), any());
        assertEquals(0, cache.size());
    }

    @Test
    void shouldSurviveBrokenProgressChannel() {
        String text = "hello there";
        when(channel.sendStatus(anyString(), anyString())).thenThrow(new IllegalStateException("socket closed"));
        when(classifier.classify(eq(text), anyList()))
                .thenReturn(Plan.withoutTools(QueryCategory.CASUAL, "casual"));
        when(synthesis.synthesize(eq(text), anyMap(), anyBoolean(), anyList()))
                .thenReturn(new ResponseSynthesisService.SynthesisResult("Hi!", 90, List.of()));

        ResponsePayload payload = driver.process(query(text));

        assertEquals("Hi!", payload.getResponse());
        verify(channel, times(1)).sendFinalResponse(eq(USER_ID), any());
    }

    @Test
    void shouldDescribeFallbackMethod() {
        assertEquals(PipelineDriver.METHOD_CASUAL,
                PipelineDriver.fallbackMethod(Plan.withoutTools(QueryCategory.CASUAL, "")));
        assertEquals(PipelineDriver.METHOD_DIRECT,
                PipelineDriver.fallbackMethod(Plan.withoutTools(QueryCategory.MEMORY, "")));
        Plan news = new Plan(QueryCategory.NEWS, List.of(
                ToolCall.of(ToolNames.NEWS_SEARCH, Map.of("query", "q")),
                ToolCall.of(ToolNames.WEB_SEARCH, Map.of("query", "q"))), "");
        assertEquals("Tool Search: news_search, web_search", PipelineDriver.fallbackMethod(news));
    }

    @Test
    void shouldRoundProcessingTimeToHundredths() {
        Instant start = Instant.parse("2026-03-01T10:00:00Z");

        assertEquals(1.23, PipelineDriver.processingSeconds(start, start.plusMillis(1234)));
        assertEquals(0.0, PipelineDriver.processingSeconds(start, start));
    }
}
