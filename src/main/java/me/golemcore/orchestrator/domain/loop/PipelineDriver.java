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

package me.golemcore.orchestrator.domain.loop;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.orchestrator.domain.agent.SpecialistOrchestrator;
import me.golemcore.orchestrator.domain.model.CacheStats;
import me.golemcore.orchestrator.domain.model.Message;
import me.golemcore.orchestrator.domain.model.PipelineStage;
import me.golemcore.orchestrator.domain.model.Plan;
import me.golemcore.orchestrator.domain.model.ProactiveSuggestion;
import me.golemcore.orchestrator.domain.model.Query;
import me.golemcore.orchestrator.domain.model.ResponsePayload;
import me.golemcore.orchestrator.domain.model.Source;
import me.golemcore.orchestrator.domain.model.SpecialistResult;
import me.golemcore.orchestrator.domain.model.StreamSnapshot;
import me.golemcore.orchestrator.domain.model.ToolNames;
import me.golemcore.orchestrator.domain.model.ToolNeedAnalysis;
import me.golemcore.orchestrator.domain.model.ToolResult;
import me.golemcore.orchestrator.domain.model.UserContext;
import me.golemcore.orchestrator.domain.model.UserPatternSummary;
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
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Top-level coordinator of one query's lifecycle.
 *
 * <p>
 * Stages, in order:
 * <ol>
 * <li>cache check, the only early exit</li>
 * <li>lazy bootstrap of the default data streams</li>
 * <li>optional tool-need analysis</li>
 * <li>context load: stream snapshots, history, user context, proactive
 * suggestions</li>
 * <li>specialist attempt with personalization</li>
 * <li>fallback attempt: classify, run tools, synthesize</li>
 * <li>persist: analytics, conversation turn, cache entry, durable memory</li>
 * <li>emit exactly one {@code final_response}</li>
 * </ol>
 *
 * <p>
 * Every stage except the two resolution attempts degrades on failure instead of
 * failing the request. Any failure in the specialist attempt switches to the
 * fallback attempt; only one of them contributes to the payload.
 */
@Service
@Slf4j
public class PipelineDriver {

    static final String FALLBACK_AGENT = "fallback_processing";
    static final String METHOD_CASUAL = "Casual Chat";
    static final String METHOD_DIRECT = "Direct Answer";
    static final String METHOD_TOOL_PREFIX = "Tool Search: ";
    static final String METHOD_SPECIALIST_PREFIX = "Multi-Agent: ";
    static final String METHOD_UNAVAILABLE = "Unavailable";
    static final int SPECIALIST_CONFIDENCE = 95;

    private static final List<String> FINANCIAL_STREAM_KEYWORDS = List.of("stock", "price", "market", "financial");
    private static final List<String> NEWS_STREAM_KEYWORDS = List.of("news", "latest", "recent", "current");
    private static final int PROACTIVE_WINDOW = 3;

    private final RequestCacheService cache;
    private final DataStreamRegistry streams;
    private final ToolNeedAnalyzer toolNeedAnalyzer;
    private final ConversationMemoryService memory;
    private final ProactiveTaskDetector proactiveTaskDetector;
    private final SpecialistOrchestrator specialists;
    private final PersonalizationService personalization;
    private final QueryClassifier classifier;
    private final ToolExecutionService toolExecution;
    private final ResponseSynthesisService synthesis;
    private final SourceExtractor sourceExtractor;
    private final AnalyticsService analytics;
    private final QueryAnnotator annotator;
    private final ProgressChannelPort channel;
    private final OrchestratorProperties properties;
    private final Clock clock;

    @SuppressWarnings("java:S107") // one collaborator per pipeline stage
    public PipelineDriver(RequestCacheService cache, DataStreamRegistry streams, ToolNeedAnalyzer toolNeedAnalyzer,
            ConversationMemoryService memory, ProactiveTaskDetector proactiveTaskDetector,
            SpecialistOrchestrator specialists, PersonalizationService personalization, QueryClassifier classifier,
            ToolExecutionService toolExecution, ResponseSynthesisService synthesis, SourceExtractor sourceExtractor,
            AnalyticsService analytics, QueryAnnotator annotator, ProgressChannelPort channel,
            OrchestratorProperties properties, Clock clock) {
        this.cache = cache;
        this.streams = streams;
        this.toolNeedAnalyzer = toolNeedAnalyzer;
        this.memory = memory;
        this.proactiveTaskDetector = proactiveTaskDetector;
        this.specialists = specialists;
        this.personalization = personalization;
        this.classifier = classifier;
        this.toolExecution = toolExecution;
        this.synthesis = synthesis;
        this.sourceExtractor = sourceExtractor;
        this.analytics = analytics;
        this.annotator = annotator;
        this.channel = channel;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Processes one query to completion and emits its final response. Never
     * throws: an unexpected failure is answered with the apology payload.
     */
    public ResponsePayload process(Query query) {
        RequestRun run = new RequestRun(query, clock.instant());
        ResponsePayload payload;
        try {
            payload = resolve(run);
        } catch (Exception e) { // NOSONAR - the request must still be answered
            log.error("[Pipeline] Unexpected failure for user {} at stage {}", query.userId(), run.stage, e);
            payload = unavailablePayload(processingSeconds(run.startedAt, clock.instant()));
        }
        emit(run, payload);
        return payload;
    }

    /**
     * Answer sent when a request cannot be processed at all.
     */
    public static ResponsePayload unavailablePayload(double processingSeconds) {
        return ResponsePayload.builder()
                .response(ResponseSynthesisService.FAILURE_MESSAGE)
                .confidence(ResponseSynthesisService.FAILURE_CONFIDENCE)
                .processingTime(processingSeconds)
                .method(METHOD_UNAVAILABLE)
                .build();
    }

    // ==================== STAGES ====================

    private ResponsePayload resolve(RequestRun run) {
        stage(run, PipelineStage.CACHE_CHECK);
        Optional<ResponsePayload> cached = cachedPayload(run);
        if (cached.isPresent()) {
            status(run, "Found cached response");
            return cached.get();
        }

        stage(run, PipelineStage.STREAM_BOOTSTRAP);
        bootstrapStreams();
        status(run, "Analyzing your query...");

        stage(run, PipelineStage.TOOL_NEED_ANALYSIS);
        analyzeToolNeeds(run);

        stage(run, PipelineStage.CONTEXT_LOAD);
        loadContext(run);

        stage(run, PipelineStage.SPECIALIST_ATTEMPT);
        status(run, "Selecting specialist agent...");
        try {
            Optional<ResponsePayload> specialistPayload = attemptSpecialist(run);
            if (specialistPayload.isPresent()) {
                stage(run, PipelineStage.SPECIALIST_SUCCESS);
                return specialistPayload.get();
            }
            log.debug("[Pipeline] No specialist accepted the query, using standard processing");
        } catch (Exception e) { // NOSONAR - any specialist failure routes to the fallback
            log.warn("[Pipeline] Specialist processing failed, falling back to standard processing: {}",
                    e.getMessage());
            status(run, "Switching to standard processing...");
        }

        stage(run, PipelineStage.FALLBACK_ATTEMPT);
        return attemptFallback(run);
    }

    private Optional<ResponsePayload> cachedPayload(RequestRun run) {
        try {
            return cache.get(run.cacheKey);
        } catch (Exception e) { // NOSONAR
            log.warn("[Pipeline] Cache lookup failed: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private void bootstrapStreams() {
        try {
            streams.ensureDefaultStreams();
        } catch (Exception e) { // NOSONAR
            log.error("[Pipeline] Failed to initialize default streams: {}", e.getMessage());
        }
    }

    private void analyzeToolNeeds(RequestRun run) {
        if (!toolNeedAnalyzer.isEnabled()) {
            return;
        }
        try {
            ToolNeedAnalysis analysis = toolNeedAnalyzer.analyze(run.query.text(), toolExecution.getToolNames());
            run.toolNeedDetected = analysis.isNeedsNewTool();
            if (analysis.isActionable()) {
                status(run, "Recorded capability request: " + analysis.getSuggestedToolName());
            }
        } catch (Exception e) { // NOSONAR
            log.warn("[Pipeline] Tool discovery failed: {}", e.getMessage());
        }
    }

    private void loadContext(RequestRun run) {
        String userId = run.query.userId();
        loadStreamData(run);
        status(run, "Loading your personalized context...");

        try {
            memory.rehydrateIfEmpty(userId);
            run.history = memory.getConversationHistory(userId);
        } catch (Exception e) { // NOSONAR
            log.warn("[Pipeline] Failed to load persistent history: {}", e.getMessage());
        }

        try {
            run.context = memory.getContextForQuery(userId, run.query.text());
        } catch (Exception e) { // NOSONAR
            log.warn("[Pipeline] User context unavailable: {}", e.getMessage());
        }

        try {
            List<String> memories = memory.searchMemory(userId, run.query.text(),
                    properties.getMemory().getSearchResults());
            run.context.setRelevantMemories(new ArrayList<>(memories));
        } catch (Exception e) { // NOSONAR
            log.warn("[Pipeline] Memory search failed: {}", e.getMessage());
        }

        try {
            run.suggestions = proactiveTaskDetector.detect(memory.getRecentTurns(userId, PROACTIVE_WINDOW));
        } catch (Exception e) { // NOSONAR
            log.warn("[Pipeline] Proactive suggestions failed: {}", e.getMessage());
        }
        if (!run.suggestions.isEmpty()) {
            status(run, "Found " + run.suggestions.size() + " proactive suggestions");
        }
    }

    private void loadStreamData(RequestRun run) {
        String lowered = run.query.text().toLowerCase(Locale.ROOT);
        try {
            if (containsAny(lowered, FINANCIAL_STREAM_KEYWORDS)) {
                StreamSnapshot financial = streams.getLatestData(DataStreamRegistry.DEFAULT_FINANCIAL_STREAM);
                if (financial.hasData()) {
                    run.streamData.put("financial", financial);
                    status(run, "Using real-time market data");
                }
            }
            if (containsAny(lowered, NEWS_STREAM_KEYWORDS)) {
                StreamSnapshot news = streams.getLatestData(DataStreamRegistry.DEFAULT_NEWS_STREAM);
                if (news.hasData()) {
                    run.streamData.put("news", news);
                    status(run, "Using real-time news data");
                }
            }
        } catch (Exception e) { // NOSONAR
            log.warn("[Pipeline] Stream data retrieval failed: {}", e.getMessage());
        }
    }

    private Optional<ResponsePayload> attemptSpecialist(RequestRun run) {
        Optional<SpecialistResult> outcome = specialists.process(run.query.text(), run.context);
        if (outcome.isEmpty()) {
            return Optional.empty();
        }
        SpecialistResult result = outcome.get();
        status(run, "Processed by " + result.getAgentName());

        status(run, "Personalizing your response...");
        PersonalizationService.PersonalizedResponse personalized = personalization.personalize(
                result.getContent(), run.query.text(), run.context, run.suggestions);

        List<Source> sources = sourceExtractor.fromSpecialistPayload(result.getStructuredPayload());
        ResponsePayload draft = ResponsePayload.builder()
                .response(personalized.response())
                .confidence(SPECIALIST_CONFIDENCE)
                .sources(sources)
                .method(METHOD_SPECIALIST_PREFIX + result.getAgentName())
                .personalizationApplied(personalized.applied())
                .proactiveSuggestions(new ArrayList<>(run.suggestions))
                .realTimeData(new LinkedHashMap<>(run.streamData))
                .toolsUsed(List.of(result.getAgentName()))
                .sourcesFound(sources.size())
                .build();
        return Optional.of(persist(run, draft, result.getAgentName(),
                properties.getCache().getSpecialistTtl()));
    }

    private ResponsePayload attemptFallback(RequestRun run) {
        Plan plan = classifier.classify(run.query.text(), run.history);
        status(run, plan.log());

        Map<String, ToolResult> toolOutputs = new LinkedHashMap<>();
        if (!run.streamData.isEmpty()) {
            toolOutputs.put(ToolNames.REAL_TIME_STREAMS, ToolResult.success(new LinkedHashMap<>(run.streamData)));
        }
        if (!plan.toolCalls().isEmpty()) {
            toolOutputs.putAll(toolExecution.execute(plan, message -> status(run, message)));
        }

        boolean casual = plan.isCasual();
        status(run, casual ? "Generating your response..." : "Synthesizing information...");
        ResponseSynthesisService.SynthesisResult result = synthesis.synthesize(run.query.text(), toolOutputs,
                casual, run.history);

        ResponsePayload draft = ResponsePayload.builder()
                .response(result.response())
                .confidence(result.confidence())
                .sources(new ArrayList<>(result.sources()))
                .method(fallbackMethod(plan))
                .personalizationApplied(false)
                .realTimeData(new LinkedHashMap<>(run.streamData))
                .toolsUsed(plan.toolNames())
                .sourcesFound(result.sources().size())
                .build();
        return persist(run, draft, FALLBACK_AGENT, properties.getCache().getFallbackTtl());
    }

    static String fallbackMethod(Plan plan) {
        if (plan.isCasual()) {
            return METHOD_CASUAL;
        }
        if (plan.toolCalls().isEmpty()) {
            return METHOD_DIRECT;
        }
        return METHOD_TOOL_PREFIX + String.join(", ", plan.toolNames());
    }

    // ==================== PERSIST / EMIT ====================

    private ResponsePayload persist(RequestRun run, ResponsePayload draft, String agentUsed, Duration cacheTtl) {
        stage(run, PipelineStage.PERSIST);
        String userId = run.query.userId();
        String queryText = run.query.text();
        double processingSeconds = processingSeconds(run.startedAt, clock.instant());

        try {
            analytics.trackInteraction(userId, agentUsed, processingSeconds, annotator.complexity(queryText), null);
        } catch (Exception e) { // NOSONAR
            log.warn("[Pipeline] Analytics tracking failed: {}", e.getMessage());
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("agent_used", agentUsed);
        metadata.put("processing_time", processingSeconds);
        metadata.put("personalization_applied", draft.isPersonalizationApplied());
        metadata.put("proactive_suggestions_count", run.suggestions.size());
        metadata.put("real_time_data_used", !run.streamData.isEmpty());
        metadata.put("dynamic_tools_created", run.toolNeedDetected);
        metadata.put("cache_miss", true);

        ResponsePayload payload = draft.toBuilder()
                .processingTime(processingSeconds)
                .metadata(metadata)
                .analytics(analyticsSnapshot(userId))
                .build();

        try {
            memory.addConversationTurn(userId, queryText, payload.getResponse(), metadata);
        } catch (Exception e) { // NOSONAR
            log.warn("[Pipeline] Conversation turn not recorded: {}", e.getMessage());
        }
        try {
            cache.set(run.cacheKey, payload, cacheTtl);
        } catch (Exception e) { // NOSONAR
            log.warn("[Pipeline] Caching failed: {}", e.getMessage());
        }
        try {
            memory.addToMemory(userId, queryText, payload.getResponse());
        } catch (Exception e) { // NOSONAR
            log.warn("[Pipeline] Memory storage failed: {}", e.getMessage());
        }
        return payload;
    }

    private Map<String, Object> analyticsSnapshot(String userId) {
        Map<String, Object> snapshot = new LinkedHashMap<>();
        try {
            CacheStats stats = cache.getStats();
            snapshot.put("cache_performance", cachePerformance(stats));
            snapshot.put("user_patterns", analytics.analyzeUserPatterns(userId));
        } catch (Exception e) { // NOSONAR
            log.warn("[Pipeline] Analytics retrieval failed: {}", e.getMessage());
            snapshot.put("cache_performance", cachePerformance(new CacheStats(0, 0, 0)));
            snapshot.put("user_patterns", UserPatternSummary.insufficient("unavailable"));
        }
        return snapshot;
    }

    static Map<String, Object> cachePerformance(CacheStats stats) {
        Map<String, Object> performance = new LinkedHashMap<>();
        performance.put("hit_rate", stats.hitRate());
        performance.put("total_entries", stats.totalEntries());
        performance.put("total_requests", stats.totalRequests());
        return performance;
    }

    private void emit(RequestRun run, ResponsePayload payload) {
        if (!run.emitted.compareAndSet(false, true)) {
            log.warn("[Pipeline] Final response already emitted for user {}", run.query.userId());
            return;
        }
        stage(run, PipelineStage.EMIT);
        try {
            channel.sendFinalResponse(run.query.userId(), payload)
                    .exceptionally(e -> {
                        log.warn("[Pipeline] Failed to deliver final response to {}: {}", run.query.userId(),
                                e.getMessage());
                        return null;
                    });
        } catch (Exception e) { // NOSONAR
            log.warn("[Pipeline] Failed to deliver final response to {}: {}", run.query.userId(), e.getMessage());
        }
    }

    private void status(RequestRun run, String message) {
        try {
            channel.sendStatus(run.query.userId(), message)
                    .exceptionally(e -> {
                        log.debug("[Pipeline] Status update dropped: {}", e.getMessage());
                        return null;
                    });
        } catch (Exception e) { // NOSONAR - progress is advisory
            log.debug("[Pipeline] Status update dropped: {}", e.getMessage());
        }
    }

    private void stage(RequestRun run, PipelineStage stage) {
        run.stage = stage;
        log.debug("[Pipeline] user={} stage={}", run.query.userId(), stage);
    }

    static double processingSeconds(Instant start, Instant end) {
        return Math.round(Duration.between(start, end).toMillis() / 10.0) / 100.0;
    }

    private static boolean containsAny(String text, List<String> keywords) {
        return keywords.stream().anyMatch(text::contains);
    }

    // ==================== EVENTS ====================

    /**
     * A query received from a progress channel.
     */
    public record InboundQueryEvent(Query query) {
    }

    /**
     * Request to forget a user's conversation history.
     */
    public record ClearHistoryEvent(String userId) {
    }

    /**
     * Satisfaction score for the user's latest answer.
     */
    public record FeedbackEvent(String userId, double satisfaction) {
    }

    /**
     * Mutable state of one request.
     */
    private static final class RequestRun {

        private final Query query;
        private final Instant startedAt;
        private final String cacheKey;
        private final AtomicBoolean emitted = new AtomicBoolean(false);
        private final Map<String, Object> streamData = new LinkedHashMap<>();
        private PipelineStage stage;
        private boolean toolNeedDetected;
        private List<Message> history = List.of();
        private UserContext context = UserContext.forNewUser();
        private List<ProactiveSuggestion> suggestions = List.of();

        private RequestRun(Query query, Instant startedAt) {
            this.query = query;
            this.startedAt = startedAt;
            this.cacheKey = RequestCacheService.fingerprint(query.userId(), query.text());
        }
    }
}
