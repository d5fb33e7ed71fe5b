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

package me.golemcore.orchestrator.routing;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.orchestrator.domain.model.Message;
import me.golemcore.orchestrator.domain.model.Plan;
import me.golemcore.orchestrator.domain.model.QueryCategory;
import me.golemcore.orchestrator.domain.model.ToolCall;
import me.golemcore.orchestrator.domain.model.ToolNames;
import me.golemcore.orchestrator.domain.service.LlmCompletionService;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Classifies a query with a single completion and turns the category into a
 * {@link Plan}.
 *
 * <p>
 * Post-classification rules are deterministic:
 * <ul>
 * <li>CASUAL, MEMORY: no tools</li>
 * <li>SOCIAL_MEDIA: {@code social_media_search} on the detected platform, then
 * {@code web_search}</li>
 * <li>FINANCIAL: {@code get_stock_info} when a ticker is extracted, else
 * {@code web_search}</li>
 * <li>NEWS: {@code news_search}, then {@code web_search}</li>
 * <li>anything else: {@code web_search}</li>
 * </ul>
 * A failed classification degrades to a single {@code web_search}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class QueryClassifier {

    private static final int MAX_TOKENS = 20;
    private static final String DEFAULT_PLATFORM = "instagram";

    /** Checked in this order against the upper-cased response. */
    private static final List<QueryCategory> PARSE_ORDER = List.of(
            QueryCategory.CASUAL, QueryCategory.MEMORY, QueryCategory.SOCIAL_MEDIA,
            QueryCategory.FINANCIAL, QueryCategory.NEWS);

    private static final Map<String, String> PLATFORM_KEYWORDS = new LinkedHashMap<>();

    static {
        PLATFORM_KEYWORDS.put("twitter", "twitter");
        PLATFORM_KEYWORDS.put("x.com", "twitter");
        PLATFORM_KEYWORDS.put("tiktok", "tiktok");
        PLATFORM_KEYWORDS.put("facebook", "facebook");
        PLATFORM_KEYWORDS.put("youtube", "youtube");
        PLATFORM_KEYWORDS.put("instagram", "instagram");
    }

    private static final String SYSTEM_PROMPT = """
            You classify user queries for an assistant that can search the web, news and
            social media and look up stock quotes.

            Categories:
            - CASUAL: greetings, small talk, thanks, questions about the assistant itself
            - MEMORY: questions about this conversation ("what did I ask first?")
            - SOCIAL_MEDIA: posts, trends or profiles on Instagram, Twitter/X, TikTok, Facebook, YouTube
            - FINANCIAL: stock prices, tickers, companies' market data
            - NEWS: recent events, headlines, breaking or latest news
            - GENERAL_WEB: anything else that needs information from the web

            Respond with the category name only.
            """;

    private final LlmCompletionService completionService;
    private final TickerExtractor tickerExtractor;

    public Plan classify(String query, List<Message> history) {
        QueryCategory category;
        try {
            List<Message> messages = new ArrayList<>();
            messages.add(Message.system(SYSTEM_PROMPT));
            messages.add(Message.user(buildPrompt(query, history)));
            String raw = completionService.completeFast(messages, 0.0, MAX_TOKENS);
            category = parseCategory(raw);
            log.debug("[Planner] Raw classification '{}' -> {}", raw, category);
        } catch (Exception e) { // NOSONAR
            String logLine = "Error during classification, defaulting to web search: " + e.getMessage();
            log.warn("[Planner] {}", logLine);
            return new Plan(QueryCategory.GENERAL_WEB, List.of(webSearch(query)), logLine);
        }
        return planFor(category, query);
    }

    static QueryCategory parseCategory(String raw) {
        String normalized = raw == null ? "" : raw.trim().toUpperCase(Locale.ROOT);
        for (QueryCategory candidate : PARSE_ORDER) {
            if (normalized.contains(candidate.name())) {
                return candidate;
            }
        }
        return QueryCategory.GENERAL_WEB;
    }

    private Plan planFor(QueryCategory category, String query) {
        return switch (category) {
            case CASUAL -> Plan.withoutTools(category, "Detected casual conversation - no tools needed");
            case MEMORY -> Plan.withoutTools(category, "Detected memory query - using conversation context");
            case SOCIAL_MEDIA -> toolPlan(category, List.of(
                    ToolCall.of(ToolNames.SOCIAL_MEDIA_SEARCH,
                            Map.of("query", query, "platform", detectPlatform(query))),
                    webSearch(query)));
            case FINANCIAL -> toolPlan(category, List.of(tickerExtractor.extract(query)
                    .map(symbol -> ToolCall.of(ToolNames.GET_STOCK_INFO, Map.of("ticker", symbol)))
                    .orElseGet(() -> webSearch(query))));
            case NEWS -> toolPlan(category, List.of(
                    ToolCall.of(ToolNames.NEWS_SEARCH, Map.of("query", query)),
                    webSearch(query)));
            case GENERAL_WEB -> toolPlan(category, List.of(webSearch(query)));
        };
    }

    private Plan toolPlan(QueryCategory category, List<ToolCall> calls) {
        List<String> names = calls.stream().map(ToolCall::toolName).toList();
        String logLine = "Classified as " + category + ", using tools: " + names;
        log.info("[Planner] {}", logLine);
        return new Plan(category, calls, logLine);
    }

    static String detectPlatform(String query) {
        String normalized = query.toLowerCase(Locale.ROOT);
        return PLATFORM_KEYWORDS.entrySet().stream()
                .filter(entry -> normalized.contains(entry.getKey()))
                .map(Map.Entry::getValue)
                .findFirst()
                .orElse(DEFAULT_PLATFORM);
    }

    private static ToolCall webSearch(String query) {
        return ToolCall.of(ToolNames.WEB_SEARCH, Map.of("query", query));
    }

    private static String buildPrompt(String query, List<Message> history) {
        StringBuilder sb = new StringBuilder();
        if (history != null && !history.isEmpty()) {
            sb.append("Recent conversation:\n");
            int start = Math.max(0, history.size() - 4);
            for (Message message : history.subList(start, history.size())) {
                sb.append(message.getRole()).append(": ").append(truncate(message.getContent())).append('\n');
            }
            sb.append('\n');
        }
        sb.append("Query: ").append(query);
        return sb.toString();
    }

    private static String truncate(String text) {
        if (text == null) {
            return "";
        }
        return text.length() > 200 ? text.substring(0, 200) + "..." : text;
    }
}
