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

package me.golemcore.orchestrator.adapter.outbound.search;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import feign.FeignException;
import feign.Headers;
import feign.Param;
import feign.RequestLine;
import jakarta.annotation.PostConstruct;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import me.golemcore.orchestrator.infrastructure.http.FeignClientFactory;
import me.golemcore.orchestrator.port.outbound.SearchPort;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Supplier;

/**
 * Search backend using the Brave Search API.
 *
 * <p>
 * Web and news results come from the {@code web} and {@code news} endpoints.
 * Social media search is a web search restricted to the platform's domain.
 * Rate-limited calls (HTTP 429) are retried with exponential backoff; every
 * other failure, and an empty result set, is returned as a single
 * {@code error} item.
 *
 * <p>
 * Configuration:
 * <ul>
 * <li>{@code orchestrator.tools.brave-search.api-key} - Brave API key
 * <li>{@code orchestrator.tools.brave-search.base-url} - API base URL
 * </ul>
 *
 * @see <a href="https://brave.com/search/api/">Brave Search API</a>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BraveSearchAdapter implements SearchPort {

    static final String PLATFORM_ALL = "all";
    private static final int MAX_COUNT = 20;
    private static final double BACKOFF_MULTIPLIER = 2.0;
    private static final int HTTP_TOO_MANY_REQUESTS = 429;

    private static final Map<String, String> PLATFORM_DOMAINS = Map.of(
            "instagram", "instagram.com",
            "twitter", "twitter.com",
            "tiktok", "tiktok.com",
            "facebook", "facebook.com",
            "youtube", "youtube.com");

    private static final ExecutorService SEARCH_EXECUTOR = Executors.newFixedThreadPool(8,
            r -> {
                Thread t = new Thread(r, "brave-search");
                t.setDaemon(true);
                return t;
            });

    private final FeignClientFactory feignClientFactory;
    private final OrchestratorProperties properties;

    private BraveSearchApi searchApi;
    private String apiKey;

    @PostConstruct
    public void init() {
        var config = properties.getTools().getBraveSearch();
        this.apiKey = config.getApiKey();
        if (apiKey == null || apiKey.isBlank()) {
            log.warn("[Search] Brave API key is not configured, searches will return errors");
            return;
        }
        this.searchApi = feignClientFactory.create(BraveSearchApi.class, config.getBaseUrl());
        log.info("[Search] Brave Search backend initialized");
    }

    @Override
    public CompletableFuture<List<Map<String, Object>>> webSearch(String query, int maxResults) {
        return CompletableFuture.supplyAsync(() -> search(query, () -> {
            WebSearchResponse response = searchApi.webSearch(apiKey, query, clamp(maxResults));
            return toWebItems(response, null);
        }), SEARCH_EXECUTOR);
    }

    @Override
    public CompletableFuture<List<Map<String, Object>>> newsSearch(String query, int maxResults) {
        return CompletableFuture.supplyAsync(() -> search(query, () -> {
            NewsSearchResponse response = searchApi.newsSearch(apiKey, query, clamp(maxResults));
            List<Map<String, Object>> items = new ArrayList<>();
            if (response != null && response.getResults() != null) {
                for (NewsResult result : response.getResults()) {
                    Map<String, Object> item = new LinkedHashMap<>();
                    item.put("title", nullToEmpty(result.getTitle()));
                    item.put("source", result.getMetaUrl() != null ? nullToEmpty(result.getMetaUrl().getHostname())
                            : "");
                    item.put("date", nullToEmpty(result.getAge()));
                    item.put("url", nullToEmpty(result.getUrl()));
                    item.put("snippet", stripTags(result.getDescription()));
                    items.add(item);
                }
            }
            return items;
        }), SEARCH_EXECUTOR);
    }

    @Override
    public CompletableFuture<List<Map<String, Object>>> socialMediaSearch(String query, String platform,
            int maxResults) {
        String resolvedPlatform = platform != null ? platform.toLowerCase(Locale.ROOT) : PLATFORM_ALL;
        String domain = PLATFORM_DOMAINS.get(resolvedPlatform);
        String effectiveQuery = domain != null ? "site:" + domain + " " + query : query;
        return CompletableFuture.supplyAsync(() -> search(query, () -> {
            WebSearchResponse response = searchApi.webSearch(apiKey, effectiveQuery, clamp(maxResults));
            return toWebItems(response, resolvedPlatform);
        }), SEARCH_EXECUTOR);
    }

    private List<Map<String, Object>> search(String query, Supplier<List<Map<String, Object>>> call) {
        if (searchApi == null) {
            return errorItem("Search backend is not configured");
        }
        var config = properties.getTools().getBraveSearch();
        int maxRetries = config.getMaxRetries();
        for (int attempt = 0; attempt <= maxRetries; attempt++) {
            try {
                List<Map<String, Object>> items = call.get();
                if (items.isEmpty()) {
                    return errorItem("No results found for '" + query + "'");
                }
                return items;
            } catch (FeignException e) {
                if (e.status() == HTTP_TOO_MANY_REQUESTS && attempt < maxRetries) {
                    long backoffMs = (long) (config.getInitialBackoffMs() * Math.pow(BACKOFF_MULTIPLIER, attempt));
                    log.warn("[Search] Rate limit hit (attempt {}/{}), retrying in {}ms",
                            attempt + 1, maxRetries, backoffMs);
                    sleep(backoffMs);
                } else {
                    log.error("[Search] API error (status {}) for query: {}", e.status(), query);
                    return errorItem("Search failed: HTTP " + e.status());
                }
            } catch (Exception e) { // NOSONAR - broad catch for unexpected errors
                log.error("[Search] Unexpected error for query: {}", query, e);
                return errorItem("Search failed: " + e.getMessage());
            }
        }
        return errorItem("Search failed: rate limit exceeded");
    }

    private static List<Map<String, Object>> toWebItems(WebSearchResponse response, String platform) {
        List<Map<String, Object>> items = new ArrayList<>();
        if (response == null || response.getWeb() == null || response.getWeb().getResults() == null) {
            return items;
        }
        for (WebResult result : response.getWeb().getResults()) {
            Map<String, Object> item = new LinkedHashMap<>();
            item.put("title", nullToEmpty(result.getTitle()));
            item.put("snippet", stripTags(result.getDescription()));
            item.put("url", nullToEmpty(result.getUrl()));
            if (platform != null) {
                item.put("platform", platform);
            }
            items.add(item);
        }
        return items;
    }

    private static List<Map<String, Object>> errorItem(String message) {
        Map<String, Object> item = new LinkedHashMap<>();
        item.put("error", message);
        return List.of(item);
    }

    private static int clamp(int count) {
        return Math.max(1, Math.min(MAX_COUNT, count));
    }

    private static String stripTags(String text) {
        return text == null ? "" : text.replaceAll("<[^>]+>", "");
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }

    private void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Search retry sleep interrupted", e);
        }
    }

    // Feign API interface
    interface BraveSearchApi {
        @RequestLine("GET /res/v1/web/search?q={query}&count={count}")
        @Headers({
                "Accept: application/json",
                "X-Subscription-Token: {apiKey}"
        })
        WebSearchResponse webSearch(
                @Param("apiKey") String apiKey,
                @Param("query") String query,
                @Param("count") int count);

        @RequestLine("GET /res/v1/news/search?q={query}&count={count}")
        @Headers({
                "Accept: application/json",
                "X-Subscription-Token: {apiKey}"
        })
        NewsSearchResponse newsSearch(
                @Param("apiKey") String apiKey,
                @Param("query") String query,
                @Param("count") int count);
    }

    // Response DTOs
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class WebSearchResponse {
        private WebResults web;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class WebResults {
        private List<WebResult> results;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class WebResult {
        private String title;
        private String url;
        private String description;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class NewsSearchResponse {
        private List<NewsResult> results;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class NewsResult {
        private String title;
        private String url;
        private String description;
        private String age;
        @JsonProperty("meta_url")
        private MetaUrl metaUrl;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class MetaUrl {
        private String hostname;
    }
}
