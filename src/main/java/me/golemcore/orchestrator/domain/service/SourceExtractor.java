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

import me.golemcore.orchestrator.domain.model.Source;
import me.golemcore.orchestrator.domain.model.SourceType;
import me.golemcore.orchestrator.domain.model.ToolResult;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Builds the attributed source list of a payload.
 *
 * <p>
 * Sources are numbered 1..n in encounter order. Only list items with a URL and
 * no error marker, and quote maps with a symbol and no error marker, become
 * sources. Titles are whitespace-collapsed and capped at 100 characters.
 */
@Component
public class SourceExtractor {

    static final int MAX_TITLE_LENGTH = 100;
    private static final String ELLIPSIS = "...";
    private static final Set<String> SOCIAL_DOMAINS = Set.of(
            "instagram.com", "twitter.com", "x.com", "facebook.com", "tiktok.com");

    private static final String KEY_URL = "url";
    private static final String KEY_TITLE = "title";
    private static final String KEY_SOURCE = "source";
    private static final String KEY_PLATFORM = "platform";
    private static final String KEY_SYMBOL = "symbol";

    public List<Source> fromToolOutputs(Map<String, ToolResult> outputs) {
        List<Source> sources = new ArrayList<>();
        if (outputs == null) {
            return sources;
        }
        outputs.forEach((toolName, result) -> {
            if (result == null || !result.isSuccess()) {
                return;
            }
            Object data = result.getData();
            if (data instanceof List<?> items) {
                addListItems(sources, items, toolName, null);
            } else if (data instanceof Map<?, ?> map) {
                addQuote(sources, map);
            }
        });
        return sources;
    }

    /**
     * Extracts sources from a specialist's structured payload: primary and
     * secondary research results and a financial quote in the analysis results.
     */
    public List<Source> fromSpecialistPayload(Map<String, Object> payload) {
        List<Source> sources = new ArrayList<>();
        if (payload == null) {
            return sources;
        }
        if (payload.get("primary_results") instanceof List<?> primary) {
            addListItems(sources, primary, null, SourceType.RESEARCH);
        }
        if (payload.get("secondary_results") instanceof List<?> secondary) {
            addListItems(sources, secondary, null, SourceType.RESEARCH_SECONDARY);
        }
        if (payload.get("analysis_results") instanceof Map<?, ?> analysis
                && analysis.get("financial_analysis") instanceof Map<?, ?> quote) {
            addQuote(sources, quote);
        }
        return sources;
    }

    private void addListItems(List<Source> sources, List<?> items, String toolName, SourceType fixedType) {
        for (Object element : items) {
            if (!(element instanceof Map<?, ?> item) || item.containsKey(ToolResult.ERROR_KEY)) {
                continue;
            }
            String url = stringValue(item.get(KEY_URL));
            if (url == null || url.isBlank()) {
                continue;
            }
            int id = sources.size() + 1;
            String title = stringValue(item.get(KEY_TITLE));
            if (title == null || title.isBlank()) {
                title = stringValue(item.get(KEY_SOURCE));
            }
            if (title == null || title.isBlank()) {
                title = "Source " + id;
            }
            String platform = stringValue(item.get(KEY_PLATFORM));
            sources.add(Source.builder()
                    .id(id)
                    .title(cleanTitle(title))
                    .url(url)
                    .type(fixedType != null ? fixedType : typeFor(toolName, url))
                    .platform(platform != null ? platform : hostOf(url))
                    .build());
        }
    }

    private void addQuote(List<Source> sources, Map<?, ?> quote) {
        String symbol = stringValue(quote.get(KEY_SYMBOL));
        if (symbol == null || symbol.isBlank() || quote.containsKey(ToolResult.ERROR_KEY)) {
            return;
        }
        sources.add(Source.builder()
                .id(sources.size() + 1)
                .title("Yahoo Finance - " + symbol)
                .url("https://finance.yahoo.com/quote/" + symbol)
                .type(SourceType.FINANCIAL)
                .platform("yahoo_finance")
                .build());
    }

    static SourceType typeFor(String toolName, String url) {
        String name = toolName != null ? toolName.toLowerCase(Locale.ROOT) : "";
        if (name.contains("financial") || name.contains("stock")) {
            return SourceType.FINANCIAL;
        }
        if (name.contains("news")) {
            return SourceType.NEWS;
        }
        if (name.contains("social_media")) {
            return SourceType.SOCIAL;
        }
        String host = hostOf(url);
        if (host != null && SOCIAL_DOMAINS.stream().anyMatch(domain -> host.equals(domain)
                || host.endsWith("." + domain))) {
            return SourceType.SOCIAL;
        }
        return SourceType.WEB;
    }

    static String cleanTitle(String title) {
        String collapsed = title.trim().replaceAll("\\s+", " ");
        if (collapsed.length() > MAX_TITLE_LENGTH) {
            return collapsed.substring(0, MAX_TITLE_LENGTH - ELLIPSIS.length()) + ELLIPSIS;
        }
        return collapsed;
    }

    private static String hostOf(String url) {
        try {
            String host = URI.create(url.trim()).getHost();
            return host != null ? host.toLowerCase(Locale.ROOT) : null;
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    private static String stringValue(Object value) {
        return value != null ? value.toString() : null;
    }
}
