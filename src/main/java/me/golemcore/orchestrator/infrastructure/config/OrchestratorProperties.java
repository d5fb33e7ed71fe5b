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

package me.golemcore.orchestrator.infrastructure.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Centralized configuration properties for the orchestrator, bound from
 * application.yml.
 *
 * <p>
 * All configuration is organized under the {@code orchestrator.*} prefix:
 * <ul>
 * <li>{@link LlmProperties} - generation backend and model tiers</li>
 * <li>{@link ToolsProperties} - search/finance backends and the tool
 * catalog</li>
 * <li>{@link CacheProperties} - request cache size and TTLs</li>
 * <li>{@link MemoryProperties} - short-term history and the durable store</li>
 * <li>{@link PipelineProperties} - worker pool and request behaviour</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "orchestrator")
@Data
public class OrchestratorProperties {

    private LlmProperties llm = new LlmProperties();
    private EmbeddingProperties embedding = new EmbeddingProperties();
    private HttpProperties http = new HttpProperties();
    private ToolsProperties tools = new ToolsProperties();
    private CacheProperties cache = new CacheProperties();
    private MemoryProperties memory = new MemoryProperties();
    private AnalyticsProperties analytics = new AnalyticsProperties();
    private PipelineProperties pipeline = new PipelineProperties();
    private StreamsProperties streams = new StreamsProperties();
    private DiscoveryProperties discovery = new DiscoveryProperties();

    // ==================== LLM ====================

    @Data
    public static class LlmProperties {
        /** openai (any OpenAI-compatible endpoint) or anthropic. */
        private String provider = "openai";
        private String apiKey = "";
        /** Provider endpoint; the provider default when unset. */
        private String baseUrl;
        /** Classification, ticker extraction, confidence scoring. */
        private String fastModel = "llama-3.1-8b-instant";
        /** Synthesis, specialist content and personalization. */
        private String smartModel = "llama-3.3-70b-versatile";
        private long timeoutMs = 30000;
        private int maxRetries = 3;
        private long initialBackoffMs = 2000;
    }

    @Data
    public static class EmbeddingProperties {
        private String apiKey = "";
        private String baseUrl;
        private String model = "text-embedding-3-small";
    }

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 60000;
        private long writeTimeout = 60000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
    }

    // ==================== TOOLS ====================

    @Data
    public static class ToolsProperties {
        private long timeoutMs = 30000;
        private BraveSearchProperties braveSearch = new BraveSearchProperties();
        private FinanceProperties finance = new FinanceProperties();
        private ToolToggle webSearch = new ToolToggle(8);
        private ToolToggle newsSearch = new ToolToggle(5);
        private ToolToggle socialMediaSearch = new ToolToggle(5);
        private ToolToggle stockInfo = new ToolToggle(1);
    }

    @Data
    public static class ToolToggle {
        private boolean enabled = true;
        private int maxResults;

        public ToolToggle() {
        }

        public ToolToggle(int maxResults) {
            this.maxResults = maxResults;
        }
    }

    @Data
    public static class BraveSearchProperties {
        private String apiKey = "";
        private String baseUrl = "https://api.search.brave.com";
        private int maxRetries = 3;
        private long initialBackoffMs = 1000;
    }

    @Data
    public static class FinanceProperties {
        private String baseUrl = "https://query1.finance.yahoo.com";
    }

    // ==================== CACHE ====================

    @Data
    public static class CacheProperties {
        private int maxSize = 500;
        private Duration specialistTtl = Duration.ofMinutes(30);
        private Duration fallbackTtl = Duration.ofMinutes(15);
        private Duration cleanupInterval = Duration.ofMinutes(5);
    }

    // ==================== MEMORY ====================

    @Data
    public static class MemoryProperties {
        private int maxTurnsPerUser = 50;
        private int contextTurns = 5;
        private int historyLimit = 10;
        private int searchResults = 3;
        private DurableMemoryProperties durable = new DurableMemoryProperties();
    }

    @Data
    public static class DurableMemoryProperties {
        private boolean enabled = false;
        private String baseUrl = "http://localhost:8001";
        private String collection = "conversations";
        private long timeoutMs = 10000;
    }

    @Data
    public static class AnalyticsProperties {
        private int maxPatterns = 100;
        private Duration retention = Duration.ofHours(24);
    }

    // ==================== PIPELINE ====================

    @Data
    public static class PipelineProperties {
        private int workerThreads = 8;
        private int queueCapacity = 100;
        private int casualHistoryTurns = 20;
        private long shutdownTimeoutSeconds = 10;
    }

    @Data
    public static class StreamsProperties {
        private boolean enabled = true;
        private List<String> defaultSymbols = new ArrayList<>(List.of("AAPL", "GOOGL", "MSFT", "TSLA", "NVDA"));
        private List<String> defaultNewsKeywords = new ArrayList<>(
                List.of("AI", "technology", "innovation", "startup"));
        private int poolSize = 2;
    }

    @Data
    public static class DiscoveryProperties {
        private boolean enabled = false;
    }
}
