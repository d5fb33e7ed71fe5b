package me.golemcore.orchestrator.adapter.outbound.search;

import me.golemcore.orchestrator.infrastructure.config.AutoConfiguration;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import me.golemcore.orchestrator.infrastructure.http.FeignClientFactory;
import me.golemcore.orchestrator.testsupport.http.ScriptedHttpInterceptor;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BraveSearchAdapterTest {

    private static final String API_KEY = "test-brave-key";

    private ScriptedHttpInterceptor http;
    private OrchestratorProperties properties;
    private BraveSearchAdapter adapter;

    @BeforeEach
    void setUp() {
        http = new ScriptedHttpInterceptor();
        properties = new OrchestratorProperties();
        properties.getTools().getBraveSearch().setApiKey(API_KEY);
        properties.getTools().getBraveSearch().setBaseUrl("http://brave.test");
        properties.getTools().getBraveSearch().setInitialBackoffMs(1);
        properties.getTools().getBraveSearch().setMaxRetries(2);

        OkHttpClient client = new OkHttpClient.Builder().addInterceptor(http).build();
        FeignClientFactory factory = new FeignClientFactory(client, AutoConfiguration.objectMapper());
        adapter = new BraveSearchAdapter(factory, properties);
        adapter.init();
    }

    @Test
    void shouldMapWebResults() throws Exception {
        http.enqueueJson(200, """
                {"web": {"results": [
                  {"title": "Quantum computing", "url": "https://example.com/q",
                   "description": "A <strong>new</strong> era"}
                ]}}
                """);

        List<Map<String, Object>> items = adapter.webSearch("quantum computing", 8).get();

        assertEquals(1, items.size());
        assertEquals("Quantum computing", items.get(0).get("title"));
        assertEquals("A new era", items.get(0).get("snippet"));
        assertEquals("https://example.com/q", items.get(0).get("url"));

        ScriptedHttpInterceptor.RecordedCall call = http.takeCall();
        assertEquals("GET", call.method());
        assertEquals("/res/v1/web/search", call.path());
        assertEquals("quantum computing", call.queryParameter("q"));
        assertEquals("8", call.queryParameter("count"));
        assertEquals(API_KEY, call.header("X-Subscription-Token"));
    }

    @Test
    void shouldCallBackendOnSearchThreads() throws Exception {
        http.enqueueJson(200, "{\"web\": {\"results\": []}}");

        adapter.webSearch("anything", 3).get();

        assertEquals("brave-search", http.takeCall().threadName());
    }

    @Test
    void shouldMapNewsResults() throws Exception {
        http.enqueueJson(200, """
                {"results": [
                  {"title": "Chip shortage eases", "url": "https://news.example.com/chips",
                   "description": "Supply recovers", "age": "2 hours ago",
                   "meta_url": {"hostname": "news.example.com"}}
                ]}
                """);

        List<Map<String, Object>> items = adapter.newsSearch("chips", 5).get();

        assertEquals("news.example.com", items.get(0).get("source"));
        assertEquals("2 hours ago", items.get(0).get("date"));
        assertEquals("/res/v1/news/search", http.takeCall().path());
    }

    @Test
    void shouldRestrictSocialSearchToPlatformDomain() throws Exception {
        http.enqueueJson(200, """
                {"web": {"results": [{"title": "Trend", "url": "https://tiktok.com/@x", "description": "d"}]}}
                """);

        List<Map<String, Object>> items = adapter.socialMediaSearch("dance trends", "TikTok", 5).get();

        assertEquals("tiktok", items.get(0).get("platform"));
        assertEquals("site:tiktok.com dance trends", http.takeCall().queryParameter("q"));
    }

    @Test
    void shouldRetryOnRateLimit() throws Exception {
        http.enqueueJson(429, "{}");
        http.enqueueJson(200, """
                {"web": {"results": [{"title": "Ok", "url": "https://example.com", "description": ""}]}}
                """);

        List<Map<String, Object>> items = adapter.webSearch("anything", 3).get();

        assertEquals("Ok", items.get(0).get("title"));
        assertEquals(2, http.getCallCount());
    }

    @Test
    void shouldReturnErrorItemOnServerError() throws Exception {
        http.enqueueJson(500, "{}");

        List<Map<String, Object>> items = adapter.webSearch("anything", 3).get();

        assertEquals(1, items.size());
        assertEquals("Search failed: HTTP 500", items.get(0).get("error"));
    }

    @Test
    void shouldReturnErrorItemWhenNothingFound() throws Exception {
        http.enqueueJson(200, "{\"web\": {\"results\": []}}");

        List<Map<String, Object>> items = adapter.webSearch("zzzz", 3).get();

        assertEquals("No results found for 'zzzz'", items.get(0).get("error"));
    }

    @Test
    void shouldNotCallBackendWithoutApiKey() throws Exception {
        properties.getTools().getBraveSearch().setApiKey("");
        BraveSearchAdapter unconfigured = new BraveSearchAdapter(
                new FeignClientFactory(new OkHttpClient.Builder().addInterceptor(http).build(),
                        AutoConfiguration.objectMapper()),
                properties);
        unconfigured.init();

        List<Map<String, Object>> items = unconfigured.webSearch("anything", 3).get();

        assertTrue(items.get(0).containsKey("error"));
        assertEquals(0, http.getCallCount());
    }
}
