package me.golemcore.orchestrator.adapter.outbound.finance;

import me.golemcore.orchestrator.infrastructure.config.AutoConfiguration;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import me.golemcore.orchestrator.infrastructure.http.FeignClientFactory;
import me.golemcore.orchestrator.testsupport.http.ScriptedHttpInterceptor;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class YahooFinanceAdapterTest {

    private ScriptedHttpInterceptor http;
    private YahooFinanceAdapter adapter;

    @BeforeEach
    void setUp() {
        http = new ScriptedHttpInterceptor();
        OrchestratorProperties properties = new OrchestratorProperties();
        properties.getTools().getFinance().setBaseUrl("http://finance.test");
        OkHttpClient client = new OkHttpClient.Builder().addInterceptor(http).build();
        adapter = new YahooFinanceAdapter(new FeignClientFactory(client, AutoConfiguration.objectMapper()),
                properties);
        adapter.init();
    }

    @Test
    void shouldMapChartMetaToQuote() throws Exception {
        http.enqueueJson(200, """
                {"chart": {"result": [{"meta": {
                  "symbol": "AAPL", "longName": "Apple Inc.", "currency": "USD", "exchangeName": "NMS",
                  "regularMarketPrice": 210.0, "chartPreviousClose": 200.0,
                  "regularMarketDayHigh": 212.5, "regularMarketDayLow": 205.1, "regularMarketVolume": 51000000
                }}]}}
                """);

        Map<String, Object> quote = adapter.getQuote("aapl").get();

        assertEquals("AAPL", quote.get("symbol"));
        assertEquals("Apple Inc.", quote.get("longName"));
        assertEquals(210.0, quote.get("currentPrice"));
        assertEquals(10.0, quote.get("priceChange"));
        assertEquals(5.0, quote.get("priceChangePercent"));
        assertEquals("/v8/finance/chart/AAPL", http.takeCall().path());
    }

    @Test
    void shouldFetchQuotesOnFinanceThreads() throws Exception {
        http.enqueueJson(200, "{\"chart\": {\"result\": []}}");

        adapter.getQuote("MSFT").get();

        assertEquals("yahoo-finance", http.takeCall().threadName());
    }

    @Test
    void shouldReportMissingQuoteData() throws Exception {
        http.enqueueJson(200, "{\"chart\": {\"result\": []}}");

        Map<String, Object> quote = adapter.getQuote("ZZZZ").get();

        assertEquals("No quote data found for ZZZZ", quote.get("error"));
    }

    @Test
    void shouldReportHttpFailure() throws Exception {
        http.enqueueJson(404, "{}");

        Map<String, Object> quote = adapter.getQuote("ZZZZ").get();

        assertTrue(quote.get("error").toString().contains("HTTP 404"));
    }

    @Test
    void shouldRequireTicker() throws Exception {
        assertEquals("Ticker symbol is required", adapter.getQuote(" ").get().get("error"));
        assertEquals(0, http.getCallCount());
    }
}
