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

package me.golemcore.orchestrator.adapter.outbound.finance;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
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
import me.golemcore.orchestrator.port.outbound.FinancePort;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Finance backend using the Yahoo Finance chart API.
 *
 * <p>
 * Reads the quote metadata of the chart endpoint and derives the absolute and
 * percentage change against the previous close. Failures are reported as a map
 * with a single {@code error} entry.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class YahooFinanceAdapter implements FinancePort {

    private static final ExecutorService FINANCE_EXECUTOR = Executors.newFixedThreadPool(4,
            r -> {
                Thread t = new Thread(r, "yahoo-finance");
                t.setDaemon(true);
                return t;
            });

    private final FeignClientFactory feignClientFactory;
    private final OrchestratorProperties properties;

    private ChartApi chartApi;

    @PostConstruct
    public void init() {
        this.chartApi = feignClientFactory.create(ChartApi.class, properties.getTools().getFinance().getBaseUrl());
    }

    @Override
    public CompletableFuture<Map<String, Object>> getQuote(String ticker) {
        return CompletableFuture.supplyAsync(() -> {
            String symbol = ticker == null ? "" : ticker.trim().toUpperCase(Locale.ROOT);
            if (symbol.isEmpty()) {
                return error("Ticker symbol is required");
            }
            try {
                ChartResponse response = chartApi.chart(symbol);
                Meta meta = firstMeta(response);
                if (meta == null || meta.getRegularMarketPrice() == null) {
                    return error("No quote data found for " + symbol);
                }
                return toQuote(symbol, meta);
            } catch (FeignException e) {
                log.warn("[Finance] API error (status {}) for {}", e.status(), symbol);
                return error("Could not fetch stock data for " + symbol + ": HTTP " + e.status());
            } catch (Exception e) { // NOSONAR - broad catch for unexpected errors
                log.error("[Finance] Unexpected error for {}", symbol, e);
                return error("Could not fetch stock data for " + symbol + ": " + e.getMessage());
            }
        }, FINANCE_EXECUTOR);
    }

    static Map<String, Object> toQuote(String symbol, Meta meta) {
        Map<String, Object> quote = new LinkedHashMap<>();
        quote.put("symbol", meta.getSymbol() != null ? meta.getSymbol() : symbol);
        quote.put("longName", meta.getLongName() != null ? meta.getLongName() : meta.getShortName());
        quote.put("currentPrice", meta.getRegularMarketPrice());
        quote.put("previousClose", meta.getChartPreviousClose());
        quote.put("dayHigh", meta.getRegularMarketDayHigh());
        quote.put("dayLow", meta.getRegularMarketDayLow());
        quote.put("volume", meta.getRegularMarketVolume());
        quote.put("fiftyTwoWeekHigh", meta.getFiftyTwoWeekHigh());
        quote.put("fiftyTwoWeekLow", meta.getFiftyTwoWeekLow());
        quote.put("currency", meta.getCurrency());
        quote.put("exchange", meta.getExchangeName());

        Double previous = meta.getChartPreviousClose();
        if (previous != null && previous != 0) {
            double change = meta.getRegularMarketPrice() - previous;
            quote.put("priceChange", round(change));
            quote.put("priceChangePercent", round(change / previous * 100));
        }
        return quote;
    }

    private static Meta firstMeta(ChartResponse response) {
        if (response == null || response.getChart() == null) {
            return null;
        }
        List<ChartResult> results = response.getChart().getResult();
        if (results == null || results.isEmpty()) {
            return null;
        }
        return results.get(0).getMeta();
    }

    private static double round(double value) {
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }

    private static Map<String, Object> error(String message) {
        Map<String, Object> error = new LinkedHashMap<>();
        error.put("error", message);
        return error;
    }

    // Feign API interface
    interface ChartApi {
        @RequestLine("GET /v8/finance/chart/{symbol}?interval=1d&range=5d")
        @Headers({
                "Accept: application/json",
                "User-Agent: Mozilla/5.0"
        })
        ChartResponse chart(@Param("symbol") String symbol);
    }

    // Response DTOs
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class ChartResponse {
        private Chart chart;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class Chart {
        private List<ChartResult> result;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class ChartResult {
        private Meta meta;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class Meta {
        private String symbol;
        private String longName;
        private String shortName;
        private String currency;
        private String exchangeName;
        private Double regularMarketPrice;
        private Double chartPreviousClose;
        private Double regularMarketDayHigh;
        private Double regularMarketDayLow;
        private Long regularMarketVolume;
        private Double fiftyTwoWeekHigh;
        private Double fiftyTwoWeekLow;
    }
}
