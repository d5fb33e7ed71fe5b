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

package me.golemcore.orchestrator.domain.stream;

import lombok.RequiredArgsConstructor;
import me.golemcore.orchestrator.domain.model.StreamType;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Placeholder market feed: synthesizes a quote per configured symbol on every
 * poll. No real market data source is wired in.
 */
@Component
@RequiredArgsConstructor
public class FinancialStreamPoller implements StreamPoller {

    static final List<String> DEFAULT_SYMBOLS = List.of("AAPL", "GOOGL", "MSFT");

    private final Clock clock;

    @Override
    public StreamType getType() {
        return StreamType.FINANCIAL;
    }

    @Override
    public Duration getInterval() {
        return Duration.ofSeconds(30);
    }

    @Override
    public Duration getErrorInterval() {
        return Duration.ofSeconds(60);
    }

    @Override
    public Task open(Map<String, Object> config) {
        List<String> symbols = StreamConfig.stringList(config, "symbols", DEFAULT_SYMBOLS);
        return () -> {
            ThreadLocalRandom random = ThreadLocalRandom.current();
            Map<String, Object> quotes = new LinkedHashMap<>();
            for (String symbol : symbols) {
                double basePrice = 150 + random.nextDouble(-10, 10);
                double change = random.nextDouble(-5, 5);
                Map<String, Object> quote = new LinkedHashMap<>();
                quote.put("symbol", symbol);
                quote.put("price", round(basePrice));
                quote.put("change", round(change));
                quote.put("change_percent", round(change / basePrice * 100));
                quote.put("timestamp", clock.instant().toString());
                quote.put("volume", random.nextLong(1_000_000, 10_000_001));
                quotes.put(symbol, quote);
            }
            return Optional.of(quotes);
        };
    }

    private static double round(double value) {
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }
}
