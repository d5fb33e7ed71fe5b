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
import me.golemcore.orchestrator.domain.service.LlmCompletionService;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Extracts a stock ticker from a query with a constrained completion. Only
 * answers of one to five uppercase letters are accepted; {@code NONE}, prose
 * and failures yield empty.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TickerExtractor {

    private static final Pattern TICKER = Pattern.compile("^[A-Z]{1,5}$");
    private static final String NONE = "NONE";
    private static final int MAX_TOKENS = 10;

    private final LlmCompletionService completionService;

    public Optional<String> extract(String query) {
        String prompt = "Extract the stock ticker symbol from this query: \"" + query + "\". "
                + "Return ONLY the ticker symbol (e.g., AAPL, GOOGL, TSLA). "
                + "If no specific company or ticker is mentioned, return \"NONE\".";
        try {
            String raw = completionService.completeFast(List.of(Message.user(prompt)), 0.0, MAX_TOKENS);
            return validate(raw);
        } catch (Exception e) { // NOSONAR
            log.warn("[Planner] Ticker extraction failed: {}", e.getMessage());
            return Optional.empty();
        }
    }

    static Optional<String> validate(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String candidate = raw.trim().toUpperCase(Locale.ROOT);
        if (NONE.equals(candidate) || !TICKER.matcher(candidate).matches()) {
            log.debug("[Planner] Rejected ticker candidate: '{}'", raw);
            return Optional.empty();
        }
        return Optional.of(candidate);
    }
}
