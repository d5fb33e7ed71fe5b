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

package me.golemcore.orchestrator.tools;

import lombok.RequiredArgsConstructor;
import me.golemcore.orchestrator.domain.component.ToolComponent;
import me.golemcore.orchestrator.domain.model.ToolDefinition;
import me.golemcore.orchestrator.domain.model.ToolNames;
import me.golemcore.orchestrator.domain.model.ToolResult;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import me.golemcore.orchestrator.port.outbound.FinancePort;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Stock quote lookup by ticker symbol. Backend errors stay in the data as an
 * {@code error} entry.
 */
@Component
@RequiredArgsConstructor
public class StockInfoTool implements ToolComponent {

    private static final String PARAM_TICKER = "ticker";

    private final FinancePort financePort;
    private final OrchestratorProperties properties;

    @Override
    public boolean isEnabled() {
        return properties.getTools().getStockInfo().isEnabled();
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.withStringParams(ToolNames.GET_STOCK_INFO,
                "Get the current quote and daily change for a stock ticker.",
                Map.of(PARAM_TICKER, "Ticker symbol, e.g. AAPL"));
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        String ticker = ToolParameters.requireString(parameters, PARAM_TICKER);
        if (ticker == null) {
            return CompletableFuture.completedFuture(ToolResult.failure("Ticker is required"));
        }
        return financePort.getQuote(ticker).thenApply(ToolResult::success);
    }
}
