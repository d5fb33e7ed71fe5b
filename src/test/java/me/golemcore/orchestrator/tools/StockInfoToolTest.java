package me.golemcore.orchestrator.tools;

import me.golemcore.orchestrator.domain.model.ToolNames;
import me.golemcore.orchestrator.domain.model.ToolResult;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import me.golemcore.orchestrator.port.outbound.FinancePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class StockInfoToolTest {

    private FinancePort financePort;
    private StockInfoTool tool;

    @BeforeEach
    void setUp() {
        financePort = mock(FinancePort.class);
        tool = new StockInfoTool(financePort, new OrchestratorProperties());
    }

    @Test
    void shouldReturnQuote() {
        Map<String, Object> quote = Map.of("ticker", "AAPL", "price", 190.5);
        when(financePort.getQuote("AAPL")).thenReturn(CompletableFuture.completedFuture(quote));

        ToolResult result = tool.execute(Map.of("ticker", "AAPL")).join();

        assertEquals(ToolNames.GET_STOCK_INFO, tool.getToolName());
        assertTrue(result.isSuccess());
        assertFalse(result.hasErrorMarker());
    }

    @Test
    void shouldKeepBackendErrorInData() {
        when(financePort.getQuote("ZZZZ"))
                .thenReturn(CompletableFuture.completedFuture(Map.of("error", "Unknown ticker")));

        ToolResult result = tool.execute(Map.of("ticker", "ZZZZ")).join();

        assertTrue(result.isSuccess());
        assertTrue(result.hasErrorMarker());
    }

    @Test
    void shouldRejectMissingTicker() {
        ToolResult result = tool.execute(Map.of()).join();

        assertFalse(result.isSuccess());
        assertEquals("Ticker is required", result.getError());
    }
}
