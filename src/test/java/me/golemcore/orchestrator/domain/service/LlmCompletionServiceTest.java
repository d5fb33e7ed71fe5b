package me.golemcore.orchestrator.domain.service;

import me.golemcore.orchestrator.domain.exception.ExternalServiceException;
import me.golemcore.orchestrator.domain.model.LlmRequest;
import me.golemcore.orchestrator.domain.model.LlmResponse;
import me.golemcore.orchestrator.domain.model.Message;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import me.golemcore.orchestrator.port.outbound.LlmPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class LlmCompletionServiceTest {

    private LlmPort llmPort;
    private OrchestratorProperties properties;
    private LlmCompletionService service;

    @BeforeEach
    void setUp() {
        llmPort = mock(LlmPort.class);
        properties = new OrchestratorProperties();
        properties.getLlm().setFastModel("fast-model");
        properties.getLlm().setSmartModel("smart-model");
        properties.getLlm().setTimeoutMs(200);
        service = new LlmCompletionService(llmPort, properties);
    }

    @Test
    void shouldAddressFastTierAndTrimContent() {
        when(llmPort.chat(any(LlmRequest.class))).thenReturn(CompletableFuture.completedFuture(
                LlmResponse.builder().content("  research  \n").build()));

        String result = service.completeFast(List.of(Message.user("classify")), 0.1, 10);

        assertEquals("research", result);
        ArgumentCaptor<LlmRequest> captor = ArgumentCaptor.forClass(LlmRequest.class);
        verify(llmPort).chat(captor.capture());
        assertEquals("fast-model", captor.getValue().getModel());
        assertEquals(0.1, captor.getValue().getTemperature());
        assertEquals(10, captor.getValue().getMaxTokens());
        assertEquals(1, captor.getValue().getMessages().size());
    }

    @Test
    void shouldAddressSmartTier() {
        when(llmPort.chat(any(LlmRequest.class))).thenReturn(CompletableFuture.completedFuture(
                LlmResponse.builder().content("answer").build()));

        service.completeSmart(List.of(Message.user("explain")), 0.7, 1000);

        ArgumentCaptor<LlmRequest> captor = ArgumentCaptor.forClass(LlmRequest.class);
        verify(llmPort).chat(captor.capture());
        assertEquals("smart-model", captor.getValue().getModel());
    }

    @Test
    void shouldReturnEmptyForNullContent() {
        when(llmPort.chat(any(LlmRequest.class))).thenReturn(CompletableFuture.completedFuture(
                LlmResponse.builder().build()));

        assertEquals("", service.completeFast(List.of(Message.user("x")), 0.0, 5));
    }

    @Test
    void shouldFailOnMissingResponse() {
        when(llmPort.chat(any(LlmRequest.class))).thenReturn(CompletableFuture.completedFuture(null));

        assertThrows(ExternalServiceException.class,
                () -> service.completeFast(List.of(Message.user("x")), 0.0, 5));
    }

    @Test
    void shouldWrapBackendFailure() {
        when(llmPort.chat(any(LlmRequest.class)))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("rate limited")));

        ExternalServiceException thrown = assertThrows(ExternalServiceException.class,
                () -> service.completeSmart(List.of(Message.user("x")), 0.7, 5));

        assertTrue(thrown.getMessage().contains("rate limited"));
    }

    @Test
    void shouldTimeOutAndCancelPendingCall() {
        CompletableFuture<LlmResponse> pending = new CompletableFuture<>();
        when(llmPort.chat(any(LlmRequest.class))).thenReturn(pending);

        ExternalServiceException thrown = assertThrows(ExternalServiceException.class,
                () -> service.completeFast(List.of(Message.user("x")), 0.0, 5));

        assertTrue(thrown.getMessage().contains("timed out after 200ms"));
        assertTrue(pending.isCancelled());
    }
}
