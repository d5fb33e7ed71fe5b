package me.golemcore.orchestrator.adapter.inbound.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.orchestrator.domain.loop.PipelineDriver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class WebSocketQueryHandlerTest {

    private static final String CONNECTION_ID = "conn-1";

    private ApplicationEventPublisher eventPublisher;
    private WebProgressChannelAdapter channelAdapter;
    private WebSocketQueryHandler handler;

    @BeforeEach
    void setUp() {
        ObjectMapper objectMapper = new ObjectMapper();
        eventPublisher = mock(ApplicationEventPublisher.class);
        Clock clock = Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC);
        channelAdapter = new WebProgressChannelAdapter(objectMapper, eventPublisher, clock);
        handler = new WebSocketQueryHandler(channelAdapter, objectMapper);
        channelAdapter.registerSession(CONNECTION_ID, mock(WebSocketSession.class));
    }

    @Test
    void shouldPublishQueryEventWithTrimmedText() throws Exception {
        handler.handlePayload("{\"type\":\"send_message\",\"message\":\"  what is AI?  \",\"userId\":\"alice\"}",
                CONNECTION_ID);

        ArgumentCaptor<PipelineDriver.InboundQueryEvent> captor = ArgumentCaptor
                .forClass(PipelineDriver.InboundQueryEvent.class);
        verify(eventPublisher).publishEvent(captor.capture());
        assertEquals("alice", captor.getValue().query().userId());
        assertEquals("what is AI?", captor.getValue().query().text());
        assertEquals(Instant.parse("2026-03-01T10:00:00Z"), captor.getValue().query().receivedAt());
        assertEquals(1, channelAdapter.roomSize("alice"));
    }

    @Test
    void shouldTreatUntypedMessageAsQueryFromConnection() throws Exception {
        handler.handlePayload("{\"message\":\"hello\"}", CONNECTION_ID);

        ArgumentCaptor<PipelineDriver.InboundQueryEvent> captor = ArgumentCaptor
                .forClass(PipelineDriver.InboundQueryEvent.class);
        verify(eventPublisher).publishEvent(captor.capture());
        assertEquals(CONNECTION_ID, captor.getValue().query().userId());
    }

    @Test
    void shouldIgnoreBlankMessage() throws Exception {
        handler.handlePayload("{\"type\":\"send_message\",\"message\":\"   \"}", CONNECTION_ID);

        verify(eventPublisher, never()).publishEvent(any(Object.class));
    }

    @Test
    void shouldPublishClearHistoryEvent() throws Exception {
        handler.handlePayload("{\"type\":\"clear_history\",\"userId\":\"bob\"}", CONNECTION_ID);

        verify(eventPublisher).publishEvent(new PipelineDriver.ClearHistoryEvent("bob"));
        assertEquals(1, channelAdapter.roomSize("bob"));
    }

    @Test
    void shouldPublishFeedbackOnlyForNumericSatisfaction() throws Exception {
        handler.handlePayload("{\"type\":\"feedback\",\"satisfaction\":4.5,\"userId\":\"bob\"}", CONNECTION_ID);
        handler.handlePayload("{\"type\":\"feedback\",\"satisfaction\":\"great\",\"userId\":\"bob\"}",
                CONNECTION_ID);

        verify(eventPublisher).publishEvent(new PipelineDriver.FeedbackEvent("bob", 4.5));
    }

    @Test
    void shouldIgnoreUnknownType() throws Exception {
        handler.handlePayload("{\"type\":\"ping\"}", CONNECTION_ID);

        verify(eventPublisher, never()).publishEvent(any(Object.class));
    }

    @Test
    void shouldRejectMalformedJson() {
        assertThrows(Exception.class, () -> handler.handlePayload("not json", CONNECTION_ID));
    }

    @Test
    void shouldSurviveMalformedFrameAndDeregisterOnClose() {
        WebSocketSession session = mock(WebSocketSession.class);
        WebSocketMessage bad = mock(WebSocketMessage.class);
        when(bad.getPayloadAsText()).thenReturn("{broken");
        WebSocketMessage good = mock(WebSocketMessage.class);
        when(good.getPayloadAsText()).thenReturn("{\"message\":\"hi\",\"userId\":\"carol\"}");
        when(session.receive()).thenReturn(Flux.just(bad, good));

        StepVerifier.create(handler.handle(session))
                .verifyComplete();

        verify(eventPublisher).publishEvent(any(PipelineDriver.InboundQueryEvent.class));
        assertEquals(0, channelAdapter.roomSize("carol"));
    }
}
