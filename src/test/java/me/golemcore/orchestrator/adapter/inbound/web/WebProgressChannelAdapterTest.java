package me.golemcore.orchestrator.adapter.inbound.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.orchestrator.domain.model.ResponsePayload;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class WebProgressChannelAdapterTest {

    private WebProgressChannelAdapter adapter;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC);
        adapter = new WebProgressChannelAdapter(new ObjectMapper(), mock(ApplicationEventPublisher.class), clock);
    }

    private WebSocketSession openSession() {
        WebSocketSession session = mock(WebSocketSession.class);
        when(session.isOpen()).thenReturn(true);
        when(session.textMessage(anyString())).thenReturn(mock(WebSocketMessage.class));
        when(session.send(any())).thenReturn(Mono.empty());
        return session;
    }

    @Test
    void shouldGreetNewConnection() {
        WebSocketSession session = openSession();

        adapter.registerSession("conn-1", session);

        ArgumentCaptor<String> json = ArgumentCaptor.forClass(String.class);
        verify(session).textMessage(json.capture());
        assertTrue(json.getValue().contains("\"type\":\"connected\""));
        assertTrue(json.getValue().contains("\"clientId\":\"conn-1\""));
    }

    @Test
    void shouldDeliverStatusToEveryConnectionInRoom() {
        WebSocketSession first = openSession();
        WebSocketSession second = openSession();
        adapter.registerSession("conn-1", first);
        adapter.registerSession("conn-2", second);
        adapter.joinRoom("conn-1", "alice");
        adapter.joinRoom("conn-2", "alice");

        adapter.sendStatus("alice", "Searching").join();

        ArgumentCaptor<String> json = ArgumentCaptor.forClass(String.class);
        verify(first, times(2)).textMessage(json.capture());
        List<String> sent = json.getAllValues();
        assertTrue(sent.get(1).contains("\"type\":\"status_update\""));
        assertTrue(sent.get(1).contains("Searching"));
        verify(second, times(2)).textMessage(anyString());
    }

    @Test
    void shouldSerializeFinalResponsePayload() {
        WebSocketSession session = openSession();
        adapter.registerSession("conn-1", session);
        adapter.joinRoom("conn-1", "alice");

        adapter.sendFinalResponse("alice", ResponsePayload.builder().response("Answer").build()).join();

        ArgumentCaptor<String> json = ArgumentCaptor.forClass(String.class);
        verify(session, times(2)).textMessage(json.capture());
        String last = json.getAllValues().get(1);
        assertTrue(last.contains("\"type\":\"final_response\""));
        assertTrue(last.contains("\"response\":\"Answer\""));
    }

    @Test
    void shouldCompleteWithoutConnection() {
        adapter.sendHistoryCleared("nobody").join();

        assertEquals(0, adapter.roomSize("nobody"));
    }

    @Test
    void shouldSkipClosedSessions() {
        WebSocketSession session = openSession();
        adapter.registerSession("conn-1", session);
        adapter.joinRoom("conn-1", "alice");
        when(session.isOpen()).thenReturn(false);

        adapter.sendStatus("alice", "Working").join();

        verify(session, atLeastOnce()).isOpen();
        verify(session, times(1)).send(any());
    }

    @Test
    void shouldLeaveRoomsOnDeregister() {
        adapter.registerSession("conn-1", openSession());
        adapter.joinRoom("conn-1", "alice");

        adapter.deregisterSession("conn-1");

        assertEquals(0, adapter.roomSize("alice"));
        assertEquals(0, adapter.roomSize("conn-1"));
    }

    @Test
    void shouldNotJoinRoomForUnknownConnection() {
        WebSocketSession session = openSession();

        adapter.joinRoom("ghost", "alice");

        assertEquals(0, adapter.roomSize("alice"));
        verify(session, never()).send(any());
    }
}
