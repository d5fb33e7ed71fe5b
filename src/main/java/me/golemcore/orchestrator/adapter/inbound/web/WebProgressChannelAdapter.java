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

package me.golemcore.orchestrator.adapter.inbound.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.orchestrator.domain.loop.PipelineDriver;
import me.golemcore.orchestrator.domain.model.Query;
import me.golemcore.orchestrator.domain.model.ResponsePayload;
import me.golemcore.orchestrator.port.inbound.ProgressChannelPort;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.socket.WebSocketSession;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * WebSocket implementation of the progress channel. Every user id is a room;
 * a connection joins the room of each user id it sends on behalf of, and all
 * events for that user go to every open connection in the room.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WebProgressChannelAdapter implements ProgressChannelPort {

    static final String KEY_TYPE = "type";
    static final String TYPE_CONNECTED = "connected";
    static final String TYPE_STATUS_UPDATE = "status_update";
    static final String TYPE_FINAL_RESPONSE = "final_response";
    static final String TYPE_HISTORY_CLEARED = "history_cleared";

    private final ObjectMapper objectMapper;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    private final Map<String, WebSocketSession> sessions = new ConcurrentHashMap<>();
    /** userId -> connectionIds in that user's room. */
    private final Map<String, Set<String>> rooms = new ConcurrentHashMap<>();
    /** connectionId -> userIds the connection joined. */
    private final Map<String, Set<String>> connectionRooms = new ConcurrentHashMap<>();

    @Override
    public String getChannelType() {
        return "web";
    }

    @Override
    public CompletableFuture<Void> sendStatus(String userId, String message) {
        Map<String, Object> event = new LinkedHashMap<>();
        event.put(KEY_TYPE, TYPE_STATUS_UPDATE);
        event.put("message", message);
        return sendJsonToRoom(userId, event);
    }

    @Override
    public CompletableFuture<Void> sendFinalResponse(String userId, ResponsePayload payload) {
        Map<String, Object> event = new LinkedHashMap<>();
        event.put(KEY_TYPE, TYPE_FINAL_RESPONSE);
        event.put("payload", payload);
        return sendJsonToRoom(userId, event);
    }

    @Override
    public CompletableFuture<Void> sendHistoryCleared(String userId) {
        Map<String, Object> event = new LinkedHashMap<>();
        event.put(KEY_TYPE, TYPE_HISTORY_CLEARED);
        event.put("message", "Conversation history cleared");
        return sendJsonToRoom(userId, event);
    }

    // ==================== CONNECTIONS ====================

    public void registerSession(String connectionId, WebSocketSession session) {
        sessions.put(connectionId, session);
        joinRoom(connectionId, connectionId);
        Map<String, Object> event = new LinkedHashMap<>();
        event.put(KEY_TYPE, TYPE_CONNECTED);
        event.put("clientId", connectionId);
        event.put("message", "Connected to the query orchestrator");
        sendJsonToRoom(connectionId, event);
    }

    public void deregisterSession(String connectionId) {
        sessions.remove(connectionId);
        Set<String> joined = connectionRooms.remove(connectionId);
        if (joined == null) {
            return;
        }
        for (String userId : joined) {
            rooms.computeIfPresent(userId, (id, members) -> {
                members.remove(connectionId);
                return members.isEmpty() ? null : members;
            });
        }
    }

    public void joinRoom(String connectionId, String userId) {
        if (connectionId == null || userId == null || !sessions.containsKey(connectionId)) {
            return;
        }
        rooms.computeIfAbsent(userId, id -> ConcurrentHashMap.newKeySet()).add(connectionId);
        connectionRooms.computeIfAbsent(connectionId, id -> ConcurrentHashMap.newKeySet()).add(userId);
    }

    int roomSize(String userId) {
        Set<String> members = rooms.get(userId);
        return members != null ? members.size() : 0;
    }

    // ==================== INBOUND ====================

    public void handleIncomingQuery(String connectionId, String userId, String text) {
        joinRoom(connectionId, userId);
        eventPublisher.publishEvent(new PipelineDriver.InboundQueryEvent(new Query(userId, text, clock.instant())));
    }

    public void handleClearHistory(String connectionId, String userId) {
        joinRoom(connectionId, userId);
        eventPublisher.publishEvent(new PipelineDriver.ClearHistoryEvent(userId));
    }

    public void handleFeedback(String userId, double satisfaction) {
        eventPublisher.publishEvent(new PipelineDriver.FeedbackEvent(userId, satisfaction));
    }

    private CompletableFuture<Void> sendJsonToRoom(String userId, Map<String, Object> event) {
        Set<String> members = userId != null ? rooms.get(userId) : null;
        if (members == null || members.isEmpty()) {
            log.debug("[WebSocket] No active connection for user: {}", userId);
            return CompletableFuture.completedFuture(null);
        }
        String json;
        try {
            json = objectMapper.writeValueAsString(event);
        } catch (Exception e) { // NOSONAR
            log.warn("[WebSocket] Failed to serialize {} for {}: {}", event.get(KEY_TYPE), userId, e.getMessage());
            return CompletableFuture.completedFuture(null);
        }
        for (String connectionId : members) {
            WebSocketSession session = sessions.get(connectionId);
            if (session == null || !session.isOpen()) {
                continue;
            }
            Mono<Void> sendMono = session.send(Mono.just(session.textMessage(json)));
            sendMono.subscribe(
                    unused -> {
                    },
                    error -> log.warn("[WebSocket] Failed to send {} to {}: {}", event.get(KEY_TYPE), connectionId,
                            error.getMessage()));
        }
        return CompletableFuture.completedFuture(null);
    }
}
