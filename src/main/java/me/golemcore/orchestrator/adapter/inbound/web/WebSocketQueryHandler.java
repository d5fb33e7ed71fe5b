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
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.socket.WebSocketHandler;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.util.Map;
import java.util.UUID;

/**
 * Reactive WebSocket handler for queries. Accepts JSON messages:
 * <ul>
 * <li>{@code {"type": "send_message", "message": "...", "userId": "..."}}</li>
 * <li>{@code {"type": "clear_history", "userId": "..."}}</li>
 * <li>{@code {"type": "feedback", "satisfaction": 4.5, "userId": "..."}}</li>
 * </ul>
 * Without a {@code userId} the connection id is used.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WebSocketQueryHandler implements WebSocketHandler {

    static final String TYPE_SEND_MESSAGE = "send_message";
    static final String TYPE_CLEAR_HISTORY = "clear_history";
    static final String TYPE_FEEDBACK = "feedback";

    private final WebProgressChannelAdapter channelAdapter;
    private final ObjectMapper objectMapper;

    @Override
    public Mono<Void> handle(WebSocketSession session) {
        String connectionId = UUID.randomUUID().toString();
        log.info("[WebSocket] Connection established: connectionId={}", connectionId);
        channelAdapter.registerSession(connectionId, session);

        return session.receive()
                .doOnNext(wsMessage -> handleIncoming(wsMessage, connectionId))
                .doFinally(signal -> {
                    log.info("[WebSocket] Connection closed: connectionId={}, signal={}", connectionId, signal);
                    channelAdapter.deregisterSession(connectionId);
                })
                .then();
    }

    private void handleIncoming(WebSocketMessage wsMessage, String connectionId) {
        try {
            handlePayload(wsMessage.getPayloadAsText(), connectionId);
        } catch (IOException | RuntimeException e) { // NOSONAR
            log.warn("[WebSocket] Failed to process incoming message: {}", e.getMessage());
        }
    }

    void handlePayload(String payload, String connectionId) throws IOException {
        @SuppressWarnings("unchecked")
        Map<String, Object> json = objectMapper.readValue(payload, Map.class);

        String type = stringValue(json.get("type"));
        String userId = stringValue(json.get("userId"));
        if (userId == null || userId.isBlank()) {
            userId = connectionId;
        }
        if (type == null) {
            type = TYPE_SEND_MESSAGE;
        }

        switch (type) {
            case TYPE_SEND_MESSAGE -> {
                String text = stringValue(json.get("message"));
                if (text == null || text.isBlank()) {
                    return;
                }
                log.info("[WebSocket] Received query from {}", userId);
                channelAdapter.handleIncomingQuery(connectionId, userId, text.trim());
            }
            case TYPE_CLEAR_HISTORY -> {
                log.info("[WebSocket] {} requested to clear history", userId);
                channelAdapter.handleClearHistory(connectionId, userId);
            }
            case TYPE_FEEDBACK -> {
                Object satisfaction = json.get("satisfaction");
                if (satisfaction instanceof Number number) {
                    channelAdapter.handleFeedback(userId, number.doubleValue());
                }
            }
            default -> log.debug("[WebSocket] Ignoring message of type {}", type);
        }
    }

    private static String stringValue(Object value) {
        return value instanceof String text ? text : null;
    }
}
