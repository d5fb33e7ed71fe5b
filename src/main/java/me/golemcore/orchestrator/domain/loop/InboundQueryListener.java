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

package me.golemcore.orchestrator.domain.loop;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.orchestrator.domain.service.AnalyticsService;
import me.golemcore.orchestrator.domain.service.ConversationMemoryService;
import me.golemcore.orchestrator.port.inbound.ProgressChannelPort;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Routes inbound channel events: queries go to {@link RequestRunCoordinator},
 * history and feedback requests are applied directly.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class InboundQueryListener {

    private final RequestRunCoordinator coordinator;
    private final ConversationMemoryService memory;
    private final AnalyticsService analytics;
    private final ProgressChannelPort channel;

    @EventListener
    public void onInboundQuery(PipelineDriver.InboundQueryEvent event) {
        log.debug("[Inbound] enqueue query (user={})", event.query().userId());
        coordinator.enqueue(event.query());
    }

    @EventListener
    public void onClearHistory(PipelineDriver.ClearHistoryEvent event) {
        memory.clearHistory(event.userId());
        channel.sendHistoryCleared(event.userId())
                .exceptionally(e -> {
                    log.warn("[Inbound] Failed to confirm history clear for {}: {}", event.userId(), e.getMessage());
                    return null;
                });
    }

    @EventListener
    public void onFeedback(PipelineDriver.FeedbackEvent event) {
        if (!analytics.recordFeedback(event.userId(), event.satisfaction())) {
            log.debug("[Inbound] Feedback from {} ignored, no recorded interaction", event.userId());
        }
    }
}
