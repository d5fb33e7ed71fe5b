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

package me.golemcore.orchestrator.port.inbound;

import me.golemcore.orchestrator.domain.model.ResponsePayload;

import java.util.concurrent.CompletableFuture;

/**
 * Port for the per-user push channel carrying progress and terminal events.
 * Status updates are advisory; exactly one final response is sent per query.
 */
public interface ProgressChannelPort {

    /**
     * Returns the channel type identifier (e.g., "web").
     */
    String getChannelType();

    /**
     * Sends an advisory {@code status_update} event.
     */
    CompletableFuture<Void> sendStatus(String userId, String message);

    /**
     * Sends the terminal {@code final_response} event.
     */
    CompletableFuture<Void> sendFinalResponse(String userId, ResponsePayload payload);

    /**
     * Confirms that the user's history was cleared.
     */
    CompletableFuture<Void> sendHistoryCleared(String userId);
}
