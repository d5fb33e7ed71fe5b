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

package me.golemcore.orchestrator.port.outbound;

import java.util.concurrent.CompletableFuture;

/**
 * Vectorizes conversation documents and recall queries for the durable memory
 * store, which keeps no embedding function of its own.
 */
public interface EmbeddingPort {

    /**
     * Embeds one document or query text. The future fails when no model is
     * configured.
     */
    CompletableFuture<float[]> embed(String text);

    String getModel();

    boolean isAvailable();
}
