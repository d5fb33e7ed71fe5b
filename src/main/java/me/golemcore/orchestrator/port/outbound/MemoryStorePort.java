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

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Port for the durable vector-memory store holding past exchanges.
 */
public interface MemoryStorePort {

    /**
     * Stores one document with its metadata under the given id.
     */
    CompletableFuture<Void> add(String document, Map<String, Object> metadata, String id);

    /**
     * Semantic lookup of the {@code n} documents closest to {@code text} for a
     * user.
     */
    CompletableFuture<List<String>> query(String text, int n, String userId);

    /**
     * Returns all documents stored for a user, with their metadata, in no
     * particular order.
     */
    CompletableFuture<List<StoredDocument>> get(String userId);

    /**
     * Check if the store is enabled.
     */
    boolean isAvailable();

    record StoredDocument(String document, Map<String, Object> metadata) {
    }
}
