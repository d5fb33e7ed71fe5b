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

package me.golemcore.orchestrator.domain.model;

import lombok.Builder;
import lombok.Data;

import java.time.Duration;
import java.time.Instant;

/**
 * Cached response payload with its freshness window and usage counter.
 */
@Data
@Builder
public class CacheEntry {

    private String key;
    private ResponsePayload payload;
    private Instant createdAt;
    private Duration ttl;
    private int accessCount;
    private Instant lastAccessedAt;

    public boolean isFresh(Instant now) {
        return Duration.between(createdAt, now).compareTo(ttl) < 0;
    }
}
