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

package me.golemcore.orchestrator.domain.service;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.orchestrator.domain.model.CacheEntry;
import me.golemcore.orchestrator.domain.model.CacheStats;
import me.golemcore.orchestrator.domain.model.ResponsePayload;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Response cache keyed by a fingerprint of user and normalized query.
 *
 * <p>
 * Entries expire after their TTL and are removed lazily on read (a stale read
 * counts as a miss). When full, the entry with the fewest reads is evicted,
 * the least recently read one among equals.
 */
@Service
@Slf4j
public class RequestCacheService {

    private final OrchestratorProperties properties;
    private final Clock clock;

    private final Object lock = new Object();
    private final Map<String, CacheEntry> entries = new HashMap<>();
    private long hits;
    private long misses;

    public RequestCacheService(OrchestratorProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Stable key for a user's query: SHA-256 over the user id and the query
     * lower-cased with whitespace collapsed.
     */
    public static String fingerprint(String userId, String queryText) {
        String normalized = queryText == null ? ""
                : queryText.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest((userId + "\u0000" + normalized).getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public Optional<ResponsePayload> get(String key) {
        Instant now = Instant.now(clock);
        synchronized (lock) {
            CacheEntry entry = entries.get(key);
            if (entry == null) {
                misses++;
                return Optional.empty();
            }
            if (!entry.isFresh(now)) {
                entries.remove(key);
                misses++;
                log.debug("[Cache] Expired entry removed: {}", key);
                return Optional.empty();
            }
            hits++;
            entry.setAccessCount(entry.getAccessCount() + 1);
            entry.setLastAccessedAt(now);
            return Optional.of(entry.getPayload());
        }
    }

    public void set(String key, ResponsePayload payload, Duration ttl) {
        Instant now = Instant.now(clock);
        int maxSize = Math.max(1, properties.getCache().getMaxSize());
        synchronized (lock) {
            if (!entries.containsKey(key)) {
                while (entries.size() >= maxSize) {
                    evictOne();
                }
            }
            entries.put(key, CacheEntry.builder()
                    .key(key)
                    .payload(payload)
                    .createdAt(now)
                    .ttl(ttl)
                    .accessCount(1)
                    .lastAccessedAt(now)
                    .build());
        }
    }

    /**
     * Removes every entry whose TTL has elapsed.
     *
     * @return number of entries removed
     */
    public int purgeExpired() {
        Instant now = Instant.now(clock);
        int removed;
        synchronized (lock) {
            int before = entries.size();
            entries.values().removeIf(entry -> !entry.isFresh(now));
            removed = before - entries.size();
        }
        if (removed > 0) {
            log.debug("[Cache] Purged {} expired entries", removed);
        }
        return removed;
    }

    public CacheStats getStats() {
        synchronized (lock) {
            return new CacheStats(hits, misses, entries.size());
        }
    }

    public int size() {
        synchronized (lock) {
            return entries.size();
        }
    }

    private void evictOne() {
        entries.values().stream()
                .min(Comparator.comparingInt(CacheEntry::getAccessCount)
                        .thenComparing(CacheEntry::getLastAccessedAt))
                .ifPresent(victim -> {
                    entries.remove(victim.getKey());
                    log.debug("[Cache] Evicted {} (accessCount={})", victim.getKey(), victim.getAccessCount());
                });
    }
}
