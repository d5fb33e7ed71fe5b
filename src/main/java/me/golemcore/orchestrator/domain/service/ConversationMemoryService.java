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
import me.golemcore.orchestrator.domain.model.ConversationTurn;
import me.golemcore.orchestrator.domain.model.Message;
import me.golemcore.orchestrator.domain.model.Topic;
import me.golemcore.orchestrator.domain.model.UserContext;
import me.golemcore.orchestrator.domain.model.UserProfile;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import me.golemcore.orchestrator.port.outbound.MemoryStorePort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Short-term, process-local conversation memory per user.
 *
 * <p>
 * Keeps a bounded window of annotated {@link ConversationTurn}s and an
 * incrementally updated {@link UserProfile} for every user. Each user's state
 * is guarded by its own lock, so concurrent requests for different users never
 * contend.
 *
 * <p>
 * Durable recall goes through {@link MemoryStorePort}: writes are
 * fire-and-forget, reads are timeout-bounded and degrade to empty results.
 */
@Service
@Slf4j
public class ConversationMemoryService {

    static final String DOCUMENT_QUERY_PREFIX = "User query: ";
    static final String DOCUMENT_RESPONSE_SEPARATOR = "\nAI response: ";
    private static final String META_USER_ID = "user_id";
    private static final String META_TIMESTAMP = "timestamp";

    private final QueryAnnotator annotator;
    private final MemoryStorePort memoryStore;
    private final OrchestratorProperties properties;
    private final Clock clock;

    private final Map<String, UserMemory> users = new ConcurrentHashMap<>();

    public ConversationMemoryService(QueryAnnotator annotator, MemoryStorePort memoryStore,
            OrchestratorProperties properties, Clock clock) {
        this.annotator = annotator;
        this.memoryStore = memoryStore;
        this.properties = properties;
        this.clock = clock;
    }

    // ==================== TURNS ====================

    public ConversationTurn addConversationTurn(String userId, String query, String response,
            Map<String, Object> metadata) {
        ConversationTurn turn = ConversationTurn.builder()
                .timestamp(Instant.now(clock))
                .queryText(query)
                .responseText(response)
                .topics(annotator.topics(query))
                .sentiment(annotator.sentiment(query))
                .complexity(annotator.complexity(query))
                .metadata(metadata != null ? Map.copyOf(metadata) : Map.of())
                .build();

        UserMemory memory = memoryFor(userId);
        int maxTurns = properties.getMemory().getMaxTurnsPerUser();
        synchronized (memory) {
            memory.turns.addLast(turn);
            while (memory.turns.size() > maxTurns) {
                memory.turns.removeFirst();
            }
            memory.profile.record(turn);
        }
        log.debug("[Memory] Turn added for {}: topics={}, complexity={}", userId, turn.getTopics(),
                turn.getComplexity());
        return turn;
    }

    public List<ConversationTurn> getRecentTurns(String userId, int limit) {
        UserMemory memory = users.get(userId);
        if (memory == null) {
            return List.of();
        }
        synchronized (memory) {
            List<ConversationTurn> all = new ArrayList<>(memory.turns);
            return List.copyOf(all.subList(Math.max(0, all.size() - limit), all.size()));
        }
    }

    public UserProfile getProfile(String userId) {
        UserMemory memory = users.get(userId);
        if (memory == null) {
            return new UserProfile();
        }
        synchronized (memory) {
            return memory.profile.copy();
        }
    }

    /**
     * Builds the context used for personalization: recent turns, the profile and
     * whether the current query touches topics the user already prefers.
     */
    public UserContext getContextForQuery(String userId, String query) {
        int contextTurns = properties.getMemory().getContextTurns();
        List<ConversationTurn> recent = getRecentTurns(userId, contextTurns);
        if (recent.isEmpty()) {
            return UserContext.forNewUser();
        }
        UserProfile profile = getProfile(userId);

        Set<String> recentTopics = new LinkedHashSet<>();
        for (ConversationTurn turn : recent) {
            turn.getTopics().forEach(topic -> recentTopics.add(topic.label()));
        }

        Set<Topic> queryTopics = annotator.topics(query);
        boolean familiar = queryTopics.stream().anyMatch(profile.getPreferredTopics()::containsKey);

        return UserContext.builder()
                .newUser(false)
                .recentTopics(new ArrayList<>(recentTopics))
                .userPreferences(profile)
                .conversationFlow(recent)
                .suggestedApproach(familiar ? UserContext.APPROACH_PERSONALIZED : UserContext.APPROACH_STANDARD)
                .build();
    }

    // ==================== HISTORY ====================

    /**
     * Returns the user's conversation as alternating user/assistant messages:
     * history rehydrated from the durable store first, then live turns.
     */
    public List<Message> getConversationHistory(String userId) {
        UserMemory memory = users.get(userId);
        if (memory == null) {
            return List.of();
        }
        synchronized (memory) {
            List<Message> history = new ArrayList<>(memory.rehydrated);
            for (ConversationTurn turn : memory.turns) {
                history.add(Message.user(turn.getQueryText()));
                history.add(Message.assistant(turn.getResponseText()));
            }
            return history;
        }
    }

    /**
     * Loads history from the durable store once per user when nothing is held in
     * process, e.g. after a restart.
     *
     * @return number of messages rehydrated
     */
    public int rehydrateIfEmpty(String userId) {
        UserMemory memory = memoryFor(userId);
        synchronized (memory) {
            if (memory.rehydrationAttempted || !memory.turns.isEmpty()) {
                return 0;
            }
            memory.rehydrationAttempted = true;
        }
        List<Message> restored = getRecentHistory(userId, properties.getMemory().getHistoryLimit());
        if (restored.isEmpty()) {
            return 0;
        }
        synchronized (memory) {
            memory.rehydrated.clear();
            memory.rehydrated.addAll(restored);
        }
        log.info("[Memory] Rehydrated {} messages for {}", restored.size(), userId);
        return restored.size();
    }

    public void clearHistory(String userId) {
        UserMemory memory = memoryFor(userId);
        synchronized (memory) {
            memory.turns.clear();
            memory.rehydrated.clear();
            memory.rehydrationAttempted = true;
        }
        log.info("[Memory] History cleared for {}", userId);
    }

    // ==================== DURABLE STORE ====================

    /**
     * Stores the exchange in the durable store without waiting for the result.
     */
    public void addToMemory(String userId, String query, String response) {
        if (!memoryStore.isAvailable()) {
            return;
        }
        Instant now = Instant.now(clock);
        String document = DOCUMENT_QUERY_PREFIX + query + DOCUMENT_RESPONSE_SEPARATOR + response;
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(META_USER_ID, userId);
        metadata.put(META_TIMESTAMP, now.toString());
        try {
            memoryStore.add(document, metadata, userId + "-" + now)
                    .exceptionally(e -> {
                        log.warn("[Memory] Durable write failed for {}: {}", userId, ExternalCalls.safeMessage(e));
                        return null;
                    });
        } catch (RuntimeException e) { // NOSONAR - durable writes never surface
            log.warn("[Memory] Durable write rejected for {}: {}", userId, e.getMessage());
        }
    }

    /**
     * Returns up to {@code n} stored documents semantically close to
     * {@code text}, or an empty list when the store is unavailable.
     */
    public List<String> searchMemory(String userId, String text, int n) {
        if (!memoryStore.isAvailable()) {
            return List.of();
        }
        try {
            List<String> documents = ExternalCalls.await(memoryStore.query(text, n, userId),
                    properties.getMemory().getDurable().getTimeoutMs(), "Memory search");
            return documents != null ? documents : List.of();
        } catch (Exception e) { // NOSONAR
            log.warn("[Memory] Search failed for {}: {}", userId, e.getMessage());
            return List.of();
        }
    }

    /**
     * Reads the user's stored exchanges ordered by timestamp and returns the last
     * {@code limit} of them as alternating user/assistant messages.
     */
    public List<Message> getRecentHistory(String userId, int limit) {
        if (!memoryStore.isAvailable()) {
            return List.of();
        }
        List<MemoryStorePort.StoredDocument> documents;
        try {
            documents = ExternalCalls.await(memoryStore.get(userId),
                    properties.getMemory().getDurable().getTimeoutMs(), "Memory history read");
        } catch (Exception e) { // NOSONAR
            log.warn("[Memory] History read failed for {}: {}", userId, e.getMessage());
            return List.of();
        }
        if (documents == null || documents.isEmpty()) {
            return List.of();
        }

        List<MemoryStorePort.StoredDocument> ordered = new ArrayList<>(documents);
        ordered.sort(Comparator.comparing(ConversationMemoryService::timestampOf));
        List<MemoryStorePort.StoredDocument> window = ordered.subList(Math.max(0, ordered.size() - limit),
                ordered.size());

        List<Message> messages = new ArrayList<>();
        for (MemoryStorePort.StoredDocument stored : window) {
            String document = stored.document();
            if (document == null) {
                continue;
            }
            int separator = document.indexOf(DOCUMENT_RESPONSE_SEPARATOR);
            if (separator < 0) {
                continue;
            }
            String query = document.substring(0, separator);
            if (query.startsWith(DOCUMENT_QUERY_PREFIX)) {
                query = query.substring(DOCUMENT_QUERY_PREFIX.length());
            }
            messages.add(Message.user(query));
            messages.add(Message.assistant(document.substring(separator + DOCUMENT_RESPONSE_SEPARATOR.length())));
        }
        return messages;
    }

    private static Instant timestampOf(MemoryStorePort.StoredDocument document) {
        Object timestamp = document.metadata() != null ? document.metadata().get(META_TIMESTAMP) : null;
        if (timestamp == null) {
            return Instant.EPOCH;
        }
        try {
            return Instant.parse(timestamp.toString());
        } catch (DateTimeParseException e) {
            return Instant.EPOCH;
        }
    }

    private UserMemory memoryFor(String userId) {
        return users.computeIfAbsent(userId, id -> new UserMemory());
    }

    private static final class UserMemory {
        private final Deque<ConversationTurn> turns = new ArrayDeque<>();
        private final UserProfile profile = new UserProfile();
        private final List<Message> rehydrated = new ArrayList<>();
        private boolean rehydrationAttempted;
    }
}
