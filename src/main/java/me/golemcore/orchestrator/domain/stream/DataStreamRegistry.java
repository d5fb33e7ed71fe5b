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

package me.golemcore.orchestrator.domain.stream;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.orchestrator.domain.model.StreamSnapshot;
import me.golemcore.orchestrator.domain.model.StreamStatus;
import me.golemcore.orchestrator.domain.model.StreamType;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Long-lived background pollers keyed by stream id.
 *
 * <p>
 * Each stream reschedules itself after every poll, using the poller's normal
 * interval on success and its error interval on failure. Stopping a stream
 * cancels its pending future, so no further cycle runs once
 * {@link #stopStream(String)} returns, except for one already in flight.
 *
 * <p>
 * Stopping a stream drops its snapshot, so it then reads as
 * {@code not_found}. After {@link #shutdown()} the last snapshots stay readable
 * with status {@code inactive}.
 */
@Service
@Slf4j
public class DataStreamRegistry {

    public static final String DEFAULT_FINANCIAL_STREAM = "default_financial";
    public static final String DEFAULT_NEWS_STREAM = "tech_news";

    private final Map<StreamType, StreamPoller> pollers = new EnumMap<>(StreamType.class);
    private final Map<String, ActiveStream> activeStreams = new ConcurrentHashMap<>();
    private final Map<String, Snapshot> snapshots = new ConcurrentHashMap<>();
    private final Map<String, List<Consumer<Object>>> callbacks = new ConcurrentHashMap<>();
    private final OrchestratorProperties properties;
    private final Clock clock;
    private final ScheduledExecutorService scheduler;
    private volatile boolean defaultStreamsInitialized;

    public DataStreamRegistry(List<StreamPoller> pollers, OrchestratorProperties properties, Clock clock) {
        for (StreamPoller poller : pollers) {
            this.pollers.put(poller.getType(), poller);
        }
        this.properties = properties;
        this.clock = clock;
        AtomicInteger threadCounter = new AtomicInteger();
        this.scheduler = Executors.newScheduledThreadPool(
                Math.max(1, properties.getStreams().getPoolSize()), r -> {
                    Thread t = new Thread(r, "stream-poller-" + threadCounter.incrementAndGet());
                    t.setDaemon(true);
                    return t;
                });
    }

    // ==================== LIFECYCLE ====================

    /**
     * Creates the default market and technology news streams once per process.
     * Failures are logged and retried on the next call.
     */
    public synchronized void ensureDefaultStreams() {
        if (defaultStreamsInitialized || !properties.getStreams().isEnabled()) {
            return;
        }
        OrchestratorProperties.StreamsProperties streams = properties.getStreams();
        boolean financial = activeStreams.containsKey(DEFAULT_FINANCIAL_STREAM)
                || createStream(DEFAULT_FINANCIAL_STREAM, StreamType.FINANCIAL,
                        Map.of("symbols", List.copyOf(streams.getDefaultSymbols())));
        boolean news = activeStreams.containsKey(DEFAULT_NEWS_STREAM)
                || createStream(DEFAULT_NEWS_STREAM, StreamType.NEWS,
                        Map.of("keywords", List.copyOf(streams.getDefaultNewsKeywords())));
        if (financial && news) {
            defaultStreamsInitialized = true;
            log.info("[Streams] Default data streams initialized");
        } else {
            log.error("[Streams] Failed to initialize default streams");
        }
    }

    public boolean isDefaultStreamsInitialized() {
        return defaultStreamsInitialized;
    }

    /**
     * Starts polling a new stream. The first poll runs immediately.
     *
     * @return false when the id is already active, no poller serves the type,
     *         or the scheduler refuses the task
     */
    public boolean createStream(String streamId, StreamType type, Map<String, Object> config) {
        StreamPoller poller = pollers.get(type);
        if (poller == null) {
            log.error("[Streams] No poller registered for stream type {}", type.label());
            return false;
        }
        ActiveStream stream = new ActiveStream(streamId, poller, poller.open(config));
        if (activeStreams.putIfAbsent(streamId, stream) != null) {
            log.warn("[Streams] Stream {} already exists", streamId);
            return false;
        }
        try {
            stream.schedule(Duration.ZERO);
        } catch (RejectedExecutionException e) {
            activeStreams.remove(streamId, stream);
            log.error("[Streams] Failed to create stream {}: {}", streamId, e.getMessage());
            return false;
        }
        log.info("[Streams] Created {} stream: {}", type.label(), streamId);
        return true;
    }

    public boolean stopStream(String streamId) {
        ActiveStream stream = activeStreams.remove(streamId);
        if (stream == null) {
            return false;
        }
        stream.cancel();
        callbacks.remove(streamId);
        snapshots.remove(streamId);
        log.info("[Streams] Stopped stream: {}", streamId);
        return true;
    }

    @PreDestroy
    public void shutdown() {
        activeStreams.values().forEach(ActiveStream::cancel);
        activeStreams.clear();
        scheduler.shutdownNow();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("[Streams] Pollers did not terminate in time");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("[Streams] Shut down");
    }

    // ==================== ACCESS ====================

    public void registerCallback(String streamId, Consumer<Object> callback) {
        callbacks.computeIfAbsent(streamId, id -> new CopyOnWriteArrayList<>()).add(callback);
    }

    public StreamSnapshot getLatestData(String streamId) {
        Snapshot snapshot = snapshots.get(streamId);
        if (snapshot == null) {
            return StreamSnapshot.notFound(streamId);
        }
        return StreamSnapshot.builder()
                .streamId(streamId)
                .data(snapshot.data())
                .lastUpdate(snapshot.updatedAt())
                .status(activeStreams.containsKey(streamId) ? StreamStatus.ACTIVE : StreamStatus.INACTIVE)
                .build();
    }

    public boolean isActive(String streamId) {
        return activeStreams.containsKey(streamId);
    }

    public int activeStreamCount() {
        return activeStreams.size();
    }

    // ==================== POLLING ====================

    private void publish(ActiveStream stream, Object data) {
        // cancel() holds the same lock, so a stopped stream never writes its snapshot back
        synchronized (stream) {
            if (stream.cancelled || activeStreams.get(stream.id) != stream) {
                return;
            }
            snapshots.put(stream.id, new Snapshot(data, clock.instant()));
        }
        for (Consumer<Object> callback : callbacks.getOrDefault(stream.id, List.of())) {
            try {
                callback.accept(data);
            } catch (Exception e) { // NOSONAR - one callback must not stop the stream
                log.warn("[Streams] Callback for {} failed: {}", stream.id, e.getMessage());
            }
        }
    }

    private record Snapshot(Object data, Instant updatedAt) {
    }

    private final class ActiveStream {

        private final String id;
        private final StreamPoller poller;
        private final StreamPoller.Task task;
        private volatile ScheduledFuture<?> future;
        private volatile boolean cancelled;

        private ActiveStream(String id, StreamPoller poller, StreamPoller.Task task) {
            this.id = id;
            this.poller = poller;
            this.task = task;
        }

        private synchronized void schedule(Duration delay) {
            if (!cancelled) {
                future = scheduler.schedule(this::runCycle, delay.toMillis(), TimeUnit.MILLISECONDS);
            }
        }

        private synchronized void cancel() {
            cancelled = true;
            ScheduledFuture<?> current = future;
            if (current != null) {
                current.cancel(false);
            }
        }

        private void runCycle() {
            if (cancelled) {
                return;
            }
            Duration nextDelay = poller.getInterval();
            try {
                Optional<Object> data = task.poll();
                data.ifPresent(value -> publish(this, value));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            } catch (Exception e) { // NOSONAR - a failed cycle only delays the next one
                log.error("[Streams] Stream {} error: {}", id, e.getMessage());
                nextDelay = poller.getErrorInterval();
            }
            try {
                schedule(nextDelay);
            } catch (RejectedExecutionException e) {
                log.debug("[Streams] Scheduler stopped, stream {} ends", id);
            }
        }
    }
}
