package me.golemcore.memory.consolidation;

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

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.memory.domain.model.EpisodeTurnAppendedEvent;
import me.golemcore.memory.domain.service.EpisodicMemoryService;
import me.golemcore.memory.domain.service.SemanticIngestionService;
import me.golemcore.memory.infrastructure.config.MemoryProperties;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Idle-triggered consolidation of conversation turns into triples.
 *
 * <p>
 * Every appended turn lands in a per-session buffer and restarts that
 * session's debounce timer. When a session has been idle for
 * {@code memory.consolidation.idle-seconds}, its buffer is handed to a worker
 * pool which extracts and stores triples tagged with the originating episode.
 * The request path only appends to the buffer.
 *
 * <p>
 * A failed batch is logged and scheduled again after another idle window, up
 * to {@value #MAX_ATTEMPTS} attempts.
 *
 * @see EpisodicMemoryService
 * @see SemanticIngestionService
 */
@Component
@Slf4j
public class ConsolidationScheduler {

    static final int MAX_ATTEMPTS = 5;
    private static final String SOURCE_PREFIX = "conversation_";

    private final SemanticIngestionService semanticIngestionService;
    private final MemoryProperties properties;
    private final Map<String, SessionBuffer> buffers = new ConcurrentHashMap<>();

    private ScheduledExecutorService timer;
    private ExecutorService workers;

    public ConsolidationScheduler(SemanticIngestionService semanticIngestionService, MemoryProperties properties) {
        this.semanticIngestionService = semanticIngestionService;
        this.properties = properties;
    }

    @PostConstruct
    public void init() {
        MemoryProperties.ConsolidationProperties config = properties.getConsolidation();
        if (!config.isEnabled()) {
            log.info("[Consolidation] Disabled");
            return;
        }

        timer = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "memory-consolidation-timer");
            t.setDaemon(true);
            return t;
        });

        AtomicInteger workerIndex = new AtomicInteger();
        workers = Executors.newFixedThreadPool(Math.max(1, config.getWorkerThreads()), r -> {
            Thread t = new Thread(r, "memory-consolidation-worker-" + workerIndex.incrementAndGet());
            t.setDaemon(true);
            return t;
        });

        log.info("[Consolidation] Started (idle: {}s, workers: {})", config.getIdleSeconds(),
                config.getWorkerThreads());
    }

    @PreDestroy
    public void shutdown() {
        if (timer == null) {
            return;
        }
        timer.shutdownNow();

        List<String> sessions = new ArrayList<>(buffers.keySet());
        log.info("[Consolidation] Flushing {} buffered session(s)", pendingSessions());
        for (String sessionId : sessions) {
            flush(sessionId);
        }

        workers.shutdown();
        try {
            if (!workers.awaitTermination(10, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("[Consolidation] Shut down");
    }

    @EventListener
    public void onTurnAppended(EpisodeTurnAppendedEvent event) {
        if (timer == null || event.content() == null || event.content().isBlank()) {
            return;
        }

        String sessionId = event.sessionId();
        PendingBatch rolledOver = append(sessionId, event);
        if (rolledOver != null) {
            submit(sessionId, rolledOver);
        }
    }

    private PendingBatch append(String sessionId, EpisodeTurnAppendedEvent event) {
        while (true) {
            SessionBuffer buffer = buffers.computeIfAbsent(sessionId, id -> new SessionBuffer());
            synchronized (buffer) {
                if (buffer.retired) {
                    continue;
                }
                PendingBatch rolledOver = null;
                if (buffer.episodeId != null && !buffer.episodeId.equals(event.episodeId())
                        && buffer.text.length() > 0) {
                    rolledOver = buffer.drain();
                }
                buffer.episodeId = event.episodeId();
                buffer.text.append(event.role()).append(": ").append(event.content()).append('\n');
                restartTimer(sessionId, buffer);
                return rolledOver;
            }
        }
    }

    /**
     * Hand the session's buffered turns to the workers now. The session's
     * buffer is released; its next turn starts a new one.
     *
     * @return true if anything was buffered
     */
    public boolean flush(String sessionId) {
        SessionBuffer buffer = buffers.get(sessionId);
        if (buffer == null) {
            return false;
        }
        PendingBatch batch;
        synchronized (buffer) {
            if (buffer.timer != null) {
                buffer.timer.cancel(false);
                buffer.timer = null;
            }
            batch = buffer.text.length() > 0 ? buffer.drain() : null;
            buffer.retired = true;
            buffers.remove(sessionId, buffer);
        }
        if (batch == null) {
            return false;
        }
        submit(sessionId, batch);
        return true;
    }

    int pendingSessions() {
        return buffers.size();
    }

    private void restartTimer(String sessionId, SessionBuffer buffer) {
        if (buffer.timer != null) {
            buffer.timer.cancel(false);
        }
        try {
            buffer.timer = timer.schedule(() -> flush(sessionId),
                    properties.getConsolidation().getIdleSeconds(), TimeUnit.SECONDS);
        } catch (RejectedExecutionException e) {
            log.debug("[Consolidation] Timer stopped, session {} stays buffered", sessionId);
        }
    }

    private void submit(String sessionId, PendingBatch batch) {
        if (batch.text().trim().length() < properties.getConsolidation().getMinTextLength()) {
            log.debug("[Consolidation] Skipping short batch for session {}", sessionId);
            return;
        }
        try {
            workers.submit(() -> process(sessionId, batch));
        } catch (RejectedExecutionException e) {
            log.warn("[Consolidation] Workers stopped, dropped batch for session {}", sessionId);
        }
    }

    private void process(String sessionId, PendingBatch batch) {
        try {
            int stored = semanticIngestionService.extractAndStore(batch.text(), SOURCE_PREFIX + sessionId,
                    batch.episodeId());
            log.info("[Consolidation] Session {}: stored {} triple(s) from episode {}", sessionId, stored,
                    batch.episodeId());
        } catch (RuntimeException e) {
            retryLater(sessionId, batch, e);
        }
    }

    private void retryLater(String sessionId, PendingBatch batch, RuntimeException failure) {
        int attempts = batch.attempts() + 1;
        if (attempts >= MAX_ATTEMPTS) {
            log.error("[Consolidation] Giving up on batch for session {} after {} attempts: {}", sessionId,
                    attempts, failure.getMessage());
            return;
        }
        log.warn("[Consolidation] Batch for session {} failed (attempt {}), retrying after idle window: {}",
                sessionId, attempts, failure.getMessage());
        PendingBatch retry = new PendingBatch(batch.episodeId(), batch.text(), attempts);
        try {
            timer.schedule(() -> submit(sessionId, retry), properties.getConsolidation().getIdleSeconds(),
                    TimeUnit.SECONDS);
        } catch (RejectedExecutionException e) {
            log.warn("[Consolidation] Timer stopped, dropped retry for session {}", sessionId);
        }
    }

    private static final class SessionBuffer {
        private final StringBuilder text = new StringBuilder();
        private String episodeId;
        private ScheduledFuture<?> timer;
        private boolean retired;

        private PendingBatch drain() {
            PendingBatch batch = new PendingBatch(episodeId, text.toString(), 0);
            text.setLength(0);
            return batch;
        }
    }

    private record PendingBatch(String episodeId, String text, int attempts) {
    }
}
