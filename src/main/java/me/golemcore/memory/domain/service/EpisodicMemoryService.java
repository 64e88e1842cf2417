package me.golemcore.memory.domain.service;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.memory.domain.model.Episode;
import me.golemcore.memory.domain.model.EpisodeTurnAppendedEvent;
import me.golemcore.memory.domain.model.KnowledgeTriple;
import me.golemcore.memory.domain.model.MessageTurn;
import me.golemcore.memory.infrastructure.config.MemoryProperties;
import me.golemcore.memory.infrastructure.event.SpringEventBus;
import me.golemcore.memory.port.outbound.StoragePort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Session-scoped conversation episodes.
 *
 * <p>
 * Each session has at most one open episode. Appending the first turn of a
 * session opens one; reaching {@code memory.episodes.finalize-threshold} turns
 * finalizes it with an automatic summary, and the next turn opens a fresh
 * episode. Appends are serialized per session and independent across sessions.
 *
 * <p>
 * Episodes are cached in memory and persisted as {@code episodes/<id>.json}.
 * Every read and every lookup by episode id is scoped to a session: an episode
 * of one session is never returned or changed through another. Reads return
 * copies taken under the session lock.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EpisodicMemoryService {

    private static final String EPISODES_DIR = "episodes";
    private static final String JSON_EXTENSION = ".json";
    private static final int SUMMARY_PREVIEW_CHARS = 100;
    private static final Comparator<Episode> NEWEST_FIRST = Comparator.comparing(Episode::getCreatedAt,
            Comparator.nullsLast(Comparator.<Instant>reverseOrder()));

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final MemoryProperties properties;
    private final TripleStoreService tripleStoreService;
    private final SpringEventBus eventBus;
    private final Clock clock;

    private final Map<String, Episode> episodeCache = new ConcurrentHashMap<>();
    private final Map<String, String> openEpisodeBySession = new ConcurrentHashMap<>();
    private final Map<String, Object> sessionLocks = new ConcurrentHashMap<>();

    @PostConstruct
    public void loadEpisodes() {
        try {
            List<String> files = storagePort.listObjects(EPISODES_DIR, "").join();
            int loaded = 0;
            for (String file : files) {
                if (!file.endsWith(JSON_EXTENSION)) {
                    continue;
                }
                Optional<Episode> episode = load(file);
                if (episode.isPresent()) {
                    register(episode.get());
                    loaded++;
                }
            }
            log.info("[Episodes] Loaded {} episode(s), {} open", loaded, openEpisodeBySession.size());
        } catch (RuntimeException e) {
            log.warn("[Episodes] Failed to load episodes at startup: {}", e.getMessage());
        }
    }

    /**
     * Start a new open episode for the session. A previously open episode of the
     * same session is finalized first.
     */
    public Episode createEpisode(String sessionId) {
        requireSession(sessionId);
        synchronized (lockFor(sessionId)) {
            Episode current = currentOpen(sessionId);
            if (current != null) {
                finalizeLocked(current, List.of(), autoSummary(current));
            }
            return copyOf(openNew(sessionId));
        }
    }

    /**
     * Append a turn to the session's open episode, opening one if needed.
     *
     * @return id of the episode the turn was appended to
     */
    public String addMessageToEpisode(String sessionId, String role, String content) {
        requireSession(sessionId);
        Episode episode;
        MessageTurn turn;
        synchronized (lockFor(sessionId)) {
            episode = currentOpen(sessionId);
            if (episode == null) {
                episode = openNew(sessionId);
            }

            Instant now = clock.instant();
            turn = MessageTurn.builder()
                    .role(role)
                    .content(content != null ? content : "")
                    .timestamp(now)
                    .build();
            episode.getTurns().add(turn);
            episode.setUpdatedAt(now);

            int threshold = properties.getEpisodes().getFinalizeThreshold();
            if (threshold > 0 && episode.getTurns().size() >= threshold) {
                log.info("[Episodes] Episode {} reached {} turns, finalizing", episode.getId(), threshold);
                finalizeLocked(episode, List.of(), autoSummary(episode));
            } else {
                save(episode);
            }
        }

        eventBus.publish(new EpisodeTurnAppendedEvent(sessionId, episode.getId(), turn.getRole(),
                turn.getContent(), turn.getTimestamp()));
        return episode.getId();
    }

    /**
     * Finalize an episode with the given topics and summary. A blank summary is
     * replaced by the automatic one.
     *
     * @return false if the session has no such episode or it is already finalized
     */
    public boolean finalizeEpisode(String sessionId, String episodeId, List<String> topics, String summary) {
        Episode episode = ownedBy(sessionId, episodeId);
        if (episode == null) {
            log.debug("[Episodes] Finalize requested for unknown episode {} in session {}", episodeId, sessionId);
            return false;
        }
        synchronized (lockFor(sessionId)) {
            if (episode.isFinalized()) {
                return false;
            }
            String effectiveSummary = summary != null && !summary.isBlank() ? summary : autoSummary(episode);
            finalizeLocked(episode, topics != null ? topics : List.of(), effectiveSummary);
            return true;
        }
    }

    public Optional<Episode> getEpisode(String sessionId, String episodeId) {
        Episode episode = ownedBy(sessionId, episodeId);
        if (episode == null) {
            return Optional.empty();
        }
        synchronized (lockFor(sessionId)) {
            return Optional.of(copyOf(episode));
        }
    }

    public Optional<Episode> getOpenEpisode(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            return Optional.empty();
        }
        synchronized (lockFor(sessionId)) {
            return Optional.ofNullable(currentOpen(sessionId)).map(this::copyOf);
        }
    }

    public List<Episode> queryEpisodesBySession(String sessionId, int limit) {
        return sessionEpisodes(sessionId).stream()
                .sorted(NEWEST_FIRST)
                .limit(Math.max(0, limit))
                .toList();
    }

    /**
     * Session episodes created within {@code [start, end]}, newest first.
     */
    public List<Episode> queryEpisodesByTime(String sessionId, Instant start, Instant end) {
        return sessionEpisodes(sessionId).stream()
                .filter(e -> e.getCreatedAt() != null)
                .filter(e -> start == null || !e.getCreatedAt().isBefore(start))
                .filter(e -> end == null || !e.getCreatedAt().isAfter(end))
                .sorted(NEWEST_FIRST)
                .toList();
    }

    /**
     * Session episodes active within the last {@code hours}, newest first.
     */
    public List<Episode> getRecentEpisodes(String sessionId, int hours, int limit) {
        Instant cutoff = clock.instant().minus(Duration.ofHours(hours));
        return sessionEpisodes(sessionId).stream()
                .filter(e -> lastActivity(e) != null && !lastActivity(e).isBefore(cutoff))
                .sorted(NEWEST_FIRST)
                .limit(Math.max(0, limit))
                .toList();
    }

    /**
     * Case-insensitive substring search over the turns and summary of the
     * session's episodes, newest first.
     */
    public List<Episode> searchEpisodes(String sessionId, String query, int limit) {
        if (query == null || query.isBlank()) {
            return List.of();
        }
        String needle = query.toLowerCase(Locale.ROOT);
        List<Episode> matches = new ArrayList<>();
        for (Episode episode : sessionEpisodes(sessionId)) {
            if (contains(episode, needle)) {
                matches.add(episode);
            }
        }
        return matches.stream()
                .sorted(NEWEST_FIRST)
                .limit(Math.max(0, limit))
                .toList();
    }

    /**
     * Last {@code maxTurns} turns of one of the session's episodes in
     * conversation order.
     */
    public List<MessageTurn> getConversationContext(String sessionId, String episodeId, int maxTurns) {
        Episode episode = ownedBy(sessionId, episodeId);
        if (episode == null || maxTurns <= 0) {
            return List.of();
        }
        synchronized (lockFor(sessionId)) {
            List<MessageTurn> turns = episode.getTurns();
            int from = Math.max(0, turns.size() - maxTurns);
            return turns.subList(from, turns.size()).stream()
                    .map(turn -> turn.toBuilder().build())
                    .toList();
        }
    }

    /**
     * Session episodes from the last {@code days} days grouped by local creation
     * date, newest date first.
     */
    public Map<LocalDate, List<Episode>> timeline(String sessionId, int days) {
        Instant cutoff = clock.instant().minus(Duration.ofDays(days));
        Map<LocalDate, List<Episode>> grouped = new LinkedHashMap<>();
        queryEpisodesByTime(sessionId, cutoff, null)
                .forEach(e -> grouped.computeIfAbsent(LocalDate.ofInstant(e.getCreatedAt(), clock.getZone()),
                        d -> new ArrayList<>()).add(e));
        return grouped;
    }

    /**
     * Facts extracted from the conversation held in one of the session's
     * episodes.
     */
    public List<KnowledgeTriple> getEpisodeFacts(String sessionId, String episodeId, int limit) {
        if (ownedBy(sessionId, episodeId) == null) {
            return List.of();
        }
        return tripleStoreService.queryByEpisode(episodeId, limit);
    }

    private Episode openNew(String sessionId) {
        Instant now = clock.instant();
        Episode episode = Episode.builder()
                .id(UUID.randomUUID().toString())
                .sessionId(sessionId)
                .createdAt(now)
                .updatedAt(now)
                .build();
        register(episode);
        save(episode);
        log.info("[Episodes] Opened episode {} for session {}", episode.getId(), sessionId);
        return episode;
    }

    private void finalizeLocked(Episode episode, List<String> topics, String summary) {
        Instant now = clock.instant();
        episode.setFinalized(true);
        episode.setFinalizedAt(now);
        episode.setUpdatedAt(now);
        episode.setSummary(summary);
        if (!topics.isEmpty()) {
            episode.setTopics(new ArrayList<>(topics));
        }
        openEpisodeBySession.remove(episode.getSessionId(), episode.getId());
        save(episode);
        log.info("[Episodes] Finalized episode {} ({} turns)", episode.getId(), episode.getTurns().size());
    }

    private String autoSummary(Episode episode) {
        List<MessageTurn> turns = episode.getTurns();
        String first = turns.isEmpty() || turns.get(0).getContent() == null ? "" : turns.get(0).getContent();
        if (first.length() > SUMMARY_PREVIEW_CHARS) {
            first = first.substring(0, SUMMARY_PREVIEW_CHARS);
        }
        return "Conversation with " + turns.size() + " messages. Started with: " + first;
    }

    private Episode currentOpen(String sessionId) {
        String episodeId = openEpisodeBySession.get(sessionId);
        return episodeId != null ? episodeCache.get(episodeId) : null;
    }

    private void register(Episode episode) {
        episodeCache.put(episode.getId(), episode);
        if (!episode.isFinalized()) {
            openEpisodeBySession.merge(episode.getSessionId(), episode.getId(), (current, candidate) -> {
                Episode existing = episodeCache.get(current);
                return existing != null && existing.getCreatedAt() != null && episode.getCreatedAt() != null
                        && existing.getCreatedAt().isAfter(episode.getCreatedAt()) ? current : candidate;
            });
        }
    }

    private Episode ownedBy(String sessionId, String episodeId) {
        if (sessionId == null || sessionId.isBlank() || episodeId == null) {
            return null;
        }
        Episode episode = episodeCache.get(episodeId);
        return episode != null && sessionId.equals(episode.getSessionId()) ? episode : null;
    }

    private Collection<Episode> sessionEpisodes(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            return List.of();
        }
        synchronized (lockFor(sessionId)) {
            return episodeCache.values().stream()
                    .filter(e -> sessionId.equals(e.getSessionId()))
                    .map(this::copyOf)
                    .toList();
        }
    }

    private Episode copyOf(Episode episode) {
        return objectMapper.convertValue(episode, Episode.class);
    }

    private boolean contains(Episode episode, String needle) {
        if (episode.getSummary() != null && episode.getSummary().toLowerCase(Locale.ROOT).contains(needle)) {
            return true;
        }
        for (MessageTurn turn : episode.getTurns()) {
            if (turn.getContent() != null && turn.getContent().toLowerCase(Locale.ROOT).contains(needle)) {
                return true;
            }
        }
        return false;
    }

    private Instant lastActivity(Episode episode) {
        return episode.getUpdatedAt() != null ? episode.getUpdatedAt() : episode.getCreatedAt();
    }

    private Object lockFor(String sessionId) {
        return sessionLocks.computeIfAbsent(sessionId != null ? sessionId : "", id -> new Object());
    }

    private void requireSession(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("Session id must not be blank");
        }
    }

    private void save(Episode episode) {
        try {
            String json = objectMapper.writeValueAsString(episode);
            storagePort.putTextAtomic(EPISODES_DIR, episode.getId() + JSON_EXTENSION, json, false).join();
            log.debug("[Episodes] Saved episode {}", episode.getId());
        } catch (JsonProcessingException | RuntimeException e) {
            log.warn("[Episodes] Failed to save episode {}: {}", episode.getId(), e.getMessage());
        }
    }

    private Optional<Episode> load(String file) {
        try {
            String json = storagePort.getText(EPISODES_DIR, file).join();
            if (json == null || json.isBlank()) {
                return Optional.empty();
            }
            Episode episode = objectMapper.readValue(json, Episode.class);
            if (episode.getTurns() == null) {
                episode.setTurns(new ArrayList<>());
            }
            return Optional.of(episode);
        } catch (JsonProcessingException | RuntimeException e) {
            log.warn("[Episodes] Skipping unreadable episode file {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }
}
