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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.memory.domain.exception.TripleStorageException;
import me.golemcore.memory.domain.exception.VectorIndexUnavailableException;
import me.golemcore.memory.domain.model.EntityNames;
import me.golemcore.memory.domain.model.KnowledgeTriple;
import me.golemcore.memory.domain.model.ScoredTriple;
import me.golemcore.memory.domain.model.TripleCandidate;
import me.golemcore.memory.domain.model.TriplePredicate;
import me.golemcore.memory.domain.model.VectorFilter;
import me.golemcore.memory.domain.model.VectorHit;
import me.golemcore.memory.domain.model.VectorRecord;
import me.golemcore.memory.infrastructure.config.MemoryProperties;
import me.golemcore.memory.port.outbound.EmbeddingPort;
import me.golemcore.memory.port.outbound.VectorIndexPort;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletionException;

/**
 * Stores subject/predicate/object facts in the vector index and serves
 * similarity and metadata queries over them.
 *
 * <p>
 * Identity is a fingerprint of the normalized triple plus its source. A
 * re-observed triple is merged into the stored one: confidence becomes the
 * maximum of the time-decayed stored value and the new value, topics are
 * unioned and the earliest creation time is kept. Other metadata is
 * last-writer-wins.
 *
 * <p>
 * Failures never escape from {@link #ingest} and the queries: a candidate that
 * cannot be embedded or written is skipped, and a query that cannot reach the
 * index returns an empty list. {@link #ingestAll} reports write failures to
 * callers that retry.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TripleStoreService {

    private static final int QUERY_OVERSAMPLE = 3;

    private final VectorIndexPort vectorIndexPort;
    private final EmbeddingPort embeddingPort;
    private final MemoryProperties properties;
    private final Clock clock;

    /**
     * Ingest candidates, merging with stored triples of the same identity.
     *
     * @return number of candidates stored or merged
     */
    public int ingest(List<TripleCandidate> candidates) {
        if (candidates == null || candidates.isEmpty()) {
            return 0;
        }
        int stored = 0;
        for (TripleCandidate candidate : candidates) {
            if (store(candidate).isPresent()) {
                stored++;
            }
        }
        log.info("[TripleStore] Ingested {}/{} triple(s)", stored, candidates.size());
        return stored;
    }

    /**
     * Like {@link #ingest}, but a candidate that could not be embedded or written
     * fails the call once every candidate has been tried. Incomplete candidates
     * are still skipped silently.
     *
     * @return number of candidates stored or merged
     * @throws TripleStorageException
     *             if at least one complete candidate could not be stored
     */
    public int ingestAll(List<TripleCandidate> candidates) {
        if (candidates == null || candidates.isEmpty()) {
            return 0;
        }
        int stored = 0;
        int failed = 0;
        RuntimeException lastFailure = null;
        for (TripleCandidate candidate : candidates) {
            if (!isComplete(candidate)) {
                log.debug("[TripleStore] Skipping incomplete candidate: {}", candidate);
                continue;
            }
            try {
                write(candidate);
                stored++;
            } catch (RuntimeException e) {
                failed++;
                lastFailure = e;
            }
        }
        if (lastFailure != null) {
            throw new TripleStorageException(failed + " of " + candidates.size()
                    + " triple(s) could not be stored: " + rootMessage(lastFailure), unwrap(lastFailure));
        }
        log.info("[TripleStore] Ingested {}/{} triple(s)", stored, candidates.size());
        return stored;
    }

    /**
     * Ingest a single candidate.
     *
     * @return the stored triple after merge, or empty when the candidate was
     *         skipped
     */
    public Optional<KnowledgeTriple> store(TripleCandidate candidate) {
        if (!isComplete(candidate)) {
            log.debug("[TripleStore] Skipping incomplete candidate: {}", candidate);
            return Optional.empty();
        }

        try {
            return Optional.of(write(candidate));
        } catch (RuntimeException e) {
            log.warn("[TripleStore] Failed to store triple ({}, {}): {}", candidate.getSubject(),
                    candidate.getPredicate(), rootMessage(e));
            return Optional.empty();
        }
    }

    private KnowledgeTriple write(TripleCandidate candidate) {
        KnowledgeTriple incoming = normalize(candidate);
        Optional<VectorRecord> existing = vectorIndexPort.get(incoming.getId()).join();

        KnowledgeTriple toStore;
        float[] vector;
        if (existing.isPresent()) {
            toStore = merge(existing.get().payload(), incoming);
            vector = existing.get().vector();
            if (vector == null) {
                vector = embeddingPort.embed(toText(toStore)).join();
            }
        } else {
            toStore = incoming;
            vector = embeddingPort.embed(toText(toStore)).join();
        }

        vectorIndexPort.upsert(toStore.getId(), vector, toStore).join();
        log.debug("[TripleStore] {} triple {}: ({}, {}, {})", existing.isPresent() ? "Merged" : "Stored",
                toStore.getId(), toStore.getSubject(), toStore.getPredicate(), abbreviate(toStore.getObject()));
        return toStore;
    }

    /**
     * Replace the metadata of an already stored triple, keeping its identity and
     * embedding. Used for state held in the payload (goal status).
     *
     * @return true if the triple was written
     */
    public boolean replace(KnowledgeTriple triple) {
        try {
            Optional<VectorRecord> existing = vectorIndexPort.get(triple.getId()).join();
            float[] vector = existing.map(VectorRecord::vector).orElse(null);
            if (vector == null) {
                vector = embeddingPort.embed(toText(triple)).join();
            }
            triple.setUpdatedAt(clock.instant());
            vectorIndexPort.upsert(triple.getId(), vector, triple).join();
            return true;
        } catch (RuntimeException e) {
            log.warn("[TripleStore] Failed to replace triple {}: {}", triple.getId(), rootMessage(e));
            return false;
        }
    }

    /**
     * Similarity query. Raw similarity is blended with the predicate weight and
     * the stored confidence: {@code similarity * weight * (0.5 + 0.5 * confidence)}.
     */
    public List<ScoredTriple> query(String text, int limit, VectorFilter filter) {
        if (isBlank(text) || limit <= 0) {
            return List.of();
        }

        float[] vector;
        try {
            vector = embeddingPort.embed(text).join();
        } catch (RuntimeException e) {
            log.warn("[TripleStore] Query embedding failed, returning no results: {}", rootMessage(e));
            return List.of();
        }

        List<VectorHit> hits;
        try {
            int candidates = (int) Math.min(Integer.MAX_VALUE, (long) limit * QUERY_OVERSAMPLE);
            hits = vectorIndexPort.search(vector, filter, candidates).join();
        } catch (RuntimeException e) {
            logIndexFailure("Similarity search", e);
            return List.of();
        }

        List<ScoredTriple> ranked = hits.stream()
                .map(hit -> new ScoredTriple(hit.payload(), score(hit)))
                .sorted(Comparator.comparingDouble(ScoredTriple::score).reversed())
                .limit(limit)
                .toList();
        log.debug("[TripleStore] Query '{}' returned {} of {} hit(s)", abbreviate(text), ranked.size(), hits.size());
        return ranked;
    }

    public List<ScoredTriple> query(String text, int limit) {
        return query(text, limit, VectorFilter.none());
    }

    /**
     * Metadata-only read, newest first.
     */
    public List<KnowledgeTriple> queryByMetadata(VectorFilter filter, int limit) {
        try {
            return vectorIndexPort.scroll(filter, limit).join();
        } catch (RuntimeException e) {
            logIndexFailure("Metadata query", e);
            return List.of();
        }
    }

    public List<KnowledgeTriple> queryByTimeRange(Instant start, Instant end, int limit) {
        return queryByMetadata(VectorFilter.builder().createdFrom(start).createdTo(end).build(), limit);
    }

    public List<KnowledgeTriple> queryRecent(int hours, int limit) {
        Instant now = clock.instant();
        return queryByTimeRange(now.minus(Duration.ofHours(hours)), now, limit);
    }

    public List<KnowledgeTriple> queryByEpisode(String episodeId, int limit) {
        if (isBlank(episodeId)) {
            return List.of();
        }
        return queryByMetadata(VectorFilter.builder().episodeId(episodeId).build(), limit);
    }

    public Optional<KnowledgeTriple> getTriple(String id) {
        try {
            return vectorIndexPort.get(id).join().map(VectorRecord::payload);
        } catch (RuntimeException e) {
            logIndexFailure("Lookup", e);
            return Optional.empty();
        }
    }

    /**
     * Identity of a triple: fingerprint of the normalized subject, predicate and
     * object combined with the source.
     */
    public static String computeId(String subject, String predicate, String object, String source) {
        String key = EntityNames.normalize(subject)
                + "|" + TriplePredicate.of(predicate).name()
                + "|" + EntityNames.normalize(object)
                + "|" + (source != null ? source : "");
        return computeFingerprint(key);
    }

    /**
     * Text embedded for a triple.
     */
    public static String toText(KnowledgeTriple triple) {
        return triple.getSubject() + " " + triple.getPredicate().replace('_', ' ') + " " + triple.getObject();
    }

    private KnowledgeTriple normalize(TripleCandidate candidate) {
        Instant now = clock.instant();
        TriplePredicate predicate = TriplePredicate.of(candidate.getPredicate());
        String subject = EntityNames.normalize(candidate.getSubject());

        Set<String> topics = new LinkedHashSet<>();
        if (candidate.getTopics() != null) {
            for (String topic : candidate.getTopics()) {
                if (!isBlank(topic)) {
                    topics.add(topic.trim());
                }
            }
        }
        if (predicate.isProcedural()) {
            topics.add(TriplePredicate.PROCEDURE_TOPIC);
        }

        double confidence = candidate.getConfidence() != null
                ? candidate.getConfidence()
                : properties.getTriples().getDefaultConfidence();

        return KnowledgeTriple.builder()
                .id(computeId(subject, predicate.name(), candidate.getObject(), candidate.getSource()))
                .subject(subject)
                .predicate(predicate.name())
                .object(candidate.getObject())
                .confidence(clamp(confidence))
                .createdAt(now)
                .updatedAt(now)
                .topics(new ArrayList<>(topics))
                .source(candidate.getSource())
                .episodeId(candidate.getEpisodeId())
                .abstractionLevel(candidate.getAbstractionLevel())
                .goal(candidate.getGoal())
                .build();
    }

    private KnowledgeTriple merge(KnowledgeTriple existing, KnowledgeTriple incoming) {
        KnowledgeTriple merged = existing.toBuilder().build();
        double decayed = decay(existing.getConfidence(), existing.getUpdatedAt(), incoming.getUpdatedAt());
        merged.setConfidence(Math.max(decayed, incoming.getConfidence()));

        Set<String> topics = new LinkedHashSet<>();
        if (existing.getTopics() != null) {
            topics.addAll(existing.getTopics());
        }
        topics.addAll(incoming.getTopics());
        merged.setTopics(new ArrayList<>(topics));

        if (existing.getCreatedAt() == null || (incoming.getCreatedAt() != null
                && incoming.getCreatedAt().isBefore(existing.getCreatedAt()))) {
            merged.setCreatedAt(incoming.getCreatedAt());
        }
        merged.setUpdatedAt(incoming.getUpdatedAt());
        merged.setObject(incoming.getObject());
        if (incoming.getEpisodeId() != null) {
            merged.setEpisodeId(incoming.getEpisodeId());
        }
        if (incoming.getAbstractionLevel() != null) {
            merged.setAbstractionLevel(incoming.getAbstractionLevel());
        }
        if (incoming.getGoal() != null) {
            merged.setGoal(incoming.getGoal());
        }
        return merged;
    }

    double decay(double confidence, Instant since, Instant now) {
        if (since == null || now == null || !now.isAfter(since)) {
            return confidence;
        }
        double halfLifeDays = properties.getTriples().getDecayHalfLifeDays();
        if (halfLifeDays <= 0) {
            return confidence;
        }
        double elapsedDays = Duration.between(since, now).toMillis() / (double) Duration.ofDays(1).toMillis();
        return confidence * Math.pow(0.5, elapsedDays / halfLifeDays);
    }

    private double score(VectorHit hit) {
        KnowledgeTriple triple = hit.payload();
        double weight = TriplePredicate.of(triple.getPredicate()).weight();
        return hit.score() * weight * (0.5 + 0.5 * triple.getConfidence());
    }

    private void logIndexFailure(String operation, RuntimeException e) {
        Throwable cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
        if (cause instanceof VectorIndexUnavailableException) {
            log.warn("[TripleStore] {} skipped, vector index unavailable", operation);
        } else {
            log.warn("[TripleStore] {} failed: {}", operation, cause.getMessage());
        }
    }

    private static String computeFingerprint(String content) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(content.getBytes(StandardCharsets.UTF_8));
            StringBuilder sb = new StringBuilder();
            for (int i = 0; i < 12 && i < hash.length; i++) {
                sb.append(String.format("%02x", hash[i]));
            }
            return sb.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }

    private static Throwable unwrap(RuntimeException e) {
        return e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
    }

    private static String rootMessage(RuntimeException e) {
        return unwrap(e).getMessage();
    }

    private static String abbreviate(String text) {
        if (text == null) {
            return "";
        }
        return text.length() <= 60 ? text : text.substring(0, 57) + "...";
    }

    private static boolean isComplete(TripleCandidate candidate) {
        return candidate != null && !isBlank(candidate.getSubject()) && !isBlank(candidate.getPredicate())
                && !isBlank(candidate.getObject());
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
