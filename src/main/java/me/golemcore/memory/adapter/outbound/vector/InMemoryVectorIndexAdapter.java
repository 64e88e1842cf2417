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

package me.golemcore.memory.adapter.outbound.vector;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.memory.domain.exception.VectorIndexUnavailableException;
import me.golemcore.memory.domain.model.KnowledgeTriple;
import me.golemcore.memory.domain.model.VectorFilter;
import me.golemcore.memory.domain.model.VectorHit;
import me.golemcore.memory.domain.model.VectorRecord;
import me.golemcore.memory.port.outbound.EmbeddingPort;
import me.golemcore.memory.port.outbound.StoragePort;
import me.golemcore.memory.port.outbound.VectorIndexPort;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local vector index with brute-force cosine search.
 *
 * <p>
 * Entries live in a {@link ConcurrentHashMap}. Durability goes through
 * {@link StoragePort}:
 * <ul>
 * <li>{@code vectors/snapshot.jsonl} - full index, rewritten atomically on
 * {@link #close()}</li>
 * <li>{@code vectors/journal.jsonl} - upserts and deletes appended since the
 * last snapshot, replayed on {@link #open()}</li>
 * </ul>
 *
 * <p>
 * Linear scan is fine for the target of thousands to low millions of triples
 * on one host.
 *
 * <p>
 * Payloads are copied on the way in and on the way out, so a caller editing a
 * returned triple never changes the indexed one behind the journal's back.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class InMemoryVectorIndexAdapter implements VectorIndexPort {

    static final String VECTORS_DIR = "vectors";
    static final String SNAPSHOT_FILE = "snapshot.jsonl";
    static final String JOURNAL_FILE = "journal.jsonl";

    private static final String OP_UPSERT = "upsert";
    private static final String OP_DELETE = "delete";

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;

    private final Map<String, VectorRecord> records = new ConcurrentHashMap<>();
    private final Object journalLock = new Object();
    private volatile boolean open = false;

    @PostConstruct
    @Override
    public synchronized void open() {
        if (open) {
            return;
        }
        records.clear();
        int loaded = replay(SNAPSHOT_FILE);
        int replayed = replay(JOURNAL_FILE);
        open = true;
        log.info("[VectorIndex] Opened with {} entries ({} snapshot lines, {} journal lines)",
                records.size(), loaded, replayed);
    }

    @PreDestroy
    @Override
    public synchronized void close() {
        if (!open) {
            return;
        }
        open = false;
        try {
            synchronized (journalLock) {
                StringBuilder snapshot = new StringBuilder();
                for (VectorRecord record : records.values()) {
                    snapshot.append(toLine(new JournalEntry(OP_UPSERT, record.id(), record.vector(),
                            record.payload()))).append("\n");
                }
                storagePort.putTextAtomic(VECTORS_DIR, SNAPSHOT_FILE, snapshot.toString(), true).join();
                storagePort.deleteObject(VECTORS_DIR, JOURNAL_FILE).join();
            }
            log.info("[VectorIndex] Closed, snapshot written with {} entries", records.size());
        } catch (RuntimeException e) {
            log.warn("[VectorIndex] Failed to write snapshot on close, journal kept: {}", e.getMessage());
        }
    }

    @Override
    public boolean isAvailable() {
        return open;
    }

    @Override
    public CompletableFuture<Void> upsert(String id, float[] vector, KnowledgeTriple payload) {
        return CompletableFuture.runAsync(() -> {
            requireOpen();
            VectorRecord record = new VectorRecord(id, vector, copyOf(payload));
            synchronized (journalLock) {
                appendJournal(new JournalEntry(OP_UPSERT, id, vector, payload));
                records.put(id, record);
            }
            log.debug("[VectorIndex] Upserted {}", id);
        });
    }

    @Override
    public CompletableFuture<List<VectorHit>> search(float[] vector, VectorFilter filter, int limit) {
        return CompletableFuture.supplyAsync(() -> {
            requireOpen();
            VectorFilter effective = filter != null ? filter : VectorFilter.none();
            List<VectorHit> hits = new ArrayList<>();
            for (VectorRecord record : records.values()) {
                if (record.vector() == null || record.vector().length != vector.length) {
                    continue;
                }
                if (!effective.matches(record.payload())) {
                    continue;
                }
                double score = EmbeddingPort.cosineSimilarity(vector, record.vector());
                hits.add(new VectorHit(record.id(), score, record.payload()));
            }
            List<VectorHit> result = hits.stream()
                    .sorted(Comparator.comparingDouble(VectorHit::score).reversed())
                    .limit(Math.max(0, limit))
                    .map(hit -> new VectorHit(hit.id(), hit.score(), copyOf(hit.payload())))
                    .toList();
            log.debug("[VectorIndex] Search returned {} of {} matching entries", result.size(), hits.size());
            return result;
        });
    }

    @Override
    public CompletableFuture<List<KnowledgeTriple>> scroll(VectorFilter filter, int limit) {
        return CompletableFuture.supplyAsync(() -> {
            requireOpen();
            VectorFilter effective = filter != null ? filter : VectorFilter.none();
            return records.values().stream()
                    .map(VectorRecord::payload)
                    .filter(effective::matches)
                    .sorted(Comparator.comparing(KnowledgeTriple::getCreatedAt,
                            Comparator.nullsLast(Comparator.<Instant>reverseOrder())))
                    .limit(Math.max(0, limit))
                    .map(this::copyOf)
                    .toList();
        });
    }

    @Override
    public CompletableFuture<Optional<VectorRecord>> get(String id) {
        return CompletableFuture.supplyAsync(() -> {
            requireOpen();
            return Optional.ofNullable(records.get(id))
                    .map(record -> new VectorRecord(record.id(), record.vector(), copyOf(record.payload())));
        });
    }

    @Override
    public CompletableFuture<Void> delete(String id) {
        return CompletableFuture.runAsync(() -> {
            requireOpen();
            synchronized (journalLock) {
                if (records.remove(id) != null) {
                    appendJournal(new JournalEntry(OP_DELETE, id, null, null));
                }
            }
        });
    }

    private void requireOpen() {
        if (!open) {
            throw new VectorIndexUnavailableException("Vector index is not open");
        }
    }

    private int replay(String file) {
        String content;
        try {
            content = storagePort.getText(VECTORS_DIR, file).join();
        } catch (RuntimeException e) {
            log.warn("[VectorIndex] Failed to read {}: {}", file, e.getMessage());
            return 0;
        }
        if (content == null || content.isBlank()) {
            return 0;
        }

        int lines = 0;
        for (String line : content.split("\\R")) {
            if (line.isBlank()) {
                continue;
            }
            try {
                JournalEntry entry = objectMapper.readValue(line, JournalEntry.class);
                if (OP_DELETE.equals(entry.op())) {
                    records.remove(entry.id());
                } else if (entry.id() != null && entry.payload() != null) {
                    records.put(entry.id(), new VectorRecord(entry.id(), entry.vector(), entry.payload()));
                }
                lines++;
            } catch (JsonProcessingException e) {
                log.warn("[VectorIndex] Skipping unreadable line in {}: {}", file, e.getOriginalMessage());
            }
        }
        return lines;
    }

    private KnowledgeTriple copyOf(KnowledgeTriple triple) {
        return triple != null ? objectMapper.convertValue(triple, KnowledgeTriple.class) : null;
    }

    private void appendJournal(JournalEntry entry) {
        storagePort.appendText(VECTORS_DIR, JOURNAL_FILE, toLine(entry) + "\n").join();
    }

    private String toLine(JournalEntry entry) {
        try {
            return objectMapper.writeValueAsString(entry);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize index entry " + entry.id(), e);
        }
    }

    record JournalEntry(String op, String id, float[] vector, KnowledgeTriple payload) {
    }
}
