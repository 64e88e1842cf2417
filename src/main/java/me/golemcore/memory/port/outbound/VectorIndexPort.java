package me.golemcore.memory.port.outbound;

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

import me.golemcore.memory.domain.model.KnowledgeTriple;
import me.golemcore.memory.domain.model.VectorFilter;
import me.golemcore.memory.domain.model.VectorHit;
import me.golemcore.memory.domain.model.VectorRecord;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Port for the nearest-neighbor index that holds every triple. Triples are
 * keyed by their content id and stored with their full metadata as payload, so
 * metadata-only reads ({@link #scroll}) need no embedding.
 *
 * <p>
 * The index has an explicit lifecycle: {@link #open()} before first use,
 * {@link #close()} at shutdown. Calls outside that window complete
 * exceptionally with
 * {@link me.golemcore.memory.domain.exception.VectorIndexUnavailableException}.
 */
public interface VectorIndexPort {

    void open();

    void close();

    boolean isAvailable();

    /**
     * Insert or replace the entry stored under {@code id}.
     */
    CompletableFuture<Void> upsert(String id, float[] vector, KnowledgeTriple payload);

    /**
     * Rank entries matching {@code filter} by cosine similarity to
     * {@code vector}, highest first.
     */
    CompletableFuture<List<VectorHit>> search(float[] vector, VectorFilter filter, int limit);

    /**
     * Entries matching {@code filter}, newest first, without similarity ranking.
     */
    CompletableFuture<List<KnowledgeTriple>> scroll(VectorFilter filter, int limit);

    CompletableFuture<Optional<VectorRecord>> get(String id);

    CompletableFuture<Void> delete(String id);
}
