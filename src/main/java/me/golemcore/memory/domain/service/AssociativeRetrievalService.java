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
import me.golemcore.memory.domain.model.EntityNames;
import me.golemcore.memory.domain.model.KnowledgeTriple;
import me.golemcore.memory.domain.model.ScoredTriple;
import me.golemcore.memory.domain.model.Subgraph;
import me.golemcore.memory.domain.model.SubgraphEdge;
import me.golemcore.memory.domain.model.VectorFilter;
import me.golemcore.memory.infrastructure.config.MemoryProperties;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Breadth-first expansion over the triple graph from seed entities.
 *
 * <p>
 * Each hop looks up every triple whose subject or object is a frontier entity.
 * Per frontier entity only the {@code branchingLimit} most confident unvisited
 * triples are kept. A triple first reached at hop {@code k} is reported with
 * confidence {@code confidence * decay^k}. Traversal stops after
 * {@code maxHops} or when a hop reaches no new entity.
 *
 * <p>
 * Read-only; safe to run concurrently with ingestion.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AssociativeRetrievalService {

    private final TripleStoreService tripleStoreService;
    private final MemoryProperties properties;

    public Subgraph expand(List<String> seedEntities, int maxHops, int branchingLimit, double minConfidence) {
        Set<String> seeds = new LinkedHashSet<>();
        if (seedEntities != null) {
            for (String seed : seedEntities) {
                String normalized = EntityNames.normalize(seed);
                if (!normalized.isEmpty()) {
                    seeds.add(normalized);
                }
            }
        }

        Subgraph subgraph = Subgraph.builder()
                .seeds(new ArrayList<>(seeds))
                .entities(new LinkedHashSet<>(seeds))
                .build();
        if (seeds.isEmpty() || maxHops <= 0 || branchingLimit <= 0) {
            return subgraph;
        }

        double decay = properties.getRetrieval().getHopDecay();
        Map<String, SubgraphEdge> visited = new LinkedHashMap<>();
        Set<String> frontier = seeds;
        int hop = 0;

        while (hop < maxHops && !frontier.isEmpty()) {
            hop++;
            double hopFactor = Math.pow(decay, hop);
            Set<String> nextFrontier = new LinkedHashSet<>();

            for (String entity : frontier) {
                List<KnowledgeTriple> neighbours = tripleStoreService.queryByMetadata(
                        VectorFilter.builder().entity(entity).minConfidence(minConfidence).build(),
                        Integer.MAX_VALUE);

                List<KnowledgeTriple> kept = neighbours.stream()
                        .filter(t -> !visited.containsKey(t.getId()))
                        .sorted(Comparator.comparingDouble(KnowledgeTriple::getConfidence).reversed())
                        .limit(branchingLimit)
                        .toList();

                for (KnowledgeTriple triple : kept) {
                    visited.put(triple.getId(), new SubgraphEdge(triple, hop, triple.getConfidence() * hopFactor));
                    addIfNew(triple.getSubject(), subgraph.getEntities(), nextFrontier);
                    addIfNew(EntityNames.normalize(triple.getObject()), subgraph.getEntities(), nextFrontier);
                }
            }

            log.debug("[Retriever] Hop {}: {} frontier entities -> {} new", hop, frontier.size(), nextFrontier.size());
            frontier = nextFrontier;
        }

        List<SubgraphEdge> edges = new ArrayList<>(visited.values());
        edges.sort(Comparator.comparingInt(SubgraphEdge::hop)
                .thenComparing(Comparator.comparingDouble(SubgraphEdge::decayedConfidence).reversed()));
        subgraph.setEdges(edges);
        subgraph.setHopsTraversed(hop);

        log.info("[Retriever] Expanded {} seed(s) over {} hop(s): {} triples, {} entities",
                seeds.size(), hop, edges.size(), subgraph.getEntities().size());
        return subgraph;
    }

    public Subgraph expand(List<String> seedEntities, int maxHops) {
        MemoryProperties.RetrievalProperties config = properties.getRetrieval();
        return expand(seedEntities, maxHops, config.getDefaultBranchingLimit(), config.getDefaultMinConfidence());
    }

    /**
     * Similarity query for {@code text}, then expansion from the entities of the
     * best hits.
     */
    public Subgraph recall(String text, int maxHops) {
        List<ScoredTriple> hits = tripleStoreService.query(text, properties.getRetrieval().getRecallSeedLimit());
        List<String> seeds = new ArrayList<>();
        for (ScoredTriple hit : hits) {
            seeds.add(hit.triple().getSubject());
            seeds.add(hit.triple().getObject());
        }
        return expand(seeds, maxHops);
    }

    private void addIfNew(String entity, Set<String> seen, Set<String> nextFrontier) {
        if (!entity.isEmpty() && seen.add(entity)) {
            nextFrontier.add(entity);
        }
    }
}
