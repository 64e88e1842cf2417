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
import me.golemcore.memory.domain.exception.TripleExtractionException;
import me.golemcore.memory.domain.exception.TripleStorageException;
import me.golemcore.memory.domain.model.ExtractedTriple;
import me.golemcore.memory.domain.model.TripleCandidate;
import me.golemcore.memory.port.outbound.TripleExtractionPort;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletionException;

/**
 * Turns free text into stored triples: extraction, candidate cleanup, then
 * ingestion into the triple store.
 *
 * <p>
 * Candidates missing a subject, predicate or object are dropped individually;
 * the rest are still stored.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SemanticIngestionService {

    static final String DEFAULT_SOURCE = "user_input";

    private final TripleExtractionPort tripleExtractionPort;
    private final TripleStoreService tripleStoreService;

    /**
     * Extract and store triples from {@code text}. Extraction failures are
     * logged and count as nothing stored; candidates that cannot be written are
     * skipped.
     *
     * @return number of triples stored
     */
    public int ingestText(String text, String source, String episodeId) {
        List<TripleCandidate> candidates;
        try {
            candidates = extractCandidates(text, source, episodeId);
        } catch (TripleExtractionException e) {
            log.warn("[Ingest] {}, nothing stored", e.getMessage());
            return 0;
        }
        if (candidates.isEmpty()) {
            return 0;
        }
        int stored = tripleStoreService.ingest(candidates);
        log.info("[Ingest] Stored {} of {} extracted triple(s) from source {}", stored, candidates.size(),
                candidates.get(0).getSource());
        return stored;
    }

    /**
     * Same as {@link #ingestText} but reports failures to the caller, for
     * callers that retry later.
     *
     * @throws TripleExtractionException
     *             if the extraction collaborator failed or returned malformed
     *             output
     * @throws TripleStorageException
     *             if extracted triples could not be embedded or written
     */
    public int extractAndStore(String text, String source, String episodeId) {
        List<TripleCandidate> candidates = extractCandidates(text, source, episodeId);
        if (candidates.isEmpty()) {
            return 0;
        }
        int stored = tripleStoreService.ingestAll(candidates);
        log.info("[Ingest] Stored {} of {} extracted triple(s) from source {}", stored, candidates.size(),
                candidates.get(0).getSource());
        return stored;
    }

    private List<TripleCandidate> extractCandidates(String text, String source, String episodeId) {
        if (text == null || text.isBlank()) {
            return List.of();
        }

        List<ExtractedTriple> extracted;
        try {
            extracted = tripleExtractionPort.extract(text).join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof TripleExtractionException extractionFailure) {
                throw extractionFailure;
            }
            throw new TripleExtractionException("Extraction failed: " + cause.getMessage(), cause);
        } catch (RuntimeException e) {
            throw new TripleExtractionException("Extraction failed: " + e.getMessage(), e);
        }

        if (extracted == null || extracted.isEmpty()) {
            log.debug("[Ingest] No triples extracted from {} chars", text.length());
            return List.of();
        }

        String effectiveSource = source != null && !source.isBlank() ? source : DEFAULT_SOURCE;
        List<TripleCandidate> candidates = new ArrayList<>();
        for (ExtractedTriple triple : extracted) {
            if (isBlank(triple.subject()) || isBlank(triple.predicate()) || isBlank(triple.object())) {
                log.debug("[Ingest] Skipping incomplete extracted triple: {}", triple);
                continue;
            }
            candidates.add(TripleCandidate.builder()
                    .subject(triple.subject())
                    .predicate(triple.predicate())
                    .object(triple.object())
                    .topics(new ArrayList<>(triple.topics()))
                    .source(effectiveSource)
                    .episodeId(episodeId)
                    .abstractionLevel(triple.abstractionLevel())
                    .build());
        }
        return candidates;
    }

    private boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
