package me.golemcore.memory.domain.service;

import me.golemcore.memory.adapter.outbound.storage.LocalStorageAdapter;
import me.golemcore.memory.adapter.outbound.vector.InMemoryVectorIndexAdapter;
import me.golemcore.memory.domain.exception.TripleStorageException;
import me.golemcore.memory.domain.model.KnowledgeTriple;
import me.golemcore.memory.domain.model.ScoredTriple;
import me.golemcore.memory.domain.model.TripleCandidate;
import me.golemcore.memory.domain.model.TriplePredicate;
import me.golemcore.memory.domain.model.VectorFilter;
import me.golemcore.memory.infrastructure.config.AutoConfiguration;
import me.golemcore.memory.infrastructure.config.MemoryProperties;
import me.golemcore.memory.port.outbound.EmbeddingPort;
import me.golemcore.memory.testsupport.HashingEmbeddingPort;
import me.golemcore.memory.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class TripleStoreServiceTest {

    private static final Instant T0 = Instant.parse("2026-03-01T12:00:00Z");
    private static final double EPS = 1e-9;

    @TempDir
    Path tempDir;

    private MemoryProperties properties;
    private MutableClock clock;
    private InMemoryVectorIndexAdapter index;
    private TripleStoreService service;

    @BeforeEach
    void setUp() {
        properties = new MemoryProperties();
        properties.getStorage().getLocal().setBasePath(tempDir.toString());
        LocalStorageAdapter storage = new LocalStorageAdapter(properties);
        storage.init();

        index = new InMemoryVectorIndexAdapter(storage, AutoConfiguration.objectMapper());
        index.open();
        clock = new MutableClock(T0);
        service = new TripleStoreService(index, new HashingEmbeddingPort(), properties, clock);
    }

    private TripleCandidate candidate(String subject, String predicate, String object, double confidence) {
        return TripleCandidate.builder()
                .subject(subject)
                .predicate(predicate)
                .object(object)
                .confidence(confidence)
                .source("user_input")
                .build();
    }

    private int storedCount() {
        return index.scroll(VectorFilter.none(), Integer.MAX_VALUE).join().size();
    }

    // ===== ingest & merge =====

    @Test
    void ingest_sameTripleTwice_keepsOneRecordWithHigherConfidence() {
        service.ingest(List.of(candidate("Alice", "works_at", "Acme", 0.6)));
        service.ingest(List.of(candidate("Alice", "works_at", "Acme", 0.9)));
        service.ingest(List.of(candidate("Alice", "works_at", "Acme", 0.5)));

        assertEquals(1, storedCount());
        KnowledgeTriple stored = service.queryByMetadata(VectorFilter.none(), 10).get(0);
        assertEquals(0.9, stored.getConfidence(), EPS);
    }

    @Test
    void ingest_whitespaceVariantsShareIdentity() {
        service.ingest(List.of(candidate("Alice", "works_at", "Acme", 0.6)));
        service.ingest(List.of(candidate("  Alice ", "WORKS_AT", "Acme", 0.7)));

        assertEquals(1, storedCount());
        assertEquals(TripleStoreService.computeId("Alice", "works_at", "Acme", "user_input"),
                service.queryByMetadata(VectorFilter.none(), 1).get(0).getId());
    }

    @Test
    void ingest_differentSourceIsSeparateRecord() {
        TripleCandidate fromChat = candidate("Alice", "works_at", "Acme", 0.6);
        fromChat.setSource("conversation_s1");

        service.ingest(List.of(candidate("Alice", "works_at", "Acme", 0.6), fromChat));

        assertEquals(2, storedCount());
    }

    @Test
    void ingest_mergeDecaysStoredConfidenceByHalfLife() {
        service.ingest(List.of(candidate("Alice", "likes", "tea", 0.8)));
        clock.advance(Duration.ofDays(30));

        service.ingest(List.of(candidate("Alice", "likes", "tea", 0.3)));

        assertEquals(0.4, service.queryByMetadata(VectorFilter.none(), 1).get(0).getConfidence(), 1e-6);
    }

    @Test
    void ingest_mergeUnionsTopicsAndKeepsEarliestCreation() {
        TripleCandidate first = candidate("Alice", "likes", "tea", 0.5);
        first.setTopics(List.of("food"));
        service.store(first);
        clock.advance(Duration.ofHours(2));

        TripleCandidate second = candidate("Alice", "likes", "tea", 0.5);
        second.setTopics(List.of("preferences", "food"));
        KnowledgeTriple merged = service.store(second).orElseThrow();

        assertEquals(List.of("food", "preferences"), merged.getTopics());
        assertEquals(T0, merged.getCreatedAt());
        assertEquals(T0.plus(Duration.ofHours(2)), merged.getUpdatedAt());
    }

    @Test
    void ingest_usesDefaultConfidenceWhenUnset() {
        KnowledgeTriple stored = service.store(TripleCandidate.builder()
                .subject("Bob").predicate("lives_in").object("Berlin").build()).orElseThrow();

        assertEquals(properties.getTriples().getDefaultConfidence(), stored.getConfidence(), EPS);
    }

    @Test
    void ingest_skipsIncompleteCandidates() {
        int stored = service.ingest(List.of(
                candidate("Alice", "likes", " ", 0.5),
                candidate("", "likes", "tea", 0.5),
                candidate("Bob", "likes", "coffee", 0.5)));

        assertEquals(1, stored);
        assertEquals(1, storedCount());
    }

    @Test
    void ingest_proceduralPredicateGetsProcedureTopic() {
        KnowledgeTriple stored = service.store(candidate("deploy app", "accomplished_by", "docker compose up", 0.9))
                .orElseThrow();

        assertTrue(stored.getTopics().contains(TriplePredicate.PROCEDURE_TOPIC));
    }

    @Test
    void ingest_exampleUsageObjectIsStoredVerbatim() {
        String code = "for f in *.log; do\n    gzip  \"$f\"\ndone\n";
        KnowledgeTriple stored = service.store(candidate("compress logs", "example_usage", code, 0.9)).orElseThrow();

        Optional<KnowledgeTriple> read = service.getTriple(stored.getId());

        assertTrue(read.isPresent());
        assertEquals(code, read.get().getObject());
    }

    @Test
    void ingest_skipsCandidateWhenEmbeddingFails() {
        EmbeddingPort failing = mock(EmbeddingPort.class);
        when(failing.embed(anyString()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("Embedding model not available")));
        TripleStoreService degraded = new TripleStoreService(index, failing, properties, clock);

        int stored = degraded.ingest(List.of(candidate("Alice", "likes", "tea", 0.5)));

        assertEquals(0, stored);
        assertEquals(0, storedCount());
    }

    @Test
    void ingestAll_reportsEmbeddingOutage() {
        EmbeddingPort failing = mock(EmbeddingPort.class);
        when(failing.embed(anyString()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("Embedding model not available")));
        TripleStoreService degraded = new TripleStoreService(index, failing, properties, clock);

        TripleStorageException error = assertThrows(TripleStorageException.class,
                () -> degraded.ingestAll(List.of(candidate("Alice", "likes", "tea", 0.5))));

        assertTrue(error.getMessage().contains("Embedding model not available"));
        assertEquals(0, storedCount());
    }

    @Test
    void ingestAll_reportsClosedIndex() {
        index.close();

        assertThrows(TripleStorageException.class,
                () -> service.ingestAll(List.of(candidate("Alice", "likes", "tea", 0.5))));
    }

    @Test
    void ingestAll_skipsIncompleteCandidatesWithoutFailing() {
        int stored = service.ingestAll(List.of(
                candidate("Alice", "likes", " ", 0.5),
                candidate("Bob", "likes", "coffee", 0.5)));

        assertEquals(1, stored);
        assertEquals(1, storedCount());
    }

    @Test
    void ingestAll_retryOfStoredBatchIsIdempotent() {
        List<TripleCandidate> batch = List.of(candidate("Alice", "likes", "tea", 0.5),
                candidate("Bob", "likes", "coffee", 0.7));

        service.ingestAll(batch);
        service.ingestAll(batch);

        assertEquals(2, storedCount());
    }

    // ===== query =====

    @Test
    void query_weightsAccomplishedByAboveOpenPredicate() {
        service.ingest(List.of(
                candidate("deploy app", "related_to", "docker", 0.8),
                candidate("deploy app", "accomplished_by", "docker", 0.8)));

        List<ScoredTriple> results = service.query("deploy app docker", 2);

        assertEquals(2, results.size());
        assertEquals("accomplished_by", results.get(0).triple().getPredicate());
        assertTrue(results.get(0).score() > results.get(1).score());
    }

    @Test
    void query_confidenceRaisesScore() {
        service.ingest(List.of(
                candidate("Alice", "likes", "green tea", 0.2),
                candidate("Alice", "enjoys", "green tea", 1.0)));

        List<ScoredTriple> results = service.query("Alice green tea", 2);

        assertEquals("enjoys", results.get(0).triple().getPredicate());
    }

    @Test
    void query_respectsLimitAndFilter() {
        TripleCandidate food = candidate("Alice", "likes", "tea", 0.8);
        food.setTopics(List.of("food"));
        service.ingest(List.of(food,
                candidate("Alice", "works_at", "Acme", 0.8),
                candidate("Alice", "lives_in", "Berlin", 0.8)));

        assertEquals(2, service.query("Alice", 2).size());
        List<ScoredTriple> filtered = service.query("Alice", 10,
                VectorFilter.builder().topics(Set.of("food")).build());
        assertEquals(1, filtered.size());
        assertEquals("tea", filtered.get(0).triple().getObject());
    }

    @Test
    void query_hugeLimitStillReturnsHits() {
        service.ingest(List.of(candidate("Alice", "likes", "tea", 0.8)));

        assertEquals(1, service.query("Alice tea", 10).size());
        assertEquals(1, service.query("Alice tea", 1_000_000_000).size());
        assertEquals(1, service.query("Alice tea", Integer.MAX_VALUE).size());
    }

    @Test
    void query_returnsExampleUsageCodeVerbatim() {
        String code = "```bash\nfor f in *.log; do\n    gzip  \"$f\"\t# keep   spacing\ndone\n```";
        service.store(candidate("compress logs", "example_usage", code, 0.9));

        List<ScoredTriple> results = service.query("compress logs gzip", 5);

        assertEquals(1, results.size());
        assertEquals("example_usage", results.get(0).triple().getPredicate());
        assertEquals(code, results.get(0).triple().getObject());
    }

    @Test
    void query_blankTextOrZeroLimitReturnsEmpty() {
        service.ingest(List.of(candidate("Alice", "likes", "tea", 0.8)));

        assertTrue(service.query(" ", 5).isEmpty());
        assertTrue(service.query("Alice", 0).isEmpty());
    }

    @Test
    void query_returnsEmptyWhenIndexUnavailable() {
        service.ingest(List.of(candidate("Alice", "likes", "tea", 0.8)));
        index.close();

        assertTrue(service.query("Alice tea", 5).isEmpty());
        assertTrue(service.queryByMetadata(VectorFilter.none(), 5).isEmpty());
        assertTrue(service.getTriple("anything").isEmpty());
        assertTrue(service.store(candidate("Bob", "likes", "coffee", 0.8)).isEmpty());
    }

    // ===== metadata queries =====

    @Test
    void queryByEpisode_returnsOnlyThatEpisode() {
        TripleCandidate inEpisode = candidate("Alice", "likes", "tea", 0.8);
        inEpisode.setEpisodeId("ep-1");
        service.ingest(List.of(inEpisode, candidate("Bob", "likes", "coffee", 0.8)));

        List<KnowledgeTriple> facts = service.queryByEpisode("ep-1", 10);

        assertEquals(1, facts.size());
        assertEquals("Alice", facts.get(0).getSubject());
        assertTrue(service.queryByEpisode(" ", 10).isEmpty());
    }

    @Test
    void queryRecent_excludesOlderTriples() {
        service.store(candidate("Alice", "likes", "tea", 0.8));
        clock.advance(Duration.ofHours(48));
        service.store(candidate("Bob", "likes", "coffee", 0.8));

        List<KnowledgeTriple> recent = service.queryRecent(24, 10);

        assertEquals(1, recent.size());
        assertEquals("Bob", recent.get(0).getSubject());
    }

    @Test
    void queryResultsAreDetachedFromStoredTriples() {
        KnowledgeTriple stored = service.store(candidate("Alice", "likes", "tea", 0.8)).orElseThrow();

        KnowledgeTriple listed = service.queryByMetadata(VectorFilter.none(), 10).get(0);
        listed.setConfidence(0.01);
        listed.setObject("coffee");
        listed.getTopics().add("tampered");
        KnowledgeTriple ranked = service.query("Alice tea", 1).get(0).triple();
        ranked.setConfidence(0.02);
        service.getTriple(stored.getId()).orElseThrow().setSubject("Mallory");

        KnowledgeTriple read = service.getTriple(stored.getId()).orElseThrow();
        assertEquals(0.8, read.getConfidence(), EPS);
        assertEquals("tea", read.getObject());
        assertEquals("Alice", read.getSubject());
        assertFalse(read.getTopics().contains("tampered"));
    }

    @Test
    void replace_keepsIdentityAndUpdatesTimestamp() {
        KnowledgeTriple stored = service.store(candidate("Alice", "likes", "tea", 0.5)).orElseThrow();
        clock.advance(Duration.ofMinutes(5));

        KnowledgeTriple changed = stored.toBuilder().confidence(0.99).build();
        assertTrue(service.replace(changed));

        KnowledgeTriple read = service.getTriple(stored.getId()).orElseThrow();
        assertEquals(0.99, read.getConfidence(), EPS);
        assertEquals(T0.plus(Duration.ofMinutes(5)), read.getUpdatedAt());
        assertEquals(1, storedCount());
    }

    @Test
    void toText_spellsOutPredicate() {
        KnowledgeTriple triple = KnowledgeTriple.builder()
                .subject("deploy app").predicate("accomplished_by").object("docker compose up").build();

        assertEquals("deploy app accomplished by docker compose up", TripleStoreService.toText(triple));
    }

    @Test
    void decay_isIdentityWithoutElapsedTime() {
        assertEquals(0.7, service.decay(0.7, T0, T0), EPS);
        assertEquals(0.35, service.decay(0.7, T0, T0.plus(Duration.ofDays(30))), 1e-9);
    }
}
