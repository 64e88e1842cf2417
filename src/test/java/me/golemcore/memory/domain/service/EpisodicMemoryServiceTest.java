package me.golemcore.memory.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.memory.adapter.outbound.storage.LocalStorageAdapter;
import me.golemcore.memory.domain.model.Episode;
import me.golemcore.memory.domain.model.EpisodeTurnAppendedEvent;
import me.golemcore.memory.domain.model.KnowledgeTriple;
import me.golemcore.memory.domain.model.MessageTurn;
import me.golemcore.memory.infrastructure.config.AutoConfiguration;
import me.golemcore.memory.infrastructure.config.MemoryProperties;
import me.golemcore.memory.infrastructure.event.SpringEventBus;
import me.golemcore.memory.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class EpisodicMemoryServiceTest {

    private static final Instant T0 = Instant.parse("2026-03-01T12:00:00Z");
    private static final String SESSION = "session-1";
    private static final String OTHER_SESSION = "session-2";

    @TempDir
    Path tempDir;

    private MemoryProperties properties;
    private LocalStorageAdapter storage;
    private ObjectMapper objectMapper;
    private TripleStoreService tripleStoreService;
    private SpringEventBus eventBus;
    private MutableClock clock;
    private EpisodicMemoryService service;

    @BeforeEach
    void setUp() {
        properties = new MemoryProperties();
        properties.getStorage().getLocal().setBasePath(tempDir.toString());
        properties.getEpisodes().setFinalizeThreshold(3);
        storage = new LocalStorageAdapter(properties);
        storage.init();
        objectMapper = AutoConfiguration.objectMapper();
        tripleStoreService = mock(TripleStoreService.class);
        eventBus = mock(SpringEventBus.class);
        clock = new MutableClock(T0);

        service = newService();
        service.loadEpisodes();
    }

    private EpisodicMemoryService newService() {
        return new EpisodicMemoryService(storage, objectMapper, properties, tripleStoreService, eventBus, clock);
    }

    // ===== append & lifecycle =====

    @Test
    void addMessage_opensEpisodeAndPersistsIt() {
        String episodeId = service.addMessageToEpisode(SESSION, "user", "I moved to Berlin");

        Episode episode = service.getEpisode(SESSION, episodeId).orElseThrow();
        assertEquals(SESSION, episode.getSessionId());
        assertFalse(episode.isFinalized());
        assertEquals(1, episode.getTurns().size());
        assertTrue(Files.exists(tempDir.resolve("episodes").resolve(episodeId + ".json")));
    }

    @Test
    void addMessage_finalizesAtThresholdAndOpensFreshEpisode() {
        String first = service.addMessageToEpisode(SESSION, "user", "hello there");
        service.addMessageToEpisode(SESSION, "assistant", "hi");
        String third = service.addMessageToEpisode(SESSION, "user", "bye");

        assertEquals(first, third);
        Episode finalized = service.getEpisode(SESSION, first).orElseThrow();
        assertTrue(finalized.isFinalized());
        assertEquals(T0, finalized.getFinalizedAt());
        assertEquals("Conversation with 3 messages. Started with: hello there", finalized.getSummary());
        assertTrue(service.getOpenEpisode(SESSION).isEmpty());

        String next = service.addMessageToEpisode(SESSION, "user", "back again");
        assertNotEquals(first, next);
        assertEquals(1, service.getEpisode(SESSION, next).orElseThrow().getTurns().size());
    }

    @Test
    void addMessage_publishesTurnEvent() {
        String episodeId = service.addMessageToEpisode(SESSION, "user", "I like green tea");

        ArgumentCaptor<Object> captor = ArgumentCaptor.forClass(Object.class);
        verify(eventBus).publish(captor.capture());
        EpisodeTurnAppendedEvent event = assertInstanceOf(EpisodeTurnAppendedEvent.class, captor.getValue());
        assertEquals(SESSION, event.sessionId());
        assertEquals(episodeId, event.episodeId());
        assertEquals("I like green tea", event.content());
    }

    @Test
    void addMessage_rejectsBlankSession() {
        assertThrows(IllegalArgumentException.class, () -> service.addMessageToEpisode(" ", "user", "hi"));
        verifyNoInteractions(eventBus);
    }

    @Test
    void createEpisode_finalizesPreviousOpenEpisode() {
        String first = service.addMessageToEpisode(SESSION, "user", "first topic");

        Episode second = service.createEpisode(SESSION);

        assertTrue(service.getEpisode(SESSION, first).orElseThrow().isFinalized());
        assertEquals(second.getId(), service.getOpenEpisode(SESSION).orElseThrow().getId());
    }

    @Test
    void finalizeEpisode_storesTopicsAndSummaryOnce() {
        String episodeId = service.addMessageToEpisode(SESSION, "user", "planning a trip");

        assertTrue(service.finalizeEpisode(SESSION, episodeId, List.of("travel"), "Trip planning"));
        assertFalse(service.finalizeEpisode(SESSION, episodeId, List.of("other"), "Again"));
        assertFalse(service.finalizeEpisode(SESSION, "missing", List.of(), null));

        Episode episode = service.getEpisode(SESSION, episodeId).orElseThrow();
        assertEquals(List.of("travel"), episode.getTopics());
        assertEquals("Trip planning", episode.getSummary());
    }

    // ===== session-scoped reads =====

    @Test
    void search_neverCrossesSessions() {
        service.addMessageToEpisode(SESSION, "user", "My password hint is Rosebud");
        service.addMessageToEpisode(OTHER_SESSION, "user", "Just chatting");

        assertEquals(1, service.searchEpisodes(SESSION, "rosebud", 10).size());
        assertTrue(service.searchEpisodes(OTHER_SESSION, "rosebud", 10).isEmpty());
        assertTrue(service.searchEpisodes(null, "rosebud", 10).isEmpty());
        assertTrue(service.searchEpisodes(SESSION, " ", 10).isEmpty());
    }

    @Test
    void queryBySession_returnsNewestFirst() {
        String first = service.addMessageToEpisode(SESSION, "user", "one");
        clock.advance(Duration.ofMinutes(10));
        Episode second = service.createEpisode(SESSION);
        service.addMessageToEpisode(OTHER_SESSION, "user", "elsewhere");

        List<Episode> episodes = service.queryEpisodesBySession(SESSION, 10);

        assertEquals(List.of(second.getId(), first), episodes.stream().map(Episode::getId).toList());
    }

    @Test
    void getRecentEpisodes_excludesInactiveEpisodes() {
        String old = service.addMessageToEpisode(SESSION, "user", "old conversation");
        service.finalizeEpisode(SESSION, old, List.of(), null);
        clock.advance(Duration.ofHours(30));
        String recent = service.addMessageToEpisode(SESSION, "user", "new conversation");

        List<Episode> episodes = service.getRecentEpisodes(SESSION, 24, 10);

        assertEquals(1, episodes.size());
        assertEquals(recent, episodes.get(0).getId());
    }

    @Test
    void queryByTime_isInclusiveAndSessionScoped() {
        String episodeId = service.addMessageToEpisode(SESSION, "user", "hello");

        assertEquals(1, service.queryEpisodesByTime(SESSION, T0, T0).size());
        assertEquals(episodeId, service.queryEpisodesByTime(SESSION, null, null).get(0).getId());
        assertTrue(service.queryEpisodesByTime(OTHER_SESSION, null, null).isEmpty());
    }

    @Test
    void timeline_groupsByDateNewestFirst() {
        String dayOne = service.addMessageToEpisode(SESSION, "user", "monday");
        clock.advance(Duration.ofDays(1));
        String dayTwo = service.createEpisode(SESSION).getId();

        Map<LocalDate, List<Episode>> timeline = service.timeline(SESSION, 7);

        assertEquals(List.of(LocalDate.of(2026, 3, 2), LocalDate.of(2026, 3, 1)), List.copyOf(timeline.keySet()));
        assertEquals(dayTwo, timeline.get(LocalDate.of(2026, 3, 2)).get(0).getId());
        assertEquals(dayOne, timeline.get(LocalDate.of(2026, 3, 1)).get(0).getId());
        assertTrue(service.timeline("", 7).isEmpty());
    }

    @Test
    void conversationContext_returnsLastTurnsInOrder() {
        properties.getEpisodes().setFinalizeThreshold(50);
        String episodeId = service.addMessageToEpisode(SESSION, "user", "a");
        service.addMessageToEpisode(SESSION, "assistant", "b");
        service.addMessageToEpisode(SESSION, "user", "c");

        List<MessageTurn> context = service.getConversationContext(SESSION, episodeId, 2);

        assertEquals(List.of("b", "c"), context.stream().map(MessageTurn::getContent).toList());
        assertTrue(service.getConversationContext(SESSION, "missing", 2).isEmpty());
    }

    @Test
    void episodeFacts_delegateToTripleStore() {
        String episodeId = service.addMessageToEpisode(SESSION, "user", "I work at Acme");
        KnowledgeTriple fact = KnowledgeTriple.builder().subject("user").predicate("works_at").object("Acme")
                .episodeId(episodeId).build();
        when(tripleStoreService.queryByEpisode(episodeId, 10)).thenReturn(List.of(fact));

        assertEquals(List.of(fact), service.getEpisodeFacts(SESSION, episodeId, 10));
        assertTrue(service.getEpisodeFacts(SESSION, "unknown", 10).isEmpty());
    }

    @Test
    void lookupsByEpisodeIdRequireOwningSession() {
        properties.getEpisodes().setFinalizeThreshold(50);
        String episodeId = service.addMessageToEpisode(SESSION, "user", "my bank PIN is 1234");
        when(tripleStoreService.queryByEpisode(eq(episodeId), anyInt())).thenReturn(List.of(
                KnowledgeTriple.builder().subject("user").predicate("has_pin").object("1234").build()));

        assertTrue(service.getConversationContext(OTHER_SESSION, episodeId, 10).isEmpty());
        assertTrue(service.getConversationContext(null, episodeId, 10).isEmpty());
        assertTrue(service.getEpisode(OTHER_SESSION, episodeId).isEmpty());
        assertTrue(service.getEpisode(" ", episodeId).isEmpty());
        assertTrue(service.getEpisodeFacts(OTHER_SESSION, episodeId, 10).isEmpty());
        assertFalse(service.finalizeEpisode(OTHER_SESSION, episodeId, List.of(), "hijacked"));

        Episode own = service.getEpisode(SESSION, episodeId).orElseThrow();
        assertFalse(own.isFinalized());
        assertEquals(1, service.getConversationContext(SESSION, episodeId, 10).size());
        assertEquals(1, service.getEpisodeFacts(SESSION, episodeId, 10).size());
    }

    @Test
    void returnedEpisodesAreDetachedCopies() {
        properties.getEpisodes().setFinalizeThreshold(50);
        String episodeId = service.addMessageToEpisode(SESSION, "user", "original");

        Episode copy = service.getEpisode(SESSION, episodeId).orElseThrow();
        copy.getTurns().clear();
        copy.setSessionId(OTHER_SESSION);
        service.getConversationContext(SESSION, episodeId, 5).get(0).setContent("rewritten");
        service.queryEpisodesBySession(SESSION, 5).get(0).setFinalized(true);
        service.addMessageToEpisode(SESSION, "assistant", "reply");

        Episode stored = service.getEpisode(SESSION, episodeId).orElseThrow();
        assertEquals(SESSION, stored.getSessionId());
        assertFalse(stored.isFinalized());
        assertEquals(List.of("original", "reply"), stored.getTurns().stream().map(MessageTurn::getContent).toList());
        assertTrue(copy.getTurns().isEmpty());
    }

    // ===== persistence =====

    @Test
    void loadEpisodes_restoresOpenEpisodeAfterRestart() {
        String episodeId = service.addMessageToEpisode(SESSION, "user", "remember me");

        EpisodicMemoryService restarted = newService();
        restarted.loadEpisodes();

        Episode restored = restarted.getOpenEpisode(SESSION).orElseThrow();
        assertEquals(episodeId, restored.getId());
        assertEquals("remember me", restored.getTurns().get(0).getContent());
        assertEquals(episodeId, restarted.addMessageToEpisode(SESSION, "assistant", "I do"));
    }
}
