package me.golemcore.memory.consolidation;

import me.golemcore.memory.domain.exception.TripleExtractionException;
import me.golemcore.memory.domain.exception.TripleStorageException;
import me.golemcore.memory.domain.model.EpisodeTurnAppendedEvent;
import me.golemcore.memory.domain.service.SemanticIngestionService;
import me.golemcore.memory.infrastructure.config.MemoryProperties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class ConsolidationSchedulerTest {

    private static final String SESSION = "s1";

    private SemanticIngestionService ingestionService;
    private MemoryProperties properties;
    private ConsolidationScheduler scheduler;

    @BeforeEach
    void setUp() {
        ingestionService = mock(SemanticIngestionService.class);
        properties = new MemoryProperties();
        properties.getConsolidation().setIdleSeconds(60);
        properties.getConsolidation().setMinTextLength(10);
        scheduler = new ConsolidationScheduler(ingestionService, properties);
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdown();
    }

    private EpisodeTurnAppendedEvent turn(String episodeId, String role, String content) {
        return new EpisodeTurnAppendedEvent(SESSION, episodeId, role, content, Instant.now());
    }

    @Test
    void shouldConsolidateAfterIdleWindow() {
        properties.getConsolidation().setIdleSeconds(1);
        scheduler.init();

        scheduler.onTurnAppended(turn("ep-1", "user", "I moved to Berlin last year"));
        scheduler.onTurnAppended(turn("ep-1", "assistant", "Nice, how do you like it?"));

        verify(ingestionService, timeout(5000)).extractAndStore(
                "user: I moved to Berlin last year\nassistant: Nice, how do you like it?\n",
                "conversation_" + SESSION, "ep-1");
    }

    @Test
    void flushSubmitsBufferedTurnsImmediately() {
        scheduler.init();
        scheduler.onTurnAppended(turn("ep-1", "user", "My favourite editor is Emacs"));

        assertTrue(scheduler.flush(SESSION));
        assertFalse(scheduler.flush(SESSION));

        verify(ingestionService, timeout(2000)).extractAndStore(anyString(), eq("conversation_" + SESSION),
                eq("ep-1"));
    }

    @Test
    void shortBatchesAreSkipped() {
        scheduler.init();
        scheduler.onTurnAppended(turn("ep-1", "user", "ok"));

        assertTrue(scheduler.flush(SESSION));

        verify(ingestionService, after(300).never()).extractAndStore(anyString(), anyString(), anyString());
    }

    @Test
    void episodeChangeSubmitsPreviousEpisodeText() {
        scheduler.init();
        scheduler.onTurnAppended(turn("ep-1", "user", "Alice works at Acme in Berlin"));
        scheduler.onTurnAppended(turn("ep-2", "user", "Bob prefers green tea"));

        verify(ingestionService, timeout(2000)).extractAndStore("user: Alice works at Acme in Berlin\n",
                "conversation_" + SESSION, "ep-1");

        scheduler.flush(SESSION);
        verify(ingestionService, timeout(2000)).extractAndStore("user: Bob prefers green tea\n",
                "conversation_" + SESSION, "ep-2");
    }

    @Test
    void failedBatchIsRetried() {
        properties.getConsolidation().setIdleSeconds(1);
        when(ingestionService.extractAndStore(anyString(), anyString(), anyString()))
                .thenThrow(new TripleExtractionException("Malformed extraction response"))
                .thenReturn(2);
        scheduler.init();
        scheduler.onTurnAppended(turn("ep-1", "user", "Carol lives in Lisbon"));

        scheduler.flush(SESSION);

        verify(ingestionService, timeout(5000).times(2)).extractAndStore("user: Carol lives in Lisbon\n",
                "conversation_" + SESSION, "ep-1");
    }

    @Test
    void batchLostToStorageOutageIsRetried() {
        properties.getConsolidation().setIdleSeconds(1);
        when(ingestionService.extractAndStore(anyString(), anyString(), anyString()))
                .thenThrow(new TripleStorageException("1 of 1 triple(s) could not be stored: embedding unavailable",
                        new IllegalStateException("embedding unavailable")))
                .thenReturn(1);
        scheduler.init();
        scheduler.onTurnAppended(turn("ep-1", "user", "Dave switched to a standing desk"));

        scheduler.flush(SESSION);

        verify(ingestionService, timeout(5000).times(2)).extractAndStore("user: Dave switched to a standing desk\n",
                "conversation_" + SESSION, "ep-1");
    }

    @Test
    void flushedSessionsReleaseTheirBuffers() {
        scheduler.init();
        scheduler.onTurnAppended(turn("ep-1", "user", "Erin is learning the cello"));
        scheduler.onTurnAppended(new EpisodeTurnAppendedEvent("s2", "ep-9", "user", "ok", Instant.now()));
        assertEquals(2, scheduler.pendingSessions());

        scheduler.flush(SESSION);
        scheduler.flush("s2");

        assertEquals(0, scheduler.pendingSessions());
        scheduler.onTurnAppended(turn("ep-1", "user", "She practices every evening"));
        assertEquals(1, scheduler.pendingSessions());
        assertTrue(scheduler.flush(SESSION));
        verify(ingestionService, timeout(2000)).extractAndStore("user: She practices every evening\n",
                "conversation_" + SESSION, "ep-1");
    }

    @Test
    void shutdownFlushesPendingBuffers() {
        scheduler.init();
        scheduler.onTurnAppended(turn("ep-1", "user", "Remember that the wifi password is on the fridge"));

        scheduler.shutdown();

        verify(ingestionService).extractAndStore(anyString(), eq("conversation_" + SESSION), eq("ep-1"));
    }

    @Test
    void disabledSchedulerIgnoresTurns() {
        properties.getConsolidation().setEnabled(false);
        scheduler.init();

        scheduler.onTurnAppended(turn("ep-1", "user", "This should never be consolidated"));

        assertFalse(scheduler.flush(SESSION));
        verifyNoInteractions(ingestionService);
    }
}
