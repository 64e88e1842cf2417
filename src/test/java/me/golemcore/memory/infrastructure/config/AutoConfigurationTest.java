package me.golemcore.memory.infrastructure.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.memory.domain.model.Episode;
import me.golemcore.memory.port.outbound.EmbeddingPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AutoConfigurationTest {

    @Mock
    private EmbeddingPort embeddingPort;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        when(embeddingPort.getModel()).thenReturn("text-embedding-3-small");
    }

    @Test
    void shouldLogStartupWithoutTouchingModels() {
        AutoConfiguration autoConfiguration = new AutoConfiguration(new MemoryProperties(), embeddingPort);

        assertDoesNotThrow(autoConfiguration::init);
        verify(embeddingPort).getModel();
    }

    @Test
    void objectMapperWritesIsoInstantsAndIgnoresUnknownFields() throws Exception {
        ObjectMapper mapper = AutoConfiguration.objectMapper();
        Episode episode = Episode.builder().id("ep-1").createdAt(Instant.parse("2026-03-01T12:00:00Z")).build();

        String json = mapper.writeValueAsString(episode);
        Episode read = mapper.readValue(json.replace("{", "{\"legacyField\":1,"), Episode.class);

        assertTrue(json.contains("\"createdAt\":\"2026-03-01T12:00:00Z\""));
        assertEquals(episode.getCreatedAt(), read.getCreatedAt());
    }

    @Test
    void propertiesHaveDocumentedDefaults() {
        MemoryProperties properties = new MemoryProperties();

        assertEquals(0.7, properties.getRetrieval().getHopDecay());
        assertEquals(50, properties.getEpisodes().getFinalizeThreshold());
        assertEquals(30, properties.getTriples().getDecayHalfLifeDays());
        assertEquals(30, properties.getConsolidation().getIdleSeconds());
        assertTrue(properties.getConsolidation().isEnabled());
        assertEquals(10, properties.getTriples().getDefaultQueryLimit());
    }

    @Test
    void hopDecayMustStayInsideOpenUnitInterval() {
        MemoryProperties.RetrievalProperties retrieval = new MemoryProperties().getRetrieval();

        assertThrows(IllegalArgumentException.class, () -> retrieval.setHopDecay(1.0));
        assertThrows(IllegalArgumentException.class, () -> retrieval.setHopDecay(1.5));
        assertThrows(IllegalArgumentException.class, () -> retrieval.setHopDecay(0.0));
        assertThrows(IllegalArgumentException.class, () -> retrieval.setHopDecay(-0.3));
        assertThrows(IllegalArgumentException.class, () -> retrieval.setHopDecay(Double.NaN));
        assertEquals(0.7, retrieval.getHopDecay());

        retrieval.setHopDecay(0.5);
        assertEquals(0.5, retrieval.getHopDecay());
    }
}
