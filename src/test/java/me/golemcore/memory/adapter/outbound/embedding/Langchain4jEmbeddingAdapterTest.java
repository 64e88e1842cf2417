package me.golemcore.memory.adapter.outbound.embedding;

import me.golemcore.memory.infrastructure.config.MemoryProperties;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.*;

class Langchain4jEmbeddingAdapterTest {

    @Test
    void shouldBeUnavailableWithoutApiKey() {
        Langchain4jEmbeddingAdapter adapter = new Langchain4jEmbeddingAdapter(new MemoryProperties());

        assertFalse(adapter.isAvailable());
        CompletionException error = assertThrows(CompletionException.class,
                () -> adapter.embed("Alice works at Acme").join());
        assertInstanceOf(IllegalStateException.class, error.getCause());
    }

    @Test
    void shouldRejectBlankText() {
        Langchain4jEmbeddingAdapter adapter = new Langchain4jEmbeddingAdapter(new MemoryProperties());

        CompletionException error = assertThrows(CompletionException.class, () -> adapter.embed(" ").join());
        assertInstanceOf(IllegalArgumentException.class, error.getCause());
    }

    @Test
    void shouldReturnEmptyBatchForNoTexts() {
        Langchain4jEmbeddingAdapter adapter = new Langchain4jEmbeddingAdapter(new MemoryProperties());

        assertTrue(adapter.embedBatch(List.of()).join().isEmpty());
    }

    @Test
    void shouldFallBackToDefaultModelName() {
        MemoryProperties properties = new MemoryProperties();
        properties.getEmbedding().setModel(" ");

        assertEquals("text-embedding-3-small", new Langchain4jEmbeddingAdapter(properties).getModel());
    }
}
