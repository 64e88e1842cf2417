package me.golemcore.memory.testsupport;

import me.golemcore.memory.port.outbound.EmbeddingPort;

import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;

/**
 * Deterministic bag-of-words embedding: each lowercase token is hashed into a
 * fixed number of buckets. Texts sharing words end up close in cosine space.
 */
public class HashingEmbeddingPort implements EmbeddingPort {

    private static final int DIMENSIONS = 128;

    @Override
    public CompletableFuture<float[]> embed(String text) {
        return CompletableFuture.completedFuture(vectorOf(text));
    }

    @Override
    public CompletableFuture<List<float[]>> embedBatch(List<String> texts) {
        return CompletableFuture.completedFuture(texts.stream().map(HashingEmbeddingPort::vectorOf).toList());
    }

    @Override
    public String getModel() {
        return "hashing-test";
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    public static float[] vectorOf(String text) {
        float[] vector = new float[DIMENSIONS];
        for (String token : text.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}]+")) {
            if (!token.isEmpty()) {
                vector[Math.floorMod(token.hashCode(), DIMENSIONS)] += 1.0f;
            }
        }
        return vector;
    }
}
