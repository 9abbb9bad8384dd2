package com.williamcallahan.memorypipeline.service.embedding;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;

import java.time.Instant;
import java.util.OptionalInt;
import org.junit.jupiter.api.Test;

/**
 * Verifies cache values compare by vector content.
 */
class CachedEmbeddingTest {
    private static final Instant WRITTEN = Instant.parse("2026-03-01T09:00:00Z");

    @Test
    void equalVectorsMakeEqualValues() {
        CachedEmbedding first = new CachedEmbedding(new float[] {0.5f, -1f}, OptionalInt.of(3), WRITTEN);
        CachedEmbedding second = new CachedEmbedding(new float[] {0.5f, -1f}, OptionalInt.of(3), WRITTEN);

        assertEquals(first, second);
        assertEquals(first.hashCode(), second.hashCode());
    }

    @Test
    void differentVectorsMakeDifferentValues() {
        CachedEmbedding first = new CachedEmbedding(new float[] {0.5f, -1f}, OptionalInt.empty(), WRITTEN);
        CachedEmbedding second = new CachedEmbedding(new float[] {0.5f, 1f}, OptionalInt.empty(), WRITTEN);

        assertNotEquals(first, second);
    }
}
