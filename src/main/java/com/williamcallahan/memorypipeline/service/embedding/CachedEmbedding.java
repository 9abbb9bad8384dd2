package com.williamcallahan.memorypipeline.service.embedding;

import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * Immutable cache value.
 *
 * @param vector embedding vector
 * @param tokenCount token count of the source text when the writer reported one
 * @param timestamp when the entry was written
 */
public record CachedEmbedding(float[] vector, OptionalInt tokenCount, Instant timestamp) {

    public CachedEmbedding {
        Objects.requireNonNull(vector, "vector");
        Objects.requireNonNull(timestamp, "timestamp");
        vector = vector.clone();
        tokenCount = tokenCount == null ? OptionalInt.empty() : tokenCount;
    }

    @Override
    public float[] vector() {
        return vector.clone();
    }

    /** Compares vectors by content. */
    @Override
    public boolean equals(Object other) {
        return other instanceof CachedEmbedding that
                && Arrays.equals(vector, that.vector)
                && tokenCount.equals(that.tokenCount)
                && timestamp.equals(that.timestamp);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(tokenCount, timestamp) + Arrays.hashCode(vector);
    }

    @Override
    public String toString() {
        return "CachedEmbedding[dimensions=" + vector.length + ", tokenCount=" + tokenCount
                + ", timestamp=" + timestamp + "]";
    }
}
