package com.williamcallahan.memorypipeline.service.embedding;

import java.util.Optional;
import java.util.OptionalInt;

/**
 * Content-addressed embedding store shared by all pipeline workers.
 */
public interface EmbeddingCache {

    /**
     * Looks up a cached vector. Always empty in {@link EmbeddingCacheMode#WRITE_ONLY} mode.
     */
    Optional<CachedEmbedding> tryGet(EmbeddingCacheKey key);

    /**
     * Stores a vector, replacing any previous entry wholesale. No-op in
     * {@link EmbeddingCacheMode#READ_ONLY} mode.
     */
    void store(EmbeddingCacheKey key, float[] vector, OptionalInt tokenCount);

    EmbeddingCacheMode mode();
}
