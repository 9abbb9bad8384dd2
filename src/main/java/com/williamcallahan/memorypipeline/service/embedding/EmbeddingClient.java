package com.williamcallahan.memorypipeline.service.embedding;

import java.util.List;

/**
 * Embedding provider port used by the pipeline.
 *
 * <p>Implementations throw {@link EmbeddingServiceUnavailableException} for failures worth retrying
 * (throttling, 5xx, connectivity) and {@link EmbeddingProviderRejectedException} when the provider
 * refuses the input outright.
 */
public interface EmbeddingClient {

    /**
     * Embeds texts in order.
     *
     * @param texts input texts
     * @return one vector per input, same order
     */
    List<float[]> embed(List<String> texts);

    /**
     * Embeds a single text.
     */
    default float[] embed(String text) {
        List<float[]> vectors = embed(List.of(text));
        if (vectors.isEmpty()) {
            throw new EmbeddingServiceUnavailableException("Embedding provider returned no vector");
        }
        return vectors.get(0);
    }

    /**
     * Returns the embedding dimensions.
     */
    int dimensions();

    /** Provider identifier, part of the embedding cache key. */
    String providerName();

    /** Model identifier, part of the embedding cache key. */
    String modelName();
}
