package com.williamcallahan.memorypipeline.service.embedding;

import com.williamcallahan.memorypipeline.service.chunking.TokenCounter;
import com.williamcallahan.memorypipeline.support.ContentHasher;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Embedding client decorator that consults the {@link EmbeddingCache} before calling the provider.
 *
 * <p>A batch is looked up key by key; only the misses are sent to the provider, in one call, and the
 * results are stored back. Identical text seen by another document, or by a retry of the same step,
 * costs no provider call.
 */
public class CachingEmbeddingClient implements EmbeddingClient {
    private static final Logger CACHE_LOG = LoggerFactory.getLogger("EMBEDDING_CACHE");

    private final EmbeddingClient delegate;
    private final EmbeddingCache cache;
    private final ContentHasher hasher;
    private final TokenCounter tokenCounter;
    private final boolean normalizedVectors;

    public CachingEmbeddingClient(
            EmbeddingClient delegate,
            EmbeddingCache cache,
            ContentHasher hasher,
            TokenCounter tokenCounter,
            boolean normalizedVectors) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.cache = Objects.requireNonNull(cache, "cache");
        this.hasher = Objects.requireNonNull(hasher, "hasher");
        this.tokenCounter = Objects.requireNonNull(tokenCounter, "tokenCounter");
        this.normalizedVectors = normalizedVectors;
    }

    @Override
    public List<float[]> embed(List<String> texts) {
        if (texts == null || texts.isEmpty()) {
            return List.of();
        }

        List<float[]> embeddings = new ArrayList<>(texts.size());
        List<String> toCompute = new ArrayList<>();
        List<Integer> computeIndexes = new ArrayList<>();
        List<EmbeddingCacheKey> computeKeys = new ArrayList<>();

        for (int textIndex = 0; textIndex < texts.size(); textIndex++) {
            String text = texts.get(textIndex);
            EmbeddingCacheKey key = keyFor(text);
            Optional<CachedEmbedding> cached = cache.tryGet(key);
            if (cached.isPresent()) {
                embeddings.add(cached.get().vector());
            } else {
                embeddings.add(null);
                toCompute.add(text);
                computeIndexes.add(textIndex);
                computeKeys.add(key);
            }
        }

        if (toCompute.isEmpty()) {
            CACHE_LOG.debug("All {} embeddings served from cache", texts.size());
            return embeddings;
        }

        CACHE_LOG.info("Computing {} of {} embeddings via {}/{}",
                toCompute.size(), texts.size(), delegate.providerName(), delegate.modelName());
        List<float[]> computed = delegate.embed(toCompute);
        if (computed.size() != toCompute.size()) {
            throw new EmbeddingServiceUnavailableException("Embedding provider returned " + computed.size()
                    + " vectors for " + toCompute.size() + " inputs");
        }

        for (int computedIndex = 0; computedIndex < computed.size(); computedIndex++) {
            float[] vector = computed.get(computedIndex);
            embeddings.set(computeIndexes.get(computedIndex), vector);
            cache.store(
                    computeKeys.get(computedIndex),
                    vector,
                    OptionalInt.of(tokenCounter.countTokens(toCompute.get(computedIndex))));
        }
        return embeddings;
    }

    @Override
    public int dimensions() {
        return delegate.dimensions();
    }

    @Override
    public String providerName() {
        return delegate.providerName();
    }

    @Override
    public String modelName() {
        return delegate.modelName();
    }

    EmbeddingCacheKey keyFor(String text) {
        return EmbeddingCacheKey.forText(
                delegate.providerName(), delegate.modelName(), delegate.dimensions(), normalizedVectors, text, hasher);
    }
}
