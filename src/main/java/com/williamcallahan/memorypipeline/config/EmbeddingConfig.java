package com.williamcallahan.memorypipeline.config;

import com.williamcallahan.memorypipeline.service.chunking.TokenCounter;
import com.williamcallahan.memorypipeline.service.embedding.CachingEmbeddingClient;
import com.williamcallahan.memorypipeline.service.embedding.EmbeddingCache;
import com.williamcallahan.memorypipeline.service.embedding.EmbeddingCacheService;
import com.williamcallahan.memorypipeline.service.embedding.EmbeddingClient;
import com.williamcallahan.memorypipeline.service.embedding.LocalHashingEmbeddingClient;
import com.williamcallahan.memorypipeline.service.embedding.OpenAiCompatibleEmbeddingClient;
import com.williamcallahan.memorypipeline.support.ContentHasher;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Locale;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Embedding provider configuration.
 *
 * <p>The provider is selected from {@code app.embeddings.provider} with no runtime fallback, so a
 * misconfigured provider fails at startup instead of silently producing vectors from another model.
 * When the embedding cache is enabled, the provider is wrapped so repeated texts are embedded once.</p>
 */
@Configuration
public class EmbeddingConfig {
    private static final Logger log = LoggerFactory.getLogger(EmbeddingConfig.class);
    private static final String OPENAI_PROVIDER = "openai";

    /**
     * Opens the persistent embedding cache.
     *
     * @param appProperties application configuration
     * @param clock clock used to timestamp entries
     * @return cache backed by a SQLite file
     */
    @Bean
    @ConditionalOnProperty(name = "app.embedding-cache.enabled", havingValue = "true", matchIfMissing = true)
    public EmbeddingCacheService embeddingCache(AppProperties appProperties, Clock clock) {
        AppProperties.EmbeddingCache settings = appProperties.getEmbeddingCache();
        return new EmbeddingCacheService(Path.of(settings.getDatabasePath()), settings.getMode(), clock);
    }

    /**
     * Creates the embedding client used by the pipeline and by search.
     *
     * @param appProperties application configuration
     * @param cache embedding cache, absent when disabled
     * @param hasher content hasher for cache keys
     * @param tokenCounter token counter recorded with cached entries
     * @return embedding client for the configured provider
     */
    @Bean
    public EmbeddingClient embeddingClient(
            AppProperties appProperties,
            ObjectProvider<EmbeddingCache> cache,
            ContentHasher hasher,
            TokenCounter tokenCounter) {
        AppProperties.Embeddings settings = Objects.requireNonNull(appProperties, "appProperties").getEmbeddings();
        EmbeddingClient provider = providerClient(settings);
        EmbeddingCache embeddingCache = cache.getIfAvailable();
        if (embeddingCache == null) {
            log.info("[EMBEDDING] Embedding cache disabled");
            return provider;
        }
        return new CachingEmbeddingClient(provider, embeddingCache, hasher, tokenCounter, settings.isNormalized());
    }

    private static EmbeddingClient providerClient(AppProperties.Embeddings settings) {
        String provider = settings.getProvider().trim().toLowerCase(Locale.ROOT);
        if (OPENAI_PROVIDER.equals(provider)) {
            log.info("[EMBEDDING] Using OpenAI-compatible provider (model={}, urlId={})",
                    settings.getModel(), Integer.toHexString(Objects.hashCode(settings.getBaseUrl())));
            return OpenAiCompatibleEmbeddingClient.create(
                    settings.getBaseUrl(), settings.getApiKey(), settings.getModel(), settings.getDimensions());
        }
        log.info("[EMBEDDING] Using local hashing provider ({} dimensions)", settings.getDimensions());
        return new LocalHashingEmbeddingClient(settings.getDimensions());
    }
}
