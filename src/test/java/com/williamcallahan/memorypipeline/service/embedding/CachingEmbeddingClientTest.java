package com.williamcallahan.memorypipeline.service.embedding;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.williamcallahan.memorypipeline.support.ContentHasher;
import com.williamcallahan.memorypipeline.support.MutableClock;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Verifies that the caching client only sends cache misses to the provider.
 */
class CachingEmbeddingClientTest {

    @TempDir
    Path tempDir;

    private EmbeddingClient provider;
    private EmbeddingCacheService cache;

    @BeforeEach
    void setUp() {
        provider = mock(EmbeddingClient.class);
        when(provider.providerName()).thenReturn("openai");
        when(provider.modelName()).thenReturn("small");
        when(provider.dimensions()).thenReturn(2);
        cache = newCache(EmbeddingCacheMode.READ_WRITE);
    }

    @Test
    void secondCallIsServedFromCache() {
        when(provider.embed(List.of("alpha"))).thenReturn(List.of(new float[] {1f, 0f}));
        CachingEmbeddingClient client = newClient(cache);

        float[] first = client.embed(List.of("alpha")).get(0);
        float[] second = client.embed(List.of("alpha")).get(0);

        assertArrayEquals(first, second);
        verify(provider, times(1)).embed(anyList());
    }

    @Test
    void onlyMissesAreSentToProviderAndOrderIsPreserved() {
        when(provider.embed(List.of("alpha"))).thenReturn(List.of(new float[] {1f, 0f}));
        when(provider.embed(List.of("beta"))).thenReturn(List.of(new float[] {0f, 1f}));
        CachingEmbeddingClient client = newClient(cache);
        client.embed(List.of("alpha"));

        List<float[]> vectors = client.embed(List.of("beta", "alpha"));

        assertArrayEquals(new float[] {0f, 1f}, vectors.get(0));
        assertArrayEquals(new float[] {1f, 0f}, vectors.get(1));
        verify(provider).embed(List.of("beta"));
    }

    @Test
    void readOnlyCacheNeverLearnsNewVectors() {
        when(provider.embed(List.of("alpha"))).thenReturn(List.of(new float[] {1f, 0f}));
        CachingEmbeddingClient client = newClient(newCache(EmbeddingCacheMode.READ_ONLY));

        client.embed(List.of("alpha"));
        client.embed(List.of("alpha"));

        verify(provider, times(2)).embed(List.of("alpha"));
    }

    @Test
    void providerFailureIsPropagatedAndNothingIsCached() {
        when(provider.embed(List.of("alpha"))).thenThrow(new EmbeddingServiceUnavailableException("HTTP 429"));
        CachingEmbeddingClient client = newClient(cache);

        assertThrows(EmbeddingServiceUnavailableException.class, () -> client.embed(List.of("alpha")));
        assertEquals(0, cache.getStats().cacheWrites());
    }

    @Test
    void emptyInputSkipsProvider() {
        assertEquals(List.of(), newClient(cache).embed(List.of()));
        verify(provider, never()).embed(anyList());
    }

    private CachingEmbeddingClient newClient(EmbeddingCache embeddingCache) {
        return new CachingEmbeddingClient(provider, embeddingCache, new ContentHasher(),
                text -> text.split("\\s+").length, false);
    }

    private EmbeddingCacheService newCache(EmbeddingCacheMode mode) {
        EmbeddingCacheService service = new EmbeddingCacheService(
                tempDir.resolve("cache.db"), mode, MutableClock.startingAt("2026-01-01T00:00:00Z"));
        service.initializeCache();
        return service;
    }
}
