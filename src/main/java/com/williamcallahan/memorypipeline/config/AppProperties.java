package com.williamcallahan.memorypipeline.config;

import com.williamcallahan.memorypipeline.service.chunking.ChunkerOptions;
import com.williamcallahan.memorypipeline.service.embedding.EmbeddingCacheMode;
import com.williamcallahan.memorypipeline.service.queue.QueueOptions;
import jakarta.annotation.PostConstruct;
import java.time.Duration;
import java.util.Locale;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Application settings bound from {@code app.*}.
 */
@Component
@ConfigurationProperties(prefix = "app")
public class AppProperties {
    private static final String POSITIVE_FMT = "%s must be greater than 0.";
    private static final String NON_BLANK_FMT = "%s must not be blank.";

    private Queue queue = new Queue();
    private Chunking chunking = new Chunking();
    private Embeddings embeddings = new Embeddings();
    private EmbeddingCache embeddingCache = new EmbeddingCache();
    private Storage storage = new Storage();
    private Worker worker = new Worker();

    /**
     * Fails startup on settings the pipeline cannot run with.
     */
    @PostConstruct
    public void validateConfiguration() {
        queue.toOptions();
        chunking.toOptions();
        embeddings.validate();
        embeddingCache.validate();
        storage.validate();
        worker.validate();
    }

    public Queue getQueue() { return queue; }
    public void setQueue(Queue queue) { this.queue = queue; }

    public Chunking getChunking() { return chunking; }
    public void setChunking(Chunking chunking) { this.chunking = chunking; }

    public Embeddings getEmbeddings() { return embeddings; }
    public void setEmbeddings(Embeddings embeddings) { this.embeddings = embeddings; }

    public EmbeddingCache getEmbeddingCache() { return embeddingCache; }
    public void setEmbeddingCache(EmbeddingCache embeddingCache) { this.embeddingCache = embeddingCache; }

    public Storage getStorage() { return storage; }
    public void setStorage(Storage storage) { this.storage = storage; }

    public Worker getWorker() { return worker; }
    public void setWorker(Worker worker) { this.worker = worker; }

    private static void requirePositive(String key, long value) {
        if (value <= 0) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, POSITIVE_FMT, key));
        }
    }

    private static void requireNonBlank(String key, String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(String.format(Locale.ROOT, NON_BLANK_FMT, key));
        }
    }

    /**
     * Operation queue and retry policy. Validation is delegated to {@link QueueOptions}.
     */
    public static class Queue {
        private String name = "pipelines";
        private String poisonQueueSuffix = "-poison";
        private long pollDelayMs = 100;
        private int fetchBatchSize = 3;
        private long lockDurationSeconds = 300;
        private int maxRetriesBeforePoison = 20;
        private long retryInitialDelayMs = 1000;
        private long retryMaxDelayMs = 30_000;

        public QueueOptions toOptions() {
            return new QueueOptions(
                    name,
                    poisonQueueSuffix,
                    Duration.ofMillis(pollDelayMs),
                    fetchBatchSize,
                    Duration.ofSeconds(lockDurationSeconds),
                    maxRetriesBeforePoison,
                    Duration.ofMillis(retryInitialDelayMs),
                    Duration.ofMillis(retryMaxDelayMs));
        }

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }

        public String getPoisonQueueSuffix() { return poisonQueueSuffix; }
        public void setPoisonQueueSuffix(String poisonQueueSuffix) { this.poisonQueueSuffix = poisonQueueSuffix; }

        public long getPollDelayMs() { return pollDelayMs; }
        public void setPollDelayMs(long pollDelayMs) { this.pollDelayMs = pollDelayMs; }

        public int getFetchBatchSize() { return fetchBatchSize; }
        public void setFetchBatchSize(int fetchBatchSize) { this.fetchBatchSize = fetchBatchSize; }

        public long getLockDurationSeconds() { return lockDurationSeconds; }
        public void setLockDurationSeconds(long lockDurationSeconds) { this.lockDurationSeconds = lockDurationSeconds; }

        public int getMaxRetriesBeforePoison() { return maxRetriesBeforePoison; }
        public void setMaxRetriesBeforePoison(int maxRetriesBeforePoison) {
            this.maxRetriesBeforePoison = maxRetriesBeforePoison;
        }

        public long getRetryInitialDelayMs() { return retryInitialDelayMs; }
        public void setRetryInitialDelayMs(long retryInitialDelayMs) { this.retryInitialDelayMs = retryInitialDelayMs; }

        public long getRetryMaxDelayMs() { return retryMaxDelayMs; }
        public void setRetryMaxDelayMs(long retryMaxDelayMs) { this.retryMaxDelayMs = retryMaxDelayMs; }
    }

    /**
     * Partition sizing, in tokens.
     */
    public static class Chunking {
        private int maxTokensPerLine = 300;
        private int maxTokensPerParagraph = 1000;
        private int overlapTokens = 100;

        public ChunkerOptions toOptions() {
            return new ChunkerOptions(maxTokensPerLine, maxTokensPerParagraph, overlapTokens);
        }

        public int getMaxTokensPerLine() { return maxTokensPerLine; }
        public void setMaxTokensPerLine(int maxTokensPerLine) { this.maxTokensPerLine = maxTokensPerLine; }

        public int getMaxTokensPerParagraph() { return maxTokensPerParagraph; }
        public void setMaxTokensPerParagraph(int maxTokensPerParagraph) {
            this.maxTokensPerParagraph = maxTokensPerParagraph;
        }

        public int getOverlapTokens() { return overlapTokens; }
        public void setOverlapTokens(int overlapTokens) { this.overlapTokens = overlapTokens; }
    }

    public static class Embeddings {
        private static final String DIMENSIONS_KEY = "app.embeddings.dimensions";
        private static final String BATCH_SIZE_KEY = "app.embeddings.batch-size";
        private static final String PROVIDER_KEY = "app.embeddings.provider";

        private boolean enabled = true;
        private String provider = "hash";
        private String model = "text-embedding-3-small";
        private int dimensions = 256;
        private int batchSize = 32;
        private String baseUrl = "https://api.openai.com/v1";
        private String apiKey = "";
        private boolean normalized = false;

        void validate() {
            requirePositive(DIMENSIONS_KEY, dimensions);
            requirePositive(BATCH_SIZE_KEY, batchSize);
            requireNonBlank(PROVIDER_KEY, provider);
            String normalizedProvider = provider.trim().toLowerCase(Locale.ROOT);
            if (!normalizedProvider.equals("hash") && !normalizedProvider.equals("openai")) {
                throw new IllegalArgumentException(PROVIDER_KEY + " must be 'hash' or 'openai' (got '" + provider + "').");
            }
            if (enabled && normalizedProvider.equals("openai")) {
                requireNonBlank("app.embeddings.model", model);
                requireNonBlank("app.embeddings.base-url", baseUrl);
                requireNonBlank("app.embeddings.api-key", apiKey);
            }
        }

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getProvider() { return provider; }
        public void setProvider(String provider) { this.provider = provider; }

        public String getModel() { return model; }
        public void setModel(String model) { this.model = model; }

        public int getDimensions() { return dimensions; }
        public void setDimensions(int dimensions) { this.dimensions = dimensions; }

        public int getBatchSize() { return batchSize; }
        public void setBatchSize(int batchSize) { this.batchSize = batchSize; }

        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

        public String getApiKey() { return apiKey; }
        public void setApiKey(String apiKey) { this.apiKey = apiKey; }

        public boolean isNormalized() { return normalized; }
        public void setNormalized(boolean normalized) { this.normalized = normalized; }
    }

    public static class EmbeddingCache {
        private boolean enabled = true;
        private EmbeddingCacheMode mode = EmbeddingCacheMode.READ_WRITE;
        private String databasePath = "data/embeddings_cache.db";

        void validate() {
            if (mode == null) {
                throw new IllegalArgumentException("app.embedding-cache.mode must be set.");
            }
            if (enabled) {
                requireNonBlank("app.embedding-cache.database-path", databasePath);
            }
        }

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public EmbeddingCacheMode getMode() { return mode; }
        public void setMode(EmbeddingCacheMode mode) { this.mode = mode; }

        public String getDatabasePath() { return databasePath; }
        public void setDatabasePath(String databasePath) { this.databasePath = databasePath; }
    }

    public static class Storage {
        private String databasePath = "data/pipelines.db";
        private String documentsDir = "data/documents";

        void validate() {
            requireNonBlank("app.storage.database-path", databasePath);
            requireNonBlank("app.storage.documents-dir", documentsDir);
        }

        public String getDatabasePath() { return databasePath; }
        public void setDatabasePath(String databasePath) { this.databasePath = databasePath; }

        public String getDocumentsDir() { return documentsDir; }
        public void setDocumentsDir(String documentsDir) { this.documentsDir = documentsDir; }
    }

    /**
     * Background queue polling.
     */
    public static class Worker {
        private boolean enabled = true;
        private int threads = 2;

        void validate() {
            requirePositive("app.worker.threads", threads);
        }

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public int getThreads() { return threads; }
        public void setThreads(int threads) { this.threads = threads; }
    }
}
