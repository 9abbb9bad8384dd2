package com.williamcallahan.memorypipeline.service.pipeline.handlers;

import com.williamcallahan.memorypipeline.config.AppProperties;
import com.williamcallahan.memorypipeline.domain.pipeline.ArtifactType;
import com.williamcallahan.memorypipeline.domain.pipeline.FileRecord;
import com.williamcallahan.memorypipeline.domain.pipeline.GeneratedFileDescriptor;
import com.williamcallahan.memorypipeline.domain.pipeline.Pipeline;
import com.williamcallahan.memorypipeline.service.embedding.EmbeddingClient;
import com.williamcallahan.memorypipeline.service.embedding.EmbeddingProviderRejectedException;
import com.williamcallahan.memorypipeline.service.embedding.EmbeddingServiceUnavailableException;
import com.williamcallahan.memorypipeline.service.extraction.MimeTypes;
import com.williamcallahan.memorypipeline.service.storage.DocumentStorage;
import com.williamcallahan.memorypipeline.service.storage.StorageJson;
import com.williamcallahan.memorypipeline.support.ContentHasher;
import com.williamcallahan.memorypipeline.support.FailureClassifier;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Computes one embedding per partition and stores it as
 * {@code {partition}.{provider}.{model}.text_embedding}.
 *
 * <p>Partitions already marked as processed, or whose embedding file is already registered, are skipped.
 * Calls go through the caching client, so a retry after a partial failure only pays for the partitions
 * the provider has not embedded yet. Does nothing when embedding generation is disabled.
 */
@Component
public class GenerateEmbeddingsHandler implements StepHandler {
    private static final Logger log = LoggerFactory.getLogger(GenerateEmbeddingsHandler.class);

    private final DocumentStorage storage;
    private final EmbeddingClient embeddingClient;
    private final StorageJson json;
    private final ContentHasher hasher;
    private final AppProperties.Embeddings settings;

    public GenerateEmbeddingsHandler(
            DocumentStorage storage,
            EmbeddingClient embeddingClient,
            StorageJson json,
            ContentHasher hasher,
            AppProperties appProperties) {
        this.storage = Objects.requireNonNull(storage, "storage");
        this.embeddingClient = Objects.requireNonNull(embeddingClient, "embeddingClient");
        this.json = Objects.requireNonNull(json, "json");
        this.hasher = Objects.requireNonNull(hasher, "hasher");
        this.settings = appProperties.getEmbeddings();
    }

    /**
     * Content of an embedding file.
     */
    public record EmbeddingFileContent(
            String provider, String model, int dimensions, String sourceFileName, float[] vector) {}

    @Override
    public String stepName() {
        return PipelineSteps.GEN_EMBEDDINGS;
    }

    @Override
    public HandlerResult invoke(Pipeline pipeline) {
        if (!settings.isEnabled()) {
            log.debug("[EMBEDDING] Embedding generation disabled, skipping document {}", pipeline.id());
            return HandlerResult.success(pipeline);
        }
        Pipeline current = pipeline;
        try {
            for (FileRecord file : pipeline.files()) {
                current = current.withFile(embedFile(current, file));
            }
            return HandlerResult.success(current);
        } catch (EmbeddingServiceUnavailableException unavailable) {
            log.warn("[EMBEDDING] Provider unavailable for document {}: {}", pipeline.id(), unavailable.getMessage());
            return HandlerResult.transientFailure(current, FailureClassifier.describe(unavailable));
        } catch (EmbeddingProviderRejectedException rejected) {
            log.warn("[EMBEDDING] Provider rejected document {}: {}", pipeline.id(), rejected.getMessage());
            return HandlerResult.permanentFailure(current, FailureClassifier.describe(rejected));
        } catch (IOException ioException) {
            return HandlerResult.transientFailure(current, FailureClassifier.describe(ioException));
        }
    }

    static String embeddingFileName(String partitionName, String provider, String model) {
        return partitionName + "." + provider + "." + model + ".text_embedding";
    }

    private FileRecord embedFile(Pipeline pipeline, FileRecord file) throws IOException {
        List<GeneratedFileDescriptor> pending = new ArrayList<>();
        FileRecord updated = file;
        for (GeneratedFileDescriptor partition : file.generatedFilesOfType(ArtifactType.TEXT_PARTITION)) {
            if (partition.alreadyProcessedBy(stepName())) {
                continue;
            }
            String embeddingName = embeddingFileName(
                    partition.name(), embeddingClient.providerName(), embeddingClient.modelName());
            if (file.hasGeneratedFile(embeddingName)) {
                updated = updated.withGeneratedFile(partition.markProcessedBy(stepName()));
                continue;
            }
            pending.add(partition);
        }

        int batchSize = Math.max(1, settings.getBatchSize());
        for (int start = 0; start < pending.size(); start += batchSize) {
            List<GeneratedFileDescriptor> batch = pending.subList(start, Math.min(pending.size(), start + batchSize));
            List<String> texts = new ArrayList<>(batch.size());
            for (GeneratedFileDescriptor partition : batch) {
                texts.add(storage.readText(pipeline.ownerScope(), pipeline.id(), partition.name()));
            }
            List<float[]> vectors = embeddingClient.embed(texts);
            if (vectors.size() != batch.size()) {
                throw new EmbeddingServiceUnavailableException("Expected " + batch.size()
                        + " embeddings but received " + vectors.size());
            }
            for (int index = 0; index < batch.size(); index++) {
                updated = writeEmbedding(pipeline, updated, batch.get(index), vectors.get(index));
            }
        }
        if (!pending.isEmpty()) {
            log.info("[EMBEDDING] Generated {} embedding(s) for {} with {}/{}",
                    pending.size(), file.name(), embeddingClient.providerName(), embeddingClient.modelName());
        }
        return updated;
    }

    private FileRecord writeEmbedding(
            Pipeline pipeline, FileRecord file, GeneratedFileDescriptor partition, float[] vector) throws IOException {
        String provider = embeddingClient.providerName();
        String model = embeddingClient.modelName();
        String name = embeddingFileName(partition.name(), provider, model);
        String content = json.write(new EmbeddingFileContent(provider, model, vector.length, partition.name(), vector));
        storage.writeText(pipeline.ownerScope(), pipeline.id(), name, content);

        GeneratedFileDescriptor embedding = GeneratedFileDescriptor.of(
                        name, file.name(), ArtifactType.TEXT_EMBEDDING_VECTOR, MimeTypes.TEXT_EMBEDDING_VECTOR,
                        content.getBytes(StandardCharsets.UTF_8).length, hasher.sha256(content))
                .withPartitionPosition(partition.partitionNumber(), partition.sectionNumber())
                .withSourcePartition(partition.name())
                .markProcessedBy(stepName());
        return file.withGeneratedFile(embedding).withGeneratedFile(partition.markProcessedBy(stepName()));
    }
}
