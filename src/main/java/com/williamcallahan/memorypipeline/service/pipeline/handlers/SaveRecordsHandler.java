package com.williamcallahan.memorypipeline.service.pipeline.handlers;

import com.williamcallahan.memorypipeline.config.AppProperties;
import com.williamcallahan.memorypipeline.domain.memory.MemoryRecord;
import com.williamcallahan.memorypipeline.domain.pipeline.ArtifactType;
import com.williamcallahan.memorypipeline.domain.pipeline.FileRecord;
import com.williamcallahan.memorypipeline.domain.pipeline.GeneratedFileDescriptor;
import com.williamcallahan.memorypipeline.domain.pipeline.Pipeline;
import com.williamcallahan.memorypipeline.service.embedding.EmbeddingClient;
import com.williamcallahan.memorypipeline.service.memory.MemoryDb;
import com.williamcallahan.memorypipeline.service.storage.DocumentStorage;
import com.williamcallahan.memorypipeline.service.storage.StorageJson;
import com.williamcallahan.memorypipeline.support.FailureClassifier;
import java.io.IOException;
import java.time.Clock;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Writes one memory record per partition, then removes records this document no longer produces.
 *
 * <p>Record ids are derived from the document and partition names, so saving again overwrites instead of
 * duplicating. Records left behind by a superseded execution, or by a partition that no longer exists,
 * are deleted once every current partition is saved.
 */
@Component
public class SaveRecordsHandler implements StepHandler {
    private static final Logger log = LoggerFactory.getLogger(SaveRecordsHandler.class);

    private final DocumentStorage storage;
    private final MemoryDb memoryDb;
    private final EmbeddingClient embeddingClient;
    private final StorageJson json;
    private final Clock clock;
    private final AppProperties.Embeddings settings;

    public SaveRecordsHandler(
            DocumentStorage storage,
            MemoryDb memoryDb,
            EmbeddingClient embeddingClient,
            StorageJson json,
            Clock clock,
            AppProperties appProperties) {
        this.storage = Objects.requireNonNull(storage, "storage");
        this.memoryDb = Objects.requireNonNull(memoryDb, "memoryDb");
        this.embeddingClient = Objects.requireNonNull(embeddingClient, "embeddingClient");
        this.json = Objects.requireNonNull(json, "json");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.settings = appProperties.getEmbeddings();
    }

    @Override
    public String stepName() {
        return PipelineSteps.SAVE_RECORDS;
    }

    @Override
    public HandlerResult invoke(Pipeline pipeline) {
        Pipeline current = pipeline;
        try {
            memoryDb.createIndex(pipeline.ownerScope(), embeddingClient.dimensions());
            for (FileRecord file : pipeline.files()) {
                FileRecord updated = file;
                for (GeneratedFileDescriptor partition : file.generatedFilesOfType(ArtifactType.TEXT_PARTITION)) {
                    if (partition.alreadyProcessedBy(stepName())) {
                        continue;
                    }
                    Optional<float[]> vector = vectorFor(current, file, partition);
                    if (settings.isEnabled() && vector.isEmpty()) {
                        return HandlerResult.permanentFailure(current,
                                "No embedding found for partition " + partition.name());
                    }
                    memoryDb.upsert(current.ownerScope(), toRecord(current, file, partition, vector.orElse(null)));
                    updated = updated.withGeneratedFile(partition.markProcessedBy(stepName()));
                }
                current = current.withFile(updated);
            }
            int purged = purgeObsoleteRecords(current);
            if (purged > 0) {
                log.info("[PIPELINE] Removed {} obsolete record(s) of document {}", purged, current.id());
            }
            return HandlerResult.success(current.withPreviousExecutionRecordIds(List.of()));
        } catch (IOException ioException) {
            return HandlerResult.transientFailure(current, FailureClassifier.describe(ioException));
        }
    }

    private Optional<float[]> vectorFor(Pipeline pipeline, FileRecord file, GeneratedFileDescriptor partition)
            throws IOException {
        if (!settings.isEnabled()) {
            return Optional.empty();
        }
        String expectedName = GenerateEmbeddingsHandler.embeddingFileName(
                partition.name(), embeddingClient.providerName(), embeddingClient.modelName());
        if (!file.hasGeneratedFile(expectedName)) {
            return Optional.empty();
        }
        GenerateEmbeddingsHandler.EmbeddingFileContent content = json.read(
                storage.readText(pipeline.ownerScope(), pipeline.id(), expectedName),
                GenerateEmbeddingsHandler.EmbeddingFileContent.class);
        return Optional.ofNullable(content.vector());
    }

    private MemoryRecord toRecord(
            Pipeline pipeline, FileRecord file, GeneratedFileDescriptor partition, float[] vector) throws IOException {
        Map<String, String> tags = new LinkedHashMap<>(pipeline.tags());
        tags.put(MemoryRecord.DOCUMENT_ID_TAG, pipeline.id());
        tags.put(MemoryRecord.FILE_ID_TAG, file.name());
        tags.put(MemoryRecord.FILE_TYPE_TAG, file.mimeType());
        tags.put(MemoryRecord.FILE_PARTITION_TAG, partition.name());

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(MemoryRecord.TEXT_FIELD, storage.readText(pipeline.ownerScope(), pipeline.id(), partition.name()));
        payload.put(MemoryRecord.FILE_NAME_FIELD, file.name());
        payload.put(MemoryRecord.PAGE_NUMBER_FIELD, partition.sectionNumber());
        payload.put(MemoryRecord.LAST_UPDATE_FIELD, clock.instant().toString());
        if (vector != null) {
            payload.put(MemoryRecord.VECTOR_PROVIDER_FIELD, embeddingClient.providerName());
            payload.put(MemoryRecord.VECTOR_GENERATOR_FIELD, embeddingClient.modelName());
        }
        return new MemoryRecord(pipeline.recordId(partition.name()), vector, tags, payload);
    }

    private int purgeObsoleteRecords(Pipeline pipeline) {
        Set<String> current = new HashSet<>(pipeline.recordIds());
        Set<String> obsolete = new HashSet<>();
        for (String previousId : pipeline.previousExecutionRecordIds()) {
            if (!current.contains(previousId)) {
                obsolete.add(previousId);
            }
        }
        for (MemoryRecord stored : memoryDb.getList(pipeline.ownerScope(), pipeline.id())) {
            if (!current.contains(stored.id())) {
                obsolete.add(stored.id());
            }
        }
        for (String recordId : obsolete) {
            memoryDb.delete(pipeline.ownerScope(), recordId);
        }
        return obsolete.size();
    }
}
