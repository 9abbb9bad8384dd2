package com.williamcallahan.memorypipeline.service.pipeline.handlers;

import com.williamcallahan.memorypipeline.domain.pipeline.Pipeline;
import com.williamcallahan.memorypipeline.service.memory.MemoryDb;
import com.williamcallahan.memorypipeline.service.storage.ContentStore;
import com.williamcallahan.memorypipeline.service.storage.DocumentStorage;
import com.williamcallahan.memorypipeline.service.storage.PipelineStore;
import com.williamcallahan.memorypipeline.support.FailureClassifier;
import java.io.IOException;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Drops an entire index: memory records, stored files, content records and the pipelines of its documents.
 *
 * <p>The pipeline running this step belongs to the index too; it is kept so its completion can be recorded.
 */
@Component
public class DeleteIndexHandler implements StepHandler {
    private static final Logger log = LoggerFactory.getLogger(DeleteIndexHandler.class);

    private final MemoryDb memoryDb;
    private final DocumentStorage storage;
    private final ContentStore contentStore;
    private final PipelineStore pipelineStore;

    public DeleteIndexHandler(
            MemoryDb memoryDb, DocumentStorage storage, ContentStore contentStore, PipelineStore pipelineStore) {
        this.memoryDb = Objects.requireNonNull(memoryDb, "memoryDb");
        this.storage = Objects.requireNonNull(storage, "storage");
        this.contentStore = Objects.requireNonNull(contentStore, "contentStore");
        this.pipelineStore = Objects.requireNonNull(pipelineStore, "pipelineStore");
    }

    @Override
    public String stepName() {
        return PipelineSteps.DELETE_INDEX;
    }

    @Override
    public HandlerResult invoke(Pipeline pipeline) {
        String index = pipeline.ownerScope();
        memoryDb.deleteIndex(index);
        try {
            storage.deleteIndex(index);
        } catch (IOException ioException) {
            return HandlerResult.transientFailure(pipeline, FailureClassifier.describe(ioException));
        }
        int contentRecords = contentStore.deleteIndex(index);
        int pipelines = pipelineStore.deleteByScopeExcept(index, pipeline.id());
        log.info("[PIPELINE] Deleted index {} ({} content record(s), {} pipeline(s))", index, contentRecords, pipelines);
        return HandlerResult.success(pipeline);
    }
}
