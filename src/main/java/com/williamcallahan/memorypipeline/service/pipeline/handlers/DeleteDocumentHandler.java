package com.williamcallahan.memorypipeline.service.pipeline.handlers;

import com.williamcallahan.memorypipeline.domain.memory.MemoryRecord;
import com.williamcallahan.memorypipeline.domain.pipeline.Pipeline;
import com.williamcallahan.memorypipeline.service.memory.MemoryDb;
import com.williamcallahan.memorypipeline.service.storage.ContentStore;
import com.williamcallahan.memorypipeline.service.storage.DocumentStorage;
import com.williamcallahan.memorypipeline.support.FailureClassifier;
import java.io.IOException;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Removes a document's memory records, stored files and content record. Each removal tolerates
 * already-missing data.
 */
@Component
public class DeleteDocumentHandler implements StepHandler {
    private static final Logger log = LoggerFactory.getLogger(DeleteDocumentHandler.class);

    private final MemoryDb memoryDb;
    private final DocumentStorage storage;
    private final ContentStore contentStore;

    public DeleteDocumentHandler(MemoryDb memoryDb, DocumentStorage storage, ContentStore contentStore) {
        this.memoryDb = Objects.requireNonNull(memoryDb, "memoryDb");
        this.storage = Objects.requireNonNull(storage, "storage");
        this.contentStore = Objects.requireNonNull(contentStore, "contentStore");
    }

    @Override
    public String stepName() {
        return PipelineSteps.DELETE_DOCUMENT;
    }

    @Override
    public HandlerResult invoke(Pipeline pipeline) {
        List<MemoryRecord> records = memoryDb.getList(pipeline.ownerScope(), pipeline.id());
        for (MemoryRecord record : records) {
            memoryDb.delete(pipeline.ownerScope(), record.id());
        }
        try {
            storage.deleteDocument(pipeline.ownerScope(), pipeline.id());
        } catch (IOException ioException) {
            return HandlerResult.transientFailure(pipeline, FailureClassifier.describe(ioException));
        }
        contentStore.delete(pipeline.id());
        log.info("[PIPELINE] Deleted document {} from index {} ({} record(s))",
                pipeline.id(), pipeline.ownerScope(), records.size());
        return HandlerResult.success(pipeline);
    }
}
