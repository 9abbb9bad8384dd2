package com.williamcallahan.memorypipeline.service.memory;

import com.williamcallahan.memorypipeline.domain.memory.MemoryRecord;
import java.util.List;

/**
 * Vector database port used by the save and delete steps.
 *
 * <p>Upserts and deletes are keyed by record id, so repeating them is harmless.
 */
public interface MemoryDb {

    void createIndex(String index, int vectorSize);

    /**
     * @return id of the stored record
     */
    String upsert(String index, MemoryRecord record);

    /**
     * Records of one document, in no particular order.
     */
    List<MemoryRecord> getList(String index, String documentId);

    /**
     * Records most similar to {@code queryVector}, best first.
     */
    List<ScoredMemoryRecord> search(String index, float[] queryVector, double minRelevance, int limit);

    void delete(String index, String recordId);

    void deleteIndex(String index);

    /**
     * A search hit with its cosine similarity.
     */
    record ScoredMemoryRecord(MemoryRecord record, double relevance) {}
}
