package com.williamcallahan.memorypipeline.service.memory;

import com.williamcallahan.memorypipeline.domain.memory.MemoryRecord;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process-local memory database with cosine-similarity search.
 *
 * <p>Indexes are created on first upsert. Records without a vector are stored but never returned by search.
 */
public class InMemoryMemoryDb implements MemoryDb {
    private static final Logger log = LoggerFactory.getLogger(InMemoryMemoryDb.class);

    private final Map<String, Map<String, MemoryRecord>> indexes = new ConcurrentHashMap<>();

    public InMemoryMemoryDb() {
        log.info("Using in-memory memory database");
    }

    @Override
    public void createIndex(String index, int vectorSize) {
        indexes.computeIfAbsent(index, ignored -> new ConcurrentHashMap<>());
    }

    @Override
    public String upsert(String index, MemoryRecord record) {
        indexes.computeIfAbsent(index, ignored -> new ConcurrentHashMap<>()).put(record.id(), record);
        return record.id();
    }

    @Override
    public List<MemoryRecord> getList(String index, String documentId) {
        Map<String, MemoryRecord> records = indexes.get(index);
        if (records == null) {
            return List.of();
        }
        return records.values().stream()
                .filter(record -> documentId.equals(record.documentId()))
                .toList();
    }

    @Override
    public List<ScoredMemoryRecord> search(String index, float[] queryVector, double minRelevance, int limit) {
        Map<String, MemoryRecord> records = indexes.get(index);
        if (records == null || records.isEmpty() || limit <= 0) {
            return List.of();
        }
        List<ScoredMemoryRecord> scored = new ArrayList<>();
        for (MemoryRecord record : records.values()) {
            if (record.vector().length != queryVector.length || record.vector().length == 0) {
                continue;
            }
            double similarity = cosineSimilarity(queryVector, record.vector());
            if (similarity >= minRelevance) {
                scored.add(new ScoredMemoryRecord(record, similarity));
            }
        }
        scored.sort(Comparator.comparingDouble(ScoredMemoryRecord::relevance).reversed());
        return scored.stream().limit(limit).toList();
    }

    @Override
    public void delete(String index, String recordId) {
        Map<String, MemoryRecord> records = indexes.get(index);
        if (records != null) {
            records.remove(recordId);
        }
    }

    @Override
    public void deleteIndex(String index) {
        if (indexes.remove(index) != null) {
            log.info("Deleted memory index {}", index);
        }
    }

    public int size(String index) {
        Map<String, MemoryRecord> records = indexes.get(index);
        return records == null ? 0 : records.size();
    }

    static double cosineSimilarity(float[] a, float[] b) {
        double dotProduct = 0.0;
        double normA = 0.0;
        double normB = 0.0;
        for (int i = 0; i < a.length; i++) {
            dotProduct += a[i] * b[i];
            normA += a[i] * a[i];
            normB += b[i] * b[i];
        }
        if (normA == 0.0 || normB == 0.0) {
            return 0.0;
        }
        return dotProduct / (Math.sqrt(normA) * Math.sqrt(normB));
    }
}
