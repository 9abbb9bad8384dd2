package com.williamcallahan.memorypipeline.service;

import com.williamcallahan.memorypipeline.config.AppProperties;
import com.williamcallahan.memorypipeline.domain.pipeline.PipelineStatus;
import com.williamcallahan.memorypipeline.service.embedding.EmbeddingClient;
import com.williamcallahan.memorypipeline.service.memory.MemoryDb;
import com.williamcallahan.memorypipeline.service.pipeline.DocumentUpload;
import com.williamcallahan.memorypipeline.service.pipeline.PipelineOrchestrator;
import com.williamcallahan.memorypipeline.service.pipeline.UploadedFile;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Entry point for applications embedding the pipeline: upload documents, poll their readiness and
 * search the resulting memory records.
 *
 * <p>Uploads return as soon as the files are stored and the first step is queued; processing happens on
 * the background workers. Poll {@link #isReady(String)} or {@link #status(String)} to follow it.
 */
@Service
public class MemoryIngestionService {
    private static final Logger log = LoggerFactory.getLogger(MemoryIngestionService.class);

    private final PipelineOrchestrator orchestrator;
    private final EmbeddingClient embeddingClient;
    private final MemoryDb memoryDb;
    private final AppProperties.Embeddings embeddingSettings;

    public MemoryIngestionService(
            PipelineOrchestrator orchestrator,
            EmbeddingClient embeddingClient,
            MemoryDb memoryDb,
            AppProperties appProperties) {
        this.orchestrator = Objects.requireNonNull(orchestrator, "orchestrator");
        this.embeddingClient = Objects.requireNonNull(embeddingClient, "embeddingClient");
        this.memoryDb = Objects.requireNonNull(memoryDb, "memoryDb");
        this.embeddingSettings = appProperties.getEmbeddings();
    }

    /**
     * Schedules ingestion of an upload.
     *
     * @return document id
     */
    public String upload(DocumentUpload upload) {
        return orchestrator.schedule(upload);
    }

    public String uploadText(String index, String documentId, String text, Map<String, String> tags) {
        return upload(DocumentUpload.of(index, documentId, UploadedFile.ofText(text)).withTags(tags));
    }

    /**
     * Reads a local file and schedules its ingestion.
     *
     * @throws IOException if the file cannot be read
     */
    public String uploadFile(String index, String documentId, Path file, Map<String, String> tags)
            throws IOException {
        byte[] content = Files.readAllBytes(file);
        String fileName = file.getFileName().toString();
        log.debug("Uploading {} ({} bytes) as document {}", fileName, content.length, documentId);
        return upload(DocumentUpload.of(index, documentId, UploadedFile.of(fileName, content)).withTags(tags));
    }

    /**
     * Schedules ingestion of a web page. The page is downloaded by the extraction step.
     */
    public String uploadUrl(String index, String documentId, String url, Map<String, String> tags) {
        return upload(DocumentUpload.of(index, documentId, UploadedFile.ofUrl(url)).withTags(tags));
    }

    public boolean isReady(String documentId) {
        return orchestrator.isReady(documentId);
    }

    public Optional<PipelineStatus> status(String documentId) {
        return orchestrator.status(documentId);
    }

    public int cancel(String documentId) {
        return orchestrator.cancel(documentId);
    }

    public String deleteDocument(String index, String documentId) {
        return orchestrator.deleteDocument(index, documentId);
    }

    public String deleteIndex(String index) {
        return orchestrator.deleteIndex(index);
    }

    /**
     * Finds the memory records of an index closest to a query.
     *
     * @param index index to search
     * @param query query text, embedded with the same provider as the records
     * @param minRelevance minimum cosine similarity, between -1 and 1
     * @param limit maximum number of results
     * @return matches, best first
     * @throws IllegalStateException if embedding generation is disabled
     */
    public List<MemoryDb.ScoredMemoryRecord> search(String index, String query, double minRelevance, int limit) {
        if (!embeddingSettings.isEnabled()) {
            throw new IllegalStateException("Search requires app.embeddings.enabled=true");
        }
        if (query == null || query.isBlank() || limit <= 0) {
            return List.of();
        }
        return memoryDb.search(index, embeddingClient.embed(query), minRelevance, limit);
    }
}
