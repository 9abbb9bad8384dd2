package com.williamcallahan.memorypipeline.service.pipeline;

import com.williamcallahan.memorypipeline.service.pipeline.handlers.PipelineSteps;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A request to ingest files as one document.
 *
 * @param index index the document's records are written to
 * @param documentId document id; uploading again with the same id replaces the document
 * @param files files of the document
 * @param tags tags copied onto every memory record
 * @param steps steps to run, the default ingestion steps when empty
 */
public record DocumentUpload(
        String index, String documentId, List<UploadedFile> files, Map<String, String> tags, List<String> steps) {

    public static final String DEFAULT_INDEX = "default";

    public DocumentUpload {
        index = index == null || index.isBlank() ? DEFAULT_INDEX : index.trim();
        files = files == null ? List.of() : List.copyOf(files);
        tags = tags == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(tags));
        steps = steps == null || steps.isEmpty() ? PipelineSteps.DEFAULT_INGESTION : List.copyOf(steps);
    }

    public static DocumentUpload of(String index, String documentId, UploadedFile... files) {
        return new DocumentUpload(index, documentId, List.of(files), Map.of(), null);
    }

    public DocumentUpload withTags(Map<String, String> newTags) {
        return new DocumentUpload(index, documentId, files, newTags, steps);
    }

    public DocumentUpload withSteps(List<String> newSteps) {
        return new DocumentUpload(index, documentId, files, tags, newSteps);
    }
}
