package com.williamcallahan.memorypipeline.domain.pipeline;

/**
 * Kind of output a handler wrote next to an uploaded file.
 */
public enum ArtifactType {
    /** Plain text extracted from the upload, kept for inspection and the content record. */
    EXTRACTED_TEXT,
    /** Sectioned extraction (one section per page where the format has pages), input to partitioning. */
    EXTRACTED_CONTENT,
    /** One bounded partition of extracted text. */
    TEXT_PARTITION,
    /** Embedding vector JSON for one partition. */
    TEXT_EMBEDDING_VECTOR
}
