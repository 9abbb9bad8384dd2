package com.williamcallahan.memorypipeline.service.pipeline.handlers;

import java.util.List;

/**
 * Step names understood by the built-in handlers.
 */
public final class PipelineSteps {
    public static final String EXTRACT = "extract";
    public static final String PARTITION = "partition";
    public static final String GEN_EMBEDDINGS = "gen_embeddings";
    public static final String SAVE_RECORDS = "save_records";
    public static final String DELETE_DOCUMENT = "delete_document";
    public static final String DELETE_INDEX = "delete_index";

    /** Steps run for an upload when the caller does not choose them. */
    public static final List<String> DEFAULT_INGESTION = List.of(EXTRACT, PARTITION, GEN_EMBEDDINGS, SAVE_RECORDS);

    private PipelineSteps() {}
}
