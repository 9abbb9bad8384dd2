package com.williamcallahan.memorypipeline.service.chunking;

/**
 * One partition produced by the chunker.
 *
 * @param number zero-based position in the document
 * @param pageNumber 1-based page (or section) of the partition's first line
 * @param text partition text, overlap prefix included
 */
public record TextPartition(int number, int pageNumber, String text) {}
