package com.williamcallahan.memorypipeline.service.chunking;

/**
 * Size bounds for partitioning.
 *
 * @param maxTokensPerLine upper bound for a single sentence-respecting line
 * @param maxTokensPerParagraph upper bound for a partition, overlap included
 * @param overlapTokens tokens of the previous partition repeated at the start of the next one
 */
public record ChunkerOptions(int maxTokensPerLine, int maxTokensPerParagraph, int overlapTokens) {

    public ChunkerOptions {
        if (maxTokensPerLine <= 0) {
            throw new IllegalArgumentException("maxTokensPerLine must be > 0");
        }
        if (maxTokensPerParagraph <= 0) {
            throw new IllegalArgumentException("maxTokensPerParagraph must be > 0");
        }
        if (overlapTokens < 0) {
            throw new IllegalArgumentException("overlapTokens must be >= 0");
        }
        if (overlapTokens >= maxTokensPerParagraph) {
            throw new IllegalArgumentException("overlapTokens must be less than maxTokensPerParagraph");
        }
        if (maxTokensPerLine > maxTokensPerParagraph) {
            throw new IllegalArgumentException("maxTokensPerLine cannot exceed maxTokensPerParagraph");
        }
    }
}
