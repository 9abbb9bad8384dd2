package com.williamcallahan.memorypipeline.service.embedding;

public enum EmbeddingCacheMode {
    READ_WRITE,
    /** Lookups only; stores are ignored. */
    READ_ONLY,
    /** Stores only; lookups always miss. */
    WRITE_ONLY;

    public boolean canRead() {
        return this != WRITE_ONLY;
    }

    public boolean canWrite() {
        return this != READ_ONLY;
    }
}
