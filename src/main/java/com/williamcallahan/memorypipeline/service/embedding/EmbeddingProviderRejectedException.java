package com.williamcallahan.memorypipeline.service.embedding;

/**
 * The embedding provider rejected the request in a way retrying will not fix (bad input, auth, model).
 */
public class EmbeddingProviderRejectedException extends RuntimeException {

    public EmbeddingProviderRejectedException(String message) {
        super(message);
    }

    public EmbeddingProviderRejectedException(String message, Throwable cause) {
        super(message, cause);
    }
}
