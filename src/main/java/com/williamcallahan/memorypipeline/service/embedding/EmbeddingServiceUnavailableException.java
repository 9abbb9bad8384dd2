package com.williamcallahan.memorypipeline.service.embedding;

/**
 * Signals that the embedding provider is temporarily unable to serve requests.
 *
 * <p>Steps that hit this failure are retried later rather than poisoned.
 */
public class EmbeddingServiceUnavailableException extends RuntimeException {

    public EmbeddingServiceUnavailableException(String message) {
        super(message);
    }

    public EmbeddingServiceUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
