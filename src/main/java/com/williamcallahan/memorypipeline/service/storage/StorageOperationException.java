package com.williamcallahan.memorypipeline.service.storage;

/**
 * Raised when durable pipeline state cannot be read or written.
 */
public class StorageOperationException extends RuntimeException {

    public StorageOperationException(String message, Throwable cause) {
        super(message, cause);
    }
}
