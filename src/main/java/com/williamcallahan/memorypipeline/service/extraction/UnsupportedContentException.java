package com.williamcallahan.memorypipeline.service.extraction;

/**
 * Content that no decoder can turn into text. Retrying will not help.
 */
public class UnsupportedContentException extends RuntimeException {

    public UnsupportedContentException(String message) {
        super(message);
    }

    public UnsupportedContentException(String message, Throwable cause) {
        super(message, cause);
    }
}
