package com.williamcallahan.memorypipeline.service.pipeline;

/**
 * A pipeline definition was rejected before anything was scheduled. Never retried.
 */
public class InvalidPipelineException extends RuntimeException {

    public InvalidPipelineException(String message) {
        super(message);
    }
}
