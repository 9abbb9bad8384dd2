package com.williamcallahan.memorypipeline.service.pipeline.handlers;

import com.williamcallahan.memorypipeline.domain.pipeline.Pipeline;
import java.util.Objects;

/**
 * Outcome of a step together with the pipeline as the handler left it.
 */
public sealed interface HandlerResult
        permits HandlerResult.Success, HandlerResult.TransientFailure, HandlerResult.PermanentFailure {

    Pipeline pipeline();

    static HandlerResult success(Pipeline pipeline) {
        return new Success(pipeline);
    }

    static HandlerResult transientFailure(Pipeline pipeline, String reason) {
        return new TransientFailure(pipeline, reason);
    }

    static HandlerResult permanentFailure(Pipeline pipeline, String reason) {
        return new PermanentFailure(pipeline, reason);
    }

    record Success(Pipeline pipeline) implements HandlerResult {
        public Success {
            Objects.requireNonNull(pipeline, "pipeline");
        }
    }

    /**
     * Worth retrying later: throttling, timeouts, busy storage.
     */
    record TransientFailure(Pipeline pipeline, String reason) implements HandlerResult {
        public TransientFailure {
            Objects.requireNonNull(pipeline, "pipeline");
            reason = reason == null || reason.isBlank() ? "Transient failure" : reason;
        }
    }

    /**
     * Retrying cannot help: unsupported or corrupt input, rejected requests.
     */
    record PermanentFailure(Pipeline pipeline, String reason) implements HandlerResult {
        public PermanentFailure {
            Objects.requireNonNull(pipeline, "pipeline");
            reason = reason == null || reason.isBlank() ? "Permanent failure" : reason;
        }
    }
}
