package com.williamcallahan.memorypipeline.domain.pipeline;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Externally visible state of a document's ingestion, polled by clients.
 *
 * <p>{@code ready} stays false while the document is processing and after it was poisoned;
 * {@code poisoned} together with {@code lastFailureReason} tells the two apart.
 */
public record PipelineStatus(
        String documentId,
        String index,
        String executionId,
        boolean ready,
        boolean complete,
        boolean cancelled,
        boolean poisoned,
        List<String> completedSteps,
        List<String> remainingSteps,
        Optional<String> lastFailureReason,
        Instant lastUpdatedAt) {

    public PipelineStatus {
        completedSteps = List.copyOf(completedSteps);
        remainingSteps = List.copyOf(remainingSteps);
        lastFailureReason = lastFailureReason == null ? Optional.empty() : lastFailureReason;
    }
}
