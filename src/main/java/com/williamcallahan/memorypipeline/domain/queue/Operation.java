package com.williamcallahan.memorypipeline.domain.queue;

import com.williamcallahan.memorypipeline.domain.pipeline.Pipeline;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * One queued, lockable unit of pipeline advancement: running {@link #currentStep()} for a pipeline.
 *
 * <p>While {@code lastAttemptTimestamp} is present and the operation is not complete, it is locked,
 * either by a worker that is executing it or by one that crashed, until the lock expires. The
 * timestamp value is also the claim token: only the holder of that exact value may complete,
 * requeue or poison the operation.
 *
 * @param id stable id, derived from the execution and step position so enqueueing is idempotent
 * @param contentId pipeline (document) id
 * @param executionId execution of the pipeline this operation belongs to
 * @param queueName queue currently holding the operation; the poison queue once poisoned
 * @param plannedSteps pipeline steps at enqueue time
 * @param completedSteps steps already completed at enqueue time
 * @param remainingSteps steps remaining at enqueue time; the first one is executed by this operation
 * @param complete true once the step was executed and the pipeline advanced
 * @param cancelled true once the pipeline was cancelled or superseded
 * @param failureCount number of failed attempts
 * @param lastFailureReason reason of the last failed attempt
 * @param lastAttemptTimestamp lock timestamp of the current claim
 * @param notBefore earliest time a requeued operation may be claimed again
 * @param timestamp creation time
 */
public record Operation(
        String id,
        String contentId,
        String executionId,
        String queueName,
        List<String> plannedSteps,
        List<String> completedSteps,
        List<String> remainingSteps,
        boolean complete,
        boolean cancelled,
        int failureCount,
        Optional<String> lastFailureReason,
        Optional<Instant> lastAttemptTimestamp,
        Optional<Instant> notBefore,
        Instant timestamp) {

    public Operation {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(contentId, "contentId");
        Objects.requireNonNull(executionId, "executionId");
        Objects.requireNonNull(queueName, "queueName");
        Objects.requireNonNull(timestamp, "timestamp");
        plannedSteps = List.copyOf(plannedSteps);
        completedSteps = List.copyOf(completedSteps);
        remainingSteps = List.copyOf(remainingSteps);
        if (remainingSteps.isEmpty()) {
            throw new IllegalArgumentException("Operation " + id + " has no step to execute");
        }
        lastFailureReason = lastFailureReason == null ? Optional.empty() : lastFailureReason;
        lastAttemptTimestamp = lastAttemptTimestamp == null ? Optional.empty() : lastAttemptTimestamp;
        notBefore = notBefore == null ? Optional.empty() : notBefore;
    }

    /**
     * Creates the pending operation that executes the pipeline's current step.
     */
    public static Operation forCurrentStep(Pipeline pipeline, String queueName, Instant now) {
        return new Operation(
                idFor(pipeline.executionId(), pipeline.completedSteps().size()),
                pipeline.id(),
                pipeline.executionId(),
                queueName,
                pipeline.plannedSteps(),
                pipeline.completedSteps(),
                pipeline.remainingSteps(),
                false,
                false,
                0,
                Optional.empty(),
                Optional.empty(),
                Optional.empty(),
                now);
    }

    public static String idFor(String executionId, int stepPosition) {
        return executionId + "." + stepPosition;
    }

    public String currentStep() {
        return remainingSteps.get(0);
    }

    public boolean isLocked() {
        return !complete && lastAttemptTimestamp.isPresent();
    }
}
