package com.williamcallahan.memorypipeline.service.queue;

import com.williamcallahan.memorypipeline.domain.queue.Operation;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable, crash-recoverable work queue with per-operation locks.
 *
 * <p>Methods that settle a claimed operation take the {@link Operation} returned by {@link #claim(int)}.
 * Its {@code lastAttemptTimestamp} identifies the claim; settling with a stale claim raises
 * {@link LockContentionAnomaly} unless the operation is already complete.
 */
public interface OperationQueue {

    /**
     * Stores the operation unless one with the same id already exists.
     *
     * @return true if the operation was inserted
     */
    boolean enqueue(Operation operation);

    /**
     * Locks and returns up to {@code batchSize} runnable operations.
     */
    List<Operation> claim(int batchSize);

    void complete(Operation claimed);

    /**
     * Unlocks the operation without recording a failure.
     */
    void release(Operation claimed);

    /**
     * Records a failure and makes the operation claimable again from {@code notBefore}.
     */
    void requeue(Operation claimed, String reason, Instant notBefore);

    /**
     * Records a failure and moves the operation to the poison queue.
     */
    void toPoison(Operation claimed, String reason);

    /**
     * Moves the operation to the poison queue regardless of who holds its lock.
     */
    void forcePoison(String operationId, String reason);

    /**
     * Marks every outstanding operation of the pipeline cancelled.
     *
     * @return number of operations cancelled
     */
    int cancelAll(String contentId);

    Optional<Operation> find(String operationId);

    /**
     * All operations of a pipeline, oldest first.
     */
    List<Operation> findByContent(String contentId);

    boolean isCancelled(String operationId);

    boolean isPoisoned(Operation operation);
}
