package com.williamcallahan.memorypipeline.service.queue;

/**
 * A worker tried to settle an operation whose claim it no longer holds.
 *
 * <p>The atomic claim should make this unobservable. When it happens anyway the operation is poisoned.
 */
public class LockContentionAnomaly extends RuntimeException {
    private final String operationId;

    public LockContentionAnomaly(String operationId, String message) {
        super(message);
        this.operationId = operationId;
    }

    public String operationId() {
        return operationId;
    }
}
