package com.williamcallahan.memorypipeline.support;

import java.time.Duration;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Capped exponential backoff, used both for short in-process retries around provider calls and for the
 * delay before a failed queue operation becomes visible again.
 */
public final class RetrySupport {
    private static final Logger log = LoggerFactory.getLogger(RetrySupport.class);

    private static final double MULTIPLIER = 2.0;
    private static final int MAX_DOUBLINGS = 30;
    private static final Duration IN_PROCESS_BACKOFF_CAP = Duration.ofSeconds(30);

    private RetrySupport() {}

    /**
     * Delay after {@code failureCount} failures: {@code initial}, doubled per further failure, never above
     * {@code cap}. Zero before the first failure.
     */
    public static Duration backoffFor(int failureCount, Duration initial, Duration cap) {
        if (failureCount < 1) {
            return Duration.ZERO;
        }
        double millis = initial.toMillis() * Math.pow(MULTIPLIER, Math.min(failureCount - 1, MAX_DOUBLINGS));
        return millis >= cap.toMillis() ? cap : Duration.ofMillis((long) millis);
    }

    /**
     * Runs {@code operation}, retrying on the calling thread while {@link FailureClassifier} considers the
     * failure transient. The last failure is rethrown once {@code maxAttempts} is reached.
     */
    public static <T> T executeWithRetry(Supplier<T> operation, String operationName, int maxAttempts,
            Duration initialBackoff) {
        int attempt = 1;
        while (true) {
            try {
                return operation.get();
            } catch (RuntimeException failure) {
                if (!FailureClassifier.isTransient(failure)) {
                    log.warn("{} failed permanently on attempt {}", operationName, attempt);
                    throw failure;
                }
                if (attempt >= maxAttempts) {
                    log.error("{} still failing after {} attempts", operationName, attempt);
                    throw failure;
                }
                Duration backoff = backoffFor(attempt, initialBackoff, IN_PROCESS_BACKOFF_CAP);
                log.warn("{} failed on attempt {}/{}, retrying in {}ms",
                        operationName, attempt, maxAttempts, backoff.toMillis());
                pause(backoff);
                attempt++;
            }
        }
    }

    private static void pause(Duration backoff) {
        try {
            Thread.sleep(backoff.toMillis());
        } catch (InterruptedException interrupted) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting to retry", interrupted);
        }
    }
}
