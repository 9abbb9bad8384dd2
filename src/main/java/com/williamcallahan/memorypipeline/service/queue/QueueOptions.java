package com.williamcallahan.memorypipeline.service.queue;

import com.williamcallahan.memorypipeline.support.RetrySupport;
import java.time.Duration;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Queue and lock settings.
 *
 * @param queueName queue that holds runnable operations
 * @param poisonQueueSuffix appended to {@code queueName} to name the poison queue
 * @param pollDelay how long an idle worker waits before polling again
 * @param fetchBatchSize maximum operations claimed per poll
 * @param lockDuration how long a claim stays valid before another worker may reclaim the operation
 * @param maxRetriesBeforePoison failures tolerated before the next one poisons the operation
 * @param retryInitialDelay delay after the first failure
 * @param retryMaxDelay upper bound for any retry delay
 */
public record QueueOptions(
        String queueName,
        String poisonQueueSuffix,
        Duration pollDelay,
        int fetchBatchSize,
        Duration lockDuration,
        int maxRetriesBeforePoison,
        Duration retryInitialDelay,
        Duration retryMaxDelay) {

    public static final Duration MIN_LOCK_DURATION = Duration.ofSeconds(30);

    private static final Pattern POISON_SUFFIX_PATTERN =
            Pattern.compile("^[a-z0-9-]{1}(?!.*--)[a-z0-9-]{0,28}[a-z0-9]$");

    public QueueOptions {
        if (queueName == null || queueName.isBlank()) {
            throw new IllegalArgumentException("Queue name must not be blank");
        }
        if (poisonQueueSuffix == null || !POISON_SUFFIX_PATTERN.matcher(poisonQueueSuffix).matches()) {
            throw new IllegalArgumentException("Poison queue suffix '" + poisonQueueSuffix
                    + "' must be 2-30 lowercase letters, digits or single dashes, not ending with a dash");
        }
        Objects.requireNonNull(pollDelay, "pollDelay");
        Objects.requireNonNull(lockDuration, "lockDuration");
        Objects.requireNonNull(retryInitialDelay, "retryInitialDelay");
        Objects.requireNonNull(retryMaxDelay, "retryMaxDelay");
        if (pollDelay.isNegative() || pollDelay.isZero()) {
            throw new IllegalArgumentException("Poll delay must be positive");
        }
        if (fetchBatchSize < 1) {
            throw new IllegalArgumentException("Fetch batch size must be at least 1");
        }
        if (lockDuration.compareTo(MIN_LOCK_DURATION) < 0) {
            throw new IllegalArgumentException(
                    "Lock duration must be at least " + MIN_LOCK_DURATION.toSeconds() + " seconds");
        }
        if (maxRetriesBeforePoison < 0) {
            throw new IllegalArgumentException("Max retries before poison must not be negative");
        }
        if (retryInitialDelay.isNegative() || retryMaxDelay.compareTo(retryInitialDelay) < 0) {
            throw new IllegalArgumentException("Retry delays must satisfy 0 <= initial <= max");
        }
    }

    public static QueueOptions defaults() {
        return new QueueOptions("pipelines", "-poison", Duration.ofMillis(100), 3, Duration.ofSeconds(300), 20,
                Duration.ofMillis(1000), Duration.ofMillis(30_000));
    }

    public String poisonQueueName() {
        return queueName + poisonQueueSuffix;
    }

    /**
     * Delay before the operation may run again after its {@code failureCount}-th failure.
     */
    public Duration retryDelayFor(int failureCount) {
        return RetrySupport.backoffFor(failureCount, retryInitialDelay, retryMaxDelay);
    }

    /**
     * True once {@code failureCount} failures exceed the retry budget.
     */
    public boolean shouldPoison(int failureCount) {
        return failureCount > maxRetriesBeforePoison;
    }

    public QueueOptions withMaxRetriesBeforePoison(int maxRetries) {
        return new QueueOptions(queueName, poisonQueueSuffix, pollDelay, fetchBatchSize, lockDuration, maxRetries,
                retryInitialDelay, retryMaxDelay);
    }
}
