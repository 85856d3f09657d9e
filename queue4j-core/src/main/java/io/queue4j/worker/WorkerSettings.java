package io.queue4j.worker;

import java.time.Duration;
import java.util.Objects;

/**
 * Tuning knobs for a {@link Worker}.
 *
 * @param pollInterval       sleep between claims when no job is eligible
 * @param defaultTimeout     command timeout for jobs without their own; {@code null} means none
 * @param defaultBackoffBase backoff base used while {@code backoff_base} is not configured
 * @param writeAttempts      attempts for an outcome write before the job is left in processing
 * @param storeRetryDelay    first delay after a store failure; doubles up to {@link #MAX_STORE_RETRY_DELAY}
 */
public record WorkerSettings(
        Duration pollInterval,
        Duration defaultTimeout,
        double defaultBackoffBase,
        int writeAttempts,
        Duration storeRetryDelay
) {
    public static final Duration MAX_STORE_RETRY_DELAY = Duration.ofSeconds(60);

    public WorkerSettings {
        Objects.requireNonNull(pollInterval, "pollInterval must not be null");
        Objects.requireNonNull(storeRetryDelay, "storeRetryDelay must not be null");
        if (pollInterval.isZero() || pollInterval.isNegative()) {
            throw new IllegalArgumentException("pollInterval must be a positive duration");
        }
        if (defaultTimeout != null && (defaultTimeout.isZero() || defaultTimeout.isNegative())) {
            throw new IllegalArgumentException("defaultTimeout must be a positive duration");
        }
        if (writeAttempts <= 0) {
            throw new IllegalArgumentException("writeAttempts must be a positive number");
        }
        if (storeRetryDelay.isNegative()) {
            throw new IllegalArgumentException("storeRetryDelay must not be negative");
        }
    }

    public static WorkerSettings defaults() {
        return new WorkerSettings(Duration.ofMillis(500), Duration.ofSeconds(30), 2.0, 5, Duration.ofSeconds(1));
    }

    /**
     * Delay before retrying a store call after {@code failCount} consecutive failures.
     */
    public Duration storeBackoff(int failCount) {
        int exp = Math.max(0, Math.min(failCount - 1, 15));
        long ms = Math.min(storeRetryDelay.toMillis() * (1L << exp), MAX_STORE_RETRY_DELAY.toMillis());
        return Duration.ofMillis(ms);
    }
}
