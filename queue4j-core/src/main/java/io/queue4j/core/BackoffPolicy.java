package io.queue4j.core;

import java.time.Duration;

/**
 * Exponential retry backoff.
 *
 * <p>The delay after a failed attempt is {@code base ^ attempts} seconds, where {@code attempts}
 * is the attempt count recorded at claim time. The first failure therefore waits {@code base}
 * seconds, the second {@code base^2}, and so on. A job is exhausted once
 * {@code attempts > maxRetries}.
 */
public final class BackoffPolicy {

    public static final double DEFAULT_BASE = 2.0;

    /**
     * Upper bound for a single retry delay.
     */
    public static final Duration MAX_DELAY = Duration.ofDays(1);

    private BackoffPolicy() {
    }

    /**
     * Decides whether a failed job is retried and after which delay.
     *
     * @param attempts    attempts started so far, including the one that just failed
     * @param maxRetries  retry limit of the job
     * @param backoffBase exponential base, must be a positive finite number
     * @throws InvalidConfigException if {@code backoffBase} is not positive and finite
     */
    public static BackoffDecision decide(int attempts, int maxRetries, double backoffBase) {
        if (attempts < 0) {
            throw new IllegalArgumentException("attempts must not be negative");
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative");
        }
        validateBase(backoffBase);

        if (attempts > maxRetries) {
            return BackoffDecision.exhaustedResult();
        }
        return BackoffDecision.retry(delay(attempts, backoffBase));
    }

    /**
     * {@code base ^ attempts} seconds at millisecond precision, capped at {@link #MAX_DELAY}.
     */
    public static Duration delay(int attempts, double backoffBase) {
        validateBase(backoffBase);
        double seconds = Math.pow(backoffBase, attempts);
        double maxSeconds = MAX_DELAY.toSeconds();
        if (Double.isNaN(seconds) || seconds >= maxSeconds) {
            return MAX_DELAY;
        }
        return Duration.ofMillis(Math.round(seconds * 1000d));
    }

    /**
     * Parses a stored {@code backoff_base} value.
     *
     * @param raw      stored value, may be null when the key was never set
     * @param fallback value used when {@code raw} is null or blank
     * @throws InvalidConfigException if the value is not a positive number
     */
    public static double parseBase(String raw, double fallback) {
        if (raw == null || raw.isBlank()) {
            validateBase(fallback);
            return fallback;
        }
        double base;
        try {
            base = Double.parseDouble(raw.trim());
        } catch (NumberFormatException e) {
            throw new InvalidConfigException(ConfigStore.BACKOFF_BASE, "not a number: " + raw);
        }
        validateBase(base);
        return base;
    }

    /**
     * Reads the current base from the config store. No caching: every call hits the store.
     */
    public static double currentBase(ConfigStore config, double fallback) {
        return parseBase(config.get(ConfigStore.BACKOFF_BASE).orElse(null), fallback);
    }

    private static void validateBase(double base) {
        if (Double.isNaN(base) || Double.isInfinite(base) || base <= 0) {
            throw new InvalidConfigException(ConfigStore.BACKOFF_BASE, "must be a positive number, was " + base);
        }
    }
}
