package io.queue4j.core;

import java.time.Duration;

/**
 * Outcome of {@link BackoffPolicy#decide(int, int, double)}: either retry after {@code delay},
 * or give up because the retry budget is exhausted.
 */
public record BackoffDecision(
        boolean exhausted,
        Duration delay
) {
    public static BackoffDecision retry(Duration delay) {
        return new BackoffDecision(false, delay);
    }

    public static BackoffDecision exhaustedResult() {
        return new BackoffDecision(true, null);
    }
}
