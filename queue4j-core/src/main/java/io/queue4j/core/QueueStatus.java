package io.queue4j.core;

import java.util.Map;

/**
 * Summary returned by {@code status}.
 *
 * @param counts        job counts per state, every state present
 * @param metrics       execution counters
 * @param stopRequested whether a worker stop request is pending
 */
public record QueueStatus(
        Map<JobState, Long> counts,
        Map<String, Long> metrics,
        boolean stopRequested
) {
    public long count(JobState state) {
        return counts.getOrDefault(state, 0L);
    }

    public long total() {
        return counts.values().stream().mapToLong(Long::longValue).sum();
    }
}
