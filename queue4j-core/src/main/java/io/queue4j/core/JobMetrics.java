package io.queue4j.core;

import java.util.Map;

/**
 * Durable execution counters.
 */
public interface JobMetrics {

    String JOBS_PROCESSED = "jobs_processed";
    String JOBS_FAILED = "jobs_failed";
    String JOBS_RETRIED = "jobs_retried";
    String JOBS_DEAD = "jobs_dead";

    void increment(String counter);

    Map<String, Long> snapshot();

    /**
     * Metrics sink that records nothing.
     */
    static JobMetrics noop() {
        return new JobMetrics() {
            @Override
            public void increment(String counter) {
            }

            @Override
            public Map<String, Long> snapshot() {
                return Map.of();
            }
        };
    }
}
