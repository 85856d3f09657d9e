package io.queue4j.core;

import java.time.Instant;

/**
 * State change computed for a finished execution.
 *
 * @param target    state the job moves to: {@link JobState#COMPLETED}, {@link JobState#FAILED}
 *                  or {@link JobState#DEAD}
 * @param nextRunAt earliest re-claim time, only set for {@link JobState#FAILED}
 * @param lastError failure description, {@code null} on success
 */
public record Transition(
        JobState target,
        Instant nextRunAt,
        String lastError
) {
    public static Transition complete() {
        return new Transition(JobState.COMPLETED, null, null);
    }

    public static Transition retry(Instant nextRunAt, String lastError) {
        return new Transition(JobState.FAILED, nextRunAt, lastError);
    }

    public static Transition dead(String lastError) {
        return new Transition(JobState.DEAD, null, lastError);
    }
}
