package io.queue4j.core;

import java.util.Locale;

/**
 * Lifecycle states of a queued job.
 *
 * <p>{@link #COMPLETED} and {@link #DEAD} are terminal. A dead job only leaves the
 * dead letter queue through an explicit retry.
 */
public enum JobState {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED,
    DEAD;

    public boolean isTerminal() {
        return this == COMPLETED || this == DEAD;
    }

    /**
     * Lower-case name used on the command line and in printed job summaries.
     */
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a state label, case-insensitive.
     */
    public static JobState fromLabel(String label) {
        if (label == null || label.isBlank()) {
            throw new IllegalArgumentException("state must not be blank");
        }
        try {
            return JobState.valueOf(label.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown job state: " + label);
        }
    }
}
