package io.queue4j.core;

import java.time.Instant;

/**
 * Immutable snapshot of a persisted job.
 *
 * <p>Snapshots are produced by the {@link JobStore} and never written back directly; every
 * state change goes through a store operation.
 */
public record JobRecord(

        // identity
        String id,
        String command,

        // lifecycle
        JobState state,
        int attempts,
        int maxRetries,
        Integer timeoutSeconds,

        // timestamps
        Instant createdAt,
        Instant updatedAt,
        Instant nextRunAt,

        // diagnostics
        String lastError,
        String claimedBy,
        String logPath
) {
}
