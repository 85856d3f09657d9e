package io.queue4j.core;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Durable table of job records.
 *
 * <p>Every operation is atomic with respect to every other one. Mutations either fully apply
 * or leave no visible effect. Cross-worker coordination happens only through
 * {@link #claimNext(Instant, String)}, which must be a single atomic select-and-update.
 */
public interface JobStore {

    /**
     * Inserts a new job in {@link JobState#PENDING} with zero attempts.
     *
     * @param descriptor job description with id and retry limit already resolved
     * @throws DuplicateJobIdException if the id already exists
     */
    JobRecord enqueue(JobDescriptor descriptor, Instant now);

    /**
     * Atomically claims the oldest eligible job: pending, or failed with {@code nextRunAt <= now}.
     * The claimed job moves to {@link JobState#PROCESSING} and its attempt count is incremented.
     *
     * @return the claimed job as stored after the claim, or empty when nothing is eligible
     */
    Optional<JobRecord> claimNext(Instant now, String workerId);

    /**
     * processing -> completed.
     */
    void markCompleted(String id, Instant now);

    /**
     * processing -> failed, claimable again once {@code nextRunAt} has passed.
     */
    void markRetry(String id, Instant nextRunAt, String lastError, Instant now);

    /**
     * processing -> dead.
     */
    void markDead(String id, String lastError, Instant now);

    /**
     * dead -> pending with the attempt count reset to zero.
     *
     * @throws JobNotFoundException     if the id is unknown
     * @throws InvalidJobStateException if the job is not dead; the job is left unchanged
     */
    JobRecord retryDead(String id, Instant now);

    /**
     * Records where the job's run output is appended. Allowed in any state.
     *
     * @throws JobNotFoundException if the id is unknown
     */
    void assignLogPath(String id, String logPath);

    Optional<JobRecord> get(String id);

    /**
     * Lists jobs ordered by creation time.
     *
     * @param state state filter, or {@code null} for all jobs
     */
    List<JobRecord> list(JobState state);

    /**
     * Job counts for every state; states without jobs map to zero.
     */
    Map<JobState, Long> countByState();
}
