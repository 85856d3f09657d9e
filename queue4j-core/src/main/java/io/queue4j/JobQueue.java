package io.queue4j;

import io.queue4j.core.JobDescriptor;
import io.queue4j.core.JobRecord;
import io.queue4j.core.JobState;
import io.queue4j.core.QueueStatus;
import io.queue4j.worker.WorkerPool;

import java.util.List;
import java.util.Optional;

/**
 * Main job queue API.
 *
 * <p>Typical usage:
 * <pre>{@code
 * queue.enqueue(JobDescriptor.fromJson("{\"id\":\"job1\",\"command\":\"echo hi\"}"));
 *
 * // in the worker process; blocks until stop() or "worker stop"
 * queue.start(4);
 *
 * queue.deadLetters().forEach(job -> queue.retryDead(job.id()));
 * }</pre>
 */
public interface JobQueue {

    /**
     * Persist a new pending job.
     *
     * @throws io.queue4j.core.DuplicateJobIdException if the id is taken
     */
    JobRecord enqueue(JobDescriptor descriptor);

    /**
     * Start {@code workerCount} workers in the background and return the running pool.
     *
     * @throws IllegalStateException if workers are already running
     */
    WorkerPool startWorkers(int workerCount);

    /**
     * Run {@code workerCount} workers in the calling thread's process. Blocks until stopped.
     */
    void start(int workerCount);

    /**
     * Request a graceful stop: workers finish their current job, then exit.
     */
    void stop();

    QueueStatus status();

    Optional<JobRecord> get(String id);

    /**
     * @param state filter, or {@code null} for every job
     */
    List<JobRecord> list(JobState state);

    /**
     * Jobs currently in the dead letter queue.
     */
    List<JobRecord> deadLetters();

    /**
     * Move a dead job back to pending with a fresh retry budget.
     *
     * @throws io.queue4j.core.JobNotFoundException     if the id is unknown
     * @throws io.queue4j.core.InvalidJobStateException if the job is not dead
     */
    JobRecord retryDead(String id);

    Optional<String> getConfig(String key);

    /**
     * @throws io.queue4j.core.InvalidConfigException if a known key gets an invalid value
     */
    void setConfig(String key, String value);
}
