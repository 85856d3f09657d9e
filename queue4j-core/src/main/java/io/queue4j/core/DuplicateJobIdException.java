package io.queue4j.core;

/**
 * Raised when a job is enqueued with an id that is already taken.
 * The existing job is left untouched.
 */
public class DuplicateJobIdException extends QueueException {

    private final String jobId;

    public DuplicateJobIdException(String jobId, Throwable cause) {
        super("Job id already exists: " + jobId, cause);
        this.jobId = jobId;
    }

    public String getJobId() {
        return jobId;
    }
}
