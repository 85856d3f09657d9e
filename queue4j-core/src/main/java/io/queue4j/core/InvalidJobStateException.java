package io.queue4j.core;

/**
 * Raised when an operation is attempted from a state that forbids it,
 * for example retrying a job that is not in the dead letter queue.
 */
public class InvalidJobStateException extends QueueException {

    private final String jobId;
    private final JobState actual;
    private final JobState expected;

    public InvalidJobStateException(String jobId, JobState actual, JobState expected) {
        super("Job " + jobId + " is " + actual.label() + ", expected " + expected.label());
        this.jobId = jobId;
        this.actual = actual;
        this.expected = expected;
    }

    public String getJobId() {
        return jobId;
    }

    public JobState getActual() {
        return actual;
    }

    public JobState getExpected() {
        return expected;
    }
}
