package io.queue4j.core;

public class JobNotFoundException extends QueueException {

    private final String jobId;

    public JobNotFoundException(String jobId) {
        super("No such job: " + jobId);
        this.jobId = jobId;
    }

    public String getJobId() {
        return jobId;
    }
}
