package io.github.byzatic.jobs.base_exceptions;

public class JobNotFoundException extends Exception {
    private final String jobId;

    public JobNotFoundException(String jobId) {
        super("Job not found: " + jobId);
        this.jobId = jobId;
    }

    public String getJobId() {
        return jobId;
    }
}
