package io.postscheduler.exception;

import io.postscheduler.core.JobStatus;

/**
 * Thrown when a job no longer exists, or no longer has the status a conditional
 * update expected (another writer got there first).
 */
public class JobNotFoundException extends PostSchedulerException {

    private final String jobId;
    private final JobStatus expectedStatus;

    public JobNotFoundException(String jobId) {
        super("Scheduled job not found: " + jobId);
        this.jobId = jobId;
        this.expectedStatus = null;
    }

    public JobNotFoundException(String jobId, JobStatus expectedStatus) {
        super("Scheduled job not found in status " + expectedStatus.value() + ": " + jobId);
        this.jobId = jobId;
        this.expectedStatus = expectedStatus;
    }

    public String jobId() {
        return jobId;
    }

    /**
     * Status the caller required, or null for a plain lookup.
     */
    public JobStatus expectedStatus() {
        return expectedStatus;
    }
}
