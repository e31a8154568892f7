package com.pushhub.notification.exception;

/**
 * Lookup of a scheduled job by an id the scheduler does not know.
 */
public class JobNotFoundException extends NotificationException {

    private final String jobId;

    public JobNotFoundException(final String jobId) {
        super("Scheduled job not found: " + jobId);
        this.jobId = jobId;
    }

    public String getJobId() { return jobId; }
}
