package com.pushhub.notification.scheduler;

import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Acknowledgement returned by {@link NotificationScheduler#schedule}. The job
 * is armed when this is returned; delivery happens later.
 */
public final class ScheduleResult {

    private static final DateTimeFormatter DISPLAY = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss z");

    private final String        jobId;
    private final ZonedDateTime scheduledFor;
    private final Frequency     frequency;
    private final String        timezone;

    ScheduleResult(
            final String jobId,
            final ZonedDateTime scheduledFor,
            final Frequency frequency,
            final String timezone) {
        this.jobId        = jobId;
        this.scheduledFor = scheduledFor;
        this.frequency    = frequency;
        this.timezone     = timezone;
    }

    public String        getJobId()        { return jobId; }
    /** First firing, in the schedule's timezone. */
    public ZonedDateTime getScheduledFor() { return scheduledFor; }
    public Frequency     getFrequency()    { return frequency; }
    public String        getTimezone()     { return timezone; }

    @Override
    public String toString() {
        return "ScheduleResult{jobId=" + jobId
             + ", scheduledFor=" + DISPLAY.format(scheduledFor)
             + ", frequency=" + frequency
             + ", timezone=" + timezone + "}";
    }
}
