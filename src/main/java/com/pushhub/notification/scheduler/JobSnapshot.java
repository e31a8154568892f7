package com.pushhub.notification.scheduler;

import java.time.Instant;
import java.time.ZonedDateTime;

/**
 * Immutable view of a scheduled job's metadata. Never carries the live timer.
 */
public final class JobSnapshot {

    private final String        id;
    private final String        title;
    private final String        body;
    private final ScheduleSpec  schedule;
    private final String        provider;      // explicit provider override, null for failover
    private final Instant       createdAt;
    private final ZonedDateTime nextTrigger;   // null once fired or cancelled
    private final JobState      state;
    private final int           fireCount;
    private final Instant       lastFiredAt;
    private final String        lastOutcome;

    JobSnapshot(
            final String id,
            final String title,
            final String body,
            final ScheduleSpec schedule,
            final String provider,
            final Instant createdAt,
            final ZonedDateTime nextTrigger,
            final JobState state,
            final int fireCount,
            final Instant lastFiredAt,
            final String lastOutcome) {
        this.id          = id;
        this.title       = title;
        this.body        = body;
        this.schedule    = schedule;
        this.provider    = provider;
        this.createdAt   = createdAt;
        this.nextTrigger = nextTrigger;
        this.state       = state;
        this.fireCount   = fireCount;
        this.lastFiredAt = lastFiredAt;
        this.lastOutcome = lastOutcome;
    }

    public String        getId()          { return id; }
    public String        getTitle()       { return title; }
    /** Body truncated for display. */
    public String        getBody()        { return body; }
    public ScheduleSpec  getSchedule()    { return schedule; }
    public String        getProvider()    { return provider; }
    public Instant       getCreatedAt()   { return createdAt; }
    public ZonedDateTime getNextTrigger() { return nextTrigger; }
    public JobState      getState()       { return state; }
    public int           getFireCount()   { return fireCount; }
    public Instant       getLastFiredAt() { return lastFiredAt; }
    public String        getLastOutcome() { return lastOutcome; }

    @Override
    public String toString() {
        return "JobSnapshot{id=" + id
             + ", state=" + state
             + ", schedule=" + schedule
             + ", nextTrigger=" + nextTrigger
             + ", fireCount=" + fireCount + "}";
    }
}
