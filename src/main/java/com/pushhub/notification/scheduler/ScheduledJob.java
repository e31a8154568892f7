package com.pushhub.notification.scheduler;

import com.pushhub.notification.model.DispatchOptions;
import com.pushhub.notification.model.Notification;

import java.time.Instant;
import java.time.ZonedDateTime;
import java.util.concurrent.ScheduledFuture;

/**
 * A registered deferred dispatch. Owned by {@link NotificationScheduler};
 * mutable state is guarded by the instance monitor so that a cancel racing a
 * daily re-arm cannot leave a live timer behind.
 */
final class ScheduledJob {

    static final int BODY_PREVIEW_LENGTH = 100;

    private final String          id;
    private final Notification    notification;
    private final ScheduleSpec    spec;
    private final DispatchOptions options;
    private final Instant         createdAt;

    private ScheduledFuture<?> handle;
    private ZonedDateTime      nextTrigger;
    private JobState           state = JobState.PENDING;
    private int                fireCount;
    private Instant            lastFiredAt;
    private String             lastOutcome;

    ScheduledJob(
            final String id,
            final Notification notification,
            final ScheduleSpec spec,
            final DispatchOptions options,
            final Instant createdAt) {
        this.id           = id;
        this.notification = notification;
        this.spec         = spec;
        this.options      = options;
        this.createdAt    = createdAt;
    }

    String          getId()           { return id; }
    Notification    getNotification() { return notification; }
    ScheduleSpec    getSpec()         { return spec; }
    DispatchOptions getOptions()      { return options; }

    synchronized ZonedDateTime getNextTrigger() { return nextTrigger; }
    synchronized JobState      getState()       { return state; }

    /** Attach a freshly scheduled timer. Returns false if the job was cancelled meanwhile. */
    synchronized boolean arm(final ScheduledFuture<?> newHandle, final ZonedDateTime trigger) {
        if (state == JobState.CANCELLED) {
            newHandle.cancel(false);
            return false;
        }
        this.handle      = newHandle;
        this.nextTrigger = trigger;
        this.state       = JobState.ARMED;
        return true;
    }

    synchronized void recordFiring(final Instant firedAt, final String outcome) {
        this.fireCount++;
        this.lastFiredAt = firedAt;
        this.lastOutcome = outcome;
        if (spec.getFrequency() == Frequency.ONCE) {
            this.state       = JobState.FIRED;
            this.nextTrigger = null;
            this.handle      = null;
        }
    }

    /** Disarm the timer. An attempt already running is not interrupted. */
    synchronized void cancel() {
        if (handle != null) {
            handle.cancel(false);
            handle = null;
        }
        nextTrigger = null;
        state       = JobState.CANCELLED;
    }

    synchronized JobSnapshot snapshot() {
        return new JobSnapshot(
                id,
                notification.getTitle(),
                notification.bodyPreview(BODY_PREVIEW_LENGTH, false),
                spec,
                options.getProvider().orElse(null),
                createdAt,
                nextTrigger,
                state,
                fireCount,
                lastFiredAt,
                lastOutcome);
    }
}
