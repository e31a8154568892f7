package com.pushhub.notification.scheduler;

/**
 * Lifecycle of a scheduled job.
 *
 * <pre>
 *   PENDING → ARMED → FIRED     (once: removed after firing)
 *                   → ARMED     (daily: re-armed for the next day)
 *                   → CANCELLED
 * </pre>
 */
public enum JobState {
    PENDING,
    ARMED,
    FIRED,
    CANCELLED
}
