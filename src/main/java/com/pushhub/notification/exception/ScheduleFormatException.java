package com.pushhub.notification.exception;

/**
 * Bad schedule descriptor: unparseable time, unknown timezone or frequency.
 * Always raised before a job is registered.
 */
public class ScheduleFormatException extends NotificationException {

    public ScheduleFormatException(final String message) {
        super(message);
    }
}
