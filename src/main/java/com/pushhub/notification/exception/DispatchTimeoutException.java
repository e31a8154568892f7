package com.pushhub.notification.exception;

import java.time.Duration;

/**
 * A dispatch with an explicit timeout did not complete in time. The underlying
 * provider attempt may still be running.
 */
public class DispatchTimeoutException extends NotificationException {

    private final Duration timeout;

    public DispatchTimeoutException(final Duration timeout) {
        super("Dispatch did not complete within " + timeout.toMillis() + "ms");
        this.timeout = timeout;
    }

    public Duration getTimeout() { return timeout; }
}
