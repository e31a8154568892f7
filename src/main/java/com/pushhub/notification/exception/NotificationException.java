package com.pushhub.notification.exception;

/**
 * Root of the hub's error taxonomy.
 *
 * <p>All subclasses are unchecked: callers that care about a specific failure
 * (an unknown provider, a malformed schedule) catch the subtype, everything
 * else propagates to the host layer.
 */
public class NotificationException extends RuntimeException {

    public NotificationException(final String message) {
        super(message);
    }

    public NotificationException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
