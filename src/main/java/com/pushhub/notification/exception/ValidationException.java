package com.pushhub.notification.exception;

/**
 * Malformed notification content, e.g. neither title nor body present.
 */
public class ValidationException extends NotificationException {

    public ValidationException(final String message) {
        super(message);
    }
}
