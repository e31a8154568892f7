package com.pushhub.notification.exception;

/**
 * The requested provider cannot handle the notification's targeting fields
 * (e.g. Firebase without a token, token list or topic).
 */
public class ProviderUnsupportedException extends NotificationException {

    private final String providerName;

    public ProviderUnsupportedException(final String providerName, final String message) {
        super(message);
        this.providerName = providerName;
    }

    public String getProviderName() { return providerName; }
}
