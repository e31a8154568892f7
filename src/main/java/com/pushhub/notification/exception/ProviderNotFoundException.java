package com.pushhub.notification.exception;

/**
 * No configured provider matches the requested name, or the match is disabled.
 */
public class ProviderNotFoundException extends NotificationException {

    private final String providerName;

    public ProviderNotFoundException(final String providerName, final String message) {
        super(message);
        this.providerName = providerName;
    }

    public String getProviderName() { return providerName; }
}
