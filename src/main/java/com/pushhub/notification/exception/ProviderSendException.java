package com.pushhub.notification.exception;

/**
 * A provider's delivery attempt failed. Carries the upstream error detail
 * (HTTP status and body, or the I/O error message).
 */
public class ProviderSendException extends NotificationException {

    private final String providerName;
    private final int    httpStatusCode; // 0 if not applicable

    public ProviderSendException(final String providerName, final String message) {
        this(providerName, message, 0, null);
    }

    public ProviderSendException(final String providerName, final String message, final int httpStatusCode) {
        this(providerName, message, httpStatusCode, null);
    }

    public ProviderSendException(final String providerName, final String message, final Throwable cause) {
        this(providerName, message, 0, cause);
    }

    public ProviderSendException(
            final String providerName,
            final String message,
            final int httpStatusCode,
            final Throwable cause) {
        super(message, cause);
        this.providerName   = providerName;
        this.httpStatusCode = httpStatusCode;
    }

    public String getProviderName()   { return providerName; }
    public int    getHttpStatusCode() { return httpStatusCode; }
}
