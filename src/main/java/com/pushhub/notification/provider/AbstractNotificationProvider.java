package com.pushhub.notification.provider;

import com.pushhub.notification.exception.ValidationException;
import com.pushhub.notification.model.DeliveryReceipt;
import com.pushhub.notification.model.Notification;
import com.pushhub.notification.retry.RetryExecutor;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Shared behaviour of all providers: the enabled flag, the baseline
 * validation rule and the retry wrapper around {@link #send}.
 *
 * <p>Subclasses implement {@link #isConfigured()}, {@link #send} and, when
 * they need explicit targeting, {@link #canHandle}.
 */
public abstract class AbstractNotificationProvider implements NotificationProvider {

    protected static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final String        name;
    private final int           priority;
    private final RetryExecutor retry;
    private final AtomicBoolean enabled;

    protected AbstractNotificationProvider(
            final String name,
            final int priority,
            final boolean enabled,
            final RetryExecutor retry) {
        this.name     = name;
        this.priority = priority;
        this.retry    = retry;
        this.enabled  = new AtomicBoolean(enabled);
    }

    @Override public String name()     { return name; }
    @Override public int    priority() { return priority; }

    /**
     * Returns {@code true} if this provider has the credentials and
     * configuration required to operate. Fixed at construction time.
     */
    public abstract boolean isConfigured();

    @Override
    public boolean isEnabled() {
        return enabled.get() && isConfigured();
    }

    @Override
    public void setEnabled(final boolean value) {
        enabled.set(value);
    }

    @Override
    public boolean canHandle(final Notification notification) {
        return true;
    }

    @Override
    public void validate(final Notification notification) {
        if (!notification.hasTitle() && !notification.hasBody()) {
            throw new ValidationException("Notification must have either title or body");
        }
        if (notification.getTitle() != null && notification.getTitle().length() > Notification.MAX_TITLE_LENGTH) {
            throw new ValidationException("Title must be at most " + Notification.MAX_TITLE_LENGTH
                    + " characters, got " + notification.getTitle().length());
        }
        if (notification.getBody() != null && notification.getBody().length() > Notification.MAX_BODY_LENGTH) {
            throw new ValidationException("Body must be at most " + Notification.MAX_BODY_LENGTH
                    + " characters, got " + notification.getBody().length());
        }
    }

    @Override
    public DeliveryReceipt sendWithRetry(final Notification notification) {
        return sendWithRetry(notification, retry.getDefaultAttempts());
    }

    @Override
    public DeliveryReceipt sendWithRetry(final Notification notification, final int attempts) {
        validate(notification);
        return retry.execute(() -> send(notification), attempts, name + " " + notification);
    }

    protected static OkHttpClient buildHttpClient() {
        return new OkHttpClient.Builder()
                .connectTimeout(10, TimeUnit.SECONDS)
                .readTimeout(15, TimeUnit.SECONDS)
                .writeTimeout(15, TimeUnit.SECONDS)
                .build();
    }

    protected static boolean present(final String value) {
        return value != null && !value.isBlank();
    }

    protected static String stripTrailingSlash(final String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{name=" + name
             + ", priority=" + priority
             + ", enabled=" + isEnabled() + "}";
    }
}
