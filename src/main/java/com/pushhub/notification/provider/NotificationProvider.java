package com.pushhub.notification.provider;

import com.pushhub.notification.model.DeliveryReceipt;
import com.pushhub.notification.model.Notification;

/**
 * Pluggable push delivery channel.
 *
 * <p>Each concrete implementation wraps a single external provider
 * (Firebase Cloud Messaging, OneSignal, Pusher Channels) and translates a
 * {@link Notification} into that provider's wire format.
 *
 * <h2>Contract</h2>
 * <ul>
 *   <li>Implementations must be thread-safe; a single instance is shared by
 *       direct dispatches and every scheduled job.</li>
 *   <li>{@link #send} performs exactly one delivery attempt and reports failure
 *       by throwing {@link com.pushhub.notification.exception.ProviderSendException}.
 *       The retry policy lives in {@link #sendWithRetry}.</li>
 *   <li>The enabled flag may be flipped at any time by a management call; the
 *       change is observed on the next dispatch decision.</li>
 *   <li>Implementations must close their HTTP clients when {@link #close()} is called.</li>
 * </ul>
 */
public interface NotificationProvider extends AutoCloseable {

    /**
     * Human-readable provider name for logging and lookup (e.g. "Firebase").
     * Lookups by name are case-insensitive.
     */
    String name();

    /** Failover rank; lower values are tried first. */
    int priority();

    /**
     * True only if the provider's configuration was complete at construction
     * time and it has not been administratively disabled.
     */
    boolean isEnabled();

    /** Administrative toggle. Has no effect on a provider with incomplete configuration. */
    void setEnabled(boolean enabled);

    /**
     * Whether the notification's targeting fields are sufficient for this provider.
     */
    boolean canHandle(Notification notification);

    /**
     * @throws com.pushhub.notification.exception.ValidationException if the
     *         notification cannot be sent by this provider
     */
    void validate(Notification notification);

    /**
     * One delivery attempt.
     *
     * @return receipt describing the accepted message; never null
     * @throws com.pushhub.notification.exception.ProviderSendException on any failure
     */
    DeliveryReceipt send(Notification notification);

    /**
     * Validate, then {@link #send} with the configured number of attempts.
     */
    DeliveryReceipt sendWithRetry(Notification notification);

    /**
     * Validate, then {@link #send} up to {@code attempts} times with linear back-off.
     */
    DeliveryReceipt sendWithRetry(Notification notification, int attempts);

    @Override
    void close();
}
