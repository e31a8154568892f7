package com.pushhub.notification.model;

import java.time.Instant;
import java.util.Map;

/**
 * Immutable proof of a successful provider send.
 *
 * <p>The {@code providerMessageId} is the external reference returned by the
 * provider (FCM message name, OneSignal notification id, Pusher event id or a
 * {@code success/failure} count for Firebase multicast). {@code details} holds
 * provider-specific extras such as recipient counts or the Pusher channel.
 */
public final class DeliveryReceipt {

    private final String              provider;
    private final String              providerMessageId;
    private final int                 httpStatusCode;
    private final Map<String, Object> details;
    private final Instant             sentAt;

    public DeliveryReceipt(
            final String provider,
            final String providerMessageId,
            final int httpStatusCode,
            final Map<String, Object> details) {
        this.provider          = provider;
        this.providerMessageId = providerMessageId;
        this.httpStatusCode    = httpStatusCode;
        this.details           = details != null ? Map.copyOf(details) : Map.of();
        this.sentAt            = Instant.now();
    }

    public DeliveryReceipt(final String provider, final String providerMessageId, final int httpStatusCode) {
        this(provider, providerMessageId, httpStatusCode, Map.of());
    }

    public String              getProvider()          { return provider; }
    public String              getProviderMessageId() { return providerMessageId; }
    public int                 getHttpStatusCode()    { return httpStatusCode; }
    public Map<String, Object> getDetails()           { return details; }
    public Instant             getSentAt()            { return sentAt; }

    @Override
    public String toString() {
        return "DeliveryReceipt{provider=" + provider
             + ", msgId=" + providerMessageId
             + (httpStatusCode > 0 ? ", http=" + httpStatusCode : "")
             + (!details.isEmpty() ? ", details=" + details : "")
             + "}";
    }
}
