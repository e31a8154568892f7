package com.pushhub.notification.model;

import java.util.List;

/**
 * Result of a successful dispatch.
 *
 * <p>Exactly one provider delivered the notification ({@link #getUsedProvider()}).
 * {@link #getAttempts()} lists every provider considered before it, in order,
 * followed by the successful one. Failed dispatches never produce a result;
 * they raise {@link com.pushhub.notification.exception.AllProvidersFailedException}
 * or {@link com.pushhub.notification.exception.ProviderSendException}.
 *
 * <p>{@code totalProviders} counts the configured providers able to handle the
 * notification, whether or not they were enabled or reached.
 */
public final class DispatchResult {

    private final String                usedProvider;
    private final DeliveryReceipt       receipt;
    private final List<ProviderAttempt> attempts;
    private final int                   totalProviders;

    public DispatchResult(
            final String usedProvider,
            final DeliveryReceipt receipt,
            final List<ProviderAttempt> attempts,
            final int totalProviders) {
        this.usedProvider   = usedProvider;
        this.receipt        = receipt;
        this.attempts       = List.copyOf(attempts);
        this.totalProviders = totalProviders;
    }

    public boolean               isSuccess()       { return usedProvider != null; }
    public String                getUsedProvider() { return usedProvider; }
    public DeliveryReceipt       getReceipt()      { return receipt; }
    public List<ProviderAttempt> getAttempts()     { return attempts; }
    public int                   getTotalProviders() { return totalProviders; }

    public int getSuccessfulProviders() {
        return (int) attempts.stream().filter(ProviderAttempt::isSuccess).count();
    }

    public int getFailedProviders() {
        return (int) attempts.stream().filter(ProviderAttempt::isFailed).count();
    }

    public int getSkippedProviders() {
        return (int) attempts.stream().filter(ProviderAttempt::isSkipped).count();
    }

    @Override
    public String toString() {
        return "DispatchResult{usedProvider=" + usedProvider
             + ", total=" + totalProviders
             + ", successful=" + getSuccessfulProviders()
             + ", failed=" + getFailedProviders()
             + ", skipped=" + getSkippedProviders()
             + "}";
    }
}
