package com.pushhub.notification.model;

/**
 * Outcome of considering one provider during a dispatch.
 *
 * <p>{@link Outcome#SKIPPED} entries never count as failures; they record a
 * provider that was disabled or could not handle the notification.
 */
public final class ProviderAttempt {

    public enum Outcome { SUCCESS, FAILED, SKIPPED }

    public static final String REASON_DISABLED    = "Provider is disabled";
    public static final String REASON_UNSUPPORTED = "Provider cannot handle this notification type";

    private final String  provider;
    private final Outcome outcome;
    private final String  reason;   // null on success

    private ProviderAttempt(final String provider, final Outcome outcome, final String reason) {
        this.provider = provider;
        this.outcome  = outcome;
        this.reason   = reason;
    }

    public static ProviderAttempt success(final String provider) {
        return new ProviderAttempt(provider, Outcome.SUCCESS, null);
    }

    public static ProviderAttempt failed(final String provider, final String error) {
        return new ProviderAttempt(provider, Outcome.FAILED, error);
    }

    public static ProviderAttempt skipped(final String provider, final String reason) {
        return new ProviderAttempt(provider, Outcome.SKIPPED, reason);
    }

    public String  getProvider() { return provider; }
    public Outcome getOutcome()  { return outcome; }
    public String  getReason()   { return reason; }
    public boolean isSuccess()   { return outcome == Outcome.SUCCESS; }
    public boolean isFailed()    { return outcome == Outcome.FAILED; }
    public boolean isSkipped()   { return outcome == Outcome.SKIPPED; }

    @Override
    public String toString() {
        return "ProviderAttempt{provider=" + provider
             + ", outcome=" + outcome
             + (reason != null ? ", reason=" + reason : "")
             + "}";
    }
}
