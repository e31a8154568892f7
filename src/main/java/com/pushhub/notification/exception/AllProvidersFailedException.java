package com.pushhub.notification.exception;

import com.pushhub.notification.model.ProviderAttempt;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Every eligible provider failed during a failover dispatch, or none was eligible.
 *
 * <p>{@link #getAttempts()} lists every failure and skip in the order the
 * providers were considered.
 */
public class AllProvidersFailedException extends NotificationException {

    private final List<ProviderAttempt> attempts;

    public AllProvidersFailedException(final List<ProviderAttempt> attempts) {
        super(buildMessage(attempts));
        this.attempts = List.copyOf(attempts);
    }

    public List<ProviderAttempt> getAttempts() { return attempts; }

    /** Number of attempts that were real send failures (skips excluded). */
    public long getFailedCount() {
        return attempts.stream().filter(ProviderAttempt::isFailed).count();
    }

    private static String buildMessage(final List<ProviderAttempt> attempts) {
        if (attempts.isEmpty()) {
            return "No notification providers available";
        }
        return "All providers failed: " + attempts.stream()
                .map(a -> a.getProvider() + ": " + a.getReason())
                .collect(Collectors.joining("; "));
    }
}
