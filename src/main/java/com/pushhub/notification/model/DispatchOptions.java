package com.pushhub.notification.model;

import com.pushhub.notification.exception.ValidationException;

import java.time.Duration;
import java.util.Optional;

/**
 * Per-call dispatch options.
 *
 * <ul>
 *   <li>{@code provider}: explicit provider name; disables failover entirely.</li>
 *   <li>{@code failover}: when false, only the first eligible provider is tried.
 *       Defaults to true.</li>
 *   <li>{@code timeout}: bounded wait for the whole dispatch, at most
 *       {@link #MAX_TIMEOUT}.</li>
 * </ul>
 */
public final class DispatchOptions {

    public static final Duration MAX_TIMEOUT = Duration.ofSeconds(30);

    private static final DispatchOptions DEFAULTS = builder().build();

    private final String   provider;
    private final boolean  failover;
    private final Duration timeout;

    private DispatchOptions(final Builder b) {
        this.provider = b.provider;
        this.failover = b.failover;
        this.timeout  = b.timeout;
    }

    public static DispatchOptions defaults() {
        return DEFAULTS;
    }

    public static DispatchOptions forProvider(final String provider) {
        return builder().provider(provider).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String   provider;
        private boolean  failover = true;
        private Duration timeout;

        private Builder() {}

        public Builder provider(final String v) { this.provider = v; return this; }
        public Builder failover(final boolean v) { this.failover = v; return this; }

        public Builder timeout(final Duration v) {
            if (v != null && (v.isZero() || v.isNegative())) {
                throw new ValidationException("Dispatch timeout must be positive, got " + v.toMillis() + "ms");
            }
            if (v != null && v.compareTo(MAX_TIMEOUT) > 0) {
                throw new ValidationException("Dispatch timeout must not exceed " + MAX_TIMEOUT.toMillis() + "ms");
            }
            this.timeout = v;
            return this;
        }

        public DispatchOptions build() { return new DispatchOptions(this); }
    }

    public Optional<String> getProvider() {
        return provider != null && !provider.isBlank() ? Optional.of(provider) : Optional.empty();
    }

    public boolean            isFailover() { return failover; }
    public Optional<Duration> getTimeout() { return Optional.ofNullable(timeout); }

    @Override
    public String toString() {
        return "DispatchOptions{provider=" + provider
             + ", failover=" + failover
             + (timeout != null ? ", timeout=" + timeout.toMillis() + "ms" : "")
             + "}";
    }
}
