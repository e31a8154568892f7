package com.pushhub.notification.model;

/**
 * Whether a single provider would accept a notification, evaluated without sending.
 */
public final class ProviderCompatibility {

    private final String  provider;
    private final boolean enabled;
    private final boolean valid;
    private final boolean canHandle;
    private final String  error;   // validation message, null when valid

    public ProviderCompatibility(
            final String provider,
            final boolean enabled,
            final boolean valid,
            final boolean canHandle,
            final String error) {
        this.provider  = provider;
        this.enabled   = enabled;
        this.valid     = valid;
        this.canHandle = canHandle;
        this.error     = error;
    }

    public String  getProvider() { return provider; }
    public boolean isEnabled()   { return enabled; }
    public boolean isValid()     { return valid; }
    public boolean isCanHandle() { return canHandle; }
    public String  getError()    { return error; }

    /** True when this provider would be attempted for the notification. */
    public boolean isUsable() {
        return enabled && valid && canHandle;
    }
}
