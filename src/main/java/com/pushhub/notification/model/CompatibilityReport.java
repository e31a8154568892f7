package com.pushhub.notification.model;

import java.util.List;

/**
 * Per-provider compatibility of a notification. The report is {@link #isValid() valid}
 * when at least one enabled provider can handle it.
 */
public final class CompatibilityReport {

    private final List<ProviderCompatibility> providers;

    public CompatibilityReport(final List<ProviderCompatibility> providers) {
        this.providers = List.copyOf(providers);
    }

    public boolean isValid() {
        return providers.stream().anyMatch(ProviderCompatibility::isUsable);
    }

    public List<ProviderCompatibility> getProviders() { return providers; }
}
