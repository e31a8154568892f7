package com.pushhub.notification.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Typed configuration for the Push Notification Hub, loaded from
 * {@code application.conf} via Typesafe Config.
 *
 * <p>All secrets (access tokens, REST keys, app secrets) are read from
 * environment variables via Typesafe Config substitution
 * (e.g. {@code ${?ONESIGNAL_REST_API_KEY}}). This class never holds or logs
 * secret values; providers only check their presence.
 */
public final class HubConfig {

    private final Config raw;

    private HubConfig(final Config config) {
        this.raw = config;
    }

    public static HubConfig load() {
        return new HubConfig(ConfigFactory.load().resolve());
    }

    public static HubConfig from(final Config config) {
        return new HubConfig(config.resolve());
    }

    // ── Providers ─────────────────────────────────────────────────────────────

    public List<? extends Config> getProviders() {
        return raw.getConfigList("providers");
    }

    /** Returns all providers where enabled=true, in declaration order. */
    public List<? extends Config> getActiveProviders() {
        return getProviders().stream()
                .filter(c -> c.hasPath("enabled") && c.getBoolean("enabled"))
                .collect(Collectors.toList());
    }

    // ── Retry ─────────────────────────────────────────────────────────────────

    public int getRetryAttempts() {
        return raw.getInt("retry.attempts");
    }

    public long getRetryBaseDelayMs() {
        return raw.getLong("retry.base-delay-ms");
    }

    // ── Scheduler ─────────────────────────────────────────────────────────────

    public int getSchedulerThreads() {
        return raw.getInt("scheduler.threads");
    }

    // ── Health ────────────────────────────────────────────────────────────────

    public int getHealthPort() {
        return raw.getInt("health.port");
    }
}
