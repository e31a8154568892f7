package com.pushhub.notification.provider;

import com.pushhub.notification.config.HubConfig;
import com.pushhub.notification.retry.RetryExecutor;
import com.typesafe.config.Config;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds all {@link NotificationProvider} instances from the application config.
 *
 * <p>Only providers with {@code enabled = true} are built. A provider that is
 * enabled but missing credentials is still returned: it reports
 * {@link NotificationProvider#isEnabled()} {@code false}, shows up in provider
 * listings and is skipped as "disabled" during failover.
 *
 * <p>Each entry's {@code priority} sets its failover rank; when absent, the
 * declaration position (1-based) is used.
 */
public final class ProviderFactory {

    private static final Logger LOG = LoggerFactory.getLogger(ProviderFactory.class);

    private ProviderFactory() {}

    public static List<NotificationProvider> buildProviders(final HubConfig config, final RetryExecutor retry) {
        final List<NotificationProvider> providers = new ArrayList<>();
        final List<? extends Config> active = config.getActiveProviders();

        for (int i = 0; i < active.size(); i++) {
            final Config cfg  = active.get(i);
            final String name = cfg.getString("name");
            final int priority = cfg.hasPath("priority") ? cfg.getInt("priority") : i + 1;
            try {
                final AbstractNotificationProvider provider = buildProvider(name, priority, cfg, retry);
                if (provider.isConfigured()) {
                    LOG.info("Provider ready: name={} priority={}", provider.name(), priority);
                } else {
                    LOG.warn("Provider '{}' is enabled in config but missing credentials - it will stay disabled", name);
                }
                providers.add(provider);
            } catch (Exception e) {
                LOG.error("Failed to build provider '{}': {}", name, e.getMessage());
            }
        }

        if (providers.stream().noneMatch(NotificationProvider::isEnabled)) {
            LOG.warn("No providers are configured and operational. Notifications cannot be delivered.");
        }
        return providers;
    }

    // ── Private builders ──────────────────────────────────────────────────────

    private static AbstractNotificationProvider buildProvider(
            final String name,
            final int priority,
            final Config cfg,
            final RetryExecutor retry) {
        return switch (name.toLowerCase()) {
            case "firebase" -> new FirebaseProvider(priority, true, retry,
                    cfgStr(cfg, "project-id"),
                    cfgStr(cfg, "client-email"),
                    cfgStr(cfg, "private-key"),
                    cfgStr(cfg, "token-uri", ServiceAccountTokenSource.DEFAULT_TOKEN_URI),
                    cfgStr(cfg, "endpoint",  FirebaseProvider.DEFAULT_ENDPOINT),
                    Clock.systemUTC());

            case "onesignal" -> cfg.hasPath("endpoint")
                    ? new OneSignalProvider(priority, true, retry,
                            cfgStr(cfg, "app-id"),
                            cfgStr(cfg, "rest-api-key"),
                            cfgStr(cfg, "endpoint"))
                    : new OneSignalProvider(priority, true, retry,
                            cfgStr(cfg, "app-id"),
                            cfgStr(cfg, "rest-api-key"));

            case "pusher" -> new PusherProvider(priority, true, retry,
                    cfgStr(cfg, "app-id"),
                    cfgStr(cfg, "key"),
                    cfgStr(cfg, "secret"),
                    cfgStr(cfg, "cluster"));

            default -> throw new IllegalArgumentException("Unknown provider: " + name);
        };
    }

    private static String cfgStr(final Config cfg, final String key) {
        return cfgStr(cfg, key, "");
    }

    private static String cfgStr(final Config cfg, final String key, final String fallback) {
        return cfg.hasPath(key) && !cfg.getString(key).isBlank() ? cfg.getString(key) : fallback;
    }
}
