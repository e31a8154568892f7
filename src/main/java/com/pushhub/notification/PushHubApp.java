package com.pushhub.notification;

import com.pushhub.notification.config.HubConfig;
import com.pushhub.notification.dispatch.NotificationDispatcher;
import com.pushhub.notification.health.HealthServer;
import com.pushhub.notification.model.ProviderStatus;
import com.pushhub.notification.provider.NotificationProvider;
import com.pushhub.notification.provider.ProviderFactory;
import com.pushhub.notification.retry.RetryExecutor;
import com.pushhub.notification.scheduler.NotificationScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CountDownLatch;

/**
 * Push Notification Hub: main entry point.
 *
 * <h2>Startup sequence</h2>
 * <ol>
 *   <li>Load and validate configuration</li>
 *   <li>Build providers (fail fast if none is operational)</li>
 *   <li>Create the dispatcher and start the scheduler</li>
 *   <li>Start the health server</li>
 *   <li>Register JVM shutdown hook for graceful shutdown</li>
 * </ol>
 */
public class PushHubApp {

    private static final Logger LOG = LoggerFactory.getLogger(PushHubApp.class);

    public static void main(final String[] args) throws Exception {
        LOG.info("=================================================");
        LOG.info("  Push Notification Hub  v1.0.0");
        LOG.info("=================================================");

        // ── 1. Configuration ──────────────────────────────────────────────────
        final HubConfig config = HubConfig.load();
        LOG.info("Configuration loaded. Retry: attempts={} baseDelayMs={}",
                config.getRetryAttempts(), config.getRetryBaseDelayMs());

        // ── 2. Providers ──────────────────────────────────────────────────────
        final RetryExecutor retry = new RetryExecutor(config);
        final List<NotificationProvider> providers = ProviderFactory.buildProviders(config, retry);

        if (providers.stream().noneMatch(NotificationProvider::isEnabled)) {
            LOG.error("No providers are configured - refusing to start. " +
                      "Set at least one Firebase, OneSignal or Pusher provider's credentials.");
            System.exit(1);
        }

        // ── 3. Core services ──────────────────────────────────────────────────
        final NotificationDispatcher dispatcher = new NotificationDispatcher(providers);
        final NotificationScheduler  scheduler  = new NotificationScheduler(config);
        scheduler.start();

        for (final ProviderStatus status : dispatcher.listProviders()) {
            LOG.info("Provider status: name={} enabled={} priority={}",
                    status.getName(), status.isEnabled(), status.getPriority());
        }

        // ── 4. Health server ──────────────────────────────────────────────────
        final HealthServer health = new HealthServer(config.getHealthPort(), dispatcher, scheduler);
        health.start();
        health.markReady();

        // ── 5. Shutdown hook ──────────────────────────────────────────────────
        final CountDownLatch shutdownLatch = new CountDownLatch(1);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            LOG.info("Shutdown hook triggered - starting graceful shutdown...");
            health.markNotReady();
            scheduler.close();
            dispatcher.close();
            health.stop();
            LOG.info("Push Notification Hub shut down cleanly.");
            shutdownLatch.countDown();
        }, "shutdown-hook"));

        LOG.info("Push Notification Hub is running. Press Ctrl+C to stop.");
        shutdownLatch.await();
    }
}
