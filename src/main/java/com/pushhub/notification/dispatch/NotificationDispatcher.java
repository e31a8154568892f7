package com.pushhub.notification.dispatch;

import com.pushhub.notification.exception.AllProvidersFailedException;
import com.pushhub.notification.exception.DispatchTimeoutException;
import com.pushhub.notification.exception.NotificationException;
import com.pushhub.notification.exception.ProviderNotFoundException;
import com.pushhub.notification.exception.ProviderSendException;
import com.pushhub.notification.exception.ProviderUnsupportedException;
import com.pushhub.notification.exception.ValidationException;
import com.pushhub.notification.model.BulkDispatchResult;
import com.pushhub.notification.model.BulkItemResult;
import com.pushhub.notification.model.CompatibilityReport;
import com.pushhub.notification.model.DeliveryReceipt;
import com.pushhub.notification.model.DispatchOptions;
import com.pushhub.notification.model.DispatchResult;
import com.pushhub.notification.model.Notification;
import com.pushhub.notification.model.ProviderAttempt;
import com.pushhub.notification.model.ProviderCompatibility;
import com.pushhub.notification.model.ProviderStatus;
import com.pushhub.notification.provider.NotificationProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Routes a {@link Notification} to exactly one {@link NotificationProvider}.
 *
 * <h2>Routing logic</h2>
 * <ol>
 *   <li>If {@link DispatchOptions#getProvider()} names a provider, only that
 *       provider is used; its failure is final.</li>
 *   <li>Otherwise iterate the providers in ascending priority. Disabled
 *       providers and providers that cannot handle the targeting fields are
 *       recorded as skipped. The first provider whose
 *       {@link NotificationProvider#sendWithRetry} succeeds wins; subsequent
 *       providers are <em>not</em> called.</li>
 *   <li>When every eligible provider fails, or none is eligible, the call
 *       raises {@link AllProvidersFailedException} with every recorded attempt.</li>
 * </ol>
 *
 * <p>Dispatch is sequential within a call: provider N+1 is only tried after
 * provider N, retries included, has finished. The provider list is fixed at
 * construction; only the providers' enabled flags change afterwards.
 */
public class NotificationDispatcher implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(NotificationDispatcher.class);

    private final List<NotificationProvider> providers;
    private final ExecutorService            workers;

    public NotificationDispatcher(final List<NotificationProvider> providers) {
        this.providers = providers.stream()
                .sorted(Comparator.comparingInt(NotificationProvider::priority))
                .collect(Collectors.toUnmodifiableList());
        // Unbounded: an async dispatch with a timeout occupies two workers at once
        this.workers = Executors.newCachedThreadPool(new WorkerThreadFactory());

        LOG.info("Initialized {} notification providers: {}", this.providers.size(),
                this.providers.stream().map(NotificationProvider::name).collect(Collectors.toList()));
    }

    /**
     * Deliver {@code notification} through one provider.
     *
     * @return the successful result; never null
     * @throws ProviderNotFoundException    explicit provider unknown or disabled
     * @throws ProviderUnsupportedException explicit provider cannot handle the targeting fields
     * @throws ProviderSendException        explicit provider failed after retries
     * @throws AllProvidersFailedException  failover exhausted every eligible provider
     * @throws DispatchTimeoutException     the optional timeout expired first
     */
    public DispatchResult dispatch(final Notification notification, final DispatchOptions options) {
        final Optional<Duration> timeout = options.getTimeout();
        if (timeout.isEmpty()) {
            return doDispatch(notification, options);
        }

        final Future<DispatchResult> future = workers.submit(() -> doDispatch(notification, options));
        try {
            return future.get(timeout.get().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            // The attempt keeps running on the worker; only the caller stops waiting
            LOG.warn("Dispatch timed out after {}ms: {}", timeout.get().toMillis(), notification);
            throw new DispatchTimeoutException(timeout.get());
        } catch (ExecutionException e) {
            throw unwrap(e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new NotificationException("Interrupted while waiting for dispatch", e);
        }
    }

    public DispatchResult dispatch(final Notification notification) {
        return dispatch(notification, DispatchOptions.defaults());
    }

    /**
     * Runs {@link #dispatch} on the dispatcher's worker pool. Failures complete
     * the future exceptionally with the same exception types.
     */
    public CompletableFuture<DispatchResult> dispatchAsync(
            final Notification notification,
            final DispatchOptions options) {
        return CompletableFuture.supplyAsync(() -> dispatch(notification, options), workers);
    }

    /**
     * Dispatch every notification in order, one at a time. A failing item is
     * recorded and never aborts the remaining items.
     */
    public BulkDispatchResult dispatchBulk(final List<Notification> notifications, final DispatchOptions options) {
        final List<BulkItemResult> results = new ArrayList<>(notifications.size());

        for (int i = 0; i < notifications.size(); i++) {
            final Notification notification = notifications.get(i);
            try {
                LOG.info("Processing bulk notification {}/{}", i + 1, notifications.size());
                results.add(BulkItemResult.success(i, notification, dispatch(notification, options)));
            } catch (RuntimeException e) {
                LOG.error("Failed to send bulk notification {}: {}", i + 1, e.getMessage());
                results.add(BulkItemResult.failure(i, notification, e.getMessage()));
            }
        }

        final BulkDispatchResult bulk = new BulkDispatchResult(results);
        LOG.info("Bulk dispatch finished: {}", bulk);
        return bulk;
    }

    /** Every configured provider in priority order. */
    public List<ProviderStatus> listProviders() {
        return providers.stream()
                .map(p -> new ProviderStatus(p.name(), p.isEnabled(), p.priority()))
                .collect(Collectors.toList());
    }

    /**
     * Administrative enable/disable; observed by the next dispatch decision.
     *
     * @throws ProviderNotFoundException if no provider matches {@code name}
     */
    public boolean setProviderEnabled(final String name, final boolean enabled) {
        final NotificationProvider provider = findProvider(name)
                .orElseThrow(() -> new ProviderNotFoundException(name, "Provider " + name + " not found"));
        provider.setEnabled(enabled);
        LOG.info("Provider {} {}", provider.name(), enabled ? "enabled" : "disabled");
        return true;
    }

    /**
     * Evaluates {@code validate} and {@code canHandle} for every provider without
     * sending anything.
     */
    public CompatibilityReport checkCompatibility(final Notification notification) {
        final List<ProviderCompatibility> entries = new ArrayList<>();

        for (final NotificationProvider provider : providers) {
            final boolean enabled = provider.isEnabled();
            try {
                provider.validate(notification);
                entries.add(new ProviderCompatibility(
                        provider.name(), enabled, true, provider.canHandle(notification), null));
            } catch (ValidationException e) {
                entries.add(new ProviderCompatibility(provider.name(), enabled, false, false, e.getMessage()));
            }
        }
        return new CompatibilityReport(entries);
    }

    @Override
    public void close() {
        workers.shutdown();
        try {
            if (!workers.awaitTermination(10, TimeUnit.SECONDS)) {
                LOG.warn("Dispatch workers did not terminate in 10s - forcing shutdown");
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            workers.shutdownNow();
        }
        providers.forEach(NotificationProvider::close);
    }

    // ── Private helpers ───────────────────────────────────────────────────────

    private DispatchResult doDispatch(final Notification notification, final DispatchOptions options) {
        if (providers.isEmpty()) {
            throw new AllProvidersFailedException(List.of());
        }
        final Optional<String> explicit = options.getProvider();
        if (explicit.isPresent()) {
            return dispatchToProvider(notification, explicit.get());
        }
        return dispatchWithFailover(notification, options.isFailover());
    }

    private DispatchResult dispatchToProvider(final Notification notification, final String name) {
        final NotificationProvider provider = findProvider(name)
                .filter(NotificationProvider::isEnabled)
                .orElseThrow(() -> new ProviderNotFoundException(name,
                        "Provider " + name + " not found or not enabled"));

        if (!provider.canHandle(notification)) {
            throw new ProviderUnsupportedException(provider.name(),
                    "Provider " + provider.name() + " cannot handle this notification type");
        }

        try {
            final DeliveryReceipt receipt = provider.sendWithRetry(notification);
            return new DispatchResult(provider.name(), receipt,
                    List.of(ProviderAttempt.success(provider.name())), 1);
        } catch (ValidationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ProviderSendException(provider.name(),
                    "Failed to send via " + name + ": " + e.getMessage(), e);
        }
    }

    private DispatchResult dispatchWithFailover(final Notification notification, final boolean failover) {
        final List<ProviderAttempt> attempts = new ArrayList<>();

        for (final NotificationProvider provider : providers) {
            if (!provider.isEnabled()) {
                LOG.info("Skipping disabled provider: {}", provider.name());
                attempts.add(ProviderAttempt.skipped(provider.name(), ProviderAttempt.REASON_DISABLED));
                continue;
            }
            if (!provider.canHandle(notification)) {
                LOG.info("Provider {} cannot handle this notification type", provider.name());
                attempts.add(ProviderAttempt.skipped(provider.name(), ProviderAttempt.REASON_UNSUPPORTED));
                continue;
            }

            try {
                LOG.info("Attempting to send notification via {}", provider.name());
                final DeliveryReceipt receipt = provider.sendWithRetry(notification);
                attempts.add(ProviderAttempt.success(provider.name()));

                LOG.info("Successfully sent via {} - stopping here", provider.name());
                return new DispatchResult(provider.name(), receipt, attempts, countHandling(notification));
            } catch (RuntimeException e) {
                LOG.error("Failed to send via {}: {}", provider.name(), e.getMessage());
                attempts.add(ProviderAttempt.failed(provider.name(), e.getMessage()));
            }

            if (!failover) {
                LOG.info("Failover disabled - not trying further providers");
                break;
            }
        }

        throw new AllProvidersFailedException(attempts);
    }

    private int countHandling(final Notification notification) {
        return (int) providers.stream().filter(p -> p.canHandle(notification)).count();
    }

    private Optional<NotificationProvider> findProvider(final String name) {
        return providers.stream()
                .filter(p -> p.name().equalsIgnoreCase(name))
                .findFirst();
    }

    private static RuntimeException unwrap(final Throwable cause) {
        if (cause instanceof CompletionException && cause.getCause() != null) {
            return unwrap(cause.getCause());
        }
        if (cause instanceof RuntimeException) {
            return (RuntimeException) cause;
        }
        return new NotificationException(cause.getMessage(), cause);
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(final Runnable r) {
            final Thread t = new Thread(r, "dispatch-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
