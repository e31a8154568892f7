package com.pushhub.notification.retry;

import com.pushhub.notification.config.HubConfig;
import com.pushhub.notification.exception.NotificationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Callable;

/**
 * Executes a provider send with a fixed number of attempts and linear back-off.
 *
 * <p>Any exception thrown by the operation counts as a failed attempt. The
 * first successful return value is handed back immediately; once every
 * attempt has failed, the last exception is rethrown.
 *
 * <h2>Back-off formula</h2>
 * <pre>
 *   delay(attempt) = baseDelay × attempt      (attempt is 1-based)
 * </pre>
 * With the defaults (3 attempts, 1000 ms) a send that keeps failing waits
 * 1 s after the first attempt and 2 s after the second.
 */
public class RetryExecutor {

    private static final Logger LOG = LoggerFactory.getLogger(RetryExecutor.class);

    /** Pause between attempts; replaced in tests to observe delays without waiting. */
    @FunctionalInterface
    public interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }

    private final int     defaultAttempts;
    private final long    baseDelayMs;
    private final Sleeper sleeper;

    public RetryExecutor(final HubConfig config) {
        this(config.getRetryAttempts(), config.getRetryBaseDelayMs(), Thread::sleep);
    }

    public RetryExecutor(final int defaultAttempts, final long baseDelayMs, final Sleeper sleeper) {
        if (defaultAttempts < 1) {
            throw new IllegalArgumentException("retry attempts must be >= 1, got " + defaultAttempts);
        }
        if (baseDelayMs < 0) {
            throw new IllegalArgumentException("retry base delay must be >= 0, got " + baseDelayMs);
        }
        this.defaultAttempts = defaultAttempts;
        this.baseDelayMs     = baseDelayMs;
        this.sleeper         = sleeper;
    }

    public int getDefaultAttempts() {
        return defaultAttempts;
    }

    public <T> T execute(final Callable<T> operation, final String description) {
        return execute(operation, defaultAttempts, description);
    }

    /**
     * Execute {@code operation} up to {@code attempts} times.
     *
     * @param operation   the send call to attempt
     * @param attempts    maximum number of calls, at least 1
     * @param description human-readable description for log messages
     * @return the first successful result
     * @throws RuntimeException the last failure once all attempts are exhausted
     */
    public <T> T execute(final Callable<T> operation, final int attempts, final String description) {
        if (attempts < 1) {
            throw new IllegalArgumentException("attempts must be >= 1, got " + attempts);
        }

        Exception lastError = null;

        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                final T result = operation.call();
                if (attempt > 1) {
                    LOG.info("Retry succeeded: {} on attempt {}/{}", description, attempt, attempts);
                }
                return result;
            } catch (Exception e) {
                lastError = e;
                LOG.warn("Send failed (attempt {}/{}): {} - {}", attempt, attempts, description, e.getMessage());

                if (attempt < attempts && !pause(backoffDelay(attempt))) {
                    LOG.warn("Retry interrupted after attempt {}/{}: {}", attempt, attempts, description);
                    break;
                }
            }
        }

        LOG.error("All retry attempts exhausted for: {}", description);
        throw asUnchecked(lastError);
    }

    long backoffDelay(final int attempt) {
        return baseDelayMs * attempt;
    }

    private boolean pause(final long ms) {
        try {
            sleeper.sleep(ms);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static RuntimeException asUnchecked(final Exception e) {
        if (e instanceof RuntimeException) {
            return (RuntimeException) e;
        }
        return new NotificationException(e.getMessage(), e);
    }
}
