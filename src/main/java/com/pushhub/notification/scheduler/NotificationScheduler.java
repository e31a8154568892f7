package com.pushhub.notification.scheduler;

import com.pushhub.notification.config.HubConfig;
import com.pushhub.notification.dispatch.NotificationDispatcher;
import com.pushhub.notification.exception.JobNotFoundException;
import com.pushhub.notification.model.DispatchOptions;
import com.pushhub.notification.model.DispatchResult;
import com.pushhub.notification.model.Notification;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Defers notification dispatch to a time of day, once or every day.
 *
 * <h2>Job lifecycle</h2>
 * <ol>
 *   <li>{@link #schedule} receives an already validated {@link ScheduleSpec}
 *       (malformed input fails in {@link ScheduleSpec#of} before any job
 *       exists). The first trigger is computed by the {@link TriggerCalculator},
 *       the job is registered and its timer armed. The call returns
 *       immediately.</li>
 *   <li>When the timer fires, the job calls
 *       {@link NotificationDispatcher#dispatch}. Success and failure are logged
 *       and recorded on the job, never reported to the original caller.</li>
 *   <li>{@link Frequency#ONCE} jobs leave the registry after that single firing,
 *       whatever its outcome. {@link Frequency#DAILY} jobs are re-armed for the
 *       same local time on the next day.</li>
 * </ol>
 *
 * <p>Jobs live in memory only and are lost when the process stops. Several
 * jobs may fire at the same time on the timer pool; a daily job is re-armed
 * only after its previous firing has completed.
 */
public class NotificationScheduler implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(NotificationScheduler.class);
    private static final String ID_ALPHABET = "0123456789abcdefghijklmnopqrstuvwxyz";

    private final ScheduledExecutorService   timer;
    private final TriggerCalculator          triggers;
    private final Clock                      clock;
    private final Map<String, ScheduledJob>  jobs    = new ConcurrentHashMap<>();
    private final AtomicBoolean              running = new AtomicBoolean(false);
    private final Object                     lifecycle = new Object();

    public NotificationScheduler(final HubConfig config) {
        this(Executors.newScheduledThreadPool(Math.max(1, config.getSchedulerThreads()), new TimerThreadFactory()),
                new TriggerCalculator(), Clock.systemUTC());
    }

    public NotificationScheduler(
            final ScheduledExecutorService timer,
            final TriggerCalculator triggers,
            final Clock clock) {
        this.timer    = timer;
        this.triggers = triggers;
        this.clock    = clock;
    }

    public void start() {
        synchronized (lifecycle) {
            running.set(true);
        }
        LOG.info("Scheduler service started");
    }

    /**
     * Disarm every job and clear the registry. Safe to call repeatedly; the
     * scheduler can be started again afterwards.
     */
    public void stop() {
        final boolean            wasRunning;
        final List<ScheduledJob> drained;
        synchronized (lifecycle) {
            wasRunning = running.getAndSet(false);
            drained    = new ArrayList<>(jobs.values());
            jobs.clear();
        }
        drained.forEach(ScheduledJob::cancel);
        if (wasRunning || !drained.isEmpty()) {
            LOG.info("Scheduler service stopped: {} jobs disarmed", drained.size());
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    public ScheduleResult schedule(
            final Notification notification,
            final ScheduleSpec spec,
            final NotificationDispatcher dispatcher) {
        return schedule(notification, spec, dispatcher, DispatchOptions.defaults());
    }

    /**
     * Register a deferred dispatch.
     *
     * @throws IllegalStateException if the scheduler is not running, or stops
     *         or has its timer shut down before the job is armed
     */
    public ScheduleResult schedule(
            final Notification notification,
            final ScheduleSpec spec,
            final NotificationDispatcher dispatcher,
            final DispatchOptions options) {
        final ZonedDateTime first = triggers.nextTrigger(spec, clock.instant());
        final ScheduledJob  job;
        // stop() drains the registry under the same lock, so no job can slip in after it
        synchronized (lifecycle) {
            if (!running.get()) {
                throw new IllegalStateException("Scheduler service is not running");
            }
            job = register(notification, spec, options);
        }

        try {
            arm(job, dispatcher, first);
        } catch (RejectedExecutionException e) {
            jobs.remove(job.getId(), job);
            job.cancel();
            LOG.error("Scheduler timer rejected job {}: {}", job.getId(), e.getMessage());
            throw new IllegalStateException("Scheduler timer is shut down", e);
        }
        if (job.getState() == JobState.CANCELLED && !running.get()) {
            throw new IllegalStateException("Scheduler service stopped while scheduling");
        }

        LOG.info("Notification scheduled: jobId={} time={} timezone={} frequency={} scheduledFor={}",
                job.getId(), spec.getTime(), spec.getTimezone(), spec.getFrequency(), first);

        return new ScheduleResult(job.getId(), first, spec.getFrequency(), spec.getTimezone());
    }

    /**
     * Disarm and remove a job. A firing already in progress completes.
     *
     * @return false if no job with this id is registered
     */
    public boolean cancel(final String jobId) {
        final ScheduledJob job = jobs.remove(jobId);
        if (job == null) {
            return false;
        }
        job.cancel();
        LOG.info("Scheduled job removed: {}", jobId);
        return true;
    }

    /**
     * @throws JobNotFoundException if no job with this id is registered
     */
    public JobSnapshot getJob(final String jobId) {
        return findJob(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
    }

    public Optional<JobSnapshot> findJob(final String jobId) {
        return Optional.ofNullable(jobs.get(jobId)).map(ScheduledJob::snapshot);
    }

    /** Snapshots of every registered job, oldest first. */
    public List<JobSnapshot> listActive() {
        return jobs.values().stream()
                .map(ScheduledJob::snapshot)
                .sorted(Comparator.comparing(JobSnapshot::getCreatedAt).thenComparing(JobSnapshot::getId))
                .collect(Collectors.toList());
    }

    @Override
    public void close() {
        stop();
        timer.shutdownNow();
    }

    // ── Private ───────────────────────────────────────────────────────────────

    private ScheduledJob register(
            final Notification notification,
            final ScheduleSpec spec,
            final DispatchOptions options) {
        while (true) {
            final ScheduledJob job = new ScheduledJob(newJobId(), notification, spec, options, clock.instant());
            if (jobs.putIfAbsent(job.getId(), job) == null) {
                return job;
            }
        }
    }

    private void arm(final ScheduledJob job, final NotificationDispatcher dispatcher, final ZonedDateTime trigger) {
        final long delayMs = Math.max(0L, Duration.between(clock.instant(), trigger.toInstant()).toMillis());
        // Holding the job lock keeps a zero-delay firing from recording before the handle is attached
        synchronized (job) {
            final ScheduledFuture<?> handle = timer.schedule(() -> fire(job, dispatcher), delayMs, TimeUnit.MILLISECONDS);
            if (!job.arm(handle, trigger)) {
                LOG.debug("Job {} was cancelled before it could be armed", job.getId());
            }
        }
    }

    private void fire(final ScheduledJob job, final NotificationDispatcher dispatcher) {
        LOG.info("Executing scheduled notification: {}", job.getId());

        String outcome;
        try {
            final DispatchResult result = dispatcher.dispatch(job.getNotification(), job.getOptions());
            outcome = "delivered via " + result.getUsedProvider();
            LOG.info("Scheduled notification sent successfully: jobId={} result={}", job.getId(), result);
        } catch (RuntimeException e) {
            outcome = "failed: " + e.getMessage();
            LOG.error("Failed to send scheduled notification: jobId={} error={}", job.getId(), e.getMessage());
        }

        job.recordFiring(clock.instant(), outcome);

        if (job.getSpec().getFrequency() == Frequency.ONCE) {
            if (jobs.remove(job.getId(), job)) {
                LOG.info("Scheduled job removed: {}", job.getId());
            }
            return;
        }
        rearm(job, dispatcher);
    }

    private void rearm(final ScheduledJob job, final NotificationDispatcher dispatcher) {
        synchronized (job) {
            if (jobs.get(job.getId()) != job || job.getState() == JobState.CANCELLED) {
                return;
            }
            final ZonedDateTime next = triggers.following(job.getSpec(), job.getNextTrigger());
            try {
                arm(job, dispatcher, next);
            } catch (RejectedExecutionException e) {
                jobs.remove(job.getId(), job);
                job.cancel();
                LOG.warn("Daily job dropped, scheduler timer is shut down: jobId={}", job.getId());
                return;
            }
            LOG.info("Daily job re-armed: jobId={} nextTrigger={}", job.getId(), next);
        }
    }

    private String newJobId() {
        final ThreadLocalRandom rnd = ThreadLocalRandom.current();
        final StringBuilder sb = new StringBuilder("notif_").append(clock.millis()).append('_');
        for (int i = 0; i < 9; i++) {
            sb.append(ID_ALPHABET.charAt(rnd.nextInt(ID_ALPHABET.length())));
        }
        return sb.toString();
    }

    private static final class TimerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(final Runnable r) {
            final Thread t = new Thread(r, "notification-scheduler-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
