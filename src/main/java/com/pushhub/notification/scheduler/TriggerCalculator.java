package com.pushhub.notification.scheduler;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * Computes trigger instants for a {@link ScheduleSpec}.
 *
 * <p>Local times are resolved with {@link ZonedDateTime} rules: a time that
 * falls in a DST gap moves forward by the gap length, an ambiguous time in an
 * overlap takes the earlier offset.
 */
public class TriggerCalculator {

    /**
     * The next occurrence of the schedule's time of day relative to {@code now}:
     * today in the schedule's zone, or tomorrow when today's occurrence is already
     * in the past.
     */
    public ZonedDateTime nextTrigger(final ScheduleSpec spec, final Instant now) {
        final ZoneId    zone  = spec.zone();
        final LocalDate today = now.atZone(zone).toLocalDate();

        final ZonedDateTime candidate = today.atTime(spec.localTime()).atZone(zone);
        if (candidate.toInstant().isBefore(now)) {
            return today.plusDays(1).atTime(spec.localTime()).atZone(zone);
        }
        return candidate;
    }

    /** The daily occurrence after {@code previous}, at the same local time. */
    public ZonedDateTime following(final ScheduleSpec spec, final ZonedDateTime previous) {
        final LocalDate next = previous.withZoneSameInstant(spec.zone()).toLocalDate().plusDays(1);
        return next.atTime(spec.localTime()).atZone(spec.zone());
    }
}
