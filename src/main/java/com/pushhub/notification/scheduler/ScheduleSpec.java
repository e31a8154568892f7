package com.pushhub.notification.scheduler;

import com.pushhub.notification.exception.ScheduleFormatException;

import java.time.LocalTime;
import java.time.ZoneId;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Validated schedule descriptor: a 24-hour {@code HH:MM} time of day, an IANA
 * timezone and a {@link Frequency}.
 *
 * <p>Instances only exist in a valid state; {@link #of} rejects anything else
 * with {@link ScheduleFormatException}.
 */
public final class ScheduleSpec {

    public static final String DEFAULT_TIMEZONE = "UTC";

    private static final Pattern TIME = Pattern.compile("^([01][0-9]|2[0-3]):([0-5][0-9])$");

    private final LocalTime time;
    private final ZoneId    zone;
    private final Frequency frequency;

    private ScheduleSpec(final LocalTime time, final ZoneId zone, final Frequency frequency) {
        this.time      = time;
        this.zone      = zone;
        this.frequency = frequency;
    }

    /**
     * @param time      {@code HH:MM}, required
     * @param timezone  IANA zone name; null or blank means {@value #DEFAULT_TIMEZONE}
     * @param frequency {@code "once"} or {@code "daily"}; null means once
     */
    public static ScheduleSpec of(final String time, final String timezone, final String frequency) {
        return new ScheduleSpec(parseTime(time), parseZone(timezone), Frequency.fromValue(frequency));
    }

    public static ScheduleSpec once(final String time, final String timezone) {
        return of(time, timezone, Frequency.ONCE.value());
    }

    public static ScheduleSpec daily(final String time, final String timezone) {
        return of(time, timezone, Frequency.DAILY.value());
    }

    private static LocalTime parseTime(final String time) {
        if (time == null || time.isEmpty()) {
            throw new ScheduleFormatException("Schedule time is required");
        }
        final Matcher m = TIME.matcher(time);
        if (!m.matches()) {
            throw new ScheduleFormatException("Invalid time format \"" + time + "\". Use HH:MM (24-hour)");
        }
        return LocalTime.of(Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)));
    }

    private static ZoneId parseZone(final String timezone) {
        final String id = timezone == null || timezone.isBlank() ? DEFAULT_TIMEZONE : timezone.trim();
        if (!ZoneId.getAvailableZoneIds().contains(id)) {
            throw new ScheduleFormatException("Invalid timezone \"" + id + "\"");
        }
        return ZoneId.of(id);
    }

    public LocalTime localTime() { return time; }
    public ZoneId    zone()      { return zone; }

    /** The time of day as {@code HH:MM}. */
    public String    getTime()      { return time.toString(); }
    public String    getTimezone()  { return zone.getId(); }
    public Frequency getFrequency() { return frequency; }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (!(o instanceof ScheduleSpec)) return false;
        final ScheduleSpec other = (ScheduleSpec) o;
        return time.equals(other.time) && zone.equals(other.zone) && frequency == other.frequency;
    }

    @Override
    public int hashCode() {
        return (time.hashCode() * 31 + zone.hashCode()) * 31 + frequency.hashCode();
    }

    @Override
    public String toString() {
        return "ScheduleSpec{time=" + time + ", timezone=" + zone.getId() + ", frequency=" + frequency + "}";
    }
}
