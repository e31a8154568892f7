package com.pushhub.notification.scheduler;

import com.pushhub.notification.exception.ScheduleFormatException;

/** How often a scheduled job fires. */
public enum Frequency {

    /** A single firing at the next occurrence of the time of day. */
    ONCE("once"),

    /** Every day at the same local time until cancelled. */
    DAILY("daily");

    private final String value;

    Frequency(final String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * @param value {@code "once"} or {@code "daily"}; null means {@link #ONCE}
     * @throws ScheduleFormatException for any other value
     */
    public static Frequency fromValue(final String value) {
        if (value == null) {
            return ONCE;
        }
        for (final Frequency f : values()) {
            if (f.value.equals(value.trim())) {
                return f;
            }
        }
        throw new ScheduleFormatException("Frequency must be \"once\" or \"daily\", got \"" + value + "\"");
    }

    @Override
    public String toString() {
        return value;
    }
}
