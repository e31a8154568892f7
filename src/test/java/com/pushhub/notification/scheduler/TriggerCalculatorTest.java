package com.pushhub.notification.scheduler;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZonedDateTime;

import static org.assertj.core.api.Assertions.*;

class TriggerCalculatorTest {

    private final TriggerCalculator calculator = new TriggerCalculator();

    @Test
    void nextTrigger_rollsToTomorrow_whenTimeAlreadyPassed() {
        final var now  = Instant.parse("2026-03-10T10:00:00Z");
        final var next = calculator.nextTrigger(ScheduleSpec.once("09:00", "UTC"), now);

        assertThat(next.toInstant()).isEqualTo(Instant.parse("2026-03-11T09:00:00Z"));
    }

    @Test
    void nextTrigger_staysToday_whenTimeStillAhead() {
        final var now  = Instant.parse("2026-03-10T08:00:00Z");
        final var next = calculator.nextTrigger(ScheduleSpec.once("09:00", "UTC"), now);

        assertThat(next.toInstant()).isEqualTo(Instant.parse("2026-03-10T09:00:00Z"));
    }

    @Test
    void nextTrigger_firesImmediately_whenTimeIsNow() {
        final var now  = Instant.parse("2026-03-10T09:00:00Z");
        final var next = calculator.nextTrigger(ScheduleSpec.once("09:00", "UTC"), now);

        assertThat(next.toInstant()).isEqualTo(now);
    }

    @Test
    void nextTrigger_usesTheScheduleTimezone() {
        // 08:00 UTC is 17:00 in Tokyo, so 09:00 Tokyo time is tomorrow
        final var now  = Instant.parse("2026-03-10T08:00:00Z");
        final var next = calculator.nextTrigger(ScheduleSpec.once("09:00", "Asia/Tokyo"), now);

        assertThat(next.toInstant()).isEqualTo(Instant.parse("2026-03-11T00:00:00Z"));
        assertThat(next.getZone().getId()).isEqualTo("Asia/Tokyo");
    }

    @Test
    void nextTrigger_shiftsForwardInsideDstGap() {
        // 2026-03-29 02:30 does not exist in Europe/Berlin; clocks jump 02:00 -> 03:00
        final var now  = Instant.parse("2026-03-28T23:00:00Z");
        final var next = calculator.nextTrigger(ScheduleSpec.once("02:30", "Europe/Berlin"), now);

        assertThat(next.toLocalTime().toString()).isEqualTo("03:30");
        assertThat(next.toInstant()).isEqualTo(Instant.parse("2026-03-29T01:30:00Z"));
    }

    @Test
    void following_keepsLocalTime_acrossDstChange() {
        final var spec     = ScheduleSpec.daily("09:00", "America/New_York");
        final var previous = ZonedDateTime.parse("2026-03-07T09:00-05:00[America/New_York]");

        final var next = calculator.following(spec, previous);

        assertThat(next.toLocalDateTime().toString()).isEqualTo("2026-03-08T09:00");
        assertThat(next.toInstant()).isEqualTo(Instant.parse("2026-03-08T13:00:00Z"));
    }
}
