package com.smartroom.booking.domain.model;

import java.time.DayOfWeek;
import java.time.Instant;
import java.util.Set;

/**
 * How a booking repeats. Immutable; a reschedule replaces the whole pattern.
 *
 * A repeating pattern is bounded by exactly one of {@code endDate} or {@code count}.
 * {@code daysOfWeek} only applies to {@link Frequency#WEEKLY}; empty means the base weekday.
 */
public record RecurrencePattern(
        Frequency frequency,
        int interval,
        Instant endDate,
        Set<DayOfWeek> daysOfWeek,
        Integer count
) {
    public enum Frequency {
        NONE,
        DAILY,
        WEEKLY,
        MONTHLY
    }

    public RecurrencePattern {
        frequency = frequency == null ? Frequency.NONE : frequency;
        daysOfWeek = daysOfWeek == null ? Set.of() : Set.copyOf(daysOfWeek);
    }

    public static RecurrencePattern once() {
        return new RecurrencePattern(Frequency.NONE, 1, null, Set.of(), null);
    }

    public static RecurrencePattern times(Frequency frequency, int interval, int count) {
        return new RecurrencePattern(frequency, interval, null, Set.of(), count);
    }

    public static RecurrencePattern until(Frequency frequency, int interval, Instant endDate) {
        return new RecurrencePattern(frequency, interval, endDate, Set.of(), null);
    }

    public RecurrencePattern onDays(Set<DayOfWeek> days) {
        return new RecurrencePattern(frequency, interval, endDate, days, count);
    }

    public boolean repeats() {
        return frequency != Frequency.NONE;
    }
}
