package com.smartroom.booking.domain.service;

import com.smartroom.booking.domain.model.RecurrencePattern;
import com.smartroom.booking.domain.model.RecurrencePattern.Frequency;
import com.smartroom.booking.domain.model.TimeRange;
import com.smartroom.booking.exception.InvalidRecurrenceException;
import lombok.extern.slf4j.Slf4j;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Expands a base range and recurrence pattern into the concrete occurrence ranges of a series.
 *
 * Calendar arithmetic happens in a fixed zone so that "every Monday at 10:00" keeps its wall-clock
 * time across DST changes. Each occurrence keeps the base range's duration. The output is
 * ascending and deterministic for identical inputs.
 */
@Slf4j
public class RecurrenceExpander {

    /** A monthly series on day 31 hits at most a few months in a row without that day. */
    private static final int MAX_CONSECUTIVE_SKIPS = 48;

    private final ZoneId zone;

    public RecurrenceExpander(ZoneId zone) {
        this.zone = zone;
    }

    /**
     * @param horizonLimit maximum number of occurrences produced, whatever the pattern's own bound
     */
    public List<TimeRange> expand(TimeRange base, RecurrencePattern pattern, int horizonLimit) {
        if (horizonLimit <= 0) {
            throw new IllegalArgumentException("Horizon limit must be positive");
        }
        if (pattern == null || !pattern.repeats()) {
            validateSingle(pattern);
            return List.of(base);
        }
        validate(base, pattern);

        int limit = pattern.count() != null ? Math.min(pattern.count(), horizonLimit) : horizonLimit;
        ZonedDateTime start = base.start().atZone(zone);
        Duration duration = base.duration();

        List<TimeRange> ranges;
        if (pattern.frequency() == Frequency.DAILY) {
            ranges = expandDaily(start, duration, pattern, limit);
        } else if (pattern.frequency() == Frequency.WEEKLY) {
            ranges = expandWeekly(start, duration, pattern, limit);
        } else {
            ranges = expandMonthly(start, duration, pattern, limit);
        }
        if (ranges.size() == horizonLimit && (pattern.count() == null || pattern.count() > horizonLimit)) {
            log.warn("Recurrence truncated at horizon: base={}, frequency={}, limit={}",
                    base.start(), pattern.frequency(), horizonLimit);
        }
        return ranges;
    }

    private List<TimeRange> expandDaily(ZonedDateTime start, Duration duration,
                                        RecurrencePattern pattern, int limit) {
        List<TimeRange> ranges = new ArrayList<>();
        LocalDate date = start.toLocalDate();
        while (ranges.size() < limit) {
            ZonedDateTime occurrenceStart = atTime(date, start.toLocalTime());
            if (pastEnd(occurrenceStart, pattern)) {
                break;
            }
            ranges.add(rangeAt(occurrenceStart, duration));
            date = date.plusDays(pattern.interval());
        }
        return ranges;
    }

    private List<TimeRange> expandWeekly(ZonedDateTime start, Duration duration,
                                         RecurrencePattern pattern, int limit) {
        LocalDate baseDate = start.toLocalDate();
        Set<DayOfWeek> days = pattern.daysOfWeek().isEmpty()
                ? EnumSet.of(baseDate.getDayOfWeek())
                : EnumSet.copyOf(pattern.daysOfWeek());

        List<TimeRange> ranges = new ArrayList<>();
        LocalDate weekStart = baseDate.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
        while (true) {
            for (DayOfWeek day : days) {
                LocalDate date = weekStart.plusDays(day.getValue() - 1L);
                if (date.isBefore(baseDate)) {
                    continue;
                }
                ZonedDateTime occurrenceStart = atTime(date, start.toLocalTime());
                if (pastEnd(occurrenceStart, pattern)) {
                    return ranges;
                }
                ranges.add(rangeAt(occurrenceStart, duration));
                if (ranges.size() >= limit) {
                    return ranges;
                }
            }
            weekStart = weekStart.plusWeeks(pattern.interval());
        }
    }

    private List<TimeRange> expandMonthly(ZonedDateTime start, Duration duration,
                                          RecurrencePattern pattern, int limit) {
        LocalDate baseDate = start.toLocalDate();
        int dayOfMonth = baseDate.getDayOfMonth();

        List<TimeRange> ranges = new ArrayList<>();
        LocalDate monthStart = baseDate.withDayOfMonth(1);
        int consecutiveSkips = 0;
        while (ranges.size() < limit) {
            if (dayOfMonth > monthStart.lengthOfMonth()) {
                if (++consecutiveSkips > MAX_CONSECUTIVE_SKIPS) {
                    throw new InvalidRecurrenceException(
                            "Monthly recurrence on day " + dayOfMonth + " never matches its interval");
                }
                monthStart = monthStart.plusMonths(pattern.interval());
                continue;
            }
            consecutiveSkips = 0;
            ZonedDateTime occurrenceStart = atTime(monthStart.withDayOfMonth(dayOfMonth), start.toLocalTime());
            if (pastEnd(occurrenceStart, pattern)) {
                break;
            }
            ranges.add(rangeAt(occurrenceStart, duration));
            monthStart = monthStart.plusMonths(pattern.interval());
        }
        return ranges;
    }

    private ZonedDateTime atTime(LocalDate date, LocalTime time) {
        return ZonedDateTime.of(date, time, zone);
    }

    private static boolean pastEnd(ZonedDateTime occurrenceStart, RecurrencePattern pattern) {
        return pattern.endDate() != null && occurrenceStart.toInstant().isAfter(pattern.endDate());
    }

    private static TimeRange rangeAt(ZonedDateTime occurrenceStart, Duration duration) {
        return new TimeRange(occurrenceStart.toInstant(), occurrenceStart.toInstant().plus(duration));
    }

    private static void validateSingle(RecurrencePattern pattern) {
        if (pattern != null && !pattern.daysOfWeek().isEmpty()) {
            throw new InvalidRecurrenceException("Days of week only apply to weekly recurrence");
        }
    }

    private void validate(TimeRange base, RecurrencePattern pattern) {
        if (pattern.interval() <= 0) {
            throw new InvalidRecurrenceException("Recurrence interval must be positive, got " + pattern.interval());
        }
        if (pattern.endDate() != null && pattern.count() != null) {
            throw new InvalidRecurrenceException("Recurrence may be bounded by an end date or a count, not both");
        }
        if (pattern.endDate() == null && pattern.count() == null) {
            throw new InvalidRecurrenceException("Recurring booking needs an end date or an occurrence count");
        }
        if (pattern.count() != null && pattern.count() <= 0) {
            throw new InvalidRecurrenceException("Recurrence count must be positive, got " + pattern.count());
        }
        if (pattern.endDate() != null && pattern.endDate().isBefore(base.start())) {
            throw new InvalidRecurrenceException("Recurrence end date " + pattern.endDate()
                    + " is before the first occurrence " + base.start());
        }
        if (pattern.frequency() != Frequency.WEEKLY && !pattern.daysOfWeek().isEmpty()) {
            throw new InvalidRecurrenceException("Days of week only apply to weekly recurrence");
        }
        if (pattern.frequency() == Frequency.WEEKLY && !pattern.daysOfWeek().isEmpty()) {
            DayOfWeek baseDay = base.start().atZone(zone).getDayOfWeek();
            if (!pattern.daysOfWeek().contains(baseDay)) {
                throw new InvalidRecurrenceException(
                        "Weekly recurrence days " + pattern.daysOfWeek() + " must include the first occurrence's " + baseDay);
            }
        }
    }
}
