package com.smartroom.booking.api.dto;

import com.smartroom.booking.domain.model.RecurrencePattern;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.time.DayOfWeek;
import java.time.Instant;
import java.util.Set;

public record RecurrenceRequest(
        @NotNull(message = "Frequency cannot be null")
        RecurrencePattern.Frequency frequency,

        @Positive(message = "Interval must be positive")
        Integer interval,

        Instant endDate,

        Set<DayOfWeek> daysOfWeek,

        @Positive(message = "Count must be positive")
        Integer count
) {
    public RecurrencePattern toPattern() {
        return new RecurrencePattern(frequency, interval == null ? 1 : interval, endDate, daysOfWeek, count);
    }
}
