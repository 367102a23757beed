package com.smartroom.booking.api.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

import java.time.Instant;

/**
 * Omitting {@code recurrence} keeps the booking's current pattern.
 */
public record RescheduleBookingRequest(
        @NotNull(message = "Start time cannot be null")
        Instant startTime,

        @NotNull(message = "End time cannot be null")
        Instant endTime,

        @Valid
        RecurrenceRequest recurrence,

        @NotNull(message = "Expected version cannot be null")
        Long expectedVersion
) {
}
