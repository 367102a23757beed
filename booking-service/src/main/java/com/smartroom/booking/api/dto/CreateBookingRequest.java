package com.smartroom.booking.api.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.time.Instant;

public record CreateBookingRequest(
        @NotNull(message = "Room ID cannot be null")
        Long roomId,

        String title,

        String description,

        @Positive(message = "Attendees must be a positive number")
        Integer attendees,

        @NotNull(message = "Start time cannot be null")
        Instant startTime,

        @NotNull(message = "End time cannot be null")
        Instant endTime,

        @Valid
        RecurrenceRequest recurrence,

        boolean override
) {
}
