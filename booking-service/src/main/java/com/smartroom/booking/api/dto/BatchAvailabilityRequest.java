package com.smartroom.booking.api.dto;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.time.Instant;
import java.util.List;

public record BatchAvailabilityRequest(
        @NotEmpty(message = "Room IDs cannot be empty")
        @Size(max = 50, message = "At most 50 rooms per request")
        List<Long> roomIds,

        @NotNull(message = "From cannot be null")
        Instant from,

        @NotNull(message = "To cannot be null")
        Instant to
) {
}
