package com.smartroom.booking.api.dto;

import jakarta.validation.constraints.Positive;

/**
 * Omitted fields stay as they are. Use a reschedule to move the booking in time.
 */
public record UpdateBookingDetailsRequest(
        String title,

        String description,

        @Positive(message = "Attendees must be a positive number")
        Integer attendees,

        Long expectedVersion
) {
}
