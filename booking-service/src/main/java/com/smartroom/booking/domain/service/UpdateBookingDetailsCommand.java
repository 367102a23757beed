package com.smartroom.booking.domain.service;

import com.smartroom.booking.domain.model.Actor;

/**
 * Changes to the descriptive fields of a booking. A null field is left as it is.
 *
 * @param expectedVersion when given, the update only applies to that version of the booking
 */
public record UpdateBookingDetailsCommand(
        Long bookingId,
        Actor actor,
        String title,
        String description,
        Integer attendees,
        Long expectedVersion
) {
}
