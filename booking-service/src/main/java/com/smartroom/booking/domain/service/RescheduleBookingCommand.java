package com.smartroom.booking.domain.service;

import com.smartroom.booking.domain.model.Actor;
import com.smartroom.booking.domain.model.RecurrencePattern;
import com.smartroom.booking.domain.model.TimeRange;

/**
 * @param recurrence      new pattern, or null to keep the booking's current one
 * @param expectedVersion version the caller last read; the move fails as stale if it has changed
 */
public record RescheduleBookingCommand(
        Long bookingId,
        Actor actor,
        TimeRange range,
        RecurrencePattern recurrence,
        Long expectedVersion
) {
}
