package com.smartroom.booking.domain.service;

import com.smartroom.booking.domain.model.Actor;
import com.smartroom.booking.domain.model.RecurrencePattern;
import com.smartroom.booking.domain.model.TimeRange;

/**
 * @param attendees  expected head count, checked against the room's capacity; null if unknown
 * @param recurrence null for a single booking
 * @param override   force-confirm over conflicts, superseding them; only for roles allowed to override
 */
public record CreateBookingCommand(
        Long roomId,
        Actor actor,
        String title,
        String description,
        Integer attendees,
        TimeRange range,
        RecurrencePattern recurrence,
        boolean override
) {
}
