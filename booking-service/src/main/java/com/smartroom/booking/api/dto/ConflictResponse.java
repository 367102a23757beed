package com.smartroom.booking.api.dto;

import com.smartroom.booking.domain.model.OccurrenceConflict;
import com.smartroom.booking.domain.model.TimeRange;

/**
 * @param candidateBookingId null when the candidate is a booking that was not admitted
 * @param candidateIndex     position of the candidate occurrence in its series
 */
public record ConflictResponse(
        Long candidateBookingId,
        int candidateIndex,
        TimeRange candidate,
        Long existingBookingId,
        TimeRange existing
) {
    public static ConflictResponse from(OccurrenceConflict conflict) {
        return new ConflictResponse(
                conflict.candidate().bookingId(),
                conflict.candidate().sequenceIndex(),
                conflict.candidate().range(),
                conflict.existing().bookingId(),
                conflict.existing().range()
        );
    }
}
