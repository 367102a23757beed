package com.smartroom.booking.domain.model;

/**
 * One concrete time slot of a booking. {@code bookingId} is null for the candidate
 * occurrences of a booking that has not been persisted yet.
 */
public record Occurrence(Long bookingId, TimeRange range, int sequenceIndex) {

    public Occurrence {
        if (range == null) {
            throw new IllegalArgumentException("Occurrence range is required");
        }
        if (sequenceIndex < 0) {
            throw new IllegalArgumentException("Occurrence sequence index must be non-negative");
        }
    }

    public boolean belongsToSameBooking(Occurrence other) {
        return bookingId != null && bookingId.equals(other.bookingId);
    }
}
