package com.smartroom.booking.domain.repository;

import com.smartroom.booking.domain.model.Booking.BookingStatus;

import java.time.Instant;

/**
 * Filters for listing bookings. Null fields do not filter.
 *
 * @param startsFrom only bookings starting at or after this instant
 * @param endsBy     only bookings ending at or before this instant
 */
public record BookingSearchCriteria(
        Long userId,
        Long roomId,
        BookingStatus status,
        Instant startsFrom,
        Instant endsBy
) {

    public BookingSearchCriteria forUser(Long ownerId) {
        return new BookingSearchCriteria(ownerId, roomId, status, startsFrom, endsBy);
    }
}
