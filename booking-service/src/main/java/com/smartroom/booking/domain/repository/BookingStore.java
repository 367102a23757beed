package com.smartroom.booking.domain.repository;

import com.smartroom.booking.domain.model.Booking;
import com.smartroom.booking.domain.model.Occurrence;
import com.smartroom.booking.domain.model.TimeRange;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Persistence port of the booking engine.
 *
 * Every write is atomic: a booking and its whole occurrence set are stored together, and an
 * update whose version no longer matches the stored one fails with
 * {@link com.smartroom.booking.exception.StaleBookingException} leaving the stored state untouched.
 */
public interface BookingStore {

    Optional<Booking> findById(Long bookingId);

    List<Booking> findByUserId(Long userId);

    /** One page of bookings matching the criteria, in the page request's order. */
    Page<Booking> search(BookingSearchCriteria criteria, Pageable pageable);

    /** PENDING and CONFIRMED bookings of the room. */
    List<Booking> findActiveByRoom(Long roomId);

    /** Active bookings of the room with at least a chance of an occurrence inside the window. */
    List<Booking> findActiveByRoomOverlapping(Long roomId, TimeRange window);

    Booking save(Booking booking);

    /**
     * Stores an admitted booking and, in the same transaction, supersedes the given bookings in
     * its favour. Bookings that stopped being active since they were read are skipped; the
     * returned write lists only the bookings actually superseded.
     */
    AdmissionWrite saveAdmission(Booking admitted, Collection<Long> supersededIds, Instant at);

    /**
     * Occurrences of active bookings in the room that overlap the window.
     */
    default List<Occurrence> findActiveOccurrences(Long roomId, TimeRange window) {
        return findActiveByRoomOverlapping(roomId, window).stream()
                .flatMap(booking -> booking.getOccurrences().stream())
                .filter(occurrence -> occurrence.range().overlaps(window))
                .collect(Collectors.toList());
    }

    default List<Occurrence> findActiveOccurrences(Long roomId) {
        return findActiveByRoom(roomId).stream()
                .flatMap(booking -> booking.getOccurrences().stream())
                .collect(Collectors.toList());
    }

    record AdmissionWrite(Booking admitted, List<Booking> superseded) {
        public AdmissionWrite {
            superseded = List.copyOf(superseded);
        }
    }
}
