package com.smartroom.booking.domain.service;

import com.smartroom.booking.config.BookingEngineProperties;
import com.smartroom.booking.domain.model.Actor;
import com.smartroom.booking.domain.model.Booking;
import com.smartroom.booking.domain.repository.BookingSearchCriteria;
import com.smartroom.booking.domain.repository.BookingStore;
import com.smartroom.booking.exception.BookingAccessDeniedException;
import com.smartroom.common.exception.ResourceNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Read side of bookings. Owners see their own bookings; managers, admins and auditors see all.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BookingService {

    static final Sort LATEST_FIRST = Sort.by(Sort.Order.desc("startTime"), Sort.Order.desc("id"));

    private final BookingStore bookingStore;
    private final BookingEngineProperties properties;

    /**
     * Retrieves booking by ID.
     */
    public Booking getBooking(Long bookingId, Actor actor) {
        Booking booking = bookingStore.findById(bookingId)
                .orElseThrow(() -> new ResourceNotFoundException("Booking", bookingId));
        if (!actor.canView(booking)) {
            log.warn("User {} denied read access to booking {}", actor.userId(), bookingId);
            throw new BookingAccessDeniedException("User " + actor.userId() + " may not view booking " + bookingId);
        }
        return booking;
    }

    /**
     * Retrieves all bookings for a user, most recent first.
     */
    public List<Booking> getBookingsForUser(Long userId, Actor actor) {
        if (!actor.userId().equals(userId) && !actor.role().canViewAll()) {
            throw new BookingAccessDeniedException("User " + actor.userId() + " may not list bookings of user " + userId);
        }
        return bookingStore.findByUserId(userId);
    }

    /**
     * Lists bookings page by page, latest start first. Callers without a view-all role only
     * ever see their own bookings, whatever the criteria say.
     *
     * @param page    1-based; anything lower reads the first page
     * @param perPage capped at the configured maximum page size
     */
    public Page<Booking> listBookings(BookingSearchCriteria criteria, Actor actor, int page, int perPage) {
        BookingSearchCriteria scoped = actor.role().canViewAll() ? criteria : criteria.forUser(actor.userId());
        int safePage = Math.max(page, 1) - 1;
        int safeSize = Math.min(Math.max(perPage, 1), properties.getPolicy().getMaxPageSize());
        Page<Booking> result = bookingStore.search(scoped, PageRequest.of(safePage, safeSize, LATEST_FIRST));
        log.debug("Listed bookings for user {}: criteria={}, page={}, size={}, total={}",
                actor.userId(), scoped, safePage + 1, safeSize, result.getTotalElements());
        return result;
    }
}
