package com.smartroom.booking.domain.repository;

import com.smartroom.booking.domain.model.Booking;
import com.smartroom.booking.domain.model.Booking.BookingStatus;
import org.springframework.data.jpa.domain.Specification;

import java.time.Instant;

/**
 * Query building blocks for {@link BookingSearchCriteria}.
 */
final class BookingSpecifications {

    private BookingSpecifications() {
    }

    static Specification<Booking> matching(BookingSearchCriteria criteria) {
        return Specification.where(ownedBy(criteria.userId()))
                .and(inRoom(criteria.roomId()))
                .and(withStatus(criteria.status()))
                .and(startingFrom(criteria.startsFrom()))
                .and(endingBy(criteria.endsBy()));
    }

    static Specification<Booking> ownedBy(Long userId) {
        return (root, query, cb) -> userId == null ? null : cb.equal(root.get("userId"), userId);
    }

    static Specification<Booking> inRoom(Long roomId) {
        return (root, query, cb) -> roomId == null ? null : cb.equal(root.get("roomId"), roomId);
    }

    static Specification<Booking> withStatus(BookingStatus status) {
        return (root, query, cb) -> status == null ? null : cb.equal(root.get("status"), status);
    }

    static Specification<Booking> startingFrom(Instant from) {
        return (root, query, cb) -> from == null ? null : cb.greaterThanOrEqualTo(root.<Instant>get("startTime"), from);
    }

    static Specification<Booking> endingBy(Instant by) {
        return (root, query, cb) -> by == null ? null : cb.lessThanOrEqualTo(root.<Instant>get("endTime"), by);
    }
}
