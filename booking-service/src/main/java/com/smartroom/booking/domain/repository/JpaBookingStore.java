package com.smartroom.booking.domain.repository;

import com.smartroom.booking.domain.model.Booking;
import com.smartroom.booking.domain.model.Booking.BookingStatus;
import com.smartroom.booking.domain.model.TimeRange;
import com.smartroom.booking.exception.StaleBookingException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * {@link BookingStore} on Spring Data JPA. Optimistic version checks come from the entity's
 * {@code @Version} column; writes are flushed inside the transaction so a version conflict
 * surfaces here rather than at commit.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class JpaBookingStore implements BookingStore {

    private static final Set<BookingStatus> ACTIVE = EnumSet.of(BookingStatus.PENDING, BookingStatus.CONFIRMED);

    private final BookingRepository bookingRepository;

    @Override
    @Transactional(readOnly = true)
    public Optional<Booking> findById(Long bookingId) {
        return bookingRepository.findById(bookingId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Booking> findByUserId(Long userId) {
        return bookingRepository.findByUserIdOrderByStartTimeDesc(userId);
    }

    @Override
    @Transactional(readOnly = true)
    public Page<Booking> search(BookingSearchCriteria criteria, Pageable pageable) {
        return bookingRepository.findAll(BookingSpecifications.matching(criteria), pageable);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Booking> findActiveByRoom(Long roomId) {
        return bookingRepository.findByRoomIdAndStatusIn(roomId, ACTIVE);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Booking> findActiveByRoomOverlapping(Long roomId, TimeRange window) {
        return bookingRepository.findSeriesOverlapping(roomId, ACTIVE, window.start(), window.end());
    }

    @Override
    @Transactional
    public Booking save(Booking booking) {
        try {
            return bookingRepository.saveAndFlush(booking);
        } catch (OptimisticLockingFailureException e) {
            log.warn("Version conflict saving booking {}", booking.getId());
            throw new StaleBookingException(booking.getId(), e);
        }
    }

    /**
     * A version conflict on a superseded booking is left to propagate as a transient
     * {@link OptimisticLockingFailureException}: the whole write is rolled back and the caller's
     * retry re-reads the bookings.
     */
    @Override
    @Transactional
    public AdmissionWrite saveAdmission(Booking admitted, Collection<Long> supersededIds, Instant at) {
        Booking saved = bookingRepository.saveAndFlush(admitted);
        List<Booking> superseded = new ArrayList<>(supersededIds.size());
        for (Long supersededId : supersededIds) {
            Optional<Booking> existing = bookingRepository.findById(supersededId);
            if (existing.isEmpty() || !existing.get().isActive()) {
                log.info("Booking {} no longer active, not superseded by booking {}", supersededId, saved.getId());
                continue;
            }
            existing.get().supersede(saved.getId(), at);
            superseded.add(bookingRepository.saveAndFlush(existing.get()));
        }
        return new AdmissionWrite(saved, superseded);
    }
}
