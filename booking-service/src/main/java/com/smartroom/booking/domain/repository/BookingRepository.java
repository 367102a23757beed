package com.smartroom.booking.domain.repository;

import com.smartroom.booking.domain.model.Booking;
import com.smartroom.booking.domain.model.Booking.BookingStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

public interface BookingRepository extends JpaRepository<Booking, Long>, JpaSpecificationExecutor<Booking> {

    List<Booking> findByUserIdOrderByStartTimeDesc(Long userId);

    List<Booking> findByRoomIdAndStatusIn(Long roomId, Collection<BookingStatus> statuses);

    /**
     * Bookings of a room whose series span [start of first occurrence, end of last occurrence)
     * intersects the window. Individual occurrences still need filtering.
     */
    @Query("""
           SELECT b FROM Booking b
           WHERE b.roomId = :roomId
             AND b.status IN :statuses
             AND b.startTime < :windowEnd
             AND b.seriesEnd > :windowStart
           ORDER BY b.startTime
           """)
    List<Booking> findSeriesOverlapping(@Param("roomId") Long roomId,
                                        @Param("statuses") Collection<BookingStatus> statuses,
                                        @Param("windowStart") Instant windowStart,
                                        @Param("windowEnd") Instant windowEnd);
}
