package com.smartroom.booking.api.dto;

import com.smartroom.booking.domain.model.Booking;
import com.smartroom.booking.domain.model.RecurrencePattern;
import com.smartroom.booking.domain.model.TimeRange;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

public record BookingResponse(
        Long id,
        Long roomId,
        Long userId,
        String title,
        String description,
        Integer attendees,
        Booking.BookingStatus status,
        Instant startTime,
        Instant endTime,
        RecurrencePattern recurrence,
        List<TimeRange> occurrences,
        Long version,
        String cancellationReason,
        Long cancelledBy,
        Instant cancelledAt,
        Long supersededBy,
        Instant createdAt,
        Instant updatedAt
) {
    public static BookingResponse from(Booking booking) {
        return new BookingResponse(
                booking.getId(),
                booking.getRoomId(),
                booking.getUserId(),
                booking.getTitle(),
                booking.getDescription(),
                booking.getAttendees(),
                booking.getStatus(),
                booking.getStartTime(),
                booking.getEndTime(),
                booking.getRecurrence(),
                booking.getOccurrences().stream()
                        .map(occurrence -> occurrence.range())
                        .collect(Collectors.toList()),
                booking.getVersion(),
                booking.getCancellationReason(),
                booking.getCancelledBy(),
                booking.getCancelledAt(),
                booking.getSupersededBy(),
                booking.getCreatedAt(),
                booking.getUpdatedAt()
        );
    }
}
