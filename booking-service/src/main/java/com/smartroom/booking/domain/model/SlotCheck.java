package com.smartroom.booking.domain.model;

import java.util.List;

/**
 * Lock-free answer to "is this slot free right now". A later admission may still conflict.
 */
public record SlotCheck(Long roomId, TimeRange range, boolean available, List<Long> conflictingBookingIds) {

    public SlotCheck {
        conflictingBookingIds = List.copyOf(conflictingBookingIds);
    }
}
