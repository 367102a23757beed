package com.smartroom.booking.api.dto;

import com.smartroom.booking.domain.model.SlotCheck;

import java.time.Instant;
import java.util.List;

public record SlotCheckResponse(
        Long roomId,
        Instant from,
        Instant to,
        boolean available,
        List<Long> conflictingBookingIds
) {
    public static SlotCheckResponse from(SlotCheck check) {
        return new SlotCheckResponse(
                check.roomId(),
                check.range().start(),
                check.range().end(),
                check.available(),
                check.conflictingBookingIds()
        );
    }
}
