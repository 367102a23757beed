package com.smartroom.booking.api.dto;

import com.smartroom.booking.domain.model.AvailabilityWindow;
import com.smartroom.booking.domain.model.TimeRange;

import java.time.Instant;
import java.util.List;

public record AvailabilityResponse(
        Long roomId,
        Instant from,
        Instant to,
        List<TimeRange> busy,
        List<TimeRange> free
) {
    public static AvailabilityResponse from(AvailabilityWindow window) {
        return new AvailabilityResponse(
                window.roomId(),
                window.queryRange().start(),
                window.queryRange().end(),
                window.busy(),
                window.free()
        );
    }
}
