package com.smartroom.booking.domain.model;

import java.util.List;

/**
 * Free/busy partition of {@code queryRange} for one room. Both lists are ascending by start,
 * disjoint, and together cover the query range exactly.
 */
public record AvailabilityWindow(
        Long roomId,
        TimeRange queryRange,
        List<TimeRange> busy,
        List<TimeRange> free
) {
    public AvailabilityWindow {
        busy = List.copyOf(busy);
        free = List.copyOf(free);
    }

    public boolean fullyFree() {
        return busy.isEmpty();
    }
}
