package com.smartroom.booking.domain.service;

import com.smartroom.booking.domain.model.AvailabilityWindow;
import com.smartroom.booking.domain.model.Occurrence;
import com.smartroom.booking.domain.model.TimeRange;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Computes the free/busy partition of a query window from a room's active occurrences.
 */
@Component
public class AvailabilityMatrixBuilder {

    public AvailabilityWindow buildAvailability(Long roomId, TimeRange query, Collection<Occurrence> existing) {
        List<TimeRange> clipped = new ArrayList<>();
        for (Occurrence occurrence : existing) {
            TimeRange.intersect(occurrence.range(), query).ifPresent(clipped::add);
        }
        List<TimeRange> busy = TimeRange.mergeSorted(clipped);
        return new AvailabilityWindow(roomId, query, busy, freeSpace(query, busy));
    }

    /**
     * Complement of merged busy ranges within the query. Since busy is sorted and disjoint, each
     * subtraction only ever splits the last free piece.
     */
    private static List<TimeRange> freeSpace(TimeRange query, List<TimeRange> busy) {
        List<TimeRange> free = new ArrayList<>();
        free.add(query);
        for (TimeRange block : busy) {
            TimeRange last = free.remove(free.size() - 1);
            free.addAll(last.subtract(block));
            if (free.isEmpty()) {
                break;
            }
        }
        return free;
    }
}
