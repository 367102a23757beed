package com.smartroom.booking.domain.service;

import com.smartroom.booking.domain.model.Occurrence;
import com.smartroom.booking.domain.model.OccurrenceConflict;
import com.smartroom.booking.domain.model.TimeRange;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedList;
import java.util.List;

/**
 * Sweep-line overlap detection between occurrence sets.
 *
 * Both inputs are sorted by start; each side keeps an "active" list of occurrences whose end is
 * still ahead of the sweep position, so every overlapping pair is found once without comparing
 * all pairs.
 */
@Component
public class ConflictDetector {

    private static final Comparator<Occurrence> BY_RANGE = Comparator
            .comparing((Occurrence o) -> o.range().start())
            .thenComparing(o -> o.range().end())
            .thenComparingInt(Occurrence::sequenceIndex);

    /**
     * Pairs of a candidate and an existing occurrence that overlap. Occurrences of the same booking
     * never conflict with each other, which keeps a reschedule from colliding with its own old slots.
     *
     * @return pairs ordered by candidate start, then existing start; empty when admissible
     */
    public List<OccurrenceConflict> findConflicts(Collection<Occurrence> candidates,
                                                  Collection<Occurrence> existing) {
        List<Occurrence> left = sorted(candidates);
        List<Occurrence> right = sorted(existing);
        List<OccurrenceConflict> conflicts = new ArrayList<>();

        List<Occurrence> activeLeft = new LinkedList<>();
        List<Occurrence> activeRight = new LinkedList<>();
        int i = 0;
        int j = 0;
        while (i < left.size() || j < right.size()) {
            boolean takeLeft = j >= right.size()
                    || (i < left.size() && !left.get(i).range().start().isAfter(right.get(j).range().start()));
            if (takeLeft) {
                Occurrence candidate = left.get(i++);
                evictEnded(activeRight, candidate.range());
                for (Occurrence other : activeRight) {
                    record(conflicts, candidate, other);
                }
                activeLeft.add(candidate);
            } else {
                Occurrence other = right.get(j++);
                if (i >= left.size() && activeLeft.isEmpty()) {
                    break;
                }
                evictEnded(activeLeft, other.range());
                for (Occurrence candidate : activeLeft) {
                    record(conflicts, candidate, other);
                }
                activeRight.add(other);
            }
        }

        conflicts.sort(Comparator
                .comparing((OccurrenceConflict c) -> c.candidate(), BY_RANGE)
                .thenComparing(OccurrenceConflict::existing, BY_RANGE));
        return conflicts;
    }

    /**
     * Overlapping pairs between different bookings inside one occurrence set, each reported once
     * with the earlier-starting occurrence as {@code candidate}.
     */
    public List<OccurrenceConflict> findOverlaps(Collection<Occurrence> occurrences) {
        List<Occurrence> sorted = sorted(occurrences);
        List<OccurrenceConflict> overlaps = new ArrayList<>();
        List<Occurrence> active = new LinkedList<>();
        for (Occurrence current : sorted) {
            evictEnded(active, current.range());
            for (Occurrence earlier : active) {
                record(overlaps, earlier, current);
            }
            active.add(current);
        }
        return overlaps;
    }

    public boolean isAdmissible(Collection<Occurrence> candidates, Collection<Occurrence> existing) {
        return findConflicts(candidates, existing).isEmpty();
    }

    private static void record(List<OccurrenceConflict> sink, Occurrence candidate, Occurrence existing) {
        if (candidate.belongsToSameBooking(existing)) {
            return;
        }
        if (candidate.range().overlaps(existing.range())) {
            sink.add(new OccurrenceConflict(candidate, existing));
        }
    }

    private static void evictEnded(List<Occurrence> active, TimeRange position) {
        Iterator<Occurrence> iterator = active.iterator();
        while (iterator.hasNext()) {
            if (!iterator.next().range().end().isAfter(position.start())) {
                iterator.remove();
            }
        }
    }

    private static List<Occurrence> sorted(Collection<Occurrence> occurrences) {
        List<Occurrence> copy = new ArrayList<>(occurrences);
        copy.sort(BY_RANGE);
        return copy;
    }
}
