package com.smartroom.booking.domain.model;

import com.smartroom.booking.exception.InvalidRangeException;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Half-open interval {@code [start, end)} on the instant timeline.
 *
 * Ranges that only touch ({@code a.end == b.start}) do not overlap, so back-to-back
 * meetings in the same room are always admissible.
 */
public record TimeRange(Instant start, Instant end) implements Comparable<TimeRange> {

    private static final Comparator<TimeRange> ORDER =
            Comparator.comparing(TimeRange::start).thenComparing(TimeRange::end);

    public TimeRange {
        if (start == null || end == null) {
            throw new InvalidRangeException("Time range start and end are required");
        }
        if (!start.isBefore(end)) {
            throw new InvalidRangeException(start, end);
        }
    }

    public static TimeRange of(Instant start, Instant end) {
        return new TimeRange(start, end);
    }

    public static boolean overlaps(TimeRange a, TimeRange b) {
        return a.start.isBefore(b.end) && b.start.isBefore(a.end);
    }

    public static boolean contains(TimeRange outer, TimeRange inner) {
        return !inner.start.isBefore(outer.start) && !inner.end.isAfter(outer.end);
    }

    /**
     * Parts of {@code a} not covered by {@code b}: none, one, or two ranges in ascending order.
     */
    public static List<TimeRange> subtract(TimeRange a, TimeRange b) {
        if (!overlaps(a, b)) {
            return List.of(a);
        }
        List<TimeRange> remainder = new ArrayList<>(2);
        if (a.start.isBefore(b.start)) {
            remainder.add(new TimeRange(a.start, b.start));
        }
        if (b.end.isBefore(a.end)) {
            remainder.add(new TimeRange(b.end, a.end));
        }
        return List.copyOf(remainder);
    }

    public static Optional<TimeRange> intersect(TimeRange a, TimeRange b) {
        if (!overlaps(a, b)) {
            return Optional.empty();
        }
        Instant start = a.start.isAfter(b.start) ? a.start : b.start;
        Instant end = a.end.isBefore(b.end) ? a.end : b.end;
        return Optional.of(new TimeRange(start, end));
    }

    /**
     * Sorts by start and coalesces overlapping or adjacent ranges.
     * The result is sorted, pairwise disjoint and never touching.
     */
    public static List<TimeRange> mergeSorted(Collection<TimeRange> ranges) {
        List<TimeRange> sorted = new ArrayList<>(ranges);
        sorted.sort(ORDER);
        List<TimeRange> merged = new ArrayList<>();
        for (TimeRange range : sorted) {
            int last = merged.size() - 1;
            if (last >= 0 && !range.start.isAfter(merged.get(last).end)) {
                TimeRange previous = merged.get(last);
                if (range.end.isAfter(previous.end)) {
                    merged.set(last, new TimeRange(previous.start, range.end));
                }
            } else {
                merged.add(range);
            }
        }
        return List.copyOf(merged);
    }

    /**
     * Smallest range covering all given ranges.
     */
    public static TimeRange span(Collection<TimeRange> ranges) {
        if (ranges.isEmpty()) {
            throw new IllegalArgumentException("Cannot span an empty set of ranges");
        }
        Instant start = ranges.stream().map(TimeRange::start).min(Comparator.naturalOrder()).orElseThrow();
        Instant end = ranges.stream().map(TimeRange::end).max(Comparator.naturalOrder()).orElseThrow();
        return new TimeRange(start, end);
    }

    public boolean overlaps(TimeRange other) {
        return overlaps(this, other);
    }

    public boolean contains(TimeRange inner) {
        return contains(this, inner);
    }

    public List<TimeRange> subtract(TimeRange other) {
        return subtract(this, other);
    }

    public Duration duration() {
        return Duration.between(start, end);
    }

    @Override
    public int compareTo(TimeRange other) {
        return ORDER.compare(this, other);
    }
}
