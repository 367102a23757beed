package com.smartroom.booking.domain.service;

import com.smartroom.booking.domain.model.Occurrence;
import com.smartroom.booking.domain.model.OccurrenceConflict;
import com.smartroom.booking.domain.model.TimeRange;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class ConflictDetectorTest {

    private static final Instant DAY = Instant.parse("2025-01-06T00:00:00Z");

    private final ConflictDetector detector = new ConflictDetector();

    private static Occurrence occ(Long bookingId, int index, int fromMinute, int toMinute) {
        return new Occurrence(bookingId,
                new TimeRange(DAY.plus(Duration.ofMinutes(fromMinute)), DAY.plus(Duration.ofMinutes(toMinute))),
                index);
    }

    @Test
    @DisplayName("candidate inside an existing booking conflicts; touching bookings do not")
    void findConflicts_scenario() {
        Occurrence a = occ(1L, 0, 600, 660);
        Occurrence b = occ(2L, 0, 720, 780);
        Occurrence c = occ(null, 0, 630, 645);
        Occurrence backToBack = occ(null, 0, 660, 720);

        List<OccurrenceConflict> conflicts = detector.findConflicts(List.of(c), List.of(a, b));

        assertThat(conflicts).containsExactly(new OccurrenceConflict(c, a));
        assertThat(detector.isAdmissible(List.of(backToBack), List.of(a, b))).isTrue();
    }

    @Test
    @DisplayName("occurrences of the same booking are excluded by id even with identical ranges")
    void findConflicts_excludesSameBooking() {
        Occurrence old = occ(5L, 0, 600, 660);
        Occurrence moved = occ(5L, 0, 600, 660);
        Occurrence other = occ(6L, 0, 630, 700);

        List<OccurrenceConflict> conflicts = detector.findConflicts(List.of(moved), List.of(old, other));

        assertThat(conflicts).extracting(conflict -> conflict.existing().bookingId()).containsExactly(6L);
    }

    @Test
    @DisplayName("every overlapping pair of a recurring candidate is reported")
    void findConflicts_reportsAllPairs() {
        List<Occurrence> candidates = List.of(occ(null, 0, 0, 60), occ(null, 1, 1440, 1500), occ(null, 2, 2880, 2940));
        List<Occurrence> existing = List.of(occ(9L, 0, 30, 90), occ(8L, 0, 2900, 3000), occ(7L, 0, 2870, 2885));

        List<OccurrenceConflict> conflicts = detector.findConflicts(candidates, existing);

        assertThat(conflicts).hasSize(3);
        assertThat(conflicts).extracting(conflict -> conflict.candidate().sequenceIndex()).containsExactly(0, 2, 2);
        assertThat(conflicts).extracting(conflict -> conflict.existing().bookingId()).containsExactly(9L, 7L, 8L);
    }

    @Test
    @DisplayName("sweep agrees with the pairwise check on random input")
    void findConflicts_matchesPairwise() {
        Random random = new Random(7);
        for (int round = 0; round < 100; round++) {
            List<Occurrence> candidates = randomOccurrences(random, null, 15);
            List<Occurrence> existing = new ArrayList<>();
            for (long id = 1; id <= 10; id++) {
                existing.addAll(randomOccurrences(random, id, 3));
            }

            Set<OccurrenceConflict> expected = new HashSet<>();
            for (Occurrence candidate : candidates) {
                for (Occurrence other : existing) {
                    if (candidate.range().overlaps(other.range())) {
                        expected.add(new OccurrenceConflict(candidate, other));
                    }
                }
            }

            assertThat(new HashSet<>(detector.findConflicts(candidates, existing))).isEqualTo(expected);
        }
    }

    @Test
    @DisplayName("findOverlaps reports each overlapping pair of different bookings once")
    void findOverlaps_withinOneSet() {
        Occurrence first = occ(1L, 0, 0, 60);
        Occurrence second = occ(2L, 0, 30, 90);
        Occurrence sameSeries = occ(1L, 1, 45, 50);
        Occurrence later = occ(3L, 0, 90, 120);

        List<OccurrenceConflict> overlaps = detector.findOverlaps(List.of(later, second, sameSeries, first));

        assertThat(overlaps).containsExactlyInAnyOrder(
                new OccurrenceConflict(first, second),
                new OccurrenceConflict(second, sameSeries));
    }

    private static List<Occurrence> randomOccurrences(Random random, Long bookingId, int count) {
        List<Occurrence> occurrences = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            int from = random.nextInt(24 * 60);
            occurrences.add(occ(bookingId, i, from, from + 15 + random.nextInt(120)));
        }
        return occurrences;
    }
}
