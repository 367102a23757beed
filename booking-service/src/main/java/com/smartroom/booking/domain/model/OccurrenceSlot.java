package com.smartroom.booking.domain.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Persistent row of one occurrence, owned by its {@link Booking}.
 */
@Embeddable
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class OccurrenceSlot {

    @Column(name = "sequence_index", nullable = false)
    private int sequenceIndex;

    @Column(name = "start_time", nullable = false)
    private Instant startTime;

    @Column(name = "end_time", nullable = false)
    private Instant endTime;

    public static OccurrenceSlot of(int sequenceIndex, TimeRange range) {
        return new OccurrenceSlot(sequenceIndex, range.start(), range.end());
    }

    public TimeRange toRange() {
        return new TimeRange(startTime, endTime);
    }
}
