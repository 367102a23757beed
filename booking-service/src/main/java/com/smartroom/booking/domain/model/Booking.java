package com.smartroom.booking.domain.model;

import com.smartroom.booking.exception.InvalidTransitionException;
import com.smartroom.common.util.Constants;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Booking entity representing a meeting room reservation, possibly recurring.
 */
@Entity
@Table(name = "bookings", indexes = {
        @Index(name = "idx_bookings_room_status", columnList = "room_id, status"),
        @Index(name = "idx_bookings_user_id", columnList = "user_id"),
        @Index(name = "idx_bookings_series", columnList = "room_id, start_time, series_end")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Booking {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "room_id", nullable = false)
    private Long roomId;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "title", nullable = false, length = 200)
    private String title;

    @Column(name = "description", length = 2000)
    private String description;

    @Column(name = "attendees")
    private Integer attendees;

    @Column(name = "start_time", nullable = false)
    private Instant startTime;

    @Column(name = "end_time", nullable = false)
    private Instant endTime;

    /** End of the last occurrence; lets the store narrow window queries without loading occurrences. */
    @Column(name = "series_end", nullable = false)
    private Instant seriesEnd;

    @Convert(converter = RecurrencePatternConverter.class)
    @Column(name = "recurrence", columnDefinition = "TEXT")
    private RecurrencePattern recurrence;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private BookingStatus status;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "booking_occurrences", joinColumns = @JoinColumn(name = "booking_id"))
    @OrderBy("sequenceIndex")
    @Builder.Default
    private List<OccurrenceSlot> occurrenceSlots = new ArrayList<>();

    @Column(name = "cancellation_reason", length = 500)
    private String cancellationReason;

    @Column(name = "cancelled_by")
    private Long cancelledBy;

    @Column(name = "cancelled_at")
    private Instant cancelledAt;

    @Column(name = "superseded_by")
    private Long supersededBy;

    @Version
    @Column(name = "version", nullable = false)
    private Long version;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        createdAt = Instant.now();
        updatedAt = createdAt;
        if (status == null) {
            status = BookingStatus.PENDING;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    public TimeRange getRange() {
        return new TimeRange(startTime, endTime);
    }

    public List<Occurrence> getOccurrences() {
        return occurrenceSlots.stream()
                .map(slot -> new Occurrence(id, slot.toRange(), slot.getSequenceIndex()))
                .collect(Collectors.toList());
    }

    /**
     * Swaps the whole occurrence set. Ranges must already be in series order.
     */
    public void replaceOccurrences(List<TimeRange> ranges) {
        if (ranges.isEmpty()) {
            throw new IllegalArgumentException("A booking needs at least one occurrence");
        }
        occurrenceSlots.clear();
        IntStream.range(0, ranges.size())
                .mapToObj(i -> OccurrenceSlot.of(i, ranges.get(i)))
                .forEach(occurrenceSlots::add);
        seriesEnd = ranges.stream().map(TimeRange::end).max(Instant::compareTo).orElseThrow();
    }

    public boolean isActive() {
        return status != null && status.isActive();
    }

    public void confirm() {
        transitionTo(BookingStatus.CONFIRMED, "confirm");
    }

    public void reject() {
        transitionTo(BookingStatus.REJECTED, "reject");
    }

    public void cancel(Long actorId, String reason, Instant at) {
        transitionTo(BookingStatus.CANCELLED, "cancel");
        cancelledBy = actorId;
        cancellationReason = reason;
        cancelledAt = at;
    }

    public void supersede(Long supersedingBookingId, Instant at) {
        cancel(Constants.SYSTEM_ACTOR_ID, "Superseded by booking " + supersedingBookingId, at);
        supersededBy = supersedingBookingId;
    }

    /**
     * Moves the booking to a new schedule. A pending booking is confirmed by the move.
     */
    public void reschedule(TimeRange range, RecurrencePattern pattern, List<TimeRange> ranges) {
        if (!isActive()) {
            throw new InvalidTransitionException(id, status, "reschedule");
        }
        startTime = range.start();
        endTime = range.end();
        recurrence = pattern;
        replaceOccurrences(ranges);
        if (status == BookingStatus.PENDING) {
            confirm();
        }
    }

    /**
     * Replaces the descriptive fields that are given; null arguments keep the current value.
     */
    public void updateDetails(String newTitle, String newDescription, Integer newAttendees) {
        if (!isActive()) {
            throw new InvalidTransitionException(id, status, "update");
        }
        if (newTitle != null) {
            title = newTitle;
        }
        if (newDescription != null) {
            description = newDescription;
        }
        if (newAttendees != null) {
            attendees = newAttendees;
        }
    }

    private void transitionTo(BookingStatus target, String action) {
        if (status == null || !status.canTransitionTo(target)) {
            throw new InvalidTransitionException(id, status, action);
        }
        status = target;
    }

    public enum BookingStatus {
        PENDING,
        CONFIRMED,
        CANCELLED,
        REJECTED;

        public boolean isActive() {
            return this == PENDING || this == CONFIRMED;
        }

        public boolean isTerminal() {
            return !isActive();
        }

        public boolean canTransitionTo(BookingStatus target) {
            if (isTerminal()) {
                return false;
            }
            if (this == PENDING) {
                return target == CONFIRMED || target == REJECTED || target == CANCELLED;
            }
            return this == CONFIRMED && target == CANCELLED;
        }
    }
}
