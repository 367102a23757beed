package com.smartroom.booking.events;

import com.smartroom.booking.domain.model.Booking;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Event published on every booking state change.
 * Consumed by the notification dispatcher and calendar sync; delivery is at-least-once,
 * so consumers deduplicate on (bookingId, version).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BookingLifecycleEvent {
    private BookingEventType eventType;
    private Long bookingId;
    private Long roomId;
    private Long userId;
    private Long version;
    private String reason;
    private Instant timestamp;

    public static BookingLifecycleEvent of(BookingEventType type, Booking booking, String reason, Instant at) {
        return BookingLifecycleEvent.builder()
                .eventType(type)
                .bookingId(booking.getId())
                .roomId(booking.getRoomId())
                .userId(booking.getUserId())
                .version(booking.getVersion())
                .reason(reason)
                .timestamp(at)
                .build();
    }
}
