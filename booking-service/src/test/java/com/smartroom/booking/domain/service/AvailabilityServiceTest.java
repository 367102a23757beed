package com.smartroom.booking.domain.service;

import com.smartroom.booking.client.RoomDirectory;
import com.smartroom.booking.domain.model.AvailabilityWindow;
import com.smartroom.booking.domain.model.Booking;
import com.smartroom.booking.domain.model.Booking.BookingStatus;
import com.smartroom.booking.domain.model.OccurrenceConflict;
import com.smartroom.booking.domain.model.SlotCheck;
import com.smartroom.booking.domain.model.TimeRange;
import com.smartroom.booking.support.InMemoryBookingStore;
import com.smartroom.common.exception.ResourceNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.lenient;

@ExtendWith(MockitoExtension.class)
class AvailabilityServiceTest {

    private static final Instant DAY = Instant.parse("2025-01-06T00:00:00Z");

    @Mock
    private RoomDirectory roomDirectory;

    private InMemoryBookingStore store;
    private AvailabilityService service;

    @BeforeEach
    void setUp() {
        store = new InMemoryBookingStore();
        service = new AvailabilityService(store, roomDirectory, new AvailabilityMatrixBuilder(),
                new ConflictDetector(), Runnable::run);
    }

    private static TimeRange at(int fromHour, int toHour) {
        return new TimeRange(DAY.plus(Duration.ofHours(fromHour)), DAY.plus(Duration.ofHours(toHour)));
    }

    private Booking seed(Long roomId, TimeRange range, BookingStatus status) {
        Booking booking = Booking.builder()
                .roomId(roomId)
                .userId(1L)
                .title("Seeded")
                .startTime(range.start())
                .endTime(range.end())
                .status(status)
                .build();
        booking.replaceOccurrences(List.of(range));
        return store.save(booking);
    }

    @Test
    @DisplayName("busy and free partition the query window; cancelled bookings do not count")
    void getAvailability_singleRoom() {
        // given
        seed(1L, at(10, 11), BookingStatus.CONFIRMED);
        seed(1L, at(12, 13), BookingStatus.CONFIRMED);
        seed(1L, at(9, 10), BookingStatus.CANCELLED);

        // when
        AvailabilityWindow window = service.getAvailability(1L, at(9, 14));

        // then
        assertThat(window.busy()).containsExactly(at(10, 11), at(12, 13));
        assertThat(window.free()).containsExactly(at(9, 10), at(11, 12), at(13, 14));
        assertThat(window.fullyFree()).isFalse();
    }

    @Test
    @DisplayName("several rooms come back in the requested order")
    void getAvailability_batch() {
        seed(2L, at(10, 11), BookingStatus.CONFIRMED);

        List<AvailabilityWindow> windows = service.getAvailability(List.of(3L, 2L), at(9, 12));

        assertThat(windows).extracting(AvailabilityWindow::roomId).containsExactly(3L, 2L);
        assertThat(windows.get(0).fullyFree()).isTrue();
        assertThat(windows.get(1).busy()).containsExactly(at(10, 11));
    }

    @Test
    @DisplayName("an unknown room in a batch fails the whole request with its own error")
    void getAvailability_batchUnknownRoom() {
        lenient().doThrow(new ResourceNotFoundException("Room", 99L)).when(roomDirectory).requireRoom(99L);

        assertThatThrownBy(() -> service.getAvailability(List.of(1L, 99L), at(9, 12)))
                .isInstanceOf(ResourceNotFoundException.class)
                .hasMessageContaining("99");
    }

    @Test
    @DisplayName("slot check reports the bookings in the way, and a touching slot as available")
    void checkSlot() {
        Booking blocker = seed(1L, at(10, 11), BookingStatus.CONFIRMED);

        SlotCheck taken = service.checkSlot(1L, at(10, 12));
        SlotCheck touching = service.checkSlot(1L, at(11, 12));

        assertThat(taken.available()).isFalse();
        assertThat(taken.conflictingBookingIds()).containsExactly(blocker.getId());
        assertThat(touching.available()).isTrue();
        assertThat(touching.conflictingBookingIds()).isEmpty();
    }

    @Test
    @DisplayName("room conflict report finds overlaps written around the engine")
    void findRoomConflicts() {
        Booking first = seed(1L, at(10, 12), BookingStatus.CONFIRMED);
        Booking second = seed(1L, at(11, 13), BookingStatus.PENDING);
        seed(1L, at(13, 14), BookingStatus.CONFIRMED);

        List<OccurrenceConflict> conflicts = service.findRoomConflicts(1L);

        assertThat(conflicts).singleElement().satisfies(conflict -> {
            assertThat(conflict.candidate().bookingId()).isEqualTo(first.getId());
            assertThat(conflict.existing().bookingId()).isEqualTo(second.getId());
        });
    }
}
