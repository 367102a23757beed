package com.smartroom.booking.domain.service;

import com.smartroom.booking.client.RoomDirectory;
import com.smartroom.booking.domain.model.AvailabilityWindow;
import com.smartroom.booking.domain.model.Occurrence;
import com.smartroom.booking.domain.model.OccurrenceConflict;
import com.smartroom.booking.domain.model.SlotCheck;
import com.smartroom.booking.domain.model.TimeRange;
import com.smartroom.booking.domain.repository.BookingStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;

/**
 * Lock-free room queries. Results reflect the store's current snapshot and may be stale by the
 * time a booking is submitted; only admission decides.
 */
@Slf4j
@Service
public class AvailabilityService {

    private final BookingStore bookingStore;
    private final RoomDirectory roomDirectory;
    private final AvailabilityMatrixBuilder matrixBuilder;
    private final ConflictDetector conflictDetector;
    private final Executor availabilityExecutor;

    public AvailabilityService(BookingStore bookingStore,
                               RoomDirectory roomDirectory,
                               AvailabilityMatrixBuilder matrixBuilder,
                               ConflictDetector conflictDetector,
                               @Qualifier("availabilityExecutor") Executor availabilityExecutor) {
        this.bookingStore = bookingStore;
        this.roomDirectory = roomDirectory;
        this.matrixBuilder = matrixBuilder;
        this.conflictDetector = conflictDetector;
        this.availabilityExecutor = availabilityExecutor;
    }

    public AvailabilityWindow getAvailability(Long roomId, TimeRange query) {
        roomDirectory.requireRoom(roomId);
        List<Occurrence> existing = bookingStore.findActiveOccurrences(roomId, query);
        AvailabilityWindow window = matrixBuilder.buildAvailability(roomId, query, existing);
        log.debug("Availability computed: roomId={}, busy={}, free={}", roomId, window.busy().size(), window.free().size());
        return window;
    }

    /**
     * Availability of several rooms, computed in parallel. Windows come back in the requested order.
     */
    public List<AvailabilityWindow> getAvailability(List<Long> roomIds, TimeRange query) {
        List<CompletableFuture<AvailabilityWindow>> futures = roomIds.stream()
                .map(roomId -> CompletableFuture.supplyAsync(() -> getAvailability(roomId, query), availabilityExecutor))
                .collect(Collectors.toList());
        try {
            return futures.stream().map(CompletableFuture::join).collect(Collectors.toList());
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw e;
        }
    }

    public SlotCheck checkSlot(Long roomId, TimeRange range) {
        roomDirectory.requireRoom(roomId);
        List<Long> conflicting = bookingStore.findActiveOccurrences(roomId, range).stream()
                .map(Occurrence::bookingId)
                .distinct()
                .collect(Collectors.toList());
        return new SlotCheck(roomId, range, conflicting.isEmpty(), conflicting);
    }

    /**
     * Overlapping active bookings in a room. Admission never produces these; a non-empty report
     * points at data written around the engine.
     */
    public List<OccurrenceConflict> findRoomConflicts(Long roomId) {
        roomDirectory.requireRoom(roomId);
        List<OccurrenceConflict> overlaps = conflictDetector.findOverlaps(bookingStore.findActiveOccurrences(roomId));
        if (!overlaps.isEmpty()) {
            log.warn("Room {} has {} overlapping occurrence pair(s)", roomId, overlaps.size());
        }
        return overlaps;
    }
}
