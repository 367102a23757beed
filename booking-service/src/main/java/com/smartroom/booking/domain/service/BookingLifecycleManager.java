package com.smartroom.booking.domain.service;

import com.smartroom.booking.client.RoomDirectory;
import com.smartroom.booking.client.dto.RoomSummary;
import com.smartroom.booking.config.BookingEngineProperties;
import com.smartroom.booking.domain.model.Actor;
import com.smartroom.booking.domain.model.AdmissionResult;
import com.smartroom.booking.domain.model.Booking;
import com.smartroom.booking.domain.model.Booking.BookingStatus;
import com.smartroom.booking.domain.model.Occurrence;
import com.smartroom.booking.domain.model.OccurrenceConflict;
import com.smartroom.booking.domain.model.RecurrencePattern;
import com.smartroom.booking.domain.model.TimeRange;
import com.smartroom.booking.domain.repository.BookingStore;
import com.smartroom.booking.domain.repository.BookingStore.AdmissionWrite;
import com.smartroom.booking.domain.strategy.RoomAdmissionGate;
import com.smartroom.booking.domain.strategy.RoomLock;
import com.smartroom.booking.events.BookingEventSink;
import com.smartroom.booking.events.BookingEventType;
import com.smartroom.booking.events.BookingLifecycleEvent;
import com.smartroom.booking.exception.AdmissionCancelledException;
import com.smartroom.booking.exception.BookingAccessDeniedException;
import com.smartroom.booking.exception.InvalidAttendeesException;
import com.smartroom.booking.exception.InvalidRangeException;
import com.smartroom.booking.exception.InvalidTransitionException;
import com.smartroom.booking.exception.PersistenceFailureException;
import com.smartroom.booking.exception.StaleBookingException;
import com.smartroom.common.exception.ResourceNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Owns the booking state machine and the admission protocol.
 *
 * Create and reschedule run their check-then-write sequence inside the room's admission lock,
 * so no two active bookings of a room ever overlap. Once the lock is held the sequence always
 * runs to a confirm or reject. Events are published after the lock is released.
 *
 * Cancel takes no room lock: it can only free time, and concurrent writers are caught by the
 * booking's version.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BookingLifecycleManager {

    static final String RESCHEDULED_REASON = "Rescheduled";
    static final String DEFAULT_CANCEL_REASON = "Cancelled by request";

    private final BookingStore bookingStore;
    private final RoomDirectory roomDirectory;
    private final RoomAdmissionGate admissionGate;
    private final RecurrenceExpander recurrenceExpander;
    private final ConflictDetector conflictDetector;
    private final BookingEventSink eventSink;
    private final RetryTemplate bookingWriteRetryTemplate;
    private final BookingEngineProperties properties;
    private final Clock clock;

    /**
     * Admits a new booking, or records it as rejected when it conflicts and no override applies.
     *
     * @return CONFIRMED, CONFLICT (with the full conflicting set) or BUSY
     */
    public AdmissionResult createBooking(CreateBookingCommand command) {
        Actor actor = command.actor();
        TimeRange range = validateRange(command.range());
        String title = normalizeTitle(command.title());
        if (command.override() && !actor.role().canOverrideConflicts()) {
            throw new BookingAccessDeniedException(
                    "Role " + actor.role() + " may not override booking conflicts");
        }
        requireCapacity(roomDirectory.requireRoom(command.roomId()), command.roomId(), command.attendees());

        RecurrencePattern pattern = command.recurrence() == null ? RecurrencePattern.once() : command.recurrence();
        List<TimeRange> ranges = expand(range, pattern);
        List<Occurrence> candidates = toOccurrences(null, ranges);

        log.info("Admitting booking: roomId={}, userId={}, occurrences={}, override={}",
                command.roomId(), actor.userId(), ranges.size(), command.override());

        List<BookingLifecycleEvent> events = new ArrayList<>();
        AdmissionResult result;
        Optional<RoomLock> held = enterRoom(command.roomId());
        if (held.isEmpty()) {
            log.info("Room {} busy, admission not attempted for user {}", command.roomId(), actor.userId());
            return AdmissionResult.busy();
        }
        try (RoomLock ignored = held.get()) {
            List<Occurrence> existing = bookingStore.findActiveOccurrences(command.roomId(), TimeRange.span(ranges));
            List<OccurrenceConflict> conflicts = conflictDetector.findConflicts(candidates, existing);

            if (conflicts.isEmpty() || command.override()) {
                List<Long> supersededIds = supersededBookingIds(conflicts);
                Instant now = clock.instant();
                AdmissionWrite write = persist("create", command.roomId(), () -> bookingStore.saveAdmission(
                        newBooking(command, title, range, pattern, ranges, BookingStatus.CONFIRMED),
                        supersededIds, now));

                List<Long> actuallySuperseded = new ArrayList<>(write.superseded().size());
                for (Booking superseded : write.superseded()) {
                    log.info("Booking {} superseded by booking {}", superseded.getId(), write.admitted().getId());
                    actuallySuperseded.add(superseded.getId());
                    events.add(BookingLifecycleEvent.of(BookingEventType.SUPERSEDED, superseded,
                            superseded.getCancellationReason(), now));
                }
                events.add(BookingLifecycleEvent.of(BookingEventType.CONFIRMED, write.admitted(), null, now));
                log.info("Booking {} confirmed: roomId={}, occurrences={}, superseded={}",
                        write.admitted().getId(), command.roomId(), ranges.size(), actuallySuperseded);
                result = AdmissionResult.confirmed(write.admitted(), actuallySuperseded);
            } else {
                Instant now = clock.instant();
                Booking rejected = persist("reject", command.roomId(), () -> bookingStore.save(
                        newBooking(command, title, range, pattern, ranges, BookingStatus.REJECTED)));
                events.add(BookingLifecycleEvent.of(BookingEventType.REJECTED, rejected,
                        "Conflicts with bookings " + supersededBookingIds(conflicts), now));
                log.info("Booking {} rejected: roomId={}, conflicts={}",
                        rejected.getId(), command.roomId(), conflicts.size());
                result = AdmissionResult.conflict(rejected, conflicts);
            }
        }
        publish(events);
        return result;
    }

    /**
     * Moves an active booking to a new time and optionally a new pattern. The occurrence set is
     * replaced as a whole; on conflict nothing changes.
     *
     * @throws StaleBookingException if the booking is no longer at {@code expectedVersion}
     */
    public AdmissionResult rescheduleBooking(RescheduleBookingCommand command) {
        TimeRange range = validateRange(command.range());
        Booking current = loadBooking(command.bookingId());
        requireModifiable(current, command.actor(), "reschedule");
        if (!current.isActive()) {
            throw new InvalidTransitionException(current.getId(), current.getStatus(), "reschedule");
        }
        requireVersion(current, command.expectedVersion());

        RecurrencePattern pattern = command.recurrence() != null ? command.recurrence() : current.getRecurrence();
        List<TimeRange> ranges = expand(range, pattern);
        List<Occurrence> candidates = toOccurrences(current.getId(), ranges);
        Long roomId = current.getRoomId();

        List<BookingLifecycleEvent> events = new ArrayList<>();
        AdmissionResult result;
        Optional<RoomLock> held = enterRoom(roomId);
        if (held.isEmpty()) {
            log.info("Room {} busy, reschedule of booking {} not attempted", roomId, current.getId());
            return AdmissionResult.busy();
        }
        try (RoomLock ignored = held.get()) {
            List<Occurrence> existing = bookingStore.findActiveOccurrences(roomId, TimeRange.span(ranges));
            List<OccurrenceConflict> conflicts = conflictDetector.findConflicts(candidates, existing);

            if (!conflicts.isEmpty()) {
                log.info("Reschedule of booking {} conflicts with {} occurrence(s), booking unchanged",
                        current.getId(), conflicts.size());
                result = AdmissionResult.conflict(current, conflicts);
            } else {
                Instant now = clock.instant();
                Booking moved = persist("reschedule", roomId, () -> {
                    Booking fresh = loadBooking(command.bookingId());
                    requireVersion(fresh, command.expectedVersion());
                    fresh.reschedule(range, pattern, ranges);
                    return bookingStore.save(fresh);
                });
                events.add(BookingLifecycleEvent.of(BookingEventType.CONFIRMED, moved, RESCHEDULED_REASON, now));
                log.info("Booking {} rescheduled: start={}, occurrences={}, version={}",
                        moved.getId(), range.start(), ranges.size(), moved.getVersion());
                result = AdmissionResult.confirmed(moved, List.of());
            }
        }
        publish(events);
        return result;
    }

    /**
     * Cancels a pending or confirmed booking. Cancelled and rejected bookings stay stored but inert.
     */
    public Booking cancelBooking(Long bookingId, Actor actor, String reason) {
        Booking current = loadBooking(bookingId);
        requireModifiable(current, actor, "cancel");
        if (!current.getStatus().canTransitionTo(BookingStatus.CANCELLED)) {
            throw new InvalidTransitionException(bookingId, current.getStatus(), "cancel");
        }
        String cancelReason = reason == null || reason.isBlank() ? DEFAULT_CANCEL_REASON : reason.trim();
        Instant now = clock.instant();

        Booking cancelled = persist("cancel", current.getRoomId(), () -> {
            Booking fresh = loadBooking(bookingId);
            fresh.cancel(actor.userId(), cancelReason, now);
            return bookingStore.save(fresh);
        });
        log.info("Booking {} cancelled by user {}: {}", bookingId, actor.userId(), cancelReason);
        publish(List.of(BookingLifecycleEvent.of(BookingEventType.CANCELLED, cancelled, cancelReason, now)));
        return cancelled;
    }

    /**
     * Changes title, description or attendee count of an active booking. The schedule is not
     * touched, so no room admission is needed.
     *
     * @throws StaleBookingException if an expected version is given and no longer matches
     */
    public Booking updateBookingDetails(UpdateBookingDetailsCommand command) {
        Booking current = loadBooking(command.bookingId());
        requireModifiable(current, command.actor(), "update");
        if (!current.isActive()) {
            throw new InvalidTransitionException(current.getId(), current.getStatus(), "update");
        }
        if (command.expectedVersion() != null) {
            requireVersion(current, command.expectedVersion());
        }
        if (command.attendees() != null) {
            requireCapacity(roomDirectory.requireRoom(current.getRoomId()), current.getRoomId(), command.attendees());
        }
        String title = command.title() == null ? null : normalizeTitle(command.title());
        String description = command.description() == null ? null : normalizeDescription(command.description());

        Booking updated = persist("update", current.getRoomId(), () -> {
            Booking fresh = loadBooking(command.bookingId());
            if (command.expectedVersion() != null) {
                requireVersion(fresh, command.expectedVersion());
            }
            fresh.updateDetails(title, description, command.attendees());
            return bookingStore.save(fresh);
        });
        log.info("Booking {} details updated by user {}, version={}",
                updated.getId(), command.actor().userId(), updated.getVersion());
        return updated;
    }

    private Optional<RoomLock> enterRoom(Long roomId) {
        try {
            return admissionGate.tryEnter(roomId);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("Admission for room {} cancelled while waiting", roomId);
            throw new AdmissionCancelledException(roomId, e);
        }
    }

    /**
     * Runs a write under the persistence retry policy. The supplier must build the write from
     * scratch on every call so a failed attempt leaves nothing behind.
     */
    private <T> T persist(String operation, Long roomId, Supplier<T> write) {
        try {
            return bookingWriteRetryTemplate.execute(context -> {
                if (context.getRetryCount() > 0) {
                    log.warn("Retrying {} write for room {} after: {}",
                            operation, roomId, String.valueOf(context.getLastThrowable()));
                }
                return write.get();
            });
        } catch (DataAccessException | TransactionException e) {
            log.error("Persistence failed for {} in room {}", operation, roomId, e);
            throw new PersistenceFailureException("Booking could not be stored, please retry later", e);
        }
    }

    private void publish(List<BookingLifecycleEvent> events) {
        for (BookingLifecycleEvent event : events) {
            try {
                eventSink.publish(event);
            } catch (RuntimeException e) {
                log.error("Event sink rejected {} event for booking {}", event.getEventType(), event.getBookingId(), e);
            }
        }
    }

    private List<TimeRange> expand(TimeRange range, RecurrencePattern pattern) {
        return recurrenceExpander.expand(range, pattern, properties.getRecurrence().getMaxOccurrences());
    }

    private Booking newBooking(CreateBookingCommand command, String title, TimeRange range,
                               RecurrencePattern pattern, List<TimeRange> ranges, BookingStatus outcome) {
        Booking booking = Booking.builder()
                .roomId(command.roomId())
                .userId(command.actor().userId())
                .title(title)
                .description(command.description() == null ? null : normalizeDescription(command.description()))
                .attendees(command.attendees())
                .startTime(range.start())
                .endTime(range.end())
                .recurrence(pattern)
                .status(BookingStatus.PENDING)
                .build();
        booking.replaceOccurrences(ranges);
        if (outcome == BookingStatus.CONFIRMED) {
            booking.confirm();
        } else {
            booking.reject();
        }
        return booking;
    }

    private Booking loadBooking(Long bookingId) {
        return bookingStore.findById(bookingId)
                .orElseThrow(() -> new ResourceNotFoundException("Booking", bookingId));
    }

    private static void requireModifiable(Booking booking, Actor actor, String action) {
        if (!actor.canModify(booking)) {
            throw new BookingAccessDeniedException(
                    String.format("User %d may not %s booking %d", actor.userId(), action, booking.getId()));
        }
    }

    private static void requireVersion(Booking booking, Long expectedVersion) {
        if (!Objects.equals(booking.getVersion(), expectedVersion)) {
            throw new StaleBookingException(booking.getId(), expectedVersion, booking.getVersion());
        }
    }

    private static List<Occurrence> toOccurrences(Long bookingId, List<TimeRange> ranges) {
        return IntStream.range(0, ranges.size())
                .mapToObj(i -> new Occurrence(bookingId, ranges.get(i), i))
                .collect(Collectors.toList());
    }

    private static List<Long> supersededBookingIds(List<OccurrenceConflict> conflicts) {
        return conflicts.stream()
                .map(conflict -> conflict.existing().bookingId())
                .distinct()
                .collect(Collectors.toList());
    }

    private static void requireCapacity(RoomSummary room, Long roomId, Integer attendees) {
        if (attendees == null) {
            return;
        }
        if (attendees < 1) {
            throw new InvalidAttendeesException(attendees);
        }
        if (room.capacity() != null && attendees > room.capacity()) {
            throw new InvalidAttendeesException(attendees, roomId, room.capacity());
        }
    }

    private TimeRange validateRange(TimeRange range) {
        if (range == null) {
            throw new InvalidRangeException("Booking time range is required");
        }
        BookingEngineProperties.Policy policy = properties.getPolicy();
        Duration duration = range.duration();
        if (duration.compareTo(policy.getMinDuration()) < 0) {
            throw new InvalidRangeException(
                    "Booking must last at least " + policy.getMinDuration().toMinutes() + " minutes");
        }
        if (duration.compareTo(policy.getMaxDuration()) > 0) {
            throw new InvalidRangeException(
                    "Booking must not last longer than " + policy.getMaxDuration().toHours() + " hours");
        }
        return range;
    }

    private String normalizeTitle(String title) {
        BookingEngineProperties.Policy policy = properties.getPolicy();
        if (title == null || title.isBlank()) {
            return policy.getDefaultTitle();
        }
        String trimmed = title.trim();
        return trimmed.length() > policy.getMaxTitleLength()
                ? trimmed.substring(0, policy.getMaxTitleLength()).trim()
                : trimmed;
    }

    private String normalizeDescription(String description) {
        int maxLength = properties.getPolicy().getMaxDescriptionLength();
        String trimmed = description.trim();
        return trimmed.length() > maxLength ? trimmed.substring(0, maxLength).trim() : trimmed;
    }
}
