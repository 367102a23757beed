package com.smartroom.booking.api.controller;

import com.smartroom.booking.api.dto.AdmissionResponse;
import com.smartroom.booking.api.dto.AvailabilityResponse;
import com.smartroom.booking.api.dto.BatchAvailabilityRequest;
import com.smartroom.booking.api.dto.BookingPageResponse;
import com.smartroom.booking.api.dto.BookingResponse;
import com.smartroom.booking.api.dto.ConflictResponse;
import com.smartroom.booking.api.dto.CreateBookingRequest;
import com.smartroom.booking.api.dto.RecurrenceRequest;
import com.smartroom.booking.api.dto.RescheduleBookingRequest;
import com.smartroom.booking.api.dto.SlotCheckResponse;
import com.smartroom.booking.api.dto.UpdateBookingDetailsRequest;
import com.smartroom.booking.domain.model.Actor;
import com.smartroom.booking.domain.model.ActorRole;
import com.smartroom.booking.domain.model.AdmissionResult;
import com.smartroom.booking.domain.model.Booking.BookingStatus;
import com.smartroom.booking.domain.model.TimeRange;
import com.smartroom.booking.domain.repository.BookingSearchCriteria;
import com.smartroom.booking.domain.service.AvailabilityService;
import com.smartroom.booking.domain.service.BookingLifecycleManager;
import com.smartroom.booking.domain.service.BookingService;
import com.smartroom.booking.domain.service.CreateBookingCommand;
import com.smartroom.booking.domain.service.RescheduleBookingCommand;
import com.smartroom.booking.domain.service.UpdateBookingDetailsCommand;
import com.smartroom.common.dto.BaseResponse;
import com.smartroom.common.util.Constants;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

/**
 * REST controller for booking operations. The caller's identity and role arrive from the
 * gateway as headers and are trusted as-is.
 */
@RestController
@RequestMapping("/api/v1/bookings")
@RequiredArgsConstructor
public class BookingController {

    private final BookingLifecycleManager lifecycleManager;
    private final BookingService bookingService;
    private final AvailabilityService availabilityService;

    @PostMapping
    public ResponseEntity<BaseResponse<AdmissionResponse>> createBooking(
            @RequestHeader(Constants.USER_ID_HEADER) Long userId,
            @RequestHeader(value = Constants.USER_ROLE_HEADER, defaultValue = "USER") ActorRole role,
            @Valid @RequestBody CreateBookingRequest request) {
        CreateBookingCommand command = new CreateBookingCommand(
                request.roomId(),
                new Actor(userId, role),
                request.title(),
                request.description(),
                request.attendees(),
                TimeRange.of(request.startTime(), request.endTime()),
                request.recurrence() == null ? null : request.recurrence().toPattern(),
                request.override());
        return admissionResponse(lifecycleManager.createBooking(command), HttpStatus.CREATED, "Booking confirmed");
    }

    @PutMapping("/{id}")
    public ResponseEntity<BaseResponse<AdmissionResponse>> rescheduleBooking(
            @PathVariable Long id,
            @RequestHeader(Constants.USER_ID_HEADER) Long userId,
            @RequestHeader(value = Constants.USER_ROLE_HEADER, defaultValue = "USER") ActorRole role,
            @Valid @RequestBody RescheduleBookingRequest request) {
        RecurrenceRequest recurrence = request.recurrence();
        RescheduleBookingCommand command = new RescheduleBookingCommand(
                id,
                new Actor(userId, role),
                TimeRange.of(request.startTime(), request.endTime()),
                recurrence == null ? null : recurrence.toPattern(),
                request.expectedVersion());
        return admissionResponse(lifecycleManager.rescheduleBooking(command), HttpStatus.OK, "Booking rescheduled");
    }

    @PatchMapping("/{id}")
    public ResponseEntity<BaseResponse<BookingResponse>> updateBookingDetails(
            @PathVariable Long id,
            @RequestHeader(Constants.USER_ID_HEADER) Long userId,
            @RequestHeader(value = Constants.USER_ROLE_HEADER, defaultValue = "USER") ActorRole role,
            @Valid @RequestBody UpdateBookingDetailsRequest request) {
        UpdateBookingDetailsCommand command = new UpdateBookingDetailsCommand(
                id,
                new Actor(userId, role),
                request.title(),
                request.description(),
                request.attendees(),
                request.expectedVersion());
        BookingResponse response = BookingResponse.from(lifecycleManager.updateBookingDetails(command));
        return ResponseEntity.ok(BaseResponse.success("Booking updated", response));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<BaseResponse<BookingResponse>> cancelBooking(
            @PathVariable Long id,
            @RequestHeader(Constants.USER_ID_HEADER) Long userId,
            @RequestHeader(value = Constants.USER_ROLE_HEADER, defaultValue = "USER") ActorRole role,
            @RequestParam(required = false) String reason) {
        BookingResponse response = BookingResponse.from(
                lifecycleManager.cancelBooking(id, new Actor(userId, role), reason));
        return ResponseEntity.ok(BaseResponse.success("Booking cancelled", response));
    }

    @GetMapping
    public ResponseEntity<BaseResponse<BookingPageResponse>> listBookings(
            @RequestHeader(Constants.USER_ID_HEADER) Long userId,
            @RequestHeader(value = Constants.USER_ROLE_HEADER, defaultValue = "USER") ActorRole role,
            @RequestParam(name = "room_id", required = false) Long roomId,
            @RequestParam(required = false) BookingStatus status,
            @RequestParam(name = "start_date", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant startDate,
            @RequestParam(name = "end_date", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant endDate,
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(name = "per_page", defaultValue = "20") int perPage) {
        BookingSearchCriteria criteria = new BookingSearchCriteria(null, roomId, status, startDate, endDate);
        BookingPageResponse response = BookingPageResponse.from(
                bookingService.listBookings(criteria, new Actor(userId, role), page, perPage));
        return ResponseEntity.ok(BaseResponse.success(response));
    }

    @GetMapping("/{id}")
    public ResponseEntity<BaseResponse<BookingResponse>> getBooking(
            @PathVariable Long id,
            @RequestHeader(Constants.USER_ID_HEADER) Long userId,
            @RequestHeader(value = Constants.USER_ROLE_HEADER, defaultValue = "USER") ActorRole role) {
        BookingResponse response = BookingResponse.from(bookingService.getBooking(id, new Actor(userId, role)));
        return ResponseEntity.ok(BaseResponse.success(response));
    }

    @GetMapping("/user/{userId}")
    public ResponseEntity<BaseResponse<List<BookingResponse>>> getBookingsByUser(
            @PathVariable Long userId,
            @RequestHeader(Constants.USER_ID_HEADER) Long callerId,
            @RequestHeader(value = Constants.USER_ROLE_HEADER, defaultValue = "USER") ActorRole role) {
        List<BookingResponse> response = bookingService.getBookingsForUser(userId, new Actor(callerId, role)).stream()
                .map(BookingResponse::from)
                .collect(Collectors.toList());
        return ResponseEntity.ok(BaseResponse.success(response));
    }

    @GetMapping("/rooms/{roomId}/availability")
    public ResponseEntity<BaseResponse<AvailabilityResponse>> getAvailability(
            @PathVariable Long roomId,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to) {
        AvailabilityResponse response = AvailabilityResponse.from(
                availabilityService.getAvailability(roomId, TimeRange.of(from, to)));
        return ResponseEntity.ok(BaseResponse.success(response));
    }

    @PostMapping("/availability")
    public ResponseEntity<BaseResponse<List<AvailabilityResponse>>> getAvailabilityForRooms(
            @Valid @RequestBody BatchAvailabilityRequest request) {
        List<AvailabilityResponse> response = availabilityService
                .getAvailability(request.roomIds(), TimeRange.of(request.from(), request.to())).stream()
                .map(AvailabilityResponse::from)
                .collect(Collectors.toList());
        return ResponseEntity.ok(BaseResponse.success(response));
    }

    @GetMapping("/rooms/{roomId}/check")
    public ResponseEntity<BaseResponse<SlotCheckResponse>> checkSlot(
            @PathVariable Long roomId,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to) {
        SlotCheckResponse response = SlotCheckResponse.from(availabilityService.checkSlot(roomId, TimeRange.of(from, to)));
        return ResponseEntity.ok(BaseResponse.success(response));
    }

    @GetMapping("/rooms/{roomId}/conflicts")
    public ResponseEntity<BaseResponse<List<ConflictResponse>>> getRoomConflicts(@PathVariable Long roomId) {
        List<ConflictResponse> response = availabilityService.findRoomConflicts(roomId).stream()
                .map(ConflictResponse::from)
                .collect(Collectors.toList());
        return ResponseEntity.ok(BaseResponse.success(response));
    }

    private static ResponseEntity<BaseResponse<AdmissionResponse>> admissionResponse(
            AdmissionResult result, HttpStatus confirmedStatus, String confirmedMessage) {
        AdmissionResponse body = AdmissionResponse.from(result);
        if (result.status() == AdmissionResult.Status.CONFLICT) {
            return ResponseEntity.status(HttpStatus.CONFLICT)
                    .body(BaseResponse.rejected("Requested time conflicts with existing bookings", body, "BOOKING_CONFLICT"));
        }
        if (result.status() == AdmissionResult.Status.BUSY) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(BaseResponse.rejected("Room is busy, please retry shortly", body, "ROOM_BUSY"));
        }
        return ResponseEntity.status(confirmedStatus).body(BaseResponse.success(confirmedMessage, body));
    }
}
