package com.smartroom.booking.api.dto;

import com.smartroom.booking.domain.model.Booking;
import org.springframework.data.domain.Page;

import java.util.List;
import java.util.stream.Collectors;

/**
 * One page of bookings. {@code page} is 1-based.
 */
public record BookingPageResponse(
        List<BookingResponse> items,
        int page,
        int perPage,
        long total,
        int totalPages
) {
    public static BookingPageResponse from(Page<Booking> page) {
        return new BookingPageResponse(
                page.getContent().stream().map(BookingResponse::from).collect(Collectors.toList()),
                page.getNumber() + 1,
                page.getSize(),
                page.getTotalElements(),
                page.getTotalPages()
        );
    }
}
