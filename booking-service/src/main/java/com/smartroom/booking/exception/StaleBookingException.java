package com.smartroom.booking.exception;

import com.smartroom.common.exception.BusinessException;

/**
 * The caller's view of a booking is out of date. Re-fetch and retry with the current version.
 */
public class StaleBookingException extends BusinessException {
    public static final String ERROR_CODE = "STALE_BOOKING";

    public StaleBookingException(Long bookingId, Long expectedVersion, Long actualVersion) {
        super(String.format("Booking %s is at version %s, request expected %s",
                bookingId, actualVersion, expectedVersion), ERROR_CODE);
    }

    public StaleBookingException(Long bookingId, Throwable cause) {
        super(String.format("Booking %s was modified concurrently", bookingId), cause, ERROR_CODE);
    }
}
