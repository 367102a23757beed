package com.smartroom.booking.exception;

import com.smartroom.booking.domain.model.Booking.BookingStatus;
import com.smartroom.common.exception.BusinessException;

/**
 * Lifecycle misuse, e.g. cancelling an already cancelled booking or rescheduling a rejected one.
 */
public class InvalidTransitionException extends BusinessException {
    public static final String ERROR_CODE = "INVALID_TRANSITION";

    public InvalidTransitionException(Long bookingId, BookingStatus from, String action) {
        super(String.format("Cannot %s booking %s in %s status", action, bookingId, from), ERROR_CODE);
    }
}
