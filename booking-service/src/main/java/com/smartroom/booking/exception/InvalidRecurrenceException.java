package com.smartroom.booking.exception;

import com.smartroom.common.exception.BusinessException;

/**
 * Recurrence pattern that cannot be expanded into a bounded series.
 */
public class InvalidRecurrenceException extends BusinessException {
    public static final String ERROR_CODE = "INVALID_RECURRENCE";

    public InvalidRecurrenceException(String message) {
        super(message, ERROR_CODE);
    }
}
