package com.smartroom.booking.exception;

import com.smartroom.common.exception.BusinessException;

import java.time.Instant;

/**
 * Malformed time range: missing bounds, {@code start >= end}, or a duration outside booking policy.
 */
public class InvalidRangeException extends BusinessException {
    public static final String ERROR_CODE = "INVALID_RANGE";

    public InvalidRangeException(String message) {
        super(message, ERROR_CODE);
    }

    public InvalidRangeException(Instant start, Instant end) {
        super(String.format("Time range start %s must be before end %s", start, end), ERROR_CODE);
    }
}
