package com.smartroom.booking.exception;

import com.smartroom.common.exception.BusinessException;

/**
 * Booking write failed twice. No booking or occurrence row from the request was committed.
 */
public class PersistenceFailureException extends BusinessException {
    public static final String ERROR_CODE = "PERSISTENCE_FAILURE";

    public PersistenceFailureException(String message, Throwable cause) {
        super(message, cause, ERROR_CODE);
    }
}
