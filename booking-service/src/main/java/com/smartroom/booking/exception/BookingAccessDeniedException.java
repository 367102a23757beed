package com.smartroom.booking.exception;

import com.smartroom.common.exception.BusinessException;

public class BookingAccessDeniedException extends BusinessException {
    public static final String ERROR_CODE = "ACCESS_DENIED";

    public BookingAccessDeniedException(String message) {
        super(message, ERROR_CODE);
    }
}
