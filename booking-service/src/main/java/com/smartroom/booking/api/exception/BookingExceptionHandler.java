package com.smartroom.booking.api.exception;

import com.smartroom.booking.exception.BookingAccessDeniedException;
import com.smartroom.booking.exception.InvalidTransitionException;
import com.smartroom.booking.exception.PersistenceFailureException;
import com.smartroom.booking.exception.StaleBookingException;
import com.smartroom.common.dto.BaseResponse;
import com.smartroom.common.exception.BusinessException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Booking errors whose HTTP status differs from the shared 400 mapping for business errors.
 * Everything else falls through to the common GlobalExceptionHandler.
 */
@Slf4j
@Order(Ordered.HIGHEST_PRECEDENCE)
@RestControllerAdvice
public class BookingExceptionHandler {

    @ExceptionHandler({StaleBookingException.class, InvalidTransitionException.class})
    public ResponseEntity<BaseResponse<?>> handleStateConflict(BusinessException ex) {
        log.warn("Booking state conflict [{}]: {}", ex.getErrorCode(), ex.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(BaseResponse.error(ex.getMessage(), ex.getErrorCode()));
    }

    @ExceptionHandler(BookingAccessDeniedException.class)
    public ResponseEntity<BaseResponse<?>> handleAccessDenied(BookingAccessDeniedException ex) {
        log.warn("Booking access denied: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.FORBIDDEN)
                .body(BaseResponse.error(ex.getMessage(), ex.getErrorCode()));
    }

    @ExceptionHandler(PersistenceFailureException.class)
    public ResponseEntity<BaseResponse<?>> handlePersistenceFailure(PersistenceFailureException ex) {
        log.error("Booking persistence failure: {}", ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(BaseResponse.error(ex.getMessage(), ex.getErrorCode()));
    }
}
