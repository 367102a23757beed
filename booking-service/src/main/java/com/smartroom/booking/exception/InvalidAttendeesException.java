package com.smartroom.booking.exception;

import com.smartroom.common.exception.BusinessException;

/**
 * Attendee count that is not positive or does not fit the room.
 */
public class InvalidAttendeesException extends BusinessException {
    public static final String ERROR_CODE = "INVALID_ATTENDEES";

    public InvalidAttendeesException(int attendees) {
        super("Number of attendees must be at least 1, got " + attendees, ERROR_CODE);
    }

    public InvalidAttendeesException(int attendees, Long roomId, int capacity) {
        super(String.format("Number of attendees (%d) exceeds capacity (%d) of room %d", attendees, capacity, roomId),
                ERROR_CODE);
    }
}
