package com.smartroom.booking.exception;

import com.smartroom.common.exception.BusinessException;

/**
 * The request was interrupted while queued for its room. Nothing was written.
 */
public class AdmissionCancelledException extends BusinessException {
    public static final String ERROR_CODE = "ADMISSION_CANCELLED";

    public AdmissionCancelledException(Long roomId, InterruptedException cause) {
        super("Admission cancelled while waiting for room " + roomId, cause, ERROR_CODE);
    }
}
