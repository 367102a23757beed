package com.smartroom.common.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Response envelope for every booking API call.
 *
 * A non-successful response may still carry data: a booking conflict returns the
 * conflicting set so the caller can pick another slot.
 *
 * @param <T> Type of the response data
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class BaseResponse<T> {
    private boolean success;
    private String message;
    private T data;
    private Instant timestamp;
    private String errorCode;

    public static <T> BaseResponse<T> success(T data) {
        return success(null, data);
    }

    public static <T> BaseResponse<T> success(String message, T data) {
        return BaseResponse.<T>builder()
                .success(true)
                .message(message)
                .data(data)
                .timestamp(Instant.now())
                .build();
    }

    public static <T> BaseResponse<T> error(String message, String errorCode) {
        return rejected(message, null, errorCode);
    }

    /**
     * Unsuccessful outcome that still returns a payload (conflict set, busy room).
     */
    public static <T> BaseResponse<T> rejected(String message, T data, String errorCode) {
        return BaseResponse.<T>builder()
                .success(false)
                .message(message)
                .data(data)
                .errorCode(errorCode)
                .timestamp(Instant.now())
                .build();
    }
}
