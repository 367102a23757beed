package com.smartroom.common.exception;

import lombok.Getter;

/**
 * Base type for errors a client can act on: malformed input, illegal lifecycle use,
 * lost optimistic races. Each carries a stable error code that the REST layer exposes.
 */
@Getter
public class BusinessException extends RuntimeException {
    private final String errorCode;

    public BusinessException(String message, String errorCode) {
        super(message);
        this.errorCode = errorCode;
    }

    public BusinessException(String message, Throwable cause, String errorCode) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
