package com.smartroom.common.exception;

/**
 * Thrown when a collaborator the request depends on (room directory, lock backend)
 * cannot be reached. Nothing has been written; the client may retry unchanged.
 * Mapped to HTTP 503.
 */
public class ServiceUnavailableException extends RuntimeException {

    public ServiceUnavailableException(String message) {
        super(message);
    }

    public ServiceUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
