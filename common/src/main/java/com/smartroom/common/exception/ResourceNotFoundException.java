package com.smartroom.common.exception;

/**
 * Thrown when a booking or room referenced by a request does not exist.
 */
public class ResourceNotFoundException extends BusinessException {
    public static final String ERROR_CODE = "RESOURCE_NOT_FOUND";

    public ResourceNotFoundException(String resourceType, Object identifier) {
        super(String.format("%s with identifier %s not found", resourceType, identifier), ERROR_CODE);
    }
}
