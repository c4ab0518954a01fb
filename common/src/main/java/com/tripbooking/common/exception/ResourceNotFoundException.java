package com.tripbooking.common.exception;

/**
 * A lookup key that names nothing. Mapped to HTTP 404.
 */
public class ResourceNotFoundException extends BusinessException {

    public ResourceNotFoundException(String resourceType, Object identifier) {
        super(String.format("no such %s: %s", resourceType, identifier), "RESOURCE_NOT_FOUND");
    }
}
