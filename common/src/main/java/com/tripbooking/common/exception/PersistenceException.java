package com.tripbooking.common.exception;

/**
 * Thrown when a service's own store cannot be read or written.
 * Mapped to HTTP 503.
 */
public class PersistenceException extends RuntimeException {

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
