package com.tripbooking.common.exception;

import lombok.Getter;

/**
 * Base of the domain errors surfaced to callers.
 * The error code travels to the response envelope unchanged.
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
