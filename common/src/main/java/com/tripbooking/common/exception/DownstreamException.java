package com.tripbooking.common.exception;

import lombok.Getter;

/**
 * A call to a downstream booking service failed, either at the transport level
 * (status {@value #TRANSPORT_FAILURE}) or with an unexpected HTTP status.
 * The response body is kept verbatim for diagnostics.
 */
@Getter
public class DownstreamException extends BusinessException {

    public static final int TRANSPORT_FAILURE = -1;

    public static final String CREATE = "create";
    public static final String FETCH = "fetch";

    private final String resource;
    private final String operation;
    private final int status;
    private final String responseBody;

    public DownstreamException(String resource, String operation, int status, String responseBody) {
        this(resource, operation, status, responseBody, null);
    }

    public DownstreamException(String resource, String operation, int status, String responseBody, Throwable cause) {
        super(describe(resource, operation, status, responseBody), cause, "DOWNSTREAM_ERROR");
        this.resource = resource;
        this.operation = operation;
        this.status = status;
        this.responseBody = responseBody;
    }

    public boolean isTransportFailure() {
        return status == TRANSPORT_FAILURE;
    }

    private static String describe(String resource, String operation, int status, String responseBody) {
        if (status == TRANSPORT_FAILURE) {
            return String.format("%s %s request failed: %s", resource, operation, responseBody);
        }
        return String.format("%s %s request returned status code %d (%s)", resource, operation, status, responseBody);
    }
}
