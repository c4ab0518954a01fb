package com.tripbooking.common.exception;

import lombok.Getter;

/**
 * The downstream service answered 404 for a booking reference it was asked to fetch.
 */
@Getter
public class SubBookingNotFoundException extends DownstreamException {

    private final String reference;

    public SubBookingNotFoundException(String resource, String reference, String responseBody) {
        super(resource, FETCH, 404, responseBody);
        this.reference = reference;
    }
}
