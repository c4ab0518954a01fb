package com.tripbooking.trip.exception;

import com.tripbooking.common.exception.ResourceNotFoundException;

/**
 * No trip record exists for the reference.
 */
public class TripNotFoundException extends ResourceNotFoundException {

    public TripNotFoundException(String ref) {
        super("booking", ref);
    }
}
