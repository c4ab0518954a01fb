package com.tripbooking.trip.client;

/**
 * A booking committed in a downstream service: its reference and the confirmation it answered with.
 */
public record SubBooking<C>(
        String ref,
        C confirmation
) {
}
