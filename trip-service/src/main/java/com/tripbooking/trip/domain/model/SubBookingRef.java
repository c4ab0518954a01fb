package com.tripbooking.trip.domain.model;

import com.tripbooking.trip.client.ResourceKind;

/**
 * Reference to a booking held by a downstream service. At most one per kind per trip.
 */
public record SubBookingRef(
        ResourceKind kind,
        String ref
) {
}
