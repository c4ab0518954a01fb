package com.tripbooking.trip.client;

import com.tripbooking.common.exception.DownstreamException;
import com.tripbooking.common.exception.SubBookingNotFoundException;

/**
 * Creates and fetches single-resource bookings in the service that owns that resource.
 * Implementations are shared by concurrent orchestrations and must be thread-safe.
 *
 * @param <Q> resource booking request
 * @param <C> resource booking confirmation
 */
public interface SubBookingClient<Q, C> {

    ResourceKind kind();

    /**
     * Books the resource. The request must already be valid.
     *
     * @throws DownstreamException if the service did not answer 201 or could not be reached
     */
    SubBooking<C> create(Q request);

    /**
     * Reads the current state of a booking from its owning service.
     *
     * @throws SubBookingNotFoundException if the service does not know the reference
     * @throws DownstreamException         on any other failure
     */
    C fetch(String ref);
}
