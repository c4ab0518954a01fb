package com.tripbooking.trip.client.dto;

public record FlightConfirmation(
        String ref,
        BookFlightRequest flight
) {
}
