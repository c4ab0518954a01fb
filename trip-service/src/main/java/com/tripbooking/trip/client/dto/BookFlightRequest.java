package com.tripbooking.trip.client.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

import java.time.Instant;
import java.util.List;

public record BookFlightRequest(
        @NotEmpty(message = "Airline cannot be empty")
        String airline,

        @NotEmpty(message = "Flight number cannot be empty")
        @JsonProperty("flight_number")
        String flightNumber,

        @NotNull(message = "Flight time cannot be null")
        Instant time,

        @NotEmpty(message = "Passengers cannot be empty")
        List<@NotEmpty(message = "Passenger name cannot be empty") String> passengers
) {
}
