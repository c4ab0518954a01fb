package com.tripbooking.trip.client.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.time.Instant;

public record BookHotelRequest(
        @NotEmpty(message = "Hotel cannot be empty")
        String hotel,

        @NotNull(message = "Check-in cannot be null")
        @JsonProperty("check_in")
        Instant checkIn,

        @NotNull(message = "Check-out cannot be null")
        @JsonProperty("check_out")
        Instant checkOut,

        @NotEmpty(message = "Name cannot be empty")
        String name,

        @Positive(message = "Guests must be positive")
        @NotNull(message = "Guests cannot be null")
        Integer guests
) {
}
