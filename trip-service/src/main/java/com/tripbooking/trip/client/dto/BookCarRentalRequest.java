package com.tripbooking.trip.client.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

import java.time.Instant;

public record BookCarRentalRequest(
        @NotEmpty(message = "Agent cannot be empty")
        String agent,

        @NotNull(message = "Pick-up cannot be null")
        @JsonProperty("pick_up")
        Instant pickUp,

        @NotEmpty(message = "Pick-up location cannot be empty")
        @JsonProperty("pick_up_location")
        String pickUpLocation,

        @NotNull(message = "Drop-off cannot be null")
        @JsonProperty("drop_off")
        Instant dropOff,

        @NotEmpty(message = "Drop-off location cannot be empty")
        @JsonProperty("drop_off_location")
        String dropOffLocation,

        @NotEmpty(message = "Name cannot be empty")
        String name,

        @NotEmpty(message = "Vehicle class cannot be empty")
        @JsonProperty("vehicle_class")
        String vehicleClass
) {
}
