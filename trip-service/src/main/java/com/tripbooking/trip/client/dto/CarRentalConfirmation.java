package com.tripbooking.trip.client.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record CarRentalConfirmation(
        String ref,

        @JsonProperty("car_rental")
        BookCarRentalRequest carRental
) {
}
