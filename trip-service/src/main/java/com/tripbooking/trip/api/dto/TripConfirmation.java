package com.tripbooking.trip.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.tripbooking.trip.client.dto.CarRentalConfirmation;
import com.tripbooking.trip.client.dto.FlightConfirmation;
import com.tripbooking.trip.client.dto.HotelConfirmation;

/**
 * Response-only view of a trip. Sub-confirmations are present only for the resources that were
 * booked, or on retrieval, re-fetched.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TripConfirmation(
        String ref,

        BookTripRequest trip,

        @JsonProperty("flight_confirmation")
        FlightConfirmation flightConfirmation,

        @JsonProperty("hotel_confirmation")
        HotelConfirmation hotelConfirmation,

        @JsonProperty("car_rental_confirmation")
        CarRentalConfirmation carRentalConfirmation
) {
}
