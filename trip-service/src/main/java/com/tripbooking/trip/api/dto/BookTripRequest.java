package com.tripbooking.trip.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.tripbooking.trip.client.dto.BookCarRentalRequest;
import com.tripbooking.trip.client.dto.BookFlightRequest;
import com.tripbooking.trip.client.dto.BookHotelRequest;
import com.tripbooking.trip.domain.model.TripRecord;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

import java.time.Instant;
import java.util.List;

/**
 * A trip with up to three optional sub-requests. Each present sub-request is validated
 * on its own rules.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BookTripRequest(
        @NotEmpty(message = "Name cannot be empty")
        String name,

        @JsonProperty("trip_name")
        String tripName,

        @NotEmpty(message = "Destination cannot be empty")
        String destination,

        @NotNull(message = "Start cannot be null")
        Instant start,

        @NotNull(message = "End cannot be null")
        Instant end,

        @NotEmpty(message = "Members cannot be empty")
        List<@NotEmpty(message = "Member name cannot be empty") String> members,

        @Valid
        BookFlightRequest flight,

        @Valid
        BookHotelRequest hotel,

        @Valid
        BookCarRentalRequest car
) {

    /**
     * The same trip with the sub-requests dropped. Once booked, the downstream references are
     * authoritative for those.
     */
    public BookTripRequest withoutSubRequests() {
        return new BookTripRequest(name, tripName, destination, start, end, members, null, null, null);
    }

    public static BookTripRequest from(TripRecord record) {
        return new BookTripRequest(
                record.getName(),
                record.getTripName(),
                record.getDestination(),
                record.getStart(),
                record.getEnd(),
                List.copyOf(record.getMembers()),
                null,
                null,
                null
        );
    }
}
