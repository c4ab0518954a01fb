package com.tripbooking.trip;

import com.tripbooking.trip.api.dto.BookTripRequest;
import com.tripbooking.trip.client.dto.BookCarRentalRequest;
import com.tripbooking.trip.client.dto.BookFlightRequest;
import com.tripbooking.trip.client.dto.BookHotelRequest;
import com.tripbooking.trip.client.dto.CarRentalConfirmation;
import com.tripbooking.trip.client.dto.FlightConfirmation;
import com.tripbooking.trip.client.dto.HotelConfirmation;

import java.time.Instant;
import java.util.List;

/**
 * Requests and confirmations shared by the trip-service tests.
 */
public final class TripFixtures {

    public static final Instant START = Instant.parse("2026-05-01T08:00:00Z");
    public static final Instant END = Instant.parse("2026-05-08T18:00:00Z");

    private TripFixtures() {
    }

    public static BookFlightRequest flightRequest() {
        return new BookFlightRequest("Delta", "DL 1024", START, List.of("Ada Lovelace", "Charles Babbage"));
    }

    public static BookHotelRequest hotelRequest() {
        return new BookHotelRequest("Grand Budapest", START, END, "Ada Lovelace", 2);
    }

    public static BookCarRentalRequest carRequest() {
        return new BookCarRentalRequest("Hertz", START, "Airport", END, "Downtown", "Ada Lovelace", "compact");
    }

    public static BookTripRequest tripRequest(BookFlightRequest flight, BookHotelRequest hotel, BookCarRentalRequest car) {
        return new BookTripRequest(
                "Ada Lovelace",
                "Analytical Engine Offsite",
                "Lisbon",
                START,
                END,
                List.of("Ada Lovelace", "Charles Babbage"),
                flight,
                hotel,
                car
        );
    }

    public static BookTripRequest tripRequest() {
        return tripRequest(null, null, null);
    }

    public static BookTripRequest fullTripRequest() {
        return tripRequest(flightRequest(), hotelRequest(), carRequest());
    }

    public static FlightConfirmation flightConfirmation(String ref) {
        return new FlightConfirmation(ref, flightRequest());
    }

    public static HotelConfirmation hotelConfirmation(String ref) {
        return new HotelConfirmation(ref, hotelRequest());
    }

    public static CarRentalConfirmation carConfirmation(String ref) {
        return new CarRentalConfirmation(ref, carRequest());
    }
}
