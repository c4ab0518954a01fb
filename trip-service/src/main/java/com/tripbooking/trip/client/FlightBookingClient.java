package com.tripbooking.trip.client;

import com.tripbooking.trip.client.dto.BookFlightRequest;
import com.tripbooking.trip.client.dto.FlightConfirmation;
import com.tripbooking.trip.config.DownstreamServicesProperties;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;

@Component
public class FlightBookingClient extends HttpSubBookingClient<BookFlightRequest, FlightConfirmation> {

    private final FlightServiceClient flightServiceClient;

    public FlightBookingClient(FlightServiceClient flightServiceClient, DownstreamServicesProperties properties) {
        super(ResourceKind.FLIGHT, properties.flightServiceUrl());
        this.flightServiceClient = flightServiceClient;
    }

    @Override
    protected ResponseEntity<FlightConfirmation> post(BookFlightRequest request) {
        return flightServiceClient.bookFlight(request);
    }

    @Override
    protected ResponseEntity<FlightConfirmation> get(String ref) {
        return flightServiceClient.getBooking(ref);
    }

    @Override
    protected String referenceOf(FlightConfirmation confirmation) {
        return confirmation.ref();
    }
}
