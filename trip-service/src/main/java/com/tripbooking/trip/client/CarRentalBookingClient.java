package com.tripbooking.trip.client;

import com.tripbooking.trip.client.dto.BookCarRentalRequest;
import com.tripbooking.trip.client.dto.CarRentalConfirmation;
import com.tripbooking.trip.config.DownstreamServicesProperties;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;

@Component
public class CarRentalBookingClient extends HttpSubBookingClient<BookCarRentalRequest, CarRentalConfirmation> {

    private final CarServiceClient carServiceClient;

    public CarRentalBookingClient(CarServiceClient carServiceClient, DownstreamServicesProperties properties) {
        super(ResourceKind.CAR, properties.carServiceUrl());
        this.carServiceClient = carServiceClient;
    }

    @Override
    protected ResponseEntity<CarRentalConfirmation> post(BookCarRentalRequest request) {
        return carServiceClient.bookCarRental(request);
    }

    @Override
    protected ResponseEntity<CarRentalConfirmation> get(String ref) {
        return carServiceClient.getBooking(ref);
    }

    @Override
    protected String referenceOf(CarRentalConfirmation confirmation) {
        return confirmation.ref();
    }
}
