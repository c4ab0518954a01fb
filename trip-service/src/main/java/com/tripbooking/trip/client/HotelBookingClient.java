package com.tripbooking.trip.client;

import com.tripbooking.trip.client.dto.BookHotelRequest;
import com.tripbooking.trip.client.dto.HotelConfirmation;
import com.tripbooking.trip.config.DownstreamServicesProperties;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;

@Component
public class HotelBookingClient extends HttpSubBookingClient<BookHotelRequest, HotelConfirmation> {

    private final HotelServiceClient hotelServiceClient;

    public HotelBookingClient(HotelServiceClient hotelServiceClient, DownstreamServicesProperties properties) {
        super(ResourceKind.HOTEL, properties.hotelServiceUrl());
        this.hotelServiceClient = hotelServiceClient;
    }

    @Override
    protected ResponseEntity<HotelConfirmation> post(BookHotelRequest request) {
        return hotelServiceClient.bookHotel(request);
    }

    @Override
    protected ResponseEntity<HotelConfirmation> get(String ref) {
        return hotelServiceClient.getBooking(ref);
    }

    @Override
    protected String referenceOf(HotelConfirmation confirmation) {
        return confirmation.ref();
    }
}
