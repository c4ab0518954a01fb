package com.tripbooking.trip.client.dto;

public record HotelConfirmation(
        String ref,
        BookHotelRequest hotel
) {
}
