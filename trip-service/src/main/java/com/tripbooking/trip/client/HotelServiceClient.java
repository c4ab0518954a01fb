package com.tripbooking.trip.client;

import com.tripbooking.trip.client.dto.BookHotelRequest;
import com.tripbooking.trip.client.dto.HotelConfirmation;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;

/**
 * Feign client for the hotel service.
 */
@FeignClient(name = "hotel-service", url = "${trip.downstream.hotel-service-url}", path = "/hotels")
public interface HotelServiceClient {

    @PostMapping("/booking")
    ResponseEntity<HotelConfirmation> bookHotel(@RequestBody BookHotelRequest request);

    @GetMapping("/booking")
    ResponseEntity<HotelConfirmation> getBooking(@RequestParam("ref") String ref);
}
