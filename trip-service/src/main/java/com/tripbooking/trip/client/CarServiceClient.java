package com.tripbooking.trip.client;

import com.tripbooking.trip.client.dto.BookCarRentalRequest;
import com.tripbooking.trip.client.dto.CarRentalConfirmation;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;

/**
 * Feign client for the car rental service.
 */
@FeignClient(name = "car-service", url = "${trip.downstream.car-service-url}", path = "/cars")
public interface CarServiceClient {

    @PostMapping("/booking")
    ResponseEntity<CarRentalConfirmation> bookCarRental(@RequestBody BookCarRentalRequest request);

    @GetMapping("/booking")
    ResponseEntity<CarRentalConfirmation> getBooking(@RequestParam("ref") String ref);
}
