package com.tripbooking.trip.client;

import com.tripbooking.trip.client.dto.BookFlightRequest;
import com.tripbooking.trip.client.dto.FlightConfirmation;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;

/**
 * Feign client for the flight service.
 */
@FeignClient(name = "flight-service", url = "${trip.downstream.flight-service-url}", path = "/flights")
public interface FlightServiceClient {

    @PostMapping("/booking")
    ResponseEntity<FlightConfirmation> bookFlight(@RequestBody BookFlightRequest request);

    @GetMapping("/booking")
    ResponseEntity<FlightConfirmation> getBooking(@RequestParam("ref") String ref);
}
