package com.tripbooking.trip.api.controller;

import com.tripbooking.common.dto.BaseResponse;
import com.tripbooking.trip.api.dto.BookTripRequest;
import com.tripbooking.trip.api.dto.TripConfirmation;
import com.tripbooking.trip.orchestration.TripOrchestrator;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST controller for trip bookings. Requests are validated here; the orchestrator trusts them.
 */
@Slf4j
@RestController
@RequestMapping("/booking")
@RequiredArgsConstructor
public class TripBookingController {

    private final TripOrchestrator tripOrchestrator;

    @PostMapping
    public ResponseEntity<BaseResponse<TripConfirmation>> bookTrip(
            @Valid @RequestBody BookTripRequest request) {
        TripConfirmation confirmation = tripOrchestrator.bookTrip(request);
        log.info("Booked trip {}", confirmation.ref());
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(BaseResponse.success("Trip booked successfully", confirmation));
    }

    @GetMapping
    public ResponseEntity<BaseResponse<TripConfirmation>> getBooking(@RequestParam String ref) {
        TripConfirmation confirmation = tripOrchestrator.getBooking(ref);
        log.info("Fetched trip {}", ref);
        return ResponseEntity.ok(BaseResponse.success(confirmation));
    }
}
