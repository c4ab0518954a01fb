package com.tripbooking.trip.orchestration;

import com.tripbooking.common.exception.DownstreamException;
import com.tripbooking.common.exception.PersistenceException;
import com.tripbooking.trip.api.dto.BookTripRequest;
import com.tripbooking.trip.api.dto.TripConfirmation;
import com.tripbooking.trip.client.SubBooking;
import com.tripbooking.trip.client.SubBookingClient;
import com.tripbooking.trip.client.dto.BookCarRentalRequest;
import com.tripbooking.trip.client.dto.BookFlightRequest;
import com.tripbooking.trip.client.dto.BookHotelRequest;
import com.tripbooking.trip.client.dto.CarRentalConfirmation;
import com.tripbooking.trip.client.dto.FlightConfirmation;
import com.tripbooking.trip.client.dto.HotelConfirmation;
import com.tripbooking.trip.domain.model.SubBookingRef;
import com.tripbooking.trip.domain.model.TripRecord;
import com.tripbooking.trip.domain.reference.ReferenceGenerator;
import com.tripbooking.trip.domain.store.TripRecordStore;
import com.tripbooking.trip.exception.TripNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Composes a trip out of flight, hotel and car bookings held by their own services.
 *
 * Booking flow:
 * 1. Generate the trip reference
 * 2. Book flight (if requested)
 * 3. Book hotel (if requested)
 * 4. Book car rental (if requested)
 * 5. Persist the trip record (request without sub-requests + sub-booking references)
 *
 * Sub-bookings are made one at a time in that fixed order, never in parallel; the first failure
 * aborts the trip and no record is written. There is no compensation: sub-bookings committed
 * before the failure stay in their services and are only reported in the error log.
 *
 * Retrieval re-fetches every sub-booking from its owning service so the response reflects live
 * state, and fails as a whole if any fetch fails.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TripOrchestrator {

    private final ReferenceGenerator referenceGenerator;
    private final SubBookingClient<BookFlightRequest, FlightConfirmation> flightClient;
    private final SubBookingClient<BookHotelRequest, HotelConfirmation> hotelClient;
    private final SubBookingClient<BookCarRentalRequest, CarRentalConfirmation> carClient;
    private final TripRecordStore tripRecordStore;

    /**
     * Books every requested sub-resource and records the trip.
     *
     * @param request trip request that already passed validation
     * @return confirmation with the request as submitted and the sub-confirmations obtained
     */
    public TripConfirmation bookTrip(BookTripRequest request) {
        String ref = referenceGenerator.next();
        log.info("Starting trip booking {} to {} for {}", ref, request.destination(), request.name());

        List<SubBookingRef> booked = new ArrayList<>();
        FlightConfirmation flight = null;
        HotelConfirmation hotel = null;
        CarRentalConfirmation car = null;

        if (request.flight() != null) {
            log.info("Step 1: Booking flight {} {} for trip {}",
                    request.flight().airline(), request.flight().flightNumber(), ref);
            flight = book(ref, flightClient, request.flight(), booked).confirmation();
        }
        if (request.hotel() != null) {
            log.info("Step 2: Booking hotel {} for trip {}", request.hotel().hotel(), ref);
            hotel = book(ref, hotelClient, request.hotel(), booked).confirmation();
        }
        if (request.car() != null) {
            log.info("Step 3: Booking car rental with {} for trip {}", request.car().agent(), ref);
            car = book(ref, carClient, request.car(), booked).confirmation();
        }

        TripRecord record = toRecord(ref, request.withoutSubRequests(), booked);
        try {
            tripRecordStore.put(record);
        } catch (PersistenceException e) {
            log.error("Trip {} not recorded; sub-bookings left in place: {}", ref, booked, e);
            throw e;
        }

        log.info("Trip booking {} completed with {} sub-booking(s)", ref, booked.size());
        return new TripConfirmation(ref, request, flight, hotel, car);
    }

    /**
     * Reassembles a trip confirmation from the stored record and the live sub-bookings.
     *
     * @throws TripNotFoundException if no trip has this reference
     * @throws DownstreamException   if any sub-booking cannot be fetched, including one its
     *                               service no longer knows
     */
    public TripConfirmation getBooking(String ref) {
        TripRecord record = tripRecordStore.get(ref)
                .orElseThrow(() -> new TripNotFoundException(ref));

        FlightConfirmation flight = fetch(ref, flightClient, record.getFlightRef());
        HotelConfirmation hotel = fetch(ref, hotelClient, record.getHotelRef());
        CarRentalConfirmation car = fetch(ref, carClient, record.getCarRef());

        log.info("Fetched trip booking {} with {} sub-booking(s)", ref, record.subBookingRefs().size());
        return new TripConfirmation(ref, BookTripRequest.from(record), flight, hotel, car);
    }

    private <Q, C> SubBooking<C> book(String tripRef, SubBookingClient<Q, C> client, Q request,
                                      List<SubBookingRef> booked) {
        try {
            SubBooking<C> booking = client.create(request);
            booked.add(new SubBookingRef(client.kind(), booking.ref()));
            return booking;
        } catch (DownstreamException e) {
            if (booked.isEmpty()) {
                log.error("Trip {} aborted: {} booking failed", tripRef, client.kind().resourceName());
            } else {
                log.error("Trip {} aborted: {} booking failed, orphaned sub-bookings: {}",
                        tripRef, client.kind().resourceName(), booked);
            }
            throw e;
        }
    }

    private <C> C fetch(String tripRef, SubBookingClient<?, C> client, String subRef) {
        if (!StringUtils.hasText(subRef)) {
            return null;
        }
        try {
            return client.fetch(subRef);
        } catch (DownstreamException e) {
            log.error("Trip {}: failed to fetch {} booking {}", tripRef, client.kind().resourceName(), subRef);
            throw e;
        }
    }

    private TripRecord toRecord(String ref, BookTripRequest stripped, List<SubBookingRef> booked) {
        TripRecord.TripRecordBuilder builder = TripRecord.builder()
                .ref(ref)
                .createdAt(Instant.now())
                .name(stripped.name())
                .tripName(stripped.tripName())
                .destination(stripped.destination())
                .start(stripped.start())
                .end(stripped.end())
                .members(new ArrayList<>(stripped.members()));
        for (SubBookingRef subRef : booked) {
            switch (subRef.kind()) {
                case FLIGHT -> builder.flightRef(subRef.ref());
                case HOTEL -> builder.hotelRef(subRef.ref());
                case CAR -> builder.carRef(subRef.ref());
            }
        }
        return builder.build();
    }
}
