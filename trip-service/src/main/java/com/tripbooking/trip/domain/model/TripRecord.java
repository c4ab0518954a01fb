package com.tripbooking.trip.domain.model;

import com.tripbooking.trip.client.ResourceKind;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.springframework.data.domain.Persistable;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Composite record of a booked trip: the request without its sub-requests, plus the references
 * of the sub-bookings obtained. Written once per trip and never updated.
 *
 * The reference is assigned by the caller, so the record reports itself as new until it has been
 * persisted or loaded. Saving a fresh record therefore always inserts, and a reused reference
 * fails on the primary key instead of overwriting the stored trip.
 */
@Entity
@Table(name = "trips")
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class TripRecord implements Persistable<String> {
    @Id
    @Column(name = "ref", nullable = false, updatable = false, length = 64)
    private String ref;

    @Convert(converter = InstantTextConverter.class)
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "organizer_name", nullable = false)
    private String name;

    @Column(name = "trip_name")
    private String tripName;

    @Column(name = "destination", nullable = false)
    private String destination;

    @Convert(converter = InstantTextConverter.class)
    @Column(name = "start_at", nullable = false)
    private Instant start;

    @Convert(converter = InstantTextConverter.class)
    @Column(name = "end_at", nullable = false)
    private Instant end;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "trip_members", joinColumns = @JoinColumn(name = "trip_ref"))
    @OrderColumn(name = "member_index")
    @Column(name = "member_name", nullable = false)
    @Builder.Default
    private List<String> members = new ArrayList<>();

    @Column(name = "flight_ref")
    private String flightRef;

    @Column(name = "hotel_ref")
    private String hotelRef;

    @Column(name = "car_ref")
    private String carRef;

    @Transient
    @Builder.Default
    private boolean persisted = false;

    @Override
    public String getId() {
        return ref;
    }

    @Override
    public boolean isNew() {
        return !persisted;
    }

    @PostPersist
    @PostLoad
    void markPersisted() {
        this.persisted = true;
    }

    /**
     * Sub-booking references in booking order; kinds that were not booked are skipped.
     */
    public List<SubBookingRef> subBookingRefs() {
        List<SubBookingRef> refs = new ArrayList<>();
        addIfPresent(refs, ResourceKind.FLIGHT, flightRef);
        addIfPresent(refs, ResourceKind.HOTEL, hotelRef);
        addIfPresent(refs, ResourceKind.CAR, carRef);
        return refs;
    }

    private static void addIfPresent(List<SubBookingRef> refs, ResourceKind kind, String ref) {
        if (ref != null && !ref.isEmpty()) {
            refs.add(new SubBookingRef(kind, ref));
        }
    }
}
