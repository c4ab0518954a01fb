package com.tripbooking.trip.domain.model;

import com.tripbooking.trip.client.ResourceKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TripRecordTest {

    @Test
    @DisplayName("a freshly built record is new until persisted or loaded")
    void isNew_untilPersisted() {
        TripRecord record = record();

        assertThat(record.isNew()).isTrue();
        assertThat(record.getId()).isEqualTo("T1");

        record.markPersisted();

        assertThat(record.isNew()).isFalse();
    }

    @Test
    @DisplayName("sub-booking refs skip kinds that were not booked")
    void subBookingRefs_skipMissing() {
        assertThat(record().subBookingRefs()).containsExactly(
                new SubBookingRef(ResourceKind.FLIGHT, "F1"),
                new SubBookingRef(ResourceKind.CAR, "C1"));
    }

    private static TripRecord record() {
        return TripRecord.builder()
                .ref("T1")
                .createdAt(Instant.parse("2026-04-01T10:15:30Z"))
                .name("Ada Lovelace")
                .destination("Lisbon")
                .start(Instant.parse("2026-05-01T08:00:00Z"))
                .end(Instant.parse("2026-05-08T18:00:00Z"))
                .members(List.of("Ada Lovelace"))
                .flightRef("F1")
                .hotelRef("")
                .carRef("C1")
                .build();
    }
}
