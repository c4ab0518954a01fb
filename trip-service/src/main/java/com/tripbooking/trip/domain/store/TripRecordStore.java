package com.tripbooking.trip.domain.store;

import com.tripbooking.common.exception.PersistenceException;
import com.tripbooking.trip.domain.model.TripRecord;

import java.util.Optional;

/**
 * Single-key storage for trip records. Implementations must be safe for concurrent use.
 * Both operations fail with {@link PersistenceException} when the store is unavailable.
 */
public interface TripRecordStore {

    void put(TripRecord record);

    Optional<TripRecord> get(String ref);
}
