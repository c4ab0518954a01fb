package com.tripbooking.trip.domain.repository;

import com.tripbooking.trip.domain.model.TripRecord;
import org.springframework.data.jpa.repository.JpaRepository;

public interface TripRecordRepository extends JpaRepository<TripRecord, String> {
}
