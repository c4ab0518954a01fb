package com.tripbooking.trip.domain.store;

import com.tripbooking.common.exception.PersistenceException;
import com.tripbooking.trip.domain.model.TripRecord;
import com.tripbooking.trip.domain.repository.TripRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.TransactionException;

import java.util.Optional;

@Slf4j
@Component
@RequiredArgsConstructor
public class JpaTripRecordStore implements TripRecordStore {

    private final TripRecordRepository tripRecordRepository;

    /**
     * Inserts the record and flushes, so a reference that is already stored fails here with a
     * {@link PersistenceException} instead of replacing the existing trip.
     */
    @Override
    public void put(TripRecord record) {
        try {
            tripRecordRepository.saveAndFlush(record);
        } catch (DataAccessException | TransactionException e) {
            log.error("Failed to write trip record {}", record.getRef(), e);
            throw new PersistenceException("Failed to write trip record " + record.getRef(), e);
        }
    }

    @Override
    public Optional<TripRecord> get(String ref) {
        try {
            return tripRecordRepository.findById(ref);
        } catch (DataAccessException | TransactionException e) {
            log.error("Failed to read trip record {}", ref, e);
            throw new PersistenceException("Failed to read trip record " + ref, e);
        }
    }
}
