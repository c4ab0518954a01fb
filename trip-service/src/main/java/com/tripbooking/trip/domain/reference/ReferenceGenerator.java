package com.tripbooking.trip.domain.reference;

/**
 * Source of booking references handed out to callers.
 */
public interface ReferenceGenerator {

    /**
     * @return a new reference, unique with overwhelming probability; no ordering is implied
     */
    String next();
}
