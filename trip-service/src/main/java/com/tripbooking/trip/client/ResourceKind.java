package com.tripbooking.trip.client;

/**
 * The sub-resources a trip can be composed of, in the order they are booked.
 */
public enum ResourceKind {
    FLIGHT("flight"),
    HOTEL("hotel"),
    CAR("car");

    private final String resourceName;

    ResourceKind(String resourceName) {
        this.resourceName = resourceName;
    }

    public String resourceName() {
        return resourceName;
    }
}
