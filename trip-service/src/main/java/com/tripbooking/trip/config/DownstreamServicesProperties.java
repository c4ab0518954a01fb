package com.tripbooking.trip.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Base URLs of the flight, hotel and car booking services.
 * Bound from {@code trip.downstream.*}; the Feign clients resolve the same keys.
 */
@Validated
@ConfigurationProperties(prefix = "trip.downstream")
public record DownstreamServicesProperties(
        @NotBlank String flightServiceUrl,
        @NotBlank String hotelServiceUrl,
        @NotBlank String carServiceUrl
) {
}
