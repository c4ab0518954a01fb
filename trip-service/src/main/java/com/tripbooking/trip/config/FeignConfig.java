package com.tripbooking.trip.config;

import feign.Retryer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.cloud.openfeign.EnableFeignClients;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the downstream booking clients.
 * Kept off the application class so web and JPA test slices do not start Feign.
 */
@Slf4j
@Configuration
@EnableFeignClients(basePackages = "com.tripbooking.trip.client")
@EnableConfigurationProperties(DownstreamServicesProperties.class)
public class FeignConfig {

    public FeignConfig(DownstreamServicesProperties properties) {
        log.info("Downstream booking services: flight={}, hotel={}, car={}",
                properties.flightServiceUrl(), properties.hotelServiceUrl(), properties.carServiceUrl());
    }

    /**
     * A failed sub-booking fails the trip; calls are never repeated.
     */
    @Bean
    public Retryer feignRetryer() {
        return Retryer.NEVER_RETRY;
    }
}
