package com.ai.reservation.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.List;
import java.util.Random;

@Configuration
public class RestaurantConfig {

    private static final Logger log = LoggerFactory.getLogger(RestaurantConfig.class);

    @Bean
    public RestaurantSettings restaurantSettings(
            @Value("${reservation.restaurant-name:Bobby's Table}") String restaurantName,
            @Value("${reservation.phone-number:}") String phoneNumber,
            @Value("${reservation.agent-name:bobbystable}") String agentName,
            @Value("${reservation.time-slots:17:00,18:00,19:00,20:00,21:00}") List<String> timeSlots,
            @Value("${reservation.capacity-per-slot:5}") int capacityPerSlot,
            @Value("${reservation.max-party-size:20}") int maxPartySize,
            @Value("${reservation.confirmation-id-attempts:10}") int confirmationIdAttempts) {
        RestaurantSettings settings = RestaurantSettings.builder()
                .restaurantName(restaurantName)
                .phoneNumber(phoneNumber)
                .agentName(agentName)
                .timeSlots(timeSlots.stream().map(String::trim).toList())
                .capacityPerSlot(capacityPerSlot)
                .maxPartySize(maxPartySize)
                .confirmationIdAttempts(confirmationIdAttempts)
                .build();
        log.info("Restaurant '{}' slots={} capacityPerSlot={} maxPartySize={}",
                restaurantName, settings.getTimeSlots(), capacityPerSlot, maxPartySize);
        return settings;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Random confirmationRandom() {
        return new SecureRandom();
    }
}
