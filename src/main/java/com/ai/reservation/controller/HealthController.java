package com.ai.reservation.controller;

import com.ai.reservation.config.RestaurantSettings;
import org.apache.commons.lang3.StringUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
public class HealthController {

    private final RestaurantSettings settings;

    public HealthController(RestaurantSettings settings) {
        this.settings = settings;
    }

    @GetMapping("/health")
    public Map<String, String> health() {
        return Map.of("status", "healthy", "agent", StringUtils.defaultString(settings.getAgentName()));
    }
}
