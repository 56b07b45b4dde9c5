package com.ai.reservation.controller;

import com.ai.reservation.config.RestaurantSettings;
import com.ai.reservation.dto.ReservationsByDateResponse;
import com.ai.reservation.dto.SlotAvailability;
import com.ai.reservation.exception.ValidationException;
import com.ai.reservation.service.DashboardEventBroadcaster;
import com.ai.reservation.service.ReservationService;
import com.ai.reservation.service.SlotLedger;
import org.apache.commons.lang3.StringUtils;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Map;

/**
 * Read-only views for the staff dashboard plus the live event stream.
 */
@RestController
@RequestMapping("/api")
public class DashboardController {

    private final ReservationService reservationService;
    private final SlotLedger slotLedger;
    private final DashboardEventBroadcaster broadcaster;
    private final RestaurantSettings settings;

    public DashboardController(ReservationService reservationService, SlotLedger slotLedger,
                               DashboardEventBroadcaster broadcaster, RestaurantSettings settings) {
        this.reservationService = reservationService;
        this.slotLedger = slotLedger;
        this.broadcaster = broadcaster;
        this.settings = settings;
    }

    @GetMapping("/reservations")
    public ReservationsByDateResponse reservations() {
        return ReservationsByDateResponse.of(reservationService.listByDate());
    }

    @GetMapping("/availability/{date}")
    public Map<String, SlotAvailability> availability(@PathVariable String date) {
        LocalDate day;
        try {
            day = LocalDate.parse(date);
        } catch (DateTimeParseException e) {
            throw ValidationException.invalid("date", "Date must use the YYYY-MM-DD format");
        }
        return slotLedger.availability(day);
    }

    @GetMapping(value = "/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter events() {
        return broadcaster.subscribe();
    }

    @GetMapping("/config")
    public Map<String, String> config() {
        return Map.of(
                "phone_number", StringUtils.defaultString(settings.getPhoneNumber()),
                "restaurant_name", StringUtils.defaultString(settings.getRestaurantName()));
    }
}
