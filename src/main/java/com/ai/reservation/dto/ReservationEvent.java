package com.ai.reservation.dto;

import com.ai.reservation.entity.Reservation;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Notification emitted by a conversation turn for relay to dashboards.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ReservationEvent(Type type, Reservation reservation, String reservationId) {

    public enum Type {
        RESERVATION_CONFIRMED,
        RESERVATION_MODIFIED,
        RESERVATION_CANCELLED;

        @JsonValue
        public String wireName() {
            return name().toLowerCase();
        }
    }

    public static ReservationEvent confirmed(Reservation reservation) {
        return new ReservationEvent(Type.RESERVATION_CONFIRMED, reservation, null);
    }

    public static ReservationEvent modified(Reservation reservation) {
        return new ReservationEvent(Type.RESERVATION_MODIFIED, reservation, null);
    }

    public static ReservationEvent cancelled(String reservationId) {
        return new ReservationEvent(Type.RESERVATION_CANCELLED, null, reservationId);
    }
}
