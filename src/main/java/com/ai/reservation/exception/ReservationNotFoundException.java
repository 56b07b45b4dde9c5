package com.ai.reservation.exception;

import lombok.Getter;

@Getter
public class ReservationNotFoundException extends ReservationException {

    private final String reservationId;

    public ReservationNotFoundException(String reservationId) {
        super(ErrorCode.RESERVATION_NOT_FOUND, "No active reservation with id " + reservationId);
        this.reservationId = reservationId;
    }
}
