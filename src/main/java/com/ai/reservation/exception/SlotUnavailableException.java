package com.ai.reservation.exception;

import lombok.Getter;

import java.time.LocalDate;
import java.util.List;

@Getter
public class SlotUnavailableException extends ReservationException {

    private final LocalDate date;
    private final String timeSlot;
    /** Slots on the same date that still had room when the failure was detected. */
    private final List<String> alternatives;

    public SlotUnavailableException(LocalDate date, String timeSlot, List<String> alternatives) {
        super(ErrorCode.SLOT_UNAVAILABLE, "Time slot " + timeSlot + " on " + date + " is fully booked");
        this.date = date;
        this.timeSlot = timeSlot;
        this.alternatives = List.copyOf(alternatives);
    }
}
