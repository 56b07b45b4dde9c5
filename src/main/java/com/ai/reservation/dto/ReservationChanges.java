package com.ai.reservation.dto;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.LocalDate;

/**
 * Partial update for an existing reservation. Null fields are left unchanged.
 */
@Getter
@Builder
@ToString
public class ReservationChanges {

    private final Integer partySize;
    private final LocalDate date;
    private final String time;
    private final String specialRequests;

    public boolean isEmpty() {
        return partySize == null && date == null && time == null && specialRequests == null;
    }
}
