package com.ai.reservation.dto;

import com.ai.reservation.entity.Reservation;

import java.time.LocalDate;
import java.util.List;
import java.util.SortedMap;

public record ReservationsByDateResponse(SortedMap<LocalDate, List<Reservation>> reservations, int totalCount) {

    public static ReservationsByDateResponse of(SortedMap<LocalDate, List<Reservation>> grouped) {
        int total = grouped.values().stream().mapToInt(List::size).sum();
        return new ReservationsByDateResponse(grouped, total);
    }
}
