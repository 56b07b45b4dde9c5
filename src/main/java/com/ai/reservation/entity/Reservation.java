package com.ai.reservation.entity;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

import java.time.Instant;
import java.time.LocalDate;

@Getter
@Setter
@ToString
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class Reservation {

    public enum Status {
        CONFIRMED, CANCELLED;

        @JsonValue
        public String wireName() {
            return name().toLowerCase();
        }
    }

    private String id;
    private String name;
    private int partySize;
    private LocalDate date;
    private String time;
    private String phone;
    @Builder.Default
    private String specialRequests = "";
    @Builder.Default
    private Status status = Status.CONFIRMED;
    private Instant createdAt;

    /** Insertion order in the store; lookups return matches in this order. */
    @JsonIgnore
    private long sequence;

    @JsonIgnore
    public boolean isConfirmed() {
        return status == Status.CONFIRMED;
    }

    public Reservation copy() {
        return toBuilder().build();
    }
}
