package com.ai.reservation.entity;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public enum DraftField {
    NAME("name"),
    PARTY_SIZE("party_size"),
    DATE("date"),
    TIME("time"),
    PHONE("phone"),
    SPECIAL_REQUESTS("special_requests");

    private final String wireName;
}
