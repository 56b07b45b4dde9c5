package com.ai.reservation.exception;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public enum ErrorCode {
    INVALID_INPUT("RESERVATION_001", "Some reservation details are missing or invalid"),
    SLOT_UNAVAILABLE("RESERVATION_002", "The requested time slot is fully booked"),
    RESERVATION_NOT_FOUND("RESERVATION_003", "No active reservation matches that confirmation number"),
    CONFIGURATION("RESERVATION_004", "The request does not match the restaurant configuration"),
    INTERNAL_ERROR("COMMON_001", "Internal server error"),
    ;

    private final String code;
    private final String message;
}
