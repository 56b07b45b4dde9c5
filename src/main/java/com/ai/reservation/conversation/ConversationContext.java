package com.ai.reservation.conversation;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Coarse position of a call in the reservation dialogue.
 */
@Getter
@AllArgsConstructor
public enum ConversationContext {
    GREETING("greeting"),
    NEW_RESERVATION("new_reservation"),
    CONFIRMATION("confirmation"),
    MANAGE("manage");

    @JsonValue
    private final String wireName;
}
