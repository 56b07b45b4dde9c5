package com.ai.reservation.conversation;

import lombok.Getter;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Closed set of tool invocations the voice platform can send. Each intent has
 * one canonical wire name; some also accept the platform's older function names.
 */
@Getter
public enum ConversationIntent {
    START_NEW_RESERVATION("start_new_reservation"),
    LOOKUP_RESERVATION("lookup_reservation"),
    SET_NAME("set_name", "set_reservation_name"),
    SET_PARTY_SIZE("set_party_size"),
    SET_DATE("set_date", "set_reservation_date"),
    SET_TIME("set_time", "set_reservation_time"),
    SET_PHONE("set_phone", "set_phone_number"),
    SET_REQUESTS("set_requests", "set_special_requests"),
    CHECK_AVAILABILITY("check_availability"),
    CONFIRM_RESERVATION("confirm_reservation"),
    MODIFY_RESERVATION("modify_reservation"),
    CANCEL_EXISTING_RESERVATION("cancel_existing_reservation"),
    CANCEL_FLOW("cancel_flow");

    private final String wireName;
    private final List<String> aliases;

    ConversationIntent(String wireName, String... aliases) {
        this.wireName = wireName;
        this.aliases = List.of(aliases);
    }

    public static Optional<ConversationIntent> fromName(String name) {
        if (name == null) return Optional.empty();
        String normalized = name.trim().toLowerCase();
        return Arrays.stream(values())
                .filter(i -> i.wireName.equals(normalized) || i.aliases.contains(normalized))
                .findFirst();
    }
}
