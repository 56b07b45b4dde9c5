package com.ai.reservation.conversation;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

import static com.ai.reservation.conversation.ConversationIntent.*;

/**
 * Fine position within a {@link ConversationContext}. Each step owns the set
 * of intents it accepts; anything else is rejected without changing state.
 */
@Getter
public enum ConversationStep {
    WELCOME(ConversationContext.GREETING, "welcome",
            EnumSet.of(START_NEW_RESERVATION, LOOKUP_RESERVATION)),
    READY(ConversationContext.GREETING, "ready",
            EnumSet.of(START_NEW_RESERVATION, LOOKUP_RESERVATION)),
    COLLECT(ConversationContext.NEW_RESERVATION, "collect",
            EnumSet.of(SET_NAME, SET_PARTY_SIZE, SET_DATE, SET_TIME, SET_PHONE, SET_REQUESTS,
                    CHECK_AVAILABILITY, CANCEL_FLOW)),
    CONFIRM(ConversationContext.CONFIRMATION, "confirm",
            EnumSet.of(CONFIRM_RESERVATION, CANCEL_FLOW)),
    FOUND(ConversationContext.MANAGE, "found",
            EnumSet.of(MODIFY_RESERVATION, CANCEL_EXISTING_RESERVATION, CANCEL_FLOW));

    private final ConversationContext context;
    @JsonValue
    private final String wireName;
    private final Set<ConversationIntent> allowedIntents;

    ConversationStep(ConversationContext context, String wireName, EnumSet<ConversationIntent> allowedIntents) {
        this.context = context;
        this.wireName = wireName;
        this.allowedIntents = Collections.unmodifiableSet(allowedIntents);
    }

    public boolean allows(ConversationIntent intent) {
        return allowedIntents.contains(intent);
    }
}
