package com.ai.reservation.dto;

import com.ai.reservation.conversation.ConversationContext;
import com.ai.reservation.conversation.ConversationStep;

import java.util.List;

/**
 * Outcome of one dialogue turn: what to say, where the conversation now is,
 * and the events to relay to dashboards, in emission order.
 */
public record TurnResponse(String responseText,
                           List<ReservationEvent> events,
                           ConversationContext nextContext,
                           ConversationStep nextStep) {

    public TurnResponse {
        events = events == null ? List.of() : List.copyOf(events);
    }
}
