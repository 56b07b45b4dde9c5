package com.ai.reservation.conversation;

import com.ai.reservation.dto.ReservationEvent;

import java.util.List;

/**
 * What a handler produced for one turn: the sentence to speak and any events
 * to relay. The session's new position is read from {@link SessionState}.
 */
public record FlowOutcome(String responseText, List<ReservationEvent> events) {

    public FlowOutcome {
        events = events == null ? List.of() : List.copyOf(events);
    }

    public static FlowOutcome say(String text) {
        return new FlowOutcome(text, List.of());
    }

    public static FlowOutcome say(String text, ReservationEvent event) {
        return new FlowOutcome(text, List.of(event));
    }
}
