package com.ai.reservation.conversation;

import com.ai.reservation.entity.ReservationDraft;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import java.time.Instant;

/**
 * Per-call conversation state. Owned by exactly one session; the registry
 * serialises turns on this object, so handlers mutate it without further locking.
 */
@Getter
@Setter
@ToString
public class SessionState {

    private final String sessionId;
    private ConversationStep step = ConversationStep.WELCOME;
    private ReservationDraft draft;
    /** Reservation picked by the last single-match lookup; target of modify and cancel. */
    private String foundReservationId;
    private String lastReservationId;
    private Instant lastActivity;

    public SessionState(String sessionId, Instant createdAt) {
        this.sessionId = sessionId;
        this.lastActivity = createdAt;
    }

    public ConversationContext getContext() {
        return step.getContext();
    }

    public void moveTo(ConversationStep next) {
        this.step = next;
    }
}
