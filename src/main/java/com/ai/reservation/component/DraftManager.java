package com.ai.reservation.component;

import com.ai.reservation.conversation.SessionState;
import com.ai.reservation.entity.DraftField;
import com.ai.reservation.entity.ReservationDraft;
import org.springframework.stereotype.Component;

import java.time.LocalDate;

/**
 * Scratch space for the reservation a caller is dictating. One draft per
 * session, stored on the session itself. No validation happens here.
 */
@Component
public class DraftManager {

    public ReservationDraft getOrCreate(SessionState session) {
        if (session.getDraft() == null) {
            session.setDraft(new ReservationDraft());
        }
        return session.getDraft();
    }

    /**
     * Overwrites one field, leaving the others as collected so far.
     */
    public ReservationDraft set(SessionState session, DraftField field, Object value) {
        ReservationDraft draft = getOrCreate(session);
        switch (field) {
            case NAME -> draft.setName((String) value);
            case PARTY_SIZE -> draft.setPartySize((Integer) value);
            case DATE -> draft.setDate((LocalDate) value);
            case TIME -> draft.setTime((String) value);
            case PHONE -> draft.setPhone((String) value);
            case SPECIAL_REQUESTS -> draft.setSpecialRequests((String) value);
        }
        return draft;
    }

    public void clear(SessionState session) {
        session.setDraft(null);
    }

    /**
     * Starts over with an empty draft.
     */
    public ReservationDraft reset(SessionState session) {
        session.setDraft(new ReservationDraft());
        return session.getDraft();
    }
}
