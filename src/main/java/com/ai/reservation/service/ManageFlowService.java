package com.ai.reservation.service;

import com.ai.reservation.component.ResponsePhrases;
import com.ai.reservation.config.RestaurantSettings;
import com.ai.reservation.conversation.ConversationStep;
import com.ai.reservation.conversation.FlowOutcome;
import com.ai.reservation.conversation.IntentArguments;
import com.ai.reservation.conversation.SessionState;
import com.ai.reservation.dto.ReservationChanges;
import com.ai.reservation.dto.ReservationEvent;
import com.ai.reservation.entity.Reservation;
import com.ai.reservation.exception.ReservationNotFoundException;
import com.ai.reservation.exception.SlotUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Objects;

/**
 * Lookup, modification and cancellation of existing reservations.
 * A lookup only selects a reservation when it matches exactly one; modify and
 * cancel then act on that selection.
 */
@Service
public class ManageFlowService {

    private static final Logger log = LoggerFactory.getLogger(ManageFlowService.class);
    private static final int MAX_LISTED_MATCHES = 3;

    private final RestaurantSettings settings;
    private final ReservationService reservationService;
    private final ResponsePhrases phrases;

    public ManageFlowService(RestaurantSettings settings, ReservationService reservationService,
                             ResponsePhrases phrases) {
        this.settings = settings;
        this.reservationService = reservationService;
        this.phrases = phrases;
    }

    public FlowOutcome lookup(SessionState state, IntentArguments args) {
        String phone = args.getString("phone");
        String name = args.getString("name");
        state.setFoundReservationId(null);
        if (phone == null && name == null) {
            state.moveTo(ConversationStep.READY);
            return FlowOutcome.say(phrases.lookupPrompt());
        }

        List<Reservation> matches = reservationService.lookup(phone, name);
        log.info("[{}] Lookup phone={} name={} -> {} matches", state.getSessionId(), phone, name, matches.size());
        if (matches.isEmpty()) {
            state.moveTo(ConversationStep.READY);
            return FlowOutcome.say(phrases.lookupNoMatch());
        }
        if (matches.size() > 1) {
            state.moveTo(ConversationStep.READY);
            return FlowOutcome.say(phrases.lookupMultiple(matches.subList(0, Math.min(MAX_LISTED_MATCHES, matches.size()))));
        }
        Reservation found = matches.get(0);
        state.setFoundReservationId(found.getId());
        state.moveTo(ConversationStep.FOUND);
        return FlowOutcome.say(phrases.lookupFound(found));
    }

    public FlowOutcome modify(SessionState state, IntentArguments args) {
        String reservationId = state.getFoundReservationId();
        if (reservationId == null) {
            return FlowOutcome.say(phrases.lookupFirst());
        }
        ReservationChanges changes = ReservationChanges.builder()
                .partySize(args.getInteger("party_size"))
                .date(args.getDate("date"))
                .time(args.getString("time"))
                .specialRequests(args.has("special_requests")
                        ? Objects.toString(args.getString("special_requests"), "")
                        : null)
                .build();
        if (changes.isEmpty()) {
            return FlowOutcome.say(phrases.askWhatToChange());
        }
        if (changes.getTime() != null && !settings.isKnownSlot(changes.getTime())) {
            return FlowOutcome.say(phrases.invalidTimeSlot());
        }
        if (changes.getPartySize() != null && changes.getPartySize() > settings.getMaxPartySize()) {
            return FlowOutcome.say(phrases.partySizeTooLarge());
        }
        if (changes.getPartySize() != null && changes.getPartySize() < 1) {
            return FlowOutcome.say(phrases.askPartySize());
        }

        try {
            Reservation updated = reservationService.modify(reservationId, changes);
            return FlowOutcome.say(phrases.reservationUpdated(updated), ReservationEvent.modified(updated));
        } catch (SlotUnavailableException e) {
            return FlowOutcome.say(phrases.modifySlotUnavailable(e.getDate(), e.getTimeSlot(), e.getAlternatives()));
        } catch (ReservationNotFoundException e) {
            return reservationGone(state);
        }
    }

    public FlowOutcome cancelExisting(SessionState state) {
        String reservationId = state.getFoundReservationId();
        if (reservationId == null) {
            return FlowOutcome.say(phrases.lookupFirst());
        }
        try {
            Reservation cancelled = reservationService.cancel(reservationId);
            state.setFoundReservationId(null);
            state.moveTo(ConversationStep.WELCOME);
            return FlowOutcome.say(phrases.reservationCancelled(cancelled), ReservationEvent.cancelled(reservationId));
        } catch (ReservationNotFoundException e) {
            return reservationGone(state);
        }
    }

    private FlowOutcome reservationGone(SessionState state) {
        log.warn("[{}] Selected reservation {} is no longer active", state.getSessionId(), state.getFoundReservationId());
        state.setFoundReservationId(null);
        state.moveTo(ConversationStep.READY);
        return FlowOutcome.say(phrases.reservationGone());
    }
}
