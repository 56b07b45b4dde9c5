package com.ai.reservation.service;

import com.ai.reservation.component.DraftManager;
import com.ai.reservation.component.ResponsePhrases;
import com.ai.reservation.config.RestaurantSettings;
import com.ai.reservation.conversation.ConversationStep;
import com.ai.reservation.conversation.FlowOutcome;
import com.ai.reservation.conversation.IntentArguments;
import com.ai.reservation.conversation.SessionState;
import com.ai.reservation.dto.ReservationEvent;
import com.ai.reservation.dto.SlotCheck;
import com.ai.reservation.entity.DraftField;
import com.ai.reservation.entity.Reservation;
import com.ai.reservation.entity.ReservationDraft;
import com.ai.reservation.exception.ConfigurationException;
import com.ai.reservation.exception.SlotUnavailableException;
import com.ai.reservation.exception.ValidationException;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Handlers for the new-reservation dialogue: collecting the draft field by
 * field, availability questions, and the final confirmation.
 * <p>
 * Field handlers validate only their own argument; ordering of the questions
 * is left to the voice platform.
 */
@Service
public class BookingFlowService {

    private static final Logger log = LoggerFactory.getLogger(BookingFlowService.class);

    private final RestaurantSettings settings;
    private final SlotLedger slotLedger;
    private final ReservationService reservationService;
    private final DraftManager draftManager;
    private final ResponsePhrases phrases;

    public BookingFlowService(RestaurantSettings settings, SlotLedger slotLedger,
                              ReservationService reservationService, DraftManager draftManager,
                              ResponsePhrases phrases) {
        this.settings = settings;
        this.slotLedger = slotLedger;
        this.reservationService = reservationService;
        this.draftManager = draftManager;
        this.phrases = phrases;
    }

    public FlowOutcome startNewReservation(SessionState state) {
        draftManager.reset(state);
        state.setFoundReservationId(null);
        state.moveTo(ConversationStep.COLLECT);
        return FlowOutcome.say(phrases.startReservation());
    }

    public FlowOutcome setName(SessionState state, IntentArguments args) {
        String name = args.getString("name");
        if (name == null) {
            return FlowOutcome.say(phrases.askName());
        }
        draftManager.set(state, DraftField.NAME, name);
        return FlowOutcome.say(phrases.nameRecorded(name));
    }

    public FlowOutcome setPartySize(SessionState state, IntentArguments args) {
        Integer partySize = args.getInteger("party_size");
        if (partySize == null || partySize < 1) {
            return FlowOutcome.say(phrases.askPartySize());
        }
        if (partySize > settings.getMaxPartySize()) {
            log.warn("[{}] Party of {} exceeds maximum {}", state.getSessionId(), partySize, settings.getMaxPartySize());
            return FlowOutcome.say(phrases.partySizeTooLarge());
        }
        draftManager.set(state, DraftField.PARTY_SIZE, partySize);
        return FlowOutcome.say(phrases.partySizeRecorded(partySize));
    }

    public FlowOutcome setDate(SessionState state, IntentArguments args) {
        LocalDate date = args.getDate("date");
        if (date == null) {
            return FlowOutcome.say(phrases.askDate());
        }
        draftManager.set(state, DraftField.DATE, date);
        List<String> open = slotLedger.openSlots(date);
        if (open.isEmpty()) {
            return FlowOutcome.say(phrases.dateFullyBooked(date));
        }
        return FlowOutcome.say(phrases.dateAvailable(date, open));
    }

    /**
     * Stores the slot unless it is unknown or, for an already chosen date, full.
     * A full slot is answered with the open slots of that date instead.
     */
    public FlowOutcome setTime(SessionState state, IntentArguments args) {
        String slot = args.getString("time");
        if (!settings.isKnownSlot(slot)) {
            log.warn("[{}] Rejected unknown time slot '{}'", state.getSessionId(), slot);
            return FlowOutcome.say(phrases.invalidTimeSlot());
        }
        LocalDate date = draftManager.getOrCreate(state).getDate();
        if (date == null) {
            draftManager.set(state, DraftField.TIME, slot);
            return FlowOutcome.say(phrases.timeRecordedPendingDate(slot));
        }
        if (!slotLedger.check(date, slot).available()) {
            List<String> alternatives = slotLedger.openSlots(date);
            return FlowOutcome.say(alternatives.isEmpty()
                    ? phrases.dateFullyBooked(date)
                    : phrases.slotFullWithAlternatives(slot, alternatives));
        }
        draftManager.set(state, DraftField.TIME, slot);
        return FlowOutcome.say(phrases.timeRecorded(slot));
    }

    public FlowOutcome setPhone(SessionState state, IntentArguments args) {
        String phone = args.getString("phone");
        if (phone == null) {
            return FlowOutcome.say(phrases.askPhone());
        }
        draftManager.set(state, DraftField.PHONE, phone);
        return FlowOutcome.say(phrases.phoneRecorded());
    }

    /**
     * Last collection step; always moves on to confirmation, even with an empty request.
     */
    public FlowOutcome setRequests(SessionState state, IntentArguments args) {
        String requests = args.has("requests") ? args.getString("requests") : args.getString("special_requests");
        ReservationDraft draft = draftManager.set(state, DraftField.SPECIAL_REQUESTS, StringUtils.defaultString(requests));
        state.moveTo(ConversationStep.CONFIRM);
        return FlowOutcome.say(phrases.confirmationSummary(draft));
    }

    public FlowOutcome checkAvailability(SessionState state, IntentArguments args) {
        LocalDate date = args.getDate("date");
        if (date == null && state.getDraft() != null) {
            date = state.getDraft().getDate();
        }
        if (date == null) {
            return FlowOutcome.say(phrases.askDate());
        }
        String slot = args.getString("time");
        if (slot != null) {
            if (!settings.isKnownSlot(slot)) {
                return FlowOutcome.say(phrases.invalidTimeSlot());
            }
            SlotCheck check = slotLedger.check(date, slot);
            return FlowOutcome.say(check.available()
                    ? phrases.slotAvailable(date, slot, check)
                    : phrases.slotFull(date, slot));
        }
        Map<String, Integer> remaining = new LinkedHashMap<>();
        for (String s : settings.getTimeSlots()) {
            SlotCheck check = slotLedger.check(date, s);
            if (check.available()) {
                remaining.put(s, check.remaining());
            }
        }
        return FlowOutcome.say(remaining.isEmpty() ? phrases.dayFull(date) : phrases.dayAvailability(date, remaining));
    }

    /**
     * Commits the draft. On success the session returns to the welcome step;
     * on a recoverable failure it goes back to collecting, keeping what it can.
     */
    public FlowOutcome confirmReservation(SessionState state) {
        ReservationDraft draft = draftManager.getOrCreate(state);
        try {
            Reservation reservation = reservationService.confirm(draft.copy());
            draftManager.clear(state);
            state.setLastReservationId(reservation.getId());
            state.moveTo(ConversationStep.WELCOME);
            log.info("[{}] Reservation {} confirmed", state.getSessionId(), reservation.getId());
            return FlowOutcome.say(phrases.reservationConfirmed(reservation), ReservationEvent.confirmed(reservation));
        } catch (ValidationException e) {
            log.warn("[{}] Confirmation rejected: {}", state.getSessionId(), e.getFields());
            state.moveTo(ConversationStep.COLLECT);
            return FlowOutcome.say(phrases.missingDetails(e.getFields()));
        } catch (SlotUnavailableException e) {
            log.warn("[{}] Slot {} {} taken before confirmation", state.getSessionId(), e.getDate(), e.getTimeSlot());
            draftManager.set(state, DraftField.TIME, null);
            state.moveTo(ConversationStep.COLLECT);
            return FlowOutcome.say(phrases.slotJustTaken(e.getAlternatives()));
        } catch (ConfigurationException e) {
            log.error("[{}] Confirmation failed: {}", state.getSessionId(), e.getMessage());
            return FlowOutcome.say(phrases.tryAgainLater());
        }
    }
}
