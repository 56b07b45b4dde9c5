package com.ai.reservation.service;

import com.ai.reservation.component.DraftManager;
import com.ai.reservation.component.ResponsePhrases;
import com.ai.reservation.component.SessionRegistry;
import com.ai.reservation.conversation.ConversationIntent;
import com.ai.reservation.conversation.ConversationStep;
import com.ai.reservation.conversation.FlowOutcome;
import com.ai.reservation.conversation.IntentArguments;
import com.ai.reservation.conversation.SessionState;
import com.ai.reservation.dto.TurnResponse;
import com.ai.reservation.exception.ConfigurationException;
import com.ai.reservation.exception.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Optional;

/**
 * Entry point for every dialogue turn. Resolves the intent, checks it against
 * the session's current step, dispatches to the booking or manage flow and
 * relays whatever events the turn produced.
 * <p>
 * A turn that is rejected or fails validation leaves the session where it was
 * and emits nothing.
 */
@Service
public class ConversationOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ConversationOrchestrator.class);

    private final SessionRegistry sessionRegistry;
    private final BookingFlowService bookingFlow;
    private final ManageFlowService manageFlow;
    private final DraftManager draftManager;
    private final ResponsePhrases phrases;
    private final DashboardEventBroadcaster broadcaster;

    public ConversationOrchestrator(SessionRegistry sessionRegistry, BookingFlowService bookingFlow,
                                    ManageFlowService manageFlow, DraftManager draftManager,
                                    ResponsePhrases phrases, DashboardEventBroadcaster broadcaster) {
        this.sessionRegistry = sessionRegistry;
        this.bookingFlow = bookingFlow;
        this.manageFlow = manageFlow;
        this.draftManager = draftManager;
        this.phrases = phrases;
        this.broadcaster = broadcaster;
    }

    public TurnResponse handleIntent(String sessionId, String intentName, Map<String, ?> rawArgs) {
        TurnResponse response = sessionRegistry.withSession(sessionId, state -> {
            ConversationStep before = state.getStep();
            FlowOutcome outcome = runTurn(state, intentName, IntentArguments.of(rawArgs));
            log.debug("[{}] {} : {} -> {} ({} events)", sessionId, intentName,
                    before.getWireName(), state.getStep().getWireName(), outcome.events().size());
            return new TurnResponse(outcome.responseText(), outcome.events(), state.getContext(), state.getStep());
        });
        broadcaster.publish(response.events());
        return response;
    }

    public boolean endSession(String sessionId) {
        return sessionRegistry.end(sessionId);
    }

    private FlowOutcome runTurn(SessionState state, String intentName, IntentArguments args) {
        Optional<ConversationIntent> intent = ConversationIntent.fromName(intentName);
        if (intent.isEmpty()) {
            log.warn("[{}] Unknown intent '{}'", state.getSessionId(), intentName);
            return FlowOutcome.say(phrases.cannotDoThatNow(state.getStep()));
        }
        if (!state.getStep().allows(intent.get())) {
            log.warn("[{}] Intent {} not allowed in {}.{}", state.getSessionId(), intent.get().getWireName(),
                    state.getContext().getWireName(), state.getStep().getWireName());
            return FlowOutcome.say(phrases.cannotDoThatNow(state.getStep()));
        }
        try {
            return dispatch(state, intent.get(), args);
        } catch (ValidationException e) {
            log.warn("[{}] Invalid arguments for {}: {}", state.getSessionId(), intent.get().getWireName(), e.getMessage());
            return FlowOutcome.say(phrases.invalidInput(e.getFields()));
        } catch (ConfigurationException e) {
            log.warn("[{}] {} rejected: {}", state.getSessionId(), intent.get().getWireName(), e.getMessage());
            return FlowOutcome.say(phrases.invalidTimeSlot());
        }
    }

    private FlowOutcome dispatch(SessionState state, ConversationIntent intent, IntentArguments args) {
        return switch (intent) {
            case START_NEW_RESERVATION -> bookingFlow.startNewReservation(state);
            case SET_NAME -> bookingFlow.setName(state, args);
            case SET_PARTY_SIZE -> bookingFlow.setPartySize(state, args);
            case SET_DATE -> bookingFlow.setDate(state, args);
            case SET_TIME -> bookingFlow.setTime(state, args);
            case SET_PHONE -> bookingFlow.setPhone(state, args);
            case SET_REQUESTS -> bookingFlow.setRequests(state, args);
            case CHECK_AVAILABILITY -> bookingFlow.checkAvailability(state, args);
            case CONFIRM_RESERVATION -> bookingFlow.confirmReservation(state);
            case LOOKUP_RESERVATION -> manageFlow.lookup(state, args);
            case MODIFY_RESERVATION -> manageFlow.modify(state, args);
            case CANCEL_EXISTING_RESERVATION -> manageFlow.cancelExisting(state);
            case CANCEL_FLOW -> cancelFlow(state);
        };
    }

    private FlowOutcome cancelFlow(SessionState state) {
        draftManager.clear(state);
        state.setFoundReservationId(null);
        state.moveTo(ConversationStep.WELCOME);
        return FlowOutcome.say(phrases.anythingElse());
    }
}
