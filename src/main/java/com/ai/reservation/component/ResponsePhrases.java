package com.ai.reservation.component;

import com.ai.reservation.config.RestaurantSettings;
import com.ai.reservation.conversation.ConversationStep;
import com.ai.reservation.dto.SlotCheck;
import com.ai.reservation.entity.Reservation;
import com.ai.reservation.entity.ReservationDraft;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Everything the host says. Flow logic decides what happened; this class
 * only turns it into warm, spoken sentences.
 */
@Component
public class ResponsePhrases {

    private final RestaurantSettings settings;

    public ResponsePhrases(RestaurantSettings settings) {
        this.settings = settings;
    }

    // --- greeting -------------------------------------------------------

    public String anythingElse() {
        return "No problem! Is there anything else I can help you with?";
    }

    public String guidanceFor(ConversationStep step) {
        switch (step) {
            case COLLECT:
                return "Let's finish your reservation details first, or say cancel to start over.";
            case CONFIRM:
                return "Shall I go ahead and confirm this reservation, or would you like to start over?";
            case FOUND:
                return "Would you like to modify or cancel this reservation?";
            default:
                return "I can help you make a new reservation or look up an existing one. What would you like to do?";
        }
    }

    public String cannotDoThatNow(ConversationStep step) {
        return "Sorry, I can't do that right now. " + guidanceFor(step);
    }

    /**
     * Re-asks for an argument that arrived in the wrong shape.
     */
    public String invalidInput(List<String> fields) {
        if (fields.contains("party_size")) {
            return askPartySize();
        }
        if (fields.contains("date")) {
            return askDate();
        }
        return "I'm sorry, I didn't quite catch that. Could you say it again?";
    }

    // --- collecting a new reservation ------------------------------------

    public String startReservation() {
        return "Wonderful! Let's get you a table. May I have the name for the reservation?";
    }

    public String askName() {
        return "May I have the name for the reservation?";
    }

    public String nameRecorded(String name) {
        return "Thank you, " + name + ". How many guests will be joining us?";
    }

    public String partySizeTooLarge() {
        return "I'm sorry, we can only accommodate parties up to " + settings.getMaxPartySize() + ". "
                + "For larger groups, please call us directly.";
    }

    public String askPartySize() {
        return "How many guests will be joining us? Please give me a number from 1 to "
                + settings.getMaxPartySize() + ".";
    }

    public String partySizeRecorded(int partySize) {
        return "Party of " + partySize + ", got it. What date would you like to dine with us?";
    }

    public String askDate() {
        return "What date would you like? Please give me the year, month and day.";
    }

    public String dateAvailable(LocalDate date, List<String> openSlots) {
        return "We have availability on " + date + ". "
                + "Available times are: " + String.join(", ", openSlots) + ". What time would you prefer?";
    }

    public String dateFullyBooked(LocalDate date) {
        return "I'm sorry, we're fully booked on " + date + ". Would you like to try a different date?";
    }

    public String invalidTimeSlot() {
        return "I'm sorry, that's not a valid time slot. "
                + "We have openings at: " + String.join(", ", settings.getTimeSlots()) + ".";
    }

    public String slotFullWithAlternatives(String slot, List<String> alternatives) {
        return "I'm sorry, " + slot + " is fully booked. "
                + "We have availability at: " + String.join(", ", alternatives) + ". Would you like one of those?";
    }

    public String timeRecorded(String slot) {
        return "Great, " + slot + " is available! May I have a phone number for the reservation?";
    }

    public String timeRecordedPendingDate(String slot) {
        return "Got it, " + slot + ". What date would you like to dine with us?";
    }

    public String askPhone() {
        return "May I have a phone number for the reservation?";
    }

    public String phoneRecorded() {
        return "Perfect! Any special requests or occasions we should know about? "
                + "For example, a birthday, anniversary, dietary restrictions, or seating preferences?";
    }

    public String confirmationSummary(ReservationDraft draft) {
        String name = StringUtils.defaultIfBlank(draft.getName(), "Guest");
        int partySize = draft.getPartySize() == null ? 0 : draft.getPartySize();
        String date = draft.getDate() == null ? "" : draft.getDate().toString();
        StringBuilder summary = new StringBuilder("Let me confirm your reservation: ")
                .append(name).append(", party of ").append(partySize)
                .append(", on ").append(date).append(" at ").append(StringUtils.defaultString(draft.getTime())).append(". ")
                .append("Phone: ").append(StringUtils.defaultString(draft.getPhone())).append(".");
        if (StringUtils.isNotBlank(draft.getSpecialRequests())) {
            summary.append(" Special requests: ").append(draft.getSpecialRequests()).append(".");
        }
        return summary.append(" Is this correct?").toString();
    }

    // --- availability ----------------------------------------------------

    public String slotAvailable(LocalDate date, String slot, SlotCheck check) {
        return "Yes, " + slot + " on " + date + " is available with " + check.remaining() + " spots remaining.";
    }

    public String slotFull(LocalDate date, String slot) {
        return "I'm sorry, " + slot + " on " + date + " is fully booked.";
    }

    public String dayAvailability(LocalDate date, Map<String, Integer> remainingBySlot) {
        String slots = remainingBySlot.entrySet().stream()
                .map(e -> e.getKey() + " (" + e.getValue() + " spots)")
                .collect(Collectors.joining(", "));
        return "On " + date + ", we have availability at: " + slots + ".";
    }

    public String dayFull(LocalDate date) {
        return "I'm sorry, we're fully booked on " + date + ".";
    }

    // --- confirming --------------------------------------------------------

    public String missingDetails(List<String> fields) {
        return "I'm missing some information: " + fields.stream().map(f -> f.replace('_', ' '))
                .collect(Collectors.joining(", ")) + ". Let's go back and complete those.";
    }

    public String slotJustTaken(List<String> alternatives) {
        if (alternatives.isEmpty()) {
            return "I'm sorry, that time slot was just taken and we're now fully booked that day. "
                    + "Would you like to try a different date?";
        }
        return "I'm sorry, that time slot was just taken. We still have availability at: "
                + String.join(", ", alternatives) + ". Which would you prefer?";
    }

    public String reservationConfirmed(Reservation r) {
        return "Your reservation is confirmed! "
                + r.getName() + ", party of " + r.getPartySize() + ", on " + r.getDate() + " at " + r.getTime() + ". "
                + "Your confirmation number is " + r.getId() + ". We look forward to seeing you!";
    }

    public String tryAgainLater() {
        return "I'm sorry, I couldn't complete that right now. Please try again in a moment.";
    }

    // --- lookup / modify / cancel -----------------------------------------

    public String lookupPrompt() {
        return "I can look up your reservation by phone number or name. Which would you like to provide?";
    }

    public String lookupNoMatch() {
        return "I couldn't find a reservation with that information. "
                + "Would you like to try different details or make a new reservation?";
    }

    public String lookupFound(Reservation r) {
        return "I found your reservation: " + r.getName() + ", party of " + r.getPartySize() + ", "
                + "on " + r.getDate() + " at " + r.getTime() + ". "
                + "Would you like to modify or cancel this reservation?";
    }

    public String lookupMultiple(List<Reservation> matches) {
        String list = matches.stream()
                .map(r -> r.getName() + " on " + r.getDate() + " at " + r.getTime())
                .collect(Collectors.joining("; "));
        return "I found multiple reservations: " + list + ". "
                + "Could you provide more details to help me find the right one?";
    }

    public String lookupFirst() {
        return "I need to look up your reservation first. Can you provide your phone number or name?";
    }

    public String askWhatToChange() {
        return "What would you like to change: the date, the time, the party size, or the special requests?";
    }

    public String modifySlotUnavailable(LocalDate date, String slot, List<String> alternatives) {
        String base = "I'm sorry, " + slot + " on " + date + " is not available.";
        if (alternatives.isEmpty()) {
            return base + " Would you like to try a different date?";
        }
        return base + " We have availability at: " + String.join(", ", alternatives)
                + ". Would you like to try a different time?";
    }

    public String reservationUpdated(Reservation r) {
        return "Your reservation has been updated: " + r.getName() + ", party of " + r.getPartySize() + ", "
                + "on " + r.getDate() + " at " + r.getTime() + ". Is there anything else?";
    }

    public String reservationCancelled(Reservation r) {
        return "Your reservation for " + r.getName() + " on " + r.getDate() + " at " + r.getTime() + " "
                + "has been cancelled. Is there anything else I can help with?";
    }

    public String reservationGone() {
        return "I couldn't find that reservation anymore. It may have been cancelled. "
                + "Can you provide your phone number or name so I can look again?";
    }
}
