package com.ai.reservation.config;

import com.ai.reservation.exception.ConfigurationException;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * Immutable restaurant configuration: the daily slot grid, per-slot capacity
 * and party size limits. Slot order in {@link #getTimeSlots()} is the sort
 * order used everywhere a list of slots or reservations is rendered.
 */
@Getter
@ToString
public final class RestaurantSettings {

    private final String restaurantName;
    private final String phoneNumber;
    private final String agentName;
    private final List<String> timeSlots;
    private final int capacityPerSlot;
    private final int maxPartySize;
    private final int confirmationIdAttempts;

    @Builder
    private RestaurantSettings(String restaurantName, String phoneNumber, String agentName,
                               List<String> timeSlots, int capacityPerSlot, int maxPartySize,
                               int confirmationIdAttempts) {
        if (timeSlots == null || timeSlots.isEmpty()) {
            throw new ConfigurationException("At least one time slot must be configured");
        }
        if (timeSlots.stream().distinct().count() != timeSlots.size()) {
            throw new ConfigurationException("Time slots must be unique: " + timeSlots);
        }
        if (capacityPerSlot < 1 || maxPartySize < 1 || confirmationIdAttempts < 1) {
            throw new ConfigurationException("Capacity, max party size and id attempts must be positive");
        }
        this.restaurantName = restaurantName;
        this.phoneNumber = phoneNumber;
        this.agentName = agentName;
        this.timeSlots = List.copyOf(timeSlots);
        this.capacityPerSlot = capacityPerSlot;
        this.maxPartySize = maxPartySize;
        this.confirmationIdAttempts = confirmationIdAttempts;
    }

    public boolean isKnownSlot(String slot) {
        return slot != null && timeSlots.contains(slot);
    }

    /**
     * Position of the slot in the configured grid.
     *
     * @throws ConfigurationException if the label is not configured
     */
    public int slotIndex(String slot) {
        int index = slot == null ? -1 : timeSlots.indexOf(slot);
        if (index < 0) {
            throw new ConfigurationException("Unknown time slot: " + slot);
        }
        return index;
    }

    public boolean isValidPartySize(int partySize) {
        return partySize >= 1 && partySize <= maxPartySize;
    }
}
