package com.ai.reservation.dto;

/**
 * Point-in-time availability of one slot. Not a reservation of capacity.
 */
public record SlotCheck(boolean available, int remaining) {

    public static SlotCheck ofRemaining(int remaining) {
        return new SlotCheck(remaining > 0, remaining);
    }
}
