package com.ai.reservation.entity;

import com.ai.reservation.exception.LedgerCorruptionException;
import lombok.Getter;

import java.time.LocalDate;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Capacity counter for one (date, time slot) cell of the grid. The counter is
 * its own lock: every read and write of {@code booked} and the occupancy set
 * happens while holding the instance monitor.
 */
public class SlotCounter {

    @Getter
    private final LocalDate date;
    @Getter
    private final String timeSlot;
    /** Position of the slot in the configured grid; used for lock ordering. */
    @Getter
    private final int position;
    @Getter
    private final int capacity;

    private int booked;
    private final Set<String> reservationIds = new LinkedHashSet<>();

    public SlotCounter(LocalDate date, String timeSlot, int position, int capacity) {
        this.date = date;
        this.timeSlot = timeSlot;
        this.position = position;
        this.capacity = capacity;
    }

    public synchronized int getBooked() {
        return booked;
    }

    public synchronized int remaining() {
        return capacity - booked;
    }

    public synchronized List<String> occupants() {
        return List.copyOf(reservationIds);
    }

    public synchronized boolean holds(String reservationId) {
        return reservationIds.contains(reservationId);
    }

    /**
     * Records the reservation if there is room and it is not already counted.
     *
     * @return true if the reservation now occupies this slot
     */
    public synchronized boolean tryBook(String reservationId) {
        if (booked >= capacity || reservationIds.contains(reservationId)) {
            return false;
        }
        reservationIds.add(reservationId);
        booked++;
        verify();
        return true;
    }

    /**
     * @return true if the reservation was present and has been removed
     */
    public synchronized boolean release(String reservationId) {
        if (!reservationIds.remove(reservationId)) {
            return false;
        }
        booked--;
        verify();
        return true;
    }

    public synchronized void verify() {
        if (booked != reservationIds.size() || booked < 0 || booked > capacity) {
            throw new LedgerCorruptionException("Slot " + date + " " + timeSlot + " desynchronized: booked="
                    + booked + " occupants=" + reservationIds.size() + " capacity=" + capacity);
        }
    }

    /**
     * Lock order shared by every operation that holds two counters at once.
     */
    public int compareLockOrder(SlotCounter other) {
        int byDate = date.compareTo(other.date);
        return byDate != 0 ? byDate : Integer.compare(position, other.position);
    }
}
