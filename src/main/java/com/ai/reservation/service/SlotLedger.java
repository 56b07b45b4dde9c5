package com.ai.reservation.service;

import com.ai.reservation.config.RestaurantSettings;
import com.ai.reservation.dto.SlotAvailability;
import com.ai.reservation.dto.SlotCheck;
import com.ai.reservation.entity.SlotCounter;
import com.ai.reservation.exception.LedgerCorruptionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-date, per-slot capacity ledger and the only place capacity is counted.
 * <p>
 * Each (date, slot) counter is locked on its own, so bookings on different
 * slots never contend. A date's counters are created together the first time
 * the date is referenced and live for the rest of the process.
 */
@Service
public class SlotLedger {

    private static final Logger log = LoggerFactory.getLogger(SlotLedger.class);

    private final RestaurantSettings settings;
    private final Map<LocalDate, Map<String, SlotCounter>> counters = new ConcurrentHashMap<>();

    public SlotLedger(RestaurantSettings settings) {
        this.settings = settings;
    }

    public SlotCheck check(LocalDate date, String slot) {
        return SlotCheck.ofRemaining(counter(date, slot).remaining());
    }

    /**
     * Books one unit of the slot for the reservation. The capacity check and the
     * increment happen under the counter's lock.
     *
     * @return false if the slot is full (or already holds this id); nothing changes then
     */
    public boolean book(LocalDate date, String slot, String reservationId) {
        boolean booked = counter(date, slot).tryBook(reservationId);
        if (booked) {
            log.debug("Booked slot {} {} for {}", date, slot, reservationId);
        }
        return booked;
    }

    /**
     * Idempotent. Unknown dates, slots and ids are ignored.
     */
    public void release(LocalDate date, String slot, String reservationId) {
        Map<String, SlotCounter> day = counters.get(date);
        SlotCounter counter = day == null ? null : day.get(slot);
        if (counter != null && counter.release(reservationId)) {
            log.debug("Released slot {} {} from {}", date, slot, reservationId);
        }
    }

    /**
     * Moves a reservation between slots as one step: both counters are locked
     * (in {@link SlotCounter#compareLockOrder} order), the destination is
     * re-checked, and only then is the source released and the destination booked.
     *
     * @return false if the destination is full; the source stays booked
     */
    public boolean move(LocalDate fromDate, String fromSlot, LocalDate toDate, String toSlot, String reservationId) {
        SlotCounter source = counter(fromDate, fromSlot);
        SlotCounter target = counter(toDate, toSlot);
        if (source == target) {
            return source.holds(reservationId);
        }
        SlotCounter first = source.compareLockOrder(target) < 0 ? source : target;
        SlotCounter second = first == source ? target : source;
        synchronized (first) {
            synchronized (second) {
                if (!source.holds(reservationId)) {
                    throw new LedgerCorruptionException(reservationId + " is not counted in "
                            + fromDate + " " + fromSlot);
                }
                if (target.remaining() <= 0) {
                    return false;
                }
                source.release(reservationId);
                if (!target.tryBook(reservationId)) {
                    throw new IllegalStateException("Destination " + toDate + " " + toSlot
                            + " refused a booking after its capacity check");
                }
            }
        }
        log.debug("Moved {} from {} {} to {} {}", reservationId, fromDate, fromSlot, toDate, toSlot);
        return true;
    }

    /**
     * Configured slots that still have room on the date, in grid order.
     */
    public List<String> openSlots(LocalDate date) {
        List<String> open = new ArrayList<>();
        for (SlotCounter c : day(date).values()) {
            if (c.remaining() > 0) {
                open.add(c.getTimeSlot());
            }
        }
        return open;
    }

    /**
     * Remaining capacity of every slot on the date, in grid order. Read-only: an
     * unseen date reports full capacity without being materialised.
     */
    public Map<String, SlotAvailability> availability(LocalDate date) {
        Map<String, SlotCounter> day = counters.get(date);
        Map<String, SlotAvailability> result = new LinkedHashMap<>();
        for (String slot : settings.getTimeSlots()) {
            SlotCounter c = day == null ? null : day.get(slot);
            int remaining = c == null ? settings.getCapacityPerSlot() : c.remaining();
            result.put(slot, new SlotAvailability(remaining, settings.getCapacityPerSlot()));
        }
        return result;
    }

    /**
     * Reservation ids currently counted against the slot.
     */
    public List<String> occupants(LocalDate date, String slot) {
        Map<String, SlotCounter> day = counters.get(date);
        SlotCounter c = day == null ? null : day.get(slot);
        return c == null ? List.of() : c.occupants();
    }

    /**
     * Re-checks every materialised counter.
     *
     * @throws LedgerCorruptionException on the first inconsistent counter
     */
    public void verifyAll() {
        counters.values().forEach(day -> day.values().forEach(SlotCounter::verify));
    }

    private SlotCounter counter(LocalDate date, String slot) {
        settings.slotIndex(slot);
        return day(date).get(slot);
    }

    private Map<String, SlotCounter> day(LocalDate date) {
        if (date == null) {
            throw new IllegalArgumentException("date is required");
        }
        return counters.computeIfAbsent(date, this::newDay);
    }

    private Map<String, SlotCounter> newDay(LocalDate date) {
        Map<String, SlotCounter> day = new LinkedHashMap<>();
        List<String> slots = settings.getTimeSlots();
        for (int i = 0; i < slots.size(); i++) {
            day.put(slots.get(i), new SlotCounter(date, slots.get(i), i, settings.getCapacityPerSlot()));
        }
        log.debug("Materialised {} slots for {}", slots.size(), date);
        return Collections.unmodifiableMap(day);
    }
}
