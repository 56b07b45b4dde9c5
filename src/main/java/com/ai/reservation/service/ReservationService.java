package com.ai.reservation.service;

import com.ai.reservation.config.RestaurantSettings;
import com.ai.reservation.dto.ReservationChanges;
import com.ai.reservation.entity.Reservation;
import com.ai.reservation.entity.ReservationDraft;
import com.ai.reservation.exception.ConfigurationException;
import com.ai.reservation.exception.ReservationNotFoundException;
import com.ai.reservation.exception.SlotUnavailableException;
import com.ai.reservation.exception.ValidationException;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Canonical reservation records, keyed by confirmation number.
 * <p>
 * Records are never removed; cancellation is a status change. Each record is
 * its own lock for modify and cancel, and callers only ever get copies.
 */
@Service
public class ReservationService {

    private static final Logger log = LoggerFactory.getLogger(ReservationService.class);

    private final RestaurantSettings settings;
    private final SlotLedger slotLedger;
    private final ConfirmationNumberGenerator numberGenerator;
    private final Clock clock;

    private final Map<String, Reservation> reservations = new ConcurrentHashMap<>();
    /** Every confirmation number handed out, including ones whose booking then failed. */
    private final Set<String> issuedIds = ConcurrentHashMap.newKeySet();
    private final AtomicLong sequence = new AtomicLong();

    public ReservationService(RestaurantSettings settings, SlotLedger slotLedger,
                              ConfirmationNumberGenerator numberGenerator, Clock clock) {
        this.settings = settings;
        this.slotLedger = slotLedger;
        this.numberGenerator = numberGenerator;
        this.clock = clock;
    }

    // =========================================================
    // CONFIRM
    // =========================================================

    /**
     * Turns a complete draft into a confirmed reservation.
     *
     * @throws ValidationException       if required fields are missing or out of range
     * @throws ConfigurationException    if the time is not a configured slot, or no
     *                                   unique confirmation number could be drawn
     * @throws SlotUnavailableException  if the slot filled up since the caller last looked
     */
    public Reservation confirm(ReservationDraft draft) {
        validate(draft);
        LocalDate date = draft.getDate();
        String slot = draft.getTime();

        if (!slotLedger.check(date, slot).available()) {
            throw unavailable(date, slot);
        }
        String id = claimConfirmationId();
        if (!slotLedger.book(date, slot, id)) {
            issuedIds.remove(id);
            throw unavailable(date, slot);
        }

        Reservation reservation = Reservation.builder()
                .id(id)
                .name(draft.getName().trim())
                .partySize(draft.getPartySize())
                .date(date)
                .time(slot)
                .phone(draft.getPhone().trim())
                .specialRequests(StringUtils.defaultString(draft.getSpecialRequests()))
                .status(Reservation.Status.CONFIRMED)
                .createdAt(Instant.now(clock))
                .sequence(sequence.incrementAndGet())
                .build();
        reservations.put(id, reservation);

        log.info("Confirmed reservation {}: name={} party={} date={} time={}",
                id, reservation.getName(), reservation.getPartySize(), date, slot);
        return reservation.copy();
    }

    private void validate(ReservationDraft draft) {
        if (draft == null) {
            throw ValidationException.missing(new ReservationDraft().missingFields());
        }
        List<String> missing = draft.missingFields();
        if (!missing.isEmpty()) {
            throw ValidationException.missing(missing);
        }
        if (!settings.isValidPartySize(draft.getPartySize())) {
            throw ValidationException.invalid("party_size",
                    "Party size must be between 1 and " + settings.getMaxPartySize());
        }
        settings.slotIndex(draft.getTime());
    }

    private String claimConfirmationId() {
        int attempts = settings.getConfirmationIdAttempts();
        for (int i = 0; i < attempts; i++) {
            String candidate = numberGenerator.next();
            if (issuedIds.add(candidate)) {
                return candidate;
            }
            log.warn("Confirmation number collision on {} (attempt {}/{})", candidate, i + 1, attempts);
        }
        throw new ConfigurationException("No unique confirmation number after " + attempts + " attempts");
    }

    // =========================================================
    // MODIFY
    // =========================================================

    /**
     * Applies the changes to a confirmed reservation. A date or time change is
     * made through {@link SlotLedger#move}; if that fails the record is left
     * exactly as it was.
     *
     * @throws ReservationNotFoundException if the id is unknown or cancelled
     * @throws SlotUnavailableException     if the new slot is full
     */
    public Reservation modify(String reservationId, ReservationChanges changes) {
        Reservation reservation = reservations.get(reservationId);
        if (reservation == null) {
            throw new ReservationNotFoundException(reservationId);
        }
        synchronized (reservation) {
            if (!reservation.isConfirmed()) {
                throw new ReservationNotFoundException(reservationId);
            }
            Integer partySize = changes.getPartySize();
            if (partySize != null && !settings.isValidPartySize(partySize)) {
                throw ValidationException.invalid("party_size",
                        "Party size must be between 1 and " + settings.getMaxPartySize());
            }
            LocalDate newDate = changes.getDate() != null ? changes.getDate() : reservation.getDate();
            String newTime = changes.getTime() != null ? changes.getTime() : reservation.getTime();
            settings.slotIndex(newTime);

            if (!newDate.equals(reservation.getDate()) || !newTime.equals(reservation.getTime())) {
                if (!slotLedger.move(reservation.getDate(), reservation.getTime(), newDate, newTime, reservationId)) {
                    throw unavailable(newDate, newTime);
                }
                reservation.setDate(newDate);
                reservation.setTime(newTime);
            }
            if (partySize != null) {
                reservation.setPartySize(partySize);
            }
            if (changes.getSpecialRequests() != null) {
                reservation.setSpecialRequests(changes.getSpecialRequests());
            }
            log.info("Modified reservation {}: {}", reservationId, changes);
            return reservation.copy();
        }
    }

    // =========================================================
    // CANCEL
    // =========================================================

    /**
     * @throws ReservationNotFoundException if the id is unknown or already cancelled
     */
    public Reservation cancel(String reservationId) {
        Reservation reservation = reservations.get(reservationId);
        if (reservation == null) {
            throw new ReservationNotFoundException(reservationId);
        }
        synchronized (reservation) {
            if (!reservation.isConfirmed()) {
                throw new ReservationNotFoundException(reservationId);
            }
            reservation.setStatus(Reservation.Status.CANCELLED);
            slotLedger.release(reservation.getDate(), reservation.getTime(), reservationId);
            log.info("Cancelled reservation {} ({} {})", reservationId, reservation.getDate(), reservation.getTime());
            return reservation.copy();
        }
    }

    // =========================================================
    // QUERIES
    // =========================================================

    public Optional<Reservation> find(String reservationId) {
        Reservation reservation = reservationId == null ? null : reservations.get(reservationId);
        return Optional.ofNullable(reservation).map(ReservationService::snapshot);
    }

    /**
     * Confirmed reservations whose phone contains {@code phone} or whose name
     * contains {@code name} ignoring case, in the order they were made.
     *
     * @throws ValidationException if neither criterion is given
     */
    public List<Reservation> lookup(String phone, String name) {
        if (StringUtils.isBlank(phone) && StringUtils.isBlank(name)) {
            throw ValidationException.missing(List.of("phone", "name"));
        }
        return confirmedSnapshots().stream()
                .filter(r -> (StringUtils.isNotBlank(phone) && StringUtils.contains(r.getPhone(), phone.trim()))
                        || (StringUtils.isNotBlank(name) && StringUtils.containsIgnoreCase(r.getName(), name.trim())))
                .toList();
    }

    /**
     * Confirmed reservations grouped by date (ascending), each day sorted by slot.
     */
    public SortedMap<LocalDate, List<Reservation>> listByDate() {
        SortedMap<LocalDate, List<Reservation>> grouped = new TreeMap<>();
        for (Reservation r : confirmedSnapshots()) {
            grouped.computeIfAbsent(r.getDate(), d -> new ArrayList<>()).add(r);
        }
        Comparator<Reservation> bySlot = Comparator.comparingInt(r -> settings.slotIndex(r.getTime()));
        grouped.values().forEach(list -> list.sort(bySlot.thenComparingLong(Reservation::getSequence)));
        return grouped;
    }

    private List<Reservation> confirmedSnapshots() {
        return reservations.values().stream()
                .map(ReservationService::snapshot)
                .filter(Reservation::isConfirmed)
                .sorted(Comparator.comparingLong(Reservation::getSequence))
                .toList();
    }

    private static Reservation snapshot(Reservation reservation) {
        synchronized (reservation) {
            return reservation.copy();
        }
    }

    private SlotUnavailableException unavailable(LocalDate date, String slot) {
        log.warn("Slot {} on {} is fully booked", slot, date);
        return new SlotUnavailableException(date, slot, slotLedger.openSlots(date));
    }
}
