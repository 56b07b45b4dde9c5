package com.ai.reservation.service;

import com.ai.reservation.TestFixtures;
import com.ai.reservation.dto.SlotAvailability;
import com.ai.reservation.exception.ConfigurationException;
import com.ai.reservation.exception.LedgerCorruptionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static com.ai.reservation.TestFixtures.FRIDAY;
import static com.ai.reservation.TestFixtures.SATURDAY;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("SlotLedger")
class SlotLedgerTest {

    private SlotLedger ledger;

    @BeforeEach
    void setUp() {
        ledger = new SlotLedger(TestFixtures.settings(3));
    }

    @Test
    @DisplayName("an unseen date reports full capacity on every slot")
    void unseenDateHasFullCapacity() {
        // when
        Map<String, SlotAvailability> availability = ledger.availability(FRIDAY);

        // then
        assertThat(availability).containsOnlyKeys(TestFixtures.SLOTS);
        assertThat(availability.values()).allSatisfy(a -> {
            assertThat(a.available()).isEqualTo(3);
            assertThat(a.total()).isEqualTo(3);
        });
        assertThat(ledger.check(FRIDAY, "19:00").remaining()).isEqualTo(3);
        assertThat(ledger.openSlots(FRIDAY)).containsExactlyElementsOf(TestFixtures.SLOTS);
    }

    @Test
    @DisplayName("booking stops at capacity and the full slot drops out of the open slots")
    void bookingStopsAtCapacity() {
        // given
        assertThat(ledger.book(FRIDAY, "19:00", "100001")).isTrue();
        assertThat(ledger.book(FRIDAY, "19:00", "100002")).isTrue();
        assertThat(ledger.book(FRIDAY, "19:00", "100003")).isTrue();

        // when
        boolean fourth = ledger.book(FRIDAY, "19:00", "100004");

        // then
        assertThat(fourth).isFalse();
        assertThat(ledger.check(FRIDAY, "19:00").available()).isFalse();
        assertThat(ledger.check(FRIDAY, "19:00").remaining()).isZero();
        assertThat(ledger.occupants(FRIDAY, "19:00")).containsExactly("100001", "100002", "100003");
        assertThat(ledger.openSlots(FRIDAY)).containsExactly("17:00", "18:00", "20:00", "21:00");
        assertThat(ledger.availability(FRIDAY).get("19:00").available()).isZero();
    }

    @Test
    @DisplayName("the same reservation is not counted twice in one slot")
    void duplicateBookingIsRefused() {
        ledger.book(FRIDAY, "18:00", "100001");

        assertThat(ledger.book(FRIDAY, "18:00", "100001")).isFalse();
        assertThat(ledger.check(FRIDAY, "18:00").remaining()).isEqualTo(2);
    }

    @Test
    @DisplayName("release is idempotent and ignores unknown ids")
    void releaseIsIdempotent() {
        // given
        ledger.book(FRIDAY, "18:00", "100001");

        // when
        ledger.release(FRIDAY, "18:00", "100001");
        ledger.release(FRIDAY, "18:00", "100001");
        ledger.release(FRIDAY, "18:00", "999999");
        ledger.release(SATURDAY, "18:00", "100001");

        // then
        assertThat(ledger.check(FRIDAY, "18:00").remaining()).isEqualTo(3);
        assertThat(ledger.occupants(FRIDAY, "18:00")).isEmpty();
        ledger.verifyAll();
    }

    @Test
    @DisplayName("an unknown slot label is a configuration error")
    void unknownSlotIsRejected() {
        assertThatThrownBy(() -> ledger.check(FRIDAY, "16:30"))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("16:30");
        assertThatThrownBy(() -> ledger.book(FRIDAY, "7pm", "100001"))
                .isInstanceOf(ConfigurationException.class);
    }

    @Test
    @DisplayName("move releases the source and books the destination in one step")
    void moveTransfersOccupancy() {
        // given
        ledger.book(FRIDAY, "18:00", "100001");

        // when
        boolean moved = ledger.move(FRIDAY, "18:00", SATURDAY, "20:00", "100001");

        // then
        assertThat(moved).isTrue();
        assertThat(ledger.occupants(FRIDAY, "18:00")).isEmpty();
        assertThat(ledger.occupants(SATURDAY, "20:00")).containsExactly("100001");
        ledger.verifyAll();
    }

    @Test
    @DisplayName("move to a full slot changes nothing")
    void moveToFullSlotIsRefused() {
        // given
        ledger.book(FRIDAY, "18:00", "100001");
        ledger.book(FRIDAY, "19:00", "100002");
        ledger.book(FRIDAY, "19:00", "100003");
        ledger.book(FRIDAY, "19:00", "100004");

        // when
        boolean moved = ledger.move(FRIDAY, "18:00", FRIDAY, "19:00", "100001");

        // then
        assertThat(moved).isFalse();
        assertThat(ledger.occupants(FRIDAY, "18:00")).containsExactly("100001");
        assertThat(ledger.occupants(FRIDAY, "19:00")).containsExactly("100002", "100003", "100004");
    }

    @Test
    @DisplayName("move of a reservation the source does not hold is reported as corruption")
    void moveOfForeignReservationFails() {
        assertThatThrownBy(() -> ledger.move(FRIDAY, "18:00", FRIDAY, "19:00", "100001"))
                .isInstanceOf(LedgerCorruptionException.class);
        assertThat(ledger.occupants(FRIDAY, "19:00")).isEmpty();
    }

    @Test
    @DisplayName("concurrent bookings never exceed capacity")
    void concurrentBookingsRespectCapacity() throws InterruptedException {
        // given
        int threadCount = 32;
        ExecutorService executor = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threadCount);
        AtomicInteger successCount = new AtomicInteger();

        // when
        for (int i = 0; i < threadCount; i++) {
            String id = String.valueOf(200000 + i);
            executor.submit(() -> {
                try {
                    start.await();
                    if (ledger.book(FRIDAY, "20:00", id)) {
                        successCount.incrementAndGet();
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    done.countDown();
                }
            });
        }
        start.countDown();
        assertThat(done.await(10, TimeUnit.SECONDS)).isTrue();
        executor.shutdown();

        // then
        assertThat(successCount.get()).isEqualTo(3);
        assertThat(ledger.occupants(FRIDAY, "20:00")).hasSize(3);
        ledger.verifyAll();
    }

    @Test
    @DisplayName("opposite concurrent moves between two slots do not deadlock")
    void crossingMovesDoNotDeadlock() throws InterruptedException {
        // given
        ledger = new SlotLedger(TestFixtures.settings(50));
        for (int i = 0; i < 20; i++) {
            ledger.book(FRIDAY, "17:00", "A" + i);
            ledger.book(FRIDAY, "21:00", "B" + i);
        }
        ExecutorService executor = Executors.newFixedThreadPool(4);
        CountDownLatch done = new CountDownLatch(40);

        // when
        for (int i = 0; i < 20; i++) {
            String a = "A" + i;
            String b = "B" + i;
            executor.submit(() -> {
                try {
                    ledger.move(FRIDAY, "17:00", FRIDAY, "21:00", a);
                } finally {
                    done.countDown();
                }
            });
            executor.submit(() -> {
                try {
                    ledger.move(FRIDAY, "21:00", FRIDAY, "17:00", b);
                } finally {
                    done.countDown();
                }
            });
        }

        // then
        assertThat(done.await(10, TimeUnit.SECONDS)).isTrue();
        executor.shutdown();
        assertThat(ledger.occupants(FRIDAY, "17:00")).hasSize(20).allMatch(id -> id.startsWith("B"));
        assertThat(ledger.occupants(FRIDAY, "21:00")).hasSize(20).allMatch(id -> id.startsWith("A"));
        ledger.verifyAll();
    }

    @Test
    @DisplayName("a move and a booking racing for the last seat never both win")
    void moveRacesBookingForLastSeat() throws InterruptedException {
        ExecutorService executor = Executors.newFixedThreadPool(2);
        for (int round = 0; round < 200; round++) {
            // given: one seat left at 19:00, the mover holds a seat at 18:00
            ledger = new SlotLedger(TestFixtures.settings(3));
            ledger.book(FRIDAY, "19:00", "100001");
            ledger.book(FRIDAY, "19:00", "100002");
            ledger.book(FRIDAY, "18:00", "MOVER");
            CountDownLatch start = new CountDownLatch(1);
            CountDownLatch done = new CountDownLatch(2);
            AtomicInteger moved = new AtomicInteger();
            AtomicInteger booked = new AtomicInteger();

            // when
            executor.submit(() -> {
                try {
                    start.await();
                    if (ledger.move(FRIDAY, "18:00", FRIDAY, "19:00", "MOVER")) {
                        moved.incrementAndGet();
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    done.countDown();
                }
            });
            executor.submit(() -> {
                try {
                    start.await();
                    if (ledger.book(FRIDAY, "19:00", "BOOKER")) {
                        booked.incrementAndGet();
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    done.countDown();
                }
            });
            start.countDown();
            assertThat(done.await(10, TimeUnit.SECONDS)).isTrue();

            // then
            assertThat(moved.get() + booked.get()).isEqualTo(1);
            assertThat(ledger.occupants(FRIDAY, "19:00")).hasSize(3);
            if (moved.get() == 1) {
                assertThat(ledger.occupants(FRIDAY, "19:00")).contains("MOVER").doesNotContain("BOOKER");
                assertThat(ledger.occupants(FRIDAY, "18:00")).isEmpty();
            } else {
                assertThat(ledger.occupants(FRIDAY, "19:00")).contains("BOOKER");
                assertThat(ledger.occupants(FRIDAY, "18:00")).containsExactly("MOVER");
            }
            ledger.verifyAll();
        }
        executor.shutdown();
    }
}
