/*
 * DICOM De-identifier
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 */
package io.xnatworks.deid.tracking;

import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for SpaceGuard.
 */
@DisplayName("SpaceGuard Tests")
class SpaceGuardTest {

    @Nested
    @DisplayName("Estimate Tests")
    class EstimateTests {

        @Test
        @DisplayName("Should round inflated estimates up to whole blocks")
        void shouldRoundUpToBlocks() {
            assertEquals(4096, SpaceGuard.conservativeEstimate(0));
            assertEquals(4096, SpaceGuard.conservativeEstimate(1000));
            assertEquals(8192, SpaceGuard.conservativeEstimate(4096));
            assertEquals(4096, SpaceGuard.conservativeEstimate(3723));
            assertEquals(8192, SpaceGuard.conservativeEstimate(3724));
        }

        @Test
        @DisplayName("Should never estimate below the codec estimate")
        void shouldNeverUnderestimate() {
            for (long size = 1; size < 100_000; size += 777) {
                assertTrue(SpaceGuard.conservativeEstimate(size) >= size);
            }
        }
    }

    @Nested
    @DisplayName("Admission Tests")
    class AdmissionTests {

        @Test
        @DisplayName("Should admit while within the limit")
        void shouldAdmitWithinLimit() {
            SpaceGuard guard = new SpaceGuard(3 * 4096);

            Optional<SpaceGuard.Reservation> first = guard.tryAdmit(100);
            Optional<SpaceGuard.Reservation> second = guard.tryAdmit(100);

            assertTrue(first.isPresent());
            assertTrue(second.isPresent());
            assertEquals(4096, guard.getRemainingBytes());
            assertFalse(guard.isHalted());
        }

        @Test
        @DisplayName("Should halt on the first rejected admission and stay halted")
        void shouldLatchHalt() {
            SpaceGuard guard = new SpaceGuard(4096);

            assertTrue(guard.tryAdmit(100).isPresent());
            assertTrue(guard.tryAdmit(100).isEmpty());
            assertTrue(guard.isHalted());
            assertNotNull(guard.getHaltReason());

            assertTrue(guard.tryAdmit(1).isEmpty());
        }

        @Test
        @DisplayName("Should return released space to the budget")
        void shouldReleaseSpace() {
            SpaceGuard guard = new SpaceGuard(4096);

            SpaceGuard.Reservation reservation = guard.tryAdmit(100).orElseThrow();
            guard.release(reservation);

            assertEquals(4096, guard.getRemainingBytes());
            assertEquals(0, guard.getConsumedBytes());
            assertTrue(guard.tryAdmit(100).isPresent());
        }

        @Test
        @DisplayName("Should settle reservations to the bytes written")
        void shouldSettleToActualBytes() {
            SpaceGuard guard = new SpaceGuard(10 * 4096);

            SpaceGuard.Reservation reservation = guard.tryAdmit(1000).orElseThrow();
            guard.settle(reservation, 1000);

            assertEquals(1000, guard.getConsumedBytes());
            assertEquals(10 * 4096 - 1000, guard.getRemainingBytes());
        }

        @Test
        @DisplayName("Should ignore a second settle of the same reservation")
        void shouldSettleOnce() {
            SpaceGuard guard = new SpaceGuard(10 * 4096);

            SpaceGuard.Reservation reservation = guard.tryAdmit(1000).orElseThrow();
            guard.settle(reservation, 1000);
            guard.settle(reservation, 1000);
            guard.release(reservation);

            assertEquals(1000, guard.getConsumedBytes());
        }

        @Test
        @DisplayName("Should halt when a write settles past the limit")
        void shouldHaltOnOverrun() {
            SpaceGuard guard = new SpaceGuard(2 * 4096);

            SpaceGuard.Reservation reservation = guard.tryAdmit(100).orElseThrow();
            guard.settle(reservation, 3 * 4096);

            assertTrue(guard.isHalted());
            assertTrue(guard.getHaltReason().contains("overrun"));
            assertEquals(0, guard.getRemainingBytes());
            assertTrue(guard.tryAdmit(1).isEmpty());
        }

        @Test
        @DisplayName("Should keep admitting after a write larger than its reservation but within the limit")
        void shouldAdmitAfterLargeWriteWithinLimit() {
            SpaceGuard guard = new SpaceGuard(4 * 4096);

            SpaceGuard.Reservation reservation = guard.tryAdmit(100).orElseThrow();
            guard.settle(reservation, 2 * 4096);

            assertFalse(guard.isHalted());
            assertTrue(guard.tryAdmit(100).isPresent());
        }

        @Test
        @DisplayName("Should reject a zero limit")
        void shouldRejectZeroLimit() {
            SpaceGuard guard = new SpaceGuard(0);

            assertTrue(guard.tryAdmit(1).isEmpty());
            assertTrue(guard.isHalted());
        }

        @Test
        @DisplayName("Should reject a negative limit")
        void shouldRejectNegativeLimit() {
            assertThrows(IllegalArgumentException.class, () -> new SpaceGuard(-1));
        }
    }

    @Nested
    @DisplayName("Concurrency Tests")
    class ConcurrencyTests {

        @Test
        @DisplayName("Should never admit more than the limit under contention")
        void shouldHoldLimitUnderContention() throws Exception {
            long limit = 50 * 4096;
            SpaceGuard guard = new SpaceGuard(limit);
            AtomicInteger admitted = new AtomicInteger();
            CountDownLatch start = new CountDownLatch(1);
            ExecutorService executor = Executors.newFixedThreadPool(8);
            List<Future<?>> futures = new ArrayList<>();

            for (int t = 0; t < 8; t++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    for (int i = 0; i < 20; i++) {
                        Optional<SpaceGuard.Reservation> reservation = guard.tryAdmit(3000);
                        if (reservation.isPresent()) {
                            admitted.incrementAndGet();
                            guard.settle(reservation.get(), 3000);
                        }
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
            executor.shutdown();

            assertTrue(guard.isHalted());
            assertTrue(guard.getConsumedBytes() <= limit);
            assertTrue(admitted.get() >= 50);
            assertEquals(admitted.get() * 3000L, guard.getConsumedBytes());
        }
    }

    @Nested
    @DisplayName("File Store Tests")
    class FileStoreTests {

        @TempDir
        Path tempDir;

        @Test
        @DisplayName("Should cap the budget at usable space less the free floor")
        void shouldCapBudget() throws Exception {
            SpaceGuard guard = SpaceGuard.forOutputDirectory(tempDir, Long.MAX_VALUE, 0);

            assertTrue(guard.getLimitBytes() < Long.MAX_VALUE);
            assertTrue(guard.getLimitBytes() > 0);
        }

        @Test
        @DisplayName("Should keep a budget smaller than usable space")
        void shouldKeepSmallBudget() throws Exception {
            SpaceGuard guard = SpaceGuard.forOutputDirectory(tempDir, 4096, 0);

            assertEquals(4096, guard.getLimitBytes());
        }
    }
}
