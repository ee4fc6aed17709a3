/*
 * DICOM De-identifier
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.deid.tracking;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileStore;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Admission control against an output space budget.
 *
 * <p>A write is admitted by reserving its conservative size estimate. Reserved and
 * consumed bytes together never exceed the limit. The first rejected admission
 * latches the guard into the halted state and every later admission is rejected
 * too, so the batch stops taking new work while in-flight writes finish. A write
 * that settles above its reservation and pushes usage past the limit latches the
 * halted state the same way.</p>
 */
public class SpaceGuard {
    private static final Logger log = LoggerFactory.getLogger(SpaceGuard.class);

    public static final long DEFAULT_MIN_FREE_BYTES = 50L * 1000 * 1000;
    static final double SAFETY_FACTOR = 1.10;
    static final long BLOCK_SIZE = 4096;

    private final long limitBytes;
    private final AtomicLong usedBytes = new AtomicLong();
    private final AtomicLong consumedBytes = new AtomicLong();
    private final AtomicBoolean halted = new AtomicBoolean();
    private volatile String haltReason;

    public SpaceGuard(long limitBytes) {
        if (limitBytes < 0) {
            throw new IllegalArgumentException("Space limit must not be negative: " + limitBytes);
        }
        this.limitBytes = limitBytes;
    }

    /**
     * Build a guard for an output directory. The limit is the configured budget or
     * the usable space of the directory's file store less {@code minFreeBytes},
     * whichever is smaller.
     */
    public static SpaceGuard forOutputDirectory(Path outputDir, long budgetBytes, long minFreeBytes) throws IOException {
        FileStore store = Files.getFileStore(outputDir);
        long available = Math.max(0, store.getUsableSpace() - minFreeBytes);
        long limit = Math.min(budgetBytes, available);
        if (limit < budgetBytes) {
            log.warn("Output file store has {} usable bytes; limiting budget from {} to {} bytes",
                    store.getUsableSpace(), budgetBytes, limit);
        }
        log.info("Space budget for {}: {} bytes", outputDir, limit);
        return new SpaceGuard(limit);
    }

    /**
     * Inflate a codec size estimate by the safety factor and round up to whole blocks.
     */
    public static long conservativeEstimate(long estimatedBytes) {
        long inflated = (long) Math.ceil(Math.max(0, estimatedBytes) * SAFETY_FACTOR);
        long blocks = (inflated + BLOCK_SIZE - 1) / BLOCK_SIZE;
        return Math.max(1, blocks) * BLOCK_SIZE;
    }

    /**
     * Try to admit a write of the given estimated size.
     *
     * @return a reservation to settle or release, or empty if the budget is exhausted
     */
    public Optional<Reservation> tryAdmit(long estimatedBytes) {
        long bytes = conservativeEstimate(estimatedBytes);
        while (!halted.get()) {
            long used = usedBytes.get();
            if (used + bytes > limitBytes) {
                halt(String.format("space budget exhausted: %d of %d bytes used, next record needs %d",
                        used, limitBytes, bytes));
                break;
            }
            if (usedBytes.compareAndSet(used, used + bytes)) {
                return Optional.of(new Reservation(bytes));
            }
        }
        return Optional.empty();
    }

    /**
     * Replace a reservation with the bytes actually written.
     */
    public void settle(Reservation reservation, long actualBytes) {
        if (!reservation.close()) {
            return;
        }
        if (actualBytes > reservation.getBytes()) {
            log.warn("Write of {} bytes exceeded its reservation of {} bytes", actualBytes, reservation.getBytes());
        }
        long used = usedBytes.addAndGet(actualBytes - reservation.getBytes());
        consumedBytes.addAndGet(actualBytes);
        if (used > limitBytes) {
            halt(String.format("space budget overrun: %d of %d bytes used after a write of %d bytes",
                    used, limitBytes, actualBytes));
        }
    }

    /**
     * Return a reservation whose write did not happen.
     */
    public void release(Reservation reservation) {
        if (reservation.close()) {
            usedBytes.addAndGet(-reservation.getBytes());
        }
    }

    private void halt(String reason) {
        if (halted.compareAndSet(false, true)) {
            haltReason = reason;
            log.warn("Halting admission: {}", reason);
        }
    }

    public boolean isHalted() {
        return halted.get();
    }

    public String getHaltReason() {
        return haltReason;
    }

    public long getLimitBytes() {
        return limitBytes;
    }

    public long getConsumedBytes() {
        return consumedBytes.get();
    }

    public long getRemainingBytes() {
        return Math.max(0, limitBytes - usedBytes.get());
    }

    /**
     * Bytes set aside for one admitted write.
     */
    public static final class Reservation {
        private final long bytes;
        private final AtomicBoolean open = new AtomicBoolean(true);

        private Reservation(long bytes) {
            this.bytes = bytes;
        }

        public long getBytes() {
            return bytes;
        }

        private boolean close() {
            return open.compareAndSet(true, false);
        }
    }
}
