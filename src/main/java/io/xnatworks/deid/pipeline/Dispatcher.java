/*
 * DICOM De-identifier
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.deid.pipeline;

import io.xnatworks.deid.anon.FieldTransformer;
import io.xnatworks.deid.anon.OutputNamer;
import io.xnatworks.deid.anon.TransformedRecord;
import io.xnatworks.deid.broker.IdentityBundle;
import io.xnatworks.deid.broker.IdentityKey;
import io.xnatworks.deid.broker.IdentityResolver;
import io.xnatworks.deid.broker.MissingIdentifierException;
import io.xnatworks.deid.dicom.InputScanner;
import io.xnatworks.deid.dicom.RecordSource;
import io.xnatworks.deid.dicom.RecordTags;
import io.xnatworks.deid.dicom.UnreadableRecordException;
import io.xnatworks.deid.linklog.LinkLog;
import io.xnatworks.deid.linklog.LinkLogException;
import io.xnatworks.deid.tracking.RunState;
import io.xnatworks.deid.tracking.RunSummary;
import io.xnatworks.deid.tracking.SpaceGuard;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.TreeSet;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs one batch over an input directory.
 *
 * <p>The batch runs in three phases so that the identifiers handed out never
 * depend on the number of workers or the order in which they finish:</p>
 * <ol>
 *   <li>Scan: workers read every record and compute its identity key.</li>
 *   <li>Allocate: distinct keys are resolved against the link log one at a time,
 *       in sorted order.</li>
 *   <li>Write: workers transform each record, reserve space for it and write it.
 *       Identities are already allocated, so resolution is a cache hit.</li>
 * </ol>
 *
 * <p>The space guard halting or a link log failure stops workers from taking new
 * files. Writes already admitted are allowed to finish.</p>
 */
public class Dispatcher {
    private static final Logger log = LoggerFactory.getLogger(Dispatcher.class);

    public static final int DEFAULT_PROGRESS_INTERVAL = 100;

    private final RecordSource recordSource;
    private final LinkLog linkLog;
    private final IdentityResolver resolver;
    private final FieldTransformer transformer;
    private final OutputNamer namer;
    private final SpaceGuard spaceGuard;
    private final int workerCount;
    private int progressInterval = DEFAULT_PROGRESS_INTERVAL;

    private final AtomicReference<LinkLogException> fatal = new AtomicReference<>();

    public Dispatcher(RecordSource recordSource,
                      LinkLog linkLog,
                      IdentityResolver resolver,
                      FieldTransformer transformer,
                      OutputNamer namer,
                      SpaceGuard spaceGuard,
                      int workerCount) {
        if (workerCount < 1) {
            throw new IllegalArgumentException("Worker count must be at least 1: " + workerCount);
        }
        this.recordSource = recordSource;
        this.linkLog = linkLog;
        this.resolver = resolver;
        this.transformer = transformer;
        this.namer = namer;
        this.spaceGuard = spaceGuard;
        this.workerCount = workerCount;
    }

    public void setProgressInterval(int progressInterval) {
        this.progressInterval = Math.max(1, progressInterval);
    }

    /**
     * Process every record under {@code inputDir}.
     *
     * @throws IOException if the input directory cannot be enumerated
     */
    public RunSummary run(Path inputDir) throws IOException {
        RunSummary summary = new RunSummary();
        summary.setLimitBytes(spaceGuard.getLimitBytes());

        List<Path> files = new InputScanner(recordSource).scan(inputDir);
        summary.setTotalFiles(files.size());

        AtomicInteger threadCounter = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(workerCount, r -> {
            Thread t = new Thread(r, "deid-worker-" + threadCounter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        log.info("Processing {} files with {} workers", files.size(), workerCount);

        try {
            List<IdentityKey> keys = scanPhase(executor, files, summary);
            if (fatal.get() == null) {
                allocatePhase(keys);
            }
            if (fatal.get() == null) {
                writePhase(executor, files, keys, summary);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            fatal.compareAndSet(null, new LinkLogException("Batch interrupted"));
        } finally {
            executor.shutdownNow();
            try {
                executor.awaitTermination(30, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }

        finish(summary);
        return summary;
    }

    /**
     * Read every file and compute its identity key. Files that cannot be keyed are
     * counted as skipped or failed here and get a null key.
     */
    private List<IdentityKey> scanPhase(ExecutorService executor, List<Path> files, RunSummary summary)
            throws InterruptedException {
        log.info("Reading patient identifiers");
        List<Future<IdentityKey>> futures = new ArrayList<>(files.size());
        for (Path file : files) {
            futures.add(executor.submit(() -> scanOne(file, summary)));
        }

        List<IdentityKey> keys = new ArrayList<>(files.size());
        for (Future<IdentityKey> future : futures) {
            keys.add(await(future, summary));
        }
        return keys;
    }

    private IdentityKey scanOne(Path file, RunSummary summary) {
        try {
            RecordTags tags = recordSource.readTags(file);
            return resolver.identityKey(file, tags);
        } catch (UnreadableRecordException e) {
            log.warn("Skipping unreadable file {}: {}", file, e.getMessage());
            summary.recordSkippedUnreadable();
        } catch (MissingIdentifierException e) {
            log.warn("Skipping {}: no usable patient identifier", file);
            summary.recordSkippedMissingIdentifier();
        } catch (RuntimeException e) {
            log.error("Unexpected error reading {}: {}", file, e.getMessage(), e);
            summary.recordFailed();
        }
        return null;
    }

    /**
     * Resolve each distinct key in sorted order on the calling thread.
     */
    private void allocatePhase(List<IdentityKey> keys) {
        TreeSet<IdentityKey> distinct = new TreeSet<>();
        for (IdentityKey key : keys) {
            if (key != null) {
                distinct.add(key);
            }
        }
        log.info("Resolving {} distinct patient studies", distinct.size());
        try {
            for (IdentityKey key : distinct) {
                linkLog.resolve(key.getRealIdentifier(), key.getStudyKey());
            }
        } catch (LinkLogException e) {
            log.error("Link log failure while allocating identifiers: {}", e.getMessage(), e);
            fatal.compareAndSet(null, e);
        }
    }

    private void writePhase(ExecutorService executor, List<Path> files, List<IdentityKey> keys,
                            RunSummary summary) throws InterruptedException {
        long writable = keys.stream().filter(k -> k != null).count();
        log.info("Writing {} records", writable);

        ProgressTracker progress = new ProgressTracker(writable);
        List<Future<?>> futures = new ArrayList<>();
        for (int i = 0; i < files.size(); i++) {
            if (keys.get(i) == null) {
                continue;
            }
            Path file = files.get(i);
            futures.add(executor.submit(() -> {
                if (processOne(file, summary)) {
                    progress.increment();
                }
            }));
        }
        for (Future<?> future : futures) {
            await(future, summary);
        }
    }

    /**
     * Transform and write one record.
     *
     * @return true if the file was handled, false if it was left for a later run
     */
    private boolean processOne(Path file, RunSummary summary) {
        if (spaceGuard.isHalted() || fatal.get() != null) {
            return false;
        }

        try {
            RecordTags tags = recordSource.readTags(file);
            IdentityBundle identity = resolver.resolve(file, tags);
            TransformedRecord record = transformer.transform(file, tags, identity);
            Path target = namer.targetPath(record);

            if (Files.exists(target)) {
                skipExisting(file, target, identity, summary);
                return true;
            }

            Optional<SpaceGuard.Reservation> reservation =
                    spaceGuard.tryAdmit(recordSource.estimateSize(record.getAttributes()));
            if (!reservation.isPresent()) {
                return false;
            }

            SpaceGuard.Reservation slot = reservation.get();
            long written;
            try {
                written = recordSource.writeRecord(target, record.getAttributes());
                spaceGuard.settle(slot, written);
            } catch (FileAlreadyExistsException e) {
                skipExisting(file, target, identity, summary);
                return true;
            } catch (IOException e) {
                log.error("Failed to write {} for {}: {}", target, file, e.getMessage());
                summary.recordFailed();
                return true;
            } finally {
                // no-op once settled
                spaceGuard.release(slot);
            }
            linkLog.recordAdmission(identity.getStudyId(), identity.getSeriesKey());
            summary.recordProcessed();
            log.debug("Wrote {} ({} bytes)", target, written);
            return true;

        } catch (UnreadableRecordException e) {
            log.warn("Skipping unreadable file {}: {}", file, e.getMessage());
            summary.recordSkippedUnreadable();
            return true;
        } catch (MissingIdentifierException e) {
            log.warn("Skipping {}: no usable patient identifier", file);
            summary.recordSkippedMissingIdentifier();
            return true;
        } catch (LinkLogException e) {
            if (fatal.compareAndSet(null, e)) {
                log.error("Link log failure, stopping batch: {}", e.getMessage(), e);
            }
            return false;
        } catch (RuntimeException e) {
            log.error("Unexpected error processing {}: {}", file, e.getMessage(), e);
            summary.recordFailed();
            return true;
        }
    }

    /**
     * An output that already exists came from an earlier run. Its admission is
     * recorded again so a run that stopped between writing and logging is repaired.
     */
    private void skipExisting(Path file, Path target, IdentityBundle identity, RunSummary summary) {
        log.info("Skipping {}: output {} already exists", file, target.getFileName());
        linkLog.recordAdmission(identity.getStudyId(), identity.getSeriesKey());
        summary.recordSkippedExisting();
    }

    /**
     * Wait for one per-file task. A task that died without accounting for its file
     * is counted as failed so the file is never silently dropped.
     */
    private <T> T await(Future<T> future, RunSummary summary) throws InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException e) {
            log.error("Worker task failed: {}", e.getCause().getMessage(), e.getCause());
            summary.recordFailed();
            return null;
        }
    }

    private void finish(RunSummary summary) {
        summary.setConsumedBytes(spaceGuard.getConsumedBytes());
        summary.setRemaining(Math.max(0, summary.getTotalFiles() - summary.getHandled()));

        LinkLogException failure = fatal.get();
        if (failure != null) {
            summary.setState(RunState.FAILED_FATAL);
            summary.setHaltReason(failure.getMessage());
        } else if (spaceGuard.isHalted()) {
            summary.setState(RunState.HALTED_ON_SPACE);
            summary.setHaltReason(spaceGuard.getHaltReason());
        } else {
            if (summary.getRemaining() > 0) {
                log.warn("{} files were neither processed nor skipped", summary.getRemaining());
            }
            summary.setState(RunState.COMPLETED);
        }
        summary.markFinished();

        log.info("Batch {}: {} processed, {} skipped, {} failed, {} remaining",
                summary.getState(), summary.getProcessed(), summary.getSkipped(),
                summary.getFailed(), summary.getRemaining());
    }

    /**
     * Logs a progress line every {@code progressInterval} written files with an
     * estimate of the time left.
     */
    private class ProgressTracker {
        private final long total;
        private final long startNanos = System.nanoTime();
        private final AtomicLong done = new AtomicLong();

        ProgressTracker(long total) {
            this.total = total;
        }

        void increment() {
            long count = done.incrementAndGet();
            if (count % progressInterval != 0 && count != total) {
                return;
            }
            double percent = total == 0 ? 100.0 : count * 100.0 / total;
            double elapsedMinutes = (System.nanoTime() - startNanos) / 60_000_000_000.0;
            double remainingMinutes = elapsedMinutes / count * (total - count);
            log.info("Progress: {}/{} files ({}%), about {} min remaining",
                    count, total, String.format("%.1f", percent), String.format("%.1f", remainingMinutes));
        }
    }
}
