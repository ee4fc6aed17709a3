/*
 * DICOM De-identifier
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.deid.tracking;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Counters and outcome of one batch run. Counters are updated concurrently by the
 * workers; state and timestamps are set by the dispatcher.
 */
@JsonPropertyOrder({"state", "halt_reason", "total_files", "processed", "skipped_existing",
        "skipped_missing_identifier", "skipped_unreadable", "failed", "remaining",
        "consumed_bytes", "limit_bytes", "started_at", "finished_at"})
public class RunSummary {

    private final AtomicLong processed = new AtomicLong();
    private final AtomicLong skippedExisting = new AtomicLong();
    private final AtomicLong skippedMissingIdentifier = new AtomicLong();
    private final AtomicLong skippedUnreadable = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();

    private volatile RunState state;
    private volatile String haltReason;
    private volatile long totalFiles;
    private volatile long remaining;
    private volatile long consumedBytes;
    private volatile long limitBytes;
    private volatile Instant startedAt = Instant.now();
    private volatile Instant finishedAt;

    public void recordProcessed() { processed.incrementAndGet(); }

    public void recordSkippedExisting() { skippedExisting.incrementAndGet(); }

    public void recordSkippedMissingIdentifier() { skippedMissingIdentifier.incrementAndGet(); }

    public void recordSkippedUnreadable() { skippedUnreadable.incrementAndGet(); }

    public void recordFailed() { failed.incrementAndGet(); }

    /**
     * Files that were handled in some way (written, skipped or failed).
     */
    @JsonIgnore
    public long getHandled() {
        return processed.get() + getSkipped() + failed.get();
    }

    @JsonIgnore
    public long getSkipped() {
        return skippedExisting.get() + skippedMissingIdentifier.get() + skippedUnreadable.get();
    }

    @JsonProperty("state")
    public RunState getState() { return state; }
    public void setState(RunState state) { this.state = state; }

    @JsonProperty("halt_reason")
    public String getHaltReason() { return haltReason; }
    public void setHaltReason(String haltReason) { this.haltReason = haltReason; }

    @JsonProperty("total_files")
    public long getTotalFiles() { return totalFiles; }
    public void setTotalFiles(long totalFiles) { this.totalFiles = totalFiles; }

    @JsonProperty("processed")
    public long getProcessed() { return processed.get(); }

    @JsonProperty("skipped_existing")
    public long getSkippedExisting() { return skippedExisting.get(); }

    @JsonProperty("skipped_missing_identifier")
    public long getSkippedMissingIdentifier() { return skippedMissingIdentifier.get(); }

    @JsonProperty("skipped_unreadable")
    public long getSkippedUnreadable() { return skippedUnreadable.get(); }

    @JsonProperty("failed")
    public long getFailed() { return failed.get(); }

    @JsonProperty("remaining")
    public long getRemaining() { return remaining; }
    public void setRemaining(long remaining) { this.remaining = remaining; }

    @JsonProperty("consumed_bytes")
    public long getConsumedBytes() { return consumedBytes; }
    public void setConsumedBytes(long consumedBytes) { this.consumedBytes = consumedBytes; }

    @JsonProperty("limit_bytes")
    public long getLimitBytes() { return limitBytes; }
    public void setLimitBytes(long limitBytes) { this.limitBytes = limitBytes; }

    @JsonProperty("started_at")
    public String getStartedAt() { return startedAt != null ? startedAt.toString() : null; }

    @JsonProperty("finished_at")
    public String getFinishedAt() { return finishedAt != null ? finishedAt.toString() : null; }

    public void markFinished() { this.finishedAt = Instant.now(); }

    @JsonIgnore
    public Duration getDuration() {
        Instant end = finishedAt != null ? finishedAt : Instant.now();
        return Duration.between(startedAt, end);
    }

    /**
     * Write this summary as JSON.
     */
    public void writeTo(Path file) throws IOException {
        ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
        Files.createDirectories(file.toAbsolutePath().getParent());
        mapper.writeValue(file.toFile(), this);
    }

    /**
     * Multi-line human readable report.
     */
    public String format() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("State:                 %s%n", state));
        if (haltReason != null) {
            sb.append(String.format("Reason:                %s%n", haltReason));
        }
        sb.append(String.format("Files found:           %d%n", totalFiles));
        sb.append(String.format("Processed:             %d%n", getProcessed()));
        sb.append(String.format("Skipped (existing):    %d%n", getSkippedExisting()));
        sb.append(String.format("Skipped (no patient):  %d%n", getSkippedMissingIdentifier()));
        sb.append(String.format("Skipped (unreadable):  %d%n", getSkippedUnreadable()));
        sb.append(String.format("Failed:                %d%n", getFailed()));
        sb.append(String.format("Remaining:             %d%n", remaining));
        sb.append(String.format("Bytes written:         %d of %d%n", consumedBytes, limitBytes));
        sb.append(String.format("Duration:              %.1f s%n", getDuration().toMillis() / 1000.0));
        return sb.toString();
    }
}
