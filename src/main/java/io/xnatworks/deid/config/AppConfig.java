/*
 * DICOM De-identifier
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.deid.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.xnatworks.deid.anon.GroupingMode;
import io.xnatworks.deid.linklog.SqliteLinkLog;
import io.xnatworks.deid.tracking.SpaceGuard;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration of a de-identification run. Loaded from YAML; any value can be
 * overridden on the command line.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class AppConfig {
    private static final Logger log = LoggerFactory.getLogger(AppConfig.class);

    private static final double BYTES_PER_GB = 1_000_000_000d;

    /**
     * Directory tree holding the source records.
     */
    @JsonProperty("input_directory")
    private String inputDirectory;

    /**
     * Directory the de-identified records are written to.
     */
    @JsonProperty("output_directory")
    private String outputDirectory = "./anondata";

    /**
     * Link log directory. Must be the same for every run over the same dataset.
     */
    @JsonProperty("link_log_directory")
    private String linkLogDirectory = "./linklog";

    /**
     * Space available for output, in GB (10^9 bytes).
     */
    @JsonProperty("space_gb")
    private double spaceGb;

    /**
     * Output layout: study, patient or none.
     */
    private String grouping = "study";

    /**
     * Worker threads; 0 means one per available processor.
     */
    @JsonProperty("worker_count")
    private int workerCount = 0;

    /**
     * Free space always left untouched on the output file store.
     */
    @JsonProperty("min_free_bytes")
    private long minFreeBytes = SpaceGuard.DEFAULT_MIN_FREE_BYTES;

    /**
     * Prefix of newly allocated synthetic patient identifiers.
     */
    @JsonProperty("id_prefix")
    private String idPrefix = SqliteLinkLog.DEFAULT_ID_PREFIX;

    /**
     * Log a progress line every this many files.
     */
    @JsonProperty("progress_interval")
    private int progressInterval = 100;

    public static AppConfig load(File configFile) throws IOException {
        log.info("Loading configuration from: {}", configFile.getAbsolutePath());
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        return mapper.readValue(configFile, AppConfig.class);
    }

    public static AppConfig load(String configPath) throws IOException {
        return load(new File(configPath));
    }

    /**
     * Check the settings a run needs.
     *
     * @return problems found, empty if the configuration is usable
     */
    public List<String> validate() {
        List<String> errors = new ArrayList<>();
        if (inputDirectory == null || inputDirectory.isBlank()) {
            errors.add("input_directory is required");
        }
        if (outputDirectory == null || outputDirectory.isBlank()) {
            errors.add("output_directory is required");
        }
        if (linkLogDirectory == null || linkLogDirectory.isBlank()) {
            errors.add("link_log_directory is required");
        }
        if (spaceGb <= 0) {
            errors.add("space_gb must be greater than 0");
        }
        if (workerCount < 0) {
            errors.add("worker_count must not be negative");
        }
        if (minFreeBytes < 0) {
            errors.add("min_free_bytes must not be negative");
        }
        if (progressInterval <= 0) {
            errors.add("progress_interval must be greater than 0");
        }
        if (idPrefix == null || !idPrefix.matches("[A-Za-z0-9]{1,8}")) {
            errors.add("id_prefix must be 1-8 letters or digits");
        }
        try {
            GroupingMode.parse(grouping);
        } catch (IllegalArgumentException e) {
            errors.add(e.getMessage());
        }
        return errors;
    }

    @JsonIgnore
    public long getSpaceBudgetBytes() {
        return (long) (spaceGb * BYTES_PER_GB);
    }

    @JsonIgnore
    public GroupingMode getGroupingMode() {
        return GroupingMode.parse(grouping);
    }

    @JsonIgnore
    public int getEffectiveWorkerCount() {
        return workerCount > 0 ? workerCount : Runtime.getRuntime().availableProcessors();
    }

    public String getInputDirectory() { return inputDirectory; }
    public void setInputDirectory(String inputDirectory) { this.inputDirectory = inputDirectory; }

    public String getOutputDirectory() { return outputDirectory; }
    public void setOutputDirectory(String outputDirectory) { this.outputDirectory = outputDirectory; }

    public String getLinkLogDirectory() { return linkLogDirectory; }
    public void setLinkLogDirectory(String linkLogDirectory) { this.linkLogDirectory = linkLogDirectory; }

    public double getSpaceGb() { return spaceGb; }
    public void setSpaceGb(double spaceGb) { this.spaceGb = spaceGb; }

    public String getGrouping() { return grouping; }
    public void setGrouping(String grouping) { this.grouping = grouping; }

    public int getWorkerCount() { return workerCount; }
    public void setWorkerCount(int workerCount) { this.workerCount = workerCount; }

    public long getMinFreeBytes() { return minFreeBytes; }
    public void setMinFreeBytes(long minFreeBytes) { this.minFreeBytes = minFreeBytes; }

    public String getIdPrefix() { return idPrefix; }
    public void setIdPrefix(String idPrefix) { this.idPrefix = idPrefix; }

    public int getProgressInterval() { return progressInterval; }
    public void setProgressInterval(int progressInterval) { this.progressInterval = progressInterval; }
}
