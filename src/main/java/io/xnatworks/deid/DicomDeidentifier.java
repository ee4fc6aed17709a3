/*
 * DICOM De-identifier
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.deid;

import io.xnatworks.deid.anon.FieldTransformer;
import io.xnatworks.deid.anon.OutputNamer;
import io.xnatworks.deid.broker.IdentityResolver;
import io.xnatworks.deid.config.AppConfig;
import io.xnatworks.deid.dicom.JsonRecordSource;
import io.xnatworks.deid.dicom.RecordSource;
import io.xnatworks.deid.linklog.LinkLogException;
import io.xnatworks.deid.linklog.LinkLogStats;
import io.xnatworks.deid.linklog.SqliteLinkLog;
import io.xnatworks.deid.pipeline.Dispatcher;
import io.xnatworks.deid.tracking.RunState;
import io.xnatworks.deid.tracking.RunSummary;
import io.xnatworks.deid.tracking.SpaceGuard;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.*;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * DICOM De-identifier - Main Application
 *
 * Batch tool that:
 * - Replaces patient identifiers with synthetic ones that stay stable across runs
 * - Keeps the real-to-synthetic mapping in a durable link log
 * - Writes de-identified records until the output space budget is used up
 *
 * Exit codes: 0 completed, 2 halted on space (rerun to resume), 1 failed.
 */
@Command(name = "deidentify",
        mixinStandardHelpOptions = true,
        version = "1.0.0",
        description = "DICOM De-identifier - Replace patient identity in image records",
        exitCodeOnInvalidInput = DicomDeidentifier.EXIT_FAILED,
        exitCodeOnExecutionException = DicomDeidentifier.EXIT_FAILED,
        subcommands = {
                DicomDeidentifier.RunCommand.class,
                DicomDeidentifier.VerifyCommand.class
        })
public class DicomDeidentifier implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(DicomDeidentifier.class);

    public static final int EXIT_COMPLETED = 0;
    public static final int EXIT_FAILED = 1;
    public static final int EXIT_HALTED = 2;

    public static final String LAST_RUN_FILE = "last-run.json";

    @Option(names = {"-c", "--config"}, scope = ScopeType.INHERIT, description = "Optional YAML config file")
    protected File configFile;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new DicomDeidentifier()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        CommandLine.usage(this, System.out);
        return EXIT_COMPLETED;
    }

    AppConfig loadConfig() throws IOException {
        if (configFile == null) {
            return new AppConfig();
        }
        return AppConfig.load(configFile);
    }

    static int exitCodeFor(RunState state) {
        switch (state) {
            case COMPLETED:
                return EXIT_COMPLETED;
            case HALTED_ON_SPACE:
                return EXIT_HALTED;
            case FAILED_FATAL:
            default:
                return EXIT_FAILED;
        }
    }

    // ========================================================================
    // RUN COMMAND - De-identify a directory
    // ========================================================================

    @Command(name = "run", description = "De-identify every record under an input directory",
            exitCodeOnInvalidInput = EXIT_FAILED,
            exitCodeOnExecutionException = EXIT_FAILED)
    static class RunCommand implements Callable<Integer> {

        @ParentCommand
        private DicomDeidentifier parent;

        @Option(names = {"-d", "--input"}, description = "Input directory")
        private String inputDirectory;

        @Option(names = {"-o", "--output"}, description = "Output directory")
        private String outputDirectory;

        @Option(names = {"-l", "--link-log"}, description = "Link log directory")
        private String linkLogDirectory;

        @Option(names = {"-s", "--space"}, description = "Output space budget in GB")
        private Double spaceGb;

        @Option(names = {"-g", "--grouping"}, description = "Output grouping: study (s), patient (m) or none (n)")
        private String grouping;

        @Option(names = {"-w", "--workers"}, description = "Worker threads (default: available processors)")
        private Integer workers;

        @Override
        public Integer call() throws Exception {
            AppConfig config = parent.loadConfig();
            applyOverrides(config);

            List<String> errors = config.validate();
            if (!errors.isEmpty()) {
                for (String error : errors) {
                    System.err.println("Configuration error: " + error);
                }
                return EXIT_FAILED;
            }

            printBanner();
            Path inputDir = Paths.get(config.getInputDirectory());
            Path outputDir = Paths.get(config.getOutputDirectory());
            Path linkLogDir = Paths.get(config.getLinkLogDirectory());
            Files.createDirectories(outputDir);

            SqliteLinkLog linkLog;
            try {
                linkLog = SqliteLinkLog.open(linkLogDir, config.getIdPrefix());
            } catch (LinkLogException e) {
                log.error("Cannot open link log: {}", e.getMessage());
                return EXIT_FAILED;
            }

            RunSummary summary;
            try {
                RecordSource recordSource = new JsonRecordSource();
                SpaceGuard spaceGuard = SpaceGuard.forOutputDirectory(outputDir,
                        config.getSpaceBudgetBytes(), config.getMinFreeBytes());
                Dispatcher dispatcher = new Dispatcher(
                        recordSource,
                        linkLog,
                        new IdentityResolver(linkLog),
                        new FieldTransformer(),
                        new OutputNamer(outputDir, config.getGroupingMode(), recordSource.getFileExtension()),
                        spaceGuard,
                        config.getEffectiveWorkerCount());
                dispatcher.setProgressInterval(config.getProgressInterval());

                summary = dispatcher.run(inputDir);
            } catch (IOException e) {
                log.error("Batch failed: {}", e.getMessage());
                linkLog.close();
                return EXIT_FAILED;
            }

            if (summary.getState() == RunState.FAILED_FATAL) {
                linkLog.abandon();
            } else {
                try {
                    linkLog.close();
                } catch (LinkLogException e) {
                    log.error("Failed to flush link log: {}", e.getMessage(), e);
                    summary.setState(RunState.FAILED_FATAL);
                    summary.setHaltReason(e.getMessage());
                }
            }

            try {
                summary.writeTo(linkLogDir.resolve(LAST_RUN_FILE));
            } catch (IOException e) {
                log.warn("Could not write run summary: {}", e.getMessage());
            }

            System.out.println();
            System.out.println("=========================================================");
            System.out.println("  De-identification Summary");
            System.out.println("=========================================================");
            System.out.print(summary.format());
            if (summary.getState() == RunState.HALTED_ON_SPACE) {
                System.out.println();
                System.out.println("Run again with more space to process the remaining files.");
            }
            System.out.println("=========================================================");

            return exitCodeFor(summary.getState());
        }

        private void applyOverrides(AppConfig config) {
            if (inputDirectory != null) config.setInputDirectory(inputDirectory);
            if (outputDirectory != null) config.setOutputDirectory(outputDirectory);
            if (linkLogDirectory != null) config.setLinkLogDirectory(linkLogDirectory);
            if (spaceGb != null) config.setSpaceGb(spaceGb);
            if (grouping != null) config.setGrouping(grouping);
            if (workers != null) config.setWorkerCount(workers);
        }

        private void printBanner() {
            System.out.println();
            System.out.println("╔═══════════════════════════════════════════════════════╗");
            System.out.println("║                                                       ║");
            System.out.println("║             DICOM De-identifier v1.0.0                ║");
            System.out.println("║         Copyright © 2025 XNATWorks.                  ║");
            System.out.println("║                                                       ║");
            System.out.println("╚═══════════════════════════════════════════════════════╝");
            System.out.println();
        }
    }

    // ========================================================================
    // VERIFY COMMAND - Check a link log
    // ========================================================================

    @Command(name = "verify", description = "Open a link log, run its consistency checks and show statistics",
            exitCodeOnInvalidInput = EXIT_FAILED,
            exitCodeOnExecutionException = EXIT_FAILED)
    static class VerifyCommand implements Callable<Integer> {

        @ParentCommand
        private DicomDeidentifier parent;

        @Option(names = {"-l", "--link-log"}, description = "Link log directory")
        private String linkLogDirectory;

        @Override
        public Integer call() throws Exception {
            String directory = linkLogDirectory != null
                    ? linkLogDirectory
                    : parent.loadConfig().getLinkLogDirectory();
            Path linkLogDir = Paths.get(directory);
            if (!Files.isDirectory(linkLogDir)) {
                System.err.println("Link log directory does not exist: " + linkLogDir.toAbsolutePath());
                return EXIT_FAILED;
            }

            if (!Files.isRegularFile(linkLogDir.resolve(SqliteLinkLog.DB_FILE))) {
                System.err.println("No link log store in " + linkLogDir.toAbsolutePath());
                return EXIT_FAILED;
            }

            // Read-only check: the audit file is not rewritten on the way out
            SqliteLinkLog linkLog;
            try {
                linkLog = SqliteLinkLog.open(linkLogDir);
            } catch (LinkLogException e) {
                System.err.println("Link log is not usable: " + e.getMessage());
                return EXIT_FAILED;
            }
            LinkLogStats stats;
            try {
                stats = linkLog.stats();
            } finally {
                linkLog.abandon();
            }

            System.out.println();
            System.out.println("=========================================================");
            System.out.println("  Link Log " + linkLogDir.toAbsolutePath());
            System.out.println("=========================================================");
            System.out.printf("  %-20s %d%n", "Patients:", stats.getPatientCount());
            System.out.printf("  %-20s %d%n", "Studies:", stats.getStudyCount());
            System.out.printf("  %-20s %d%n", "Admitted series:", stats.getAdmittedSeriesCount());
            System.out.println("  Status:              OK");
            System.out.println("=========================================================");
            return EXIT_COMPLETED;
        }
    }
}
