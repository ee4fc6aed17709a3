/*
 * DICOM De-identifier
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.deid.dicom;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Recursive enumeration of candidate record files under an input directory.
 * The result is sorted so every run sees the same order.
 */
public class InputScanner {
    private static final Logger log = LoggerFactory.getLogger(InputScanner.class);

    private final RecordSource recordSource;

    public InputScanner(RecordSource recordSource) {
        this.recordSource = recordSource;
    }

    public List<Path> scan(Path inputDir) throws IOException {
        if (!Files.isDirectory(inputDir)) {
            throw new IOException("Input directory does not exist: " + inputDir.toAbsolutePath());
        }

        log.info("Scanning for records in {}", inputDir.toAbsolutePath());
        List<Path> files;
        try (Stream<Path> walk = Files.walk(inputDir)) {
            files = walk.filter(Files::isRegularFile)
                    .filter(recordSource::accepts)
                    .sorted()
                    .collect(Collectors.toList());
        }
        log.info("Found {} candidate records", files.size());
        return files;
    }
}
