/*
 * DICOM De-identifier
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.deid.dicom;

import java.nio.file.Path;

/**
 * A problem with one input record. The record is skipped and the batch continues.
 */
public class SkippableRecordException extends Exception {
    private final Path path;

    public SkippableRecordException(Path path, String message) {
        super(message);
        this.path = path;
    }

    public SkippableRecordException(Path path, String message, Throwable cause) {
        super(message, cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
