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
 * The record codec could not parse a file.
 */
public class UnreadableRecordException extends SkippableRecordException {

    public UnreadableRecordException(Path path, String message) {
        super(path, message);
    }

    public UnreadableRecordException(Path path, String message, Throwable cause) {
        super(path, message, cause);
    }
}
