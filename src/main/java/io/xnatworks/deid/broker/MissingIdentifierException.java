/*
 * DICOM De-identifier
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.deid.broker;

import io.xnatworks.deid.dicom.SkippableRecordException;

import java.nio.file.Path;

/**
 * The record carries no usable patient identifier.
 */
public class MissingIdentifierException extends SkippableRecordException {

    public MissingIdentifierException(Path path, String message) {
        super(path, message);
    }
}
