/*
 * DICOM De-identifier
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.deid.linklog;

/**
 * The same key was found mapped to two different values, either inside the audit
 * file or between the audit file and the keyed store. Requires operator
 * intervention before the next run.
 */
public class InconsistentStateException extends LinkLogException {

    public InconsistentStateException(String message) {
        super(message);
    }
}
