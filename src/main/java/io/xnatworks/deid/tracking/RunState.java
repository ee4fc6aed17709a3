/*
 * DICOM De-identifier
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.deid.tracking;

/**
 * Terminal state of a batch run.
 */
public enum RunState {
    /** Every file was processed or skipped. */
    COMPLETED,
    /** The space budget stopped admission; remaining files can be processed by a later run. */
    HALTED_ON_SPACE,
    /** The link log is corrupt or inconsistent; needs operator intervention. */
    FAILED_FATAL
}
