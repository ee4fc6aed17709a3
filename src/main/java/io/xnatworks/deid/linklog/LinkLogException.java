/*
 * DICOM De-identifier
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.deid.linklog;

/**
 * Failure of the link log itself. Always fatal for the batch: once the mapping
 * store cannot be trusted no further records may be written.
 */
public class LinkLogException extends RuntimeException {

    public LinkLogException(String message) {
        super(message);
    }

    public LinkLogException(String message, Throwable cause) {
        super(message, cause);
    }
}
