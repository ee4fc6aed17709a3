/*
 * DICOM De-identifier
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.deid.dicom;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;

/**
 * Record codec. Decoding and encoding the stored record format lives behind this
 * interface so the de-identification pipeline never touches the binary layout.
 */
public interface RecordSource {

    /**
     * Whether a file found during the input scan should be treated as a record.
     */
    boolean accepts(Path path);

    /**
     * Read the attribute values of a record.
     *
     * @throws UnreadableRecordException if the file cannot be parsed
     */
    RecordTags readTags(Path path) throws UnreadableRecordException;

    /**
     * Write a record. Must never replace an existing file and must never leave a
     * partially written file at {@code target}.
     *
     * @return number of bytes written
     * @throws java.nio.file.FileAlreadyExistsException if {@code target} already exists
     */
    long writeRecord(Path target, Map<String, String> attributes) throws IOException;

    /**
     * Size in bytes {@link #writeRecord} would produce for these attributes.
     */
    long estimateSize(Map<String, String> attributes);

    /**
     * Extension (with leading dot) for output files.
     */
    String getFileExtension();
}
