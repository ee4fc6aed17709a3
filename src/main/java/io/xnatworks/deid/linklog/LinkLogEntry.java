/*
 * DICOM De-identifier
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.deid.linklog;

import java.util.Objects;

/**
 * One line of the audit file: {@code studyID<TAB>accessionNumber}.
 */
public final class LinkLogEntry {
    static final char SEPARATOR = '\t';

    private final String studyId;
    private final String accessionNumber;

    public LinkLogEntry(String studyId, String accessionNumber) {
        this.studyId = Objects.requireNonNull(studyId, "studyId");
        this.accessionNumber = Objects.requireNonNull(accessionNumber, "accessionNumber");
    }

    public String getStudyId() { return studyId; }

    public String getAccessionNumber() { return accessionNumber; }

    /**
     * Render as a single audit line including the trailing newline.
     */
    public String toLine() {
        return studyId + SEPARATOR + accessionNumber + "\n";
    }

    /**
     * Parse a line without its newline.
     *
     * @return the entry, or null if the line does not have exactly two non-empty fields
     */
    static LinkLogEntry parse(String line) {
        int tab = line.indexOf(SEPARATOR);
        if (tab <= 0 || tab == line.length() - 1 || line.indexOf(SEPARATOR, tab + 1) >= 0) {
            return null;
        }
        return new LinkLogEntry(line.substring(0, tab), line.substring(tab + 1));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LinkLogEntry)) return false;
        LinkLogEntry that = (LinkLogEntry) o;
        return studyId.equals(that.studyId) && accessionNumber.equals(that.accessionNumber);
    }

    @Override
    public int hashCode() {
        return Objects.hash(studyId, accessionNumber);
    }

    @Override
    public String toString() {
        return studyId + "\t" + accessionNumber;
    }
}
