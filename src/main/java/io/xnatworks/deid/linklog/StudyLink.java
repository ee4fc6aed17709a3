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
 * Resolved identity of one study: the patient's synthetic identifier plus the
 * accession number allocated for the study within that identity.
 *
 * <p>The synthetic study id is {@code <syntheticIdentifier>-<accessionNumber>}.</p>
 */
public final class StudyLink {
    private final String realIdentifier;
    private final String studyKey;
    private final String syntheticIdentifier;
    private final String accessionNumber;
    private final String studyId;

    public StudyLink(String realIdentifier, String studyKey, String syntheticIdentifier, String accessionNumber) {
        this.realIdentifier = Objects.requireNonNull(realIdentifier, "realIdentifier");
        this.studyKey = Objects.requireNonNull(studyKey, "studyKey");
        this.syntheticIdentifier = Objects.requireNonNull(syntheticIdentifier, "syntheticIdentifier");
        this.accessionNumber = Objects.requireNonNull(accessionNumber, "accessionNumber");
        this.studyId = syntheticIdentifier + "-" + accessionNumber;
    }

    public String getRealIdentifier() { return realIdentifier; }

    public String getStudyKey() { return studyKey; }

    public String getSyntheticIdentifier() { return syntheticIdentifier; }

    public String getAccessionNumber() { return accessionNumber; }

    public String getStudyId() { return studyId; }

    /**
     * The audit projection of this study.
     */
    public LinkLogEntry toEntry() {
        return new LinkLogEntry(studyId, accessionNumber);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StudyLink)) return false;
        StudyLink that = (StudyLink) o;
        return realIdentifier.equals(that.realIdentifier)
                && studyKey.equals(that.studyKey)
                && syntheticIdentifier.equals(that.syntheticIdentifier)
                && accessionNumber.equals(that.accessionNumber);
    }

    @Override
    public int hashCode() {
        return Objects.hash(realIdentifier, studyKey, syntheticIdentifier, accessionNumber);
    }

    @Override
    public String toString() {
        return "StudyLink{" + studyId + "}";
    }
}
