/*
 * DICOM De-identifier
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.deid.broker;

import io.xnatworks.deid.linklog.StudyLink;

/**
 * Everything identity-related a de-identified record needs: the persisted study
 * link plus values derived per record (age, replacement UIDs, manufacturer).
 */
public class IdentityBundle {
    private final StudyLink studyLink;
    private final String seriesKey;
    private final String studyInstanceUid;
    private final String seriesInstanceUid;
    private final String sopInstanceUid;
    private final String patientAge;
    private final String manufacturer;

    public IdentityBundle(StudyLink studyLink, String seriesKey, String studyInstanceUid,
                          String seriesInstanceUid, String sopInstanceUid,
                          String patientAge, String manufacturer) {
        this.studyLink = studyLink;
        this.seriesKey = seriesKey;
        this.studyInstanceUid = studyInstanceUid;
        this.seriesInstanceUid = seriesInstanceUid;
        this.sopInstanceUid = sopInstanceUid;
        this.patientAge = patientAge;
        this.manufacturer = manufacturer;
    }

    public StudyLink getStudyLink() { return studyLink; }

    public String getSyntheticIdentifier() { return studyLink.getSyntheticIdentifier(); }

    public String getAccessionNumber() { return studyLink.getAccessionNumber(); }

    public String getStudyId() { return studyLink.getStudyId(); }

    public String getSeriesKey() { return seriesKey; }

    public String getStudyInstanceUid() { return studyInstanceUid; }

    public String getSeriesInstanceUid() { return seriesInstanceUid; }

    public String getSopInstanceUid() { return sopInstanceUid; }

    public String getPatientAge() { return patientAge; }

    public String getManufacturer() { return manufacturer; }
}
