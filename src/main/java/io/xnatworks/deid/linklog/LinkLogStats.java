/*
 * DICOM De-identifier
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.deid.linklog;

/**
 * Row counts of a link log.
 */
public final class LinkLogStats {
    private final int patientCount;
    private final int studyCount;
    private final int admittedSeriesCount;

    public LinkLogStats(int patientCount, int studyCount, int admittedSeriesCount) {
        this.patientCount = patientCount;
        this.studyCount = studyCount;
        this.admittedSeriesCount = admittedSeriesCount;
    }

    public int getPatientCount() { return patientCount; }

    public int getStudyCount() { return studyCount; }

    public int getAdmittedSeriesCount() { return admittedSeriesCount; }

    @Override
    public String toString() {
        return String.format("%d patients, %d studies, %d admitted series",
                patientCount, studyCount, admittedSeriesCount);
    }
}
