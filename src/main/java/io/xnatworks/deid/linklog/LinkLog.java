/*
 * DICOM De-identifier
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.deid.linklog;

import java.util.Optional;

/**
 * Durable keyed store mapping real patient identifiers to synthetic ones.
 *
 * <p>Lookups may run concurrently. Allocation of a new synthetic identifier or
 * accession number is serialized by the implementation so that no counter value
 * is handed out twice and no real identifier gets two entries. Once persisted a
 * value is never reassigned.</p>
 *
 * <p>Lifecycle: obtained already open (load-or-create), {@link #flush()} at any
 * point, {@link #close()} exactly once at shutdown.</p>
 */
public interface LinkLog extends AutoCloseable {

    /**
     * Look up the identity for a real identifier without allocating.
     */
    Optional<PatientIdentity> lookup(String realIdentifier);

    /**
     * Look up a study link without allocating.
     */
    Optional<StudyLink> lookupStudy(String realIdentifier, String studyKey);

    /**
     * Return the existing identity or allocate the next synthetic identifier.
     */
    PatientIdentity insertIfAbsent(String realIdentifier);

    /**
     * Return the existing study link or allocate the next accession number for
     * the identity, allocating the identity itself first when needed.
     */
    StudyLink insertStudyIfAbsent(String realIdentifier, String studyKey);

    /**
     * Resolve a (real identifier, study) pair. Idempotent after the first
     * successful call.
     */
    default StudyLink resolve(String realIdentifier, String studyKey) {
        Optional<StudyLink> existing = lookupStudy(realIdentifier, studyKey);
        if (existing.isPresent()) {
            return existing.get();
        }
        return insertStudyIfAbsent(realIdentifier, studyKey);
    }

    /**
     * Record that a series of the given study has been written. The first call for
     * a (study, series) pair appends one audit entry; later calls do nothing.
     *
     * @return true if an audit entry was appended
     */
    boolean recordAdmission(String studyId, String seriesKey);

    /**
     * Per-log random salt used to derive replacement UIDs that stay stable across runs.
     */
    String getUidSalt();

    LinkLogStats stats();

    /**
     * Make the audit file reflect the store exactly.
     */
    void flush();

    @Override
    void close();
}
