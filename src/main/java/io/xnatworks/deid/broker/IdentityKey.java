/*
 * DICOM De-identifier
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.deid.broker;

import java.util.Comparator;
import java.util.Objects;

/**
 * Normalized real identifier plus study-scoping key of one record. Ordered so
 * that allocation can happen in a fixed order regardless of which worker saw a
 * record first.
 */
public final class IdentityKey implements Comparable<IdentityKey> {
    private static final Comparator<IdentityKey> ORDER = Comparator
            .comparing(IdentityKey::getRealIdentifier)
            .thenComparing(IdentityKey::getStudyKey);

    private final String realIdentifier;
    private final String studyKey;

    public IdentityKey(String realIdentifier, String studyKey) {
        this.realIdentifier = Objects.requireNonNull(realIdentifier, "realIdentifier");
        this.studyKey = Objects.requireNonNull(studyKey, "studyKey");
    }

    public String getRealIdentifier() { return realIdentifier; }

    public String getStudyKey() { return studyKey; }

    @Override
    public int compareTo(IdentityKey other) {
        return ORDER.compare(this, other);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IdentityKey)) return false;
        IdentityKey that = (IdentityKey) o;
        return realIdentifier.equals(that.realIdentifier) && studyKey.equals(that.studyKey);
    }

    @Override
    public int hashCode() {
        return Objects.hash(realIdentifier, studyKey);
    }
}
