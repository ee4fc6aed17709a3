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
 * Mapping of a real patient identifier to its synthetic replacement.
 * Created on first encounter and never changed afterwards.
 */
public final class PatientIdentity {
    private final String realIdentifier;
    private final String syntheticIdentifier;

    public PatientIdentity(String realIdentifier, String syntheticIdentifier) {
        this.realIdentifier = Objects.requireNonNull(realIdentifier, "realIdentifier");
        this.syntheticIdentifier = Objects.requireNonNull(syntheticIdentifier, "syntheticIdentifier");
    }

    public String getRealIdentifier() { return realIdentifier; }

    public String getSyntheticIdentifier() { return syntheticIdentifier; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PatientIdentity)) return false;
        PatientIdentity that = (PatientIdentity) o;
        return realIdentifier.equals(that.realIdentifier) && syntheticIdentifier.equals(that.syntheticIdentifier);
    }

    @Override
    public int hashCode() {
        return Objects.hash(realIdentifier, syntheticIdentifier);
    }

    @Override
    public String toString() {
        return "PatientIdentity{" + syntheticIdentifier + "}";
    }
}
